/*
 * /////////////////////////////////////////////////////////////////////////////
 *
 * Copyright (c) 2026 Indra Sistemas, S.A. All Rights Reserved.
 * http://www.indracompany.com/
 *
 * The contents of this file are owned by Indra Sistemas, S.A. copyright holder.
 * This file can only be copied, distributed and used all or in part with the
 * written permission of Indra Sistemas, S.A, or in accordance with the terms and
 * conditions laid down in the agreement / contract under which supplied.
 *
 * /////////////////////////////////////////////////////////////////////////////
 */
package com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.jdbc;

import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreUnavailableException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import java.util.function.Supplier;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 20-01-2026 at 09:14:27
 * File: LocalStoreErrors.java
 */

/**
 * Traduce las excepciones de Spring JDBC a las del dominio. Sin conexión se
 * considera caída del almacén local; el resto, fallo de la operación.
 */
final class LocalStoreErrors {

    private LocalStoreErrors() {
    }

    static <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new LocalStoreUnavailableException("Local store unavailable during " + operation + ": " + e.getMessage(), e);
        } catch (DataAccessException | TransactionException e) {
            throw new LocalStoreException("Local store " + operation + " failed: " + e.getMessage(), e);
        }
    }

    static void run(String operation, Runnable action) {
        translate(operation, () -> {
            action.run();
            return null;
        });
    }
}
