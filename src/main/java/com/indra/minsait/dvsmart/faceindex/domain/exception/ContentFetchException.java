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
package com.indra.minsait.dvsmart.faceindex.domain.exception;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 13-01-2026 at 09:15:02
 * File: ContentFetchException.java
 */

/**
 * Fallo definitivo al descargar un fichero a la caché (tras agotar reintentos).
 * No se registra ninguna entrada en la caché.
 */
public class ContentFetchException extends RuntimeException {

    public ContentFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
