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
 * Created on: 13-01-2026 at 09:12:30
 * File: JobAlreadyRunningException.java
 */

/**
 * Ya existe un job en ejecución para el propietario (en esta instancia o en otra).
 */
public class JobAlreadyRunningException extends RuntimeException {

    private final String owner;

    public JobAlreadyRunningException(String owner) {
        super("A face indexing job is already running for owner " + owner);
        this.owner = owner;
    }

    public String getOwner() {
        return owner;
    }
}
