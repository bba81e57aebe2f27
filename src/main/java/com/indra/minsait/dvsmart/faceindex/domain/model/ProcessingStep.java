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
package com.indra.minsait.dvsmart.faceindex.domain.model;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-01-2026 at 11:02:14
 * File: ProcessingStep.java
 */

/**
 * Pasos por los que pasa cada foto, en este orden.
 */
public enum ProcessingStep {

    DOWNLOAD("download"),
    DETECT("detect"),
    EMBED("embed"),
    STORE("store");

    private final String key;

    ProcessingStep(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
