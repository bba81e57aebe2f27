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

import java.time.Instant;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-01-2026 at 11:14:22
 * File: JobIssue.java
 */

/**
 * Aviso o error de un elemento concreto. Lleva la identidad del fichero y de la
 * foto para poder reintentarlo manualmente.
 */
public record JobIssue(
    Severity severity,
    ProcessingStep step,
    String fileId,
    String photoReference,
    String message,
    Instant timestamp
) {
    public enum Severity {
        WARNING,
        ERROR
    }
}
