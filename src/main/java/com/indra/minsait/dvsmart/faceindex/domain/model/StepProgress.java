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
 * Created on: 12-01-2026 at 11:18:47
 * File: StepProgress.java
 */

public record StepProgress(
    int total,
    int completed,
    double percent
) {
    public static StepProgress of(int total, int completed) {
        double percent = total == 0 ? 0.0 : Math.min(100.0, completed * 100.0 / total);
        return new StepProgress(total, completed, percent);
    }
}
