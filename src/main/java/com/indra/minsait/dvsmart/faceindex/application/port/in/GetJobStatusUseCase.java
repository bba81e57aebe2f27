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
package com.indra.minsait.dvsmart.faceindex.application.port.in;

import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-01-2026 at 09:14:02
 * File: GetJobStatusUseCase.java
 */

public interface GetJobStatusUseCase {

    /**
     * Estado actual del job del propietario; IDLE si no hay ninguno.
     */
    JobSnapshot status(String owner);
}
