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
package com.indra.minsait.dvsmart.faceindex.adapter.in.rest.dto;

import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobState;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 09:14:02
 * File: JobAcceptedResponse.java
 */

public record JobAcceptedResponse(
    String jobId,
    String owner,
    String scope,
    JobState state,
    String statusUrl,
    String streamUrl
) {

    public static JobAcceptedResponse from(JobSnapshot snapshot) {
        String base = "/api/face-index/jobs/" + snapshot.owner();
        return new JobAcceptedResponse(snapshot.jobId(), snapshot.owner(), snapshot.scope(),
                snapshot.state(), base, base + "/stream");
    }
}
