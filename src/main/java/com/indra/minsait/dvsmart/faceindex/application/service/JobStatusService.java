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
package com.indra.minsait.dvsmart.faceindex.application.service;

import com.indra.minsait.dvsmart.faceindex.application.port.in.CancelJobUseCase;
import com.indra.minsait.dvsmart.faceindex.application.port.in.GetJobStatusUseCase;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingJob;
import com.indra.minsait.dvsmart.faceindex.domain.service.ProcessingJobRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-01-2026 at 15:40:27
 * File: JobStatusService.java
 */

@Slf4j
@Service
@RequiredArgsConstructor
public class JobStatusService implements GetJobStatusUseCase, CancelJobUseCase {

    private final ProcessingJobRegistry registry;

    @Override
    public JobSnapshot status(String owner) {
        return registry.find(owner)
                .map(ProcessingJob::snapshot)
                .orElseGet(() -> JobSnapshot.idle(owner));
    }

    @Override
    public Optional<JobSnapshot> cancel(String owner) {
        return registry.find(owner).map(job -> {
            if (job.requestCancel()) {
                log.info("Cancellation requested for job {} (owner {})", job.getJobId(), owner);
            } else {
                log.debug("Job {} already finished, nothing to cancel", job.getJobId());
            }
            return job.snapshot();
        });
    }

    @Override
    public boolean reset(String owner) {
        boolean removed = registry.reset(owner);
        if (removed) {
            log.info("Finished job state reset for owner {}", owner);
        }
        return removed;
    }
}
