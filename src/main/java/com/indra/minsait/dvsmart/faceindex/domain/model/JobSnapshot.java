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
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-01-2026 at 11:26:10
 * File: JobSnapshot.java
 */

/**
 * Copia consistente del estado de un job, tomada bajo el lock del job.
 * Es lo que consumen el endpoint de estado y el stream SSE.
 */
public record JobSnapshot(
    String jobId,
    String owner,
    String scope,
    JobState state,
    boolean forceReprocess,
    ProcessingStep currentStep,
    Map<ProcessingStep, StepProgress> steps,
    int totalItems,
    int processedCount,
    int skippedCount,
    int failedCount,
    int facesStored,
    double overallPercent,
    Instant startedAt,
    Instant finishedAt,
    long elapsedMs,
    Long estimatedRemainingMs,
    List<JobIssue> warnings,
    List<JobIssue> errors,
    String failureReason
) {

    /**
     * Estado para un propietario sin ningún job registrado.
     */
    public static JobSnapshot idle(String owner) {
        Map<ProcessingStep, StepProgress> steps = new EnumMap<>(ProcessingStep.class);
        for (ProcessingStep step : ProcessingStep.values()) {
            steps.put(step, StepProgress.of(0, 0));
        }
        return new JobSnapshot(null, owner, null, JobState.IDLE, false, null,
                Collections.unmodifiableMap(steps), 0, 0, 0, 0, 0, 0.0,
                null, null, 0L, null, List.of(), List.of(), null);
    }
}
