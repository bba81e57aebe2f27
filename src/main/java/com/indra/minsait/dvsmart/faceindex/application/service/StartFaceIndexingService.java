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

import com.indra.minsait.dvsmart.faceindex.application.port.in.StartFaceIndexingUseCase;
import com.indra.minsait.dvsmart.faceindex.domain.exception.JobAlreadyRunningException;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingJob;
import com.indra.minsait.dvsmart.faceindex.domain.service.ProcessingJobRegistry;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-01-2026 at 12:54:15
 * File: StartFaceIndexingService.java
 */

/**
 * Arranque asíncrono de jobs de indexación facial.
 *
 * Un único job en ejecución por propietario: se rechaza el arranque si ya hay
 * uno RUNNING en esta instancia (registro) o en otra (lock ShedLock
 * {@code face-indexing-<owner>}).
 */
@Slf4j
@Service
public class StartFaceIndexingService implements StartFaceIndexingUseCase {

    static final String LOCK_PREFIX = "face-indexing-";

    private final ProcessingJobRegistry registry;
    private final FaceIndexingOrchestrator orchestrator;
    private final LockProvider lockProvider;
    private final TaskExecutor launcherExecutor;
    private final FaceIndexProperties props;
    private final Clock clock;

    public StartFaceIndexingService(
            ProcessingJobRegistry registry,
            FaceIndexingOrchestrator orchestrator,
            LockProvider lockProvider,
            @Qualifier("faceJobLauncherExecutor") TaskExecutor launcherExecutor,
            FaceIndexProperties props,
            Clock clock) {
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.lockProvider = lockProvider;
        this.launcherExecutor = launcherExecutor;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public JobSnapshot start(String owner, String scope, boolean forceReprocess) {
        validatePrerequisites(owner, scope);

        log.info("Starting FACE INDEXING JOB: owner={}, scope={}, force={}", owner, scope, forceReprocess);

        FaceIndexProperties.Processing processing = props.getProcessing();
        ProcessingJob job = new ProcessingJob(owner, scope, forceReprocess, clock,
                processing.getEtaWindow(), processing.getConcurrency());

        registry.register(job);

        Optional<SimpleLock> lock = lockProvider.lock(new LockConfiguration(
                clock.instant(), LOCK_PREFIX + owner, processing.getLockAtMostFor(), Duration.ZERO));
        if (lock.isEmpty()) {
            registry.unregister(job);
            log.warn("⚠️ Owner {} already has a job running on another instance", owner);
            throw new JobAlreadyRunningException(owner);
        }

        try {
            launcherExecutor.execute(() -> runAndRelease(job, lock.get()));
        } catch (TaskRejectedException e) {
            lock.get().unlock();
            job.fail("Job launcher rejected the job");
            log.error("Failed to start job", e);
            throw new RuntimeException("Failed to start job: " + e.getMessage(), e);
        }

        log.info("Job launched: jobId={}, owner={}", job.getJobId(), owner);
        return job.snapshot();
    }

    private void runAndRelease(ProcessingJob job, SimpleLock lock) {
        try {
            orchestrator.run(job);
        } catch (RuntimeException e) {
            log.error("❌ Face indexing job {} crashed", job.getJobId(), e);
            job.fail(e.getMessage());
        } finally {
            lock.unlock();
            log.debug("Owner lock released for {}", job.getOwner());
        }
    }

    private void validatePrerequisites(String owner, String scope) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Owner is required");
        }
        if (scope == null || scope.isBlank()) {
            throw new IllegalArgumentException("Scope is required");
        }
    }
}
