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

import com.indra.minsait.dvsmart.faceindex.application.port.out.FolderStatePort;
import com.indra.minsait.dvsmart.faceindex.application.port.out.SourceListingPort;
import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreUnavailableException;
import com.indra.minsait.dvsmart.faceindex.domain.model.ItemOutcome;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingJob;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingStep;
import com.indra.minsait.dvsmart.faceindex.domain.model.SourceFile;
import com.indra.minsait.dvsmart.faceindex.domain.service.SourceFileMetadataService;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-01-2026 at 12:48:03
 * File: FaceIndexingOrchestrator.java
 */

/**
 * Ejecuta un job de indexación facial.
 *
 * Flujo:
 * 1. Listado del origen (siempre fresco) y filtrado de imágenes
 * 2. Si el listado no cambió desde la última ejecución sin fallos, todo se omite
 * 3. Reparto de fotos a los workers, como máximo {@code concurrency} en vuelo
 * 4. Espera de los elementos en curso y cierre del job
 *
 * Sin orden entre fotos; dentro de cada foto los pasos van siempre en orden.
 * La cancelación detiene el reparto y deja terminar lo que está en vuelo.
 */
@Slf4j
@Service
public class FaceIndexingOrchestrator {

    private final SourceListingPort source;
    private final PhotoItemProcessor itemProcessor;
    private final SourceFileMetadataService metadataService;
    private final FolderStatePort folderState;
    private final TaskExecutor workerExecutor;
    private final int concurrency;

    public FaceIndexingOrchestrator(
            SourceListingPort source,
            PhotoItemProcessor itemProcessor,
            SourceFileMetadataService metadataService,
            FolderStatePort folderState,
            @Qualifier("faceIndexingWorkerExecutor") TaskExecutor workerExecutor,
            FaceIndexProperties props) {
        this.source = source;
        this.itemProcessor = itemProcessor;
        this.metadataService = metadataService;
        this.folderState = folderState;
        this.workerExecutor = workerExecutor;
        this.concurrency = Math.max(1, props.getProcessing().getConcurrency());
    }

    /**
     * Ejecuta el job en el hilo actual hasta su estado terminal.
     */
    public void run(ProcessingJob job) {
        log.info("========================================");
        log.info("FACE INDEXING JOB {}", job.getJobId());
        log.info("Owner: {} | Scope: {} | Source: {} | Force: {}",
                job.getOwner(), job.getScope(), source.sourceType(), job.isForceReprocess());
        log.info("========================================");

        List<SourceFile> files;
        try {
            long listStart = System.currentTimeMillis();
            List<SourceFile> listed = source.list(job.getScope());
            files = metadataService.filterProcessable(listed);
            log.info("✅ Listing completed in {} ms: {} files, {} photos to check",
                    System.currentTimeMillis() - listStart, listed.size(), files.size());
        } catch (RuntimeException e) {
            log.error("❌ Source listing failed for scope {}", job.getScope(), e);
            job.fail("Source listing failed: " + e.getMessage());
            logSummary(job);
            return;
        }

        job.begin(files.size());

        String fingerprint = metadataService.fingerprint(files);
        if (!job.isForceReprocess() && isUnchanged(job, fingerprint)) {
            log.info("Folder unchanged since last complete run, {} photos skipped", files.size());
            job.skipAll(files.size());
            job.complete();
            logSummary(job);
            return;
        }

        AtomicReference<LocalStoreUnavailableException> fatal = new AtomicReference<>();
        Semaphore slots = new Semaphore(concurrency);
        int dispatched = 0;

        for (SourceFile file : files) {
            if (job.isCancelRequested() || fatal.get() != null) {
                break;
            }
            try {
                slots.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠️ Dispatcher interrupted, cancelling job {}", job.getJobId());
                job.requestCancel();
                break;
            }
            if (job.isCancelRequested() || fatal.get() != null) {
                slots.release();
                break;
            }

            try {
                workerExecutor.execute(() -> runItem(job, file, slots, fatal));
                dispatched++;
            } catch (TaskRejectedException e) {
                slots.release();
                log.error("❌ Worker pool rejected {}", file.getId());
                job.addError(ProcessingStep.DOWNLOAD, file.getId(), metadataService.photoReference(file),
                        "Worker pool rejected item: " + e.getMessage());
                job.itemFinished(ItemOutcome.FAILED, null, 0, 0);
            }

            if (dispatched > 0 && dispatched % 100 == 0) {
                log.info("📊 Progress: {} of {} photos dispatched", dispatched, files.size());
            }
        }

        if (job.isCancelRequested()) {
            log.info("Cancellation requested, stopped dispatching after {} of {} photos", dispatched, files.size());
        }

        // Esperar a los elementos en vuelo
        slots.acquireUninterruptibly(concurrency);
        slots.release(concurrency);

        LocalStoreUnavailableException failure = fatal.get();
        if (failure != null) {
            log.error("❌ Local embedding store unavailable, job {} aborted", job.getJobId(), failure);
            job.fail("Local embedding store unavailable: " + failure.getMessage());
        } else {
            if (!job.isCancelRequested() && job.getFailedCount() == 0 && !job.hasErrors()) {
                saveFingerprint(job, fingerprint, files.size());
            }
            job.complete();
        }
        logSummary(job);
    }

    private void runItem(ProcessingJob job, SourceFile file, Semaphore slots,
                         AtomicReference<LocalStoreUnavailableException> fatal) {
        try {
            itemProcessor.process(job, file, source);
        } catch (LocalStoreUnavailableException e) {
            fatal.compareAndSet(null, e);
        } catch (RuntimeException e) {
            log.error("❌ Unexpected error processing {}", file.getId(), e);
            job.addError(null, file.getId(), metadataService.photoReference(file), "Unexpected error: " + e.getMessage());
            job.itemFinished(ItemOutcome.FAILED, null, 0, 0);
        } finally {
            slots.release();
        }
    }

    private boolean isUnchanged(ProcessingJob job, String fingerprint) {
        try {
            Optional<String> previous = folderState.findFingerprint(job.getOwner(), job.getScope());
            return previous.isPresent() && previous.get().equals(fingerprint);
        } catch (LocalStoreException e) {
            log.warn("⚠️ Could not read folder state for {}/{}: {}", job.getOwner(), job.getScope(), e.getMessage());
            return false;
        }
    }

    private void saveFingerprint(ProcessingJob job, String fingerprint, int fileCount) {
        try {
            folderState.saveFingerprint(job.getOwner(), job.getScope(), fingerprint, fileCount);
        } catch (LocalStoreException e) {
            log.warn("⚠️ Could not save folder state for {}/{}: {}", job.getOwner(), job.getScope(), e.getMessage());
        }
    }

    private void logSummary(ProcessingJob job) {
        JobSnapshot snapshot = job.snapshot();
        log.info("========================================");
        log.info("FACE INDEXING JOB {} {}", snapshot.jobId(), snapshot.state());
        log.info("Total: {} | Processed: {} | Skipped: {} | Failed: {} | Faces: {}",
                snapshot.totalItems(), snapshot.processedCount(), snapshot.skippedCount(),
                snapshot.failedCount(), snapshot.facesStored());
        log.info("Warnings: {} | Errors: {} | Elapsed: {} ms",
                snapshot.warnings().size(), snapshot.errors().size(), snapshot.elapsedMs());
        if (snapshot.failureReason() != null) {
            log.info("Failure: {}", snapshot.failureReason());
        }
        log.info("========================================");
    }
}
