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

import com.indra.minsait.dvsmart.faceindex.domain.model.ReconciliationReport;
import com.indra.minsait.dvsmart.faceindex.domain.service.EmbeddingStoreService;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 16:52:08
 * File: EmbeddingReconciliationService.java
 */

/**
 * Sube al nivel remoto los conjuntos que quedaron solo en local tras un fallo
 * de escritura remota. Una sola instancia ejecuta la pasada programada.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingReconciliationService {

    private final EmbeddingStoreService embeddingStore;
    private final FaceIndexProperties props;

    @Scheduled(
        fixedDelayString = "${faceindex.reconciliation.interval-ms:300000}",
        initialDelayString = "${faceindex.reconciliation.interval-ms:300000}")
    @SchedulerLock(name = "face-embeddings-reconciliation", lockAtMostFor = "PT10M")
    public void scheduledReconcile() {
        if (!props.getReconciliation().isEnabled()) {
            return;
        }
        reconcileNow();
    }

    /**
     * Pasada completa: lotes hasta vaciar los pendientes o hasta que un lote no avance.
     */
    public ReconciliationReport reconcileNow() {
        int batchSize = props.getReconciliation().getBatchSize();
        int pending = 0;
        int pushed = 0;
        int failed = 0;

        ReconciliationReport batch;
        do {
            batch = embeddingStore.reconcile(batchSize);
            pending += batch.pending();
            pushed += batch.pushed();
            failed += batch.failed();
        } while (batch.pending() == batchSize && batch.failed() == 0);

        if (pending > 0) {
            log.info("📊 Reconciliation pass: pending={}, pushed={}, failed={}", pending, pushed, failed);
        }
        return new ReconciliationReport(pending, pushed, failed);
    }
}
