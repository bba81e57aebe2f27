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
package com.indra.minsait.dvsmart.faceindex.adapter.in.rest;

import com.indra.minsait.dvsmart.faceindex.application.service.EmbeddingReconciliationService;
import com.indra.minsait.dvsmart.faceindex.domain.model.ReconciliationReport;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import com.indra.minsait.dvsmart.faceindex.infrastructure.sftp.PooledSourceSessionFactory.PoolStats;
import com.indra.minsait.dvsmart.faceindex.infrastructure.sftp.SftpPoolMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 18-12-2025 at 16:29:47
 * File: MonitoringController.java
 */

/**
 * Estado del origen de fotos y mantenimiento del nivel remoto.
 * 
 * Endpoints disponibles:
 * - GET  /api/monitoring/source-pool  - Estadísticas del pool SFTP
 * - GET  /api/monitoring/health       - Estado general
 * - POST /api/monitoring/reconcile    - Sube al nivel remoto los sets pendientes
 */
@Slf4j
@RestController
@RequestMapping("/api/monitoring")
public class MonitoringController {

    private final ObjectProvider<SftpPoolMonitor> poolMonitor;
    private final EmbeddingReconciliationService reconciliationService;
    private final FaceIndexProperties props;

    public MonitoringController(ObjectProvider<SftpPoolMonitor> poolMonitor,
                                EmbeddingReconciliationService reconciliationService,
                                FaceIndexProperties props) {
        this.poolMonitor = poolMonitor;
        this.reconciliationService = reconciliationService;
        this.props = props;
    }

    /**
     * GET /api/monitoring/source-pool
     * 
     * 404 cuando el origen es una carpeta local (sin pool).
     */
    @GetMapping("/source-pool")
    public ResponseEntity<Map<String, Object>> getSourcePoolStats() {
        SftpPoolMonitor monitor = poolMonitor.getIfAvailable();
        if (monitor == null) {
            return ResponseEntity.notFound().build();
        }

        PoolStats stats = monitor.getStats();
        monitor.logStats();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active", stats.active());
        body.put("idle", stats.idle());
        body.put("maxTotal", stats.maxTotal());
        body.put("totalCreated", stats.created());
        body.put("totalDestroyed", stats.destroyed());
        body.put("totalBorrows", stats.borrows());
        body.put("totalFailures", stats.failures());
        body.put("utilizationPercent", stats.utilizationPercent());
        body.put("availableSlots", stats.maxTotal() - stats.active());
        body.put("status", monitor.getHealthStatus());
        return ResponseEntity.ok(body);
    }

    /**
     * GET /api/monitoring/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> getSystemHealth() {
        SftpPoolMonitor monitor = poolMonitor.getIfAvailable();

        Map<String, Object> source = new LinkedHashMap<>();
        source.put("type", props.getSource().getType());
        boolean healthy = true;
        if (monitor != null) {
            PoolStats stats = monitor.getStats();
            healthy = monitor.isHealthy();
            source.put("status", monitor.getHealthStatus());
            source.put("active", stats.active());
            source.put("available", stats.maxTotal() - stats.active());
        } else {
            source.put("status", "LOCAL");
        }

        return ResponseEntity.ok(Map.of(
            "status", healthy ? "UP" : "DEGRADED",
            "components", Map.of("source", source)
        ));
    }

    /**
     * POST /api/monitoring/reconcile
     */
    @PostMapping("/reconcile")
    public ResponseEntity<ReconciliationReport> reconcile() {
        log.info("Manual reconciliation triggered");
        return ResponseEntity.ok(reconciliationService.reconcileNow());
    }
}
