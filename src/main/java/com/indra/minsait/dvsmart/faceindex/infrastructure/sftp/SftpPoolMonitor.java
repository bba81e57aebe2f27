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
package com.indra.minsait.dvsmart.faceindex.infrastructure.sftp;

import com.indra.minsait.dvsmart.faceindex.infrastructure.sftp.PooledSourceSessionFactory.PoolStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 10:40:12
 * File: SftpPoolMonitor.java
 */

/**
 * Vigilancia del pool SFTP del origen de fotos.
 */
@Slf4j
public class SftpPoolMonitor {

    private final PooledSourceSessionFactory factory;

    public SftpPoolMonitor(PooledSourceSessionFactory factory) {
        this.factory = factory;
    }

    public PoolStats getStats() {
        return factory.getStats();
    }

    /**
     * HEALTHY, WARNING (>80% ocupado), CRITICAL (>95%) o DEGRADED (>10% de préstamos fallidos).
     */
    public String getHealthStatus() {
        PoolStats stats = getStats();
        double utilization = stats.utilizationPercent();
        if (utilization > 95.0) return "CRITICAL";
        if (utilization > 80.0) return "WARNING";
        if (stats.failures() > (stats.borrows() + stats.failures()) * 0.1) return "DEGRADED";
        return "HEALTHY";
    }

    public boolean isHealthy() {
        String status = getHealthStatus();
        return "HEALTHY".equals(status) || "WARNING".equals(status);
    }

    public void logStats() {
        PoolStats stats = getStats();
        log.info("════════════════════════════════════════════════════");
        log.info("📊 SFTP SOURCE POOL");
        log.info("   Active:      {}/{}", stats.active(), stats.maxTotal());
        log.info("   Idle:        {}", stats.idle());
        log.info("   Created:     {} (destroyed {})", stats.created(), stats.destroyed());
        log.info("   Borrows:     {} (failed {})", stats.borrows(), stats.failures());
        log.info("   Utilization: {}%", String.format("%.1f", stats.utilizationPercent()));
        log.info("════════════════════════════════════════════════════");
    }

    @Scheduled(fixedRate = 300000)
    public void scheduledLogStats() {
        logStats();
    }

    @Scheduled(fixedRate = 60000)
    public void checkPoolHealth() {
        PoolStats stats = getStats();
        if (stats.active() >= stats.maxTotal() * 0.9) {
            log.warn("⚠️  SFTP source pool near capacity: {}/{} sessions active", stats.active(), stats.maxTotal());
        }
        if (stats.created() > 10 && stats.destroyed() > stats.created() * 0.5) {
            log.warn("⚠️  High SFTP session churn: {} destroyed / {} created", stats.destroyed(), stats.created());
        }
    }
}
