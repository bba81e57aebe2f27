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

import com.indra.minsait.dvsmart.faceindex.infrastructure.config.SftpConfigProperties;
import org.apache.sshd.sftp.client.SftpClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.integration.file.remote.session.SessionFactory;

import static org.junit.jupiter.api.Assertions.*;

class SftpPoolMonitorTest {

    private PooledSourceSessionFactory factory;

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.destroy();
        }
    }

    private SftpPoolMonitor monitorOver(SessionFactory<SftpClient.DirEntry> target) {
        SftpConfigProperties.Pool pool = new SftpConfigProperties.Pool();
        pool.setMaxSize(4);
        pool.setMaxWaitMillis(100);
        factory = new PooledSourceSessionFactory(target, "/photos", pool);
        return new SftpPoolMonitor(factory);
    }

    @Test
    void idlePoolIsHealthy() {
        SftpPoolMonitor monitor = monitorOver(() -> {
            throw new IllegalStateException("not used");
        });

        PooledSourceSessionFactory.PoolStats stats = monitor.getStats();
        assertEquals(0, stats.active());
        assertEquals(4, stats.maxTotal());
        assertEquals(0.0, stats.utilizationPercent(), 0.001);
        assertEquals("HEALTHY", monitor.getHealthStatus());
        assertTrue(monitor.isHealthy());
    }

    @Test
    void failedBorrowsDegradeThePool() {
        SftpPoolMonitor monitor = monitorOver(() -> {
            throw new IllegalStateException("Connection refused");
        });

        assertThrows(IllegalStateException.class, () -> factory.getSession());

        assertEquals(1, monitor.getStats().failures());
        assertEquals(0, monitor.getStats().borrows());
        assertEquals("DEGRADED", monitor.getHealthStatus());
        assertFalse(monitor.isHealthy());
    }
}
