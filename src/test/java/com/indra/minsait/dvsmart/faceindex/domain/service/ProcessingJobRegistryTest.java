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
package com.indra.minsait.dvsmart.faceindex.domain.service;

import com.indra.minsait.dvsmart.faceindex.domain.exception.JobAlreadyRunningException;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingJob;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingJobRegistryTest {

    private final ProcessingJobRegistry registry = new ProcessingJobRegistry();

    private ProcessingJob job(String owner) {
        return new ProcessingJob(owner, "album", false, Clock.systemUTC(), 20, 1);
    }

    @Test
    void rejectsSecondJobWhileFirstIsRunning() {
        ProcessingJob first = registry.register(job("alice"));

        JobAlreadyRunningException ex = assertThrows(JobAlreadyRunningException.class,
                () -> registry.register(job("alice")));
        assertEquals("alice", ex.getOwner());
        assertSame(first, registry.find("alice").orElseThrow());
    }

    @Test
    void finishedJobIsSuperseded() {
        ProcessingJob first = registry.register(job("alice"));
        first.complete();

        ProcessingJob second = registry.register(job("alice"));
        assertSame(second, registry.find("alice").orElseThrow());
    }

    @Test
    void ownersAreIndependent() {
        registry.register(job("alice"));
        assertDoesNotThrow(() -> registry.register(job("bob")));
    }

    @Test
    void resetRemovesOnlyFinishedJobs() {
        ProcessingJob running = registry.register(job("alice"));
        assertThrows(JobAlreadyRunningException.class, () -> registry.reset("alice"));

        running.fail("boom");
        assertTrue(registry.reset("alice"));
        assertTrue(registry.find("alice").isEmpty());
        assertFalse(registry.reset("alice"));
    }

    @Test
    void unregisterIgnoresNewerJob() {
        ProcessingJob stale = job("alice");
        ProcessingJob current = registry.register(job("alice"));

        registry.unregister(stale);
        assertSame(current, registry.find("alice").orElseThrow());

        registry.unregister(current);
        assertTrue(registry.find("alice").isEmpty());
    }
}
