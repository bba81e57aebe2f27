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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 13-01-2026 at 10:05:19
 * File: ProcessingJobRegistry.java
 */

/**
 * Un job por propietario. Registrar un job nuevo se rechaza mientras el
 * anterior siga en ejecución; si ya terminó, lo sustituye.
 */
@Slf4j
@Component
public class ProcessingJobRegistry {

    private final ConcurrentMap<String, ProcessingJob> jobs = new ConcurrentHashMap<>();

    /**
     * @throws JobAlreadyRunningException si el propietario tiene un job RUNNING
     */
    public ProcessingJob register(ProcessingJob job) {
        jobs.compute(job.getOwner(), (owner, current) -> {
            if (current != null && current.isRunning()) {
                throw new JobAlreadyRunningException(owner);
            }
            if (current != null) {
                log.debug("Superseding finished job {} ({}) for {}", current.getJobId(), current.getState(), owner);
            }
            return job;
        });
        return job;
    }

    public Optional<ProcessingJob> find(String owner) {
        return Optional.ofNullable(jobs.get(owner));
    }

    /**
     * Elimina el job terminado del propietario.
     *
     * @return false si no había job
     * @throws JobAlreadyRunningException si sigue en ejecución
     */
    public boolean reset(String owner) {
        ProcessingJob[] removed = new ProcessingJob[1];
        jobs.computeIfPresent(owner, (key, current) -> {
            if (current.isRunning()) {
                throw new JobAlreadyRunningException(key);
            }
            removed[0] = current;
            return null;
        });
        return removed[0] != null;
    }

    /**
     * Quita el job solo si sigue siendo el registrado (rollback de un arranque fallido).
     */
    public void unregister(ProcessingJob job) {
        jobs.remove(job.getOwner(), job);
    }
}
