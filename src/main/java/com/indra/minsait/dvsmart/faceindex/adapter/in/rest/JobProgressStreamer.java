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

import com.indra.minsait.dvsmart.faceindex.application.port.in.GetJobStatusUseCase;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobState;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import java.io.IOException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 11:02:44
 * File: JobProgressStreamer.java
 */

/**
 * Emite el snapshot del job de un propietario por SSE a intervalo fijo.
 * 
 * Eventos:
 * - progress: snapshot actual
 * - complete: snapshot final cuando el job termina (o si no hay job)
 */
@Slf4j
@Component
public class JobProgressStreamer {

    static final String PROGRESS_EVENT = "progress";
    static final String COMPLETE_EVENT = "complete";

    private final GetJobStatusUseCase statusUseCase;
    private final TaskScheduler scheduler;
    private final FaceIndexProperties props;

    public JobProgressStreamer(GetJobStatusUseCase statusUseCase,
                               @Qualifier("taskScheduler") TaskScheduler scheduler,
                               FaceIndexProperties props) {
        this.statusUseCase = statusUseCase;
        this.scheduler = scheduler;
        this.props = props;
    }

    public SseEmitter open(String owner) {
        SseEmitter emitter = new SseEmitter(props.getStream().getTimeout().toMillis());
        AtomicBoolean finished = new AtomicBoolean(false);
        AtomicReference<ScheduledFuture<?>> task = new AtomicReference<>();

        Runnable stop = () -> {
            finished.set(true);
            ScheduledFuture<?> future = task.get();
            if (future != null) {
                future.cancel(false);
            }
        };
        emitter.onCompletion(stop);
        emitter.onTimeout(() -> {
            stop.run();
            emitter.complete();
        });
        emitter.onError(e -> stop.run());

        task.set(scheduler.scheduleAtFixedRate(() -> {
            if (finished.get()) {
                stop.run();
                return;
            }
            push(owner, emitter, stop);
        }, props.getStream().getInterval()));

        log.debug("Progress stream opened for {}", owner);
        return emitter;
    }

    private void push(String owner, SseEmitter emitter, Runnable stop) {
        JobSnapshot snapshot = statusUseCase.status(owner);
        try {
            emitter.send(SseEmitter.event().name(PROGRESS_EVENT).data(snapshot, MediaType.APPLICATION_JSON));
            if (snapshot.state() == JobState.IDLE || snapshot.state().isTerminal()) {
                emitter.send(SseEmitter.event().name(COMPLETE_EVENT).data(snapshot, MediaType.APPLICATION_JSON));
                stop.run();
                emitter.complete();
                log.debug("Progress stream for {} closed ({})", owner, snapshot.state());
            }
        } catch (IOException | IllegalStateException e) {
            // Cliente desconectado
            log.debug("Progress stream for {} dropped: {}", owner, e.getMessage());
            stop.run();
        }
    }
}
