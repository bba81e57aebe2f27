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

import lombok.Getter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-01-2026 at 12:40:05
 * File: ProcessingJob.java
 */

/**
 * Contexto de un job de indexación facial. Se pasa explícitamente a cada worker
 * y se expone en solo lectura mediante {@link #snapshot()}.
 *
 * Todas las mutaciones pasan por el mismo lock; los lectores nunca leen campos
 * sueltos, siempre una copia consistente.
 *
 * Contadores por paso: un elemento cuenta en un paso cuando lo ha superado,
 * sea cual sea su resultado final (procesado, omitido o fallido). Al terminar
 * todos los elementos, cada paso queda en {@code totalItems}.
 */
public class ProcessingJob {

    @Getter
    private final String jobId;
    @Getter
    private final String owner;
    @Getter
    private final String scope;
    @Getter
    private final boolean forceReprocess;

    private final Clock clock;
    private final int etaWindow;
    private final int parallelism;

    private final Object lock = new Object();
    private final CountDownLatch finished = new CountDownLatch(1);

    // Estado protegido por lock
    private JobState state = JobState.RUNNING;
    private ProcessingStep currentStep;
    private final Map<ProcessingStep, Integer> stepCompleted = new EnumMap<>(ProcessingStep.class);
    private final Deque<Long> recentDurations = new ArrayDeque<>();
    private final List<JobIssue> warnings = new ArrayList<>();
    private final List<JobIssue> errors = new ArrayList<>();
    private int totalItems;
    private int processedCount;
    private int skippedCount;
    private int failedCount;
    private int facesStored;
    private boolean cancelRequested;
    private String failureReason;
    private final Instant startedAt;
    private Instant finishedAt;

    public ProcessingJob(String owner, String scope, boolean forceReprocess,
                         Clock clock, int etaWindow, int parallelism) {
        this.jobId = UUID.randomUUID().toString();
        this.owner = owner;
        this.scope = scope;
        this.forceReprocess = forceReprocess;
        this.clock = clock;
        this.etaWindow = Math.max(1, etaWindow);
        this.parallelism = Math.max(1, parallelism);
        this.startedAt = clock.instant();
        for (ProcessingStep step : ProcessingStep.values()) {
            stepCompleted.put(step, 0);
        }
    }

    /**
     * Fija el total de elementos tras listar el origen.
     */
    public void begin(int totalItems) {
        synchronized (lock) {
            this.totalItems = totalItems;
            this.currentStep = ProcessingStep.DOWNLOAD;
        }
    }

    public void stepCompleted(ProcessingStep step) {
        synchronized (lock) {
            stepCompleted.merge(step, 1, Integer::sum);
            currentStep = step;
        }
    }

    /**
     * Cierra un elemento. Los pasos posteriores a {@code lastStep} (todos si es null)
     * se cuentan como superados.
     *
     * @param durationMs duración del elemento, entra en la media móvil del ETA si es positiva
     */
    public void itemFinished(ItemOutcome outcome, ProcessingStep lastStep, int faces, long durationMs) {
        synchronized (lock) {
            int from = lastStep == null ? 0 : lastStep.ordinal() + 1;
            ProcessingStep[] steps = ProcessingStep.values();
            for (int i = from; i < steps.length; i++) {
                stepCompleted.merge(steps[i], 1, Integer::sum);
            }
            switch (outcome) {
                case PROCESSED -> {
                    processedCount++;
                    facesStored += faces;
                }
                case SKIPPED -> skippedCount++;
                case FAILED -> failedCount++;
            }
            if (durationMs > 0) {
                recentDurations.addLast(durationMs);
                while (recentDurations.size() > etaWindow) {
                    recentDurations.removeFirst();
                }
            }
        }
    }

    /**
     * Marca como omitidos {@code count} elementos sin pasar por los workers
     * (carpeta sin cambios desde la última ejecución).
     */
    public void skipAll(int count) {
        synchronized (lock) {
            skippedCount += count;
            for (ProcessingStep step : ProcessingStep.values()) {
                stepCompleted.merge(step, count, Integer::sum);
            }
            currentStep = ProcessingStep.STORE;
        }
    }

    public void addWarning(ProcessingStep step, String fileId, String photoReference, String message) {
        JobIssue issue = new JobIssue(JobIssue.Severity.WARNING, step, fileId, photoReference, message, clock.instant());
        synchronized (lock) {
            warnings.add(issue);
        }
    }

    public void addError(ProcessingStep step, String fileId, String photoReference, String message) {
        JobIssue issue = new JobIssue(JobIssue.Severity.ERROR, step, fileId, photoReference, message, clock.instant());
        synchronized (lock) {
            errors.add(issue);
        }
    }

    /**
     * Solicita la cancelación. Los workers dejan de tomar elementos nuevos;
     * los que están en curso terminan.
     *
     * @return false si el job ya había terminado
     */
    public boolean requestCancel() {
        synchronized (lock) {
            if (state.isTerminal()) {
                return false;
            }
            cancelRequested = true;
            return true;
        }
    }

    public boolean isCancelRequested() {
        synchronized (lock) {
            return cancelRequested;
        }
    }

    /**
     * Termina el job: CANCELLED si se pidió cancelación, COMPLETED en otro caso.
     */
    public void complete() {
        finish(null);
    }

    public void fail(String reason) {
        finish(reason == null ? "Unknown failure" : reason);
    }

    private void finish(String reason) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            if (reason != null) {
                state = JobState.FAILED;
                failureReason = reason;
            } else {
                state = cancelRequested ? JobState.CANCELLED : JobState.COMPLETED;
            }
            finishedAt = clock.instant();
        }
        finished.countDown();
    }

    public JobState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isRunning() {
        return getState() == JobState.RUNNING;
    }

    public boolean hasErrors() {
        synchronized (lock) {
            return !errors.isEmpty();
        }
    }

    public int getFailedCount() {
        synchronized (lock) {
            return failedCount;
        }
    }

    /**
     * Espera a que el job llegue a un estado terminal.
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public JobSnapshot snapshot() {
        synchronized (lock) {
            Map<ProcessingStep, StepProgress> steps = new EnumMap<>(ProcessingStep.class);
            int completedUnits = 0;
            for (ProcessingStep step : ProcessingStep.values()) {
                int done = stepCompleted.get(step);
                completedUnits += done;
                steps.put(step, StepProgress.of(totalItems, done));
            }

            double overall;
            if (totalItems == 0) {
                overall = state.isTerminal() ? 100.0 : 0.0;
            } else {
                overall = Math.min(100.0, completedUnits * 100.0 / (totalItems * ProcessingStep.values().length));
            }

            Instant end = finishedAt != null ? finishedAt : clock.instant();
            long elapsed = Math.max(0, Duration.between(startedAt, end).toMillis());

            return new JobSnapshot(
                jobId, owner, scope, state, forceReprocess, currentStep,
                Collections.unmodifiableMap(steps),
                totalItems, processedCount, skippedCount, failedCount, facesStored,
                overall, startedAt, finishedAt, elapsed, estimateRemainingMs(),
                List.copyOf(warnings), List.copyOf(errors), failureReason);
        }
    }

    /**
     * Media móvil de las últimas duraciones por elemento, multiplicada por los
     * elementos pendientes y dividida entre el paralelismo.
     */
    private Long estimateRemainingMs() {
        if (state.isTerminal()) {
            return 0L;
        }
        if (recentDurations.isEmpty()) {
            return null;
        }
        int remaining = totalItems - processedCount - skippedCount - failedCount;
        if (remaining <= 0) {
            return 0L;
        }
        double average = recentDurations.stream().mapToLong(Long::longValue).average().orElse(0.0);
        return Math.round(average * remaining / parallelism);
    }
}
