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

import com.indra.minsait.dvsmart.faceindex.domain.exception.ItemTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-01-2026 at 10:02:11
 * File: BoundedCallRunner.java
 */

/**
 * Ejecuta llamadas bloqueantes (descarga, motor) con un tiempo máximo.
 * Al vencer se interrumpe la llamada y el elemento sigue su curso como fallido.
 */
@Slf4j
@Component
public class BoundedCallRunner {

    private final AsyncTaskExecutor callExecutor;

    public BoundedCallRunner(@Qualifier("faceIndexingCallExecutor") AsyncTaskExecutor callExecutor) {
        this.callExecutor = callExecutor;
    }

    /**
     * @throws ItemTimeoutException si la llamada no termina a tiempo
     */
    public <T> T call(Callable<T> task, Duration timeout, String description) {
        Future<T> future = callExecutor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("⚠️ {} timed out after {} ms", description, timeout.toMillis());
            throw new ItemTimeoutException(description + " timed out after " + timeout.toMillis() + " ms");

        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ItemTimeoutException(description + " interrupted");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new RuntimeException(description + " failed: " + cause.getMessage(), cause);
        }
    }
}
