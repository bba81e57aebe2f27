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
package com.indra.minsait.dvsmart.faceindex.infrastructure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-01-2026 at 09:48:22
 * File: FaceIndexingExecutorConfig.java
 */

/**
 * Pools de hilos de la indexación facial.
 *
 * - faceJobLauncherExecutor: un hilo por job en curso (reparto y cierre)
 * - faceIndexingWorkerExecutor: procesamiento de fotos, acotado por concurrency
 * - faceIndexingCallExecutor: llamadas bloqueantes con timeout (descarga, motor)
 * - taskScheduler: tareas programadas y envío periódico de progreso SSE
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class FaceIndexingExecutorConfig {

    private final FaceIndexProperties props;

    @Bean(name = "faceJobLauncherExecutor")
    ThreadPoolTaskExecutor faceJobLauncherExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("face-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean(name = "faceIndexingWorkerExecutor")
    ThreadPoolTaskExecutor faceIndexingWorkerExecutor() {
        FaceIndexProperties.Processing processing = props.getProcessing();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(processing.getConcurrency());
        executor.setMaxPoolSize(processing.getConcurrency() * 2);
        executor.setQueueCapacity(processing.getQueueCapacity());
        executor.setThreadNamePrefix("face-index-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        log.info("Face indexing worker pool: concurrency={}, queueCapacity={}",
                processing.getConcurrency(), processing.getQueueCapacity());
        return executor;
    }

    @Bean(name = "faceIndexingCallExecutor")
    ThreadPoolTaskExecutor faceIndexingCallExecutor() {
        int concurrency = props.getProcessing().getConcurrency();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        // Margen para llamadas colgadas tras un timeout
        executor.setCorePoolSize(concurrency * 2);
        executor.setMaxPoolSize(concurrency * 4);
        executor.setQueueCapacity(props.getProcessing().getQueueCapacity());
        executor.setThreadNamePrefix("face-index-call-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "taskScheduler")
    ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("face-index-sched-");
        scheduler.initialize();
        return scheduler;
    }
}
