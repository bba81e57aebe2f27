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
package com.indra.minsait.dvsmart.faceindex.support;

import com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.jdbc.JdbcContentCacheIndex;
import com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.jdbc.JdbcFolderStateRepository;
import com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.jdbc.JdbcLocalEmbeddingStore;
import com.indra.minsait.dvsmart.faceindex.application.service.BoundedCallRunner;
import com.indra.minsait.dvsmart.faceindex.application.service.FaceIndexingOrchestrator;
import com.indra.minsait.dvsmart.faceindex.application.service.PhotoItemProcessor;
import com.indra.minsait.dvsmart.faceindex.domain.model.JobSnapshot;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingJob;
import com.indra.minsait.dvsmart.faceindex.domain.service.ContentCacheService;
import com.indra.minsait.dvsmart.faceindex.domain.service.EmbeddingStoreService;
import com.indra.minsait.dvsmart.faceindex.domain.service.SimilaritySearchService;
import com.indra.minsait.dvsmart.faceindex.domain.service.SourceFileMetadataService;
import com.indra.minsait.dvsmart.faceindex.domain.service.ThresholdPolicy;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Monta el pipeline completo sin contexto Spring: H2 embebido para el nivel
 * local, fakes para el remoto, el origen y el motor.
 */
public class FaceIndexTestHarness implements AutoCloseable {

    public final FaceIndexProperties props = new FaceIndexProperties();
    public final Clock clock = Clock.systemUTC();

    public final EmbeddedDatabase database;
    public final JdbcTemplate jdbcTemplate;
    public final SwitchableLocalEmbeddingStore localStore;
    public final InMemoryRemoteEmbeddingStore remoteStore = new InMemoryRemoteEmbeddingStore();
    public final InMemoryPhotoSource source = new InMemoryPhotoSource();
    public final FakeEmbeddingProducer engine = new FakeEmbeddingProducer();

    public final SourceFileMetadataService metadataService;
    public final JdbcContentCacheIndex cacheIndex;
    public final JdbcFolderStateRepository folderState;
    public final ContentCacheService contentCache;
    public final EmbeddingStoreService embeddingStore;
    public final ThresholdPolicy thresholdPolicy;
    public final SimilaritySearchService searchService;
    public final PhotoItemProcessor itemProcessor;
    public final FaceIndexingOrchestrator orchestrator;

    private final ThreadPoolTaskExecutor workerExecutor;
    private final ThreadPoolTaskExecutor callExecutor;

    public FaceIndexTestHarness(Path cacheDir) {
        this(cacheDir, props -> { });
    }

    public FaceIndexTestHarness(Path cacheDir, Consumer<FaceIndexProperties> customizer) {
        props.getCache().setBaseDir(cacheDir.toString());
        props.getCache().setMaxAttempts(2);
        props.getCache().setRetryBackoffMs(1);
        props.getProcessing().setConcurrency(3);
        props.getProcessing().setItemTimeout(Duration.ofSeconds(10));
        customizer.accept(props);

        database = localTierDatabase();
        jdbcTemplate = new JdbcTemplate(database);
        localStore = new SwitchableLocalEmbeddingStore(new JdbcLocalEmbeddingStore(jdbcTemplate));

        metadataService = new SourceFileMetadataService(props);
        cacheIndex = new JdbcContentCacheIndex(jdbcTemplate);
        folderState = new JdbcFolderStateRepository(jdbcTemplate, clock);

        RetryTemplate retryTemplate = RetryTemplate.builder()
                .maxAttempts(props.getCache().getMaxAttempts())
                .fixedBackoff(props.getCache().getRetryBackoffMs())
                .retryOn(IOException.class)
                .build();
        contentCache = new ContentCacheService(cacheIndex, retryTemplate, metadataService, props, clock);
        embeddingStore = new EmbeddingStoreService(localStore, remoteStore, props);
        thresholdPolicy = new ThresholdPolicy(props);
        searchService = new SimilaritySearchService(embeddingStore);

        int concurrency = props.getProcessing().getConcurrency();
        workerExecutor = executor("test-worker-", concurrency);
        callExecutor = executor("test-call-", concurrency * 2);

        itemProcessor = new PhotoItemProcessor(contentCache, embeddingStore, engine, metadataService,
                new BoundedCallRunner(callExecutor), props, clock);
        orchestrator = new FaceIndexingOrchestrator(source, itemProcessor, metadataService, folderState,
                workerExecutor, props);
    }

    /**
     * Base H2 en memoria con el mismo schema.sql que la aplicación.
     */
    public static EmbeddedDatabase localTierDatabase() {
        return new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScript("classpath:schema.sql")
                .build();
    }

    public ProcessingJob newJob(String owner, String scope, boolean forceReprocess) {
        return new ProcessingJob(owner, scope, forceReprocess, clock,
                props.getProcessing().getEtaWindow(), props.getProcessing().getConcurrency());
    }

    /**
     * Ejecuta un job completo en el hilo actual.
     */
    public JobSnapshot run(String owner, String scope, boolean forceReprocess) {
        ProcessingJob job = newJob(owner, scope, forceReprocess);
        orchestrator.run(job);
        return job.snapshot();
    }

    @Override
    public void close() {
        workerExecutor.shutdown();
        callExecutor.shutdown();
        database.shutdown();
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
