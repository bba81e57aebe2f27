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

import com.indra.minsait.dvsmart.faceindex.application.port.out.EmbeddingProducer;
import com.indra.minsait.dvsmart.faceindex.application.port.out.SourceListingPort;
import com.indra.minsait.dvsmart.faceindex.domain.exception.ContentFetchException;
import com.indra.minsait.dvsmart.faceindex.domain.exception.ItemTimeoutException;
import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreUnavailableException;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheFetch;
import com.indra.minsait.dvsmart.faceindex.domain.model.FaceEmbedding;
import com.indra.minsait.dvsmart.faceindex.domain.model.ItemOutcome;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingJob;
import com.indra.minsait.dvsmart.faceindex.domain.model.ProcessingStep;
import com.indra.minsait.dvsmart.faceindex.domain.model.SourceFile;
import com.indra.minsait.dvsmart.faceindex.domain.model.StorePut;
import com.indra.minsait.dvsmart.faceindex.domain.service.ContentCacheService;
import com.indra.minsait.dvsmart.faceindex.domain.service.EmbeddingStoreService;
import com.indra.minsait.dvsmart.faceindex.domain.service.SourceFileMetadataService;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import java.io.IOException;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-01-2026 at 11:26:40
 * File: PhotoItemProcessor.java
 */

/**
 * Procesa una foto de principio a fin: caché, comprobación del almacén,
 * motor de caras y escritura.
 *
 * Los fallos de un elemento se registran en el job y no se propagan, salvo la
 * caída del almacén local, que termina el job.
 */
@Slf4j
@Component
public class PhotoItemProcessor {

    private final ContentCacheService contentCache;
    private final EmbeddingStoreService embeddingStore;
    private final EmbeddingProducer embeddingProducer;
    private final SourceFileMetadataService metadataService;
    private final BoundedCallRunner callRunner;
    private final Clock clock;
    private final Duration itemTimeout;

    public PhotoItemProcessor(
            ContentCacheService contentCache,
            EmbeddingStoreService embeddingStore,
            EmbeddingProducer embeddingProducer,
            SourceFileMetadataService metadataService,
            BoundedCallRunner callRunner,
            FaceIndexProperties props,
            Clock clock) {
        this.contentCache = contentCache;
        this.embeddingStore = embeddingStore;
        this.embeddingProducer = embeddingProducer;
        this.metadataService = metadataService;
        this.callRunner = callRunner;
        this.clock = clock;
        this.itemTimeout = props.getProcessing().getItemTimeout();
    }

    /**
     * @throws LocalStoreUnavailableException si el almacén local no responde
     */
    public ItemOutcome process(ProcessingJob job, SourceFile file, SourceListingPort source) {
        String owner = job.getOwner();
        String scope = job.getScope();
        String photoReference = metadataService.photoReference(file);
        long start = clock.millis();

        // 1. Caché de contenido
        CacheFetch fetch;
        try {
            fetch = callRunner.call(
                () -> contentCache.fetch(owner, scope, file, source),
                itemTimeout,
                "Download of " + file.getId());
        } catch (ContentFetchException | ItemTimeoutException e) {
            log.warn("⚠️ Download failed, item skipped for this run: {} ({})", file.getId(), e.getMessage());
            job.addWarning(ProcessingStep.DOWNLOAD, file.getId(), photoReference, e.getMessage());
            job.itemFinished(ItemOutcome.FAILED, null, 0, elapsed(start));
            return ItemOutcome.FAILED;
        } catch (RuntimeException e) {
            log.error("❌ Unexpected error caching {}", file.getId(), e);
            job.addError(ProcessingStep.DOWNLOAD, file.getId(), photoReference, describe(e));
            job.itemFinished(ItemOutcome.FAILED, null, 0, elapsed(start));
            return ItemOutcome.FAILED;
        }
        job.stepCompleted(ProcessingStep.DOWNLOAD);

        // 2. Almacén: fotos ya procesadas se omiten salvo reproceso forzado o fichero cambiado.
        // La versión del fichero se compara con la del conjunto guardado: la caché ya apunta
        // a la versión nueva aunque un intento anterior no llegara a guardarla.
        boolean replace = job.isForceReprocess() || fetch.changed();
        try {
            if (!replace) {
                Optional<PhotoEmbeddingSet> stored = embeddingStore.get(owner, photoReference);
                if (stored.isPresent() && stored.get().matchesSource(file)) {
                    log.debug("Already embedded, skipping: {}", photoReference);
                    job.itemFinished(ItemOutcome.SKIPPED, ProcessingStep.DOWNLOAD, 0, elapsed(start));
                    return ItemOutcome.SKIPPED;
                }
                if (stored.isPresent()) {
                    log.debug("Stored embeddings belong to an older version of {}", photoReference);
                    replace = true;
                }
            }
        } catch (LocalStoreUnavailableException e) {
            job.addError(ProcessingStep.STORE, file.getId(), photoReference, describe(e));
            job.itemFinished(ItemOutcome.FAILED, ProcessingStep.DOWNLOAD, 0, elapsed(start));
            throw e;
        } catch (LocalStoreException e) {
            log.error("❌ Local tier lookup failed for {}", photoReference, e);
            job.addError(ProcessingStep.STORE, file.getId(), photoReference, describe(e));
            job.itemFinished(ItemOutcome.FAILED, ProcessingStep.DOWNLOAD, 0, elapsed(start));
            return ItemOutcome.FAILED;
        }

        // 3. Detección y embedding
        List<float[]> vectors;
        try {
            byte[] imageBytes = Files.readAllBytes(fetch.entry().path());
            vectors = callRunner.call(
                () -> embeddingProducer.detectAndEmbed(imageBytes),
                itemTimeout,
                "Face detection of " + file.getId());
        } catch (IOException e) {
            log.warn("⚠️ Cached file unreadable: {} ({})", fetch.entry().getLocalPath(), e.getMessage());
            job.addWarning(ProcessingStep.DETECT, file.getId(), photoReference, "Cached file unreadable: " + e.getMessage());
            job.itemFinished(ItemOutcome.FAILED, ProcessingStep.DOWNLOAD, 0, elapsed(start));
            return ItemOutcome.FAILED;
        } catch (RuntimeException e) {
            log.warn("⚠️ Embedding engine failed on {}: {}", file.getId(), e.getMessage());
            job.addWarning(ProcessingStep.DETECT, file.getId(), photoReference, describe(e));
            job.itemFinished(ItemOutcome.FAILED, ProcessingStep.DOWNLOAD, 0, elapsed(start));
            return ItemOutcome.FAILED;
        }
        job.stepCompleted(ProcessingStep.DETECT);

        if (vectors == null) {
            vectors = List.of();
        }
        if (vectors.isEmpty()) {
            log.debug("No faces detected in {}", file.getId());
            job.addWarning(ProcessingStep.DETECT, file.getId(), photoReference, "No faces detected");
        }
        PhotoEmbeddingSet set = toEmbeddingSet(owner, photoReference, file, vectors);
        job.stepCompleted(ProcessingStep.EMBED);

        // 4. Escritura en ambos niveles
        StorePut put;
        try {
            put = embeddingStore.put(set, replace);
        } catch (LocalStoreUnavailableException e) {
            job.addError(ProcessingStep.STORE, file.getId(), photoReference, describe(e));
            job.itemFinished(ItemOutcome.FAILED, ProcessingStep.EMBED, 0, elapsed(start));
            throw e;
        } catch (LocalStoreException e) {
            log.error("❌ Local tier write failed for {}", photoReference, e);
            job.addError(ProcessingStep.STORE, file.getId(), photoReference, describe(e));
            job.itemFinished(ItemOutcome.FAILED, ProcessingStep.EMBED, 0, elapsed(start));
            return ItemOutcome.FAILED;
        }

        if (!put.remoteSynced()) {
            job.addWarning(ProcessingStep.STORE, file.getId(), photoReference,
                    "Remote tier write failed; stored locally, pending reconciliation");
        }
        job.stepCompleted(ProcessingStep.STORE);
        job.itemFinished(ItemOutcome.PROCESSED, ProcessingStep.STORE, set.getFaceCount(), elapsed(start));

        log.debug("Processed {}: {} faces{}", photoReference, set.getFaceCount(), replace ? " (replaced)" : "");
        return ItemOutcome.PROCESSED;
    }

    private PhotoEmbeddingSet toEmbeddingSet(String owner, String photoReference, SourceFile file, List<float[]> vectors) {
        Instant now = clock.instant();
        List<FaceEmbedding> faces = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            faces.add(FaceEmbedding.builder()
                    .owner(owner)
                    .photoReference(photoReference)
                    .faceIndex(i)
                    .vector(vectors.get(i))
                    .createdAt(now)
                    .build());
        }
        return PhotoEmbeddingSet.builder()
                .owner(owner)
                .photoReference(photoReference)
                .modelVersion(embeddingProducer.modelVersion())
                .dimension(vectors.isEmpty() ? 0 : vectors.get(0).length)
                .faces(List.copyOf(faces))
                .sourceSize(file.getSize())
                .sourceModificationTime(file.getModificationTime())
                .remoteSynced(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private long elapsed(long start) {
        return Math.max(1, clock.millis() - start);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
