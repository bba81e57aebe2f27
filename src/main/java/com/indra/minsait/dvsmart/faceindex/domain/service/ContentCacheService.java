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

import com.indra.minsait.dvsmart.faceindex.application.port.out.ContentCacheIndexPort;
import com.indra.minsait.dvsmart.faceindex.application.port.out.SourceListingPort;
import com.indra.minsait.dvsmart.faceindex.domain.exception.ContentFetchException;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheEntry;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheFetch;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheStats;
import com.indra.minsait.dvsmart.faceindex.domain.model.SourceFile;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 10:15:52
 * File: ContentCacheService.java
 */

/**
 * Caché local de ficheros del origen.
 *
 * La descarga se escribe en {@code <baseDir>/.tmp/<uuid>.part}, se mueve
 * atómicamente a su ruta final y solo entonces se registra la entrada en el
 * índice. Una entrada registrada siempre apunta a un fichero completo.
 */
@Slf4j
@Service
public class ContentCacheService {

    static final String TMP_DIR = ".tmp";

    private final ContentCacheIndexPort index;
    private final RetryTemplate retryTemplate;
    private final SourceFileMetadataService metadataService;
    private final Clock clock;
    private final Path baseDir;

    public ContentCacheService(
            ContentCacheIndexPort index,
            @Qualifier("contentFetchRetryTemplate") RetryTemplate retryTemplate,
            SourceFileMetadataService metadataService,
            FaceIndexProperties props,
            Clock clock) {
        this.index = index;
        this.retryTemplate = retryTemplate;
        this.metadataService = metadataService;
        this.clock = clock;
        this.baseDir = Path.of(props.getCache().getBaseDir()).toAbsolutePath().normalize();
        log.info("Content cache base directory: {}", baseDir);
    }

    /**
     * Consulta solo el índice local, sin E/S de red.
     */
    public boolean exists(String owner, String scope, String fileId) {
        return index.find(owner, scope, fileId).isPresent();
    }

    public Optional<CacheEntry> lookup(String owner, String scope, String fileId) {
        return index.find(owner, scope, fileId);
    }

    /**
     * Devuelve la copia local del fichero, descargándolo si no está cacheado.
     *
     * Se vuelve a descargar si la entrada no coincide con el fichero observado
     * (tamaño o fecha distintos) o si la copia local falta o no se puede leer.
     *
     * @throws ContentFetchException si la descarga falla tras los reintentos
     */
    public CacheFetch fetch(String owner, String scope, SourceFile file, SourceListingPort source) {
        Optional<CacheEntry> cached = index.find(owner, scope, file.getId());

        if (cached.isEmpty()) {
            return new CacheFetch(download(owner, scope, file, source), true, false);
        }

        CacheEntry entry = cached.get();
        if (!entry.matches(file)) {
            log.info("Source file changed since cached, refetching: {} (size {} -> {}, mtime {} -> {})",
                    file.getId(), entry.getSizeBytes(), file.getSize(),
                    entry.getModificationTime(), file.getModificationTime());
            return new CacheFetch(download(owner, scope, file, source), true, true);
        }

        if (!isIntact(entry)) {
            log.warn("⚠️ Cache entry without usable local file, refetching: {} -> {}",
                    file.getId(), entry.getLocalPath());
            return new CacheFetch(download(owner, scope, file, source), true, false);
        }

        log.debug("Cache hit: {}", file.getId());
        return CacheFetch.hit(entry);
    }

    /**
     * Descarga ignorando la caché y sustituye la entrada.
     */
    public CacheEntry forceRefetch(String owner, String scope, SourceFile file, SourceListingPort source) {
        return download(owner, scope, file, source);
    }

    /**
     * Elimina las entradas (y sus ficheros) de un propietario, o solo de un ámbito si se indica.
     *
     * @return número de entradas eliminadas del índice
     */
    public int evict(String owner, String scope) {
        List<CacheEntry> entries = scope == null
                ? index.findByOwner(owner)
                : index.findByScope(owner, scope);

        for (CacheEntry entry : entries) {
            deleteFile(entry.path());
        }

        int removed = scope == null
                ? index.deleteByOwner(owner)
                : index.deleteByScope(owner, scope);

        log.info("Cache evicted: owner={}, scope={}, entries={}", owner, scope == null ? "*" : scope, removed);
        return removed;
    }

    public CacheStats stats(String owner) {
        return index.stats(owner);
    }

    Path getBaseDir() {
        return baseDir;
    }

    private CacheEntry download(String owner, String scope, SourceFile file, SourceListingPort source) {
        Path target = resolveTarget(owner, scope, file);
        Path tmp = baseDir.resolve(TMP_DIR).resolve(UUID.randomUUID() + ".part");

        long start = System.currentTimeMillis();
        try {
            Files.createDirectories(tmp.getParent());

            retryTemplate.execute((RetryCallback<Void, IOException>) context -> {
                if (context.getRetryCount() > 0) {
                    log.debug("Retrying download of {} (attempt {})", file.getId(), context.getRetryCount() + 1);
                }
                try (OutputStream out = Files.newOutputStream(tmp,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                    source.download(file, out);
                }
                long written = Files.size(tmp);
                if (written != file.getSize()) {
                    throw new IOException("Incomplete download: " + written + " of " + file.getSize() + " bytes");
                }
                return null;
            });

            Files.createDirectories(target.getParent());
            publish(tmp, target);

        } catch (IOException e) {
            deleteFile(tmp);
            throw new ContentFetchException("Failed to fetch " + file.getId() + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            deleteFile(tmp);
            throw e;
        }

        CacheEntry entry = CacheEntry.builder()
                .owner(owner)
                .scope(scope)
                .fileId(file.getId())
                .localPath(target.toString())
                .sizeBytes(file.getSize())
                .modificationTime(file.getModificationTime())
                .cachedAt(clock.instant())
                .build();
        index.save(entry);

        log.debug("Cached {} ({} bytes) in {} ms", file.getId(), file.getSize(), System.currentTimeMillis() - start);
        return entry;
    }

    /**
     * La copia local existe, es legible y conserva el tamaño registrado.
     */
    private boolean isIntact(CacheEntry entry) {
        Path path = entry.path();
        try {
            return Files.isRegularFile(path) && Files.isReadable(path) && Files.size(path) == entry.getSizeBytes();
        } catch (IOException e) {
            log.debug("Could not inspect cached file {}: {}", path, e.getMessage());
            return false;
        }
    }

    private void publish(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, using plain move", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path resolveTarget(String owner, String scope, SourceFile file) {
        return baseDir
                .resolve(shortHash(owner))
                .resolve(shortHash(scope))
                .resolve(metadataService.cacheFileName(file));
    }

    private String shortHash(String value) {
        return metadataService.generateIdUnico(value).substring(0, 16);
    }

    private void deleteFile(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete cache file {}: {}", path, e.getMessage());
        }
    }
}
