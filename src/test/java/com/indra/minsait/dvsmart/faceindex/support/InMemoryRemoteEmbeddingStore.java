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

import com.indra.minsait.dvsmart.faceindex.application.port.out.RemoteEmbeddingStorePort;
import com.indra.minsait.dvsmart.faceindex.domain.exception.RemoteStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Nivel remoto en memoria. Con {@link #setAvailable(boolean)} a false todas las
 * operaciones fallan como lo haría MongoDB caído. Como el adaptador MongoDB, no
 * sustituye un conjunto por otro más antiguo.
 */
public class InMemoryRemoteEmbeddingStore implements RemoteEmbeddingStorePort {

    private final Map<String, PhotoEmbeddingSet> sets = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private volatile boolean available = true;
    private volatile Consumer<PhotoEmbeddingSet> beforeWrite = set -> { };

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int size(String owner) {
        return (int) sets.values().stream().filter(set -> set.getOwner().equals(owner)).count();
    }

    public int writeCount() {
        return writes.get();
    }

    /**
     * Se ejecuta antes de cada escritura, para intercalar otras escrituras.
     */
    public void beforeWrite(Consumer<PhotoEmbeddingSet> hook) {
        this.beforeWrite = hook;
    }

    public Optional<PhotoEmbeddingSet> stored(String owner, String photoReference) {
        return Optional.ofNullable(sets.get(key(owner, photoReference)));
    }

    public void seed(PhotoEmbeddingSet set) {
        sets.put(key(set.getOwner(), set.getPhotoReference()), set);
    }

    @Override
    public void upsert(PhotoEmbeddingSet set) {
        checkAvailable();
        beforeWrite.accept(set);
        writes.incrementAndGet();
        sets.merge(key(set.getOwner(), set.getPhotoReference()), set,
                (current, incoming) -> incoming.getUpdatedAt().isBefore(current.getUpdatedAt()) ? current : incoming);
    }

    @Override
    public int upsertAll(List<PhotoEmbeddingSet> batch) {
        checkAvailable();
        batch.forEach(this::upsert);
        return batch.size();
    }

    @Override
    public Optional<PhotoEmbeddingSet> find(String owner, String photoReference) {
        checkAvailable();
        return Optional.ofNullable(sets.get(key(owner, photoReference)));
    }

    @Override
    public List<PhotoEmbeddingSet> findAll(String owner) {
        checkAvailable();
        return sets.values().stream().filter(set -> set.getOwner().equals(owner)).toList();
    }

    @Override
    public boolean delete(String owner, String photoReference) {
        checkAvailable();
        return sets.remove(key(owner, photoReference)) != null;
    }

    private void checkAvailable() {
        if (!available) {
            throw new RemoteStoreException("Remote tier offline", null);
        }
    }

    private static String key(String owner, String photoReference) {
        return owner + "|" + photoReference;
    }
}
