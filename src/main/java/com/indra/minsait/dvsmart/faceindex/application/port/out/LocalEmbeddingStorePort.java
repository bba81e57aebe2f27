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
package com.indra.minsait.dvsmart.faceindex.application.port.out;

import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreStats;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 15-01-2026 at 10:05:31
 * File: LocalEmbeddingStorePort.java
 */

/**
 * Nivel local (rápido y autoritativo) del almacén de embeddings.
 */
public interface LocalEmbeddingStorePort {

    boolean exists(String owner, String photoReference);

    /**
     * Guarda el conjunto sustituyendo cualquier cara previa de la foto.
     */
    void replace(PhotoEmbeddingSet set);

    Optional<PhotoEmbeddingSet> find(String owner, String photoReference);

    List<PhotoEmbeddingSet> findAll(String owner);

    boolean delete(String owner, String photoReference);

    /**
     * Marca la foto como sincronizada si su versión local sigue teniendo ese
     * {@code updatedAt}.
     *
     * @return false si la foto cambió (o desapareció) desde que se leyó
     */
    boolean markRemoteSynced(String owner, String photoReference, Instant updatedAt);

    /**
     * Conjuntos pendientes de subir al nivel remoto, los más antiguos primero.
     */
    List<PhotoEmbeddingSet> findPendingRemoteSync(int limit);

    StoreStats stats(String owner);
}
