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
import java.util.List;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 15-01-2026 at 10:14:09
 * File: RemoteEmbeddingStorePort.java
 */

/**
 * Nivel remoto (duradero) del almacén de embeddings. Un registro por
 * {@code (owner, photoReference)}.
 *
 * Las escrituras son monótonas por {@code updatedAt}: un conjunto más antiguo
 * que el almacenado no lo sobrescribe.
 *
 * Las implementaciones lanzan {@link com.indra.minsait.dvsmart.faceindex.domain.exception.RemoteStoreException}
 * ante cualquier fallo de acceso.
 */
public interface RemoteEmbeddingStorePort {

    void upsert(PhotoEmbeddingSet set);

    /**
     * Upsert en bloque (no ordenado).
     *
     * @return documentos insertados o coincidentes
     */
    int upsertAll(List<PhotoEmbeddingSet> sets);

    Optional<PhotoEmbeddingSet> find(String owner, String photoReference);

    List<PhotoEmbeddingSet> findAll(String owner);

    boolean delete(String owner, String photoReference);
}
