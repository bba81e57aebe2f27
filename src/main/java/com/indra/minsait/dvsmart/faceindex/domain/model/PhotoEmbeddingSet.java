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

import lombok.Builder;
import lombok.Value;
import lombok.With;
import java.time.Instant;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 08-01-2026 at 10:44:52
 * File: PhotoEmbeddingSet.java
 */

/**
 * Conjunto de embeddings de una foto. Un conjunto vacío es un resultado válido:
 * la foto se procesó y no tiene caras, y no se vuelve a enviar al motor.
 */
@Value
@Builder
public class PhotoEmbeddingSet {
    String owner;
    String photoReference;
    String modelVersion;
    int dimension;
    List<FaceEmbedding> faces;
    Long sourceSize;                // Tamaño del fichero embebido (null si se desconoce)
    Long sourceModificationTime;    // mtime del fichero embebido (null si se desconoce)
    @With
    boolean remoteSynced;
    Instant createdAt;
    Instant updatedAt;

    public boolean isFaceless() {
        return faces == null || faces.isEmpty();
    }

    /**
     * Indica si el conjunto se calculó sobre esa versión del fichero. Sin
     * versión registrada se considera vigente.
     */
    public boolean matchesSource(SourceFile file) {
        if (sourceSize == null || sourceModificationTime == null) {
            return true;
        }
        return sourceSize == file.getSize() && sourceModificationTime == file.getModificationTime();
    }

    public int getFaceCount() {
        return faces == null ? 0 : faces.size();
    }
}
