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
package com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.mongodb.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import java.time.Instant;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 21-01-2026 at 10:31:19
 * File: FaceEmbeddingDocument.java
 */

/**
 * Documento MongoDB para la colección face-embeddings.
 * Un documento por foto; índice único (owner, photoReference).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = FaceEmbeddingDocument.COLLECTION)
public class FaceEmbeddingDocument {

    public static final String COLLECTION = "face-embeddings";

    @Id
    private String id;                  // MongoDB _id (auto-generado)

    private String owner;
    private String photoReference;      // Identidad del fichero en el origen
    private String modelVersion;
    private Integer dimension;
    private Integer faceCount;
    private Long sourceSize;            // Versión del fichero embebido
    private Long sourceModificationTime;
    private List<String> embeddings;    // Base64 de float32 little-endian, una entrada por cara
    private Instant createdAt;
    private Instant updatedAt;
}
