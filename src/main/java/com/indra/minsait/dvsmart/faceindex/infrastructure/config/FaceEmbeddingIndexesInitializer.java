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

import com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.mongodb.entity.FaceEmbeddingDocument;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.stereotype.Component;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 22-12-2025 at 01:37:38
 * File: FaceEmbeddingIndexesInitializer.java
 */

/**
 * Crea los índices MongoDB del nivel remoto.
 * Seguro de ejecutar múltiples veces.
 */
@Slf4j
@Component
public class FaceEmbeddingIndexesInitializer {

    private final MongoTemplate mongoTemplate;

    public FaceEmbeddingIndexesInitializer(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @PostConstruct
    public void createIndexes() {
        IndexOperations embeddingsIdx = mongoTemplate.indexOps(FaceEmbeddingDocument.COLLECTION);

        // Una foto por propietario
        embeddingsIdx.ensureIndex(
            new Index()
                .on("owner", Sort.Direction.ASC)
                .on("photoReference", Sort.Direction.ASC)
                .unique()
                .named("uk_owner_photo")
        );

        embeddingsIdx.ensureIndex(
            new Index()
                .on("updatedAt", Sort.Direction.DESC)
                .named("idx_updated_at")
        );

        log.info("MongoDB indexes ensured on {}", FaceEmbeddingDocument.COLLECTION);
    }
}
