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
package com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.mongodb;

import com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.mongodb.entity.FaceEmbeddingDocument;
import com.indra.minsait.dvsmart.faceindex.application.port.out.RemoteEmbeddingStorePort;
import com.indra.minsait.dvsmart.faceindex.domain.exception.RemoteStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.model.FaceEmbedding;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import com.indra.minsait.dvsmart.faceindex.domain.service.EmbeddingCodec;
import com.mongodb.MongoException;
import com.mongodb.bulk.BulkWriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.BulkOperationException;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 21-01-2026 at 10:52:44
 * File: MongoRemoteEmbeddingStore.java
 */

/**
 * Nivel remoto del almacén de embeddings en MongoDB.
 *
 * Escritura por upsert sobre (owner, photoReference): reprocesar una foto
 * sustituye su documento, nunca lo duplica. {@code createdAt} solo se fija al insertar.
 *
 * El filtro del upsert exige {@code updatedAt <= } el del conjunto. Si el documento
 * es más reciente el filtro no coincide, el upsert intenta insertar y el índice
 * único lo rechaza (E11000): ese rechazo significa "ya hay una versión más nueva".
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class MongoRemoteEmbeddingStore implements RemoteEmbeddingStorePort {

    private static final int DUPLICATE_KEY = 11000;

    private final MongoTemplate mongoTemplate;

    @Override
    public void upsert(PhotoEmbeddingSet set) {
        execute("upsert", () -> {
            try {
                mongoTemplate.upsert(notNewerThan(set), toUpdate(set), FaceEmbeddingDocument.class);
            } catch (DuplicateKeyException e) {
                log.debug("Remote tier keeps a newer version of {}/{}", set.getOwner(), set.getPhotoReference());
            }
            return null;
        });
    }

    @Override
    public int upsertAll(List<PhotoEmbeddingSet> sets) {
        if (sets.isEmpty()) {
            return 0;
        }
        return execute("bulk upsert", () -> {
            BulkOperations bulkOps = mongoTemplate.bulkOps(
                BulkOperations.BulkMode.UNORDERED,
                FaceEmbeddingDocument.class
            );
            for (PhotoEmbeddingSet set : sets) {
                bulkOps.upsert(notNewerThan(set), toUpdate(set));
            }
            BulkWriteResult result;
            try {
                result = bulkOps.execute();
            } catch (BulkOperationException e) {
                boolean onlyNewerVersions = e.getErrors().stream().allMatch(error -> error.getCode() == DUPLICATE_KEY);
                if (!onlyNewerVersions) {
                    throw e;
                }
                log.debug("Bulk upsert kept {} newer remote versions", e.getErrors().size());
                result = e.getResult();
            }
            log.info("Bulk upsert completed: {} inserted, {} updated",
                    result.getUpserts().size(), result.getModifiedCount());
            return result.getUpserts().size() + result.getMatchedCount();
        });
    }

    @Override
    public Optional<PhotoEmbeddingSet> find(String owner, String photoReference) {
        return execute("find", () -> Optional.ofNullable(
                mongoTemplate.findOne(byPhoto(owner, photoReference), FaceEmbeddingDocument.class))
                .map(this::toDomain));
    }

    @Override
    public List<PhotoEmbeddingSet> findAll(String owner) {
        return execute("findAll", () -> mongoTemplate.find(
                new Query(Criteria.where("owner").is(owner)), FaceEmbeddingDocument.class)
                .stream()
                .map(this::toDomain)
                .toList());
    }

    @Override
    public boolean delete(String owner, String photoReference) {
        return execute("delete", () -> mongoTemplate.remove(
                byPhoto(owner, photoReference), FaceEmbeddingDocument.class).getDeletedCount() > 0);
    }

    private Query byPhoto(String owner, String photoReference) {
        return new Query(Criteria.where("owner").is(owner).and("photoReference").is(photoReference));
    }

    private Query notNewerThan(PhotoEmbeddingSet set) {
        return new Query(Criteria.where("owner").is(set.getOwner())
                .and("photoReference").is(set.getPhotoReference())
                .orOperator(
                        Criteria.where("updatedAt").lte(set.getUpdatedAt()),
                        Criteria.where("updatedAt").exists(false)));
    }

    private Update toUpdate(PhotoEmbeddingSet set) {
        List<String> encoded = new ArrayList<>(set.getFaceCount());
        if (!set.isFaceless()) {
            for (FaceEmbedding face : set.getFaces()) {
                encoded.add(EmbeddingCodec.toBase64(face.getVector()));
            }
        }
        return new Update()
                .set("modelVersion", set.getModelVersion())
                .set("dimension", set.getDimension())
                .set("faceCount", set.getFaceCount())
                .set("sourceSize", set.getSourceSize())
                .set("sourceModificationTime", set.getSourceModificationTime())
                .set("embeddings", encoded)
                .set("updatedAt", set.getUpdatedAt())
                .setOnInsert("owner", set.getOwner())
                .setOnInsert("photoReference", set.getPhotoReference())
                .setOnInsert("createdAt", set.getCreatedAt());
    }

    private PhotoEmbeddingSet toDomain(FaceEmbeddingDocument doc) {
        List<String> encoded = doc.getEmbeddings() == null ? List.of() : doc.getEmbeddings();
        List<FaceEmbedding> faces = new ArrayList<>(encoded.size());
        for (int i = 0; i < encoded.size(); i++) {
            faces.add(FaceEmbedding.builder()
                    .owner(doc.getOwner())
                    .photoReference(doc.getPhotoReference())
                    .faceIndex(i)
                    .vector(EmbeddingCodec.fromBase64(encoded.get(i)))
                    .createdAt(doc.getCreatedAt())
                    .build());
        }
        return PhotoEmbeddingSet.builder()
                .owner(doc.getOwner())
                .photoReference(doc.getPhotoReference())
                .modelVersion(doc.getModelVersion())
                .dimension(doc.getDimension() == null ? 0 : doc.getDimension())
                .sourceSize(doc.getSourceSize())
                .sourceModificationTime(doc.getSourceModificationTime())
                .faces(List.copyOf(faces))
                .remoteSynced(true)
                .createdAt(doc.getCreatedAt())
                .updatedAt(doc.getUpdatedAt())
                .build();
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException e) {
            throw new RemoteStoreException("Remote store " + operation + " failed: " + e.getMessage(), e);
        }
    }
}
