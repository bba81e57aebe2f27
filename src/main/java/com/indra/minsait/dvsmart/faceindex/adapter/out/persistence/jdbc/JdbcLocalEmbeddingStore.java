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
package com.indra.minsait.dvsmart.faceindex.adapter.out.persistence.jdbc;

import com.indra.minsait.dvsmart.faceindex.application.port.out.LocalEmbeddingStorePort;
import com.indra.minsait.dvsmart.faceindex.domain.model.FaceEmbedding;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreStats;
import com.indra.minsait.dvsmart.faceindex.domain.service.EmbeddingCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 20-01-2026 at 09:40:51
 * File: JdbcLocalEmbeddingStore.java
 */

/**
 * Nivel local del almacén de embeddings sobre H2.
 *
 * Tablas:
 * - photo_embedding_set: una fila por foto (también fotos sin caras)
 * - face_embedding: una fila por cara, vector float32 little-endian
 *
 * La sustitución de una foto (cabecera + caras) se hace en una única transacción.
 */
@Slf4j
@Repository
public class JdbcLocalEmbeddingStore implements LocalEmbeddingStorePort {

    private static final String SET_COLUMNS =
            "owner, photo_reference, face_count, dimension, model_version, source_size, source_mtime, "
            + "remote_synced, created_at, updated_at";

    private static final String MERGE_SET =
            "MERGE INTO photo_embedding_set (" + SET_COLUMNS + ") KEY (owner, photo_reference) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String INSERT_FACE =
            "INSERT INTO face_embedding (owner, photo_reference, face_index, dimension, vector, created_at) "
            + "VALUES (?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcLocalEmbeddingStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(jdbcTemplate.getDataSource()));
    }

    @Override
    public boolean exists(String owner, String photoReference) {
        return LocalStoreErrors.translate("exists", () -> {
            Integer count = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM photo_embedding_set WHERE owner = ? AND photo_reference = ?",
                    Integer.class, owner, photoReference);
            return count != null && count > 0;
        });
    }

    @Override
    public void replace(PhotoEmbeddingSet set) {
        LocalStoreErrors.run("replace", () -> transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update(MERGE_SET,
                    set.getOwner(),
                    set.getPhotoReference(),
                    set.getFaceCount(),
                    set.getDimension(),
                    set.getModelVersion(),
                    set.getSourceSize(),
                    set.getSourceModificationTime(),
                    set.isRemoteSynced(),
                    Timestamp.from(set.getCreatedAt()),
                    toTimestamp(set.getUpdatedAt()));

            jdbcTemplate.update("DELETE FROM face_embedding WHERE owner = ? AND photo_reference = ?",
                    set.getOwner(), set.getPhotoReference());

            if (!set.isFaceless()) {
                List<Object[]> rows = new ArrayList<>(set.getFaceCount());
                for (FaceEmbedding face : set.getFaces()) {
                    rows.add(new Object[] {
                        set.getOwner(),
                        set.getPhotoReference(),
                        face.getFaceIndex(),
                        face.getDimension(),
                        EmbeddingCodec.toBytes(face.getVector()),
                        Timestamp.from(face.getCreatedAt())
                    });
                }
                jdbcTemplate.batchUpdate(INSERT_FACE, rows);
            }
        }));
        log.trace("Local tier stored {}/{} ({} faces)", set.getOwner(), set.getPhotoReference(), set.getFaceCount());
    }

    @Override
    public Optional<PhotoEmbeddingSet> find(String owner, String photoReference) {
        return LocalStoreErrors.translate("find", () -> {
            List<PhotoEmbeddingSet.PhotoEmbeddingSetBuilder> headers = jdbcTemplate.query(
                    "SELECT " + SET_COLUMNS + " FROM photo_embedding_set WHERE owner = ? AND photo_reference = ?",
                    headerMapper(), owner, photoReference);
            if (headers.isEmpty()) {
                return Optional.empty();
            }
            List<FaceEmbedding> faces = jdbcTemplate.query(
                    "SELECT owner, photo_reference, face_index, vector, created_at FROM face_embedding "
                    + "WHERE owner = ? AND photo_reference = ? ORDER BY face_index",
                    faceMapper(), owner, photoReference);
            return Optional.of(headers.get(0).faces(List.copyOf(faces)).build());
        });
    }

    @Override
    public List<PhotoEmbeddingSet> findAll(String owner) {
        return LocalStoreErrors.translate("findAll", () -> {
            Map<String, PhotoEmbeddingSet.PhotoEmbeddingSetBuilder> headers = new LinkedHashMap<>();
            jdbcTemplate.query(
                    "SELECT " + SET_COLUMNS + " FROM photo_embedding_set WHERE owner = ? ORDER BY photo_reference",
                    rs -> {
                        headers.put(rs.getString("photo_reference"), headerMapper().mapRow(rs, 0));
                    }, owner);

            Map<String, List<FaceEmbedding>> facesByPhoto = new HashMap<>();
            jdbcTemplate.query(
                    "SELECT owner, photo_reference, face_index, vector, created_at FROM face_embedding "
                    + "WHERE owner = ? ORDER BY photo_reference, face_index",
                    rs -> {
                        FaceEmbedding face = faceMapper().mapRow(rs, 0);
                        facesByPhoto.computeIfAbsent(face.getPhotoReference(), k -> new ArrayList<>()).add(face);
                    }, owner);

            List<PhotoEmbeddingSet> sets = new ArrayList<>(headers.size());
            headers.forEach((reference, builder) ->
                    sets.add(builder.faces(List.copyOf(facesByPhoto.getOrDefault(reference, List.of()))).build()));
            return sets;
        });
    }

    @Override
    public boolean delete(String owner, String photoReference) {
        return LocalStoreErrors.translate("delete", () -> transactionTemplate.execute(status -> {
            jdbcTemplate.update("DELETE FROM face_embedding WHERE owner = ? AND photo_reference = ?", owner, photoReference);
            return jdbcTemplate.update("DELETE FROM photo_embedding_set WHERE owner = ? AND photo_reference = ?",
                    owner, photoReference) > 0;
        }));
    }

    /**
     * Solo marca la fila si sigue siendo la versión subida: una sustitución
     * posterior cambia updated_at y la deja pendiente.
     */
    @Override
    public boolean markRemoteSynced(String owner, String photoReference, Instant updatedAt) {
        return LocalStoreErrors.translate("markRemoteSynced", () -> jdbcTemplate.update(
                "UPDATE photo_embedding_set SET remote_synced = TRUE "
                + "WHERE owner = ? AND photo_reference = ? AND updated_at = ?",
                owner, photoReference, toTimestamp(updatedAt)) > 0);
    }

    @Override
    public List<PhotoEmbeddingSet> findPendingRemoteSync(int limit) {
        return LocalStoreErrors.translate("findPendingRemoteSync", () -> {
            List<PhotoEmbeddingSet.PhotoEmbeddingSetBuilder> headers = jdbcTemplate.query(
                    "SELECT " + SET_COLUMNS + " FROM photo_embedding_set WHERE remote_synced = FALSE "
                    + "ORDER BY updated_at LIMIT ?",
                    headerMapper(), limit);

            List<PhotoEmbeddingSet> sets = new ArrayList<>(headers.size());
            for (PhotoEmbeddingSet.PhotoEmbeddingSetBuilder builder : headers) {
                PhotoEmbeddingSet header = builder.faces(List.of()).build();
                List<FaceEmbedding> faces = jdbcTemplate.query(
                        "SELECT owner, photo_reference, face_index, vector, created_at FROM face_embedding "
                        + "WHERE owner = ? AND photo_reference = ? ORDER BY face_index",
                        faceMapper(), header.getOwner(), header.getPhotoReference());
                sets.add(builder.faces(List.copyOf(faces)).build());
            }
            return sets;
        });
    }

    @Override
    public StoreStats stats(String owner) {
        return LocalStoreErrors.translate("stats", () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS photos, "
                + "COALESCE(SUM(face_count), 0) AS faces, "
                + "COALESCE(SUM(CASE WHEN face_count = 0 THEN 1 ELSE 0 END), 0) AS faceless, "
                + "COALESCE(SUM(CASE WHEN remote_synced THEN 0 ELSE 1 END), 0) AS pending "
                + "FROM photo_embedding_set WHERE owner = ?",
                (rs, rowNum) -> new StoreStats(
                        owner,
                        rs.getLong("photos"),
                        rs.getLong("faces"),
                        rs.getLong("faceless"),
                        rs.getLong("pending")),
                owner));
    }

    private static RowMapper<PhotoEmbeddingSet.PhotoEmbeddingSetBuilder> headerMapper() {
        return (rs, rowNum) -> PhotoEmbeddingSet.builder()
                .owner(rs.getString("owner"))
                .photoReference(rs.getString("photo_reference"))
                .dimension(rs.getInt("dimension"))
                .modelVersion(rs.getString("model_version"))
                .sourceSize(rs.getObject("source_size", Long.class))
                .sourceModificationTime(rs.getObject("source_mtime", Long.class))
                .remoteSynced(rs.getBoolean("remote_synced"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant());
    }

    // TIMESTAMP de H2 guarda microsegundos
    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.from(instant.truncatedTo(ChronoUnit.MICROS));
    }

    private static RowMapper<FaceEmbedding> faceMapper() {
        return JdbcLocalEmbeddingStore::mapFace;
    }

    private static FaceEmbedding mapFace(ResultSet rs, int rowNum) throws SQLException {
        return FaceEmbedding.builder()
                .owner(rs.getString("owner"))
                .photoReference(rs.getString("photo_reference"))
                .faceIndex(rs.getInt("face_index"))
                .vector(EmbeddingCodec.fromBytes(rs.getBytes("vector")))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .build();
    }
}
