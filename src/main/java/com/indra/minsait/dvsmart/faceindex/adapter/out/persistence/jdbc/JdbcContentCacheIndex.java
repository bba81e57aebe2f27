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

import com.indra.minsait.dvsmart.faceindex.application.port.out.ContentCacheIndexPort;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheEntry;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheStats;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 20-01-2026 at 11:22:06
 * File: JdbcContentCacheIndex.java
 */

@Repository
@RequiredArgsConstructor
public class JdbcContentCacheIndex implements ContentCacheIndexPort {

    private static final String COLUMNS =
            "owner, scope, file_id, local_path, size_bytes, modification_time, cached_at";

    private static final RowMapper<CacheEntry> ENTRY_MAPPER = (rs, rowNum) -> CacheEntry.builder()
            .owner(rs.getString("owner"))
            .scope(rs.getString("scope"))
            .fileId(rs.getString("file_id"))
            .localPath(rs.getString("local_path"))
            .sizeBytes(rs.getLong("size_bytes"))
            .modificationTime(rs.getLong("modification_time"))
            .cachedAt(rs.getTimestamp("cached_at").toInstant())
            .build();

    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<CacheEntry> find(String owner, String scope, String fileId) {
        return LocalStoreErrors.translate("cache lookup", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM content_cache_entry WHERE owner = ? AND scope = ? AND file_id = ?",
                ENTRY_MAPPER, owner, scope, fileId).stream().findFirst());
    }

    @Override
    public void save(CacheEntry entry) {
        LocalStoreErrors.run("cache register", () -> jdbcTemplate.update(
                "MERGE INTO content_cache_entry (" + COLUMNS + ") KEY (owner, scope, file_id) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                entry.getOwner(),
                entry.getScope(),
                entry.getFileId(),
                entry.getLocalPath(),
                entry.getSizeBytes(),
                entry.getModificationTime(),
                Timestamp.from(entry.getCachedAt())));
    }

    @Override
    public void delete(String owner, String scope, String fileId) {
        LocalStoreErrors.run("cache delete", () -> jdbcTemplate.update(
                "DELETE FROM content_cache_entry WHERE owner = ? AND scope = ? AND file_id = ?",
                owner, scope, fileId));
    }

    @Override
    public List<CacheEntry> findByOwner(String owner) {
        return LocalStoreErrors.translate("cache list", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM content_cache_entry WHERE owner = ?",
                ENTRY_MAPPER, owner));
    }

    @Override
    public List<CacheEntry> findByScope(String owner, String scope) {
        return LocalStoreErrors.translate("cache list", () -> jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM content_cache_entry WHERE owner = ? AND scope = ?",
                ENTRY_MAPPER, owner, scope));
    }

    @Override
    public int deleteByOwner(String owner) {
        return LocalStoreErrors.translate("cache evict", () -> jdbcTemplate.update(
                "DELETE FROM content_cache_entry WHERE owner = ?", owner));
    }

    @Override
    public int deleteByScope(String owner, String scope) {
        return LocalStoreErrors.translate("cache evict", () -> jdbcTemplate.update(
                "DELETE FROM content_cache_entry WHERE owner = ? AND scope = ?", owner, scope));
    }

    @Override
    public CacheStats stats(String owner) {
        return LocalStoreErrors.translate("cache stats", () -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) AS entries, COALESCE(SUM(size_bytes), 0) AS total_bytes, "
                + "COUNT(DISTINCT scope) AS scopes FROM content_cache_entry WHERE owner = ?",
                (rs, rowNum) -> new CacheStats(owner, rs.getLong("entries"), rs.getLong("total_bytes"), rs.getLong("scopes")),
                owner));
    }
}
