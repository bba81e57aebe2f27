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

import com.indra.minsait.dvsmart.faceindex.application.port.out.FolderStatePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 20-01-2026 at 12:08:41
 * File: JdbcFolderStateRepository.java
 */

@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcFolderStateRepository implements FolderStatePort {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    public Optional<String> findFingerprint(String owner, String scope) {
        return LocalStoreErrors.translate("folder state lookup", () -> jdbcTemplate.queryForList(
                "SELECT fingerprint FROM folder_state WHERE owner = ? AND scope = ?",
                String.class, owner, scope).stream().findFirst());
    }

    @Override
    public void saveFingerprint(String owner, String scope, String fingerprint, int fileCount) {
        LocalStoreErrors.run("folder state save", () -> jdbcTemplate.update(
                "MERGE INTO folder_state (owner, scope, fingerprint, file_count, processed_at) KEY (owner, scope) "
                + "VALUES (?, ?, ?, ?, ?)",
                owner, scope, fingerprint, fileCount, Timestamp.from(clock.instant())));
        log.debug("Folder state saved for {}/{}: {} files", owner, scope, fileCount);
    }

    @Override
    public void invalidate(String owner) {
        int removed = LocalStoreErrors.translate("folder state invalidate", () -> jdbcTemplate.update(
                "DELETE FROM folder_state WHERE owner = ?", owner));
        if (removed > 0) {
            log.debug("Folder state invalidated for {} ({} scopes)", owner, removed);
        }
    }
}
