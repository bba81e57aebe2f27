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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 22-12-2025 at 15:41:23
 * File: LocalTierConfigurationChecker.java
 */

/**
 * Verifica al arrancar que la base H2 del nivel local tiene sus tablas.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalTierConfigurationChecker implements ApplicationRunner {

    static final List<String> REQUIRED_TABLES = List.of(
        "PHOTO_EMBEDDING_SET", "FACE_EMBEDDING", "CONTENT_CACHE_ENTRY", "FOLDER_STATE");

    private final DataSource dataSource;

    @Override
    public void run(ApplicationArguments args) {
        log.info("════════════════════════════════════════════════════");
        log.info("LOCAL TIER (H2) CONFIGURATION CHECK");
        log.info("════════════════════════════════════════════════════");

        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData metaData = conn.getMetaData();

            log.info("Database Product: {} {}", metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion());
            log.info("Database URL: {}", metaData.getURL());

            int found = 0;
            for (String table : REQUIRED_TABLES) {
                if (tableExists(metaData, table)) {
                    log.info("  ✓ {}", table);
                    found++;
                } else {
                    log.warn("⚠️  Missing table {}", table);
                }
            }

            if (found < REQUIRED_TABLES.size()) {
                log.warn("⚠️  Check 'spring.sql.init.mode' and schema.sql");
            } else {
                log.info("✅ Found {} local tier tables", found);
            }

        } catch (SQLException e) {
            log.error("❌ Error checking local tier configuration", e);
        }

        log.info("════════════════════════════════════════════════════");
    }

    private boolean tableExists(DatabaseMetaData metaData, String table) throws SQLException {
        try (ResultSet tables = metaData.getTables(null, null, table, new String[] {"TABLE", "BASE TABLE"})) {
            if (tables.next()) {
                return true;
            }
        }
        try (ResultSet tables = metaData.getTables(null, null, table.toLowerCase(Locale.ROOT), new String[] {"TABLE", "BASE TABLE"})) {
            return tables.next();
        }
    }
}
