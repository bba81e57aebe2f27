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
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.mongo.MongoLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-12-2025 at 23:34:40
 * File: ShedLockConfig.java
 */

/**
 * Locks distribuidos en MongoDB: lock de propietario de los jobs de indexación
 * ({@code face-indexing-<owner>}) y pasada programada de reconciliación.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableSchedulerLock(defaultLockAtMostFor = "PT30M")
public class ShedLockConfig {

    static final String LOCK_COLLECTION = "faceIndexLocks";

    private final MongoTemplate mongoTemplate;

    @Bean
    LockProvider lockProvider() {
        log.info("ShedLock provider: MongoDB {}.{}", mongoTemplate.getDb().getName(), LOCK_COLLECTION);
        return new MongoLockProvider(mongoTemplate.getDb().getCollection(LOCK_COLLECTION));
    }
}
