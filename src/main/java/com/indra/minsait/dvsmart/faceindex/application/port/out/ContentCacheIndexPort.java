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

import com.indra.minsait.dvsmart.faceindex.domain.model.CacheEntry;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheStats;
import java.util.List;
import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 15-01-2026 at 10:22:50
 * File: ContentCacheIndexPort.java
 */

/**
 * Índice local de la caché de contenido. Nunca hace E/S de red.
 */
public interface ContentCacheIndexPort {

    Optional<CacheEntry> find(String owner, String scope, String fileId);

    /**
     * Registra o sustituye la entrada de {@code (owner, scope, fileId)}.
     */
    void save(CacheEntry entry);

    void delete(String owner, String scope, String fileId);

    List<CacheEntry> findByOwner(String owner);

    List<CacheEntry> findByScope(String owner, String scope);

    int deleteByOwner(String owner);

    int deleteByScope(String owner, String scope);

    CacheStats stats(String owner);
}
