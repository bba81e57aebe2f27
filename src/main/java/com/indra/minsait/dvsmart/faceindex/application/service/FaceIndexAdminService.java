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
package com.indra.minsait.dvsmart.faceindex.application.service;

import com.indra.minsait.dvsmart.faceindex.application.port.out.FolderStatePort;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheStats;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreStats;
import com.indra.minsait.dvsmart.faceindex.domain.service.ContentCacheService;
import com.indra.minsait.dvsmart.faceindex.domain.service.EmbeddingStoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 11:05:33
 * File: FaceIndexAdminService.java
 */

/**
 * Administración de caché y almacén por propietario. Cualquier borrado invalida
 * la huella de carpeta del propietario para que la siguiente ejecución revise
 * todas las fotos.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FaceIndexAdminService {

    private final ContentCacheService contentCache;
    private final EmbeddingStoreService embeddingStore;
    private final FolderStatePort folderState;

    public CacheStats cacheStats(String owner) {
        return contentCache.stats(owner);
    }

    public int evictCache(String owner, String scope) {
        int removed = contentCache.evict(owner, scope);
        folderState.invalidate(owner);
        return removed;
    }

    public StoreStats storeStats(String owner) {
        return embeddingStore.stats(owner);
    }

    public boolean deletePhoto(String owner, String photoReference) {
        boolean deleted = embeddingStore.delete(owner, photoReference);
        folderState.invalidate(owner);
        return deleted;
    }
}
