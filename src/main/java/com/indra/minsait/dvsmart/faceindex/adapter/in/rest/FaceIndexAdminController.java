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
package com.indra.minsait.dvsmart.faceindex.adapter.in.rest;

import com.indra.minsait.dvsmart.faceindex.application.service.FaceIndexAdminService;
import com.indra.minsait.dvsmart.faceindex.domain.model.CacheStats;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 12:20:14
 * File: FaceIndexAdminController.java
 */

/**
 * Mantenimiento de caché y almacén de embeddings.
 * 
 * - GET    /api/face-index/cache/{owner}
 * - DELETE /api/face-index/cache/{owner}?scope=
 * - GET    /api/face-index/store/{owner}
 * - DELETE /api/face-index/store/{owner}/photos?reference=
 */
@Slf4j
@RestController
@RequestMapping("/api/face-index")
@RequiredArgsConstructor
public class FaceIndexAdminController {

    private final FaceIndexAdminService adminService;

    @GetMapping("/cache/{owner}")
    public ResponseEntity<CacheStats> cacheStats(@PathVariable String owner) {
        return ResponseEntity.ok(adminService.cacheStats(owner));
    }

    @DeleteMapping("/cache/{owner}")
    public ResponseEntity<Map<String, Object>> evictCache(@PathVariable String owner,
                                                          @RequestParam(required = false) String scope) {
        int removed = adminService.evictCache(owner, scope);
        log.info("Cache eviction for {} (scope={}): {} entries", owner, scope == null ? "*" : scope, removed);
        return ResponseEntity.ok(Map.of(
            "owner", owner,
            "scope", scope == null ? "*" : scope,
            "removed", removed
        ));
    }

    @GetMapping("/store/{owner}")
    public ResponseEntity<StoreStats> storeStats(@PathVariable String owner) {
        return ResponseEntity.ok(adminService.storeStats(owner));
    }

    @DeleteMapping("/store/{owner}/photos")
    public ResponseEntity<Void> deletePhoto(@PathVariable String owner, @RequestParam("reference") String photoReference) {
        return adminService.deletePhoto(owner, photoReference)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }
}
