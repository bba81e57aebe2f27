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

import com.indra.minsait.dvsmart.faceindex.adapter.in.rest.dto.SearchRequest;
import com.indra.minsait.dvsmart.faceindex.application.port.in.SearchFacesUseCase;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchResult;
import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 10:48:06
 * File: FaceSearchController.java
 */

/**
 * Búsqueda de fotos por similitud facial dentro de un propietario.
 */
@Slf4j
@RestController
@RequestMapping("/api/face-search")
@RequiredArgsConstructor
public class FaceSearchController {

    private final SearchFacesUseCase searchUseCase;

    @PostMapping(path = "/{owner}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SearchResult> search(@PathVariable String owner,
                                               @Valid @RequestBody SearchRequest request) {
        SearchResult result = searchUseCase.search(owner, request.embeddings(),
                request.tier(), request.threshold(), request.limit());
        log.info("Face search for {}: {} matches over {} photos ({})",
                owner, result.size(), result.photosScanned(), result.source());
        return ResponseEntity.ok(result);
    }

    @PostMapping(path = "/{owner}/images", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SearchResult> searchByImages(@PathVariable String owner,
                                                       @RequestParam("images") List<MultipartFile> images,
                                                       @RequestParam(required = false) ThresholdTier tier,
                                                       @RequestParam(required = false) Double threshold,
                                                       @RequestParam(required = false) Integer limit) {
        List<byte[]> payloads = new ArrayList<>(images.size());
        for (MultipartFile image : images) {
            try {
                payloads.add(image.getBytes());
            } catch (IOException e) {
                throw new UncheckedIOException("Could not read uploaded image " + image.getOriginalFilename(), e);
            }
        }
        SearchResult result = searchUseCase.searchByImages(owner, payloads, tier, threshold, limit);
        log.info("Face search by {} images for {}: {} matches", payloads.size(), owner, result.size());
        return ResponseEntity.ok(result);
    }
}
