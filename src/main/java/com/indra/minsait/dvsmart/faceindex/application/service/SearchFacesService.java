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

import com.indra.minsait.dvsmart.faceindex.application.port.in.SearchFacesUseCase;
import com.indra.minsait.dvsmart.faceindex.application.port.out.EmbeddingProducer;
import com.indra.minsait.dvsmart.faceindex.domain.exception.NoFaceInQueryException;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchQuery;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchResult;
import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import com.indra.minsait.dvsmart.faceindex.domain.service.SimilaritySearchService;
import com.indra.minsait.dvsmart.faceindex.domain.service.ThresholdPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.ArrayList;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 18-01-2026 at 10:12:50
 * File: SearchFacesService.java
 */

@Slf4j
@Service
@RequiredArgsConstructor
public class SearchFacesService implements SearchFacesUseCase {

    private final SimilaritySearchService searchService;
    private final ThresholdPolicy thresholdPolicy;
    private final EmbeddingProducer embeddingProducer;

    @Override
    public SearchResult search(String owner, List<float[]> embeddings, ThresholdTier tier, Double threshold, Integer limit) {
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        SearchQuery query = SearchQuery.builder()
                .embeddings(embeddings)
                .threshold(thresholdPolicy.resolve(tier, threshold))
                .limit(limit)
                .build();
        return searchService.search(owner, query);
    }

    @Override
    public SearchResult searchByImages(String owner, List<byte[]> images, ThresholdTier tier, Double threshold, Integer limit) {
        if (images == null || images.isEmpty()) {
            throw new IllegalArgumentException("At least one reference image is required");
        }

        List<float[]> queryEmbeddings = new ArrayList<>();
        for (byte[] image : images) {
            List<float[]> faces = embeddingProducer.detectAndEmbed(image);
            if (faces != null) {
                queryEmbeddings.addAll(faces);
            }
        }
        log.info("Reference images for {}: {} images, {} faces", owner, images.size(), queryEmbeddings.size());

        if (queryEmbeddings.isEmpty()) {
            throw new NoFaceInQueryException("No face detected in the reference images");
        }
        return search(owner, queryEmbeddings, tier, threshold, limit);
    }
}
