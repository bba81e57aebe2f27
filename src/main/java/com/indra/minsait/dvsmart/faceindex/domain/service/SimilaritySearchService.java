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
package com.indra.minsait.dvsmart.faceindex.domain.service;

import com.indra.minsait.dvsmart.faceindex.domain.model.FaceEmbedding;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoMatch;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchQuery;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchResult;
import com.indra.minsait.dvsmart.faceindex.domain.model.TierRead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 16-01-2026 at 11:34:26
 * File: SimilaritySearchService.java
 */

/**
 * Búsqueda por similitud coseno sobre el corpus de un propietario.
 *
 * Una foto coincide si alguna de sus caras supera el corte frente a alguna
 * consulta; su puntuación es la máxima similitud. Sin límite de resultados
 * salvo que se pida.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimilaritySearchService {

    private final EmbeddingStoreService embeddingStore;

    public SearchResult search(String owner, SearchQuery query) {
        if (query.getEmbeddings() == null || query.getEmbeddings().isEmpty()) {
            throw new IllegalArgumentException("At least one query embedding is required");
        }

        List<float[]> queries = new ArrayList<>(query.getEmbeddings().size());
        for (float[] embedding : query.getEmbeddings()) {
            if (embedding == null || embedding.length == 0) {
                throw new IllegalArgumentException("Query embeddings must not be empty");
            }
            queries.add(EmbeddingCodec.normalize(embedding));
        }

        long start = System.currentTimeMillis();
        TierRead corpus = embeddingStore.readAll(owner);

        Map<String, PhotoMatch> best = new HashMap<>();
        int skippedFaces = 0;

        for (PhotoEmbeddingSet set : corpus.sets()) {
            for (FaceEmbedding face : set.getFaces()) {
                float[] stored = EmbeddingCodec.normalize(face.getVector());
                for (float[] q : queries) {
                    if (q.length != stored.length) {
                        skippedFaces++;
                        continue;
                    }
                    double score = EmbeddingCodec.dot(q, stored);
                    if (score < query.getThreshold()) {
                        continue;
                    }
                    PhotoMatch current = best.get(set.getPhotoReference());
                    if (current == null || score > current.score()) {
                        best.put(set.getPhotoReference(), new PhotoMatch(set.getPhotoReference(), score, face.getFaceIndex()));
                    }
                }
            }
        }

        List<PhotoMatch> matches = best.values().stream()
                .sorted(Comparator.comparingDouble(PhotoMatch::score).reversed()
                        .thenComparing(PhotoMatch::photoReference))
                .limit(query.isLimited() ? query.getLimit() : Long.MAX_VALUE)
                .toList();

        if (skippedFaces > 0) {
            log.debug("Ignored {} face/query pairs with mismatched dimension for {}", skippedFaces, owner);
        }
        log.info("Search for {}: {} matches over {} photos (threshold={}, source={}) in {} ms",
                owner, matches.size(), corpus.sets().size(), query.getThreshold(), corpus.source(),
                System.currentTimeMillis() - start);

        return new SearchResult(owner, query.getThreshold(), corpus.source(), corpus.sets().size(), matches);
    }
}
