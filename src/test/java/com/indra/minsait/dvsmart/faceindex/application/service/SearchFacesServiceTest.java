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

import com.indra.minsait.dvsmart.faceindex.domain.exception.NoFaceInQueryException;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoMatch;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchResult;
import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import com.indra.minsait.dvsmart.faceindex.support.EmbeddingSets;
import com.indra.minsait.dvsmart.faceindex.support.FaceIndexTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static com.indra.minsait.dvsmart.faceindex.support.Vectors.QUERY;
import static com.indra.minsait.dvsmart.faceindex.support.Vectors.withSimilarity;
import static org.junit.jupiter.api.Assertions.*;

class SearchFacesServiceTest {

    @TempDir
    Path cacheDir;

    private FaceIndexTestHarness harness;
    private SearchFacesService service;

    @BeforeEach
    void setUp() {
        harness = new FaceIndexTestHarness(cacheDir);
        service = new SearchFacesService(harness.searchService, harness.thresholdPolicy, harness.engine);

        harness.embeddingStore.put(EmbeddingSets.of("alice", "beach.jpg", withSimilarity(0.95)), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "party.jpg", withSimilarity(0.65)), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "crowd.jpg", withSimilarity(0.40)), true);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private static List<String> references(SearchResult result) {
        return result.matches().stream().map(PhotoMatch::photoReference).toList();
    }

    @Test
    void tierDefaultsToStandard() {
        SearchResult result = service.search("alice", List.of(QUERY), null, null, null);

        assertEquals(0.60, result.threshold(), 1e-9);
        assertEquals(List.of("beach.jpg", "party.jpg"), references(result));
    }

    @Test
    void explicitThresholdWinsOverTier() {
        SearchResult result = service.search("alice", List.of(QUERY), ThresholdTier.STRICT, 0.3, null);

        assertEquals(0.3, result.threshold(), 1e-9);
        assertEquals(3, result.size());
    }

    @Test
    void limitKeepsBestMatches() {
        SearchResult result = service.search("alice", List.of(QUERY), ThresholdTier.LOOSE, null, 1);

        assertEquals(List.of("beach.jpg"), references(result));
    }

    @Test
    void nonPositiveLimitIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.search("alice", List.of(QUERY), null, null, 0));
    }

    @Test
    void outOfRangeThresholdIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> service.search("alice", List.of(QUERY), null, 1.5, null));
    }

    @Test
    void referenceImagesAreEmbeddedBeforeSearching() {
        harness.engine.faces("selfie", QUERY);

        SearchResult result = service.searchByImages("alice",
                List.of("selfie".getBytes(StandardCharsets.UTF_8)), ThresholdTier.STRICT, null, null);

        assertEquals(List.of("beach.jpg"), references(result));
        assertEquals(1, harness.engine.callCount());
    }

    @Test
    void everyFaceInReferenceImagesIsAQuery() {
        harness.engine.faces("group", withSimilarity(0.0), QUERY);
        harness.engine.faces("landscape");

        SearchResult result = service.searchByImages("alice",
                List.of("group".getBytes(StandardCharsets.UTF_8), "landscape".getBytes(StandardCharsets.UTF_8)),
                ThresholdTier.STANDARD, null, null);

        assertEquals(List.of("beach.jpg", "party.jpg"), references(result));
    }

    @Test
    void referenceImagesWithoutFacesFail() {
        harness.engine.faces("landscape");

        assertThrows(NoFaceInQueryException.class, () -> service.searchByImages("alice",
                List.of("landscape".getBytes(StandardCharsets.UTF_8)), null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> service.searchByImages("alice", List.of(), null, null, null));
    }
}
