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

import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoMatch;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchQuery;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchResult;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreTier;
import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import com.indra.minsait.dvsmart.faceindex.support.EmbeddingSets;
import com.indra.minsait.dvsmart.faceindex.support.FaceIndexTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.indra.minsait.dvsmart.faceindex.support.Vectors.QUERY;
import static com.indra.minsait.dvsmart.faceindex.support.Vectors.withSimilarity;
import static org.junit.jupiter.api.Assertions.*;

class SimilaritySearchServiceTest {

    @TempDir
    Path cacheDir;

    private FaceIndexTestHarness harness;

    @BeforeEach
    void setUp() {
        harness = new FaceIndexTestHarness(cacheDir);
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    private SearchResult search(ThresholdTier tier, Integer limit) {
        return harness.searchService.search("alice", SearchQuery.builder()
                .embeddings(List.of(QUERY))
                .threshold(harness.thresholdPolicy.resolve(tier, null))
                .limit(limit)
                .build());
    }

    private SearchResult searchRaw(double threshold) {
        return harness.searchService.search("alice", SearchQuery.builder()
                .embeddings(List.of(QUERY))
                .threshold(threshold)
                .build());
    }

    private static Set<String> references(SearchResult result) {
        return result.matches().stream().map(PhotoMatch::photoReference).collect(Collectors.toSet());
    }

    private void storeThreePhotos() {
        harness.embeddingStore.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.95)), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "p2", withSimilarity(0.65)), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "p3", withSimilarity(0.40)), true);
    }

    @Test
    void tiersSelectExpectedPhotos() {
        storeThreePhotos();

        assertEquals(Set.of("p1"), references(search(ThresholdTier.STRICT, null)));
        assertEquals(Set.of("p1", "p2"), references(search(ThresholdTier.STANDARD, null)));
        assertEquals(Set.of("p1", "p2"), references(search(ThresholdTier.LOOSE, null)));

        SearchResult standard = search(ThresholdTier.STANDARD, null);
        assertEquals("p1", standard.matches().get(0).photoReference());
        assertEquals(0.95, standard.matches().get(0).score(), 1e-5);
        assertEquals(3, standard.photosScanned());
        assertEquals(StoreTier.LOCAL, standard.source());
    }

    @Test
    void standardTierReturnsMatchingPhotosInScoreOrder() {
        harness.embeddingStore.put(EmbeddingSets.of("alice", "close", withSimilarity(0.9)), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "similar", withSimilarity(0.7)), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "stranger", withSimilarity(0.3)), true);

        List<PhotoMatch> matches = search(ThresholdTier.STANDARD, null).matches();

        assertEquals(2, matches.size());
        assertEquals(List.of("close", "similar"), matches.stream().map(PhotoMatch::photoReference).toList());
        assertEquals(0.9, matches.get(0).score(), 1e-5);
        assertEquals(0.7, matches.get(1).score(), 1e-5);
    }

    @Test
    void loweringThresholdNeverDropsMatches() {
        storeThreePhotos();
        harness.embeddingStore.put(EmbeddingSets.of("alice", "p4", withSimilarity(0.55)), true);

        Set<String> strict = references(search(ThresholdTier.STRICT, null));
        Set<String> standard = references(search(ThresholdTier.STANDARD, null));
        Set<String> loose = references(search(ThresholdTier.LOOSE, null));

        assertTrue(standard.containsAll(strict));
        assertTrue(loose.containsAll(standard));
        assertTrue(loose.contains("p4"));
    }

    @Test
    void photoWithSeveralMatchingFacesAppearsOnceWithBestScore() {
        harness.embeddingStore.put(EmbeddingSets.of("alice", "group",
                withSimilarity(0.72), withSimilarity(0.91), withSimilarity(0.30)), true);

        SearchResult result = search(ThresholdTier.STANDARD, null);

        assertEquals(1, result.size());
        PhotoMatch match = result.matches().get(0);
        assertEquals("group", match.photoReference());
        assertEquals(0.91, match.score(), 1e-5);
        assertEquals(1, match.faceIndex());
    }

    @Test
    void severalQueriesKeepBestScorePerPhoto() {
        harness.embeddingStore.put(EmbeddingSets.of("alice", "p1", new float[] {0f, 1f}), true);

        SearchResult result = harness.searchService.search("alice", SearchQuery.builder()
                .embeddings(List.of(QUERY, new float[] {0f, 2f}))
                .threshold(0.6)
                .build());

        assertEquals(1, result.size());
        assertEquals(1.0, result.matches().get(0).score(), 1e-6);
    }

    @Test
    void thresholdIsInclusive() {
        harness.embeddingStore.put(EmbeddingSets.of("alice", "exact", new float[] {1f, 0f}), true);

        assertEquals(Set.of("exact"), references(searchRaw(1.0)));
    }

    @Test
    void limitCutsRankedList() {
        storeThreePhotos();
        harness.embeddingStore.put(EmbeddingSets.of("alice", "p0", withSimilarity(0.99)), true);

        SearchResult result = search(ThresholdTier.LOOSE, 2);

        assertEquals(List.of("p0", "p1"), result.matches().stream().map(PhotoMatch::photoReference).toList());
    }

    @Test
    void facelessPhotosAndOtherDimensionsAreIgnored() {
        harness.embeddingStore.put(EmbeddingSets.of("alice", "landscape"), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "other-model", new float[] {1f, 0f, 0f}), true);
        harness.embeddingStore.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.8)), true);

        SearchResult result = search(ThresholdTier.STANDARD, null);

        assertEquals(Set.of("p1"), references(result));
        assertEquals(3, result.photosScanned());
    }

    @Test
    void ownersDoNotSeeEachOther() {
        harness.embeddingStore.put(EmbeddingSets.of("bob", "bob-photo", withSimilarity(0.99)), true);

        assertTrue(search(ThresholdTier.LOOSE, null).matches().isEmpty());
    }

    @Test
    void emptyLocalTierFallsBackToRemoteAndWarmsLocal() {
        harness.remoteStore.seed(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)).withRemoteSynced(true));

        SearchResult first = search(ThresholdTier.STANDARD, null);
        assertEquals(StoreTier.REMOTE, first.source());
        assertEquals(Set.of("p1"), references(first));

        SearchResult second = search(ThresholdTier.STANDARD, null);
        assertEquals(StoreTier.LOCAL, second.source());
        assertEquals(Set.of("p1"), references(second));
    }

    @Test
    void remoteOutageWithEmptyLocalGivesEmptyResult() {
        harness.remoteStore.setAvailable(false);

        SearchResult result = search(ThresholdTier.STANDARD, null);
        assertTrue(result.matches().isEmpty());
        assertEquals(0, result.photosScanned());
    }

    @Test
    void emptyQueryIsRejected() {
        SearchQuery empty = SearchQuery.builder().embeddings(List.of()).threshold(0.6).build();
        assertThrows(IllegalArgumentException.class, () -> harness.searchService.search("alice", empty));
    }
}
