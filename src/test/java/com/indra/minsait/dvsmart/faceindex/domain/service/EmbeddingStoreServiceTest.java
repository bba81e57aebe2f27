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

import com.indra.minsait.dvsmart.faceindex.domain.exception.LocalStoreException;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoEmbeddingSet;
import com.indra.minsait.dvsmart.faceindex.domain.model.ReconciliationReport;
import com.indra.minsait.dvsmart.faceindex.domain.model.StorePut;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreStats;
import com.indra.minsait.dvsmart.faceindex.support.EmbeddingSets;
import com.indra.minsait.dvsmart.faceindex.support.FaceIndexTestHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static com.indra.minsait.dvsmart.faceindex.support.Vectors.withSimilarity;
import static org.junit.jupiter.api.Assertions.*;

class EmbeddingStoreServiceTest {

    @TempDir
    Path cacheDir;

    private FaceIndexTestHarness harness;
    private EmbeddingStoreService store;

    @BeforeEach
    void setUp() {
        harness = new FaceIndexTestHarness(cacheDir);
        store = harness.embeddingStore;
    }

    @AfterEach
    void tearDown() {
        harness.close();
    }

    @Test
    void putWritesBothTiers() {
        StorePut put = store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);

        assertTrue(put.written());
        assertTrue(put.remoteSynced());
        assertEquals(1, harness.remoteStore.size("alice"));
        assertTrue(harness.localStore.find("alice", "p1").orElseThrow().isRemoteSynced());
        assertEquals(0, store.stats("alice").pendingRemoteSync());
    }

    @Test
    void remoteFailureIsNotFatalAndLeavesSetPending() {
        harness.remoteStore.setAvailable(false);

        StorePut put = store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);

        assertTrue(put.written());
        assertFalse(put.remoteSynced());
        assertTrue(store.exists("alice", "p1"));
        assertEquals(1, store.stats("alice").pendingRemoteSync());
    }

    @Test
    void reconciliationPushesPendingSetsOnceRemoteIsBack() {
        harness.remoteStore.setAvailable(false);
        store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);
        store.put(EmbeddingSets.of("alice", "p2"), false);

        ReconciliationReport whileDown = store.reconcile(10);
        assertEquals(2, whileDown.pending());
        assertEquals(0, whileDown.pushed());
        assertEquals(2, whileDown.failed());

        harness.remoteStore.setAvailable(true);
        ReconciliationReport report = store.reconcile(10);

        assertEquals(2, report.pushed());
        assertEquals(0, report.failed());
        assertEquals(2, harness.remoteStore.size("alice"));
        assertEquals(0, store.stats("alice").pendingRemoteSync());
        assertEquals(0, store.reconcile(10).pending());
    }

    @Test
    void setReplacedDuringReconciliationStaysPending() {
        harness.remoteStore.setAvailable(false);
        store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);
        harness.remoteStore.setAvailable(true);

        PhotoEmbeddingSet newer = EmbeddingSets.at(EmbeddingSets.STORED_AT.plusSeconds(60), "alice", "p1",
                withSimilarity(0.9), withSimilarity(0.8), withSimilarity(0.7));
        harness.remoteStore.beforeWrite(set -> {
            if (set.getFaceCount() == 1) {
                harness.localStore.replace(newer);
            }
        });

        ReconciliationReport report = store.reconcile(10);

        assertEquals(1, report.pending());
        assertEquals(3, harness.localStore.find("alice", "p1").orElseThrow().getFaceCount());
        assertEquals(1, harness.remoteStore.stored("alice", "p1").orElseThrow().getFaceCount());
        assertEquals(1, store.stats("alice").pendingRemoteSync());

        harness.remoteStore.beforeWrite(set -> { });
        store.reconcile(10);

        assertEquals(3, harness.remoteStore.stored("alice", "p1").orElseThrow().getFaceCount());
        assertEquals(0, store.stats("alice").pendingRemoteSync());
    }

    @Test
    void olderSetNeverOverwritesNewerRemoteVersion() {
        PhotoEmbeddingSet newer = EmbeddingSets.at(EmbeddingSets.STORED_AT.plusSeconds(60), "alice", "p1",
                withSimilarity(0.9), withSimilarity(0.8));
        harness.remoteStore.beforeWrite(set -> {
            if (set.getFaceCount() == 1) {
                store.put(newer, true);
            }
        });

        store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);

        assertEquals(2, harness.localStore.find("alice", "p1").orElseThrow().getFaceCount());
        assertEquals(2, harness.remoteStore.stored("alice", "p1").orElseThrow().getFaceCount());
        assertEquals(0, store.stats("alice").pendingRemoteSync());
    }

    @Test
    void existingSetIsKeptUnlessReplaceIsRequested() {
        store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);

        StorePut second = store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.1), withSimilarity(0.2)), false);
        assertSame(StorePut.UNCHANGED, second);
        assertEquals(1, store.get("alice", "p1").orElseThrow().getFaceCount());

        store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.1), withSimilarity(0.2)), true);
        assertEquals(2, store.get("alice", "p1").orElseThrow().getFaceCount());
    }

    @Test
    void replaceNeverDuplicatesFaces() {
        PhotoEmbeddingSet set = EmbeddingSets.of("alice", "p1", withSimilarity(0.9), withSimilarity(0.8));
        store.put(set, true);
        store.put(set, true);
        store.put(set, true);

        StoreStats stats = store.stats("alice");
        assertEquals(1, stats.photos());
        assertEquals(2, stats.faces());
    }

    @Test
    void facelessPhotoCountsAsAlreadyProcessed() {
        store.put(EmbeddingSets.of("alice", "landscape"), false);

        assertTrue(store.exists("alice", "landscape"));
        assertTrue(store.get("alice", "landscape").orElseThrow().isFaceless());
        assertEquals(1, store.stats("alice").facelessPhotos());
    }

    @Test
    void remoteOnlySetIsFoundAndBackfilled() {
        harness.remoteStore.seed(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)).withRemoteSynced(true));

        assertTrue(store.exists("alice", "p1"));
        assertTrue(harness.localStore.exists("alice", "p1"));
        assertEquals(0, store.stats("alice").pendingRemoteSync());
    }

    @Test
    void deleteRemovesFromBothTiers() {
        store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);

        assertTrue(store.delete("alice", "p1"));

        assertFalse(store.exists("alice", "p1"));
        assertEquals(0, harness.remoteStore.size("alice"));
        assertFalse(store.delete("alice", "p1"));
    }

    @Test
    void localWriteFailureIsPropagated() {
        harness.localStore.rejectWritesOf("p1");

        assertThrows(LocalStoreException.class,
                () -> store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false));
        assertEquals(0, harness.remoteStore.size("alice"));
    }

    @Test
    void readAllPrefersLocalTier() {
        store.put(EmbeddingSets.of("alice", "p1", withSimilarity(0.9)), false);
        harness.remoteStore.seed(EmbeddingSets.of("alice", "remote-only", withSimilarity(0.9)));

        assertEquals(1, store.getAll("alice").size());
    }
}
