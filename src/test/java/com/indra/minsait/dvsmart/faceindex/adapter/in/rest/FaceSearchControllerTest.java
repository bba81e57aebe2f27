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

import com.indra.minsait.dvsmart.faceindex.application.port.in.SearchFacesUseCase;
import com.indra.minsait.dvsmart.faceindex.domain.exception.NoFaceInQueryException;
import com.indra.minsait.dvsmart.faceindex.domain.model.PhotoMatch;
import com.indra.minsait.dvsmart.faceindex.domain.model.SearchResult;
import com.indra.minsait.dvsmart.faceindex.domain.model.StoreTier;
import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FaceSearchControllerTest {

    private MockMvc mockMvc;
    private final List<Object[]> calls = new ArrayList<>();

    @BeforeEach
    void setUp() {
        SearchFacesUseCase stub = new SearchFacesUseCase() {
            @Override
            public SearchResult search(String owner, List<float[]> embeddings, ThresholdTier tier, Double threshold, Integer limit) {
                calls.add(new Object[] {owner, embeddings, tier, threshold, limit});
                return new SearchResult(owner, threshold == null ? 0.6 : threshold, StoreTier.LOCAL, 3,
                        List.of(new PhotoMatch("album/beach.jpg", 0.95, 0), new PhotoMatch("album/party.jpg", 0.65, 1)));
            }

            @Override
            public SearchResult searchByImages(String owner, List<byte[]> images, ThresholdTier tier, Double threshold, Integer limit) {
                calls.add(new Object[] {owner, images, tier, threshold, limit});
                if (new String(images.get(0)).equals("landscape")) {
                    throw new NoFaceInQueryException("No face detected in the reference images");
                }
                return new SearchResult(owner, 0.7, StoreTier.LOCAL, 3, List.of(new PhotoMatch("album/beach.jpg", 0.95, 0)));
            }
        };
        mockMvc = MockMvcBuilders.standaloneSetup(new FaceSearchController(stub))
                .setControllerAdvice(new RestExceptionHandler())
                .build();
    }

    @Test
    void searchByEmbeddingsReturnsRankedMatches() throws Exception {
        mockMvc.perform(post("/api/face-search/alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"embeddings\": [[1.0, 0.0]], \"tier\": \"LOOSE\", \"limit\": 5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.owner").value("alice"))
                .andExpect(jsonPath("$.source").value("LOCAL"))
                .andExpect(jsonPath("$.matches[0].photoReference").value("album/beach.jpg"))
                .andExpect(jsonPath("$.matches[1].score").value(0.65));

        Object[] call = calls.get(0);
        assertEquals(ThresholdTier.LOOSE, call[2]);
        assertNull(call[3]);
        assertEquals(5, call[4]);
        @SuppressWarnings("unchecked")
        List<float[]> embeddings = (List<float[]>) call[1];
        assertArrayEquals(new float[] {1.0f, 0.0f}, embeddings.get(0));
    }

    @Test
    void emptyEmbeddingsAreRejected() throws Exception {
        mockMvc.perform(post("/api/face-search/alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"embeddings\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
        assertTrue(calls.isEmpty());
    }

    @Test
    void nonPositiveLimitIsRejected() throws Exception {
        mockMvc.perform(post("/api/face-search/alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"embeddings\": [[1.0]], \"limit\": 0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownTierIsRejected() throws Exception {
        mockMvc.perform(post("/api/face-search/alice")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"embeddings\": [[1.0]], \"tier\": \"HUGE\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void searchByUploadedImages() throws Exception {
        mockMvc.perform(multipart("/api/face-search/alice/images")
                        .file(new MockMultipartFile("images", "selfie.jpg", "image/jpeg", "selfie".getBytes()))
                        .param("tier", "STRICT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.matches.length()").value(1));

        assertEquals(ThresholdTier.STRICT, calls.get(0)[2]);
    }

    @Test
    void imagesWithoutFacesAreUnprocessable() throws Exception {
        mockMvc.perform(multipart("/api/face-search/alice/images")
                        .file(new MockMultipartFile("images", "landscape.jpg", "image/jpeg", "landscape".getBytes())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.message").value("No face detected in the reference images"));
    }

    @Test
    void missingImagesPartIsBadRequest() throws Exception {
        mockMvc.perform(multipart("/api/face-search/alice/images").param("tier", "STRICT"))
                .andExpect(status().isBadRequest());
    }
}
