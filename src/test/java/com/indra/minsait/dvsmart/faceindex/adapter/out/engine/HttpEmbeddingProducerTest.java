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
package com.indra.minsait.dvsmart.faceindex.adapter.out.engine;

import com.indra.minsait.dvsmart.faceindex.domain.exception.EmbeddingProducerException;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpEmbeddingProducerTest {

    private static final String URL = "http://engine.test:8001/v1/faces/embeddings";

    private MockRestServiceServer server;
    private HttpEmbeddingProducer producer;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        FaceIndexProperties props = new FaceIndexProperties();
        props.getEngine().setBaseUrl("http://engine.test:8001");
        props.getEngine().setModelVersion("configured-model");
        producer = new HttpEmbeddingProducer(restTemplate, props);
    }

    @Test
    void postsImageBytesAndParsesFaces() {
        byte[] image = {1, 2, 3};
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Content-Type", MediaType.APPLICATION_OCTET_STREAM_VALUE))
                .andExpect(content().bytes(image))
                .andRespond(withSuccess("""
                        {"model": "arcface-r100", "faces": [
                          {"embedding": [0.1, 0.2, 0.3], "score": 0.99},
                          {"embedding": [0.4, 0.5, 0.6], "score": 0.87}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<float[]> faces = producer.detectAndEmbed(image);

        assertEquals(2, faces.size());
        assertArrayEquals(new float[] {0.4f, 0.5f, 0.6f}, faces.get(1));
        assertEquals("arcface-r100", producer.modelVersion());
        server.verify();
    }

    @Test
    void noFacesIsAnEmptyList() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"faces\": []}", MediaType.APPLICATION_JSON));

        assertTrue(producer.detectAndEmbed(new byte[] {9}).isEmpty());
        assertEquals("configured-model", producer.modelVersion());
    }

    @Test
    void engineErrorIsTranslated() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThrows(EmbeddingProducerException.class, () -> producer.detectAndEmbed(new byte[] {1}));
    }

    @Test
    void faceWithoutEmbeddingIsRejected() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("{\"faces\": [{\"score\": 0.5}]}", MediaType.APPLICATION_JSON));

        assertThrows(EmbeddingProducerException.class, () -> producer.detectAndEmbed(new byte[] {1}));
    }
}
