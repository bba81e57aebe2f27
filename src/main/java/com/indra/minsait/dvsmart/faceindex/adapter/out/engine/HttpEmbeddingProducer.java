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

import com.indra.minsait.dvsmart.faceindex.application.port.out.EmbeddingProducer;
import com.indra.minsait.dvsmart.faceindex.domain.exception.EmbeddingProducerException;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import java.util.ArrayList;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 18-01-2026 at 12:20:36
 * File: HttpEmbeddingProducer.java
 */

/**
 * Cliente HTTP del motor de reconocimiento facial.
 *
 * POST {base-url}{embed-path} con la imagen como application/octet-stream.
 * Respuesta:
 * {
 *   "model": "arcface-r100",
 *   "faces": [ { "embedding": [0.12, -0.03, ...], "score": 0.99 } ]
 * }
 */
@Slf4j
@Component
public class HttpEmbeddingProducer implements EmbeddingProducer {

    private final RestTemplate restTemplate;
    private final String embedUrl;
    private volatile String modelVersion;

    public HttpEmbeddingProducer(
            @Qualifier("embeddingEngineRestTemplate") RestTemplate restTemplate,
            FaceIndexProperties props) {
        this.restTemplate = restTemplate;
        this.embedUrl = props.getEngine().getBaseUrl() + props.getEngine().getEmbedPath();
        this.modelVersion = props.getEngine().getModelVersion();
        log.info("Embedding engine endpoint: {}", embedUrl);
    }

    @Override
    public List<float[]> detectAndEmbed(byte[] imageBytes) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<EngineResponse> response;
        try {
            response = restTemplate.exchange(embedUrl, HttpMethod.POST,
                    new HttpEntity<>(imageBytes, headers), EngineResponse.class);
        } catch (RestClientException e) {
            throw new EmbeddingProducerException("Embedding engine call failed: " + e.getMessage(), e);
        }

        EngineResponse body = response.getBody();
        if (body == null) {
            throw new EmbeddingProducerException("Embedding engine returned an empty body");
        }
        if (body.model() != null && !body.model().equals(modelVersion)) {
            log.info("Embedding engine model: {}", body.model());
            modelVersion = body.model();
        }

        List<float[]> vectors = new ArrayList<>();
        if (body.faces() != null) {
            for (EngineFace face : body.faces()) {
                if (face.embedding() == null || face.embedding().length == 0) {
                    throw new EmbeddingProducerException("Embedding engine returned a face without embedding");
                }
                vectors.add(face.embedding());
            }
        }
        return vectors;
    }

    @Override
    public String modelVersion() {
        return modelVersion;
    }

    public record EngineResponse(String model, List<EngineFace> faces) {}

    public record EngineFace(float[] embedding, Double score) {}
}
