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
package com.indra.minsait.dvsmart.faceindex.infrastructure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestTemplate;
import java.io.IOException;
import java.time.Clock;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 09:20:55
 * File: FaceIndexBeansConfig.java
 */

@Slf4j
@Configuration
@RequiredArgsConstructor
public class FaceIndexBeansConfig {

    private final FaceIndexProperties props;

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Reintentos de descarga: solo IOException, backoff fijo.
     */
    @Bean(name = "contentFetchRetryTemplate")
    RetryTemplate contentFetchRetryTemplate() {
        FaceIndexProperties.Cache cache = props.getCache();
        log.info("Content fetch retries: maxAttempts={}, backoff={} ms", cache.getMaxAttempts(), cache.getRetryBackoffMs());
        return RetryTemplate.builder()
                .maxAttempts(cache.getMaxAttempts())
                .fixedBackoff(cache.getRetryBackoffMs())
                .retryOn(IOException.class)
                .traversingCauses()
                .build();
    }

    @Bean(name = "embeddingEngineRestTemplate")
    RestTemplate embeddingEngineRestTemplate(RestTemplateBuilder builder) {
        FaceIndexProperties.Engine engine = props.getEngine();
        return builder
                .connectTimeout(engine.getConnectTimeout())
                .readTimeout(engine.getReadTimeout())
                .build();
    }
}
