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

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-01-2026 at 09:30:18
 * File: FaceIndexProperties.java
 */

@Getter
@Setter
@ConfigurationProperties(prefix = "faceindex")
public class FaceIndexProperties {

    private Cache cache = new Cache();
    private Processing processing = new Processing();
    private Search search = new Search();
    private Reconciliation reconciliation = new Reconciliation();
    private Engine engine = new Engine();
    private Source source = new Source();
    private Stream stream = new Stream();

    @Getter
    @Setter
    public static class Cache {
        private String baseDir = "storage/cache";
        // Reintentos de descarga (IOException)
        private int maxAttempts = 3;
        private long retryBackoffMs = 500;
    }

    @Getter
    @Setter
    public static class Processing {
        // Fotos en vuelo a la vez dentro de un job
        private int concurrency = 4;
        private Duration itemTimeout = Duration.ofSeconds(120);
        private int queueCapacity = 100;
        private int etaWindow = 20;
        private int maxDepth = 10;
        private List<String> imageExtensions = new ArrayList<>(List.of("jpg", "jpeg", "png", "webp", "heic", "heif"));
        // Tiempo máximo que se mantiene el lock de propietario si la instancia muere
        private Duration lockAtMostFor = Duration.ofHours(6);
    }

    @Getter
    @Setter
    public static class Search {
        private double strict = 0.70;
        private double standard = 0.60;
        private double loose = 0.50;
        private boolean warmLocalOnFallback = true;
    }

    @Getter
    @Setter
    public static class Reconciliation {
        private boolean enabled = true;
        private int batchSize = 200;
        private long intervalMs = 300000;
    }

    @Getter
    @Setter
    public static class Engine {
        private String baseUrl = "http://localhost:8001";
        private String embedPath = "/v1/faces/embeddings";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
        // Versión por defecto si el motor no la informa
        private String modelVersion = "unknown";
    }

    @Getter
    @Setter
    public static class Source {
        private String type = "sftp";
        private Local local = new Local();
    }

    @Getter
    @Setter
    public static class Local {
        private String rootDir = "storage/photos";
    }

    @Getter
    @Setter
    public static class Stream {
        private Duration interval = Duration.ofSeconds(1);
        private Duration timeout = Duration.ofHours(1);
    }
}
