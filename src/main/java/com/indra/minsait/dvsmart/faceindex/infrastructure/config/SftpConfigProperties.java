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

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 10:02:17
 * File: SftpConfigProperties.java
 */

/**
 * Origen SFTP de las fotos. Solo se usa con faceindex.source.type=sftp.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "sftp")
public class SftpConfigProperties {

    private Origin origin = new Origin();

    @Getter
    @Setter
    public static class Origin {
        private String host;
        private int port = 22;
        private String user;
        private String password;
        // Raíz bajo la que se resuelven los scopes
        private String baseDir = "/";
        private int timeout = 30000;
        private Pool pool = new Pool();
    }

    @Getter
    @Setter
    public static class Pool {
        private int maxSize = 8;
        private int initialSize = 0;
        private long maxWaitMillis = 30000;
        private boolean testOnBorrow = true;

        // Limpieza de sesiones inactivas
        private long timeBetweenEvictionRunsMillis = 60000;
        private long minEvictableIdleTimeMillis = 300000;
    }
}
