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

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import javax.sql.DataSource;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 24-12-2025 at 13:44:48
 * File: LocalTierDataSourceConfiguration.java
 */

/**
 * Configuración de DataSources.
 *
 * - PRIMARY: H2 en fichero (nivel local de embeddings, índice de caché, huellas de carpeta)
 * - MongoDB: nivel remoto, configurado automáticamente por Spring Boot
 */
@Configuration
public class LocalTierDataSourceConfiguration {

    @Bean
    @Primary
    @ConfigurationProperties("faceindex.local-store.datasource")
    DataSourceProperties localTierDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    @ConfigurationProperties("faceindex.local-store.datasource.hikari")
    DataSource localTierDataSource() {
        return localTierDataSourceProperties()
            .initializeDataSourceBuilder()
            .type(HikariDataSource.class)
            .build();
    }
}
