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
package com.indra.minsait.dvsmart.faceindex.infrastructure.sftp;

import com.indra.minsait.dvsmart.faceindex.infrastructure.config.SftpConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.sftp.client.SftpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.integration.sftp.session.DefaultSftpSessionFactory;
import org.springframework.integration.sftp.session.SftpRemoteFileTemplate;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 10:51:36
 * File: SftpSessionFactoryConfig.java
 */

/**
 * Beans del origen SFTP. Inactivos cuando las fotos vienen de una carpeta local.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "faceindex.source", name = "type", havingValue = "sftp", matchIfMissing = true)
public class SftpSessionFactoryConfig {

    @Bean(destroyMethod = "destroy")
    PooledSourceSessionFactory sftpOriginSessionFactory(SftpConfigProperties props) {
        SftpConfigProperties.Origin origin = props.getOrigin();

        DefaultSftpSessionFactory base = new DefaultSftpSessionFactory(true);
        base.setHost(origin.getHost());
        base.setPort(origin.getPort());
        base.setUser(origin.getUser());
        base.setPassword(origin.getPassword());
        base.setTimeout(origin.getTimeout());
        base.setAllowUnknownKeys(true);

        log.info("SFTP photo source: {}@{}:{}{}", origin.getUser(), origin.getHost(), origin.getPort(), origin.getBaseDir());
        return new PooledSourceSessionFactory(base, origin.getBaseDir(), origin.getPool());
    }

    @Bean(name = "sftpOriginTemplate")
    SftpRemoteFileTemplate sftpOriginTemplate(PooledSourceSessionFactory sftpOriginSessionFactory) {
        return new SftpRemoteFileTemplate(sftpOriginSessionFactory);
    }

    @Bean
    SftpPoolMonitor sftpPoolMonitor(PooledSourceSessionFactory sftpOriginSessionFactory) {
        return new SftpPoolMonitor(sftpOriginSessionFactory);
    }
}
