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

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.sshd.sftp.client.SftpClient;
import org.springframework.integration.file.remote.session.Session;
import org.springframework.integration.file.remote.session.SessionFactory;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 10:11:40
 * File: SftpSessionPooledObjectFactory.java
 */

/**
 * Ciclo de vida de las sesiones SFTP del pool de origen.
 * La validación lista el directorio raíz de fotos para descartar sesiones muertas.
 */
@Slf4j
public class SftpSessionPooledObjectFactory extends BasePooledObjectFactory<Session<SftpClient.DirEntry>> {

    private final SessionFactory<SftpClient.DirEntry> targetFactory;
    private final String probePath;

    public SftpSessionPooledObjectFactory(SessionFactory<SftpClient.DirEntry> targetFactory, String probePath) {
        this.targetFactory = targetFactory;
        this.probePath = probePath;
    }

    @Override
    public Session<SftpClient.DirEntry> create() {
        Session<SftpClient.DirEntry> session = targetFactory.getSession();
        if (!session.isOpen()) {
            throw new IllegalStateException("New SFTP session is not open");
        }
        log.debug("Opened SFTP session to {}", session.getHostPort());
        return session;
    }

    @Override
    public PooledObject<Session<SftpClient.DirEntry>> wrap(Session<SftpClient.DirEntry> session) {
        return new DefaultPooledObject<>(session);
    }

    @Override
    public boolean validateObject(PooledObject<Session<SftpClient.DirEntry>> p) {
        Session<SftpClient.DirEntry> session = p.getObject();
        if (!session.isOpen()) {
            return false;
        }
        try {
            session.exists(probePath);
            return true;
        } catch (Exception e) {
            log.warn("Discarding SFTP session {}: {}", session.getHostPort(), e.getMessage());
            return false;
        }
    }

    @Override
    public void activateObject(PooledObject<Session<SftpClient.DirEntry>> p) {
        if (!p.getObject().isOpen()) {
            throw new IllegalStateException("SFTP session closed while idle");
        }
    }

    @Override
    public void destroyObject(PooledObject<Session<SftpClient.DirEntry>> p) {
        Session<SftpClient.DirEntry> session = p.getObject();
        if (session != null && session.isOpen()) {
            log.debug("Closing SFTP session to {}", session.getHostPort());
            session.close();
        }
    }
}
