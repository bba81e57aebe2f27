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
package com.indra.minsait.dvsmart.faceindex.adapter.out.source;

import com.indra.minsait.dvsmart.faceindex.application.port.out.SourceListingPort;
import com.indra.minsait.dvsmart.faceindex.domain.exception.SourceListingException;
import com.indra.minsait.dvsmart.faceindex.domain.model.SourceFile;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.SftpConfigProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.sshd.sftp.client.SftpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.integration.file.remote.session.Session;
import org.springframework.integration.sftp.session.SftpRemoteFileTemplate;
import org.springframework.messaging.MessagingException;
import org.springframework.stereotype.Component;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 16-01-2026 at 14:40:25
 * File: SftpSourceListingAdapter.java
 */

/**
 * Origen de fotos en una carpeta compartida SFTP.
 *
 * El listado es un recorrido BFS dentro de una sola sesión del pool, limitado
 * en profundidad. La identidad de cada fichero es su path completo.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "faceindex.source", name = "type", havingValue = "sftp", matchIfMissing = true)
public class SftpSourceListingAdapter implements SourceListingPort {

    private final SftpRemoteFileTemplate sftpTemplate;
    private final String baseDir;
    private final int maxDepth;

    public SftpSourceListingAdapter(
            @Qualifier("sftpOriginTemplate") SftpRemoteFileTemplate sftpTemplate,
            SftpConfigProperties sftpProps,
            FaceIndexProperties props) {
        this.sftpTemplate = sftpTemplate;
        this.baseDir = sftpProps.getOrigin().getBaseDir();
        this.maxDepth = props.getProcessing().getMaxDepth();
    }

    @Override
    public List<SourceFile> list(String scope) {
        String root = resolveScope(scope);
        log.info("Listing SFTP folder: {} (max depth {})", root, maxDepth);

        try {
            // Una sola sesión para todo el escaneo
            List<SourceFile> files = sftpTemplate.execute(session -> scan(session, root));
            log.info("SFTP listing completed: {} files under {}", files.size(), root);
            return files;
        } catch (MessagingException e) {
            log.error("Failed to list SFTP folder {}", root, e);
            throw new SourceListingException("SFTP listing failed for " + root + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void download(SourceFile file, OutputStream target) throws IOException {
        try {
            boolean found = sftpTemplate.get(file.getId(), stream -> stream.transferTo(target));
            if (!found) {
                throw new IOException("Remote file not found: " + file.getId());
            }
        } catch (MessagingException e) {
            // Se relanza como IOException para que la caché reintente
            throw new IOException("SFTP download failed for " + file.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String sourceType() {
        return "sftp";
    }

    private List<SourceFile> scan(Session<SftpClient.DirEntry> session, String root) throws IOException {
        List<SourceFile> files = new ArrayList<>();
        Deque<String> toExplore = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        toExplore.add(root);
        depths.add(0);

        int dirCount = 0;

        while (!toExplore.isEmpty()) {
            String currentDir = toExplore.poll();
            int depth = depths.poll();
            dirCount++;

            for (SftpClient.DirEntry entry : session.list(currentDir)) {
                String name = entry.getFilename();

                if (".".equals(name) || "..".equals(name)) {
                    continue;
                }

                String fullPath = currentDir.endsWith("/")
                    ? currentDir + name
                    : currentDir + "/" + name;

                if (entry.getAttributes().isDirectory()) {
                    if (depth < maxDepth && !name.startsWith(".")) {
                        toExplore.add(fullPath);
                        depths.add(depth + 1);
                    }
                    continue;
                }

                files.add(SourceFile.builder()
                        .id(fullPath)
                        .fileName(name)
                        .size(entry.getAttributes().getSize())
                        .modificationTime(entry.getAttributes().getModifyTime().toMillis())
                        .build());
            }

            if (dirCount % 1000 == 0) {
                log.info("📂 Scanned {} directories, {} files so far...", dirCount, files.size());
            }
        }
        return files;
    }

    private String resolveScope(String scope) {
        String relative = scope.startsWith("/") ? scope.substring(1) : scope;
        for (String part : relative.split("/")) {
            if ("..".equals(part)) {
                throw new IllegalArgumentException("Scope must not escape the base directory: " + scope);
            }
        }
        if (relative.isEmpty() || ".".equals(relative)) {
            return baseDir;
        }
        return baseDir.endsWith("/") ? baseDir + relative : baseDir + "/" + relative;
    }
}
