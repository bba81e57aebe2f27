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
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.stream.Stream;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 16-01-2026 at 16:05:12
 * File: LocalFolderSourceListingAdapter.java
 */

/**
 * Origen de fotos en una carpeta del sistema de ficheros local (montaje NFS/SMB).
 * La identidad de cada fichero es su ruta relativa a {@code root-dir}, con '/'.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "faceindex.source", name = "type", havingValue = "local")
public class LocalFolderSourceListingAdapter implements SourceListingPort {

    private final Path rootDir;
    private final int maxDepth;

    public LocalFolderSourceListingAdapter(FaceIndexProperties props) {
        this.rootDir = Path.of(props.getSource().getLocal().getRootDir()).toAbsolutePath().normalize();
        this.maxDepth = props.getProcessing().getMaxDepth();
        log.info("Local folder source configured at {}", rootDir);
    }

    @Override
    public List<SourceFile> list(String scope) {
        Path folder = resolve(scope);
        if (!Files.isDirectory(folder)) {
            throw new SourceListingException("Folder not found: " + scope);
        }

        // maxDepth cuenta directorios; los ficheros del último nivel están un nivel más abajo
        try (Stream<Path> paths = Files.walk(folder, maxDepth + 1)) {
            List<SourceFile> files = paths
                    .filter(Files::isRegularFile)
                    .filter(path -> !isInsideHiddenDir(folder, path))
                    .map(this::toSourceFile)
                    .toList();
            log.info("Local listing completed: {} files under {}", files.size(), folder);
            return files;
        } catch (IOException | UncheckedIOException e) {
            log.error("Failed to list local folder {}", folder, e);
            throw new SourceListingException("Local listing failed for " + scope + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void download(SourceFile file, OutputStream target) throws IOException {
        Path path = resolve(file.getId());
        Files.copy(path, target);
    }

    @Override
    public String sourceType() {
        return "local";
    }

    private SourceFile toSourceFile(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            return SourceFile.builder()
                    .id(rootDir.relativize(path).toString().replace('\\', '/'))
                    .fileName(path.getFileName().toString())
                    .size(attrs.size())
                    .modificationTime(attrs.lastModifiedTime().toMillis())
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private boolean isInsideHiddenDir(Path folder, Path file) {
        Path relative = folder.relativize(file.getParent() == null ? folder : file.getParent());
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Resuelve una ruta relativa a la raíz sin permitir salir de ella.
     */
    private Path resolve(String relative) {
        String cleaned = relative.startsWith("/") ? relative.substring(1) : relative;
        Path resolved = rootDir.resolve(cleaned).normalize();
        if (!resolved.startsWith(rootDir)) {
            throw new IllegalArgumentException("Path must not escape the source root: " + relative);
        }
        return resolved;
    }
}
