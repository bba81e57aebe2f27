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
package com.indra.minsait.dvsmart.faceindex.domain.service;

import com.indra.minsait.dvsmart.faceindex.domain.model.SourceFile;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 16-01-2026 at 10:11:03
 * File: SourceFileMetadataService.java
 */

/**
 * Servicio de dominio sobre la metadata de los ficheros del origen:
 * filtrado de imágenes, identidad de la foto y huella del listado.
 */
@Slf4j
@Service
public class SourceFileMetadataService {

    private final Set<String> imageExtensions;

    public SourceFileMetadataService(FaceIndexProperties props) {
        this.imageExtensions = props.getProcessing().getImageExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Indica si el fichero es una imagen que debe pasar por el motor.
     */
    public boolean isProcessable(SourceFile file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }

        String name = file.getFileName();

        // Ocultos
        if (name.startsWith(".")) {
            log.trace("Skipping hidden file: {}", name);
            return false;
        }

        if (isTemporaryFile(name)) {
            log.trace("Skipping temporary file: {}", name);
            return false;
        }

        if (file.getSize() <= 0) {
            log.debug("Skipping empty file: {}", file.getId());
            return false;
        }

        if (!imageExtensions.contains(file.getExtension())) {
            log.trace("Skipping non-image file: {}", name);
            return false;
        }
        return true;
    }

    public List<SourceFile> filterProcessable(List<SourceFile> files) {
        return files.stream().filter(this::isProcessable).toList();
    }

    /**
     * Referencia de la foto en el almacén de embeddings: la identidad estable del fichero.
     */
    public String photoReference(SourceFile file) {
        return file.getId();
    }

    /**
     * Nombre del fichero en la caché local: SHA-256 de la identidad + extensión.
     */
    public String cacheFileName(SourceFile file) {
        String extension = file.getExtension();
        String hash = generateIdUnico(file.getId());
        return extension.isEmpty() ? hash : hash + "." + extension;
    }

    /**
     * Huella del listado: SHA-256 sobre id, nombre, tamaño y fecha de cada fichero,
     * ordenados por id. Cualquier alta, baja o cambio produce otra huella.
     */
    public String fingerprint(List<SourceFile> files) {
        String canonical = files.stream()
                .sorted(Comparator.comparing(SourceFile::getId))
                .map(f -> f.getId() + "|" + f.getFileName() + "|" + f.getSize() + "|" + f.getModificationTime())
                .collect(Collectors.joining("\n"));
        return generateIdUnico(canonical);
    }

    /**
     * Genera un ID único usando SHA-256 (hex).
     */
    public String generateIdUnico(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 algorithm not available", e);
            throw new RuntimeException("Failed to generate unique ID", e);
        }
    }

    private boolean isTemporaryFile(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return lower.endsWith(".tmp")
            || lower.endsWith(".temp")
            || lower.endsWith(".part")
            || lower.endsWith(".bak")
            || lower.endsWith("~")
            || lower.startsWith("~$");
    }

    private String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
