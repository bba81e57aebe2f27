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
package com.indra.minsait.dvsmart.faceindex.domain.model;

import lombok.Builder;
import lombok.Value;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 08-01-2026 at 10:20:05
 * File: CacheEntry.java
 */

/**
 * Copia local completa de un fichero del origen.
 * Solo se registra cuando el fichero ya está escrito completo en disco.
 */
@Value
@Builder
public class CacheEntry {
    String owner;
    String scope;
    String fileId;
    String localPath;
    long sizeBytes;
    long modificationTime;      // Marca de modificación observada al descargar
    Instant cachedAt;

    public Path path() {
        return Path.of(localPath);
    }

    /**
     * Indica si la entrada corresponde a la misma versión del fichero en el origen.
     */
    public boolean matches(SourceFile file) {
        return sizeBytes == file.getSize() && modificationTime == file.getModificationTime();
    }
}
