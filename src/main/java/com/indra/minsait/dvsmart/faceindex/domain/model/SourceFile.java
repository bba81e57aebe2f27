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

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 08-01-2026 at 10:12:41
 * File: SourceFile.java
 */

/**
 * Fichero observado en el origen (carpeta compartida SFTP o carpeta local).
 * Inmutable; se vuelve a observar en cada ejecución para detectar cambios.
 */
@Value
@Builder
public class SourceFile {
    String id;                  // Identidad estable en el origen (path completo)
    String fileName;            // Nombre visible (IMG_0001.jpg)
    long size;                  // Tamaño en bytes
    long modificationTime;      // Unix timestamp (millis)

    public String getExtension() {
        if (fileName == null || fileName.lastIndexOf('.') < 0) {
            return "";
        }
        return fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase();
    }
}
