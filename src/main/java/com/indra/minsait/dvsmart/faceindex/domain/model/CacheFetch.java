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

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 14-01-2026 at 10:02:37
 * File: CacheFetch.java
 */

/**
 * Resultado de pedir un fichero a la caché.
 *
 * @param entry      entrada publicada (fichero completo en disco)
 * @param downloaded true si hubo descarga en esta llamada
 * @param changed    true si el fichero del origen cambió respecto a la copia cacheada
 */
public record CacheFetch(
    CacheEntry entry,
    boolean downloaded,
    boolean changed
) {
    public static CacheFetch hit(CacheEntry entry) {
        return new CacheFetch(entry, false, false);
    }
}
