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
 * Created on: 15-01-2026 at 11:47:20
 * File: StorePut.java
 */

/**
 * Resultado de una escritura en el almacén de embeddings.
 *
 * @param written      false si ya existía y no se pidió sustituir
 * @param remoteSynced false si el nivel remoto falló y queda pendiente de reconciliar
 */
public record StorePut(
    boolean written,
    boolean remoteSynced
) {
    public static final StorePut UNCHANGED = new StorePut(false, true);
}
