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
package com.indra.minsait.dvsmart.faceindex.support;

/**
 * Vectores 2D con similitud coseno conocida respecto a {@link #QUERY}.
 */
public final class Vectors {

    public static final float[] QUERY = {1f, 0f};

    private Vectors() {
    }

    /**
     * Vector unitario cuyo coseno con QUERY es {@code similarity}.
     */
    public static float[] withSimilarity(double similarity) {
        return new float[] {(float) similarity, (float) Math.sqrt(1.0 - similarity * similarity)};
    }
}
