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
import java.time.Instant;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 08-01-2026 at 10:31:17
 * File: FaceEmbedding.java
 */

/**
 * Vector de una cara detectada en una foto. {@code faceIndex} distingue
 * las caras de una misma foto.
 */
@Value
@Builder
public class FaceEmbedding {
    String owner;
    String photoReference;
    int faceIndex;
    float[] vector;
    Instant createdAt;

    public int getDimension() {
        return vector == null ? 0 : vector.length;
    }
}
