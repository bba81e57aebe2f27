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
package com.indra.minsait.dvsmart.faceindex.adapter.in.rest.dto;

import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 09:20:45
 * File: SearchRequest.java
 */

/**
 * Búsqueda por embeddings ya calculados. Si llega threshold prevalece sobre tier.
 */
public record SearchRequest(
    @NotEmpty List<float[]> embeddings,
    ThresholdTier tier,
    Double threshold,
    @Positive Integer limit
) {}
