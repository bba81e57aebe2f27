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

import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 15-01-2026 at 12:03:55
 * File: TierRead.java
 */

/**
 * Lectura completa del corpus de un propietario y el nivel del que se obtuvo.
 */
public record TierRead(
    StoreTier source,
    List<PhotoEmbeddingSet> sets
) {}
