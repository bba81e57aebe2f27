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

import jakarta.validation.constraints.NotBlank;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 19-01-2026 at 09:12:31
 * File: StartJobRequest.java
 */

public record StartJobRequest(
    @NotBlank String owner,
    @NotBlank String scope,
    boolean forceReprocess
) {}
