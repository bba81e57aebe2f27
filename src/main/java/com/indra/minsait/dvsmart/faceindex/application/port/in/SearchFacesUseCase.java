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
package com.indra.minsait.dvsmart.faceindex.application.port.in;

import com.indra.minsait.dvsmart.faceindex.domain.model.SearchResult;
import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 17-01-2026 at 09:21:58
 * File: SearchFacesUseCase.java
 */

public interface SearchFacesUseCase {

    /**
     * Búsqueda con embeddings ya calculados.
     *
     * @param threshold corte explícito; si es null se usa el de {@code tier}
     * @param limit     número máximo de fotos; null = sin límite
     */
    SearchResult search(String owner, List<float[]> embeddings, ThresholdTier tier, Double threshold, Integer limit);

    /**
     * Búsqueda con imágenes de referencia: cada cara detectada es una consulta.
     *
     * @throws com.indra.minsait.dvsmart.faceindex.domain.exception.NoFaceInQueryException si ninguna imagen tiene caras
     */
    SearchResult searchByImages(String owner, List<byte[]> images, ThresholdTier tier, Double threshold, Integer limit);
}
