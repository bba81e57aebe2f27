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
package com.indra.minsait.dvsmart.faceindex.application.port.out;

import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 15-01-2026 at 09:52:48
 * File: EmbeddingProducer.java
 */

/**
 * Motor de reconocimiento facial: bytes de imagen a vectores de cara.
 * Puede devolver una lista vacía si la imagen no tiene caras.
 */
public interface EmbeddingProducer {

    /**
     * @throws com.indra.minsait.dvsmart.faceindex.domain.exception.EmbeddingProducerException si el motor falla
     */
    List<float[]> detectAndEmbed(byte[] imageBytes);

    String modelVersion();
}
