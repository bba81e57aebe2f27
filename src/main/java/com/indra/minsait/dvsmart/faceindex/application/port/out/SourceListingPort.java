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

import com.indra.minsait.dvsmart.faceindex.domain.model.SourceFile;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 15-01-2026 at 09:40:12
 * File: SourceListingPort.java
 */

/**
 * Origen de las fotos (carpeta compartida). Solo lectura; se vuelve a listar
 * en cada ejecución.
 */
public interface SourceListingPort {

    /**
     * Lista recursivamente los ficheros de {@code scope}.
     *
     * @throws com.indra.minsait.dvsmart.faceindex.domain.exception.SourceListingException si no se puede listar
     */
    List<SourceFile> list(String scope);

    /**
     * Copia el contenido del fichero en {@code target}.
     */
    void download(SourceFile file, OutputStream target) throws IOException;

    /**
     * Tipo de origen para logs y monitorización (sftp, local).
     */
    String sourceType();
}
