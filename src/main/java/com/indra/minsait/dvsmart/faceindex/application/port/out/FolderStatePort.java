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

import java.util.Optional;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 16-01-2026 at 12:31:44
 * File: FolderStatePort.java
 */

/**
 * Huella del último listado procesado sin fallos por {@code (owner, scope)}.
 */
public interface FolderStatePort {

    Optional<String> findFingerprint(String owner, String scope);

    void saveFingerprint(String owner, String scope, String fingerprint, int fileCount);

    void invalidate(String owner);
}
