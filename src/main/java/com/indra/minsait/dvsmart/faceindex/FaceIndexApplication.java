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
package com.indra.minsait.dvsmart.faceindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 12-01-2026 at 08:55:10
 * File: FaceIndexApplication.java
 */

@EnableScheduling
@SpringBootApplication
@ConfigurationPropertiesScan
public class FaceIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(FaceIndexApplication.class, args);
    }
}
