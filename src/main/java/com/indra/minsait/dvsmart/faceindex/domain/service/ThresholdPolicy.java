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
package com.indra.minsait.dvsmart.faceindex.domain.service;

import com.indra.minsait.dvsmart.faceindex.domain.model.ThresholdTier;
import com.indra.minsait.dvsmart.faceindex.infrastructure.config.FaceIndexProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Author: hahuaranga@indracompany.com
 * Created on: 16-01-2026 at 09:02:15
 * File: ThresholdPolicy.java
 */

/**
 * Tabla de cortes de similitud por nivel. Se valida al arrancar:
 * strict >= standard >= loose, todos en [-1, 1].
 */
@Slf4j
@Service
public class ThresholdPolicy {

    public static final ThresholdTier DEFAULT_TIER = ThresholdTier.STANDARD;

    private final Map<ThresholdTier, Double> cutoffs;

    public ThresholdPolicy(FaceIndexProperties props) {
        FaceIndexProperties.Search search = props.getSearch();
        Map<ThresholdTier, Double> table = new EnumMap<>(ThresholdTier.class);
        table.put(ThresholdTier.STRICT, search.getStrict());
        table.put(ThresholdTier.STANDARD, search.getStandard());
        table.put(ThresholdTier.LOOSE, search.getLoose());

        for (Map.Entry<ThresholdTier, Double> entry : table.entrySet()) {
            if (!isValidCutoff(entry.getValue())) {
                throw new IllegalStateException("Threshold for " + entry.getKey() + " out of range [-1, 1]: " + entry.getValue());
            }
        }
        if (search.getStrict() < search.getStandard() || search.getStandard() < search.getLoose()) {
            throw new IllegalStateException(String.format(
                "Threshold tiers must satisfy strict >= standard >= loose (strict=%.2f, standard=%.2f, loose=%.2f)",
                search.getStrict(), search.getStandard(), search.getLoose()));
        }

        this.cutoffs = Collections.unmodifiableMap(table);
        log.info("Threshold policy: strict={}, standard={}, loose={}",
                search.getStrict(), search.getStandard(), search.getLoose());
    }

    public double cutoff(ThresholdTier tier) {
        return cutoffs.get(tier == null ? DEFAULT_TIER : tier);
    }

    /**
     * Resuelve el corte efectivo. Un valor numérico explícito prevalece sobre el nivel.
     *
     * @throws IllegalArgumentException si el valor explícito está fuera de [-1, 1]
     */
    public double resolve(ThresholdTier tier, Double rawThreshold) {
        if (rawThreshold != null) {
            if (!isValidCutoff(rawThreshold)) {
                throw new IllegalArgumentException("Threshold must be between -1 and 1: " + rawThreshold);
            }
            return rawThreshold;
        }
        return cutoff(tier);
    }

    public Map<ThresholdTier, Double> getCutoffs() {
        return cutoffs;
    }

    private static boolean isValidCutoff(Double value) {
        return value != null && !value.isNaN() && value >= -1.0 && value <= 1.0;
    }
}
