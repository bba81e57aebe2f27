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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdPolicyTest {

    @Test
    void defaultsAreOrderedAndStandardIsDefault() {
        ThresholdPolicy policy = new ThresholdPolicy(new FaceIndexProperties());

        assertEquals(0.70, policy.cutoff(ThresholdTier.STRICT), 1e-9);
        assertEquals(0.60, policy.cutoff(ThresholdTier.STANDARD), 1e-9);
        assertEquals(0.50, policy.cutoff(ThresholdTier.LOOSE), 1e-9);
        assertEquals(0.60, policy.cutoff(null), 1e-9);
    }

    @Test
    void rawThresholdOverridesTier() {
        ThresholdPolicy policy = new ThresholdPolicy(new FaceIndexProperties());

        assertEquals(0.42, policy.resolve(ThresholdTier.STRICT, 0.42), 1e-9);
        assertEquals(0.70, policy.resolve(ThresholdTier.STRICT, null), 1e-9);
    }

    @Test
    void rawThresholdOutsideCosineRangeIsRejected() {
        ThresholdPolicy policy = new ThresholdPolicy(new FaceIndexProperties());

        assertThrows(IllegalArgumentException.class, () -> policy.resolve(null, 1.5));
        assertThrows(IllegalArgumentException.class, () -> policy.resolve(null, -1.01));
        assertThrows(IllegalArgumentException.class, () -> policy.resolve(null, Double.NaN));
    }

    @Test
    void misorderedTiersFailAtStartup() {
        FaceIndexProperties props = new FaceIndexProperties();
        props.getSearch().setStrict(0.55);

        assertThrows(IllegalStateException.class, () -> new ThresholdPolicy(props));
    }

    @Test
    void outOfRangeTierFailsAtStartup() {
        FaceIndexProperties props = new FaceIndexProperties();
        props.getSearch().setStrict(1.2);

        assertThrows(IllegalStateException.class, () -> new ThresholdPolicy(props));
    }
}
