package io.depinfer.reduce;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.depinfer.model.AffinityMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AffinityTransformTest {

    @Test
    void pkdIsNegativeLog10() {
        assertEquals(9.0, AffinityTransform.toPkd(1e-9), 1e-12);
        assertEquals(0.0, AffinityTransform.toPkd(1.0), 0.0);
    }

    @Test
    void missingKdMapsToWeakSentinel() {
        assertEquals(AffinityTransform.MISSING_PKD, AffinityTransform.toPkd(Double.NaN));
        assertEquals(AffinityTransform.squash(-10.0), AffinityTransform.transform(Double.NaN));
        assertEquals(0.0133, AffinityTransform.transform(Double.NaN), 1e-3);
    }

    @Test
    void squashIsCenteredAtShift() {
        assertEquals(0.5, AffinityTransform.squash(-AffinityTransform.SHIFT), 1e-15);
    }

    @Test
    void strongerBindersScoreHigher() {
        double strong = AffinityTransform.transform(1e-9);
        double weak = AffinityTransform.transform(1e-3);

        assertTrue(strong > weak);
        assertTrue(strong > 0.99 && strong < 1.0, "strong binder near 1: " + strong);
        assertTrue(weak > AffinityTransform.transform(Double.NaN));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.POSITIVE_INFINITY})
    void rejectsInvalidKd(double kd) {
        assertThrows(IllegalArgumentException.class, () -> AffinityTransform.transform(kd));
    }

    @Test
    void applyKeepsIdsAndBoundsValues() {
        AffinityMatrix kd = AffinityMatrix.of(new double[][] {
            {1e-9, 1e-6, Double.NaN},
            {1e-3, 10.0, 1e-7},
        });

        AffinityMatrix scores = AffinityTransform.apply(kd);

        assertEquals(kd.proteinIds(), scores.proteinIds());
        assertEquals(kd.drugIds(), scores.drugIds());
        for (int r = 0; r < scores.rows(); r++) {
            for (int c = 0; c < scores.columns(); c++) {
                double v = scores.get(r, c);
                assertTrue(v > 0.0 && v < 1.0, "score out of (0,1): " + v);
            }
        }
    }

    @Test
    void applyNamesTheOffendingEntry() {
        AffinityMatrix kd = AffinityMatrix.of(new double[][] {{1e-9, -5.0}});

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> AffinityTransform.apply(kd));
        assertTrue(e.getMessage().contains("protein2"), e.getMessage());
    }
}
