/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.windowedensemble.isolation;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;

public class IsolationForestFamilyTest {

    private final IsolationForestFamily family = new IsolationForestFamily();

    @Test
    public void testDefaults() {
        assertEquals("isolationForest", family.getName());
        assertEquals(IsolationForest.DEFAULT_RANDOM_SEED, family.getRandomSeed());
        assertEquals(27, family.getDefaultGrid().size());
        assertDoesNotThrow(() -> family.validate(family.getDefaultGrid()));

        GridPoint defaults = family.getDefaultParameters();
        assertEquals(100, defaults.getInt(IsolationForestFamily.NUMBER_OF_TREES));
        assertTrue(Double.isNaN(defaults.get(IsolationForestFamily.CONTAMINATION)));
        assertTrue(Double.isNaN(defaults.get(IsolationForestFamily.MAX_SAMPLES)));
    }

    @Test
    public void testFitAppliesParameters() {
        double[][] points = new NormalMixtureTestData().generateTestData(120, 2, 4L);
        GridPoint parameters = GridPoint.builder().put(IsolationForestFamily.NUMBER_OF_TREES, 50)
                .put(IsolationForestFamily.CONTAMINATION, 0.05).put(IsolationForestFamily.MAX_SAMPLES, 0.5).build();
        IsolationForest forest = (IsolationForest) family.fit(points, parameters);
        assertEquals(50, forest.getNumberOfTrees());
        assertEquals(60, forest.getSubsampleSize());
        assertEquals(0.05, forest.getContamination());

        IsolationForest again = (IsolationForest) new IsolationForestFamily().fit(points, parameters);
        assertArrayEquals(forest.predict(points), again.predict(points));
    }

    @Test
    public void testMissingParametersUseDefaults() {
        double[][] points = new NormalMixtureTestData().generateTestData(40, 2, 4L);
        IsolationForest forest = (IsolationForest) family.fit(points,
                GridPoint.builder().put(IsolationForestFamily.CONTAMINATION, 0.1).build());
        assertEquals(IsolationForest.DEFAULT_NUMBER_OF_TREES, forest.getNumberOfTrees());
        assertEquals(40, forest.getSubsampleSize());
    }

    @Test
    public void testValidate() {
        assertThrows(IllegalArgumentException.class,
                () -> family.validate(HyperparameterGrid.builder().dimension("nu", 0.1).build()));
        assertThrows(IllegalArgumentException.class, () -> family
                .validate(HyperparameterGrid.builder().dimension(IsolationForestFamily.NUMBER_OF_TREES, 0).build()));
        assertThrows(IllegalArgumentException.class, () -> family
                .validate(HyperparameterGrid.builder().dimension(IsolationForestFamily.NUMBER_OF_TREES, 2.5).build()));
        assertThrows(IllegalArgumentException.class, () -> family
                .validate(HyperparameterGrid.builder().dimension(IsolationForestFamily.CONTAMINATION, 0.7).build()));
        assertThrows(IllegalArgumentException.class, () -> family
                .validate(HyperparameterGrid.builder().dimension(IsolationForestFamily.MAX_SAMPLES, 0).build()));
        assertDoesNotThrow(() -> family.validate(
                HyperparameterGrid.builder().dimension(IsolationForestFamily.CONTAMINATION, Double.NaN, 0.5).build()));
    }
}
