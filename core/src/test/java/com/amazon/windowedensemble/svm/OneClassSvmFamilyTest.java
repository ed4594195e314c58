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

package com.amazon.windowedensemble.svm;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.testutils.NormalMixtureTestData;

public class OneClassSvmFamilyTest {

    private final OneClassSvmFamily family = new OneClassSvmFamily();

    @Test
    public void testDefaults() {
        assertEquals("oneClassSvm", family.getName());
        assertEquals(9, family.getDefaultGrid().size());
        assertEquals(2, family.getMinimumSampleSize());
        GridPoint defaults = family.getDefaultParameters();
        assertEquals(0.5, defaults.get(OneClassSvmFamily.NU));
        assertTrue(Double.isNaN(defaults.get(OneClassSvmFamily.GAMMA)));
        assertDoesNotThrow(() -> family.validate(family.getDefaultGrid()));
    }

    @Test
    public void testFit() {
        double[][] points = new NormalMixtureTestData().generateTestData(60, 2, 8L);
        OneClassSvm svm = (OneClassSvm) family.fit(points,
                GridPoint.builder().put(OneClassSvmFamily.NU, 0.1).put(OneClassSvmFamily.GAMMA, 1.0).build());
        assertEquals(0.1, svm.getNu());
        assertEquals(1.0, svm.getKernel().getGamma());

        OneClassSvm scaled = (OneClassSvm) family.fit(points, family.getDefaultParameters());
        assertEquals(RbfKernel.scaledGamma(points), scaled.getKernel().getGamma());
    }

    @Test
    public void testValidate() {
        assertThrows(IllegalArgumentException.class,
                () -> family.validate(HyperparameterGrid.builder().dimension("numberOfTrees", 10).build()));
        assertThrows(IllegalArgumentException.class,
                () -> family.validate(HyperparameterGrid.builder().dimension(OneClassSvmFamily.NU, 0).build()));
        assertThrows(IllegalArgumentException.class,
                () -> family.validate(HyperparameterGrid.builder().dimension(OneClassSvmFamily.NU, 1.2).build()));
        assertThrows(IllegalArgumentException.class,
                () -> family.validate(HyperparameterGrid.builder().dimension(OneClassSvmFamily.GAMMA, -0.1).build()));
    }
}
