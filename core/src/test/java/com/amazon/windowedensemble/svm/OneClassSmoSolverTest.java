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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class OneClassSmoSolverTest {

    private static double[][] kernelMatrix(int n, double gamma, long seed) {
        Random random = new Random(seed);
        double[][] points = new double[n][2];
        for (double[] point : points) {
            point[0] = random.nextGaussian();
            point[1] = random.nextGaussian();
        }
        RbfKernel kernel = new RbfKernel(gamma);
        double[][] q = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                q[i][j] = kernel.apply(points[i], points[j]);
            }
        }
        return q;
    }

    @ParameterizedTest
    @ValueSource(doubles = { 0.01, 0.05, 0.1, 0.37, 1.0 })
    public void testFeasibility(double nu) {
        int n = 80;
        OneClassSmoSolver.Solution solution = new OneClassSmoSolver().solve(kernelMatrix(n, 0.5, 3L), nu);
        double sum = 0;
        for (double a : solution.getAlpha()) {
            assertTrue(a >= 0 && a <= 1);
            sum += a;
        }
        assertEquals(nu * n, sum, 1e-9);
        assertTrue(solution.getRho() > 0);
    }

    @Test
    public void testOptimalityConditions() {
        int n = 60;
        double[][] q = kernelMatrix(n, 0.5, 9L);
        double tolerance = 1e-6;
        OneClassSmoSolver.Solution solution = new OneClassSmoSolver(tolerance).solve(q, 0.2);
        double[] alpha = solution.getAlpha();
        double rho = solution.getRho();
        for (int i = 0; i < n; i++) {
            double f = 0;
            for (int j = 0; j < n; j++) {
                f += q[i][j] * alpha[j];
            }
            f -= rho;
            if (alpha[i] <= 0) {
                assertTrue(f >= -1e-3);
            } else if (alpha[i] >= 1) {
                assertTrue(f <= 1e-3);
            } else {
                assertEquals(0.0, f, 1e-3);
            }
        }
    }

    @Test
    public void testAllPointsBoundWhenNuIsOne() {
        OneClassSmoSolver.Solution solution = new OneClassSmoSolver().solve(kernelMatrix(10, 1.0, 1L), 1.0);
        for (double a : solution.getAlpha()) {
            assertEquals(1.0, a);
        }
        assertEquals(0, solution.getIterations());
    }

    @Test
    public void testInvalidArguments() {
        double[][] q = kernelMatrix(5, 1.0, 1L);
        assertThrows(IllegalArgumentException.class, () -> new OneClassSmoSolver().solve(q, 0));
        assertThrows(IllegalArgumentException.class, () -> new OneClassSmoSolver().solve(q, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new OneClassSmoSolver(0));
    }
}
