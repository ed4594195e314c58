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

import static com.amazon.windowedensemble.CommonUtils.checkArgument;

import lombok.Getter;

/**
 * Sequential minimal optimization for the one-class dual problem
 *
 * <pre>
 *     minimize   1/2 a'Qa
 *     subject to 0 &lt;= a_i &lt;= 1,  sum a_i = nu * l
 * </pre>
 *
 * with second order working set selection. All labels are +1, so the pair
 * update keeps {@code a_i + a_j} constant. The solver is deterministic: the
 * initial point fills the first {@code floor(nu * l)} coefficients.
 */
public class OneClassSmoSolver {

    static final double TAU = 1e-12;

    public static final double DEFAULT_TOLERANCE = 1e-3;

    private static final double UPPER_BOUND = 1.0;

    private final double tolerance;

    public OneClassSmoSolver(double tolerance) {
        checkArgument(tolerance > 0, "tolerance must be positive");
        this.tolerance = tolerance;
    }

    public OneClassSmoSolver() {
        this(DEFAULT_TOLERANCE);
    }

    /**
     * Solves the dual problem for a precomputed kernel matrix.
     *
     * @param q  the symmetric kernel matrix
     * @param nu the fraction parameter, in (0, 1]
     * @return the coefficients and the offset rho
     */
    public Solution solve(double[][] q, double nu) {
        checkArgument(nu > 0 && nu <= 1, "nu must be in (0, 1]");
        int l = q.length;
        double[] alpha = new double[l];
        int n = (int) (nu * l);
        for (int i = 0; i < n; i++) {
            alpha[i] = UPPER_BOUND;
        }
        if (n < l) {
            alpha[n] = nu * l - n;
        }

        double[] gradient = new double[l];
        for (int i = 0; i < l; i++) {
            double sum = 0;
            for (int j = 0; j < l; j++) {
                sum += q[i][j] * alpha[j];
            }
            gradient[i] = sum;
        }

        long maxIterations = Math.max(10_000_000L, 100L * l);
        int iterations = 0;
        while (iterations < maxIterations) {
            int[] pair = selectWorkingSet(q, alpha, gradient);
            if (pair == null) {
                break;
            }
            ++iterations;
            update(q, alpha, gradient, pair[0], pair[1]);
        }

        return new Solution(alpha, calculateRho(alpha, gradient), iterations);
    }

    /**
     * @return the maximal violating pair, or null at optimality
     */
    private int[] selectWorkingSet(double[][] q, double[] alpha, double[] gradient) {
        double gmax = Double.NEGATIVE_INFINITY;
        int i = -1;
        for (int t = 0; t < alpha.length; t++) {
            if (alpha[t] < UPPER_BOUND && -gradient[t] >= gmax) {
                gmax = -gradient[t];
                i = t;
            }
        }
        if (i == -1) {
            return null;
        }

        double gmax2 = Double.NEGATIVE_INFINITY;
        double objDiffMin = Double.POSITIVE_INFINITY;
        int j = -1;
        for (int t = 0; t < alpha.length; t++) {
            if (alpha[t] > 0) {
                double gradDiff = gmax + gradient[t];
                if (gradient[t] >= gmax2) {
                    gmax2 = gradient[t];
                }
                if (gradDiff > 0) {
                    double quad = q[i][i] + q[t][t] - 2.0 * q[i][t];
                    double objDiff = -(gradDiff * gradDiff) / ((quad > 0) ? quad : TAU);
                    if (objDiff <= objDiffMin) {
                        j = t;
                        objDiffMin = objDiff;
                    }
                }
            }
        }

        if (gmax + gmax2 < tolerance || j == -1) {
            return null;
        }
        return new int[] { i, j };
    }

    private void update(double[][] q, double[] alpha, double[] gradient, int i, int j) {
        double quad = q[i][i] + q[j][j] - 2.0 * q[i][j];
        if (quad <= 0) {
            quad = TAU;
        }
        double oldAlphaI = alpha[i];
        double oldAlphaJ = alpha[j];
        double delta = (gradient[i] - gradient[j]) / quad;
        double sum = alpha[i] + alpha[j];
        alpha[i] -= delta;
        alpha[j] += delta;

        // project back onto the box while keeping the sum
        if (sum > UPPER_BOUND) {
            if (alpha[i] > UPPER_BOUND) {
                alpha[i] = UPPER_BOUND;
                alpha[j] = sum - UPPER_BOUND;
            }
        } else if (alpha[j] < 0) {
            alpha[j] = 0;
            alpha[i] = sum;
        }
        if (sum > UPPER_BOUND) {
            if (alpha[j] > UPPER_BOUND) {
                alpha[j] = UPPER_BOUND;
                alpha[i] = sum - UPPER_BOUND;
            }
        } else if (alpha[i] < 0) {
            alpha[i] = 0;
            alpha[j] = sum;
        }

        double deltaI = alpha[i] - oldAlphaI;
        double deltaJ = alpha[j] - oldAlphaJ;
        for (int k = 0; k < alpha.length; k++) {
            gradient[k] += q[k][i] * deltaI + q[k][j] * deltaJ;
        }
    }

    /**
     * The offset is the mean gradient over free coefficients, or the midpoint of
     * the feasible interval when every coefficient is at a bound.
     */
    private static double calculateRho(double[] alpha, double[] gradient) {
        int free = 0;
        double sumFree = 0;
        double upper = Double.POSITIVE_INFINITY;
        double lower = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < alpha.length; i++) {
            if (alpha[i] >= UPPER_BOUND) {
                lower = Math.max(lower, gradient[i]);
            } else if (alpha[i] <= 0) {
                upper = Math.min(upper, gradient[i]);
            } else {
                ++free;
                sumFree += gradient[i];
            }
        }
        if (free > 0) {
            return sumFree / free;
        }
        if (Double.isInfinite(upper)) {
            return lower;
        }
        if (Double.isInfinite(lower)) {
            return upper;
        }
        return (upper + lower) / 2;
    }

    @Getter
    public static class Solution {

        private final double[] alpha;

        private final double rho;

        private final int iterations;

        Solution(double[] alpha, double rho, int iterations) {
            this.alpha = alpha;
            this.rho = rho;
            this.iterations = iterations;
        }
    }
}
