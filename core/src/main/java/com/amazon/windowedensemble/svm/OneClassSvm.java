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
import static com.amazon.windowedensemble.CommonUtils.checkMatrix;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

import com.amazon.windowedensemble.model.IFittedModel;

/**
 * A one-class support vector machine with a Gaussian kernel. The decision
 * function is {@code f(x) = sum_i a_i K(x_i, x) - rho} over the support vectors;
 * points with {@code f(x) < 0} lie outside the estimated support of the data
 * and are labeled as outliers.
 */
public class OneClassSvm implements IFittedModel {

    public static final double DEFAULT_NU = 0.5;

    @Getter
    private final double nu;

    @Getter
    private final RbfKernel kernel;

    private final double[][] supportVectors;

    private final double[] coefficients;

    @Getter
    private final double rho;

    @Getter
    private final int iterations;

    private OneClassSvm(double nu, RbfKernel kernel, double[][] supportVectors, double[] coefficients, double rho,
            int iterations) {
        this.nu = nu;
        this.kernel = kernel;
        this.supportVectors = supportVectors;
        this.coefficients = coefficients;
        this.rho = rho;
        this.iterations = iterations;
    }

    /**
     * Fits a model.
     *
     * @param points rows of observations
     * @param nu     upper bound on the fraction of outliers and lower bound on the
     *               fraction of support vectors, in (0, 1]
     * @param gamma  kernel coefficient, or NaN to derive it from the data with
     *               {@link RbfKernel#scaledGamma(double[][])}
     * @return the fitted model
     */
    public static OneClassSvm fit(double[][] points, double nu, double gamma) {
        checkMatrix(points, "points");
        checkArgument(points.length > 0, "cannot fit a one-class SVM to no points");
        RbfKernel kernel = new RbfKernel(Double.isNaN(gamma) ? RbfKernel.scaledGamma(points) : gamma);

        int l = points.length;
        double[][] q = new double[l][l];
        for (int i = 0; i < l; i++) {
            q[i][i] = kernel.apply(points[i], points[i]);
            for (int j = i + 1; j < l; j++) {
                q[i][j] = q[j][i] = kernel.apply(points[i], points[j]);
            }
        }

        OneClassSmoSolver.Solution solution = new OneClassSmoSolver().solve(q, nu);

        List<double[]> vectors = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        double[] alpha = solution.getAlpha();
        for (int i = 0; i < l; i++) {
            if (alpha[i] > 0) {
                vectors.add(points[i]);
                weights.add(alpha[i]);
            }
        }
        return new OneClassSvm(nu, kernel, vectors.toArray(new double[0][]),
                weights.stream().mapToDouble(Double::doubleValue).toArray(), solution.getRho(),
                solution.getIterations());
    }

    public double decisionFunction(double[] point) {
        double sum = 0;
        for (int i = 0; i < supportVectors.length; i++) {
            sum += coefficients[i] * kernel.apply(supportVectors[i], point);
        }
        return sum - rho;
    }

    /**
     * @return the negated decision function, so that larger means more anomalous
     */
    @Override
    public double score(double[] point) {
        return -decisionFunction(point);
    }

    @Override
    public int[] predict(double[][] points) {
        int[] labels = new int[points.length];
        for (int i = 0; i < points.length; i++) {
            labels[i] = (decisionFunction(points[i]) < 0) ? OUTLIER : INLIER;
        }
        return labels;
    }

    public int getNumberOfSupportVectors() {
        return supportVectors.length;
    }
}
