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

import com.amazon.windowedensemble.grid.GridPoint;
import com.amazon.windowedensemble.grid.HyperparameterGrid;
import com.amazon.windowedensemble.model.IFittedModel;
import com.amazon.windowedensemble.model.IModelFamily;

/**
 * One-class SVMs with a Gaussian kernel, parameterized by {@code nu} and the
 * kernel coefficient {@code gamma}. A NaN gamma means "scale to the data".
 */
public class OneClassSvmFamily implements IModelFamily {

    public static final String NAME = "oneClassSvm";

    public static final String NU = "nu";

    public static final String GAMMA = "gamma";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public GridPoint getDefaultParameters() {
        return GridPoint.builder().put(NU, OneClassSvm.DEFAULT_NU).put(GAMMA, Double.NaN).build();
    }

    @Override
    public HyperparameterGrid getDefaultGrid() {
        return HyperparameterGrid.builder().dimension(NU, 0.01, 0.05, 0.1).dimension(GAMMA, 0.01, 0.1, 1.0).build();
    }

    @Override
    public int getMinimumSampleSize() {
        return 2;
    }

    @Override
    public void validate(HyperparameterGrid grid) {
        for (String name : grid.getDimensionNames()) {
            checkArgument(NU.equals(name) || GAMMA.equals(name), "unknown one-class SVM parameter " + name);
        }
        for (GridPoint point : grid.getPoints()) {
            double nu = point.getOrDefault(NU, OneClassSvm.DEFAULT_NU);
            checkArgument(nu > 0 && nu <= 1, "nu must be in (0, 1]");
            double gamma = point.getOrDefault(GAMMA, Double.NaN);
            checkArgument(Double.isNaN(gamma) || (gamma > 0 && Double.isFinite(gamma)),
                    "gamma must be a positive finite number");
        }
    }

    @Override
    public IFittedModel fit(double[][] points, GridPoint parameters) {
        return OneClassSvm.fit(points, parameters.getOrDefault(NU, OneClassSvm.DEFAULT_NU),
                parameters.getOrDefault(GAMMA, Double.NaN));
    }
}
