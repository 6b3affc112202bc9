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

package com.hbc.anomaly.testutils;

/**
 * A generated series of one subject. {@code features} is null for a scalar
 * series.
 */
public class StressSeries {

    private final double[] values;

    private final double[][] features;

    private final int[] changeIndices;

    public StressSeries(double[] values, double[][] features, int[] changeIndices) {
        this.values = values;
        this.features = features;
        this.changeIndices = changeIndices;
    }

    public double[] getValues() {
        return values;
    }

    public double[][] getFeatures() {
        return features;
    }

    /**
     * @return the indices at which the series switched regime, ascending
     */
    public int[] getChangeIndices() {
        return changeIndices;
    }

    public int getLength() {
        return values.length;
    }
}
