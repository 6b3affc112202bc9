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

package com.hbc.anomaly.inputtypes;

import java.util.Arrays;

/**
 * A single observation of a subject, either a scalar reading or a fixed length
 * feature vector. Scalar trackers consume {@link Scalar}, the multivariate
 * tracker consumes {@link Vector}; handing a tracker the other kind is treated
 * as malformed input.
 */
public abstract class Observation {

    Observation() {
    }

    public static Scalar of(double value) {
        return new Scalar(value);
    }

    public static Vector of(double... values) {
        return new Vector(values);
    }

    /**
     * Parses a textual reading. Text that is not a number becomes NaN, which every
     * tracker rejects as malformed without raising.
     *
     * @param text the reading, possibly null
     * @return the parsed value or NaN
     */
    public static double parseValue(String text) {
        if (text == null) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            return Double.NaN;
        }
    }

    public abstract boolean isScalar();

    public static final class Scalar extends Observation {

        private final double value;

        Scalar(double value) {
            this.value = value;
        }

        public double getValue() {
            return value;
        }

        @Override
        public boolean isScalar() {
            return true;
        }

        @Override
        public String toString() {
            return "Scalar(" + value + ")";
        }
    }

    public static final class Vector extends Observation {

        private final double[] values;

        Vector(double[] values) {
            this.values = (values == null) ? null : Arrays.copyOf(values, values.length);
        }

        /**
         * @return a copy of the components, or null for a missing vector
         */
        public double[] getValues() {
            return (values == null) ? null : Arrays.copyOf(values, values.length);
        }

        public int getDimensions() {
            return (values == null) ? 0 : values.length;
        }

        @Override
        public boolean isScalar() {
            return false;
        }

        @Override
        public String toString() {
            return "Vector" + Arrays.toString(values);
        }
    }
}
