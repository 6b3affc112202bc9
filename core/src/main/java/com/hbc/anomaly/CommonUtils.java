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

package com.hbc.anomaly;

import java.util.Objects;

/** A collection of common utility functions. */
public class CommonUtils {

    private CommonUtils() {
    }

    /**
     * Throws an {@link IllegalArgumentException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalArgumentException} if {@code condition} is
     *                  false.
     * @throws IllegalArgumentException if {@code condition} is false.
     */
    public static void checkArgument(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Throws an {@link IllegalStateException} with the specified message if the
     * specified input is false.
     *
     * @param condition A condition to test.
     * @param message   The error message to include in the
     *                  {@code IllegalStateException} if {@code condition} is
     *                  false.
     * @throws IllegalStateException if {@code condition} is false.
     */
    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Throws a {@link NullPointerException} with the specified message if the
     * specified input is null.
     *
     * @param <T>     An arbitrary type.
     * @param object  An object reference to test for nullity.
     * @param message The error message to include in the
     *                {@code NullPointerException} if {@code object} is null.
     * @return {@code object} if not null.
     * @throws NullPointerException if the supplied object is null.
     */
    public static <T> T checkNotNull(T object, String message) {
        Objects.requireNonNull(object, message);
        return object;
    }

    /**
     * @param value a number, not NaN
     * @return the value limited to [-Double.MAX_VALUE, Double.MAX_VALUE]
     */
    public static double clampToFinite(double value) {
        return Math.max(-Double.MAX_VALUE, Math.min(Double.MAX_VALUE, value));
    }

    /**
     * @param values an array, possibly null
     * @return true if the array is non-null, non-empty and every entry is finite
     */
    public static boolean isFiniteVector(double[] values) {
        if (values == null || values.length == 0) {
            return false;
        }
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Converts a boolean decision to the 0/1 flag reported in results.
     *
     * @param condition the decision
     * @return 1 if condition holds, 0 otherwise
     */
    public static int toFlag(boolean condition) {
        return condition ? 1 : 0;
    }
}
