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

package com.hbc.anomaly.statistics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.hbc.anomaly.window.BoundedWindow;

public class PopulationStatisticsTest {

    @Test
    public void testMeanAndPopulationVariance() {
        PopulationStatistics statistics = PopulationStatistics.of(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 });
        assertEquals(8, statistics.getCount());
        assertEquals(5.0, statistics.getMean(), 1e-12);
        assertEquals(4.0, statistics.getVariance(), 1e-12);
        assertEquals(2.0, statistics.getDeviation(), 1e-12);
    }

    @Test
    public void testConstantValuesHaveNoDeviation() {
        PopulationStatistics statistics = PopulationStatistics.of(new double[] { 0.4, 0.4, 0.4 });
        assertEquals(0.0, statistics.getVariance());
        assertEquals(0.0, statistics.getDeviation());
        assertEquals(1.0, statistics.getDeviation(1.0));
    }

    @Test
    public void testHugeValuesStayFinite() {
        PopulationStatistics statistics = PopulationStatistics
                .of(new double[] { Double.MAX_VALUE, -Double.MAX_VALUE, 1e308, -1e308 });
        assertEquals(0.0, statistics.getMean());
        assertTrue(Double.isFinite(statistics.getDeviation()));
        assertTrue(statistics.getDeviation() > 1e307);
        assertTrue(Double.isFinite(statistics.zscore(Double.MAX_VALUE)));
        assertTrue(statistics.zscore(Double.MAX_VALUE) > 0);
        assertTrue(statistics.zscore(-Double.MAX_VALUE) < 0);
    }

    @Test
    public void testScaledDeviationMatchesPlainValues() {
        PopulationStatistics plain = PopulationStatistics.of(new double[] { 2, 4, 4, 4, 5, 5, 7, 9 });
        PopulationStatistics huge = PopulationStatistics
                .of(new double[] { 2e300, 4e300, 4e300, 4e300, 5e300, 5e300, 7e300, 9e300 });
        assertEquals(5e300, huge.getMean(), 1e288);
        assertEquals(2e300, huge.getDeviation(), 1e288);
        assertEquals(plain.zscore(9), huge.zscore(9e300), 1e-12);
    }

    @Test
    public void testZscoreFallback() {
        PopulationStatistics constant = PopulationStatistics.of(new double[] { 3.0, 3.0 });
        assertEquals(0.0, constant.zscore(3.0));
        assertEquals(0.0, constant.zscore(3.0, 1.0));
        PopulationStatistics zeros = PopulationStatistics.of(new double[] { 0.0, 0.0, 0.0 });
        assertEquals(0.0, zeros.getMean());
        assertEquals(0.0, zeros.getDeviation());
        assertEquals(0.0, zeros.zscore(0.0, 1.0));
    }

    @Test
    public void testEmptyValues() {
        assertThrows(IllegalArgumentException.class, () -> PopulationStatistics.of(new double[0]));
        assertThrows(NullPointerException.class, () -> PopulationStatistics.of((double[]) null));
    }

    @Test
    public void testWindowAndDimension() {
        BoundedWindow<Double> window = new BoundedWindow<>(2);
        window.push(1.0);
        window.push(2.0);
        window.push(4.0);
        assertEquals(3.0, PopulationStatistics.of(window).getMean(), 1e-12);

        BoundedWindow<double[]> vectors = new BoundedWindow<>(3);
        vectors.push(new double[] { 1, 10 });
        vectors.push(new double[] { 3, 10 });
        assertEquals(2.0, PopulationStatistics.ofDimension(vectors, 0).getMean(), 1e-12);
        assertEquals(1.0, PopulationStatistics.ofDimension(vectors, 0).getVariance(), 1e-12);
        assertEquals(0.0, PopulationStatistics.ofDimension(vectors, 1).getVariance(), 1e-12);
    }

    @ParameterizedTest
    @CsvSource({ "5.0, 20, 0", "95.0, 20, 18", "10.0, 21, 2", "90.0, 21, 18", "0.0, 1, 0", "100.0, 10, 9",
            "50.0, 2, 0" })
    public void testPercentileIndex(double percentile, int n, int expected) {
        assertEquals(expected, PopulationStatistics.percentileIndex(percentile, n));
    }

    @Test
    public void testPercentile() {
        double[] values = new double[] { 9, 1, 5, 3, 7 };
        assertEquals(1, PopulationStatistics.percentile(values, 0));
        assertEquals(5, PopulationStatistics.percentile(values, 50));
        assertEquals(9, PopulationStatistics.percentile(values, 100));
        // the input is left unsorted
        assertEquals(9, values[0]);
    }
}
