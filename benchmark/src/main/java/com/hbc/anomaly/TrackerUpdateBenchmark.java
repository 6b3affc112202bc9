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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OperationsPerInvocation;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import com.hbc.anomaly.testutils.StressSeries;
import com.hbc.anomaly.testutils.StressSeriesGenerator;
import com.hbc.anomaly.tracker.DiagonalDistanceTracker;
import com.hbc.anomaly.tracker.SeasonalResidualTracker;
import com.hbc.anomaly.tracker.StaticZScoreTracker;

@Warmup(iterations = 5)
@Measurement(iterations = 10)
@Fork(value = 1)
@State(Scope.Thread)
public class TrackerUpdateBenchmark {

    public final static int DATA_SIZE = 10_000;

    public final static int NUMBER_OF_SUBJECTS = 50;

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({ "100", "500" })
        int windowSize;

        @Param({ "4", "10" })
        int dimensions;

        StressSeries data;

        StaticZScoreTracker staticTracker;
        SeasonalResidualTracker seasonalTracker;
        DiagonalDistanceTracker distanceTracker;

        @Setup(Level.Trial)
        public void setUpData() {
            data = new StressSeriesGenerator().generateFeatures(DATA_SIZE, dimensions, 42L);
        }

        @Setup(Level.Invocation)
        public void setUpTrackers() {
            staticTracker = StaticZScoreTracker.builder().windowSize(windowSize).build();
            seasonalTracker = SeasonalResidualTracker.builder().windowSize(windowSize).build();
            distanceTracker = DiagonalDistanceTracker.builder().windowSize(windowSize).build();
        }
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public StaticZScoreTracker staticZScore(BenchmarkState state, Blackhole blackhole) {
        double[] values = state.data.getValues();
        for (int i = 0; i < values.length; i++) {
            blackhole.consume(state.staticTracker.update("subject-" + (i % NUMBER_OF_SUBJECTS), values[i]));
        }
        return state.staticTracker;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public SeasonalResidualTracker seasonalResidual(BenchmarkState state, Blackhole blackhole) {
        double[] values = state.data.getValues();
        for (int i = 0; i < values.length; i++) {
            blackhole.consume(state.seasonalTracker.update("subject-" + (i % NUMBER_OF_SUBJECTS), values[i]));
        }
        return state.seasonalTracker;
    }

    @Benchmark
    @OperationsPerInvocation(DATA_SIZE)
    public DiagonalDistanceTracker diagonalDistance(BenchmarkState state, Blackhole blackhole) {
        double[][] features = state.data.getFeatures();
        for (int i = 0; i < features.length; i++) {
            blackhole.consume(state.distanceTracker.update("subject-" + (i % NUMBER_OF_SUBJECTS), features[i]));
        }
        return state.distanceTracker;
    }
}
