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

package com.hbc.anomaly.tracker;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

import com.hbc.anomaly.config.DimensionChangePolicy;
import com.hbc.anomaly.inputtypes.Observation;
import com.hbc.anomaly.returntypes.DiagonalDistanceResult;

public class DiagonalDistanceTrackerTest {

    private ListAppender<ILoggingEvent> appender;

    private Logger logger;

    @BeforeEach
    public void attachAppender() {
        logger = (Logger) LoggerFactory.getLogger(DiagonalDistanceTracker.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    public void detachAppender() {
        logger.detachAppender(appender);
        appender.stop();
    }

    private static double[] fill(int dimensions, double value) {
        double[] vector = new double[dimensions];
        Arrays.fill(vector, value);
        return vector;
    }

    @Test
    public void testDefaults() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().build();
        assertEquals(500, tracker.getWindowSize());
        assertEquals(15.0, tracker.getDistanceThreshold());
        assertEquals(DimensionChangePolicy.REJECT, tracker.getDimensionChangePolicy());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> DiagonalDistanceTracker.builder().windowSize(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> DiagonalDistanceTracker.builder().distanceThreshold(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> DiagonalDistanceTracker.builder().distanceThreshold(Double.NaN).build());
        assertThrows(NullPointerException.class,
                () -> DiagonalDistanceTracker.builder().dimensionChangePolicy(null).build());
    }

    @Test
    public void testShiftedVectorIsAnomaly() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().windowSize(30).distanceThreshold(5.0)
                .build();
        for (int i = 0; i < 35; i++) {
            assertEquals(0.0, tracker.update("r1", fill(4, 0.5)).getScore());
        }
        DiagonalDistanceResult result = tracker.update("r1", fill(4, 5.5));
        // each dimension holds one outlier among 30 values, contributing 29
        assertEquals(4 * 29.0, result.getScore(), 1e-9);
        assertThat(result.getScore(), greaterThan(5.0));
        assertEquals(1, result.getAnomaly());
    }

    @Test
    public void testNoScoreBeforeWindowHoldsMoreVectorsThanDimensions() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().windowSize(30).distanceThreshold(5.0)
                .build();
        tracker.update("r1", fill(4, 0.5));
        tracker.update("r1", fill(4, 0.5));
        DiagonalDistanceResult third = tracker.update("r1", fill(4, 500.0));
        assertEquals(0.0, third.getScore());
        assertEquals(0, third.getAnomaly());
        assertEquals(0.0, tracker.update("r1", fill(4, -500.0)).getScore());
        assertThat(tracker.update("r1", fill(4, 0.5)).getScore(), greaterThan(0.0));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 6 })
    public void testFirstDVectorsAreNotScored(int dimensions) {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().windowSize(50).distanceThreshold(1.0)
                .build();
        for (int i = 0; i < dimensions; i++) {
            DiagonalDistanceResult result = tracker.update("r1", fill(dimensions, i * 100.0));
            assertEquals(0.0, result.getScore());
            assertEquals(0, result.getAnomaly());
        }
        assertEquals(dimensions, tracker.getObservationCount("r1"));
        assertEquals(dimensions, tracker.getDimensions("r1"));
    }

    @Test
    public void testScoreOfSingleDimension() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().windowSize(10).distanceThreshold(1.5)
                .build();
        tracker.update("r1", new double[] { 0.0 });
        tracker.update("r1", new double[] { 0.0 });
        DiagonalDistanceResult result = tracker.update("r1", new double[] { 2.0 });
        // mean 2/3, variance 8/9, (4/3)^2 / (8/9) = 2
        assertEquals(2.0, result.getScore(), 1e-12);
        assertEquals(1, result.getAnomaly());
    }

    @Test
    public void testConstantVectorsScoreZero() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().windowSize(15).build();
        DiagonalDistanceResult result = null;
        for (int i = 0; i < 20; i++) {
            result = tracker.update("r1", fill(5, 0.2));
        }
        assertEquals(0.0, result.getScore());
        assertEquals(0, result.getAnomaly());
        assertEquals(15, tracker.getObservationCount("r1"));
    }

    @Test
    public void testDimensionChangeRejected() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().build();
        for (int i = 0; i < 3; i++) {
            tracker.update("r1", new double[] { 1.0, 2.0 });
        }
        DiagonalDistanceResult result = tracker.update("r1", new double[] { 1.0, 2.0, 3.0 });
        assertSame(DiagonalDistanceResult.empty(), result);
        assertEquals(2, tracker.getDimensions("r1"));
        assertEquals(3, tracker.getObservationCount("r1"));

        assertEquals(1, appender.list.size());
        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertThat(event.getFormattedMessage(), containsString("subject r1"));
    }

    @Test
    public void testDimensionChangeResetsHistory() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder()
                .dimensionChangePolicy(DimensionChangePolicy.RESET).build();
        for (int i = 0; i < 3; i++) {
            tracker.update("r1", new double[] { 1.0, 2.0 });
        }
        DiagonalDistanceResult result = tracker.update("r1", new double[] { 1.0, 2.0, 3.0 });
        assertEquals(0.0, result.getScore());
        assertEquals(3, tracker.getDimensions("r1"));
        assertEquals(1, tracker.getObservationCount("r1"));

        assertEquals(1, appender.list.size());
        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertThat(appender.list.get(0).getFormattedMessage(), containsString("from 2 to 3"));
    }

    @Test
    public void testMalformedVectorsLeaveStateUntouched() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().build();
        assertSame(tracker.getEmptyResult(), tracker.update("r1", (double[]) null));
        assertSame(tracker.getEmptyResult(), tracker.update("r1", new double[0]));
        assertSame(tracker.getEmptyResult(), tracker.update("r1", new double[] { 1.0, Double.NaN }));
        assertSame(tracker.getEmptyResult(), tracker.update("r1", new double[] { Double.POSITIVE_INFINITY }));
        assertEquals(0, tracker.getSubjectCount());
        assertEquals(0, tracker.getDimensions("r1"));
    }

    @Test
    public void testCallerArrayIsCopied() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().windowSize(10).distanceThreshold(1.5)
                .build();
        double[] vector = { 0.0 };
        tracker.update("r1", vector);
        tracker.update("r1", vector);
        vector[0] = 2.0;
        assertEquals(2.0, tracker.update("r1", vector).getScore(), 1e-12);
    }

    @Test
    public void testObservationVariants() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().build();
        assertSame(tracker.getEmptyResult(), tracker.update("r1", Observation.of(1.0)));
        assertSame(tracker.getEmptyResult(), tracker.update("r1", (Observation) null));
        assertEquals(0, tracker.getSubjectCount());

        tracker.update("r1", Observation.of(1.0, 2.0, 3.0));
        assertEquals(3, tracker.getDimensions("r1"));
    }

    @Test
    public void testSubjectsKeepTheirOwnDimension() {
        DiagonalDistanceTracker tracker = DiagonalDistanceTracker.builder().build();
        tracker.update("a", fill(2, 1.0));
        tracker.update("b", fill(7, 1.0));
        assertEquals(2, tracker.getDimensions("a"));
        assertEquals(7, tracker.getDimensions("b"));
        assertEquals(0, appender.list.size());
    }
}
