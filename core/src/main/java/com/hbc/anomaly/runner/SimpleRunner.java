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

package com.hbc.anomaly.runner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Function;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hbc.anomaly.LayeredAnomalyDetector;
import com.hbc.anomaly.inputtypes.Observation;
import com.hbc.anomaly.tracker.DiagonalDistanceTracker;
import com.hbc.anomaly.tracker.SeasonalResidualTracker;
import com.hbc.anomaly.tracker.StaticZScoreTracker;

/**
 * A simple command-line application that parses command-line arguments,
 * creates a LayeredAnomalyDetector based on those arguments, reads rows from
 * STDIN and writes results to STDOUT.
 *
 * Every row starts with the subject and its reading; any further columns form
 * the feature vector of the subject.
 */
public class SimpleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SimpleRunner.class);

    protected final ArgumentParser argumentParser;
    protected final Function<LayeredAnomalyDetector, LineTransformer> algorithmInitializer;
    protected LineTransformer algorithm;
    protected int lineNumber;

    /**
     * Create a new SimpleRunner.
     *
     * @param runnerClass          The name of the runner class. This will be
     *                             displayed in the help text.
     * @param runnerDescription    A description of the runner class. This will be
     *                             displayed in the help text.
     * @param algorithmInitializer A factory method to create a new LineTransformer
     *                             instance from a LayeredAnomalyDetector.
     */
    public SimpleRunner(String runnerClass, String runnerDescription,
            Function<LayeredAnomalyDetector, LineTransformer> algorithmInitializer) {
        this(new ArgumentParser(runnerClass, runnerDescription), algorithmInitializer);
    }

    public SimpleRunner(ArgumentParser argumentParser,
            Function<LayeredAnomalyDetector, LineTransformer> algorithmInitializer) {
        this.argumentParser = argumentParser;
        this.algorithmInitializer = algorithmInitializer;
    }

    /**
     * Parse the given command-line arguments and build the detector. An invalid
     * combination of options prints the usage message and exits.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        argumentParser.parse(arguments);
        try {
            prepareAlgorithm();
        } catch (IllegalArgumentException e) {
            argumentParser.printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
        }
    }

    /**
     * Read data from an input stream, apply the desired transformation, and write
     * the result to an output stream.
     *
     * @param in  An input stream where input values will be read.
     * @param out An output stream where the result values will be written.
     * @throws IOException if IO errors are encountered during reading or writing.
     */
    public void run(BufferedReader in, PrintWriter out) throws IOException {
        if (algorithm == null) {
            prepareAlgorithm();
        }

        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            String[] values = line.split(Pattern.quote(argumentParser.getDelimiter()), -1);

            if (lineNumber == 1 && argumentParser.getHeaderRow()) {
                writeHeader(values, out);
                continue;
            }

            processLine(values, out);
        }

        out.flush();
    }

    /**
     * Set up the internal detector and line transformer.
     */
    protected void prepareAlgorithm() {
        StaticZScoreTracker staticTracker = StaticZScoreTracker.builder().windowSize(argumentParser.getWindowSize())
                .maxSubjects(argumentParser.getMaxSubjects()).percentileLow(argumentParser.getPercentileLow())
                .percentileHigh(argumentParser.getPercentileHigh()).zscoreK(argumentParser.getZscoreK()).build();
        SeasonalResidualTracker seasonalTracker = SeasonalResidualTracker.builder()
                .windowSize(argumentParser.getWindowSize()).maxSubjects(argumentParser.getMaxSubjects())
                .ewmaAlpha(argumentParser.getEwmaAlpha()).bandK(argumentParser.getBandK())
                .residualK(argumentParser.getResidualK()).build();
        DiagonalDistanceTracker distanceTracker = DiagonalDistanceTracker.builder()
                .windowSize(argumentParser.getWindowSize()).maxSubjects(argumentParser.getMaxSubjects())
                .distanceThreshold(argumentParser.getDistanceThreshold()).build();

        algorithm = algorithmInitializer
                .apply(new LayeredAnomalyDetector(staticTracker, seasonalTracker, distanceTracker));
    }

    /**
     * Write a header row to the output stream.
     *
     * @param values The array of values that are used to create the header. These
     *               values will be joined together using the user-specified
     *               delimiter.
     * @param out    The output stream where the header will be written.
     */
    protected void writeHeader(String[] values, PrintWriter out) {
        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        algorithm.getResultColumnNames().forEach(joiner::add);
        out.println(joiner.toString());
    }

    /**
     * Process a single line of input data and write the result to the output
     * stream. A row without a subject and a reading is passed through with the
     * empty result appended.
     *
     * @param values An array of string values taken from the input stream.
     * @param out    The output stream where the transformed line will be written.
     */
    protected void processLine(String[] values, PrintWriter out) {
        List<String> result;
        if (values.length < 2 || values[0].isBlank()) {
            LOG.debug("line {} has no subject and reading, found {} columns", lineNumber, values.length);
            result = algorithm.getEmptyResultValue();
        } else {
            result = algorithm.getResultValues(values[0].trim(), Observation.parseValue(values[1]),
                    parseFeatures(values));
        }

        StringJoiner joiner = new StringJoiner(argumentParser.getDelimiter());
        Arrays.stream(values).forEach(joiner::add);
        result.forEach(joiner::add);

        out.println(joiner.toString());
    }

    /**
     * @param values the columns of a row
     * @return the columns after the reading as a feature vector, or null if there
     *         are none; cells that are not numbers become NaN
     */
    protected double[] parseFeatures(String[] values) {
        if (values.length <= 2) {
            return null;
        }
        double[] features = new double[values.length - 2];
        for (int i = 0; i < features.length; i++) {
            features[i] = Observation.parseValue(values[i + 2]);
        }
        return features;
    }

    protected int getLineNumber() {
        return lineNumber;
    }
}
