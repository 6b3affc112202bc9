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

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;

import com.hbc.anomaly.state.SubjectStateStore;
import com.hbc.anomaly.tracker.AbstractSubjectTracker;
import com.hbc.anomaly.tracker.DiagonalDistanceTracker;
import com.hbc.anomaly.tracker.SeasonalResidualTracker;
import com.hbc.anomaly.tracker.StaticZScoreTracker;

/**
 * A utility class for parsing command-line arguments.
 */
public class ArgumentParser {

    public static final String ARCHIVE_NAME = "core/target/behavior-anomaly-core-1.0.0.jar";
    private final String runnerClass;
    private final String runnerDescription;
    private final Map<String, Argument<?>> shortFlags;
    private final Map<String, Argument<?>> longFlags;
    private final IntegerArgument windowSize;
    private final DoubleArgument percentileLow;
    private final DoubleArgument percentileHigh;
    private final DoubleArgument zscoreK;
    private final DoubleArgument ewmaAlpha;
    private final DoubleArgument bandK;
    private final DoubleArgument residualK;
    private final DoubleArgument distanceThreshold;
    private final IntegerArgument maxSubjects;
    private final StringArgument delimiter;
    private final BooleanArgument headerRow;

    /**
     * Create a new ArgumentParser. The runner class and runner description will be
     * used in help text.
     *
     * @param runnerClass       The name of the runner class where this argument
     *                          parser is being invoked.
     * @param runnerDescription A description of the runner class where this
     *                          argument parser is being invoked.
     */
    public ArgumentParser(String runnerClass, String runnerDescription) {
        this.runnerClass = runnerClass;
        this.runnerDescription = runnerDescription;
        shortFlags = new HashMap<>();
        longFlags = new HashMap<>();

        windowSize = new IntegerArgument("-w", "--window-size", "Number of recent observations kept per subject.",
                AbstractSubjectTracker.DEFAULT_WINDOW_SIZE,
                n -> checkArgument(n > 0, "window size should be greater than 0"));

        addArgument(windowSize);

        percentileLow = new DoubleArgument(null, "--percentile-low", "Percentile of the lower static bound.",
                StaticZScoreTracker.DEFAULT_PERCENTILE_LOW,
                p -> checkArgument(p >= 0 && p <= 100, "percentile low should be in [0, 100]"));

        addArgument(percentileLow);

        percentileHigh = new DoubleArgument(null, "--percentile-high", "Percentile of the upper static bound.",
                StaticZScoreTracker.DEFAULT_PERCENTILE_HIGH,
                p -> checkArgument(p >= 0 && p <= 100, "percentile high should be in [0, 100]"));

        addArgument(percentileHigh);

        zscoreK = new DoubleArgument(null, "--zscore-k", "Absolute z-score above which a value is anomalous.",
                StaticZScoreTracker.DEFAULT_ZSCORE_K, k -> checkArgument(k > 0, "zscore k should be greater than 0"));

        addArgument(zscoreK);

        ewmaAlpha = new DoubleArgument(null, "--ewma-alpha", "Weight of the newest value in the seasonal baseline.",
                SeasonalResidualTracker.DEFAULT_EWMA_ALPHA,
                a -> checkArgument(a > 0 && a <= 1, "ewma alpha should be in (0, 1]"));

        addArgument(ewmaAlpha);

        bandK = new DoubleArgument(null, "--band-k", "Half width of the seasonal band in standard deviations.",
                SeasonalResidualTracker.DEFAULT_BAND_K, k -> checkArgument(k > 0, "band k should be greater than 0"));

        addArgument(bandK);

        residualK = new DoubleArgument(null, "--residual-k",
                "Absolute residual z-score above which a value is anomalous.",
                SeasonalResidualTracker.DEFAULT_RESIDUAL_K,
                k -> checkArgument(k > 0, "residual k should be greater than 0"));

        addArgument(residualK);

        distanceThreshold = new DoubleArgument(null, "--distance-threshold",
                "Squared diagonal distance above which a feature vector is anomalous.",
                DiagonalDistanceTracker.DEFAULT_DISTANCE_THRESHOLD,
                t -> checkArgument(t > 0, "distance threshold should be greater than 0"));

        addArgument(distanceThreshold);

        maxSubjects = new IntegerArgument(null, "--max-subjects",
                "Number of subjects retained, least recently updated are dropped first; 0 for no limit.",
                SubjectStateStore.UNBOUNDED, n -> checkArgument(n >= 0, "max subjects cannot be negative"));

        addArgument(maxSubjects);

        delimiter = new StringArgument("-d", "--delimiter", "The character or string used as a field delimiter.",
                ",");

        addArgument(delimiter);

        headerRow = new BooleanArgument(null, "--header-row", "Set to 'true' if the data contains a header row.",
                false);

        addArgument(headerRow);
    }

    /**
     * Add a new argument to this argument parser.
     *
     * @param argument An Argument instance for a command-line argument that should
     *                 be parsed.
     */
    protected void addArgument(Argument<?> argument) {
        checkNotNull(argument, "argument should not be null");

        checkArgument(argument.getShortFlag() == null || !shortFlags.containsKey(argument.getShortFlag()),
                String.format("An argument mapping already exists for %s", argument.getShortFlag()));

        checkArgument(!longFlags.containsKey(argument.getLongFlag()),
                String.format("An argument mapping already exists for %s", argument.getLongFlag()));

        if (argument.getShortFlag() != null) {
            shortFlags.put(argument.getShortFlag(), argument);
        }

        longFlags.put(argument.getLongFlag(), argument);
    }

    /**
     * Parse the given array of command-line arguments.
     *
     * @param arguments An array of command-line arguments.
     */
    public void parse(String... arguments) {
        int i = 0;
        while (i < arguments.length) {
            String flag = arguments[i];

            try {
                if (shortFlags.containsKey(flag)) {
                    shortFlags.get(flag).parse(arguments[++i]);
                } else if (longFlags.containsKey(flag)) {
                    longFlags.get(flag).parse(arguments[++i]);
                } else if ("-h".equals(flag) || "--help".equals(flag)) {
                    printUsage();
                    Runtime.getRuntime().exit(0);
                } else {
                    throw new IllegalArgumentException("Unknown argument: " + flag);
                }
            } catch (Exception e) {
                printUsageAndExit("%s: %s", e.getClass().getName(), e.getMessage());
            }

            i++;
        }
    }

    /**
     * Print a usage message to STDOUT.
     */
    public void printUsage() {
        System.out.println(String.format("Usage: java -cp %s %s [options] < input_file > output_file",
                ARCHIVE_NAME, runnerClass));
        System.out.println();
        System.out.println(runnerDescription);
        System.out.println();
        System.out.println("Options:");

        longFlags.values().stream().map(Argument::getHelpMessage).sorted()
                .forEach(msg -> System.out.println("\t" + msg));

        System.out.println();
        System.out.println("\t--help, -h: Print this help message and exit.");
    }

    /**
     * Print an error message, the usage message, and exit the application.
     *
     * @param errorMessage  An error message to show the user.
     * @param formatObjects An array of format objects that will be interpolated
     *                      into the error message using {@link String#format}.
     */
    public void printUsageAndExit(String errorMessage, Object... formatObjects) {
        System.err.println("Error: " + String.format(errorMessage, formatObjects));
        printUsage();
        System.exit(1);
    }

    /**
     * @return the user-specified value of the window-size parameter
     */
    public int getWindowSize() {
        return windowSize.getValue();
    }

    public double getPercentileLow() {
        return percentileLow.getValue();
    }

    public double getPercentileHigh() {
        return percentileHigh.getValue();
    }

    public double getZscoreK() {
        return zscoreK.getValue();
    }

    public double getEwmaAlpha() {
        return ewmaAlpha.getValue();
    }

    public double getBandK() {
        return bandK.getValue();
    }

    public double getResidualK() {
        return residualK.getValue();
    }

    public double getDistanceThreshold() {
        return distanceThreshold.getValue();
    }

    /**
     * @return the user-specified value of the max-subjects parameter, 0 for no
     *         limit
     */
    public int getMaxSubjects() {
        return maxSubjects.getValue();
    }

    /**
     * @return the user-specified value of the delimiter parameter
     */
    public String getDelimiter() {
        return delimiter.getValue();
    }

    /**
     * @return the user-specified value of the header-row parameter
     */
    public boolean getHeaderRow() {
        return headerRow.getValue();
    }

    public static class Argument<T> {

        private final String shortFlag;
        private final String longFlag;
        private final String description;
        private final T defaultValue;
        private final Function<String, T> parseFunction;
        private final Consumer<T> validateFunction;
        private T value;

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction, Consumer<T> validateFunction) {
            this.shortFlag = shortFlag;
            this.longFlag = longFlag;
            this.description = description;
            this.defaultValue = defaultValue;
            this.parseFunction = parseFunction;
            this.validateFunction = validateFunction;
            value = defaultValue;
        }

        public Argument(String shortFlag, String longFlag, String description, T defaultValue,
                Function<String, T> parseFunction) {
            this(shortFlag, longFlag, description, defaultValue, parseFunction, t -> {
            });
        }

        public String getShortFlag() {
            return shortFlag;
        }

        public String getLongFlag() {
            return longFlag;
        }

        public String getDescription() {
            return description;
        }

        public T getDefaultValue() {
            return defaultValue;
        }

        public String getHelpMessage() {
            if (shortFlag != null) {
                return String.format("%s, %s: %s (default: %s)", longFlag, shortFlag, description, defaultValue);
            } else {
                return String.format("%s: %s (default: %s)", longFlag, description, defaultValue);
            }
        }

        public void parse(String string) {
            value = parseFunction.apply(string);
            validateFunction.accept(value);
        }

        public T getValue() {
            return value;
        }
    }

    public static class StringArgument extends Argument<String> {
        public StringArgument(String shortFlag, String longFlag, String description, String defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, x -> x);
        }
    }

    public static class BooleanArgument extends Argument<Boolean> {
        public BooleanArgument(String shortFlag, String longFlag, String description, boolean defaultValue) {
            super(shortFlag, longFlag, description, defaultValue, Boolean::parseBoolean);
        }
    }

    public static class IntegerArgument extends Argument<Integer> {
        public IntegerArgument(String shortFlag, String longFlag, String description, int defaultValue,
                Consumer<Integer> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Integer::parseInt, validateFunction);
        }
    }

    public static class DoubleArgument extends Argument<Double> {
        public DoubleArgument(String shortFlag, String longFlag, String description, double defaultValue,
                Consumer<Double> validateFunction) {
            super(shortFlag, longFlag, description, defaultValue, Double::parseDouble, validateFunction);
        }
    }
}
