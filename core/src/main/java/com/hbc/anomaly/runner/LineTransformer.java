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

import java.util.List;

import com.hbc.anomaly.LayeredAnomalyDetector;

/**
 * This interface is used by SimpleRunner to transform input lines into output
 * lines.
 */
public interface LineTransformer {

    /**
     * For the given parsed input row, return a list of string values that should
     * be written as output. The list of strings will be joined together using the
     * user-specified delimiter.
     *
     * @param subject  the subject named in the first column
     * @param value    the reading in the second column, NaN if it is not a number
     * @param features the remaining columns as a feature vector, or null if the
     *                 row has none
     * @return a list of string values that should be written as output.
     */
    List<String> getResultValues(String subject, double value, double[] features);

    /**
     * @return a list of string values that should be written to the output for a
     *         row that does not name a subject and a reading.
     */
    List<String> getEmptyResultValue();

    /**
     * @return a list of column names to write to the output if headers are
     *         enabled.
     */
    List<String> getResultColumnNames();

    /**
     * @return the detector which is being used internally to process lines.
     */
    LayeredAnomalyDetector getDetector();
}
