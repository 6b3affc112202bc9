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

import java.util.Set;

import com.hbc.anomaly.inputtypes.Observation;

/**
 * A tracker keeps a bounded history per subject and classifies every new
 * observation of a subject against that history. Updates of one subject must
 * be applied in arrival order; updates of different subjects are independent.
 *
 * @param <R> the result type of an update
 */
public interface ISubjectTracker<R> {

    /**
     * Folds an observation into the history of a subject and classifies it.
     * Malformed observations, including the wrong kind of observation for this
     * tracker, never raise; they produce {@link #getEmptyResult()} and leave the
     * history unchanged.
     *
     * @param subject     the subject key, not null
     * @param observation the observation, possibly null
     * @return the metrics of this observation
     */
    R update(String subject, Observation observation);

    /**
     * @return the neutral result reported for malformed input
     */
    R getEmptyResult();

    /**
     * @param subject the subject key
     * @return the number of observations currently held for the subject, 0 if the
     *         subject is unknown
     */
    int getObservationCount(String subject);

    int getSubjectCount();

    Set<String> getSubjects();

    /**
     * Drops all history of a subject.
     *
     * @param subject the subject key
     * @return true if the subject was known
     */
    boolean forget(String subject);

    void clear();
}
