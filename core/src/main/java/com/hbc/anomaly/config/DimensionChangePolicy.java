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

package com.hbc.anomaly.config;

/**
 * What the multivariate tracker does when a subject sends a feature vector
 * whose length differs from the length fixed by its first vector.
 */
public enum DimensionChangePolicy {

    /**
     * the vector is treated as malformed input: the empty result is returned and
     * the subject's history is left as it was
     */
    REJECT,
    /**
     * the subject's history is discarded and the new length becomes the subject's
     * dimension; scoring restarts from a cold window
     */
    RESET;

}
