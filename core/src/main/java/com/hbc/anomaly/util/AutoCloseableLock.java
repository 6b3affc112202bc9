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

package com.hbc.anomaly.util;

import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * Acquires a lock on construction and releases it on {@link #close()}, so that
 * a critical section can be written as a try-with-resources block. Closing
 * more than once releases the lock only once.
 */
public class AutoCloseableLock implements AutoCloseable {

    private final Lock lock;

    private final AtomicBoolean closed;

    public AutoCloseableLock(Lock lock) {
        this.lock = checkNotNull(lock, "lock must not be null");
        this.closed = new AtomicBoolean(false);
        this.lock.lock();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            lock.unlock();
        }
    }

    boolean isClosed() {
        return closed.get();
    }
}
