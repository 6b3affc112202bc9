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

package com.hbc.anomaly.window;

import static com.hbc.anomaly.CommonUtils.checkArgument;
import static com.hbc.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

/**
 * A fixed capacity sequence of the most recent values. Values are kept in
 * insertion order and once the window is full every push evicts the oldest
 * value. Nothing is ever removed except through capacity driven eviction or an
 * explicit {@link #clear()}.
 *
 * The window is not thread safe; it is owned by a single tracker state and
 * accessed under that state's lock.
 *
 * @param <T> the element type
 */
public class BoundedWindow<T> {

    /**
     * Maximum number of values held.
     */
    private final int capacity;

    /**
     * Ring buffer of values.
     */
    private final Object[] buffer;

    /**
     * The index of the oldest value currently in the window.
     */
    private int head;

    /**
     * Number of values currently in the window.
     */
    private int size;

    public BoundedWindow(int capacity) {
        checkArgument(capacity >= 1, "capacity must be greater than 0");
        this.capacity = capacity;
        this.buffer = new Object[capacity];
        this.head = 0;
        this.size = 0;
    }

    /**
     * Appends a value, evicting the oldest value first when the window is full.
     *
     * @param value the value to append, must not be null
     * @return the evicted value, or null if nothing was evicted
     */
    @SuppressWarnings("unchecked")
    public T push(T value) {
        checkNotNull(value, "value must not be null");
        T evicted = null;
        if (size == capacity) {
            evicted = (T) buffer[head];
            buffer[head] = value;
            head = (head + 1) % capacity;
        } else {
            buffer[(head + size) % capacity] = value;
            size++;
        }
        return evicted;
    }

    /**
     * @return a copy of the current contents, oldest first
     */
    @SuppressWarnings("unchecked")
    public List<T> values() {
        List<T> result = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            result.add((T) buffer[(head + i) % capacity]);
        }
        return result;
    }

    /**
     * @param index position counted from the oldest value
     * @return the value at that position
     */
    @SuppressWarnings("unchecked")
    public T get(int index) {
        checkArgument(index >= 0 && index < size, String.format("index must be in [0, %d)", size));
        return (T) buffer[(head + index) % capacity];
    }

    public int size() {
        return size;
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public boolean isFull() {
        return size == capacity;
    }

    public void clear() {
        for (int i = 0; i < capacity; i++) {
            buffer[i] = null;
        }
        head = 0;
        size = 0;
    }
}
