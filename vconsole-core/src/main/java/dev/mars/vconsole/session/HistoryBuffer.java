/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.vconsole.session;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Bounded command history. Once full, each new entry silently replaces the
 * oldest one.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-23
 * @version 1.0
 */
public final class HistoryBuffer {

    public static final int DEFAULT_CAPACITY = 1000;

    private final String[] entries;
    private int head;
    private int size;

    public HistoryBuffer() {
        this(DEFAULT_CAPACITY);
    }

    public HistoryBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("History capacity must be positive: " + capacity);
        }
        this.entries = new String[capacity];
    }

    public synchronized void add(String entry) {
        entries[(head + size) % entries.length] = entry;
        if (size < entries.length) {
            size++;
        } else {
            head = (head + 1) % entries.length;
        }
    }

    public synchronized void addAll(List<String> items) {
        items.forEach(this::add);
    }

    /**
     * Returns the entries oldest first.
     */
    public synchronized List<String> toList() {
        List<String> list = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            list.add(entries[(head + i) % entries.length]);
        }
        return list;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return entries.length;
    }

    public synchronized boolean isEmpty() {
        return size == 0;
    }

    public synchronized void clear() {
        Arrays.fill(entries, null);
        head = 0;
        size = 0;
    }
}
