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

package dev.mars.fanfold.partition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits an input of a given length into contiguous, near-equal chunks.
 *
 * <p>The chunk count is {@code min(parts, length)}. Sizes differ by at most one:
 * the first {@code length % count} chunks take one extra element, so 7 values over
 * 3 parts become sizes [3, 2, 2]. The ranges cover {@code [0, length)} exactly,
 * without gaps or overlap, and no chunk is empty.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ChunkPartitioner {

    private ChunkPartitioner() {
    }

    /**
     * @param length number of elements to split, zero or more
     * @param parts  maximum number of chunks, at least one
     * @return the chunk ranges in index order; empty when {@code length} is zero
     */
    public static List<ChunkRange> partition(int length, int parts) {
        if (length < 0) {
            throw new IllegalArgumentException("length cannot be negative: " + length);
        }
        if (parts < 1) {
            throw new IllegalArgumentException("parts must be at least 1: " + parts);
        }
        if (length == 0) {
            return Collections.emptyList();
        }

        int count = Math.min(parts, length);
        int base = length / count;
        int remainder = length % count;

        List<ChunkRange> ranges = new ArrayList<>(count);
        int start = 0;
        for (int i = 0; i < count; i++) {
            int size = base + (i < remainder ? 1 : 0);
            ranges.add(new ChunkRange(i, start, start + size));
            start += size;
        }
        return Collections.unmodifiableList(ranges);
    }
}
