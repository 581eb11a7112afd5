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

/**
 * Half-open index range {@code [from, to)} of one chunk.
 *
 * @param index position of the chunk within its job
 * @param from  first element, inclusive
 * @param to    last element, exclusive
 */
public record ChunkRange(int index, int from, int to) {

    public ChunkRange {
        if (index < 0 || from < 0 || to < from) {
            throw new IllegalArgumentException(
                    "Invalid chunk range #" + index + ": [" + from + ", " + to + ")");
        }
    }

    public int size() {
        return to - from;
    }
}
