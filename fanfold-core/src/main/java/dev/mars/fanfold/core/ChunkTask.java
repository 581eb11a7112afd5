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

package dev.mars.fanfold.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One contiguous chunk of a job's input, sent by the manager to a single worker.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ChunkTask {

    @JsonProperty("jobId")
    private final long jobId;

    @JsonProperty("chunkIndex")
    private final int chunkIndex;

    @JsonProperty("values")
    private final long[] values;

    @JsonProperty("function")
    private final AggregationFunction function;

    @JsonCreator
    public ChunkTask(@JsonProperty("jobId") long jobId,
                     @JsonProperty("chunkIndex") int chunkIndex,
                     @JsonProperty("values") long[] values,
                     @JsonProperty("function") AggregationFunction function) {
        this(jobId, chunkIndex, function, values != null ? values.clone() : new long[0]);
    }

    private ChunkTask(long jobId, int chunkIndex, AggregationFunction function, long[] values) {
        if (chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex cannot be negative: " + chunkIndex);
        }
        this.jobId = jobId;
        this.chunkIndex = chunkIndex;
        this.values = values;
        this.function = Objects.requireNonNull(function, "function cannot be null");
    }

    /**
     * Build a task that takes ownership of {@code values}. The caller must not touch the array afterwards.
     */
    static ChunkTask adopting(long jobId, int chunkIndex, long[] values, AggregationFunction function) {
        return new ChunkTask(jobId, chunkIndex, function, Objects.requireNonNull(values, "values cannot be null"));
    }

    public long getJobId() {
        return jobId;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public long[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    /**
     * Fold this chunk with its function, seeded with the identity element.
     */
    public long fold() {
        return function.fold(values);
    }

    @Override
    public String toString() {
        return "ChunkTask{jobId=" + jobId + ", chunkIndex=" + chunkIndex +
                ", size=" + values.length + ", function=" + function + '}';
    }
}
