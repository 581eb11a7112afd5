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

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable request for the manager to aggregate a sequence of unsigned 64-bit values.
 *
 * <p>The request names the values, the aggregation function and the event bus
 * address that receives the single {@link AggregationReply}. An optional timeout
 * overrides the manager's default job deadline.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * AggregationRequest request = AggregationRequest.builder()
 *     .data(1, 2, 3, 4, 5, 6, 7)
 *     .function(AggregationFunction.SUM)
 *     .replyTo("fanfold.replies.client-1")
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @see AggregationReply
 */
public final class AggregationRequest {

    /** Timeout value meaning "use the manager's configured default". */
    public static final long DEFAULT_TIMEOUT = -1L;

    /** Timeout value meaning "no deadline for this job". */
    public static final long NO_TIMEOUT = 0L;

    @JsonProperty("data")
    private final long[] data;

    @JsonProperty("function")
    private final AggregationFunction function;

    @JsonProperty("replyTo")
    private final String replyTo;

    @JsonProperty("timeoutMs")
    private final long timeoutMs;

    @JsonCreator
    AggregationRequest(@JsonProperty("data") long[] data,
                       @JsonProperty("function") AggregationFunction function,
                       @JsonProperty("replyTo") String replyTo,
                       @JsonProperty("timeoutMs") Long timeoutMs) {
        this.data = data != null ? data.clone() : new long[0];
        this.function = function;
        this.replyTo = replyTo;
        this.timeoutMs = timeoutMs == null || timeoutMs < 0 ? DEFAULT_TIMEOUT : timeoutMs;
    }

    private AggregationRequest(Builder builder) {
        this(builder.data,
                Objects.requireNonNull(builder.function, "function cannot be null"),
                Objects.requireNonNull(builder.replyTo, "replyTo cannot be null"),
                builder.timeoutMs);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a copy of the values to aggregate
     */
    public long[] getData() {
        return data.clone();
    }

    /**
     * Length of the data without copying it.
     */
    public int size() {
        return data.length;
    }

    /**
     * Cut {@code [from, to)} of this request's data into a task for one worker.
     * The slice is copied once and owned by the returned task.
     *
     * @param jobId      correlation id of the job the chunk belongs to
     * @param chunkIndex position of the chunk within the job
     * @return the chunk task, folded with this request's function
     * @throws IndexOutOfBoundsException if the range falls outside the data
     */
    public ChunkTask chunk(long jobId, int chunkIndex, int from, int to) {
        if (from < 0 || to > data.length || from > to) {
            throw new IndexOutOfBoundsException("Range [" + from + ", " + to + ") outside data of length " + data.length);
        }
        return ChunkTask.adopting(jobId, chunkIndex, Arrays.copyOfRange(data, from, to), function);
    }

    public AggregationFunction getFunction() {
        return function;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public boolean usesDefaultTimeout() {
        return timeoutMs == DEFAULT_TIMEOUT;
    }

    @Override
    public String toString() {
        return "AggregationRequest{" +
                "size=" + data.length +
                ", function=" + function +
                ", replyTo='" + replyTo + '\'' +
                ", timeoutMs=" + timeoutMs +
                '}';
    }

    public static class Builder {
        private long[] data = new long[0];
        private AggregationFunction function;
        private String replyTo;
        private long timeoutMs = DEFAULT_TIMEOUT;

        public Builder data(long... data) {
            this.data = data;
            return this;
        }

        public Builder function(AggregationFunction function) {
            this.function = function;
            return this;
        }

        public Builder replyTo(String replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        /**
         * Per-request deadline in milliseconds; {@link #NO_TIMEOUT} disables it.
         */
        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs < 0) {
                throw new IllegalArgumentException("timeoutMs cannot be negative: " + timeoutMs);
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public AggregationRequest build() {
            return new AggregationRequest(this);
        }
    }
}
