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
 * Folded value of one chunk, sent by a worker back to its manager.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class PartialResult {

    @JsonProperty("jobId")
    private final long jobId;

    @JsonProperty("chunkIndex")
    private final int chunkIndex;

    @JsonProperty("value")
    private final long value;

    @JsonProperty("workerId")
    private final String workerId;

    @JsonCreator
    public PartialResult(@JsonProperty("jobId") long jobId,
                         @JsonProperty("chunkIndex") int chunkIndex,
                         @JsonProperty("value") long value,
                         @JsonProperty("workerId") String workerId) {
        this.jobId = jobId;
        this.chunkIndex = chunkIndex;
        this.value = value;
        this.workerId = workerId;
    }

    public long getJobId() {
        return jobId;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    /**
     * Partial aggregate, interpreted as unsigned.
     */
    public long getValue() {
        return value;
    }

    public String getWorkerId() {
        return workerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PartialResult that = (PartialResult) o;
        return jobId == that.jobId && chunkIndex == that.chunkIndex
                && value == that.value && Objects.equals(workerId, that.workerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, chunkIndex, value, workerId);
    }

    @Override
    public String toString() {
        return "PartialResult{jobId=" + jobId + ", chunkIndex=" + chunkIndex +
                ", value=" + Long.toUnsignedString(value) + ", workerId='" + workerId + "'}";
    }
}
