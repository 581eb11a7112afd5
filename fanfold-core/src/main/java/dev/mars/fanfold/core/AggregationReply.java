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
import dev.mars.fanfold.core.exceptions.AggregationException;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * The single reply the manager sends to a request's {@code replyTo} address.
 *
 * <p>A reply is either successful and carries the aggregate, or a failure that
 * carries a {@link FailureReason} and a message and never a result value. The
 * job id is present whenever a job was created for the request; empty-input
 * replies and fail-fast rejections have none.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @see AggregationRequest
 */
public final class AggregationReply {

    @JsonProperty("jobId")
    private final Long jobId;

    @JsonProperty("successful")
    private final boolean successful;

    @JsonProperty("result")
    private final long result;

    @JsonProperty("failureReason")
    private final FailureReason failureReason;

    @JsonProperty("errorMessage")
    private final String errorMessage;

    @JsonCreator
    AggregationReply(@JsonProperty("jobId") Long jobId,
                     @JsonProperty("successful") boolean successful,
                     @JsonProperty("result") long result,
                     @JsonProperty("failureReason") FailureReason failureReason,
                     @JsonProperty("errorMessage") String errorMessage) {
        if (!successful && failureReason == null) {
            throw new IllegalArgumentException("A failure reply needs a failure reason");
        }
        this.jobId = jobId;
        this.successful = successful;
        this.result = successful ? result : 0L;
        this.failureReason = successful ? null : failureReason;
        this.errorMessage = successful ? null : errorMessage;
    }

    /**
     * Successful reply carrying the aggregate.
     *
     * @param jobId  the job that produced it, or null when no job was created
     * @param result the aggregate, interpreted as unsigned
     */
    public static AggregationReply success(Long jobId, long result) {
        return new AggregationReply(jobId, true, result, null, null);
    }

    /**
     * Failure reply.
     *
     * @param jobId   the failed job, or null when the request was rejected before a job existed
     * @param reason  why the request failed
     * @param message human-readable detail
     */
    public static AggregationReply failure(Long jobId, FailureReason reason, String message) {
        Objects.requireNonNull(reason, "reason cannot be null");
        return new AggregationReply(jobId, false, 0L, reason,
                message != null ? message : reason.getDescription());
    }

    public OptionalLong getJobId() {
        return jobId != null ? OptionalLong.of(jobId) : OptionalLong.empty();
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * @return the aggregate for a successful reply, empty for a failure
     */
    public OptionalLong getResult() {
        return successful ? OptionalLong.of(result) : OptionalLong.empty();
    }

    public Optional<FailureReason> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    /**
     * Convert a failure reply into the exception callers see.
     *
     * @throws IllegalStateException if this reply is successful
     */
    public AggregationException toException() {
        if (successful) {
            throw new IllegalStateException("Reply is successful, nothing to raise");
        }
        return new AggregationException(jobId, failureReason, errorMessage);
    }

    @Override
    public String toString() {
        if (successful) {
            return "AggregationReply{jobId=" + jobId + ", result=" + Long.toUnsignedString(result) + '}';
        }
        return "AggregationReply{jobId=" + jobId + ", failureReason=" + failureReason +
                ", errorMessage='" + errorMessage + "'}";
    }
}
