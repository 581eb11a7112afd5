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

package dev.mars.fanfold.core.exceptions;

import dev.mars.fanfold.core.FailureReason;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Exception raised on the caller side when an aggregation ends in a failure reply.
 * Carries the failure reason and, where a job was created, its correlation id.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class AggregationException extends FanfoldException {

    private final Long jobId;
    private final FailureReason reason;

    public AggregationException(Long jobId, FailureReason reason, String message) {
        super(message);
        this.jobId = jobId;
        this.reason = Objects.requireNonNull(reason, "reason cannot be null");
    }

    public OptionalLong getJobId() {
        return jobId != null ? OptionalLong.of(jobId) : OptionalLong.empty();
    }

    public FailureReason getReason() {
        return reason;
    }

    @Override
    public String getMessage() {
        String job = jobId != null ? "Job " + jobId : "Request";
        return String.format("%s failed (%s): %s", job, reason, super.getMessage());
    }
}
