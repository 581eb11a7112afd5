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

/**
 * Reasons a request can end in a failure reply instead of a result.
 *
 * <p>Only job-level terminal failures are surfaced to callers. Stale and
 * duplicate partial results are absorbed by the manager and have no entry here.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum FailureReason {

    /** The job did not collect every partial result before its deadline. */
    JOB_TIMEOUT("Job did not complete before its deadline"),

    /** The worker pool has no eligible workers; no job was created. */
    WORKER_UNAVAILABLE("No eligible workers in the pool"),

    /** The manager is shutting down and no longer accepts requests. */
    MANAGER_DRAINING("Manager is draining and not accepting new requests"),

    /** The request was missing its aggregation function or otherwise malformed. */
    INVALID_REQUEST("Request is malformed");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
