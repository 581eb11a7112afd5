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
 * Lifecycle status of a scatter-gather job held by the manager.
 *
 * The flow is:
 * CREATED -> AWAITING_PARTIALS -> COMPLETE
 *
 * Alternative flow:
 * AWAITING_PARTIALS -> FAILED (deadline expired before every partial arrived)
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum JobStatus {

    /**
     * Job record exists and chunks are being computed, nothing dispatched yet.
     */
    CREATED("Job created", false, false),

    /**
     * Every chunk has been dispatched; partial results are being collected.
     */
    AWAITING_PARTIALS("Awaiting partial results", false, false),

    /**
     * All partial results were combined and the reply was sent.
     * This is a terminal state.
     */
    COMPLETE("Job completed successfully", true, true),

    /**
     * The job expired before all partial results arrived and a failure reply was sent.
     * This is a terminal state.
     */
    FAILED("Job failed", true, false);

    private final String description;
    private final boolean terminal;
    private final boolean successful;

    JobStatus(String description, boolean terminal, boolean successful) {
        this.description = description;
        this.terminal = terminal;
        this.successful = successful;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Terminal states cannot transition to other states.
     */
    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * Check if transition from this status to the target status is valid.
     *
     * @param target the target status to transition to
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(JobStatus target) {
        if (this.isTerminal()) {
            return false;
        }

        switch (this) {
            case CREATED:
                return target == AWAITING_PARTIALS;
            case AWAITING_PARTIALS:
                return target == COMPLETE || target == FAILED;
            default:
                return false;
        }
    }

    /**
     * Get all valid transition targets from this status.
     *
     * @return array of valid target statuses
     */
    public JobStatus[] getValidTransitions() {
        switch (this) {
            case CREATED:
                return new JobStatus[]{AWAITING_PARTIALS};
            case AWAITING_PARTIALS:
                return new JobStatus[]{COMPLETE, FAILED};
            default:
                return new JobStatus[0];
        }
    }
}
