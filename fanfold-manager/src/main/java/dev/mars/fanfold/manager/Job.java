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

package dev.mars.fanfold.manager;

import dev.mars.fanfold.core.AggregationFunction;
import dev.mars.fanfold.core.JobStatus;
import dev.mars.fanfold.core.exceptions.InvalidTransitionException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One in-flight aggregation owned by the manager.
 *
 * <p>Tracks which chunks have reported, folds each accepted partial into a running
 * accumulator and remembers which worker each chunk went to. At most
 * {@code expectedChunks} partials are ever accepted; the job is complete exactly when
 * that many have arrived.</p>
 *
 * <p>Not thread-safe. Only the manager's context touches a job.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class Job {

    /**
     * What happened to a partial result offered to a job.
     */
    public enum PartialOutcome {
        ACCEPTED,
        DUPLICATE,
        OUT_OF_RANGE
    }

    static final long NO_TIMER = -1L;

    private final long jobId;
    private final AggregationFunction function;
    private final int expectedChunks;
    private final String replyTo;
    private final Instant createdAt;
    private final Map<Integer, Long> receivedPartials = new HashMap<>();
    private final int[] assignments;

    private long accumulator;
    private JobStatus status = JobStatus.CREATED;
    private Instant deadline;
    private long timerId = NO_TIMER;

    public Job(long jobId, AggregationFunction function, int expectedChunks, String replyTo) {
        if (expectedChunks < 1) {
            throw new IllegalArgumentException("expectedChunks must be at least 1: " + expectedChunks);
        }
        this.jobId = jobId;
        this.function = Objects.requireNonNull(function, "function cannot be null");
        this.expectedChunks = expectedChunks;
        this.replyTo = Objects.requireNonNull(replyTo, "replyTo cannot be null");
        this.createdAt = Instant.now();
        this.accumulator = function.identity();
        this.assignments = new int[expectedChunks];
        Arrays.fill(this.assignments, -1);
    }

    public void transitionTo(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidTransitionException("job-" + jobId, status, target, status.getValidTransitions());
        }
        status = target;
    }

    public void assign(int chunkIndex, int workerIndex) {
        checkChunkIndex(chunkIndex);
        assignments[chunkIndex] = workerIndex;
    }

    /**
     * Worker index the chunk was dispatched to, or -1 if it was never assigned.
     */
    public int getAssignedWorker(int chunkIndex) {
        checkChunkIndex(chunkIndex);
        return assignments[chunkIndex];
    }

    /**
     * Offer a partial result. Only the first result for each chunk is folded in.
     *
     * @throws IllegalStateException if the job is not awaiting partials
     */
    public PartialOutcome recordPartial(int chunkIndex, long value) {
        if (status != JobStatus.AWAITING_PARTIALS) {
            throw new IllegalStateException("Job " + jobId + " is " + status + ", not accepting partials");
        }
        if (chunkIndex < 0 || chunkIndex >= expectedChunks) {
            return PartialOutcome.OUT_OF_RANGE;
        }
        if (receivedPartials.putIfAbsent(chunkIndex, value) != null) {
            return PartialOutcome.DUPLICATE;
        }
        accumulator = function.combine(accumulator, value);
        return PartialOutcome.ACCEPTED;
    }

    public boolean isComplete() {
        return receivedPartials.size() == expectedChunks;
    }

    /**
     * Chunk indexes with no partial yet, in index order.
     */
    public List<Integer> getMissingChunks() {
        List<Integer> missing = new ArrayList<>();
        for (int i = 0; i < expectedChunks; i++) {
            if (!receivedPartials.containsKey(i)) {
                missing.add(i);
            }
        }
        return missing;
    }

    public long getJobId() {
        return jobId;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    public int getExpectedChunks() {
        return expectedChunks;
    }

    public int getReceivedCount() {
        return receivedPartials.size();
    }

    public long getAccumulator() {
        return accumulator;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public JobStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Duration getAge() {
        return Duration.between(createdAt, Instant.now());
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    void setDeadline(Instant deadline, long timerId) {
        this.deadline = deadline;
        this.timerId = timerId;
    }

    long getTimerId() {
        return timerId;
    }

    private void checkChunkIndex(int chunkIndex) {
        if (chunkIndex < 0 || chunkIndex >= expectedChunks) {
            throw new IndexOutOfBoundsException(
                    "Chunk " + chunkIndex + " out of range for job " + jobId + " with " + expectedChunks + " chunks");
        }
    }

    @Override
    public String toString() {
        return "Job{jobId=" + jobId + ", function=" + function + ", status=" + status +
                ", received=" + receivedPartials.size() + "/" + expectedChunks + '}';
    }
}
