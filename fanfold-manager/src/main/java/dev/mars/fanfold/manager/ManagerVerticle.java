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

import dev.mars.fanfold.config.FanfoldConfiguration;
import dev.mars.fanfold.core.AggregationFunction;
import dev.mars.fanfold.core.AggregationReply;
import dev.mars.fanfold.core.AggregationRequest;
import dev.mars.fanfold.core.EventBusAddresses;
import dev.mars.fanfold.core.FailureReason;
import dev.mars.fanfold.core.JobStatus;
import dev.mars.fanfold.core.PartialResult;
import dev.mars.fanfold.manager.observability.ManagerTelemetryMetrics;
import dev.mars.fanfold.manager.pool.WorkerPool;
import dev.mars.fanfold.manager.pool.WorkerRef;
import dev.mars.fanfold.partition.ChunkPartitioner;
import dev.mars.fanfold.partition.ChunkRange;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scatter-gather coordinator for aggregation requests.
 *
 * <p>Each request is split into contiguous chunks, one per selected worker, and the
 * partial results are folded back together as they arrive in any order. Exactly one
 * {@link AggregationReply} goes to the request's {@code replyTo} address: the result,
 * or a failure when the pool is empty, the deadline passes, the request is malformed or
 * the manager is draining.</p>
 *
 * <p>The live-job table, the worker pool and every deadline timer are only touched from
 * this verticle's context, so none of them are synchronized.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class ManagerVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(ManagerVerticle.class);

    private static final long IDLE_POLL_INTERVAL_MS = 50L;

    private final EventBusAddresses addresses;
    private final WorkerPool pool;
    private final long defaultTimeoutMs;
    private final ManagerTelemetryMetrics metrics;

    private final Map<Long, Job> jobs = new HashMap<>();
    private final Set<Long> recentlyFailed;

    private long nextJobId = 1L;
    private volatile int liveJobCount;
    private volatile boolean draining;

    private MessageConsumer<AggregationRequest> requestConsumer;
    private MessageConsumer<PartialResult> partialConsumer;

    public ManagerVerticle(FanfoldConfiguration config, WorkerPool pool) {
        this(config, pool, config.isTelemetryEnabled()
                ? ManagerTelemetryMetrics.getInstance()
                : ManagerTelemetryMetrics.disabled());
    }

    public ManagerVerticle(FanfoldConfiguration config, WorkerPool pool, ManagerTelemetryMetrics metrics) {
        Objects.requireNonNull(config, "config cannot be null");
        this.addresses = config.getAddresses();
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.defaultTimeoutMs = config.getJobTimeoutMs();
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");

        int capacity = config.getRecentlyFailedCapacity();
        this.recentlyFailed = Collections.newSetFromMap(new LinkedHashMap<Long, Boolean>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
                return size() > capacity;
            }
        });
    }

    @Override
    public void start(Promise<Void> startPromise) {
        requestConsumer = vertx.eventBus().consumer(addresses.managerRequests(), this::onRequest);
        partialConsumer = vertx.eventBus().consumer(addresses.managerPartials(), this::onPartialResult);

        Future.all(requestConsumer.completion(), partialConsumer.completion())
                .onSuccess(v -> {
                    logger.info("Manager started: {} workers, policy {}, default timeout {}ms, requests on {}",
                            pool.size(), pool.getPolicy(), defaultTimeoutMs, addresses.managerRequests());
                    startPromise.complete();
                })
                .onFailure(err -> {
                    logger.error("Manager failed to register its consumers", err);
                    startPromise.fail(err);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        if (!jobs.isEmpty()) {
            logger.warn("Manager stopping with {} jobs in flight, failing them", jobs.size());
            for (Job job : new ArrayList<>(jobs.values())) {
                fail(job, FailureReason.MANAGER_DRAINING, "Manager stopped before job " + job.getJobId() + " completed");
            }
        }

        List<Future<Void>> unregistrations = new ArrayList<>();
        if (requestConsumer != null) {
            unregistrations.add(requestConsumer.unregister());
        }
        if (partialConsumer != null) {
            unregistrations.add(partialConsumer.unregister());
        }
        Future.all(unregistrations).onComplete(ar -> {
            logger.info("Manager stopped");
            stopPromise.complete();
        });
    }

    // ==================== Requests ====================

    void onRequest(Message<AggregationRequest> message) {
        AggregationRequest request = message.body();
        if (request == null) {
            logger.warn("Ignoring empty aggregation request message");
            return;
        }

        String replyTo = request.getReplyTo();
        if (replyTo == null || replyTo.isBlank()) {
            logger.warn("Dropping request without a reply address: {}", request);
            metrics.recordRequestRejected(FailureReason.INVALID_REQUEST);
            return;
        }
        if (request.getFunction() == null) {
            reject(replyTo, FailureReason.INVALID_REQUEST, "Request has no aggregation function");
            return;
        }
        if (draining) {
            reject(replyTo, FailureReason.MANAGER_DRAINING, null);
            return;
        }
        if (pool.isEmpty()) {
            reject(replyTo, FailureReason.WORKER_UNAVAILABLE, null);
            return;
        }

        AggregationFunction function = request.getFunction();
        if (request.size() == 0) {
            logger.debug("Empty {} request answered with the identity element", function);
            vertx.eventBus().send(replyTo, AggregationReply.success(null, function.identity()));
            return;
        }

        long jobId = nextJobId++;
        List<ChunkRange> ranges = ChunkPartitioner.partition(request.size(), pool.size());
        Job job = new Job(jobId, function, ranges.size(), replyTo);
        job.transitionTo(JobStatus.AWAITING_PARTIALS);
        jobs.put(jobId, job);
        liveJobCount = jobs.size();
        metrics.recordJobStarted(function.name());

        long timeoutMs = request.usesDefaultTimeout() ? defaultTimeoutMs : request.getTimeoutMs();
        if (timeoutMs > 0) {
            long timerId = vertx.setTimer(timeoutMs, id -> onTimeout(jobId));
            job.setDeadline(Instant.now().plusMillis(timeoutMs), timerId);
        }

        logger.debug("Job {} created: {} values of {} over {} chunks, timeout {}ms",
                jobId, request.size(), function, ranges.size(), timeoutMs);

        for (ChunkRange range : ranges) {
            WorkerRef worker = pool.selectWorker();
            job.assign(range.index(), worker.index());
            vertx.eventBus().send(worker.address(),
                    request.chunk(jobId, range.index(), range.from(), range.to()));
            metrics.recordChunkDispatched(function.name(), worker.workerId());
        }
    }

    // ==================== Partial results ====================

    void onPartialResult(Message<PartialResult> message) {
        PartialResult partial = message.body();
        if (partial == null) {
            logger.warn("Ignoring empty partial result message");
            return;
        }

        Job job = jobs.get(partial.getJobId());
        if (job == null) {
            if (recentlyFailed.contains(partial.getJobId())) {
                logger.info("Late partial for timed-out job {} chunk {} from {}, ignoring",
                        partial.getJobId(), partial.getChunkIndex(), partial.getWorkerId());
                metrics.recordPartialIgnored("late", partial.getWorkerId());
            } else {
                logger.debug("Partial for unknown job {} from {}, ignoring",
                        partial.getJobId(), partial.getWorkerId());
                metrics.recordPartialIgnored("unknown", partial.getWorkerId());
            }
            return;
        }

        switch (job.recordPartial(partial.getChunkIndex(), partial.getValue())) {
            case DUPLICATE:
                logger.debug("Duplicate partial for job {} chunk {} from {}, ignoring",
                        job.getJobId(), partial.getChunkIndex(), partial.getWorkerId());
                metrics.recordPartialIgnored("duplicate", partial.getWorkerId());
                return;
            case OUT_OF_RANGE:
                logger.warn("Partial for job {} names chunk {} but the job has {} chunks, ignoring",
                        job.getJobId(), partial.getChunkIndex(), job.getExpectedChunks());
                metrics.recordPartialIgnored("out_of_range", partial.getWorkerId());
                return;
            case ACCEPTED:
            default:
                pool.release(job.getAssignedWorker(partial.getChunkIndex()));
                break;
        }

        logger.debug("Job {} received chunk {} ({}/{})",
                job.getJobId(), partial.getChunkIndex(), job.getReceivedCount(), job.getExpectedChunks());

        if (job.isComplete()) {
            complete(job);
        }
    }

    // ==================== Deadlines ====================

    void onTimeout(long jobId) {
        Job job = jobs.get(jobId);
        if (job == null || job.getStatus() != JobStatus.AWAITING_PARTIALS) {
            logger.debug("Deadline fired for job {} which is no longer live", jobId);
            return;
        }

        List<Integer> missing = job.getMissingChunks();
        logger.warn("Job {} timed out with {} of {} chunks received, missing {}",
                jobId, job.getReceivedCount(), job.getExpectedChunks(), missing);

        fail(job, FailureReason.JOB_TIMEOUT, String.format("Job %d timed out with %d of %d chunks received",
                jobId, job.getReceivedCount(), job.getExpectedChunks()));
        recentlyFailed.add(jobId);
    }

    // ==================== Drain ====================

    /**
     * Stops accepting new requests; later requests are answered with
     * {@code MANAGER_DRAINING}. Jobs already in flight keep running.
     *
     * @return an already completed future, so it can be used as a drain hook
     */
    public Future<Void> drain() {
        if (!draining) {
            draining = true;
            logger.info("Manager draining with {} jobs in flight", liveJobCount);
        }
        return Future.succeededFuture();
    }

    /**
     * Waits for the job table to empty, polling on the manager's context.
     *
     * @return a future completing once no job is in flight
     */
    public Future<Void> awaitIdle() {
        if (liveJobCount == 0) {
            return Future.succeededFuture();
        }
        return vertx.timer(IDLE_POLL_INTERVAL_MS).compose(v -> awaitIdle());
    }

    /**
     * @return true once {@link #drain()} has been called
     */
    public boolean isDraining() {
        return draining;
    }

    /**
     * Number of jobs still awaiting partial results. Safe to read from any thread.
     *
     * @return the live job count
     */
    public int getLiveJobCount() {
        return liveJobCount;
    }

    // ==================== Internals ====================

    private void complete(Job job) {
        job.transitionTo(JobStatus.COMPLETE);
        cancelTimer(job);
        remove(job);

        double durationSeconds = job.getAge().toNanos() / 1_000_000_000.0;
        metrics.recordJobCompleted(job.getFunction().name(), durationSeconds);
        logger.debug("Job {} complete: {} = {}", job.getJobId(), job.getFunction(),
                Long.toUnsignedString(job.getAccumulator()));

        vertx.eventBus().send(job.getReplyTo(), AggregationReply.success(job.getJobId(), job.getAccumulator()));
    }

    private void fail(Job job, FailureReason reason, String message) {
        job.transitionTo(JobStatus.FAILED);
        cancelTimer(job);
        for (int chunk : job.getMissingChunks()) {
            pool.release(job.getAssignedWorker(chunk));
        }
        remove(job);

        double durationSeconds = job.getAge().toNanos() / 1_000_000_000.0;
        metrics.recordJobFailed(job.getFunction().name(), reason, durationSeconds);

        vertx.eventBus().send(job.getReplyTo(), AggregationReply.failure(job.getJobId(), reason, message));
    }

    private void reject(String replyTo, FailureReason reason, String message) {
        logger.info("Rejecting request for {}: {}", replyTo, message != null ? message : reason.getDescription());
        metrics.recordRequestRejected(reason);
        vertx.eventBus().send(replyTo, AggregationReply.failure(null, reason, message));
    }

    private void cancelTimer(Job job) {
        if (job.getTimerId() != Job.NO_TIMER) {
            vertx.cancelTimer(job.getTimerId());
        }
    }

    private void remove(Job job) {
        jobs.remove(job.getJobId());
        liveJobCount = jobs.size();
    }
}
