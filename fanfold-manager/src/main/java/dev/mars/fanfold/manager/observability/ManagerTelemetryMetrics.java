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

package dev.mars.fanfold.manager.observability;

import dev.mars.fanfold.core.FailureReason;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Fanfold manager.
 *
 * Provides:
 * - fanfold.jobs.active (gauge) - Jobs awaiting partial results
 * - fanfold.jobs.started (counter) - Jobs dispatched to workers
 * - fanfold.jobs.completed (counter) - Jobs answered with a result
 * - fanfold.jobs.failed (counter) - Jobs and requests answered with a failure
 * - fanfold.jobs.duration.seconds (histogram) - Time from dispatch to reply
 * - fanfold.chunks.dispatched (counter) - Chunk tasks sent to workers
 * - fanfold.partials.ignored (counter) - Stale, late, duplicate or out-of-range partials
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class ManagerTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ManagerTelemetryMetrics.class);
    private static final String METER_NAME = "fanfold-manager";

    private static ManagerTelemetryMetrics instance;

    // Counters
    private final LongCounter jobsStarted;
    private final LongCounter jobsCompleted;
    private final LongCounter jobsFailed;
    private final LongCounter chunksDispatched;
    private final LongCounter partialsIgnored;

    private final DoubleHistogram jobDuration;

    private final AtomicLong activeJobs = new AtomicLong(0);

    private static final AttributeKey<String> FUNCTION_KEY = AttributeKey.stringKey("function");
    private static final AttributeKey<String> REASON_KEY = AttributeKey.stringKey("reason");
    private static final AttributeKey<String> WORKER_ID_KEY = AttributeKey.stringKey("worker.id");

    ManagerTelemetryMetrics(Meter meter) {
        jobsStarted = meter.counterBuilder("fanfold.jobs.started")
                .setDescription("Number of jobs dispatched to workers")
                .setUnit("1")
                .build();

        jobsCompleted = meter.counterBuilder("fanfold.jobs.completed")
                .setDescription("Number of jobs answered with a result")
                .setUnit("1")
                .build();

        jobsFailed = meter.counterBuilder("fanfold.jobs.failed")
                .setDescription("Number of jobs and requests answered with a failure")
                .setUnit("1")
                .build();

        chunksDispatched = meter.counterBuilder("fanfold.chunks.dispatched")
                .setDescription("Number of chunk tasks sent to workers")
                .setUnit("1")
                .build();

        partialsIgnored = meter.counterBuilder("fanfold.partials.ignored")
                .setDescription("Number of partial results that were not folded")
                .setUnit("1")
                .build();

        jobDuration = meter.histogramBuilder("fanfold.jobs.duration.seconds")
                .setDescription("Time from dispatch to reply")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("fanfold.jobs.active")
                .setDescription("Number of jobs awaiting partial results")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeJobs.get()));
    }

    /**
     * Get the singleton instance bound to the global OpenTelemetry.
     */
    public static synchronized ManagerTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new ManagerTelemetryMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
            logger.info("ManagerTelemetryMetrics initialized");
        }
        return instance;
    }

    /**
     * Metrics that record nothing, for when telemetry is switched off.
     */
    public static ManagerTelemetryMetrics disabled() {
        return new ManagerTelemetryMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordJobStarted(String function) {
        jobsStarted.add(1, Attributes.of(FUNCTION_KEY, function));
        activeJobs.incrementAndGet();
    }

    public void recordChunkDispatched(String function, String workerId) {
        chunksDispatched.add(1, Attributes.builder()
                .put(FUNCTION_KEY, function)
                .put(WORKER_ID_KEY, workerId)
                .build());
    }

    public void recordJobCompleted(String function, double durationSeconds) {
        activeJobs.decrementAndGet();
        Attributes attrs = Attributes.of(FUNCTION_KEY, function);
        jobsCompleted.add(1, attrs);
        jobDuration.record(durationSeconds, attrs);
    }

    /**
     * Record a job that was dispatched and then failed.
     */
    public void recordJobFailed(String function, FailureReason reason, double durationSeconds) {
        activeJobs.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(FUNCTION_KEY, function)
                .put(REASON_KEY, reason.name())
                .build();
        jobsFailed.add(1, attrs);
        jobDuration.record(durationSeconds, attrs);
    }

    /**
     * Record a request refused before any job was created.
     */
    public void recordRequestRejected(FailureReason reason) {
        jobsFailed.add(1, Attributes.of(REASON_KEY, reason.name()));
    }

    public void recordPartialIgnored(String cause, String workerId) {
        partialsIgnored.add(1, Attributes.builder()
                .put(REASON_KEY, cause)
                .put(WORKER_ID_KEY, workerId != null ? workerId : "unknown")
                .build());
    }

    public long getActiveJobs() {
        return activeJobs.get();
    }
}
