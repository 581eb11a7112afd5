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

package dev.mars.fanfold.worker.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry metrics for Fanfold workers.
 *
 * Provides:
 * - fanfold.worker.chunks.processed (counter) - Chunk tasks folded
 * - fanfold.worker.values.folded (counter) - Input values folded
 * - fanfold.worker.fold.duration.seconds (histogram) - Time spent folding one chunk
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class WorkerTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkerTelemetryMetrics.class);
    private static final String METER_NAME = "fanfold-worker";

    private static WorkerTelemetryMetrics instance;

    private final LongCounter chunksProcessed;
    private final LongCounter valuesFolded;
    private final DoubleHistogram foldDuration;

    private static final AttributeKey<String> WORKER_ID_KEY = AttributeKey.stringKey("worker.id");
    private static final AttributeKey<String> FUNCTION_KEY = AttributeKey.stringKey("function");

    WorkerTelemetryMetrics(Meter meter) {
        chunksProcessed = meter.counterBuilder("fanfold.worker.chunks.processed")
                .setDescription("Number of chunk tasks folded")
                .setUnit("1")
                .build();

        valuesFolded = meter.counterBuilder("fanfold.worker.values.folded")
                .setDescription("Number of input values folded")
                .setUnit("1")
                .build();

        foldDuration = meter.histogramBuilder("fanfold.worker.fold.duration.seconds")
                .setDescription("Time spent folding one chunk")
                .setUnit("s")
                .build();
    }

    /**
     * Get the singleton instance bound to the global OpenTelemetry.
     */
    public static synchronized WorkerTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new WorkerTelemetryMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
            logger.info("WorkerTelemetryMetrics initialized");
        }
        return instance;
    }

    /**
     * Metrics that record nothing, for when telemetry is switched off.
     */
    public static WorkerTelemetryMetrics disabled() {
        return new WorkerTelemetryMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordChunkProcessed(String workerId, String function, int values, double durationSeconds) {
        Attributes attrs = Attributes.builder()
                .put(WORKER_ID_KEY, workerId)
                .put(FUNCTION_KEY, function)
                .build();
        chunksProcessed.add(1, attrs);
        valuesFolded.add(values, attrs);
        foldDuration.record(durationSeconds, attrs);
    }
}
