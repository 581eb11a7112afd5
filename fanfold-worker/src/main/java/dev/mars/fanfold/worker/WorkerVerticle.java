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

package dev.mars.fanfold.worker;

import dev.mars.fanfold.core.ChunkTask;
import dev.mars.fanfold.core.PartialResult;
import dev.mars.fanfold.worker.observability.WorkerTelemetryMetrics;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Folds chunk tasks and reports each partial result to the manager.
 *
 * <p>A worker holds no per-job state. Every {@link ChunkTask} arriving on its inbound
 * address is folded with the task's function and answered with exactly one
 * {@link PartialResult}, sent to the manager's partial-result address.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public class WorkerVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(WorkerVerticle.class);

    private final String workerId;
    private final String inboundAddress;
    private final String managerPartialAddress;
    private final WorkerTelemetryMetrics metrics;
    private final AtomicLong processedChunks = new AtomicLong();

    private MessageConsumer<ChunkTask> consumer;

    public WorkerVerticle(String workerId, String inboundAddress, String managerPartialAddress) {
        this(workerId, inboundAddress, managerPartialAddress, WorkerTelemetryMetrics.getInstance());
    }

    public WorkerVerticle(String workerId, String inboundAddress, String managerPartialAddress,
                          WorkerTelemetryMetrics metrics) {
        this.workerId = Objects.requireNonNull(workerId, "workerId cannot be null");
        this.inboundAddress = Objects.requireNonNull(inboundAddress, "inboundAddress cannot be null");
        this.managerPartialAddress = Objects.requireNonNull(managerPartialAddress,
                "managerPartialAddress cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    }

    @Override
    public void start(Promise<Void> startPromise) {
        consumer = vertx.eventBus().consumer(inboundAddress, this::onChunkTask);
        consumer.completion()
                .onSuccess(v -> {
                    logger.info("Worker {} listening on {}", workerId, inboundAddress);
                    startPromise.complete();
                })
                .onFailure(startPromise::fail);
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Worker {} stopping after {} chunks", workerId, processedChunks.get());
        if (consumer == null) {
            stopPromise.complete();
            return;
        }
        consumer.unregister().onComplete(ar -> stopPromise.complete());
    }

    void onChunkTask(Message<ChunkTask> message) {
        ChunkTask task = message.body();
        if (task == null) {
            logger.warn("Worker {} received an empty chunk message, ignoring", workerId);
            return;
        }

        long started = System.nanoTime();
        long value = task.fold();
        double durationSeconds = (System.nanoTime() - started) / 1_000_000_000.0;

        processedChunks.incrementAndGet();
        metrics.recordChunkProcessed(workerId, task.getFunction().name(), task.size(), durationSeconds);
        logger.debug("Worker {} folded job {} chunk {} ({} values) to {}",
                workerId, task.getJobId(), task.getChunkIndex(), task.size(), Long.toUnsignedString(value));

        vertx.eventBus().send(managerPartialAddress,
                new PartialResult(task.getJobId(), task.getChunkIndex(), value, workerId));
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getInboundAddress() {
        return inboundAddress;
    }

    /**
     * Number of chunk tasks this worker has folded since it was deployed.
     */
    public long getProcessedChunkCount() {
        return processedChunks.get();
    }
}
