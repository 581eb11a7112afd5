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

import dev.mars.fanfold.codec.FanfoldCodecs;
import dev.mars.fanfold.core.AggregationFunction;
import dev.mars.fanfold.core.ChunkTask;
import dev.mars.fanfold.core.PartialResult;
import dev.mars.fanfold.worker.observability.WorkerTelemetryMetrics;
import io.vertx.core.Vertx;
import io.vertx.junit5.Checkpoint;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorkerVerticle} on a real event bus.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
class WorkerVerticleTest {

    private static final String INBOUND = "test.worker.0";
    private static final String PARTIALS = "test.manager.partials";

    private WorkerVerticle worker;

    @BeforeEach
    void deployWorker(Vertx vertx, VertxTestContext testContext) {
        FanfoldCodecs.registerAll(vertx);
        worker = new WorkerVerticle("worker-0", INBOUND, PARTIALS, WorkerTelemetryMetrics.disabled());
        vertx.deployVerticle(worker).onComplete(testContext.succeedingThenComplete());
    }

    @Test
    @DisplayName("Folds a chunk and reports the partial to the manager")
    void foldsChunkAndReportsPartial(Vertx vertx, VertxTestContext testContext) {
        vertx.eventBus().<PartialResult>consumer(PARTIALS, message -> testContext.verify(() -> {
            PartialResult partial = message.body();
            assertEquals(9L, partial.getJobId());
            assertEquals(1, partial.getChunkIndex());
            assertEquals(12L, partial.getValue());
            assertEquals("worker-0", partial.getWorkerId());
            assertEquals(1L, worker.getProcessedChunkCount());
            testContext.completeNow();
        })).completion().onSuccess(v -> vertx.eventBus().send(INBOUND,
                new ChunkTask(9L, 1, new long[]{3L, 4L, 5L}, AggregationFunction.SUM)));
    }

    @Test
    @DisplayName("Empty chunk folds to the identity element")
    void emptyChunkFoldsToIdentity(Vertx vertx, VertxTestContext testContext) {
        vertx.eventBus().<PartialResult>consumer(PARTIALS, message -> testContext.verify(() -> {
            assertEquals(AggregationFunction.AND.identity(), message.body().getValue());
            testContext.completeNow();
        })).completion().onSuccess(v -> vertx.eventBus().send(INBOUND,
                new ChunkTask(1L, 0, new long[0], AggregationFunction.AND)));
    }

    @Test
    @DisplayName("Answers every task exactly once")
    void answersEveryTaskOnce(Vertx vertx, VertxTestContext testContext) throws InterruptedException {
        int tasks = 5;
        Checkpoint received = testContext.checkpoint(tasks);
        List<Integer> indexes = new CopyOnWriteArrayList<>();

        vertx.eventBus().<PartialResult>consumer(PARTIALS, message -> {
            indexes.add(message.body().getChunkIndex());
            received.flag();
        }).completion().onSuccess(v -> {
            for (int i = 0; i < tasks; i++) {
                vertx.eventBus().send(INBOUND,
                        new ChunkTask(2L, i, new long[]{i, i + 1L}, AggregationFunction.MAX));
            }
        });

        assertTrue(testContext.awaitCompletion(5, TimeUnit.SECONDS));
        assertEquals(List.of(0, 1, 2, 3, 4), indexes);
        assertEquals(tasks, worker.getProcessedChunkCount());
    }
}
