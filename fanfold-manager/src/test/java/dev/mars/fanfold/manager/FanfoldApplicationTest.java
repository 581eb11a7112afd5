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
import dev.mars.fanfold.core.FailureReason;
import dev.mars.fanfold.manager.lifecycle.ShutdownCoordinator;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: real workers, real manager, one Vert.x instance.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
@ExtendWith(VertxExtension.class)
class FanfoldApplicationTest {

    private static FanfoldConfiguration config(int poolSize, String policy) {
        Properties props = new Properties();
        props.setProperty(FanfoldConfiguration.POOL_SIZE, Integer.toString(poolSize));
        props.setProperty(FanfoldConfiguration.DISPATCH_POLICY, policy);
        props.setProperty(FanfoldConfiguration.JOB_TIMEOUT_MS, "5000");
        props.setProperty(FanfoldConfiguration.TELEMETRY_ENABLED, "false");
        return new FanfoldConfiguration(props);
    }

    @Nested
    @DisplayName("Deployed application")
    class Deployed {

        @ParameterizedTest(name = "{0} workers, {1}")
        @CsvSource({"1, ROUND_ROBIN", "4, ROUND_ROBIN", "3, LEAST_LOADED"})
        void sumsOneToOneThousand(int workers, String policy, Vertx vertx, VertxTestContext testContext) {
            FanfoldApplication.start(vertx, config(workers, policy))
                    .compose(app -> app.client().aggregate(FanfoldApplication.sequence(1000), AggregationFunction.SUM)
                            .compose(result -> app.stop().map(result)))
                    .onComplete(testContext.succeeding(result -> testContext.verify(() -> {
                        assertEquals(500500L, result);
                        testContext.completeNow();
                    })));
        }

        @Test
        void concurrentRequestsEachGetTheirOwnReply(Vertx vertx, VertxTestContext testContext) {
            FanfoldApplication.start(vertx, config(4, "LEAST_LOADED"))
                    .onComplete(testContext.succeeding(app -> {
                        app.client().aggregate(new long[]{3L, 1L, 4L, 1L, 5L, 9L, 2L, 6L}, AggregationFunction.MAX)
                                .onComplete(testContext.succeeding(max -> testContext.verify(() -> assertEquals(9L, max))));
                        app.client().aggregate(new long[]{0b1100L, 0b0110L}, AggregationFunction.XOR)
                                .onComplete(testContext.succeeding(xor -> testContext.verify(() -> {
                                    assertEquals(0b1010L, xor);
                                    testContext.completeNow();
                                })));
                    }));
        }

        @Test
        void stopDrainsAndUndeploys(Vertx vertx, VertxTestContext testContext) {
            FanfoldApplication.start(vertx, config(2, "ROUND_ROBIN"))
                    .compose(app -> app.stop().map(app))
                    .onComplete(testContext.succeeding(app -> testContext.verify(() -> {
                        assertTrue(app.manager().isDraining());
                        assertEquals(ShutdownCoordinator.State.STOPPED, app.shutdownCoordinator().getState());
                        assertTrue(app.shutdownCoordinator().getFailedHooks().isEmpty());
                        assertTrue(vertx.deploymentIDs().isEmpty());
                        testContext.completeNow();
                    })));
        }

        @Test
        void zeroWorkersReplyWorkerUnavailable(Vertx vertx, VertxTestContext testContext) {
            FanfoldApplication.start(vertx, config(0, "ROUND_ROBIN"))
                    .compose(app -> app.client().submit(new long[]{1L}, AggregationFunction.SUM))
                    .onComplete(testContext.succeeding(reply -> testContext.verify(() -> {
                        assertEquals(FailureReason.WORKER_UNAVAILABLE, reply.getFailureReason().orElseThrow());
                        testContext.completeNow();
                    })));
        }

        @Test
        void unknownDispatchPolicyFailsStartup(Vertx vertx, VertxTestContext testContext) {
            FanfoldApplication.start(vertx, config(2, "RANDOM"))
                    .onComplete(testContext.failing(err -> testContext.verify(() -> {
                        assertInstanceOf(IllegalArgumentException.class, err);
                        testContext.completeNow();
                    })));
        }
    }

    @Nested
    @DisplayName("Command line")
    class CommandLine {

        @Test
        void demoRunSucceeds() {
            assertEquals(0, FanfoldApplication.run(new String[]{"3", "100"}));
        }

        @Test
        void emptyPoolRunFails() {
            assertEquals(1, FanfoldApplication.run(new String[]{"0", "10"}));
        }

        @Test
        void badArgumentsAreRejected() {
            assertEquals(2, FanfoldApplication.run(new String[]{"3"}));
            assertEquals(2, FanfoldApplication.run(new String[]{"three", "10"}));
            assertEquals(2, FanfoldApplication.run(new String[]{"-1", "10"}));
        }

        @Test
        void workerCountArgumentWinsOverSystemProperty() {
            System.setProperty(FanfoldConfiguration.POOL_SIZE, "0");
            try {
                assertEquals(0, FanfoldApplication.run(new String[]{"3", "10"}));
            } finally {
                System.clearProperty(FanfoldConfiguration.POOL_SIZE);
            }
        }

        @Test
        void clientWaitsAtLeastAsLongAsTheJobDeadline() {
            Properties props = new Properties();
            props.setProperty(FanfoldConfiguration.JOB_TIMEOUT_MS, "90000");
            props.setProperty(FanfoldConfiguration.CLIENT_REPLY_TIMEOUT_MS, "60000");
            assertEquals(91000L, FanfoldApplication.clientReplyTimeoutMs(new FanfoldConfiguration(props)));

            props.setProperty(FanfoldConfiguration.JOB_TIMEOUT_MS, "500");
            assertEquals(60000L, FanfoldApplication.clientReplyTimeoutMs(new FanfoldConfiguration(props)));
        }

        @Test
        void triangularNumbers() {
            assertEquals(0L, FanfoldApplication.triangular(0));
            assertEquals(28L, FanfoldApplication.triangular(7));
            assertEquals(500500L, FanfoldApplication.triangular(1000));
            assertEquals(AggregationFunction.SUM.fold(FanfoldApplication.sequence(99)), FanfoldApplication.triangular(99));
        }
    }
}
