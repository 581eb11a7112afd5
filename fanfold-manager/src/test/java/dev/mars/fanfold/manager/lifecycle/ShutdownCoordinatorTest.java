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

package dev.mars.fanfold.manager.lifecycle;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ShutdownCoordinator} phase ordering and failure handling.
 */
@ExtendWith(VertxExtension.class)
class ShutdownCoordinatorTest {

    private static Future<Void> record(List<String> log, String entry) {
        log.add(entry);
        return Future.succeededFuture();
    }

    @Test
    void runsPhasesInOrder(VertxTestContext testContext) {
        List<String> log = new CopyOnWriteArrayList<>();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(1000, 1000)
                .onResourceClose("close", () -> record(log, "close"))
                .onServiceStop("stop-manager", () -> record(log, "stop-manager"))
                .onServiceStop("stop-workers", () -> record(log, "stop-workers"))
                .onAwaitCompletion("await", () -> record(log, "await"))
                .onDrain("drain", () -> record(log, "drain"));

        assertTrue(coordinator.isAcceptingWork());

        coordinator.shutdown().onComplete(testContext.succeeding(v -> testContext.verify(() -> {
            assertEquals(List.of("drain", "await", "stop-manager", "stop-workers", "close"), log);
            assertEquals(ShutdownCoordinator.State.STOPPED, coordinator.getState());
            assertTrue(coordinator.getFailedHooks().isEmpty());
            testContext.completeNow();
        })));
    }

    @Test
    void failingHookDoesNotStopTheSequence(VertxTestContext testContext) {
        List<String> log = new CopyOnWriteArrayList<>();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(1000, 1000)
                .onDrain("broken", () -> Future.failedFuture(new IllegalStateException("boom")))
                .onDrain("throwing", () -> {
                    throw new IllegalStateException("thrown");
                })
                .onServiceStop("stop", () -> record(log, "stop"));

        coordinator.shutdown().onComplete(testContext.succeeding(v -> testContext.verify(() -> {
            assertEquals(List.of("stop"), log);
            assertEquals(List.of("broken", "throwing"), coordinator.getFailedHooks());
            testContext.completeNow();
        })));
    }

    @Test
    void hookOverrunningItsTimeoutIsAbandoned(VertxTestContext testContext) {
        Promise<Void> never = Promise.promise();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(1000, 100)
                .onAwaitCompletion("stuck", never::future);

        coordinator.shutdown().onComplete(testContext.succeeding(v -> testContext.verify(() -> {
            assertEquals(List.of("stuck"), coordinator.getFailedHooks());
            testContext.completeNow();
        })));
    }

    @Test
    void repeatedShutdownReturnsSameFuture(Vertx vertx, VertxTestContext testContext) {
        List<String> log = new CopyOnWriteArrayList<>();
        ShutdownCoordinator coordinator = new ShutdownCoordinator(1000, 1000)
                .onServiceStop("slow", () -> vertx.timer(50).compose(id -> record(log, "slow")));

        Future<Void> first = coordinator.shutdown();
        Future<Void> second = coordinator.shutdown();

        assertSame(first, second);
        assertFalse(coordinator.isAcceptingWork());
        second.onComplete(testContext.succeeding(v -> testContext.verify(() -> {
            assertEquals(List.of("slow"), log);
            testContext.completeNow();
        })));
    }
}
