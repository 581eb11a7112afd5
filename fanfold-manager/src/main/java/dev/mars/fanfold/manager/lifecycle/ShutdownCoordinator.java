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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs the graceful shutdown of a manager and its workers.
 *
 * <p>Shutdown sequence:
 * <ol>
 *   <li>DRAIN: the manager refuses new requests</li>
 *   <li>AWAIT_COMPLETION: wait for in-flight jobs to reply, bounded by the shutdown timeout</li>
 *   <li>STOP_SERVICES: undeploy the manager, then the workers</li>
 *   <li>CLOSE_RESOURCES: release anything left</li>
 * </ol>
 *
 * <p>A hook that fails or overruns its timeout is logged and recorded; the sequence
 * always runs to the end.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 */
public class ShutdownCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(ShutdownCoordinator.class);

    /**
     * Shutdown phases, executed in declaration order.
     */
    public enum Phase {
        DRAIN,
        AWAIT_COMPLETION,
        STOP_SERVICES,
        CLOSE_RESOURCES
    }

    public enum State {
        RUNNING,
        DRAINING,
        SHUTTING_DOWN,
        STOPPED
    }

    private final long drainTimeoutMs;
    private final long shutdownTimeoutMs;

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final Map<Phase, List<ShutdownHook>> hooks = new EnumMap<>(Phase.class);
    private final List<String> failedHooks = new CopyOnWriteArrayList<>();
    private Future<Void> completion;

    /**
     * Creates a coordinator with per-phase time limits.
     *
     * @param drainTimeoutMs    limit for each drain hook
     * @param shutdownTimeoutMs limit for each hook of the later phases
     */
    public ShutdownCoordinator(long drainTimeoutMs, long shutdownTimeoutMs) {
        this.drainTimeoutMs = drainTimeoutMs;
        this.shutdownTimeoutMs = shutdownTimeoutMs;
        for (Phase phase : Phase.values()) {
            hooks.put(phase, new ArrayList<>());
        }
    }

    /**
     * @return the current shutdown state
     */
    public State getState() {
        return state.get();
    }

    /**
     * @return true until {@link #shutdown()} has been called
     */
    public boolean isAcceptingWork() {
        return state.get() == State.RUNNING;
    }

    /**
     * Registers a hook for a phase. Hooks of one phase run in registration order,
     * each bounded by the phase's time limit.
     *
     * @param phase the phase the hook belongs to
     * @param name  label used in logs and in {@link #getFailedHooks()}
     * @param hook  supplies the future the phase waits on
     * @return this coordinator for chaining
     */
    public synchronized ShutdownCoordinator register(Phase phase, String name, Supplier<Future<Void>> hook) {
        hooks.get(phase).add(new ShutdownHook(name, hook));
        return this;
    }

    /**
     * Registers a hook that stops a component from accepting new work.
     *
     * @param name label used in logs
     * @param hook supplies the future the drain phase waits on
     * @return this coordinator for chaining
     */
    public ShutdownCoordinator onDrain(String name, Supplier<Future<Void>> hook) {
        return register(Phase.DRAIN, name, hook);
    }

    /**
     * Registers a hook whose future completes once in-flight work has finished.
     *
     * @param name label used in logs
     * @param hook supplies the future to wait on
     * @return this coordinator for chaining
     */
    public ShutdownCoordinator onAwaitCompletion(String name, Supplier<Future<Void>> hook) {
        return register(Phase.AWAIT_COMPLETION, name, hook);
    }

    /**
     * Registers a hook that undeploys or stops a service.
     *
     * @param name label used in logs
     * @param hook supplies the future to wait on
     * @return this coordinator for chaining
     */
    public ShutdownCoordinator onServiceStop(String name, Supplier<Future<Void>> hook) {
        return register(Phase.STOP_SERVICES, name, hook);
    }

    /**
     * Registers a hook that releases a resource after every service has stopped.
     *
     * @param name label used in logs
     * @param hook supplies the future to wait on
     * @return this coordinator for chaining
     */
    public ShutdownCoordinator onResourceClose(String name, Supplier<Future<Void>> hook) {
        return register(Phase.CLOSE_RESOURCES, name, hook);
    }

    /**
     * Names of hooks that failed or timed out, in execution order.
     *
     * @return an unmodifiable view of the failed hook names
     */
    public List<String> getFailedHooks() {
        return Collections.unmodifiableList(failedHooks);
    }

    /**
     * Starts the shutdown sequence, running every phase in order. A failed or
     * timed-out hook is recorded and the sequence carries on with the next one.
     * Repeated calls return the same future.
     *
     * @return a future completing once the last phase has finished
     */
    public synchronized Future<Void> shutdown() {
        if (completion != null) {
            logger.info("Shutdown already in progress");
            return completion;
        }

        logger.info("Initiating graceful shutdown (drain={}ms, timeout={}ms)", drainTimeoutMs, shutdownTimeoutMs);
        state.set(State.DRAINING);

        Future<Void> chain = Future.succeededFuture();
        for (Phase phase : Phase.values()) {
            chain = chain.compose(v -> runPhase(phase));
        }
        completion = chain.onComplete(ar -> {
            state.set(State.STOPPED);
            if (failedHooks.isEmpty()) {
                logger.info("Graceful shutdown completed");
            } else {
                logger.warn("Shutdown completed with failed hooks: {}", failedHooks);
            }
        });
        return completion;
    }

    private Future<Void> runPhase(Phase phase) {
        if (phase == Phase.STOP_SERVICES) {
            state.set(State.SHUTTING_DOWN);
        }
        List<ShutdownHook> phaseHooks = hooks.get(phase);
        logger.info("Phase {}/{}: {} ({} hooks)", phase.ordinal() + 1, Phase.values().length, phase, phaseHooks.size());

        long timeoutMs = phase == Phase.DRAIN ? drainTimeoutMs : shutdownTimeoutMs;
        Future<Void> chain = Future.succeededFuture();
        for (ShutdownHook hook : phaseHooks) {
            chain = chain.compose(v -> runHook(phase, hook, timeoutMs));
        }
        return chain;
    }

    private Future<Void> runHook(Phase phase, ShutdownHook hook, long timeoutMs) {
        logger.debug("Running {} hook: {}", phase, hook.name());
        Future<Void> result;
        try {
            result = hook.action().get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result
                .timeout(timeoutMs, TimeUnit.MILLISECONDS)
                .onSuccess(v -> logger.debug("Hook completed: {}", hook.name()))
                .recover(err -> {
                    logger.warn("{} hook '{}' failed: {}", phase, hook.name(), err.getMessage());
                    failedHooks.add(hook.name());
                    return Future.succeededFuture();
                });
    }

    private record ShutdownHook(String name, Supplier<Future<Void>> action) {
    }
}
