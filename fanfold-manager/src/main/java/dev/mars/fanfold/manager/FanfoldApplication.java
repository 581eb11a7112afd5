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

import dev.mars.fanfold.codec.FanfoldCodecs;
import dev.mars.fanfold.config.FanfoldConfiguration;
import dev.mars.fanfold.core.AggregationFunction;
import dev.mars.fanfold.core.EventBusAddresses;
import dev.mars.fanfold.manager.client.AggregationClient;
import dev.mars.fanfold.manager.lifecycle.ShutdownCoordinator;
import dev.mars.fanfold.manager.pool.DispatchPolicy;
import dev.mars.fanfold.manager.pool.WorkerPool;
import dev.mars.fanfold.manager.pool.WorkerRef;
import dev.mars.fanfold.worker.WorkerVerticle;
import dev.mars.fanfold.worker.observability.WorkerTelemetryMetrics;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletionException;

/**
 * Wires a manager and its worker pool onto one Vert.x instance.
 *
 * <p>{@link #start(Vertx, FanfoldConfiguration)} registers the event bus codecs,
 * deploys one {@link WorkerVerticle} per pool slot and then the
 * {@link ManagerVerticle}. {@link #stop()} runs the graceful shutdown sequence.</p>
 *
 * <p>Run from the command line as {@code FanfoldApplication <numWorkers> <dataSize>}
 * to sum {@code 1..dataSize} across the pool and check the result against the
 * triangular number.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class FanfoldApplication {

    private static final Logger logger = LoggerFactory.getLogger(FanfoldApplication.class);

    private final FanfoldConfiguration config;
    private final ManagerVerticle manager;
    private final AggregationClient client;
    private final ShutdownCoordinator shutdownCoordinator;

    private FanfoldApplication(Vertx vertx, FanfoldConfiguration config, ManagerVerticle manager,
                               String managerDeploymentId, List<String> workerDeploymentIds) {
        this.config = config;
        this.manager = manager;
        this.client = new AggregationClient(vertx, config.getAddresses(), clientReplyTimeoutMs(config));
        this.shutdownCoordinator = new ShutdownCoordinator(config.getDrainTimeoutMs(), config.getShutdownTimeoutMs())
                .onDrain("manager", manager::drain)
                .onAwaitCompletion("in-flight jobs", manager::awaitIdle)
                .onServiceStop("manager", () -> vertx.undeploy(managerDeploymentId))
                .onServiceStop("workers", () -> undeployAll(vertx, workerDeploymentIds));
    }

    /**
     * Deploy the worker pool and the manager described by {@code config}.
     */
    public static Future<FanfoldApplication> start(Vertx vertx, FanfoldConfiguration config) {
        config.logConfiguration();
        FanfoldCodecs.registerAll(vertx);

        EventBusAddresses addresses = config.getAddresses();
        DispatchPolicy policy;
        try {
            policy = DispatchPolicy.fromName(config.getDispatchPolicy());
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }
        WorkerPool pool = WorkerPool.create(addresses, config.getPoolSize(), policy);
        WorkerTelemetryMetrics workerMetrics = config.isTelemetryEnabled()
                ? WorkerTelemetryMetrics.getInstance()
                : WorkerTelemetryMetrics.disabled();

        List<Future<String>> workerDeployments = new ArrayList<>();
        for (WorkerRef ref : pool.getWorkers()) {
            workerDeployments.add(vertx.deployVerticle(
                    new WorkerVerticle(ref.workerId(), ref.address(), addresses.managerPartials(), workerMetrics)));
        }

        ManagerVerticle manager = new ManagerVerticle(config, pool);
        return Future.all(workerDeployments)
                .compose(deployed -> {
                    List<String> workerIds = deployed.list();
                    logger.info("Deployed {} workers", workerIds.size());
                    return vertx.deployVerticle(manager)
                            .map(managerId -> new FanfoldApplication(vertx, config, manager, managerId, workerIds));
                })
                .onSuccess(app -> logger.info("Fanfold started on prefix '{}'", addresses.getPrefix()))
                .onFailure(err -> logger.error("Fanfold failed to start", err));
    }

    public AggregationClient client() {
        return client;
    }

    public ManagerVerticle manager() {
        return manager;
    }

    public FanfoldConfiguration configuration() {
        return config;
    }

    public ShutdownCoordinator shutdownCoordinator() {
        return shutdownCoordinator;
    }

    /**
     * Drain the manager, wait for in-flight jobs, then undeploy everything.
     * The Vert.x instance itself is left open.
     */
    public Future<Void> stop() {
        return shutdownCoordinator.shutdown();
    }

    static long clientReplyTimeoutMs(FanfoldConfiguration config) {
        return Math.max(config.getClientReplyTimeoutMs(), config.getJobTimeoutMs() + AggregationClient.REPLY_MARGIN_MS);
    }

    private static Future<Void> undeployAll(Vertx vertx, List<String> deploymentIds) {
        List<Future<Void>> undeployments = new ArrayList<>();
        for (String id : deploymentIds) {
            undeployments.add(vertx.undeploy(id));
        }
        return Future.all(undeployments).mapEmpty();
    }

    /**
     * Sum of {@code 1..n} with the same wrapping arithmetic the SUM function uses.
     */
    static long triangular(long n) {
        return (n % 2 == 0) ? (n / 2) * (n + 1) : n * ((n + 1) / 2);
    }

    static long[] sequence(int n) {
        long[] data = new long[n];
        for (int i = 0; i < n; i++) {
            data[i] = i + 1L;
        }
        return data;
    }

    /**
     * Run the demo and return the process exit code.
     */
    static int run(String[] args) {
        if (args.length != 2) {
            logger.error("Usage: FanfoldApplication <numWorkers> <dataSize>");
            return 2;
        }

        int numWorkers;
        int dataSize;
        try {
            numWorkers = Integer.parseInt(args[0].trim());
            dataSize = Integer.parseInt(args[1].trim());
        } catch (NumberFormatException e) {
            logger.error("Arguments must be integers: {}", e.getMessage());
            return 2;
        }
        if (numWorkers < 0 || dataSize < 0) {
            logger.error("Arguments cannot be negative: numWorkers={}, dataSize={}", numWorkers, dataSize);
            return 2;
        }

        Properties overrides = new Properties();
        overrides.setProperty(FanfoldConfiguration.POOL_SIZE, Integer.toString(numWorkers));
        FanfoldConfiguration config = new FanfoldConfiguration(overrides);

        Vertx vertx = Vertx.vertx();
        try {
            FanfoldApplication app = start(vertx, config).toCompletionStage().toCompletableFuture().join();
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (app.shutdownCoordinator().isAcceptingWork()) {
                    logger.info("Shutdown signal received, stopping Fanfold...");
                    app.stop().toCompletionStage().toCompletableFuture().join();
                }
            }));

            long expected = triangular(dataSize);
            int exitCode;
            try {
                long result = app.client().aggregate(sequence(dataSize), AggregationFunction.SUM)
                        .toCompletionStage().toCompletableFuture().join();
                if (result == expected) {
                    logger.info("Sum of 1..{} over {} workers = {} (correct)",
                            dataSize, config.getPoolSize(), Long.toUnsignedString(result));
                    exitCode = 0;
                } else {
                    logger.error("Sum of 1..{} over {} workers = {}, expected {}",
                            dataSize, config.getPoolSize(), Long.toUnsignedString(result), Long.toUnsignedString(expected));
                    exitCode = 1;
                }
            } catch (CompletionException e) {
                logger.error("Aggregation failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                exitCode = 1;
            }

            app.stop().toCompletionStage().toCompletableFuture().join();
            return exitCode;
        } catch (CompletionException e) {
            logger.error("Fanfold failed", e.getCause() != null ? e.getCause() : e);
            return 1;
        } finally {
            vertx.close().toCompletionStage().toCompletableFuture().join();
        }
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }
}
