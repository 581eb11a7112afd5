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

package dev.mars.fanfold.manager.client;

import dev.mars.fanfold.core.AggregationFunction;
import dev.mars.fanfold.core.AggregationReply;
import dev.mars.fanfold.core.AggregationRequest;
import dev.mars.fanfold.core.EventBusAddresses;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.core.eventbus.ReplyFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Submits aggregation requests to a manager and waits for the reply.
 *
 * <p>Each call registers a one-shot consumer on a fresh reply address, sends the
 * request once the consumer is registered, and unregisters it when the reply
 * arrives. The client holds no state between calls and may be shared.</p>
 *
 * <p>Every call also carries a client-side deadline, so the returned future completes
 * even when no manager is listening or a reply is lost. The deadline is the job's own
 * timeout plus {@link #REPLY_MARGIN_MS}; requests that use the manager default or no
 * timeout fall back to the client's reply timeout. On expiry the reply consumer is
 * unregistered and the future fails with a {@link ReplyException} of type
 * {@link ReplyFailure#TIMEOUT}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class AggregationClient {

    private static final Logger logger = LoggerFactory.getLogger(AggregationClient.class);

    /** Client wait used when the request carries no explicit deadline. */
    public static final long DEFAULT_REPLY_TIMEOUT_MS = 60000L;

    /** Slack added to a job deadline so the manager's own timeout reply wins the race. */
    public static final long REPLY_MARGIN_MS = 1000L;

    private final Vertx vertx;
    private final EventBusAddresses addresses;
    private final long replyTimeoutMs;

    public AggregationClient(Vertx vertx, EventBusAddresses addresses) {
        this(vertx, addresses, DEFAULT_REPLY_TIMEOUT_MS);
    }

    /**
     * @param replyTimeoutMs how long to wait for a reply to a request without an explicit
     *                       job deadline; must be positive
     */
    public AggregationClient(Vertx vertx, EventBusAddresses addresses, long replyTimeoutMs) {
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        this.addresses = Objects.requireNonNull(addresses, "addresses cannot be null");
        if (replyTimeoutMs <= 0) {
            throw new IllegalArgumentException("replyTimeoutMs must be positive: " + replyTimeoutMs);
        }
        this.replyTimeoutMs = replyTimeoutMs;
    }

    public long getReplyTimeoutMs() {
        return replyTimeoutMs;
    }

    /**
     * Submit using the manager's default deadline.
     */
    public Future<AggregationReply> submit(long[] data, AggregationFunction function) {
        return submit(data, function, AggregationRequest.DEFAULT_TIMEOUT);
    }

    /**
     * Submit a request and complete with the manager's reply, successful or not.
     * The future fails only if no reply arrives before the client-side deadline.
     *
     * @param timeoutMs job deadline in milliseconds, {@link AggregationRequest#NO_TIMEOUT} for none,
     *                  or {@link AggregationRequest#DEFAULT_TIMEOUT} for the manager's default
     * @return the manager's reply
     */
    public Future<AggregationReply> submit(long[] data, AggregationFunction function, long timeoutMs) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(function, "function cannot be null");

        String replyAddress = addresses.newReplyAddress();
        AggregationRequest.Builder builder = AggregationRequest.builder()
                .data(data)
                .function(function)
                .replyTo(replyAddress);
        if (timeoutMs != AggregationRequest.DEFAULT_TIMEOUT) {
            builder.timeoutMs(timeoutMs);
        }
        AggregationRequest request = builder.build();

        Promise<AggregationReply> promise = Promise.promise();
        MessageConsumer<AggregationReply> consumer = vertx.eventBus().consumer(replyAddress);
        long waitMs = replyWaitMs(timeoutMs);
        long timerId = vertx.setTimer(waitMs, id -> {
            if (!promise.future().isComplete()) {
                logger.warn("No reply on {} within {}ms, giving up", replyAddress, waitMs);
                consumer.unregister();
                promise.tryFail(new ReplyException(ReplyFailure.TIMEOUT,
                        "No reply on " + replyAddress + " within " + waitMs + "ms"));
            }
        });
        consumer.handler(message -> {
            vertx.cancelTimer(timerId);
            consumer.unregister();
            logger.debug("Reply on {}: {}", replyAddress, message.body());
            promise.tryComplete(message.body());
        });
        consumer.completion()
                .onSuccess(v -> {
                    logger.debug("Submitting {}", request);
                    vertx.eventBus().send(addresses.managerRequests(), request);
                })
                .onFailure(err -> {
                    logger.warn("Could not register reply consumer on {}: {}", replyAddress, err.getMessage());
                    vertx.cancelTimer(timerId);
                    promise.tryFail(err);
                });
        return promise.future();
    }

    long replyWaitMs(long timeoutMs) {
        if (timeoutMs > 0) {
            return timeoutMs + REPLY_MARGIN_MS;
        }
        return replyTimeoutMs;
    }

    /**
     * Submit and unwrap the result. A failure reply fails the future with an
     * {@link dev.mars.fanfold.core.exceptions.AggregationException}.
     */
    public Future<Long> aggregate(long[] data, AggregationFunction function) {
        return aggregate(data, function, AggregationRequest.DEFAULT_TIMEOUT);
    }

    public Future<Long> aggregate(long[] data, AggregationFunction function, long timeoutMs) {
        return submit(data, function, timeoutMs).compose(reply -> reply.isSuccessful()
                ? Future.succeededFuture(reply.getResult().getAsLong())
                : Future.failedFuture(reply.toException()));
    }
}
