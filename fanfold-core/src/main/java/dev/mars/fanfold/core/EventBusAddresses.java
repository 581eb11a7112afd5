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

package dev.mars.fanfold.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Event bus address scheme shared by manager, workers and clients.
 *
 * <ul>
 *   <li>{@code <prefix>.manager.requests} - inbound {@link AggregationRequest}s</li>
 *   <li>{@code <prefix>.manager.partials} - inbound {@link PartialResult}s</li>
 *   <li>{@code <prefix>.worker.<n>} - inbound {@link ChunkTask}s for worker n</li>
 *   <li>{@code <prefix>.replies.<id>} - per-client reply addresses</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class EventBusAddresses {

    public static final String DEFAULT_PREFIX = "fanfold";

    private final String prefix;

    public EventBusAddresses(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix cannot be blank");
        }
        this.prefix = prefix.trim();
    }

    public static EventBusAddresses defaults() {
        return new EventBusAddresses(DEFAULT_PREFIX);
    }

    public String getPrefix() {
        return prefix;
    }

    public String managerRequests() {
        return prefix + ".manager.requests";
    }

    public String managerPartials() {
        return prefix + ".manager.partials";
    }

    public String worker(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("worker index cannot be negative: " + index);
        }
        return prefix + ".worker." + index;
    }

    /**
     * A fresh, unique reply address for one caller.
     */
    public String newReplyAddress() {
        return prefix + ".replies." + UUID.randomUUID();
    }

    @Override
    public String toString() {
        return "EventBusAddresses{prefix='" + prefix + "'}";
    }
}
