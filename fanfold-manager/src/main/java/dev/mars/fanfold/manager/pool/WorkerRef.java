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

package dev.mars.fanfold.manager.pool;

import java.util.Objects;

/**
 * Handle to one worker in the pool.
 *
 * @param index    position in the pool, used for load accounting and tie-breaking
 * @param workerId identifier the worker stamps on its partial results
 * @param address  event bus address the worker consumes chunk tasks from
 */
public record WorkerRef(int index, String workerId, String address) {

    public WorkerRef {
        if (index < 0) {
            throw new IllegalArgumentException("index cannot be negative: " + index);
        }
        Objects.requireNonNull(workerId, "workerId cannot be null");
        Objects.requireNonNull(address, "address cannot be null");
    }
}
