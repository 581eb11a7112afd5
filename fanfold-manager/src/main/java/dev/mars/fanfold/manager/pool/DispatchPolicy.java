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

import java.util.Locale;

/**
 * How the pool picks a worker for each chunk.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public enum DispatchPolicy {

    /** Cycle over every worker in index order. */
    ROUND_ROBIN,

    /** Worker with the fewest outstanding chunks; ties go to the lowest index. */
    LEAST_LOADED;

    public static DispatchPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return ROUND_ROBIN;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown dispatch policy: " + name, e);
        }
    }
}
