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

import java.util.Locale;

/**
 * Associative, commutative binary operations over unsigned 64-bit values.
 *
 * <p>Values are carried in Java {@code long}s and interpreted as unsigned. Arithmetic
 * wraps modulo 2<sup>64</sup>, ordering uses {@link Long#compareUnsigned(long, long)}.
 * Each function has an identity element used to seed every fold, so an empty
 * chunk folds to the identity.</p>
 *
 * <p>Because every function is associative and commutative, chunks may be folded
 * in any order and partial results may be combined in any arrival order. Callers
 * adding new functions must keep that contract; it is not checked at runtime.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum AggregationFunction {

    /** Wrapping sum. */
    SUM(0L) {
        @Override
        public long combine(long left, long right) {
            return left + right;
        }
    },

    /** Wrapping product. */
    PRODUCT(1L) {
        @Override
        public long combine(long left, long right) {
            return left * right;
        }
    },

    /** Unsigned maximum. */
    MAX(0L) {
        @Override
        public long combine(long left, long right) {
            return Long.compareUnsigned(left, right) >= 0 ? left : right;
        }
    },

    /** Unsigned minimum; identity is 2^64-1. */
    MIN(-1L) {
        @Override
        public long combine(long left, long right) {
            return Long.compareUnsigned(left, right) <= 0 ? left : right;
        }
    },

    AND(-1L) {
        @Override
        public long combine(long left, long right) {
            return left & right;
        }
    },

    OR(0L) {
        @Override
        public long combine(long left, long right) {
            return left | right;
        }
    },

    XOR(0L) {
        @Override
        public long combine(long left, long right) {
            return left ^ right;
        }
    };

    private final long identity;

    AggregationFunction(long identity) {
        this.identity = identity;
    }

    /**
     * Combine two values.
     */
    public abstract long combine(long left, long right);

    /**
     * The neutral element: {@code combine(identity(), x) == x} for every x.
     */
    public long identity() {
        return identity;
    }

    /**
     * Fold a whole array, seeded with the identity.
     */
    public long fold(long[] values) {
        return fold(values, 0, values.length);
    }

    /**
     * Fold the half-open range {@code [from, to)} of an array, seeded with the identity.
     */
    public long fold(long[] values, int from, int to) {
        if (from < 0 || to > values.length || from > to) {
            throw new IndexOutOfBoundsException(
                    "Range [" + from + ", " + to + ") out of bounds for length " + values.length);
        }
        long accumulator = identity;
        for (int i = from; i < to; i++) {
            accumulator = combine(accumulator, values[i]);
        }
        return accumulator;
    }

    /**
     * Resolve a function by name, ignoring case.
     *
     * @throws IllegalArgumentException if no function has that name
     */
    public static AggregationFunction fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Aggregation function name cannot be empty");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation function: " + name, e);
        }
    }
}
