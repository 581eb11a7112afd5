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

import dev.mars.fanfold.core.exceptions.AggregationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AggregationReply} and its conversion to {@link AggregationException}.
 */
class AggregationReplyTest {

    @Test
    void successCarriesResult() {
        AggregationReply reply = AggregationReply.success(3L, 28L);

        assertTrue(reply.isSuccessful());
        assertEquals(28L, reply.getResult().getAsLong());
        assertEquals(3L, reply.getJobId().getAsLong());
        assertTrue(reply.getFailureReason().isEmpty());
        assertTrue(reply.getErrorMessage().isEmpty());
    }

    @Test
    void failureHasNoResult() {
        AggregationReply reply = AggregationReply.failure(7L, FailureReason.JOB_TIMEOUT, "2 of 3 chunks missing");

        assertFalse(reply.isSuccessful());
        assertTrue(reply.getResult().isEmpty());
        assertEquals(FailureReason.JOB_TIMEOUT, reply.getFailureReason().orElseThrow());
        assertEquals("2 of 3 chunks missing", reply.getErrorMessage().orElseThrow());
    }

    @Test
    void failureWithoutMessageUsesReasonDescription() {
        AggregationReply reply = AggregationReply.failure(null, FailureReason.WORKER_UNAVAILABLE, null);

        assertTrue(reply.getJobId().isEmpty());
        assertEquals(FailureReason.WORKER_UNAVAILABLE.getDescription(), reply.getErrorMessage().orElseThrow());
    }

    @Test
    void failureRequiresReason() {
        assertThrows(NullPointerException.class, () -> AggregationReply.failure(1L, null, "x"));
    }

    @Test
    void toExceptionCarriesJobAndReason() {
        AggregationException e = AggregationReply.failure(5L, FailureReason.JOB_TIMEOUT, "late").toException();

        assertEquals(5L, e.getJobId().getAsLong());
        assertEquals(FailureReason.JOB_TIMEOUT, e.getReason());
        assertEquals("Job 5 failed (JOB_TIMEOUT): late", e.getMessage());
    }

    @Test
    void toExceptionWithoutJobId() {
        AggregationException e = AggregationReply.failure(null, FailureReason.MANAGER_DRAINING, "draining")
                .toException();

        assertTrue(e.getJobId().isEmpty());
        assertEquals("Request failed (MANAGER_DRAINING): draining", e.getMessage());
    }

    @Test
    void toExceptionOnSuccessIsIllegal() {
        assertThrows(IllegalStateException.class, () -> AggregationReply.success(1L, 1L).toException());
    }

    @Test
    void toStringPrintsResultUnsigned() {
        assertTrue(AggregationReply.success(1L, -1L).toString().contains("18446744073709551615"));
    }
}
