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

import dev.mars.fanfold.core.AggregationFunction;
import dev.mars.fanfold.core.JobStatus;
import dev.mars.fanfold.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Job} bookkeeping.
 */
class JobTest {

    private Job job;

    @BeforeEach
    void setUp() {
        job = new Job(1L, AggregationFunction.SUM, 3, "reply");
        job.transitionTo(JobStatus.AWAITING_PARTIALS);
    }

    @Test
    void startsAtIdentity() {
        Job fresh = new Job(2L, AggregationFunction.MIN, 1, "reply");

        assertEquals(JobStatus.CREATED, fresh.getStatus());
        assertEquals(AggregationFunction.MIN.identity(), fresh.getAccumulator());
        assertEquals(-1, fresh.getAssignedWorker(0));
        assertTrue(fresh.getDeadline().isEmpty());
    }

    @Test
    void foldsPartialsInAnyOrder() {
        assertEquals(Job.PartialOutcome.ACCEPTED, job.recordPartial(2, 13L));
        assertEquals(Job.PartialOutcome.ACCEPTED, job.recordPartial(0, 6L));
        assertFalse(job.isComplete());
        assertEquals(List.of(1), job.getMissingChunks());

        assertEquals(Job.PartialOutcome.ACCEPTED, job.recordPartial(1, 9L));

        assertTrue(job.isComplete());
        assertEquals(28L, job.getAccumulator());
        assertTrue(job.getMissingChunks().isEmpty());
    }

    @Test
    void duplicatePartialIsNotFoldedTwice() {
        job.recordPartial(0, 6L);

        assertEquals(Job.PartialOutcome.DUPLICATE, job.recordPartial(0, 6L));
        assertEquals(Job.PartialOutcome.DUPLICATE, job.recordPartial(0, 100L));
        assertEquals(6L, job.getAccumulator());
        assertEquals(1, job.getReceivedCount());
    }

    @Test
    void outOfRangeChunkIsRejected() {
        assertEquals(Job.PartialOutcome.OUT_OF_RANGE, job.recordPartial(3, 1L));
        assertEquals(Job.PartialOutcome.OUT_OF_RANGE, job.recordPartial(-1, 1L));
        assertEquals(0, job.getReceivedCount());
    }

    @Test
    void remembersAssignments() {
        job.assign(0, 2);
        job.assign(1, 0);

        assertEquals(2, job.getAssignedWorker(0));
        assertEquals(0, job.getAssignedWorker(1));
        assertThrows(IndexOutOfBoundsException.class, () -> job.assign(3, 0));
    }

    @Test
    void terminalJobRejectsFurtherTransitions() {
        job.transitionTo(JobStatus.FAILED);

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> job.transitionTo(JobStatus.COMPLETE));
        assertEquals(JobStatus.FAILED, e.getCurrentState());
        assertEquals(JobStatus.COMPLETE, e.getRequestedState());
        assertThrows(IllegalStateException.class, () -> job.recordPartial(0, 1L));
    }

    @Test
    void cannotSkipAwaitingPartials() {
        Job fresh = new Job(3L, AggregationFunction.SUM, 1, "reply");
        assertThrows(InvalidTransitionException.class, () -> fresh.transitionTo(JobStatus.COMPLETE));
    }

    @Test
    void rejectsJobWithoutChunks() {
        assertThrows(IllegalArgumentException.class, () -> new Job(4L, AggregationFunction.SUM, 0, "reply"));
    }
}
