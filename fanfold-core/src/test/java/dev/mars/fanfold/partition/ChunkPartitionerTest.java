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

package dev.mars.fanfold.partition;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ChunkPartitioner}.
 */
class ChunkPartitionerTest {

    @Test
    void sevenValuesOverThreePartsAreBalanced() {
        List<ChunkRange> ranges = ChunkPartitioner.partition(7, 3);

        assertEquals(List.of(
                new ChunkRange(0, 0, 3),
                new ChunkRange(1, 3, 5),
                new ChunkRange(2, 5, 7)), ranges);
    }

    @Test
    void fewerValuesThanPartsYieldsOneChunkPerValue() {
        List<ChunkRange> ranges = ChunkPartitioner.partition(1, 4);

        assertEquals(1, ranges.size());
        assertEquals(new ChunkRange(0, 0, 1), ranges.get(0));
    }

    @Test
    void emptyInputYieldsNoChunks() {
        assertTrue(ChunkPartitioner.partition(0, 4).isEmpty());
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> ChunkPartitioner.partition(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> ChunkPartitioner.partition(5, 0));
    }

    @Test
    void resultIsUnmodifiable() {
        List<ChunkRange> ranges = ChunkPartitioner.partition(4, 2);
        assertThrows(UnsupportedOperationException.class, () -> ranges.add(new ChunkRange(2, 4, 4)));
    }

    @ParameterizedTest(name = "length={0}, parts={1}")
    @CsvSource({
            "1, 1", "2, 1", "10, 3", "10, 10", "10, 11", "100, 7", "1000, 16", "17, 4"
    })
    void rangesCoverInputExactlyWithNearEqualSizes(int length, int parts) {
        List<ChunkRange> ranges = ChunkPartitioner.partition(length, parts);

        assertEquals(Math.min(length, parts), ranges.size());

        int expectedStart = 0;
        int min = Integer.MAX_VALUE;
        int max = 0;
        for (int i = 0; i < ranges.size(); i++) {
            ChunkRange range = ranges.get(i);
            assertEquals(i, range.index());
            assertEquals(expectedStart, range.from(), "chunks must be contiguous");
            assertTrue(range.size() > 0, "no chunk may be empty");
            min = Math.min(min, range.size());
            max = Math.max(max, range.size());
            expectedStart = range.to();
        }
        assertEquals(length, expectedStart, "chunks must cover the whole input");
        assertTrue(max - min <= 1, "sizes differ by at most one");
    }

    @Test
    void chunkRangeRejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkRange(0, 5, 3));
        assertThrows(IllegalArgumentException.class, () -> new ChunkRange(-1, 0, 3));
    }
}
