package io.chkfs.tree;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Test;

import java.util.Random;

import static io.chkfs.tree.ChkConstants.FAN_OUT;
import static io.chkfs.tree.ChkConstants.LEAF_SIZE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests the boundary arithmetic of CHK trees.
 */
public class ChkTreeShapeTest {

    private static final long LEVEL1_SPAN = (long) LEAF_SIZE * FAN_OUT;

    private static int depth(long size) {
        return ChkTreeShape.depthForSize(size, LEAF_SIZE, FAN_OUT);
    }

    private static long span(int depth) {
        return ChkTreeShape.spanAtDepth(depth, LEAF_SIZE, FAN_OUT);
    }

    @Test
    public void testFullInternalBlockIsOneLeaf() {
        assertEquals(LEAF_SIZE, FAN_OUT * ChkConstants.RECORD_SIZE);
        assertEquals(LEAF_SIZE, ChkTreeShape.fromContentSize(1).getLeafSize());
    }

    @Test
    public void testDepthAtBoundaries() {
        assertEquals(1, depth(0));
        assertEquals(1, depth(1));
        assertEquals(1, depth(LEAF_SIZE));
        assertEquals(2, depth(LEAF_SIZE + 1L));
        assertEquals(2, depth(LEVEL1_SPAN));
        assertEquals(3, depth(LEVEL1_SPAN + 1));
        assertEquals(3, depth(LEVEL1_SPAN * FAN_OUT));
        assertEquals(4, depth(LEVEL1_SPAN * FAN_OUT + 1));
    }

    @Test
    public void testDepthIsMinimalAndMonotonic() {
        Random random = new Random(17);
        int previousDepth = 1;
        long previousSize = 0;
        for (int i = 0; i < 2000; i++) {
            long size = previousSize + (random.nextLong() >>> (20 + random.nextInt(40)));
            int d = depth(size);
            assertTrue(span(d - 1) >= size, "level " + (d - 1) + " must cover " + size);
            if (d > 1) {
                assertTrue(span(d - 2) < size, "depth " + d + " must be minimal for " + size);
            }
            assertThat(d).isGreaterThanOrEqualTo(previousDepth);
            previousDepth = d;
            previousSize = size;
        }
    }

    @Test
    public void testSpans() {
        assertEquals(LEAF_SIZE, span(0));
        assertEquals(LEVEL1_SPAN, span(1));
        assertEquals(LEVEL1_SPAN * FAN_OUT, span(2));
        assertEquals(1L << 55, span(5));
        assertThatThrownBy(() -> span(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testOverflowSaturatesInsteadOfWrapping() {
        assertEquals(Long.MAX_VALUE, span(6));
        assertEquals(Long.MAX_VALUE, span(50));
        assertEquals(6, depth(1L << 55));
        assertEquals(7, depth((1L << 55) + 1));
        assertEquals(7, depth(Long.MAX_VALUE));

        ChkTreeShape huge = new ChkTreeShape(Long.MAX_VALUE);
        assertEquals(7, huge.getDepth());
        assertEquals(1, huge.getBlockCountAtDepth(6));
        assertEquals(0, huge.getChildSlotIndex(6, Long.MAX_VALUE));
    }

    @Test
    public void testChildSlotIndex() {
        ChkTreeShape shape = ChkTreeShape.fromContentSize(LEVEL1_SPAN * 4);
        assertEquals(0, shape.getChildSlotIndex(0, 0));
        assertEquals(1, shape.getChildSlotIndex(0, LEAF_SIZE));
        assertEquals(255, shape.getChildSlotIndex(0, LEVEL1_SPAN - LEAF_SIZE));
        assertEquals(0, shape.getChildSlotIndex(0, LEVEL1_SPAN));

        // internal blocks are indexed by the offset they close at
        assertEquals(0, shape.getChildSlotIndex(1, LEVEL1_SPAN));
        assertEquals(1, shape.getChildSlotIndex(1, LEVEL1_SPAN + 1));
        assertEquals(1, shape.getChildSlotIndex(1, LEVEL1_SPAN * 2));
        assertEquals(0, shape.getChildSlotIndex(2, LEVEL1_SPAN * 4));

        assertThatThrownBy(() -> shape.getChildSlotIndex(1, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> shape.getChildSlotIndex(0, -1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testInternalBlockChildCount() {
        ChkTreeShape shape = ChkTreeShape.fromContentSize(LEVEL1_SPAN * 4);
        assertEquals(1, shape.getInternalBlockChildCount(1, 1));
        assertEquals(1, shape.getInternalBlockChildCount(1, LEAF_SIZE));
        assertEquals(2, shape.getInternalBlockChildCount(1, LEAF_SIZE + 1L));
        assertEquals(FAN_OUT, shape.getInternalBlockChildCount(1, LEVEL1_SPAN));
        assertEquals(1, shape.getInternalBlockChildCount(1, LEVEL1_SPAN + 1));
        assertEquals(2, shape.getInternalBlockChildCount(2, LEVEL1_SPAN + 1));
        assertEquals(4, shape.getInternalBlockChildCount(2, LEVEL1_SPAN * 4));

        assertThatThrownBy(() -> shape.getInternalBlockChildCount(0, LEAF_SIZE))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> shape.getInternalBlockChildCount(1, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testEmptyContent() {
        ChkTreeShape empty = ChkTreeShape.fromContentSize(0);
        assertEquals(1, empty.getDepth());
        assertEquals(1, empty.getLeafCount());
        assertEquals(1, empty.getTotalBlockCount());
        assertEquals(0, empty.getLeafStartPosition(0));
        assertEquals(0, empty.getLeafEndPosition(0));
    }

    @Test
    public void testBlockCounts() {
        ChkTreeShape shape = ChkTreeShape.fromContentSize(LEVEL1_SPAN + 1);
        assertEquals(3, shape.getDepth());
        assertEquals(257, shape.getLeafCount());
        assertEquals(257, shape.getBlockCountAtDepth(0));
        assertEquals(2, shape.getBlockCountAtDepth(1));
        assertEquals(1, shape.getBlockCountAtDepth(2));
        assertEquals(260, shape.getTotalBlockCount());
        assertEquals(LEVEL1_SPAN, shape.getLeafStartPosition(256));
        assertEquals(LEVEL1_SPAN + 1, shape.getLeafEndPosition(256));

        assertThatThrownBy(() -> shape.getBlockCountAtDepth(3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> shape.getLeafStartPosition(257)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSmallFanOut() {
        ChkTreeShape shape = new ChkTreeShape(1000, 2);
        assertEquals(256, shape.getLeafSize());
        assertEquals(3, shape.getDepth());
        assertEquals(4, shape.getLeafCount());
        assertEquals(2, shape.getBlockCountAtDepth(1));
        assertEquals(7, shape.getTotalBlockCount());
        assertEquals(1, shape.getChildSlotIndex(1, 1000));
        assertEquals(2, shape.getInternalBlockChildCount(1, 1000));
    }

    @Test
    public void testInvalidArguments() {
        assertThatThrownBy(() -> new ChkTreeShape(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChkTreeShape(10, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ChkTreeShape(10, FAN_OUT + 1)).isInstanceOf(IllegalArgumentException.class);
    }
}
