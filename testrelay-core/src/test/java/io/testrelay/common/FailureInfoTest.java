/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.testrelay.common;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureInfoTest {

    @Test
    void testUnequalLengthsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FailureInfo(
                new String[]{"A", "B"}, new String[]{"a"}, new String[]{null, null}, new int[]{-1, 0}));
    }

    @Test
    void testParentMustPrecedeChild() {
        assertThrows(IllegalArgumentException.class, () -> new FailureInfo(
                new String[]{"A", "B"}, new String[]{"a", "b"}, new String[]{null, null}, new int[]{1, -1}));
        assertThrows(IllegalArgumentException.class, () -> new FailureInfo(
                new String[]{"A"}, new String[]{"a"}, new String[]{null}, new int[]{0}));
        assertThrows(IllegalArgumentException.class, () -> new FailureInfo(
                new String[]{"A"}, new String[]{"a"}, new String[]{null}, new int[]{-2}));
    }

    @Test
    void testDefensiveCopies() {
        String[] types = {"A"};
        int[] parents = {-1};
        FailureInfo info = new FailureInfo(types, new String[]{"a"}, new String[]{null}, parents);
        types[0] = "changed";
        parents[0] = 5;
        assertEquals("A", info.getExceptionType(0));
        assertEquals(-1, info.getParentIndex(0));
        info.exceptionTypes()[0] = "changed again";
        assertEquals("A", info.getExceptionType(0));
    }

    @Test
    void testPreFlattenedForest() {
        FailureInfo info = new FailureInfo(
                new String[]{"A", "B", "C"},
                new String[]{"a", "b", "c"},
                new String[]{null, null, null},
                new int[]{-1, 0, -1});
        assertEquals(2, info.toTree().size());
        assertEquals(1, info.toTree().get(0).getChildren().size());
    }

    @Test
    void testEquality() {
        FailureInfo one = new FailureInfo(new String[]{"A"}, new String[]{"a"}, new String[]{null}, new int[]{-1});
        FailureInfo two = new FailureInfo(new String[]{"A"}, new String[]{"a"}, new String[]{null}, new int[]{-1});
        assertEquals(one, two);
        assertEquals(one.hashCode(), two.hashCode());
    }

}
