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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DisposalTrackerTest {

    static AutoCloseable resource(Runnable onClose) {
        return onClose::run;
    }

    @Test
    void testClosesNewestFirst() throws Exception {
        List<String> closed = new ArrayList<>();
        DisposalTracker tracker = new DisposalTracker();
        tracker.add(resource(() -> closed.add("first")));
        tracker.add(resource(() -> closed.add("second")));
        tracker.add(resource(() -> closed.add("third")));
        assertEquals(3, tracker.size());
        tracker.close();
        assertEquals(List.of("third", "second", "first"), closed);
        assertTrue(tracker.isClosed());
        assertEquals(0, tracker.size());
    }

    @Test
    void testFailureDoesNotStopOthers() {
        List<String> closed = new ArrayList<>();
        DisposalTracker tracker = new DisposalTracker();
        tracker.add(resource(() -> closed.add("first")));
        AutoCloseable second = () -> {
            throw new IOException("second failed");
        };
        AutoCloseable third = () -> {
            throw new IllegalStateException("third failed");
        };
        tracker.add(second);
        tracker.add(third);
        Exception e = assertThrows(Exception.class, tracker::close);
        assertEquals("third failed", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("second failed", e.getSuppressed()[0].getMessage());
        assertEquals(List.of("first"), closed);
    }

    @Test
    void testCloseTwiceIsNoOp() throws Exception {
        List<String> closed = new ArrayList<>();
        DisposalTracker tracker = new DisposalTracker();
        tracker.add(resource(() -> closed.add("once")));
        tracker.close();
        tracker.close();
        assertEquals(1, closed.size());
    }

    @Test
    void testAddAfterClose() throws Exception {
        DisposalTracker tracker = new DisposalTracker();
        tracker.close();
        assertThrows(IllegalStateException.class, () -> tracker.add(resource(() -> {
        })));
        assertThrows(IllegalArgumentException.class, () -> new DisposalTracker().add(null));
    }

}
