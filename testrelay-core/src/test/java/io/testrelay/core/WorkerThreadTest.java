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
package io.testrelay.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerThreadTest {

    @Test
    void testJoinAfterWork() throws Exception {
        AtomicInteger counter = new AtomicInteger();
        WorkerThread worker = new WorkerThread(counter::incrementAndGet);
        assertTrue(worker.join(5, TimeUnit.SECONDS));
        assertTrue(worker.isFinished());
        assertEquals(1, counter.get());
        worker.close();
    }

    @Test
    void testJoinReturnsWhenWorkThrows() throws Exception {
        AtomicInteger counter = new AtomicInteger();
        WorkerThread worker = new WorkerThread(() -> {
            counter.incrementAndGet();
            throw new IllegalStateException("expected failure");
        });
        assertTrue(worker.join(5, TimeUnit.SECONDS));
        worker.join();
        assertEquals(1, counter.get());
    }

    @Test
    void testRunsOnDaemonWorkerThread() throws Exception {
        String[] name = new String[1];
        boolean[] daemon = new boolean[1];
        WorkerThread worker = new WorkerThread(() -> {
            name[0] = Thread.currentThread().getName();
            daemon[0] = Thread.currentThread().isDaemon();
        });
        worker.join();
        assertTrue(name[0].startsWith("testrelay-worker-"));
        assertTrue(daemon[0]);
    }

    @Test
    void testJoinTimesOutWhileWorkBlocked() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        WorkerThread worker = new WorkerThread(() -> {
            try {
                gate.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertFalse(worker.join(50, TimeUnit.MILLISECONDS));
        assertFalse(worker.isFinished());
        gate.countDown();
        assertTrue(worker.join(5, TimeUnit.SECONDS));
    }

    @Test
    void testRunInBackgroundSetsSignal() throws Exception {
        CompletionSignal signal = new CompletionSignal();
        WorkerThread.runInBackground(() -> {
            throw new RuntimeException("expected failure");
        }, signal);
        assertTrue(signal.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testNullWorkRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerThread(null));
        assertThrows(IllegalArgumentException.class, () -> WorkerThread.runInBackground(null));
    }

}
