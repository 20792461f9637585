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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A one-shot event. {@link #set()} opens it for good, waiting threads are released and later
 * waits return at once. Setting an open signal does nothing.
 * <p>
 * Once {@link #close() closed}, a wait on a signal that was never set fails with
 * {@link IllegalStateException} instead of blocking. Closing wakes threads that are already
 * waiting, they fail the same way.
 */
public class CompletionSignal implements AutoCloseable {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile boolean set;
    private volatile boolean closed;

    public void set() {
        set = true;
        latch.countDown();
    }

    public boolean isSet() {
        return set;
    }

    public boolean isClosed() {
        return closed;
    }

    public void await() throws InterruptedException {
        checkClosed();
        latch.await();
        checkClosed();
    }

    /**
     * @return true if the signal is set, false if the timeout elapsed first
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        checkClosed();
        boolean result = latch.await(timeout, unit);
        checkClosed();
        return result;
    }

    private void checkClosed() {
        if (closed && !set) {
            throw new IllegalStateException("signal closed before it was set");
        }
    }

    @Override
    public void close() {
        closed = true;
        // release waiters, they see the closed flag
        latch.countDown();
    }

}
