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

import io.testrelay.output.LogContext;
import org.slf4j.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a unit of work in the background and lets the owner wait for it.
 * <p>
 * Work runs on a dedicated pool of daemon threads that is only used for long-running,
 * possibly blocking work, so it never competes with short-lived tasks elsewhere. The
 * completion signal is set in a {@code finally} block: {@link #join()} returns even when
 * the work throws. The exception itself reaches the worker thread's uncaught-exception
 * handler, which logs it.
 */
public class WorkerThread implements AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private static final AtomicInteger THREAD_COUNT = new AtomicInteger();

    private static final ThreadFactory THREAD_FACTORY = runnable -> {
        Thread thread = new Thread(runnable, "testrelay-worker-" + THREAD_COUNT.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> logger.error("background work failed on {}", t.getName(), e));
        return thread;
    };

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(THREAD_FACTORY);

    private final CompletionSignal finished = new CompletionSignal();

    public WorkerThread(Runnable work) {
        runInBackground(work, finished);
    }

    /**
     * Blocks until the work completed, normally or not.
     */
    public void join() throws InterruptedException {
        finished.await();
    }

    /**
     * @return true if the work completed, false if the timeout elapsed first
     */
    public boolean join(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public boolean isFinished() {
        return finished.isSet();
    }

    @Override
    public void close() {
        finished.close();
    }

    public static void runInBackground(Runnable work) {
        runInBackground(work, null);
    }

    /**
     * Schedules work without a handle.
     *
     * @param finished set when the work exits, may be null
     */
    public static void runInBackground(Runnable work, CompletionSignal finished) {
        if (work == null) {
            throw new IllegalArgumentException("work must not be null");
        }
        EXECUTOR.execute(() -> {
            try {
                work.run();
            } finally {
                if (finished != null) {
                    finished.set();
                }
            }
        });
    }

}
