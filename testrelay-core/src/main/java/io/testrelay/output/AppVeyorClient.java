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
package io.testrelay.output;

import io.testrelay.common.Json;
import io.testrelay.core.WorkerThread;
import io.testrelay.http.DefaultHttpClientFactory;
import io.testrelay.http.Http;
import io.testrelay.http.HttpClient;
import io.testrelay.http.HttpClientFactory;
import io.testrelay.http.HttpRequest;
import io.testrelay.http.HttpResponse;
import org.slf4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sends test records to the AppVeyor build worker API in batches.
 * <p>
 * Records are queued by the caller's thread and sent by a background worker: new tests with
 * {@code POST /api/tests/batch}, updates with {@code PUT /api/tests/batch}. Within one flush the
 * adds go out before the updates, so the server always knows a test before it is updated.
 * After the first failed request the client stops talking to the server for good and only
 * drops records.
 */
public class AppVeyorClient implements CiStatusClient {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String BATCH_PATH = "/api/tests/batch";
    public static final int DEFAULT_FLUSH_INTERVAL_MILLIS = 1000;

    private final RunnerLogger runnerLogger;
    private final String batchUrl;
    private final HttpClient http;
    private final long flushIntervalMillis;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition shutdownRequested = lock.newCondition();
    private List<CiTestRecord> addQueue = new ArrayList<>();
    private List<CiTestRecord> updateQueue = new ArrayList<>();
    private boolean shutdown;
    private boolean closed;

    private volatile boolean previousErrors;
    private int requestCount;

    private final WorkerThread worker;

    public AppVeyorClient(RunnerLogger runnerLogger, String baseUri) {
        this(runnerLogger, baseUri, new DefaultHttpClientFactory(), DEFAULT_FLUSH_INTERVAL_MILLIS);
    }

    public AppVeyorClient(RunnerLogger runnerLogger, String baseUri, HttpClientFactory httpClientFactory,
                          long flushIntervalMillis) {
        if (runnerLogger == null) {
            throw new IllegalArgumentException("runnerLogger must not be null");
        }
        if (baseUri == null) {
            throw new IllegalArgumentException("baseUri must not be null");
        }
        if (httpClientFactory == null) {
            throw new IllegalArgumentException("httpClientFactory must not be null");
        }
        if (flushIntervalMillis <= 0) {
            throw new IllegalArgumentException("flushIntervalMillis must be positive: " + flushIntervalMillis);
        }
        this.runnerLogger = runnerLogger;
        this.batchUrl = Http.trimTrailingSlashes(baseUri) + BATCH_PATH;
        this.http = httpClientFactory.create();
        this.flushIntervalMillis = flushIntervalMillis;
        worker = new WorkerThread(this::run);
        logger.debug("appveyor client started: {}", batchUrl);
    }

    @Override
    public void addTest(CiTestRecord record) {
        enqueue(record, true);
    }

    @Override
    public void updateTest(CiTestRecord record) {
        enqueue(record, false);
    }

    private void enqueue(CiTestRecord record, boolean add) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        lock.lock();
        try {
            if (shutdown) {
                logger.debug("appveyor client closed, dropping: {}", record.testName());
                return;
            }
            (add ? addQueue : updateQueue).add(record);
        } finally {
            lock.unlock();
        }
    }

    private void run() {
        while (true) {
            List<CiTestRecord> adds;
            List<CiTestRecord> updates;
            boolean done;
            lock.lock();
            try {
                if (!shutdown) {
                    try {
                        shutdownRequested.await(flushIntervalMillis, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        shutdown = true;
                    }
                }
                adds = addQueue;
                updates = updateQueue;
                addQueue = new ArrayList<>();
                updateQueue = new ArrayList<>();
                done = shutdown;
            } finally {
                lock.unlock();
            }
            send("POST", adds);
            send("PUT", updates);
            if (done) {
                return;
            }
        }
    }

    private void send(String method, List<CiTestRecord> records) {
        if (records.isEmpty() || previousErrors) {
            return;
        }
        List<Object> body = new ArrayList<>(records.size());
        for (CiTestRecord record : records) {
            body.add(record.toJson());
        }
        HttpRequest request = HttpRequest.of(method, batchUrl)
                .putHeader(Http.ACCEPT, Http.APPLICATION_JSON)
                .setBodyJson(Json.stringifyStrict(body));
        try {
            HttpResponse response = http.invoke(request);
            requestCount++;
            if (!response.isSuccess()) {
                fail("AppVeyor API returned status " + response.getStatus() + " for " + request, null);
            }
        } catch (RuntimeException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            fail("Error communicating with AppVeyor API at " + batchUrl + ": " + cause.getMessage(), e);
        }
    }

    private void fail(String message, Exception e) {
        previousErrors = true;
        runnerLogger.logError(message);
        if (e == null) {
            logger.warn(message);
        } else {
            logger.warn(message, e);
        }
    }

    public boolean hasPreviousErrors() {
        return previousErrors;
    }

    /**
     * Number of requests that reached the server, successful or not.
     */
    public int getRequestCount() {
        return requestCount;
    }

    /**
     * Stops the worker after a final flush and releases the HTTP transport. Safe to call twice.
     */
    @Override
    public void close() throws IOException {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            shutdown = true;
            shutdownRequested.signalAll();
        } finally {
            lock.unlock();
        }
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("interrupted while flushing appveyor records");
        } finally {
            worker.close();
            http.close();
        }
        logger.debug("appveyor client closed after {} requests", requestCount);
    }

}
