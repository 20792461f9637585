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

import io.testrelay.common.ExceptionUtility;
import io.testrelay.core.AssemblyInfo;
import io.testrelay.core.MessageHandlerArgs;
import io.testrelay.core.TestAssemblyFinished;
import io.testrelay.core.TestAssemblyStarting;
import io.testrelay.core.TestFailed;
import io.testrelay.core.TestPassed;
import io.testrelay.core.TestSkipped;
import io.testrelay.core.TestStarting;
import io.testrelay.http.Http;
import org.slf4j.Logger;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mirrors test results to the AppVeyor build worker API, then lets the default report run.
 * <p>
 * The client is shared by every assembly in flight. It is created on first use and closed when
 * the last running assembly finishes. The in-flight counter and the client handle are guarded
 * by one lock, so a release can never overlap the creation of the next client.
 * <p>
 * AppVeyor identifies tests by name, so repeated display names within an assembly (data driven
 * tests) are numbered: {@code "T"}, {@code "T 1"}, {@code "T 2"}. Only finished tests advance the
 * number, a starting test borrows the one its result will get.
 * <p>
 * Assemblies are tracked by their full identity, so builds of one assembly for different target
 * frameworks keep separate counters and file names. Finish events for an assembly that is not in
 * flight are ignored.
 * <p>
 * Durations are sent in whole milliseconds, rounded half-up. Output is cut to {@link #MAX_LENGTH}
 * characters, one less when the cut would split a surrogate pair.
 */
public class AppVeyorReporterMessageHandler extends DefaultRunnerReporterMessageHandler {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final int MAX_LENGTH = 4096;
    public static final String TEST_FRAMEWORK = "testrelay";

    private final String baseUri;
    private final CiStatusClientFactory clientFactory;

    private final ReentrantLock clientLock = new ReentrantLock();
    private int assembliesInFlight;
    private CiStatusClient client;
    private int clientsCreated;

    private final Map<AssemblyInfo, AssemblyEntry> assemblies = new ConcurrentHashMap<>();

    private record AssemblyEntry(String fileName, Map<String, Integer> testMethods) {
    }

    public AppVeyorReporterMessageHandler(RunnerLogger logger, String baseUri) {
        this(logger, baseUri, uri -> new AppVeyorClient(logger, uri));
    }

    public AppVeyorReporterMessageHandler(RunnerLogger logger, String baseUri, CiStatusClientFactory clientFactory) {
        super(logger);
        if (baseUri == null) {
            throw new IllegalArgumentException("baseUri must not be null");
        }
        if (clientFactory == null) {
            throw new IllegalArgumentException("clientFactory must not be null");
        }
        this.baseUri = Http.trimTrailingSlashes(baseUri);
        this.clientFactory = clientFactory;
        addHandlerFirst(TestAssemblyStarting.class, this::onAssemblyStarting);
        addHandlerFirst(TestAssemblyFinished.class, this::onAssemblyFinished);
        addHandlerFirst(TestStarting.class, this::onTestStarting);
        addHandlerFirst(TestPassed.class, this::onTestPassed);
        addHandlerFirst(TestFailed.class, this::onTestFailed);
        addHandlerFirst(TestSkipped.class, this::onTestSkipped);
    }

    public String getBaseUri() {
        return baseUri;
    }

    private CiStatusClient getClient() {
        clientLock.lock();
        try {
            if (client == null) {
                client = clientFactory.create(baseUri);
                clientsCreated++;
            }
            return client;
        } finally {
            clientLock.unlock();
        }
    }

    private void onAssemblyStarting(MessageHandlerArgs<TestAssemblyStarting> args) {
        AssemblyInfo assembly = args.getMessage().assembly();
        String fileName = assembly.getFileName();
        if (assembly.targetFramework() != null) {
            fileName = fileName + " (" + assembly.targetFramework() + ")";
        }
        clientLock.lock();
        try {
            if (assemblies.containsKey(assembly)) {
                logger.warn("assembly already in flight: {}", fileName);
                return;
            }
            assemblies.put(assembly, new AssemblyEntry(fileName, new TreeMap<>(String.CASE_INSENSITIVE_ORDER)));
            assembliesInFlight++;
        } finally {
            clientLock.unlock();
        }
    }

    private void onAssemblyFinished(MessageHandlerArgs<TestAssemblyFinished> args) {
        AssemblyInfo assembly = args.getMessage().assembly();
        clientLock.lock();
        try {
            if (assemblies.remove(assembly) == null) {
                logger.warn("finish for assembly that was never started: {}", assembly.name());
                return;
            }
            assembliesInFlight--;
            if (assembliesInFlight == 0) {
                if (client != null) {
                    try {
                        client.close();
                    } catch (IOException | RuntimeException e) {
                        transportError("closing the AppVeyor client", e);
                    }
                }
                client = null;
            }
        } finally {
            clientLock.unlock();
        }
    }

    private void onTestStarting(MessageHandlerArgs<TestStarting> args) {
        TestStarting message = args.getMessage();
        AssemblyEntry entry = entryFor(message.assembly());
        if (entry == null) {
            return;
        }
        String testName = message.test().displayName();
        Map<String, Integer> testMethods = entry.testMethods();
        synchronized (testMethods) {
            Integer count = testMethods.get(testName);
            if (count != null) {
                testName = testName + " " + count;
            }
        }
        CiTestRecord record = CiTestRecord.running(testName, TEST_FRAMEWORK, entry.fileName());
        send(record, true);
    }

    private void onTestPassed(MessageHandlerArgs<TestPassed> args) {
        TestPassed message = args.getMessage();
        AssemblyEntry entry = entryFor(message.assembly());
        if (entry == null) {
            return;
        }
        send(new CiTestRecord(
                getFinishedTestName(message.test().displayName(), entry.testMethods()),
                TEST_FRAMEWORK,
                entry.fileName(),
                TestOutcome.Passed,
                toMilliseconds(message.executionTime()),
                null,
                null,
                truncate(message.output())
        ), false);
    }

    private void onTestFailed(MessageHandlerArgs<TestFailed> args) {
        TestFailed message = args.getMessage();
        AssemblyEntry entry = entryFor(message.assembly());
        if (entry == null) {
            return;
        }
        send(new CiTestRecord(
                getFinishedTestName(message.test().displayName(), entry.testMethods()),
                TEST_FRAMEWORK,
                entry.fileName(),
                TestOutcome.Failed,
                toMilliseconds(message.executionTime()),
                ExceptionUtility.combineMessages(message.failure()),
                ExceptionUtility.combineStackTraces(message.failure()),
                truncate(message.output())
        ), false);
    }

    private void onTestSkipped(MessageHandlerArgs<TestSkipped> args) {
        TestSkipped message = args.getMessage();
        AssemblyEntry entry = entryFor(message.assembly());
        if (entry == null) {
            return;
        }
        send(new CiTestRecord(
                getFinishedTestName(message.test().displayName(), entry.testMethods()),
                TEST_FRAMEWORK,
                entry.fileName(),
                TestOutcome.Skipped,
                toMilliseconds(message.executionTime()),
                null,
                null,
                null
        ), false);
    }

    private AssemblyEntry entryFor(AssemblyInfo assembly) {
        AssemblyEntry entry = assemblies.get(assembly);
        if (entry == null) {
            logger.warn("test result for assembly that was never started: {}", assembly.name());
        }
        return entry;
    }

    private void send(CiTestRecord record, boolean add) {
        try {
            CiStatusClient current = getClient();
            if (add) {
                current.addTest(record);
            } else {
                current.updateTest(record);
            }
        } catch (RuntimeException e) {
            transportError("reporting test '" + record.testName() + "'", e);
        }
    }

    private void transportError(String action, Exception e) {
        getLogger().logError("AppVeyor: failure " + action + ": " + e.getMessage());
        logger.warn("appveyor failure {}", action, e);
    }

    static String getFinishedTestName(String methodName, Map<String, Integer> testMethods) {
        synchronized (testMethods) {
            String testName = methodName;
            int number = 0;
            Integer count = testMethods.get(methodName);
            if (count != null) {
                number = count;
                testName = methodName + " " + number;
            }
            testMethods.put(methodName, number + 1);
            return testName;
        }
    }

    static long toMilliseconds(BigDecimal seconds) {
        return seconds.movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValue();
    }

    static String truncate(String stdOut) {
        if (stdOut == null || stdOut.length() <= MAX_LENGTH) {
            return stdOut;
        }
        int end = MAX_LENGTH;
        if (Character.isHighSurrogate(stdOut.charAt(end - 1))) {
            end--;
        }
        return stdOut.substring(0, end);
    }

    // ========== State, for diagnostics ==========

    public int getAssembliesInFlight() {
        clientLock.lock();
        try {
            return assembliesInFlight;
        } finally {
            clientLock.unlock();
        }
    }

    public boolean isClientActive() {
        clientLock.lock();
        try {
            return client != null;
        } finally {
            clientLock.unlock();
        }
    }

    public int getClientsCreated() {
        clientLock.lock();
        try {
            return clientsCreated;
        } finally {
            clientLock.unlock();
        }
    }

}
