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

import io.testrelay.common.DisposalTracker;
import io.testrelay.output.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Reusable base for running the tests of one assembly: either everything (discovery first,
 * then execution) or a given list of test cases.
 * <p>
 * Everything the executor allocates is registered with its {@link DisposalTracker}, so
 * {@link #close()} releases all of it.
 *
 * @param <T> the test case type the framework runs
 */
public abstract class TestFrameworkExecutor<T extends TestCase> implements AutoCloseable {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final Class<T> testCaseType;
    private final DisposalTracker disposalTracker = new DisposalTracker();
    private AssemblyInfo assembly;
    private MessageSink diagnosticMessageSink;
    private volatile ExecutorState state = ExecutorState.IDLE;

    protected TestFrameworkExecutor(AssemblyInfo assembly, Class<T> testCaseType, MessageSink diagnosticMessageSink) {
        this.assembly = required("assembly", assembly);
        this.testCaseType = required("testCaseType", testCaseType);
        this.diagnosticMessageSink = required("diagnosticMessageSink", diagnosticMessageSink);
    }

    private static <V> V required(String name, V value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    public AssemblyInfo getAssembly() {
        return assembly;
    }

    protected void setAssembly(AssemblyInfo assembly) {
        this.assembly = required("assembly", assembly);
    }

    public MessageSink getDiagnosticMessageSink() {
        return diagnosticMessageSink;
    }

    protected void setDiagnosticMessageSink(MessageSink diagnosticMessageSink) {
        this.diagnosticMessageSink = required("diagnosticMessageSink", diagnosticMessageSink);
    }

    public DisposalTracker getDisposalTracker() {
        return disposalTracker;
    }

    public ExecutorState getState() {
        return state;
    }

    public Class<T> getTestCaseType() {
        return testCaseType;
    }

    /**
     * Creates the discoverer used when the caller asks to run all tests.
     */
    protected abstract TestFrameworkDiscoverer createDiscoverer();

    /**
     * The execution stage: runs the test cases and reports to the sink.
     */
    protected abstract void runTestCases(List<T> testCases, MessageSink executionMessageSink,
                                         ExecutionOptions executionOptions);

    /**
     * Returns the serializer used by {@link #deserialize(String)}.
     */
    protected abstract TestCaseSerializer getSerializer();

    public TestCase deserialize(String value) {
        required("value", value);
        TestCase testCase = getSerializer().deserialize(value);
        if (testCase == null) {
            throw new IllegalArgumentException("Could not deserialize test case: " + value);
        }
        return testCase;
    }

    /**
     * Discovers every test case of the assembly, waits for discovery to finish and runs
     * the test cases of type {@code T}.
     */
    public void runAll(MessageSink executionMessageSink, DiscoveryOptions discoveryOptions,
                       ExecutionOptions executionOptions) throws InterruptedException {
        required("executionMessageSink", executionMessageSink);
        required("discoveryOptions", discoveryOptions);
        required("executionOptions", executionOptions);
        state = ExecutorState.DISCOVERING;
        List<T> testCases = new ArrayList<>();
        boolean discovered = false;
        try (TestDiscoverySink discoverySink = new TestDiscoverySink()) {
            TestFrameworkDiscoverer discoverer = disposalTracker.add(createDiscoverer());
            discoverer.find(false, discoverySink, discoveryOptions);
            discoverySink.waitForCompletion();
            for (TestCase testCase : discoverySink.getTestCases()) {
                if (testCaseType.isInstance(testCase)) {
                    testCases.add(testCaseType.cast(testCase));
                } else {
                    logger.debug("ignoring discovered test case of unexpected type: {}", testCase);
                }
            }
            discovered = true;
        } finally {
            if (!discovered) {
                state = ExecutorState.DONE;
            }
        }
        logger.debug("discovered {} test case(s) in {}", testCases.size(), assembly.name());
        execute(testCases, executionMessageSink, executionOptions);
    }

    /**
     * Runs the given test cases, without discovery.
     *
     * @throws IllegalArgumentException if a test case is not of type {@code T}
     */
    public void runTests(Collection<? extends TestCase> testCases, MessageSink executionMessageSink,
                         ExecutionOptions executionOptions) {
        required("testCases", testCases);
        required("executionMessageSink", executionMessageSink);
        required("executionOptions", executionOptions);
        List<T> list = new ArrayList<>(testCases.size());
        for (TestCase testCase : testCases) {
            if (!testCaseType.isInstance(testCase)) {
                throw new IllegalArgumentException("test case " + testCase + " is not a " + testCaseType.getName());
            }
            list.add(testCaseType.cast(testCase));
        }
        execute(list, executionMessageSink, executionOptions);
    }

    private void execute(List<T> testCases, MessageSink executionMessageSink, ExecutionOptions executionOptions) {
        state = ExecutorState.EXECUTING;
        try {
            runTestCases(testCases, executionMessageSink, executionOptions);
        } finally {
            state = ExecutorState.DONE;
        }
    }

    @Override
    public void close() throws Exception {
        disposalTracker.close();
    }

}
