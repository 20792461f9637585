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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TestFrameworkExecutorTest {

    static final AssemblyInfo ASSEMBLY = AssemblyInfo.of("demo", "/build/demo.jar");

    record OtherTestCase(String getUniqueId) implements TestCase {

        @Override
        public String getDisplayName() {
            return getUniqueId;
        }

        @Override
        public String getClassName() {
            return "other";
        }

        @Override
        public String getMethodName() {
            return getUniqueId;
        }

    }

    /**
     * Discovers the given test cases on a background worker and "runs" them by reporting a
     * pass for each.
     */
    static class FakeExecutor extends TestFrameworkExecutor<FakeTestCase> {

        final List<TestCase> toDiscover;
        final AtomicBoolean discovererClosed = new AtomicBoolean();
        final List<ExecutorState> statesDuringRun = new ArrayList<>();
        List<FakeTestCase> ran;

        FakeExecutor(List<TestCase> toDiscover) {
            super(ASSEMBLY, FakeTestCase.class, message -> true);
            this.toDiscover = toDiscover;
        }

        @Override
        protected TestFrameworkDiscoverer createDiscoverer() {
            return new TestFrameworkDiscoverer() {
                @Override
                public void find(boolean includeSourceInformation, MessageSink sink, DiscoveryOptions options) {
                    WorkerThread.runInBackground(() -> {
                        sink.onMessage(new DiscoveryStarting(ASSEMBLY));
                        for (TestCase testCase : toDiscover) {
                            sink.onMessage(new TestCaseDiscovered(ASSEMBLY, testCase));
                        }
                        sink.onMessage(new DiscoveryComplete(ASSEMBLY, toDiscover.size()));
                    });
                }

                @Override
                public void close() {
                    discovererClosed.set(true);
                }
            };
        }

        @Override
        protected void runTestCases(List<FakeTestCase> testCases, MessageSink sink, ExecutionOptions options) {
            statesDuringRun.add(getState());
            ran = testCases;
            sink.onMessage(TestAssemblyStarting.of(ASSEMBLY));
            for (FakeTestCase testCase : testCases) {
                TestInfo test = TestInfo.of(testCase);
                sink.onMessage(new TestStarting(ASSEMBLY, test));
                sink.onMessage(new TestPassed(ASSEMBLY, test, new BigDecimal("0.010"), null));
            }
            sink.onMessage(new TestAssemblyFinished(ASSEMBLY, BigDecimal.ONE, testCases.size(), 0, 0));
        }

        @Override
        protected TestCaseSerializer getSerializer() {
            return new TestCaseSerializer() {
                @Override
                public String serialize(TestCase testCase) {
                    return testCase.getClassName() + ":" + testCase.getMethodName();
                }

                @Override
                public TestCase deserialize(String value) {
                    String[] parts = value.split(":");
                    return parts.length == 2 ? FakeTestCase.of(parts[0], parts[1]) : null;
                }
            };
        }

    }

    @Test
    void testRunAllDiscoversThenExecutes() throws Exception {
        FakeExecutor executor = new FakeExecutor(List.of(
                FakeTestCase.of("demo.Tests", "one"),
                FakeTestCase.of("demo.Tests", "two")));
        assertEquals(ExecutorState.IDLE, executor.getState());
        CompletionSink sink = CompletionSink.finishedBy(TestAssemblyFinished.class);
        executor.runAll(sink, DiscoveryOptions.create(), ExecutionOptions.create());
        assertTrue(sink.isFinished());
        assertEquals(2, executor.ran.size());
        assertEquals(2, sink.getMessages(TestPassed.class).size());
        assertEquals(List.of(ExecutorState.EXECUTING), executor.statesDuringRun);
        assertEquals(ExecutorState.DONE, executor.getState());
        assertFalse(executor.discovererClosed.get());
        executor.close();
        assertTrue(executor.discovererClosed.get());
    }

    @Test
    void testRunAllSkipsForeignTestCaseTypes() throws Exception {
        FakeExecutor executor = new FakeExecutor(List.of(
                FakeTestCase.of("demo.Tests", "one"),
                new OtherTestCase("foreign")));
        CompletionSink sink = CompletionSink.finishedBy(TestAssemblyFinished.class);
        executor.runAll(sink, DiscoveryOptions.create(), ExecutionOptions.create());
        assertEquals(1, executor.ran.size());
        assertEquals("demo.Tests.one", executor.ran.get(0).getUniqueId());
        executor.close();
    }

    @Test
    void testRunAllWithNothingDiscovered() throws Exception {
        FakeExecutor executor = new FakeExecutor(List.of());
        CompletionSink sink = CompletionSink.finishedBy(TestAssemblyFinished.class);
        executor.runAll(sink, DiscoveryOptions.create(), ExecutionOptions.create());
        assertTrue(executor.ran.isEmpty());
        assertTrue(sink.isFinished());
        executor.close();
    }

    @Test
    void testDiscoveryFailureEndsRun() {
        FakeExecutor executor = new FakeExecutor(List.of()) {
            @Override
            protected TestFrameworkDiscoverer createDiscoverer() {
                throw new IllegalStateException("cannot load assembly");
            }
        };
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> executor.runAll(message -> true, DiscoveryOptions.create(), ExecutionOptions.create()));
        assertEquals("cannot load assembly", e.getMessage());
        assertEquals(ExecutorState.DONE, executor.getState());
        assertNull(executor.ran);
    }

    @Test
    void testFindFailureEndsRun() throws Exception {
        FakeExecutor executor = new FakeExecutor(List.of()) {
            @Override
            protected TestFrameworkDiscoverer createDiscoverer() {
                return new TestFrameworkDiscoverer() {
                    @Override
                    public void find(boolean includeSourceInformation, MessageSink sink, DiscoveryOptions options) {
                        throw new IllegalArgumentException("bad filter");
                    }

                    @Override
                    public void close() {
                        discovererClosed.set(true);
                    }
                };
            }
        };
        assertThrows(IllegalArgumentException.class,
                () -> executor.runAll(message -> true, DiscoveryOptions.create(), ExecutionOptions.create()));
        assertEquals(ExecutorState.DONE, executor.getState());
        executor.close();
        assertTrue(executor.discovererClosed.get());
    }

    @Test
    void testRunTestsWithoutDiscovery() throws Exception {
        FakeExecutor executor = new FakeExecutor(List.of());
        CompletionSink sink = CompletionSink.finishedBy(TestAssemblyFinished.class);
        executor.runTests(List.of(FakeTestCase.of("demo.Tests", "given")), sink, ExecutionOptions.create());
        assertEquals(1, executor.ran.size());
        assertEquals(0, executor.getDisposalTracker().size());
        executor.close();
    }

    @Test
    void testRunTestsRejectsForeignTestCase() {
        FakeExecutor executor = new FakeExecutor(List.of());
        List<TestCase> cases = List.of(new OtherTestCase("foreign"));
        assertThrows(IllegalArgumentException.class,
                () -> executor.runTests(cases, message -> true, ExecutionOptions.create()));
        assertEquals(ExecutorState.IDLE, executor.getState());
    }

    @Test
    void testArgumentErrorsBeforeAnyWork() {
        FakeExecutor executor = new FakeExecutor(List.of(FakeTestCase.of("demo.Tests", "one")));
        assertThrows(IllegalArgumentException.class,
                () -> executor.runAll(null, DiscoveryOptions.create(), ExecutionOptions.create()));
        assertThrows(IllegalArgumentException.class,
                () -> executor.runAll(message -> true, null, ExecutionOptions.create()));
        assertThrows(IllegalArgumentException.class,
                () -> executor.runAll(message -> true, DiscoveryOptions.create(), null));
        assertEquals(ExecutorState.IDLE, executor.getState());
        assertNull(executor.ran);
    }

    @Test
    void testConstructorArguments() {
        assertThrows(IllegalArgumentException.class, () -> new TestFrameworkExecutor<FakeTestCase>(null, FakeTestCase.class, m -> true) {
            @Override
            protected TestFrameworkDiscoverer createDiscoverer() {
                return null;
            }

            @Override
            protected void runTestCases(List<FakeTestCase> testCases, MessageSink sink, ExecutionOptions options) {
            }

            @Override
            protected TestCaseSerializer getSerializer() {
                return null;
            }
        });
    }

    @Test
    void testDeserialize() {
        FakeExecutor executor = new FakeExecutor(List.of());
        TestCase testCase = executor.deserialize("demo.Tests:one");
        assertEquals("demo.Tests.one", testCase.getUniqueId());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> executor.deserialize("garbage"));
        assertTrue(e.getMessage().contains("garbage"));
        assertThrows(IllegalArgumentException.class, () -> executor.deserialize(null));
    }

}
