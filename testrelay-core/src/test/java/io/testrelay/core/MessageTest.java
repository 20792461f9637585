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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    static final AssemblyInfo ASSEMBLY = new AssemblyInfo("demo", "/build/demo.jar", "jdk17");

    @Test
    void testAssemblyInfo() {
        assertEquals("demo.jar", ASSEMBLY.getFileName());
        Map<String, Object> json = ASSEMBLY.toJson();
        assertEquals("demo", json.get("name"));
        assertEquals("jdk17", json.get("targetFramework"));
        assertFalse(AssemblyInfo.of("x", "x.jar").toJson().containsKey("targetFramework"));
        assertThrows(IllegalArgumentException.class, () -> AssemblyInfo.of(null, "x.jar"));
    }

    @Test
    void testRequiredFields() {
        TestInfo test = TestInfo.of(FakeTestCase.of("demo.Tests", "one"));
        assertThrows(IllegalArgumentException.class, () -> new TestStarting(null, test));
        assertThrows(IllegalArgumentException.class, () -> new TestPassed(ASSEMBLY, null, BigDecimal.ONE, null));
        assertThrows(IllegalArgumentException.class, () -> new TestSkipped(ASSEMBLY, test, null));
        assertThrows(IllegalArgumentException.class, () -> new DiagnosticMessage(null));
    }

    @Test
    void testExecutionTimeDefaultsToZero() {
        TestInfo test = TestInfo.of(FakeTestCase.of("demo.Tests", "one"));
        TestPassed passed = new TestPassed(ASSEMBLY, test, null, null);
        assertEquals(BigDecimal.ZERO, passed.executionTime());
        assertEquals(BigDecimal.ZERO, new TestSkipped(ASSEMBLY, test, "not today").executionTime());
    }

    @Test
    void testFailedToJson() {
        TestInfo test = TestInfo.of(FakeTestCase.of("demo.Tests", "one"));
        TestFailed failed = TestFailed.of(ASSEMBLY, test, new BigDecimal("0.5"), "out",
                new IllegalStateException("bad state"));
        assertEquals(MessageType.TEST_FAILED, failed.getType());
        Map<String, Object> json = failed.toJson();
        assertEquals("0.5", json.get("executionTime"));
        assertEquals("out", json.get("output"));
        assertEquals("java.lang.IllegalStateException : bad state", json.get("message"));
        assertTrue(json.containsKey("stackTrace"));
        @SuppressWarnings("unchecked")
        Map<String, Object> testJson = (Map<String, Object>) json.get("test");
        assertEquals("demo.Tests.one", testJson.get("displayName"));
    }

    @Test
    void testExecutionSummaryPlus() {
        ExecutionSummary a = new ExecutionSummary(3, 1, 1, new BigDecimal("1.5"), 0);
        ExecutionSummary b = new ExecutionSummary(2, 0, 0, new BigDecimal("0.25"), 1);
        ExecutionSummary sum = a.plus(b);
        assertEquals(5, sum.total());
        assertEquals(1, sum.failed());
        assertEquals(1, sum.skipped());
        assertEquals(new BigDecimal("1.75"), sum.time());
        assertEquals(1, sum.errors());
    }

    @Test
    void testExecutionSummaryKeepsOrderAndIsImmutable() {
        Map<String, ExecutionSummary> summaries = new LinkedHashMap<>();
        summaries.put("b", new ExecutionSummary(1, 0, 0, BigDecimal.ONE, 0));
        summaries.put("a", new ExecutionSummary(1, 0, 0, BigDecimal.ONE, 0));
        TestExecutionSummary summary = new TestExecutionSummary(BigDecimal.TEN, summaries);
        assertEquals(List.of("b", "a"), List.copyOf(summary.summaries().keySet()));
        assertThrows(UnsupportedOperationException.class, () -> summary.summaries().clear());
    }

    @Test
    void testCleanupFailureCopiesTestCases() {
        TestClassCleanupFailure failure = TestClassCleanupFailure.of(ASSEMBLY, null, "demo.Tests",
                new RuntimeException("teardown"));
        assertTrue(failure.testCases().isEmpty());
        assertEquals(MessageType.TEST_CLASS_CLEANUP_FAILURE, failure.getType());
    }

}
