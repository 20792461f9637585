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

import io.testrelay.common.FailureInfo;

import java.util.List;
import java.util.Map;

/**
 * Reported when tearing down a test class failed after its tests ran.
 */
public record TestClassCleanupFailure(
        AssemblyInfo assembly,
        List<TestCase> testCases,
        String testClass,
        FailureInfo failure
) implements AssemblyMessage, FailureMessage {

    public TestClassCleanupFailure {
        Messages.required("assembly", assembly);
        Messages.required("testClass", testClass);
        Messages.required("failure", failure);
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }

    public static TestClassCleanupFailure of(AssemblyInfo assembly, List<TestCase> testCases, String testClass,
                                             Throwable error) {
        return new TestClassCleanupFailure(assembly, testCases, testClass, FailureInfo.of(error));
    }

    @Override
    public MessageType getType() {
        return MessageType.TEST_CLASS_CLEANUP_FAILURE;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = Messages.assemblyJson(assembly);
        map.put("testClass", testClass);
        map.put("testCases", testCases.size());
        Messages.putFailure(map, failure);
        return map;
    }

}
