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

import java.math.BigDecimal;
import java.util.Map;

public record TestFailed(
        AssemblyInfo assembly,
        TestInfo test,
        BigDecimal executionTime,
        String output,
        FailureInfo failure
) implements TestMessage, FailureMessage {

    public TestFailed {
        Messages.required("assembly", assembly);
        Messages.required("test", test);
        Messages.required("failure", failure);
        executionTime = Messages.time(executionTime);
    }

    public static TestFailed of(AssemblyInfo assembly, TestInfo test, BigDecimal executionTime, String output,
                                Throwable error) {
        return new TestFailed(assembly, test, executionTime, output, FailureInfo.of(error));
    }

    @Override
    public MessageType getType() {
        return MessageType.TEST_FAILED;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = Messages.testJson(assembly, test);
        map.put("executionTime", executionTime.toPlainString());
        if (output != null) {
            map.put("output", output);
        }
        Messages.putFailure(map, failure);
        return map;
    }

}
