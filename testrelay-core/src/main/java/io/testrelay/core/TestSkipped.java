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

import java.math.BigDecimal;
import java.util.Map;

/**
 * A skipped test never runs, its execution time is always zero.
 */
public record TestSkipped(AssemblyInfo assembly, TestInfo test, String reason) implements TestMessage {

    public TestSkipped {
        Messages.required("assembly", assembly);
        Messages.required("test", test);
        Messages.required("reason", reason);
    }

    public BigDecimal executionTime() {
        return BigDecimal.ZERO;
    }

    @Override
    public MessageType getType() {
        return MessageType.TEST_SKIPPED;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = Messages.testJson(assembly, test);
        map.put("reason", reason);
        return map;
    }

}
