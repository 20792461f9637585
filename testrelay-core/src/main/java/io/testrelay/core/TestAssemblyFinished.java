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
 * Final message of an assembly's execution, with the assembly totals.
 */
public record TestAssemblyFinished(
        AssemblyInfo assembly,
        BigDecimal executionTime,
        int testsRun,
        int testsFailed,
        int testsSkipped
) implements AssemblyMessage {

    public TestAssemblyFinished {
        Messages.required("assembly", assembly);
        executionTime = Messages.time(executionTime);
    }

    @Override
    public MessageType getType() {
        return MessageType.ASSEMBLY_FINISHED;
    }

    @Override
    public Map<String, Object> toJson() {
        Map<String, Object> map = Messages.assemblyJson(assembly);
        map.put("executionTime", executionTime.toPlainString());
        map.put("testsRun", testsRun);
        map.put("testsFailed", testsFailed);
        map.put("testsSkipped", testsSkipped);
        return map;
    }

}
