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

import io.testrelay.common.ExceptionUtility;
import io.testrelay.common.FailureInfo;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

final class Messages {

    private Messages() {
    }

    static <T> T required(String name, T value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    static BigDecimal time(BigDecimal executionTime) {
        return executionTime == null ? BigDecimal.ZERO : executionTime;
    }

    static Map<String, Object> assemblyJson(AssemblyInfo assembly) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("assembly", assembly.toJson());
        return map;
    }

    static Map<String, Object> testJson(AssemblyInfo assembly, TestInfo test) {
        Map<String, Object> map = assemblyJson(assembly);
        map.put("test", test.toJson());
        return map;
    }

    static void putFailure(Map<String, Object> map, FailureInfo failure) {
        map.put("message", ExceptionUtility.combineMessages(failure));
        String stackTrace = ExceptionUtility.combineStackTraces(failure);
        if (stackTrace != null) {
            map.put("stackTrace", stackTrace);
        }
    }

}
