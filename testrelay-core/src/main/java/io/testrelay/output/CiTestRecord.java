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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One test as reported to the CI status service.
 *
 * @param durationMilliseconds null while the test is running
 * @param stdOut               captured output, already truncated by the caller
 */
public record CiTestRecord(
        String testName,
        String testFramework,
        String fileName,
        TestOutcome outcome,
        Long durationMilliseconds,
        String errorMessage,
        String errorStackTrace,
        String stdOut
) {

    public CiTestRecord {
        if (testName == null) {
            throw new IllegalArgumentException("testName must not be null");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
    }

    public static CiTestRecord running(String testName, String testFramework, String fileName) {
        return new CiTestRecord(testName, testFramework, fileName, TestOutcome.Running, null, null, null, null);
    }

    /**
     * Wire format of the build worker API, note the capitalized error and output keys.
     */
    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("testName", testName);
        map.put("testFramework", testFramework);
        map.put("fileName", fileName);
        map.put("outcome", outcome.name());
        map.put("durationMilliseconds", durationMilliseconds);
        map.put("ErrorMessage", errorMessage);
        map.put("ErrorStackTrace", errorStackTrace);
        map.put("StdOut", stdOut);
        return map;
    }

}
