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

import java.util.Map;

public class ExecutionOptions extends TestFrameworkOptions {

    public static final String DIAGNOSTIC_MESSAGES = "diagnosticMessages";
    public static final String DISABLE_PARALLELIZATION = "disableParallelization";
    public static final String MAX_PARALLEL_THREADS = "maxParallelThreads";
    public static final String STOP_ON_FAIL = "stopOnFail";
    public static final String SYNCHRONOUS_MESSAGE_REPORTING = "synchronousMessageReporting";

    private ExecutionOptions(Map<String, Object> values) {
        super(values);
    }

    public static ExecutionOptions create() {
        return new ExecutionOptions(null);
    }

    public static ExecutionOptions of(Map<String, Object> values) {
        return new ExecutionOptions(values);
    }

    public ExecutionOptions diagnosticMessages(boolean diagnosticMessages) {
        setValue(DIAGNOSTIC_MESSAGES, diagnosticMessages);
        return this;
    }

    public ExecutionOptions disableParallelization(boolean disableParallelization) {
        setValue(DISABLE_PARALLELIZATION, disableParallelization);
        return this;
    }

    public ExecutionOptions maxParallelThreads(int maxParallelThreads) {
        setValue(MAX_PARALLEL_THREADS, maxParallelThreads);
        return this;
    }

    public ExecutionOptions stopOnFail(boolean stopOnFail) {
        setValue(STOP_ON_FAIL, stopOnFail);
        return this;
    }

    public ExecutionOptions synchronousMessageReporting(boolean synchronousMessageReporting) {
        setValue(SYNCHRONOUS_MESSAGE_REPORTING, synchronousMessageReporting);
        return this;
    }

    public boolean isDiagnosticMessages() {
        return getBoolean(DIAGNOSTIC_MESSAGES, false);
    }

    public boolean isDisableParallelization() {
        return getBoolean(DISABLE_PARALLELIZATION, false);
    }

    /**
     * Defaults to the number of available processors; zero or less also means that.
     */
    public int getMaxParallelThreads() {
        int value = getInt(MAX_PARALLEL_THREADS, 0);
        return value > 0 ? value : Runtime.getRuntime().availableProcessors();
    }

    public boolean isStopOnFail() {
        return getBoolean(STOP_ON_FAIL, false);
    }

    public boolean isSynchronousMessageReporting() {
        return getBoolean(SYNCHRONOUS_MESSAGE_REPORTING, false);
    }

}
