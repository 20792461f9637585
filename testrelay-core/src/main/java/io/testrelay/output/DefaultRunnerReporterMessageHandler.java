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

import io.testrelay.common.ExceptionUtility;
import io.testrelay.common.FailureInfo;
import io.testrelay.core.DiagnosticMessage;
import io.testrelay.core.ErrorMessage;
import io.testrelay.core.ExecutionSummary;
import io.testrelay.core.MessageHandlerArgs;
import io.testrelay.core.TestAssemblyFinished;
import io.testrelay.core.TestAssemblyStarting;
import io.testrelay.core.TestClassCleanupFailure;
import io.testrelay.core.TestExecutionSummary;
import io.testrelay.core.TestFailed;
import io.testrelay.core.TestPassed;
import io.testrelay.core.TestSkipped;
import io.testrelay.core.TypedMessageSink;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Writes the human-readable run report through a {@link RunnerLogger}.
 * <p>
 * Each message kind has one handler registered in the constructor. Subclasses that need to do
 * their own bookkeeping before this output register with
 * {@link #addHandlerFirst(Class, io.testrelay.core.MessageHandler)}.
 */
public class DefaultRunnerReporterMessageHandler extends TypedMessageSink {

    private static final String INDENT = "      ";

    private final RunnerLogger logger;

    public DefaultRunnerReporterMessageHandler(RunnerLogger logger) {
        if (logger == null) {
            throw new IllegalArgumentException("logger must not be null");
        }
        this.logger = logger;
        addHandler(TestAssemblyStarting.class, this::handleTestAssemblyStarting);
        addHandler(TestAssemblyFinished.class, this::handleTestAssemblyFinished);
        addHandler(TestPassed.class, this::handleTestPassed);
        addHandler(TestFailed.class, this::handleTestFailed);
        addHandler(TestSkipped.class, this::handleTestSkipped);
        addHandler(TestClassCleanupFailure.class, this::handleTestClassCleanupFailure);
        addHandler(ErrorMessage.class, this::handleErrorMessage);
        addHandler(DiagnosticMessage.class, this::handleDiagnosticMessage);
        addHandler(TestExecutionSummary.class, this::handleTestExecutionSummary);
    }

    public RunnerLogger getLogger() {
        return logger;
    }

    protected void handleTestAssemblyStarting(MessageHandlerArgs<TestAssemblyStarting> args) {
        logger.logImportantMessage("  Starting:    " + args.getMessage().assembly().name());
    }

    protected void handleTestAssemblyFinished(MessageHandlerArgs<TestAssemblyFinished> args) {
        logger.logImportantMessage("  Finished:    " + args.getMessage().assembly().name());
    }

    protected void handleTestPassed(MessageHandlerArgs<TestPassed> args) {
        TestPassed message = args.getMessage();
        if (message.output() != null && !message.output().isBlank()) {
            logger.logMessage("    " + message.test().displayName() + " [PASS]");
            logOutput(message.output());
        }
    }

    protected void handleTestFailed(MessageHandlerArgs<TestFailed> args) {
        TestFailed message = args.getMessage();
        logger.logError("    " + message.test().displayName() + " [FAIL]");
        logFailureDetails(message.failure());
        if (message.output() != null && !message.output().isBlank()) {
            logOutput(message.output());
        }
    }

    protected void handleTestSkipped(MessageHandlerArgs<TestSkipped> args) {
        TestSkipped message = args.getMessage();
        logger.logWarning("    " + message.test().displayName() + " [SKIP]");
        logger.logWarning(indent(message.reason()));
    }

    protected void handleTestClassCleanupFailure(MessageHandlerArgs<TestClassCleanupFailure> args) {
        TestClassCleanupFailure message = args.getMessage();
        logger.logError("    [Test Class Cleanup Failure (" + message.testClass() + ")]");
        logFailureDetails(message.failure());
    }

    protected void handleErrorMessage(MessageHandlerArgs<ErrorMessage> args) {
        FailureInfo failure = args.getMessage().failure();
        String type = failure.isEmpty() ? null : failure.getExceptionType(0);
        logger.logError("    [FATAL ERROR] " + (type == null ? "(unknown)" : type));
        logFailureDetails(failure);
    }

    protected void handleDiagnosticMessage(MessageHandlerArgs<DiagnosticMessage> args) {
        logger.logMessage("    " + args.getMessage().message());
    }

    protected void handleTestExecutionSummary(MessageHandlerArgs<TestExecutionSummary> args) {
        Map<String, ExecutionSummary> summaries = args.getMessage().summaries();
        logger.logImportantMessage("=== TEST EXECUTION SUMMARY ===");
        if (summaries.isEmpty()) {
            logger.logImportantMessage("   No tests were run");
            return;
        }
        int width = "GRAND TOTAL".length();
        for (String name : summaries.keySet()) {
            width = Math.max(width, name.length());
        }
        ExecutionSummary total = new ExecutionSummary(0, 0, 0, BigDecimal.ZERO, 0);
        for (Map.Entry<String, ExecutionSummary> entry : summaries.entrySet()) {
            ExecutionSummary summary = entry.getValue();
            total = total.plus(summary);
            logger.logImportantMessage(summaryLine(entry.getKey(), width, summary));
        }
        if (summaries.size() > 1) {
            logger.logImportantMessage("   " + " ".repeat(width) + "  " + "-".repeat(11));
            logger.logImportantMessage(summaryLine("GRAND TOTAL", width, total)
                    + " (" + seconds(args.getMessage().elapsedClockTime()) + ")");
        }
    }

    private static String summaryLine(String name, int width, ExecutionSummary summary) {
        return "   " + name + " ".repeat(width - name.length())
                + "  Total: " + summary.total()
                + ", Errors: " + summary.errors()
                + ", Failed: " + summary.failed()
                + ", Skipped: " + summary.skipped()
                + ", Time: " + seconds(summary.time());
    }

    static String seconds(BigDecimal time) {
        return time.setScale(3, RoundingMode.HALF_UP).toPlainString() + "s";
    }

    protected void logFailureDetails(FailureInfo failure) {
        logger.logError(indent(ExceptionUtility.combineMessages(failure)));
        String stackTrace = ExceptionUtility.combineStackTraces(failure);
        if (stackTrace != null && !stackTrace.isEmpty()) {
            logger.logError(INDENT + "Stack Trace:");
            logger.logError(indent(stackTrace));
        }
    }

    private void logOutput(String output) {
        logger.logMessage(INDENT + "Output:");
        logger.logMessage(indent(output.stripTrailing()));
    }

    static String indent(String text) {
        if (text == null) {
            return INDENT;
        }
        return INDENT + text.replace("\r\n", "\n").replace("\n", System.lineSeparator() + INDENT);
    }

}
