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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleTest {

    final PrintStream original = Console.getOutput();
    final boolean colors = Console.isColorsEnabled();

    @AfterEach
    void afterEach() {
        Console.setOutput(original);
        Console.setColorsEnabled(colors);
    }

    @Test
    void testColorFormatting() {
        Console.setColorsEnabled(true);
        String fail = Console.fail("failed");
        assertTrue(fail.startsWith(Console.BRIGHT_RED + Console.BOLD));
        assertTrue(fail.endsWith(Console.RESET));
        assertEquals("failed", Console.stripAnsi(fail));
    }

    @Test
    void testColorFormattingDisabled() {
        Console.setColorsEnabled(false);
        assertEquals("failed", Console.fail("failed"));
        assertEquals("label", Console.label("label"));
        assertEquals("warning", Console.warn("warning"));
    }

    @Test
    void testRunnerLoggerWritesToConsole() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        ConsoleRunnerLogger logger = new ConsoleRunnerLogger(false);
        logger.logMessage("plain");
        logger.logError("bad");
        logger.logWarning("careful");
        logger.logImportantMessage("heading");
        logger.logRaw("raw");
        String nl = System.lineSeparator();
        assertEquals("plain" + nl + "bad" + nl + "careful" + nl + "heading" + nl + "raw" + nl,
                bytes.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testRunnerLoggerColors() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Console.setOutput(new PrintStream(bytes, true, StandardCharsets.UTF_8));
        Console.setColorsEnabled(true);
        new ConsoleRunnerLogger(true).logError("bad");
        assertTrue(bytes.toString(StandardCharsets.UTF_8).contains(Console.BRIGHT_RED));
    }

}
