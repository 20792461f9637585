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

/**
 * {@link RunnerLogger} that writes to the {@link Console}, with colors when they are enabled.
 */
public class ConsoleRunnerLogger implements RunnerLogger {

    private final boolean useColors;
    private final Object lock = new Object();

    public ConsoleRunnerLogger() {
        this(Console.isColorsEnabled());
    }

    public ConsoleRunnerLogger(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public void logMessage(String message) {
        write(message);
    }

    @Override
    public void logImportantMessage(String message) {
        write(useColors ? Console.label(message) : message);
    }

    @Override
    public void logWarning(String message) {
        write(useColors ? Console.warn(message) : message);
    }

    @Override
    public void logError(String message) {
        write(useColors ? Console.fail(message) : message);
    }

    @Override
    public void logRaw(String message) {
        write(message);
    }

    private void write(String message) {
        // keep multi-line blocks from interleaving
        synchronized (lock) {
            Console.println(message);
        }
    }

}
