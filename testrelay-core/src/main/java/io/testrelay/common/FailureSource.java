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
package io.testrelay.common;

import java.util.ArrayList;
import java.util.List;

/**
 * An error that can be flattened into a {@link FailureInfo}: a type name, a message,
 * a stack trace and any number of nested causes.
 */
public interface FailureSource {

    /**
     * Returns the type name, or null when the type is unknown.
     */
    String getTypeName();

    String getMessage();

    /**
     * Returns the stack trace text, or null when not available.
     */
    String getStackTrace();

    List<FailureSource> getCauses();

    /**
     * Adapts a Java exception. The nested causes are {@link Throwable#getCause()}
     * followed by every {@link Throwable#getSuppressed() suppressed} exception.
     */
    static FailureSource of(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new ThrowableSource(error);
    }

    final class ThrowableSource implements FailureSource {

        private final Throwable error;

        private ThrowableSource(Throwable error) {
            this.error = error;
        }

        public Throwable getError() {
            return error;
        }

        @Override
        public String getTypeName() {
            return error.getClass().getName();
        }

        @Override
        public String getMessage() {
            String message = error.getMessage();
            return message == null ? "" : message;
        }

        @Override
        public String getStackTrace() {
            return ExceptionUtility.formatStackTrace(error);
        }

        @Override
        public List<FailureSource> getCauses() {
            List<FailureSource> causes = new ArrayList<>();
            Throwable cause = error.getCause();
            if (cause != null && cause != error) {
                causes.add(new ThrowableSource(cause));
            }
            for (Throwable suppressed : error.getSuppressed()) {
                causes.add(new ThrowableSource(suppressed));
            }
            return causes;
        }

    }

}
