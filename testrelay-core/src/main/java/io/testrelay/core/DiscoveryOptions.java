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

import java.util.Locale;
import java.util.Map;

public class DiscoveryOptions extends TestFrameworkOptions {

    public static final String DIAGNOSTIC_MESSAGES = "diagnosticMessages";
    public static final String PRE_ENUMERATE_THEORIES = "preEnumerateTheories";
    public static final String METHOD_DISPLAY = "methodDisplay";

    public enum MethodDisplay {
        CLASS_AND_METHOD,
        METHOD
    }

    private DiscoveryOptions(Map<String, Object> values) {
        super(values);
    }

    public static DiscoveryOptions create() {
        return new DiscoveryOptions(null);
    }

    public static DiscoveryOptions of(Map<String, Object> values) {
        return new DiscoveryOptions(values);
    }

    public DiscoveryOptions diagnosticMessages(boolean diagnosticMessages) {
        setValue(DIAGNOSTIC_MESSAGES, diagnosticMessages);
        return this;
    }

    public DiscoveryOptions preEnumerateTheories(boolean preEnumerateTheories) {
        setValue(PRE_ENUMERATE_THEORIES, preEnumerateTheories);
        return this;
    }

    public DiscoveryOptions methodDisplay(MethodDisplay methodDisplay) {
        setValue(METHOD_DISPLAY, methodDisplay == null ? null : methodDisplay.name());
        return this;
    }

    public boolean isDiagnosticMessages() {
        return getBoolean(DIAGNOSTIC_MESSAGES, false);
    }

    public boolean isPreEnumerateTheories() {
        return getBoolean(PRE_ENUMERATE_THEORIES, true);
    }

    public MethodDisplay getMethodDisplay() {
        Object value = getValue(METHOD_DISPLAY);
        if (value == null) {
            return MethodDisplay.CLASS_AND_METHOD;
        }
        try {
            return MethodDisplay.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid " + METHOD_DISPLAY + ": " + value, e);
        }
    }

}
