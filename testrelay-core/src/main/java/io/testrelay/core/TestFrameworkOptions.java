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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * String keyed option values shared between a runner and a test framework. Unknown keys are
 * kept, so frameworks can read options the runner does not know about.
 */
public class TestFrameworkOptions {

    private final Map<String, Object> values = new LinkedHashMap<>();

    protected TestFrameworkOptions() {
    }

    protected TestFrameworkOptions(Map<String, Object> values) {
        if (values != null) {
            this.values.putAll(values);
        }
    }

    @SuppressWarnings("unchecked")
    public synchronized <T> T getValue(String key) {
        return (T) values.get(key);
    }

    public synchronized void setValue(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key must not be null");
        }
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    protected boolean getBoolean(String key, boolean defaultValue) {
        Object value = getValue(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s.trim());
        }
        return defaultValue;
    }

    protected int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("number expected for: " + key + ", got: " + s, e);
            }
        }
        return defaultValue;
    }

    public synchronized Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + toMap();
    }

}
