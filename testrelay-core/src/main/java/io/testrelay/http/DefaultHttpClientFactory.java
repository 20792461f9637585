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
package io.testrelay.http;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates a new {@link ApacheHttpClient} for each call, with the given options applied through
 * {@link HttpClient#config}.
 */
public class DefaultHttpClientFactory implements HttpClientFactory {

    private final Map<String, Object> options;

    public DefaultHttpClientFactory() {
        this(Collections.emptyMap());
    }

    public DefaultHttpClientFactory(Map<String, Object> options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }

    public Map<String, Object> getOptions() {
        return options;
    }

    @Override
    public HttpClient create() {
        ApacheHttpClient client = new ApacheHttpClient();
        options.forEach(client::config);
        return client;
    }

}
