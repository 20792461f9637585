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

import io.testrelay.core.MessageSink;
import io.testrelay.http.DefaultHttpClientFactory;

import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

/**
 * Reports to AppVeyor when running inside an AppVeyor build, detected through the
 * {@code APPVEYOR_API_URL} variable the build worker sets.
 */
public class AppVeyorReporter implements RunnerReporter {

    public static final String ENV_API_URL = "APPVEYOR_API_URL";

    private final Function<String, String> env;
    private final long flushIntervalMillis;
    private final Map<String, Object> httpOptions;

    public AppVeyorReporter() {
        this(System::getenv);
    }

    public AppVeyorReporter(Function<String, String> env) {
        this(env, AppVeyorClient.DEFAULT_FLUSH_INTERVAL_MILLIS);
    }

    public AppVeyorReporter(Function<String, String> env, long flushIntervalMillis) {
        this(env, flushIntervalMillis, Collections.emptyMap());
    }

    public AppVeyorReporter(Function<String, String> env, long flushIntervalMillis, Map<String, Object> httpOptions) {
        if (env == null) {
            throw new IllegalArgumentException("env must not be null");
        }
        this.env = env;
        this.flushIntervalMillis = flushIntervalMillis;
        this.httpOptions = httpOptions == null ? Collections.emptyMap() : httpOptions;
    }

    public Map<String, Object> getHttpOptions() {
        return httpOptions;
    }

    @Override
    public String getDescription() {
        return "forces AppVeyor CI mode (normally auto-detected)";
    }

    @Override
    public boolean isEnvironmentallyEnabled() {
        String url = env.apply(ENV_API_URL);
        return url != null && !url.isBlank();
    }

    @Override
    public String getRunnerSwitch() {
        return "appveyor";
    }

    /**
     * @throws IllegalStateException if the API URL is not set
     */
    @Override
    public MessageSink createMessageHandler(RunnerLogger logger) {
        String baseUri = env.apply(ENV_API_URL);
        if (baseUri == null || baseUri.isBlank()) {
            throw new IllegalStateException(ENV_API_URL + " is not set, cannot report to AppVeyor");
        }
        return new AppVeyorReporterMessageHandler(logger, baseUri.trim(),
                uri -> new AppVeyorClient(logger, uri, new DefaultHttpClientFactory(httpOptions), flushIntervalMillis));
    }

}
