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

import io.testrelay.common.Json;
import io.testrelay.output.LogContext;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Runner settings, read from a {@code testrelay.json} file and overridden by environment variables.
 * <pre>
 * {
 *   "reporter": "appveyor",
 *   "appveyorApiUrl": "http://localhost:9000/",
 *   "logLevel": "debug",
 *   "outputDir": "target/testrelay-reports",
 *   "jsonLines": true,
 *   "flushIntervalMillis": 1000,
 *   "http": { "proxy": "proxy.local:3128", "readTimeout": 10000, "retry": { "count": 2, "interval": 500 } },
 *   "discovery": { "preEnumerateTheories": false },
 *   "execution": { "maxParallelThreads": 4, "stopOnFail": true }
 * }
 * </pre>
 * Environment variables: {@code TESTRELAY_REPORTER}, {@code APPVEYOR_API_URL},
 * {@code TESTRELAY_LOG_LEVEL}.
 */
public class RelayConfig {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String DEFAULT_FILENAME = "testrelay.json";

    public static final String ENV_REPORTER = "TESTRELAY_REPORTER";
    public static final String ENV_APPVEYOR_API_URL = "APPVEYOR_API_URL";
    public static final String ENV_LOG_LEVEL = "TESTRELAY_LOG_LEVEL";

    private String reporter;
    private String appveyorApiUrl;
    private String logLevel;
    private Path outputDir = Path.of("target/testrelay-reports");
    private boolean jsonLines;
    private int flushIntervalMillis = 1000;
    private Map<String, Object> discovery = Collections.emptyMap();
    private Map<String, Object> execution = Collections.emptyMap();
    private Map<String, Object> http = Collections.emptyMap();

    public static RelayConfig defaults() {
        return new RelayConfig();
    }

    /**
     * Reads the file if it exists, then applies the process environment.
     */
    public static RelayConfig load(Path file) {
        return load(file, System::getenv);
    }

    public static RelayConfig load(Path file, Function<String, String> env) {
        RelayConfig config = new RelayConfig();
        if (file != null && Files.isRegularFile(file)) {
            String text;
            try {
                text = Files.readString(file);
            } catch (IOException e) {
                throw new RuntimeException("failed to read config: " + file, e);
            }
            config.apply(Json.of(text));
            logger.debug("loaded config from {}", file);
        } else {
            logger.debug("config not found: {}", file);
        }
        config.applyEnv(env);
        return config;
    }

    public static RelayConfig fromJson(String json) {
        RelayConfig config = new RelayConfig();
        config.apply(Json.of(json));
        return config;
    }

    private void apply(Json json) {
        if (!json.isObject()) {
            throw new IllegalArgumentException("config must be a JSON object");
        }
        reporter = json.get("reporter", reporter);
        appveyorApiUrl = json.get("appveyorApiUrl", appveyorApiUrl);
        logLevel = json.get("logLevel", logLevel);
        String dir = json.get("outputDir", null);
        if (dir != null) {
            outputDir = Path.of(dir);
        }
        Object flag = json.get("jsonLines", null);
        if (flag != null) {
            if (!(flag instanceof Boolean b)) {
                throw new IllegalArgumentException("boolean expected for: jsonLines");
            }
            jsonLines = b;
        }
        Object interval = json.get("flushIntervalMillis", null);
        if (interval != null) {
            if (!(interval instanceof Number n)) {
                throw new IllegalArgumentException("number expected for: flushIntervalMillis");
            }
            flushIntervalMillis = n.intValue();
        }
        discovery = section(json, "discovery");
        execution = section(json, "execution");
        http = section(json, "http");
    }

    private static Map<String, Object> section(Json json, String name) {
        Object value = json.get(name, null);
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("object expected for: " + name);
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) value;
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private void applyEnv(Function<String, String> env) {
        String value = env.apply(ENV_REPORTER);
        if (value != null && !value.isBlank()) {
            reporter = value.trim();
        }
        value = env.apply(ENV_APPVEYOR_API_URL);
        if (value != null && !value.isBlank()) {
            appveyorApiUrl = value.trim();
        }
        value = env.apply(ENV_LOG_LEVEL);
        if (value != null && !value.isBlank()) {
            logLevel = value.trim();
        }
    }

    // ========== Builder ==========

    public RelayConfig reporter(String reporter) {
        this.reporter = reporter;
        return this;
    }

    public RelayConfig appveyorApiUrl(String appveyorApiUrl) {
        this.appveyorApiUrl = appveyorApiUrl;
        return this;
    }

    public RelayConfig logLevel(String logLevel) {
        this.logLevel = logLevel;
        return this;
    }

    public RelayConfig outputDir(Path outputDir) {
        this.outputDir = outputDir;
        return this;
    }

    public RelayConfig jsonLines(boolean jsonLines) {
        this.jsonLines = jsonLines;
        return this;
    }

    public RelayConfig flushIntervalMillis(int flushIntervalMillis) {
        this.flushIntervalMillis = flushIntervalMillis;
        return this;
    }

    public RelayConfig httpOption(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>(http);
        map.put(key, value);
        http = Collections.unmodifiableMap(map);
        return this;
    }

    // ========== Accessors ==========

    public String getReporter() {
        return reporter;
    }

    public String getAppveyorApiUrl() {
        return appveyorApiUrl;
    }

    public String getLogLevel() {
        return logLevel;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public boolean isJsonLines() {
        return jsonLines;
    }

    public int getFlushIntervalMillis() {
        return flushIntervalMillis;
    }

    /**
     * Transport options for outgoing HTTP calls, keyed as {@code ApacheHttpClient} expects them.
     */
    public Map<String, Object> getHttpOptions() {
        return http;
    }

    /**
     * Applies the configured log level to the {@code testrelay} loggers, if one is configured.
     *
     * @return true if the level was changed
     */
    public boolean applyLogLevel() {
        return logLevel != null && LogContext.setRuntimeLogLevel(logLevel);
    }

    public DiscoveryOptions toDiscoveryOptions() {
        return DiscoveryOptions.of(discovery);
    }

    public ExecutionOptions toExecutionOptions() {
        return ExecutionOptions.of(execution);
    }

}
