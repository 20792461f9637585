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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        RelayConfig config = RelayConfig.defaults();
        assertNull(config.getReporter());
        assertNull(config.getAppveyorApiUrl());
        assertFalse(config.isJsonLines());
        assertEquals(1000, config.getFlushIntervalMillis());
        assertEquals(Path.of("target/testrelay-reports"), config.getOutputDir());
        assertTrue(config.toDiscoveryOptions().isPreEnumerateTheories());
        assertFalse(config.toExecutionOptions().isStopOnFail());
        assertTrue(config.getHttpOptions().isEmpty());
    }

    @Test
    void testFromJson() {
        RelayConfig config = RelayConfig.fromJson("""
                {
                  "reporter": "appveyor",
                  "appveyorApiUrl": "http://localhost:9000/",
                  "logLevel": "debug",
                  "outputDir": "build/reports",
                  "jsonLines": true,
                  "flushIntervalMillis": 250,
                  "discovery": { "preEnumerateTheories": false, "methodDisplay": "method" },
                  "execution": { "maxParallelThreads": 4, "stopOnFail": true },
                  "http": { "proxy": "proxy.local:3128", "retry": { "count": 2, "interval": 500 } }
                }
                """);
        assertEquals("appveyor", config.getReporter());
        assertEquals("http://localhost:9000/", config.getAppveyorApiUrl());
        assertEquals("debug", config.getLogLevel());
        assertEquals(Path.of("build/reports"), config.getOutputDir());
        assertTrue(config.isJsonLines());
        assertEquals(250, config.getFlushIntervalMillis());
        DiscoveryOptions discovery = config.toDiscoveryOptions();
        assertFalse(discovery.isPreEnumerateTheories());
        assertEquals(DiscoveryOptions.MethodDisplay.METHOD, discovery.getMethodDisplay());
        ExecutionOptions execution = config.toExecutionOptions();
        assertEquals(4, execution.getMaxParallelThreads());
        assertTrue(execution.isStopOnFail());
        Map<String, Object> http = config.getHttpOptions();
        assertEquals("proxy.local:3128", http.get("proxy"));
        assertEquals(Map.of("count", 2, "interval", 500), http.get("retry"));
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromJson("{ \"jsonLines\": \"yes\" }"));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromJson("{ \"execution\": 5 }"));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromJson("{ \"http\": \"proxy\" }"));
        assertThrows(IllegalArgumentException.class, () -> RelayConfig.fromJson("[1, 2]"));
    }

    @Test
    void testLoadWithEnvironmentOverrides() throws Exception {
        Path file = tempDir.resolve(RelayConfig.DEFAULT_FILENAME);
        Files.writeString(file, "{ \"reporter\": \"default\", \"appveyorApiUrl\": \"http://file\" }");
        Map<String, String> env = Map.of(
                RelayConfig.ENV_REPORTER, "appveyor",
                RelayConfig.ENV_APPVEYOR_API_URL, " http://env/ ");
        RelayConfig config = RelayConfig.load(file, env::get);
        assertEquals("appveyor", config.getReporter());
        assertEquals("http://env/", config.getAppveyorApiUrl());
    }

    @Test
    void testLoadMissingFileUsesEnvironmentOnly() {
        RelayConfig config = RelayConfig.load(tempDir.resolve("missing.json"),
                name -> RelayConfig.ENV_LOG_LEVEL.equals(name) ? "trace" : null);
        assertEquals("trace", config.getLogLevel());
        assertNull(config.getReporter());
    }

    @Test
    void testBuilder() {
        RelayConfig config = RelayConfig.defaults()
                .reporter("appveyor")
                .appveyorApiUrl("http://ci")
                .jsonLines(true)
                .flushIntervalMillis(10)
                .httpOption("readTimeout", 5000)
                .outputDir(tempDir);
        assertEquals("appveyor", config.getReporter());
        assertEquals("http://ci", config.getAppveyorApiUrl());
        assertTrue(config.isJsonLines());
        assertEquals(10, config.getFlushIntervalMillis());
        assertEquals(Map.of("readTimeout", 5000), config.getHttpOptions());
        assertEquals(tempDir, config.getOutputDir());
        assertFalse(config.applyLogLevel());
    }

}
