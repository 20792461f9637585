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

import io.testrelay.core.RelayConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Chooses the reporter for a run.
 */
public final class RunnerReporters {

    private RunnerReporters() {
    }

    /**
     * The built-in reporters. The AppVeyor reporter sees the API URL from the config when the
     * config names one, otherwise the environment's. It uses the config's HTTP options.
     */
    public static List<RunnerReporter> defaults(RelayConfig config, Function<String, String> env) {
        Function<String, String> lookup = name -> {
            if (AppVeyorReporter.ENV_API_URL.equals(name) && config.getAppveyorApiUrl() != null) {
                return config.getAppveyorApiUrl();
            }
            return env.apply(name);
        };
        List<RunnerReporter> list = new ArrayList<>();
        list.add(new AppVeyorReporter(lookup, config.getFlushIntervalMillis(), config.getHttpOptions()));
        list.add(new DefaultRunnerReporter());
        return list;
    }

    /**
     * Picks, in order: the reporter whose switch matches the configured one (case-insensitive),
     * the first environmentally enabled reporter, the default reporter.
     *
     * @throws IllegalArgumentException if the configured switch matches no reporter
     */
    public static RunnerReporter select(RelayConfig config, List<RunnerReporter> reporters) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (reporters == null) {
            throw new IllegalArgumentException("reporters must not be null");
        }
        String requested = config.getReporter();
        if (requested != null && !requested.isBlank()) {
            for (RunnerReporter reporter : reporters) {
                if (requested.trim().equalsIgnoreCase(reporter.getRunnerSwitch())) {
                    LogContext.REPORT_LOGGER.debug("reporter selected by switch: {}", requested);
                    return reporter;
                }
            }
            throw new IllegalArgumentException("unknown reporter: " + requested);
        }
        for (RunnerReporter reporter : reporters) {
            if (reporter.isEnvironmentallyEnabled()) {
                LogContext.REPORT_LOGGER.debug("reporter enabled by environment: {}", reporter.getDescription());
                return reporter;
            }
        }
        return new DefaultRunnerReporter();
    }

    public static RunnerReporter select(RelayConfig config, Function<String, String> env) {
        return select(config, defaults(config, env));
    }

}
