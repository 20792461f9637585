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

import io.testrelay.common.Json;
import io.testrelay.core.Message;
import io.testrelay.core.MessageSink;
import org.slf4j.Logger;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A {@link MessageSink} that streams every message to a JSON Lines (.jsonl) file.
 * <p>
 * One envelope per line:
 * <pre>
 * {"type":"ASSEMBLY_STARTING","timeStamp":1703500000010,"threadId":"testrelay-worker-1","data":{...}}
 * {"type":"TEST_PASSED","timeStamp":1703500000020,"threadId":"testrelay-worker-1","data":{...}}
 * </pre>
 * Each line is flushed as it is written, so the file can be tailed while tests run.
 */
public class JsonLinesMessageWriter implements MessageSink, Closeable {

    private static final Logger logger = LogContext.REPORT_LOGGER;

    public static final String DEFAULT_FILENAME = "testrelay-messages.jsonl";

    private final Path jsonlPath;
    private BufferedWriter writer;
    private volatile boolean closed = false;

    public JsonLinesMessageWriter(Path outputDir) {
        if (outputDir == null) {
            throw new IllegalArgumentException("outputDir must not be null");
        }
        this.jsonlPath = outputDir.resolve(DEFAULT_FILENAME);
    }

    /**
     * Creates the file, replacing any previous one. Must be called before messages arrive.
     */
    public void init() throws IOException {
        Path parent = jsonlPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer = Files.newBufferedWriter(jsonlPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
        logger.debug("JSONL message stream started: {}", jsonlPath);
    }

    @Override
    public boolean onMessage(Message message) {
        if (closed || writer == null) {
            return true;
        }
        try {
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("type", message.getType().name());
            envelope.put("timeStamp", System.currentTimeMillis());
            envelope.put("threadId", getThreadId());
            envelope.put("data", message.toJson());
            writeLine(Json.stringifyStrict(envelope));
        } catch (Exception e) {
            logger.warn("Failed to write message to JSONL: {}", e.getMessage());
        }
        return true; // never stops the run
    }

    private static String getThreadId() {
        Thread thread = Thread.currentThread();
        String name = thread.getName();
        if (name == null || name.isEmpty() || "main".equals(name)) {
            return "thread-" + thread.getId();
        }
        return name;
    }

    private synchronized void writeLine(String json) throws IOException {
        if (writer != null && !closed) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    @Override
    public synchronized void close() throws IOException {
        closed = true;
        if (writer != null) {
            try {
                writer.close();
            } finally {
                writer = null;
            }
            logger.info("JSONL message stream written to: {}", jsonlPath);
        }
    }

    public Path getJsonlPath() {
        return jsonlPath;
    }

}
