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

import com.sun.net.httpserver.HttpServer;
import io.testrelay.common.Json;
import io.testrelay.http.DefaultHttpClientFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AppVeyorClientTest {

    record Received(String method, String path, String body) {
    }

    HttpServer server;
    String baseUri;
    final List<Received> received = new ArrayList<>();
    volatile int status = 204;
    RecordingRunnerLogger logger;

    @BeforeEach
    void beforeEach() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body;
            try (InputStream in = exchange.getRequestBody()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            synchronized (received) {
                received.add(new Received(exchange.getRequestMethod(), exchange.getRequestURI().getPath(), body));
            }
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
        baseUri = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        logger = new RecordingRunnerLogger();
    }

    @AfterEach
    void afterEach() {
        server.stop(0);
    }

    List<Received> received() {
        synchronized (received) {
            return new ArrayList<>(received);
        }
    }

    AppVeyorClient client(long flushIntervalMillis) {
        return new AppVeyorClient(logger, baseUri, new DefaultHttpClientFactory(), flushIntervalMillis);
    }

    static CiTestRecord passed(String name) {
        return new CiTestRecord(name, "testrelay", "demo.jar", TestOutcome.Passed, 12L, null, null, "out");
    }

    @Test
    void testCloseFlushesAddsBeforeUpdates() throws Exception {
        AppVeyorClient client = client(60000);
        client.updateTest(passed("one"));
        client.addTest(CiTestRecord.running("one", "testrelay", "demo.jar"));
        client.addTest(CiTestRecord.running("two", "testrelay", "demo.jar"));
        client.close();
        List<Received> requests = received();
        assertEquals(2, requests.size());
        assertEquals("POST", requests.get(0).method());
        assertEquals("/api/tests/batch", requests.get(0).path());
        assertEquals("PUT", requests.get(1).method());
        assertEquals("/api/tests/batch", requests.get(1).path());

        List<Map<String, Object>> adds = Json.of(requests.get(0).body()).get("$");
        assertEquals(2, adds.size());
        assertEquals("one", adds.get(0).get("testName"));
        assertEquals("Running", adds.get(0).get("outcome"));
        assertEquals("two", adds.get(1).get("testName"));

        List<Map<String, Object>> updates = Json.of(requests.get(1).body()).get("$");
        Map<String, Object> update = updates.get(0);
        assertEquals("Passed", update.get("outcome"));
        assertEquals("testrelay", update.get("testFramework"));
        assertEquals("demo.jar", update.get("fileName"));
        assertEquals(12, ((Number) update.get("durationMilliseconds")).intValue());
        assertEquals("out", update.get("StdOut"));
        assertTrue(update.containsKey("ErrorMessage"));
        assertNull(update.get("ErrorMessage"));
        assertFalse(client.hasPreviousErrors());
        assertEquals(2, client.getRequestCount());
    }

    @Test
    void testPeriodicFlush() throws Exception {
        AppVeyorClient client = client(20);
        client.addTest(CiTestRecord.running("one", "testrelay", "demo.jar"));
        long deadline = System.currentTimeMillis() + 5000;
        while (received().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, received().size());
        client.close();
        assertEquals(1, received().size());
    }

    @Test
    void testNothingQueuedSendsNothing() throws Exception {
        AppVeyorClient client = client(10);
        Thread.sleep(50);
        client.close();
        assertTrue(received().isEmpty());
    }

    @Test
    void testStopsAfterFirstError() throws Exception {
        status = 500;
        AppVeyorClient client = client(60000);
        client.addTest(CiTestRecord.running("one", "testrelay", "demo.jar"));
        client.updateTest(passed("one"));
        client.close();
        assertEquals(1, received().size());
        assertTrue(client.hasPreviousErrors());
        assertEquals(1, logger.getLines().size());
        assertTrue(logger.anyStartsWith("[err] AppVeyor API returned status 500"));
    }

    @Test
    void testConnectionFailureIsLoggedNotThrown() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        AppVeyorClient client = new AppVeyorClient(logger, "http://127.0.0.1:" + closedPort,
                new DefaultHttpClientFactory(), 60000);
        client.addTest(CiTestRecord.running("one", "testrelay", "demo.jar"));
        client.close();
        assertTrue(client.hasPreviousErrors());
        assertTrue(logger.anyStartsWith("[err] Error communicating with AppVeyor API"));
    }

    @Test
    void testRecordsAfterCloseDropped() throws Exception {
        AppVeyorClient client = client(60000);
        client.close();
        client.addTest(CiTestRecord.running("late", "testrelay", "demo.jar"));
        client.close();
        assertTrue(received().isEmpty());
    }

    @Test
    void testArguments() {
        assertThrows(IllegalArgumentException.class, () -> new AppVeyorClient(null, baseUri));
        assertThrows(IllegalArgumentException.class, () -> new AppVeyorClient(logger, null));
        assertThrows(IllegalArgumentException.class,
                () -> new AppVeyorClient(logger, baseUri, new DefaultHttpClientFactory(), 0));
    }

}
