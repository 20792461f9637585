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

import io.testrelay.output.LogContext;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;

public class HttpLogger {

    private static final Logger logger = LogContext.HTTP_LOGGER;

    private int requestCount;

    public static void logHeaders(StringBuilder sb, int num, String prefix, Map<String, List<String>> headers) {
        if (headers == null || headers.isEmpty()) {
            return;
        }
        headers.forEach((k, v) -> {
            for (String value : v) {
                sb.append(num).append(prefix).append(k).append(": ");
                sb.append(value);
                sb.append('\n');
            }
        });
    }

    public synchronized void logRequest(HttpRequest request) {
        requestCount++;
        if (!logger.isDebugEnabled()) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("request:\n").append(requestCount).append(" > ")
                .append(request.getMethod()).append(' ').append(request.getUrl()).append('\n');
        logHeaders(sb, requestCount, " > ", request.getHeaders());
        String body = request.getBodyString();
        if (body != null) {
            sb.append(body).append('\n');
        }
        logger.debug(sb.toString());
    }

    public synchronized void logResponse(HttpResponse response) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        HttpRequest request = response.getRequest();
        StringBuilder sb = new StringBuilder();
        sb.append("response time in milliseconds: ").append(response.getResponseTime()).append('\n');
        sb.append(requestCount).append(" < ").append(response.getStatus());
        if (request != null) {
            sb.append(' ').append(request.getMethod()).append(' ').append(request.getUrl());
        }
        sb.append('\n');
        logHeaders(sb, requestCount, " < ", response.getHeaders());
        String body = response.getBodyString();
        if (body != null && !body.isEmpty()) {
            sb.append(body).append('\n');
        }
        logger.debug(sb.toString());
    }

}
