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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class HttpRequest {

    private String method = "GET";
    private String url;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private byte[] body;

    public static HttpRequest of(String method, String url) {
        HttpRequest request = new HttpRequest();
        request.setMethod(method);
        request.setUrl(url);
        return request;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        this.method = method.toUpperCase();
    }

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        if (url == null) {
            throw new IllegalArgumentException("url must not be null");
        }
        this.url = url;
    }

    public Map<String, List<String>> getHeaders() {
        return headers;
    }

    public String getHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                List<String> values = entry.getValue();
                return values.isEmpty() ? null : values.get(0);
            }
        }
        return null;
    }

    public HttpRequest putHeader(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public String getContentType() {
        return getHeader(Http.CONTENT_TYPE);
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyString() {
        return body == null ? null : new String(body, StandardCharsets.UTF_8);
    }

    public HttpRequest setBody(byte[] body) {
        this.body = body;
        return this;
    }

    public HttpRequest setBodyJson(String json) {
        this.body = json == null ? null : json.getBytes(StandardCharsets.UTF_8);
        if (getContentType() == null) {
            putHeader(Http.CONTENT_TYPE, Http.APPLICATION_JSON);
        }
        return this;
    }

    @Override
    public String toString() {
        return method + " " + url;
    }

}
