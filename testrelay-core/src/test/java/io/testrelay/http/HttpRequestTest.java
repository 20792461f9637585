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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HttpRequestTest {

    @Test
    void testHeadersAreCaseInsensitiveOnRead() {
        HttpRequest request = HttpRequest.of("put", "http://localhost/api")
                .putHeader("X-Trace", "abc");
        assertEquals("PUT", request.getMethod());
        assertEquals("abc", request.getHeader("x-trace"));
        assertNull(request.getHeader("missing"));
    }

    @Test
    void testJsonBodySetsContentType() {
        HttpRequest request = HttpRequest.of("POST", "http://localhost/api").setBodyJson("[1]");
        assertEquals(Http.APPLICATION_JSON, request.getContentType());
        assertEquals("[1]", request.getBodyString());
        HttpRequest custom = HttpRequest.of("POST", "http://localhost/api")
                .putHeader(Http.CONTENT_TYPE, "application/vnd.custom+json")
                .setBodyJson("{}");
        assertEquals("application/vnd.custom+json", custom.getContentType());
    }

    @Test
    void testTrimTrailingSlashes() {
        assertEquals("http://host", Http.trimTrailingSlashes("http://host//"));
        assertEquals("http://host", Http.trimTrailingSlashes("http://host"));
        assertNull(Http.trimTrailingSlashes(null));
    }

    @Test
    void testRequiredFields() {
        assertThrows(IllegalArgumentException.class, () -> HttpRequest.of(null, "http://host"));
        assertThrows(IllegalArgumentException.class, () -> HttpRequest.of("GET", null));
    }

}
