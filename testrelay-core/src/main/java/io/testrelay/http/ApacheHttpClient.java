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
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.DefaultHttpRequestRetryStrategy;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.HttpMessage;
import org.apache.hc.core5.http.io.SocketConfig;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.support.ClassicRequestBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.slf4j.Logger;

import java.io.IOException;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link HttpClient} on Apache HttpClient 5. The underlying client is built on first use and
 * rebuilt after any {@link #config} change.
 * <p>
 * Keys: {@code readTimeout} and {@code connectTimeout} in milliseconds, {@code proxy} as a
 * {@code host:port} or {@code http://host:port} string, {@code retry} as
 * {@code {"count": 3, "interval": 1000}}. Retries are off unless a positive count is given.
 */
public class ApacheHttpClient implements HttpClient {

    private static final Logger LOGGER = LogContext.HTTP_LOGGER;

    public static final String READ_TIMEOUT = "readTimeout";
    public static final String CONNECT_TIMEOUT = "connectTimeout";
    public static final String PROXY = "proxy";
    public static final String RETRY = "retry";

    private CloseableHttpClient httpClient;

    private int readTimeout = 30000;
    private int connectTimeout = 30000;
    private HttpHost proxy;
    private int retryCount;
    private int retryInterval = 1000;

    private final HttpLogger logger = new HttpLogger();

    @Override
    public void config(String key, Object value) {
        switch (key) {
            case READ_TIMEOUT:
                readTimeout = nonNegative(key, value, readTimeout);
                break;
            case CONNECT_TIMEOUT:
                connectTimeout = nonNegative(key, value, connectTimeout);
                break;
            case PROXY:
                proxy = toProxy(value);
                break;
            case RETRY:
                if (value == null) {
                    retryCount = 0;
                } else if (value instanceof Map<?, ?> map) {
                    retryCount = nonNegative("retry.count", map.get("count"), retryCount);
                    retryInterval = nonNegative("retry.interval", map.get("interval"), retryInterval);
                } else {
                    throw new IllegalArgumentException("object expected for: " + key);
                }
                break;
            default:
                throw new IllegalArgumentException("unknown http option: " + key);
        }
        LOGGER.debug("http option set: {} = {}", key, value);
        closeQuietly(); // rebuilt lazily
    }

    private static int nonNegative(String key, Object value, int current) {
        if (value == null) {
            return current;
        }
        if (!(value instanceof Number n) || n.intValue() < 0) {
            throw new IllegalArgumentException("non-negative number expected for: " + key);
        }
        return n.intValue();
    }

    private static HttpHost toProxy(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof String uri) || uri.isBlank()) {
            throw new IllegalArgumentException("string expected for: " + PROXY);
        }
        try {
            return HttpHost.create(uri.trim());
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid proxy: " + uri, e);
        }
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public HttpHost getProxy() {
        return proxy;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public int getRetryInterval() {
        return retryInterval;
    }

    private void initHttpClient() {
        HttpClientBuilder clientBuilder = HttpClientBuilder.create().useSystemProperties();
        if (retryCount > 0) {
            clientBuilder.setRetryStrategy(new DefaultHttpRequestRetryStrategy(
                    retryCount, TimeValue.ofMilliseconds(retryInterval)));
        } else {
            clientBuilder.disableAutomaticRetries();
        }
        if (proxy != null) {
            clientBuilder.setProxy(proxy);
        }
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(connectTimeout, TimeUnit.MILLISECONDS)
                .setSocketTimeout(readTimeout, TimeUnit.MILLISECONDS)
                .build();
        clientBuilder.setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(connectionConfig)
                .setDefaultSocketConfig(SocketConfig.custom().setSoTimeout(readTimeout, TimeUnit.MILLISECONDS).build())
                .build());
        httpClient = clientBuilder.build();
        LOGGER.debug("http client created, proxy: {}, retries: {}", proxy, retryCount);
    }

    @Override
    public HttpResponse invoke(HttpRequest request) {
        try {
            ClassicRequestBuilder requestBuilder = ClassicRequestBuilder.create(request.getMethod()).setUri(request.getUrl());
            if (request.getBody() != null) {
                ContentType contentType = ContentType.APPLICATION_OCTET_STREAM;
                String contentTypeHeader = request.getContentType();
                if (contentTypeHeader != null) {
                    try {
                        contentType = ContentType.parse(contentTypeHeader);
                    } catch (Exception e) {
                        LOGGER.debug("could not parse content-type: {}", contentTypeHeader);
                    }
                }
                requestBuilder.setEntity(new ByteArrayEntity(request.getBody(), contentType));
            }
            request.getHeaders().forEach((k, vals) -> {
                if (!Http.CONTENT_TYPE.equalsIgnoreCase(k)) {
                    vals.forEach(v -> requestBuilder.addHeader(k, v));
                }
            });
            if (httpClient == null) {
                initHttpClient();
            }
            logger.logRequest(request);
            long startTime = System.currentTimeMillis();
            HttpResponse response = httpClient.execute(requestBuilder.build(), r -> buildResponse(r, startTime));
            response.setRequest(request);
            logger.logResponse(response);
            return response;
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }

    static HttpResponse buildResponse(ClassicHttpResponse httpResponse, long startTime) throws IOException {
        long endTime = System.currentTimeMillis();
        HttpResponse response = new HttpResponse();
        response.setStartTime(startTime);
        response.setResponseTime(endTime - startTime);
        response.setStatus(httpResponse.getCode());
        response.setHeaders(toHeaders(httpResponse));
        HttpEntity entity = httpResponse.getEntity();
        if (entity != null) {
            response.setBody(EntityUtils.toByteArray(entity));
        }
        return response;
    }

    private static Map<String, List<String>> toHeaders(HttpMessage msg) {
        Header[] headers = msg.getHeaders();
        Map<String, List<String>> map = new LinkedHashMap<>(headers.length);
        for (Header header : headers) {
            map.computeIfAbsent(header.getName(), k -> new ArrayList<>()).add(header.getValue());
        }
        return map;
    }

    private void closeQuietly() {
        try {
            close();
        } catch (IOException e) {
            LOGGER.warn("failed to close http client: {}", e.getMessage());
        }
    }

    @Override
    public void close() throws IOException {
        if (httpClient != null) {
            try {
                httpClient.close();
                LOGGER.debug("http client closed");
            } finally {
                httpClient = null;
            }
        }
    }

}
