package org.tushareplus.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Executes HTTP requests and returns response bodies.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Execute HTTP requests</li>
 *   <li>Log request/response details for debugging</li>
 *   <li>Validate response status codes</li>
 *   <li>Extract response body as string</li>
 * </ul>
 *
 * <p><b>Success criteria:</b> HTTP status codes 200-299</p>
 *
 * <p><b>Note:</b> One pooled HttpClient is shared by all worker threads of a client;
 * {@link #close()} releases its connections.</p>
 */
public class HttpRequestExecutor implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpRequestExecutor.class);

    private final CloseableHttpClient httpClient;

    public HttpRequestExecutor() {
        this(HttpClientBuilder.create().useSystemProperties().build());
    }

    public HttpRequestExecutor(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    /**
     * Executes an HTTP request and returns the response body as string.
     *
     * @param request Configured HTTP request to execute
     * @return Response body as UTF-8 string
     * @throws IOException If request execution fails or response is unsuccessful
     */
    public String executeRequest(HttpUriRequestBase request) throws IOException {
        if (logger.isDebugEnabled()) {
            logRequest(request);
        }

        return httpClient.execute(request, response -> {
            int statusCode = response.getCode();

            if (logger.isDebugEnabled()) {
                logResponse(response, statusCode);
            }

            if (!isSuccessfulResponse(statusCode)) {
                throw new IOException("Request Failed, status code (" + statusCode + ")");
            }

            HttpEntity entity = response.getEntity();
            if (entity == null) {
                throw new IOException("Empty response entity");
            }

            try (InputStream is = entity.getContent()) {
                String responseBody = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                if (logger.isDebugEnabled()) {
                    logger.debug("Response Body:");
                    logger.debug("{}", responseBody);
                }
                return responseBody;
            }
        });
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    /**
     * Checks if HTTP status code indicates success (200-299).
     */
    private boolean isSuccessfulResponse(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * Logs HTTP request details for debugging. The token travels in the body, so the body is logged
     * only at TRACE level.
     */
    private void logRequest(HttpUriRequestBase request) {
        logger.debug("=== HTTP REQUEST ===");
        logger.debug("Method: {}", request.getMethod());
        logger.debug("URI: {}", request.getRequestUri());

        HttpEntity entity = request.getEntity();
        if (entity != null && entity.isRepeatable() && logger.isTraceEnabled()) {
            try {
                logger.trace("Request Body: {}", EntityUtils.toString(entity, StandardCharsets.UTF_8));
            } catch (Exception e) {
                logger.warn("Could not log request body: {}", e.getMessage());
            }
        }
    }

    private void logResponse(HttpResponse response, int statusCode) {
        logger.debug("=== HTTP RESPONSE ===");
        logger.debug("Status Code: {}", statusCode);
        logger.debug("Response Headers:");
        for (var header : response.getHeaders()) {
            logger.debug("  {}: {}", header.getName(), header.getValue());
        }
    }
}
