package org.tushareplus.rest.service;

import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.model.TransportResponse;
import org.tushareplus.rest.exception.TransportException;
import org.tushareplus.rest.interfaces.Transport;
import org.tushareplus.rest.parser.JsonResponseParser;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * {@link Transport} speaking JSON over HTTP POST to a single service URL.
 * <p>
 * Request construction, execution and response decoding are delegated to {@link HttpRequestBuilder},
 * {@link HttpRequestExecutor} and {@link JsonResponseParser}; any failure in one of them surfaces as a
 * {@link TransportException}.
 * </p>
 */
public class HttpTransport implements Transport, Closeable {

    private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);

    private final HttpRequestBuilder requestBuilder;
    private final HttpRequestExecutor requestExecutor;
    private final JsonResponseParser responseParser;

    public HttpTransport(String url, int connectionTimeoutSeconds, int responseTimeoutSeconds) {
        this(new HttpRequestBuilder(url, connectionTimeoutSeconds, responseTimeoutSeconds),
                new HttpRequestExecutor(),
                new JsonResponseParser());
    }

    public HttpTransport(HttpRequestBuilder requestBuilder, HttpRequestExecutor requestExecutor,
                         JsonResponseParser responseParser) {
        this.requestBuilder = requestBuilder;
        this.requestExecutor = requestExecutor;
        this.responseParser = responseParser;
    }

    @Override
    public TransportResponse send(String endpoint, String credential, Map<String, Object> params, List<String> fields) {
        HttpPost request = requestBuilder.buildRequest(endpoint, credential, params, fields);
        String body;
        try {
            body = requestExecutor.executeRequest(request);
        } catch (IOException e) {
            throw TransportException.buildTransportException(endpoint, e);
        }
        try {
            TransportResponse response = responseParser.parse(body);
            if (!response.isSuccess()) {
                logger.debug("{} answered {}", endpoint, response.describeError());
            }
            return response;
        } catch (JsonResponseParser.ParseException e) {
            logger.error("Failed to decode response of {}", endpoint, e);
            throw new TransportException(endpoint, "Failed to decode response: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        requestExecutor.close();
    }
}
