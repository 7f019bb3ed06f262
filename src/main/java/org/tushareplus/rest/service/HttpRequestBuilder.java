package org.tushareplus.rest.service;

import com.google.common.base.Joiner;
import net.minidev.json.JSONObject;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.io.entity.StringEntity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds the HTTP POST request for one API call.
 *
 * <p>Responsibilities:</p>
 * <ul>
 *   <li>Serialize the call envelope as JSON</li>
 *   <li>Join requested fields into the comma separated form the server expects</li>
 *   <li>Configure connection and response timeouts</li>
 * </ul>
 *
 * <p><b>Request body:</b></p>
 * <pre>
 * {
 *   "api_name": "daily",
 *   "token": "...",
 *   "params": {"ts_code": "000001.SZ", "offset": 0, "limit": 6000},
 *   "fields": "ts_code,trade_date,close"
 * }
 * </pre>
 */
public class HttpRequestBuilder {

    private static final Joiner FIELD_JOINER = Joiner.on(',').skipNulls();

    private final String url;
    private final int connectionTimeoutSeconds;
    private final int responseTimeoutSeconds;

    public HttpRequestBuilder(String url, int connectionTimeoutSeconds, int responseTimeoutSeconds) {
        this.url = url;
        this.connectionTimeoutSeconds = connectionTimeoutSeconds;
        this.responseTimeoutSeconds = responseTimeoutSeconds;
    }

    /**
     * Builds a POST request carrying the call envelope.
     *
     * @param endpoint API name
     * @param token Credential token
     * @param params Request parameters
     * @param fields Requested fields, may be empty
     * @return Fully configured HTTP request
     */
    public HttpPost buildRequest(String endpoint, String token, Map<String, Object> params, List<String> fields) {
        HttpPost request = new HttpPost(url);
        request.setEntity(new StringEntity(buildBody(endpoint, token, params, fields), ContentType.APPLICATION_JSON));
        request.setHeader("Accept", ContentType.APPLICATION_JSON.getMimeType());

        request.setConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(connectionTimeoutSeconds, TimeUnit.SECONDS)
                .setConnectTimeout(connectionTimeoutSeconds, TimeUnit.SECONDS)
                .setResponseTimeout(responseTimeoutSeconds, TimeUnit.SECONDS)
                .build());
        return request;
    }

    String buildBody(String endpoint, String token, Map<String, Object> params, List<String> fields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("api_name", endpoint);
        payload.put("token", token);
        payload.put("params", params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params));
        payload.put("fields", fields == null ? "" : FIELD_JOINER.join(fields));
        return JSONObject.toJSONString(payload);
    }
}
