package org.tushareplus.rest.parser;

import com.jayway.jsonpath.Configuration;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.Option;
import org.tushareplus.model.PageResult;
import org.tushareplus.model.TransportResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the JSON response envelope of the data service.
 *
 * <p><b>JSON format example:</b></p>
 * <pre>
 * {
 *   "code": 0,
 *   "msg": "",
 *   "data": {
 *     "fields": ["ts_code", "trade_date", "close"],
 *     "items": [["000001.SZ", "20240102", 9.39],
 *               ["000001.SZ", "20240103", 9.20]],
 *     "has_more": true
 *   }
 * }
 * </pre>
 *
 * <p>{@code has_more} is optional; when it is missing the page's continuation flag is left null.
 * On failure {@code data} is usually null and only {@code code}/{@code msg} are meaningful.</p>
 */
public class JsonResponseParser {

    private static final Configuration LENIENT = Configuration.defaultConfiguration()
            .addOptions(Option.DEFAULT_PATH_LEAF_TO_NULL, Option.SUPPRESS_EXCEPTIONS);

    /**
     * Parses a raw response body.
     *
     * @param httpResponse raw HTTP response body
     * @return decoded envelope
     * @throws ParseException if the body is not a JSON object or lacks a status code
     */
    public TransportResponse parse(String httpResponse) throws ParseException {
        if (httpResponse == null || httpResponse.isBlank()) {
            throw new ParseException("Empty response body");
        }
        Object root;
        try {
            root = JsonPath.parse(httpResponse).json();
        } catch (Exception e) {
            throw new ParseException("Failed to parse JSON response", e);
        }
        if (!(root instanceof Map)) {
            throw new ParseException("Response is not a JSON object");
        }

        DocumentContext document = JsonPath.using(LENIENT).parse(root);
        Object code = document.read("$.code");
        if (!(code instanceof Number)) {
            throw new ParseException("Response carries no numeric status code");
        }
        Object message = document.read("$.msg");
        String msg = message == null ? "" : message.toString();

        int status = ((Number) code).intValue();
        Object data = document.read("$.data");
        if (!(data instanceof Map)) {
            if (status == 0) {
                throw new ParseException("Successful response carries no data object");
            }
            return TransportResponse.failure(status, msg);
        }
        return new TransportResponse(status, msg, parseData(document));
    }

    private PageResult parseData(DocumentContext document) throws ParseException {
        List<String> fieldNames = new ArrayList<>();
        Object fields = document.read("$.data.fields");
        if (fields instanceof List) {
            for (Object field : (List<?>) fields) {
                fieldNames.add(String.valueOf(field));
            }
        }

        List<List<Object>> rows = new ArrayList<>();
        Object items = document.read("$.data.items");
        if (items instanceof List) {
            for (Object item : (List<?>) items) {
                if (!(item instanceof List)) {
                    throw new ParseException("Row is not a JSON array: " + item);
                }
                rows.add(new ArrayList<>((List<?>) item));
            }
        }

        Object hasMore = document.read("$.data.has_more");
        Boolean flag = hasMore instanceof Boolean ? (Boolean) hasMore : null;
        return new PageResult(fieldNames, rows, flag);
    }

    /**
     * Exception thrown when response parsing fails.
     */
    public static class ParseException extends Exception {
        public ParseException(String message) {
            super(message);
        }

        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
