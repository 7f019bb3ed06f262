package org.tushareplus.model;

import lombok.Data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable descriptor of one page request: endpoint, request parameters (including {@code offset}
 * and {@code limit} when paginating) and the requested fields.
 */
@Data
public class Page {

    public static final String OFFSET = "offset";
    public static final String LIMIT = "limit";

    private final String endpoint;
    private final Map<String, Object> params;
    private final List<String> fields;

    public Page(String endpoint, Map<String, Object> params, List<String> fields) {
        this.endpoint = endpoint;
        this.params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.fields = fields == null ? Collections.emptyList() : List.copyOf(fields);
    }

    /**
     * Creates a page from a base parameter set with {@code offset} and {@code limit} overridden.
     */
    public static Page slice(String endpoint, Map<String, Object> baseParams, List<String> fields, int offset, int limit) {
        Map<String, Object> params = new LinkedHashMap<>(baseParams);
        params.put(OFFSET, offset);
        params.put(LIMIT, limit);
        return new Page(endpoint, params, fields);
    }

    public int getOffset() {
        Object value = params.get(OFFSET);
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    /**
     * @return the requested limit, or 0 when the page carries none
     */
    public int getLimit() {
        Object value = params.get(LIMIT);
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }
}
