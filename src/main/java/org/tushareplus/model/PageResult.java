package org.tushareplus.model;

import lombok.Data;

import java.util.Collections;
import java.util.List;

/**
 * Decoded {@code data} payload of one page response.
 * <p>
 * {@code hasMore} is nullable: {@code FALSE} is authoritative (no further pages exist regardless of row count),
 * {@code null} means the server omitted the continuation flag and the caller has to infer it from the row count.
 * </p>
 */
@Data
public class PageResult {

    private final List<String> fieldNames;
    private final List<List<Object>> rows;
    private final Boolean hasMore;

    public PageResult(List<String> fieldNames, List<List<Object>> rows, Boolean hasMore) {
        this.fieldNames = fieldNames == null ? Collections.emptyList() : List.copyOf(fieldNames);
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
        this.hasMore = hasMore;
    }

    /**
     * Empty terminal page, used when a page offset lies beyond the end of the data.
     */
    public static PageResult exhausted(List<String> fieldNames) {
        return new PageResult(fieldNames, Collections.emptyList(), Boolean.FALSE);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean isExplicitlyLast() {
        return Boolean.FALSE.equals(hasMore);
    }

    /**
     * Whether another page should follow this one.
     *
     * @param requestedLimit the {@code limit} this page was requested with
     * @return the server's flag when present, otherwise whether the page came back full
     */
    public boolean hasMoreAfter(int requestedLimit) {
        if (hasMore != null) {
            return hasMore;
        }
        return !rows.isEmpty() && rows.size() >= requestedLimit;
    }
}
