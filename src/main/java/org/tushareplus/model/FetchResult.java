package org.tushareplus.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of every page of one logical fetch, concatenated in merge order.
 * Field names come from the first non-empty page.
 */
@Data
public class FetchResult {

    private final List<String> fieldNames;
    private final List<List<Object>> rows;

    public FetchResult(List<String> fieldNames, List<List<Object>> rows) {
        this.fieldNames = fieldNames == null ? Collections.emptyList() : List.copyOf(fieldNames);
        this.rows = rows == null ? Collections.emptyList() : Collections.unmodifiableList(rows);
    }

    public static FetchResult of(PageResult page) {
        return new FetchResult(page.getFieldNames(), page.getRows());
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Returns every row as a field-name to value map, preserving field order.
     * Values beyond the known field names are dropped.
     */
    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < fieldNames.size(); i++) {
                record.put(fieldNames.get(i), i < row.size() ? row.get(i) : null);
            }
            records.add(record);
        }
        return records;
    }

    /**
     * Returns the values of a single column, or an empty list when the field is unknown.
     */
    public List<Object> column(String fieldName) {
        int index = fieldNames.indexOf(fieldName);
        if (index < 0) {
            return Collections.emptyList();
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(index < row.size() ? row.get(index) : null);
        }
        return values;
    }
}
