package org.tushareplus.model;

import lombok.Data;

/**
 * Per-call options of {@code DataApiClient.fetch}.
 * <p>
 * {@code limit} and {@code offset} may also be passed as ordinary request parameters; values set here take
 * precedence over the parameter map.
 * </p>
 */
@Data
public class FetchOptions {

    /** Split the request into pages according to the endpoint's per-request cap. */
    private boolean autoPaging = true;
    /** Fetch pages on the worker pool in batches instead of one after another. */
    private boolean concurrent = false;
    /** Number of pages to plan in concurrent mode; derived from {@code limit} or the configured default when null. */
    private Integer maxPages;
    /** Total number of rows wanted; unbounded when null. */
    private Integer limit;
    /** Offset of the first row; 0 when null. */
    private Integer offset;

    public static FetchOptions defaults() {
        return new FetchOptions();
    }

    public static FetchOptions singleRequest() {
        FetchOptions options = new FetchOptions();
        options.setAutoPaging(false);
        return options;
    }

    public static FetchOptions concurrentPages(Integer maxPages) {
        FetchOptions options = new FetchOptions();
        options.setConcurrent(true);
        options.setMaxPages(maxPages);
        return options;
    }
}
