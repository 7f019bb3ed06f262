package org.tushareplus.rest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.model.Page;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pre-computes the page descriptors of a concurrent fetch.
 */
public class PagePlanner {

    private static final Logger logger = LoggerFactory.getLogger(PagePlanner.class);

    private final int defaultMaxPages;

    public PagePlanner(int defaultMaxPages) {
        if (defaultMaxPages <= 0) {
            throw new IllegalArgumentException("defaultMaxPages must be positive: " + defaultMaxPages);
        }
        this.defaultMaxPages = defaultMaxPages;
    }

    /**
     * Number of pages to plan.
     *
     * @param maxPages  explicit page count, wins when set
     * @param userLimit total rows wanted, or null
     * @param cap       per-request cap, positive
     */
    public int pageCount(String endpoint, Integer maxPages, Integer userLimit, int cap) {
        if (maxPages != null) {
            return Math.max(0, maxPages);
        }
        if (userLimit != null) {
            return (int) Math.ceil((double) Math.max(0, userLimit) / cap);
        }
        logger.warn("Total row count of {} is unknown, planning up to {} pages", endpoint, defaultMaxPages);
        return defaultMaxPages;
    }

    /**
     * Plans pages in ascending offset order; the last page is truncated so that the planned rows never
     * exceed {@code userLimit}.
     */
    public List<Page> plan(String endpoint, Map<String, Object> baseParams, List<String> fields,
                           int startOffset, int cap, int pageCount, Integer userLimit) {
        List<Page> pages = new ArrayList<>(Math.min(pageCount, 1024));
        for (int i = 0; i < pageCount; i++) {
            int size = cap;
            if (userLimit != null) {
                int remaining = userLimit - i * cap;
                if (remaining <= 0) {
                    break;
                }
                size = Math.min(cap, remaining);
            }
            pages.add(Page.slice(endpoint, baseParams, fields, startOffset + i * cap, size));
        }
        return pages;
    }
}
