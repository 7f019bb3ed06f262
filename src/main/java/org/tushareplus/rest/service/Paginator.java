package org.tushareplus.rest.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.model.FetchOptions;
import org.tushareplus.model.FetchResult;
import org.tushareplus.model.Page;
import org.tushareplus.model.PageResult;
import org.tushareplus.rest.CancellationToken;
import org.tushareplus.rest.exception.ClientException;
import org.tushareplus.rest.exception.FetchCancelledException;
import org.tushareplus.rest.exception.TransportException;
import org.tushareplus.rest.interfaces.LimitsResolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Splits a logical fetch into page requests and merges their rows.
 *
 * <p><b>Modes:</b></p>
 * <ul>
 *   <li><b>single</b> - auto paging disabled or the endpoint has no per-request cap: one request,
 *       rows returned verbatim</li>
 *   <li><b>sequential</b> - pages are fetched one after another, each offset advanced by the rows actually
 *       returned, until the server reports the last page or the requested row count is reached.
 *       Without a user limit the loop only ends when the server says so.</li>
 *   <li><b>concurrent</b> - the page count is planned up front and pages are submitted to the worker pool in
 *       batches of {@code batchSize}; a batch is submitted only after every page of the previous one
 *       completed. Rows are appended in completion order unless {@code orderConcurrentPages} is set.</li>
 * </ul>
 *
 * <p>In concurrent mode an error mentioning an out-of-range offset marks the page as an empty last page.
 * Two consecutive empty pages or an explicit {@code has_more = false} stop further batches. Any other error
 * cancels the fetch: pages of the current batch that have not started yet are skipped, the batch is drained
 * and the first error is rethrown.</p>
 */
public class Paginator {

    private static final Logger logger = LoggerFactory.getLogger(Paginator.class);

    static final String OFFSET_MARKER = "offset";
    static final String OUT_OF_RANGE_MARKER = "超出范围";
    static final int EMPTY_PAGES_BEFORE_STOP = 2;

    private final RequestExecutor requestExecutor;
    private final LimitsResolver limitsResolver;
    private final ExecutorService workers;
    private final int batchSize;
    private final PagePlanner planner;
    private final boolean orderConcurrentPages;

    public Paginator(RequestExecutor requestExecutor, LimitsResolver limitsResolver, ExecutorService workers,
                     int batchSize, PagePlanner planner, boolean orderConcurrentPages) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.requestExecutor = requestExecutor;
        this.limitsResolver = limitsResolver;
        this.workers = workers;
        this.batchSize = batchSize;
        this.planner = planner;
        this.orderConcurrentPages = orderConcurrentPages;
    }

    /**
     * Fetches every row the request describes.
     *
     * @param endpoint Endpoint name
     * @param fields   Requested fields, empty for the endpoint's defaults
     * @param params   Request parameters; {@code limit} and {@code offset} entries are read as the total row
     *                 count and start offset unless {@code options} sets them
     * @param options  Paging options
     * @param token    Cancellation token of this fetch
     * @return merged rows
     */
    public FetchResult fetch(String endpoint, List<String> fields, Map<String, Object> params,
                             FetchOptions options, CancellationToken token) {
        Map<String, Object> baseParams = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        Integer userLimit = options.getLimit() != null
                ? options.getLimit()
                : intParam(endpoint, Page.LIMIT, baseParams.remove(Page.LIMIT));
        Integer userOffset = options.getOffset() != null
                ? options.getOffset()
                : intParam(endpoint, Page.OFFSET, baseParams.remove(Page.OFFSET));
        baseParams.remove(Page.LIMIT);
        baseParams.remove(Page.OFFSET);

        if (!options.isAutoPaging()) {
            return single(endpoint, fields, baseParams, userOffset, userLimit, token);
        }

        int cap = limitsResolver.resolve(endpoint).getPerRequestCap();
        if (cap == 0) {
            logger.debug("{} has no per-request cap, fetching in one request", endpoint);
            return single(endpoint, fields, baseParams, userOffset, userLimit, token);
        }

        int startOffset = userOffset == null ? 0 : userOffset;
        if (options.isConcurrent()) {
            return concurrent(endpoint, fields, baseParams, startOffset, userLimit, cap, options.getMaxPages(), token);
        }
        return sequential(endpoint, fields, baseParams, startOffset, userLimit, cap, token);
    }

    private FetchResult single(String endpoint, List<String> fields, Map<String, Object> baseParams,
                               Integer offset, Integer limit, CancellationToken token) {
        Map<String, Object> requestParams = new LinkedHashMap<>(baseParams);
        if (offset != null) {
            requestParams.put(Page.OFFSET, offset);
        }
        if (limit != null) {
            requestParams.put(Page.LIMIT, limit);
        }
        return FetchResult.of(requestExecutor.execute(new Page(endpoint, requestParams, fields), token));
    }

    private FetchResult sequential(String endpoint, List<String> fields, Map<String, Object> baseParams,
                                   int startOffset, Integer userLimit, int cap, CancellationToken token) {
        List<String> fieldNames = Collections.emptyList();
        List<List<Object>> rows = new ArrayList<>();
        int offset = startOffset;
        int pageNumber = 0;

        while (true) {
            int pageLimit = userLimit == null ? cap : Math.min(cap, userLimit - rows.size());
            if (pageLimit <= 0) {
                break;
            }
            PageResult page = requestExecutor.execute(Page.slice(endpoint, baseParams, fields, offset, pageLimit), token);
            pageNumber++;
            if (fieldNames.isEmpty()) {
                fieldNames = page.getFieldNames();
            }
            rows.addAll(page.getRows());
            offset += page.size();
            logger.info("{} page {}: {} rows, {} in total", endpoint, pageNumber, page.size(), rows.size());

            if (page.isEmpty() && !Boolean.TRUE.equals(page.getHasMore())) {
                break;
            }
            if (!page.hasMoreAfter(pageLimit)) {
                break;
            }
        }
        return new FetchResult(fieldNames, rows);
    }

    private FetchResult concurrent(String endpoint, List<String> fields, Map<String, Object> baseParams,
                                   int startOffset, Integer userLimit, int cap, Integer maxPages,
                                   CancellationToken token) {
        int pageCount = planner.pageCount(endpoint, maxPages, userLimit, cap);
        List<Page> pages = planner.plan(endpoint, baseParams, fields, startOffset, cap, pageCount, userLimit);
        logger.info("Fetching {} in up to {} pages, {} at a time", endpoint, pages.size(), batchSize);

        List<PageOutcome> outcomes = new ArrayList<>();
        int consecutiveEmpty = 0;
        boolean exhausted = false;

        for (int from = 0; from < pages.size() && !exhausted; from += batchSize) {
            token.throwIfCancelled(endpoint);
            List<Page> batch = pages.subList(from, Math.min(from + batchSize, pages.size()));

            CompletionService<PageOutcome> completion = new ExecutorCompletionService<>(workers);
            for (Page page : batch) {
                completion.submit(() -> new PageOutcome(page, fetchPage(page, token)));
            }

            ClientException failure = null;
            for (int i = 0; i < batch.size(); i++) {
                PageOutcome outcome;
                try {
                    outcome = awaitNext(completion, endpoint, token);
                } catch (ClientException e) {
                    if (failure == null) {
                        failure = e;
                        token.cancel(e.getMessage());
                    }
                    continue;
                }
                if (failure != null) {
                    continue;
                }
                outcomes.add(outcome);
                PageResult result = outcome.getResult();
                consecutiveEmpty = result.isEmpty() ? consecutiveEmpty + 1 : 0;
                if (result.isExplicitlyLast() || consecutiveEmpty >= EMPTY_PAGES_BEFORE_STOP) {
                    exhausted = true;
                }
            }
            if (failure != null) {
                logger.error("Fetching {} failed: {}", endpoint, failure.getMessage());
                throw failure;
            }
        }

        if (orderConcurrentPages) {
            outcomes.sort(Comparator.comparingInt(outcome -> outcome.getPage().getOffset()));
        }
        List<String> fieldNames = Collections.emptyList();
        List<List<Object>> rows = new ArrayList<>();
        for (PageOutcome outcome : outcomes) {
            if (fieldNames.isEmpty()) {
                fieldNames = outcome.getResult().getFieldNames();
            }
            rows.addAll(outcome.getResult().getRows());
        }
        logger.info("{} fetched: {} rows from {} pages", endpoint, rows.size(), outcomes.size());
        return new FetchResult(fieldNames, rows);
    }

    private PageResult fetchPage(Page page, CancellationToken token) {
        try {
            return requestExecutor.execute(page, token);
        } catch (FetchCancelledException e) {
            throw e;
        } catch (ClientException e) {
            if (isOffsetOutOfRange(e.getMessage())) {
                logger.debug("{} offset {} is past the end of the data", page.getEndpoint(), page.getOffset());
                return PageResult.exhausted(Collections.emptyList());
            }
            throw e;
        }
    }

    private PageOutcome awaitNext(CompletionService<PageOutcome> completion, String endpoint, CancellationToken token) {
        Future<PageOutcome> future;
        try {
            future = completion.take();
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel("interrupted");
            throw new FetchCancelledException(endpoint, "Interrupted while fetching " + endpoint, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ClientException) {
                throw (ClientException) cause;
            }
            throw TransportException.buildTransportException(endpoint, cause);
        }
    }

    static boolean isOffsetOutOfRange(String message) {
        return StringUtils.containsIgnoreCase(message, OFFSET_MARKER)
                || StringUtils.contains(message, OUT_OF_RANGE_MARKER);
    }

    private static Integer intParam(String endpoint, String name, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        String text = value.toString().trim();
        if (StringUtils.isNumeric(text)) {
            return Integer.parseInt(text);
        }
        throw new IllegalArgumentException("Parameter '" + name + "' of " + endpoint + " is not a number: " + value);
    }

    @Getter
    @AllArgsConstructor
    private static final class PageOutcome {
        private final Page page;
        private final PageResult result;
    }
}
