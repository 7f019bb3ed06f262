package org.tushareplus.rest;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tushareplus.model.ApiProfile;
import org.tushareplus.model.EndpointLimits;
import org.tushareplus.model.FetchOptions;
import org.tushareplus.model.FetchResult;
import org.tushareplus.rest.config.ClientSettings;
import org.tushareplus.rest.csv.CsvLimitStore;
import org.tushareplus.rest.exception.ClientException;
import org.tushareplus.rest.interfaces.Clock;
import org.tushareplus.rest.interfaces.LimitStore;
import org.tushareplus.rest.interfaces.LimitsResolver;
import org.tushareplus.rest.interfaces.Transport;
import org.tushareplus.rest.limits.EndpointLimitsCache;
import org.tushareplus.rest.limits.RequiredParamsRegistry;
import org.tushareplus.rest.ratelimit.SlidingWindowRateLimiter;
import org.tushareplus.rest.ratelimit.SystemClock;
import org.tushareplus.rest.service.HttpTransport;
import org.tushareplus.rest.service.LimitProbe;
import org.tushareplus.rest.service.PagePlanner;
import org.tushareplus.rest.service.Paginator;
import org.tushareplus.rest.service.RequestExecutor;
import org.tushareplus.rest.service.RetryPolicy;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * {@code DataApiClient} is the entry point for fetching data from a Tushare-compatible service.
 *
 * <p>
 * Features:
 * <ul>
 *   <li>Learns each endpoint's per-request row cap and per-minute rate on first use and keeps them in a
 *       durable {@link LimitStore} (a CSV file under {@code ~/.tushare_plus} by default).</li>
 *   <li>Splits large requests into pages, fetched one after another or on a worker pool.</li>
 *   <li>Keeps every endpoint under its per-minute budget with a sliding-window limiter shared by all threads
 *       using this client.</li>
 *   <li>Retries transient failures a bounded number of times.</li>
 * </ul>
 *
 * <p><b>Example:</b>
 * <pre>
 * try (DataApiClient client = new DataApiClient(ClientSettings.forProfile(ApiProfile.TUSHARE, token))) {
 *     FetchResult daily = client.fetch("daily", List.of("ts_code", "trade_date", "close"),
 *             Map.of("ts_code", "000001.SZ", "start_date", "20240101"));
 * }
 * </pre>
 *
 * <p>Instances are thread-safe; {@link #close()} releases the worker pool and HTTP connections.</p>
 */
public class DataApiClient implements LimitsResolver, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DataApiClient.class);

    private final ClientSettings settings;
    private final LimitStore limitStore;
    private final EndpointLimitsCache limitsCache = new EndpointLimitsCache();
    private final RequiredParamsRegistry requiredParams;
    private final LimitProbe limitProbe;
    private final Paginator paginator;
    private final ExecutorService workers;
    /** Transport created by this client, closed with it. */
    private final Closeable ownedTransport;
    /** One monitor per endpoint so that concurrent first calls probe only once. */
    private final Map<String, Object> resolveLocks = new ConcurrentHashMap<>();

    /**
     * Creates a client talking HTTP to the profile's base URL and storing limits in the configured CSV file.
     *
     * @throws IllegalArgumentException if the settings are invalid
     */
    public DataApiClient(ClientSettings settings) {
        this(settings, createTransport(settings));
    }

    private DataApiClient(ClientSettings settings, HttpTransport transport) {
        this(settings, transport, new CsvLimitStore(settings.resolveLimitsFile()), SystemClock.instance(), transport);
    }

    /**
     * Creates a client over caller-supplied collaborators. The transport is not closed by {@link #close()}.
     */
    public DataApiClient(ClientSettings settings, Transport transport, LimitStore limitStore, Clock clock) {
        this(settings, transport, limitStore, clock, null);
    }

    private DataApiClient(ClientSettings settings, Transport transport, LimitStore limitStore, Clock clock,
                          Closeable ownedTransport) {
        settings.validate();
        this.settings = settings;
        this.limitStore = limitStore;
        this.ownedTransport = ownedTransport;

        ApiProfile profile = settings.getProfile();
        this.requiredParams = new RequiredParamsRegistry(profile.getRequiredParams())
                .loadDefaults()
                .loadFile(settings.getRequiredParamsFile());

        SlidingWindowRateLimiter rateLimiter = new SlidingWindowRateLimiter(clock);
        this.limitProbe = new LimitProbe(transport, settings.getToken(), limitStore, rateLimiter, profile, clock);

        RequestExecutor requestExecutor = new RequestExecutor(transport, settings.getToken(),
                new RetryPolicy(settings.getMaxRetries(), Duration.ofSeconds(settings.getRetryDelaySeconds())),
                rateLimiter, limitsCache, settings.isEnableRateLimit(), clock);

        this.workers = Executors.newFixedThreadPool(settings.getWorkerPoolSize(),
                new ThreadFactoryBuilder().setNameFormat(profile.getName() + "-fetch-%d").setDaemon(true).build());
        this.paginator = new Paginator(requestExecutor, this, workers, settings.getWorkerPoolSize(),
                new PagePlanner(settings.getDefaultMaxPages()), settings.isOrderConcurrentPages());

        logger.info("{} client ready: {}, rate limiting {}", profile.getName(), profile.getBaseUrl(),
                settings.isEnableRateLimit() ? "enabled" : "disabled");
    }

    private static HttpTransport createTransport(ClientSettings settings) {
        settings.validate();
        return new HttpTransport(settings.getProfile().getBaseUrl(),
                settings.getConnectionTimeoutSeconds(), settings.getResponseTimeoutSeconds());
    }

    /**
     * Fetches all rows matching {@code params}, paging automatically and sequentially.
     */
    public FetchResult fetch(String endpoint, List<String> fields, Map<String, Object> params) {
        return fetch(endpoint, fields, params, FetchOptions.defaults());
    }

    public FetchResult fetch(String endpoint, List<String> fields, Map<String, Object> params, FetchOptions options) {
        return fetch(endpoint, fields, params, options, CancellationToken.create());
    }

    /**
     * Fetches rows of an endpoint.
     *
     * @param endpoint Endpoint name, e.g. {@code daily}
     * @param fields   Fields to return; empty or null for the endpoint's defaults
     * @param params   Request parameters; {@code limit}/{@code offset} are total row count and start offset
     * @param options  Paging options
     * @param token    Token the caller may cancel from another thread
     * @return merged rows of all pages
     * @throws ClientException if a page fails permanently, the fetch is cancelled or limit detection fails
     */
    public FetchResult fetch(String endpoint, List<String> fields, Map<String, Object> params,
                             FetchOptions options, CancellationToken token) {
        return paginator.fetch(endpoint,
                fields == null ? List.of() : fields,
                params,
                options == null ? FetchOptions.defaults() : options,
                token == null ? CancellationToken.create() : token);
    }

    /**
     * Returns the endpoint's limits from memory, from the limit store, or by probing the endpoint.
     * With rate limiting disabled only the cap is probed and the rate is reported as 0.
     */
    public EndpointLimits getLimits(String endpoint) {
        Optional<EndpointLimits> cached = limitsCache.get(endpoint);
        if (cached.isPresent()) {
            return cached.get();
        }
        synchronized (resolveLocks.computeIfAbsent(endpoint, key -> new Object())) {
            cached = limitsCache.get(endpoint);
            if (cached.isPresent()) {
                return cached.get();
            }
            EndpointLimits limits;
            Optional<EndpointLimits> stored = limitStore.get(endpoint);
            if (stored.isPresent()) {
                limits = settings.isEnableRateLimit() ? stored.get() : stored.get().withoutRateLimit();
                logger.info("Using stored limits of {}: {} rows per request, {} requests per minute",
                        endpoint, limits.getPerRequestCap(), limits.getRatePerMinute());
            } else {
                limits = limitProbe.probeLimits(endpoint, requiredParams.get(endpoint), settings.isEnableRateLimit());
            }
            limitsCache.put(limits);
            return limits;
        }
    }

    @Override
    public EndpointLimits resolve(String endpointName) {
        return getLimits(endpointName);
    }

    /**
     * Forgets the endpoint's limits, in memory and in the limit store. The next fetch probes again.
     */
    public void clearLimits(String endpoint) {
        limitsCache.evict(endpoint);
        limitStore.delete(endpoint);
        logger.info("Cleared limits of {}", endpoint);
    }

    /**
     * Clears and probes the endpoint's limits again.
     *
     * @throws ClientException if detection fails; the failure is logged before it is rethrown
     */
    public EndpointLimits forceRedetect(String endpoint) {
        clearLimits(endpoint);
        try {
            return getLimits(endpoint);
        } catch (ClientException e) {
            logger.error("Re-detecting limits of {} failed", endpoint, e);
            throw e;
        }
    }

    /**
     * Registers parameters the endpoint needs to answer a probe request, e.g. an index code.
     */
    public void registerRequiredParams(String endpoint, Map<String, Object> params) {
        requiredParams.register(endpoint, params);
    }

    public Map<String, Object> getRequiredParams(String endpoint) {
        return requiredParams.get(endpoint);
    }

    public ClientSettings getSettings() {
        return settings;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.getResponseTimeoutSeconds(), TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownedTransport != null) {
            try {
                ownedTransport.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close transport", e);
            }
        }
    }
}
