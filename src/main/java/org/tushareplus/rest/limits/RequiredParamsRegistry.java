package org.tushareplus.rest.limits;

import com.jayway.jsonpath.JsonPath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed parameters that some endpoints need before a limit probe returns meaningful data
 * (e.g. {@code index_weight} needs an {@code index_code}).
 * <p>
 * Sources, later ones overriding earlier ones per endpoint:
 * </p>
 * <ol>
 *   <li>the profile's built-in parameters</li>
 *   <li>the bundled {@code api_params.json} classpath resource</li>
 *   <li>a user-supplied JSON file</li>
 *   <li>{@link #register} calls at runtime</li>
 * </ol>
 * <p>A file that cannot be read is logged and skipped.</p>
 *
 * <p><b>File format:</b></p>
 * <pre>
 * {
 *   "index_weight": {"index_code": "000906.SH"},
 *   "fund_nav": {"end_date": "20250506"}
 * }
 * </pre>
 */
public class RequiredParamsRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RequiredParamsRegistry.class);

    public static final String DEFAULT_RESOURCE = "/api_params.json";

    private final Map<String, Map<String, Object>> params = new ConcurrentHashMap<>();

    public RequiredParamsRegistry() {
    }

    public RequiredParamsRegistry(Map<String, Map<String, Object>> initial) {
        registerAll(initial);
    }

    /**
     * Loads the bundled defaults from the classpath, if present.
     */
    public RequiredParamsRegistry loadDefaults() {
        try (InputStream in = RequiredParamsRegistry.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return this;
            }
            registerAll(parse(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
            logger.info("Loaded default required parameters from {}", DEFAULT_RESOURCE);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to load default required parameters: {}", e.getMessage());
        }
        return this;
    }

    /**
     * Loads and merges a JSON file; custom entries replace existing ones per endpoint.
     */
    public RequiredParamsRegistry loadFile(Path file) {
        if (file == null || !Files.exists(file)) {
            return this;
        }
        try {
            registerAll(parse(Files.readString(file, StandardCharsets.UTF_8)));
            logger.info("Loaded custom required parameters from {}", file);
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to load custom required parameters from {}: {}", file, e.getMessage());
        }
        return this;
    }

    public void register(String endpoint, Map<String, Object> endpointParams) {
        params.put(endpoint, Collections.unmodifiableMap(new LinkedHashMap<>(endpointParams)));
        logger.info("Registered required parameters: {} = {}", endpoint, endpointParams);
    }

    /**
     * @return a mutable copy of the endpoint's required parameters, empty when none are registered
     */
    public Map<String, Object> get(String endpoint) {
        Map<String, Object> endpointParams = params.get(endpoint);
        return endpointParams == null ? new LinkedHashMap<>() : new LinkedHashMap<>(endpointParams);
    }

    private void registerAll(Map<String, Map<String, Object>> entries) {
        if (entries == null) {
            return;
        }
        entries.forEach((endpoint, endpointParams) ->
                params.put(endpoint, Collections.unmodifiableMap(new LinkedHashMap<>(endpointParams))));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> parse(String json) {
        Object parsed = JsonPath.parse(json).json();
        if (!(parsed instanceof Map)) {
            throw new IllegalArgumentException("Required parameters must be a JSON object keyed by endpoint name");
        }
        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) parsed).entrySet()) {
            if (entry.getValue() instanceof Map) {
                result.put(entry.getKey(), (Map<String, Object>) entry.getValue());
            } else {
                logger.warn("Ignoring required parameters of {}: not a JSON object", entry.getKey());
            }
        }
        return result;
    }
}
