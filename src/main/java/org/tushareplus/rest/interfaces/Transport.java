package org.tushareplus.rest.interfaces;

import org.tushareplus.model.TransportResponse;
import org.tushareplus.rest.exception.TransportException;

import java.util.List;
import java.util.Map;

/**
 * Sends one request to the remote data service and returns the decoded response envelope.
 * <p>
 * Implementations own the wire format; callers only see status code, message and page payload.
 * A non-zero status code is returned, not thrown, so that the caller decides whether it is retryable.
 * </p>
 */
public interface Transport {

    /**
     * Sends a single synchronous request.
     *
     * @param endpoint   Remote endpoint (API) name.
     * @param credential Opaque token carried to the server.
     * @param params     Request parameters, including {@code offset}/{@code limit} when paginating.
     * @param fields     Requested field names; empty for the endpoint's default set.
     * @return the decoded response envelope
     * @throws TransportException on network or decoding failure
     */
    TransportResponse send(String endpoint, String credential, Map<String, Object> params, List<String> fields);

}
