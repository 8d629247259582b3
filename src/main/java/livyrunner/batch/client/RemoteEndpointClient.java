package livyrunner.batch.client;

import livyrunner.batch.error.TransportException;

/**
 * Performs one request/response exchange against a named remote service.
 * Implementations do not retry.
 */
public interface RemoteEndpointClient {

    /**
     * Send the request and wait for the complete response.
     *
     * @param request request to send
     * @return the response, always with a 2xx status
     * @throws TransportException if the exchange could not be completed or
     *                            the service answered with a non-2xx status
     */
    RemoteResponse exchange(RemoteRequest request);
}
