package in.castsync.infrastructure.obs;

import java.time.Duration;

/**
 * Exception thrown when no response arrives for a request within its timeout.
 * Only the timed-out request fails; the connection stays open.
 */
public class ObsRequestTimeoutException extends RuntimeException {

    private final String endpoint;
    private final String requestType;
    private final String requestId;
    private final Duration timeout;

    public ObsRequestTimeoutException(String endpoint, String requestType, String requestId, Duration timeout) {
        super(String.format("[OBS:%s] Request timeout: %s (id=%s, after %dms)",
            endpoint, requestType, requestId, timeout.toMillis()));
        this.endpoint = endpoint;
        this.requestType = requestType;
        this.requestId = requestId;
        this.timeout = timeout;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getRequestType() {
        return requestType;
    }

    public String getRequestId() {
        return requestId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
