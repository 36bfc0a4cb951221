package in.castsync.infrastructure.obs;

/**
 * Exception thrown when the control endpoint rejects the identify handshake.
 */
public class ObsAuthenticationException extends RuntimeException {

    private final String endpoint;

    public ObsAuthenticationException(String endpoint, String message) {
        super(String.format("[OBS:%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
