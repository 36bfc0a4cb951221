package in.castsync.infrastructure.obs;

/**
 * Exception thrown when the control connection fails, closes, or is not open.
 */
public class ObsConnectionException extends RuntimeException {

    private final String endpoint;

    public ObsConnectionException(String endpoint, String message) {
        super(String.format("[OBS:%s] %s", endpoint, message));
        this.endpoint = endpoint;
    }

    public ObsConnectionException(String endpoint, String message, Throwable cause) {
        super(String.format("[OBS:%s] %s", endpoint, message), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
