package in.castsync.infrastructure.obs;

/**
 * Exception raised for a malformed or unexpected frame.
 * The client logs it and drops the frame; the connection stays open.
 */
public class ObsProtocolException extends RuntimeException {

    public ObsProtocolException(String message) {
        super(message);
    }

    public ObsProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
