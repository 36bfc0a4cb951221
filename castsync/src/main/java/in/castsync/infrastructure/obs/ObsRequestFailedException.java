package in.castsync.infrastructure.obs;

/**
 * Exception thrown when a typed query gets a response with {@code result=false}.
 */
public class ObsRequestFailedException extends RuntimeException {

    private final String requestType;
    private final int code;

    public ObsRequestFailedException(String endpoint, String requestType, int code, String comment) {
        super(String.format("[OBS:%s] %s failed: %d%s",
            endpoint, requestType, code, comment == null ? "" : " (" + comment + ")"));
        this.requestType = requestType;
        this.code = code;
    }

    public String getRequestType() {
        return requestType;
    }

    public int getCode() {
        return code;
    }
}
