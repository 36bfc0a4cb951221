package in.castsync.infrastructure.obs;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A {@code RequestResponse} frame correlated back to its request.
 *
 * @param responseData null when the server sent none
 */
public record ObsResponse(
    String requestType,
    String requestId,
    boolean result,
    int code,
    String comment,
    JsonNode responseData
) {}
