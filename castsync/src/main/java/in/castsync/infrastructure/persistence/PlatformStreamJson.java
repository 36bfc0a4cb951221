package in.castsync.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.castsync.domain.stream.PlatformStream;

/**
 * Platform-tagged JSON storage form of {@link PlatformStream}.
 *
 * Instants are written as ISO-8601 strings; decoding then encoding is lossless.
 */
public final class PlatformStreamJson {

    private final ObjectMapper mapper;

    public PlatformStreamJson() {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(PlatformStream platformStream) {
        try {
            return mapper.writerFor(PlatformStream.class).writeValueAsString(platformStream);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + platformStream.platform() + " stream", e);
        }
    }

    public PlatformStream decode(String json) {
        try {
            return mapper.readValue(json, PlatformStream.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid platform stream JSON: " + e.getOriginalMessage(), e);
        }
    }
}
