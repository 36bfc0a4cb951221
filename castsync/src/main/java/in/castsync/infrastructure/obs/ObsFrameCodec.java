package in.castsync.infrastructure.obs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON framing for the control protocol.
 *
 * Every frame is {@code {"op": <int>, "d": {...}}}.
 */
public final class ObsFrameCodec {

    public static final String STREAM_STATE_CHANGED = "StreamStateChanged";

    private final ObjectMapper mapper;

    public ObsFrameCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObsFrameCodec() {
        this(new ObjectMapper());
    }

    /**
     * Server hello. {@code salt}/{@code challenge} are null when the server does not require auth.
     */
    public record Hello(int rpcVersion, String obsWebSocketVersion, String salt, String challenge) {
        public boolean authenticationRequired() {
            return salt != null && challenge != null;
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // DECODE
    // ═══════════════════════════════════════════════════════════════════════

    public JsonNode decode(String text) {
        JsonNode frame;
        try {
            frame = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ObsProtocolException("Frame is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (frame == null || !frame.isObject() || !frame.path("op").isInt()) {
            throw new ObsProtocolException("Frame has no integer 'op'");
        }
        if (!frame.path("d").isObject()) {
            throw new ObsProtocolException("Frame op=" + frame.get("op").asInt() + " has no 'd' object");
        }
        return frame;
    }

    /**
     * @return opcode, or null when the server sent one this client does not speak
     */
    public ObsOpCode opOf(JsonNode frame) {
        return ObsOpCode.fromCode(frame.path("op").asInt(-1));
    }

    public Hello decodeHello(JsonNode frame) {
        JsonNode d = frame.path("d");
        if (!d.path("rpcVersion").isInt()) {
            throw new ObsProtocolException("Hello has no rpcVersion");
        }
        JsonNode auth = d.path("authentication");
        String salt = auth.isObject() ? textOrNull(auth, "salt") : null;
        String challenge = auth.isObject() ? textOrNull(auth, "challenge") : null;
        return new Hello(d.get("rpcVersion").asInt(), textOrNull(d, "obsWebSocketVersion"), salt, challenge);
    }

    public ObsResponse decodeResponse(JsonNode frame) {
        JsonNode d = frame.path("d");
        String requestId = textOrNull(d, "requestId");
        if (requestId == null) {
            throw new ObsProtocolException("RequestResponse has no requestId");
        }
        JsonNode status = d.path("requestStatus");
        if (!status.isObject()) {
            throw new ObsProtocolException("RequestResponse " + requestId + " has no requestStatus");
        }
        JsonNode data = d.get("responseData");
        return new ObsResponse(
            textOrNull(d, "requestType"),
            requestId,
            status.path("result").asBoolean(false),
            status.path("code").asInt(0),
            textOrNull(status, "comment"),
            data == null || data.isNull() ? null : data
        );
    }

    public String eventTypeOf(JsonNode frame) {
        return frame.path("d").path("eventType").asText("");
    }

    public ObsStreamStateChanged decodeStreamStateChanged(JsonNode frame) {
        JsonNode data = frame.path("d").path("eventData");
        if (!data.isObject()) {
            throw new ObsProtocolException("StreamStateChanged has no eventData");
        }
        return new ObsStreamStateChanged(
            data.path("outputActive").asBoolean(false),
            ObsOutputState.fromWire(data.path("outputState").asText(""))
        );
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ENCODE
    // ═══════════════════════════════════════════════════════════════════════

    public String encodeIdentify(int rpcVersion, String authentication, int eventSubscriptions) {
        ObjectNode d = mapper.createObjectNode();
        d.put("rpcVersion", rpcVersion);
        if (authentication != null) {
            d.put("authentication", authentication);
        }
        d.put("eventSubscriptions", eventSubscriptions);
        return write(ObsOpCode.IDENTIFY, d);
    }

    public String encodeRequest(String requestType, String requestId, JsonNode requestData) {
        ObjectNode d = mapper.createObjectNode();
        d.put("requestType", requestType);
        d.put("requestId", requestId);
        if (requestData != null && !requestData.isNull()) {
            d.set("requestData", requestData);
        }
        return write(ObsOpCode.REQUEST, d);
    }

    private String write(ObsOpCode op, ObjectNode d) {
        ObjectNode frame = mapper.createObjectNode();
        frame.put("op", op.code());
        frame.set("d", d);
        try {
            return mapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + op + " frame", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
