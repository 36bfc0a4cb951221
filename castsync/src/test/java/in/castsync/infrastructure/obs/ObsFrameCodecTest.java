package in.castsync.infrastructure.obs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ObsFrameCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ObsFrameCodec codec = new ObsFrameCodec(mapper);

    @Test
    void decodesHelloWithAuthentication() {
        JsonNode frame = codec.decode("""
            {"op":0,"d":{"obsWebSocketVersion":"5.4.2","rpcVersion":1,
              "authentication":{"challenge":"ch","salt":"sa"}}}
            """);

        assertEquals(ObsOpCode.HELLO, codec.opOf(frame));
        ObsFrameCodec.Hello hello = codec.decodeHello(frame);
        assertEquals(1, hello.rpcVersion());
        assertEquals("5.4.2", hello.obsWebSocketVersion());
        assertTrue(hello.authenticationRequired());
        assertEquals("sa", hello.salt());
        assertEquals("ch", hello.challenge());
    }

    @Test
    void helloWithoutAuthentication() {
        JsonNode frame = codec.decode("{\"op\":0,\"d\":{\"rpcVersion\":1}}");

        assertFalse(codec.decodeHello(frame).authenticationRequired());
    }

    @Test
    void rejectsMalformedFrames() {
        assertThrows(ObsProtocolException.class, () -> codec.decode("{not json"));
        assertThrows(ObsProtocolException.class, () -> codec.decode("{\"d\":{}}"));
        assertThrows(ObsProtocolException.class, () -> codec.decode("{\"op\":\"5\",\"d\":{}}"));
        assertThrows(ObsProtocolException.class, () -> codec.decode("{\"op\":5}"));
        assertThrows(ObsProtocolException.class, () -> codec.decode("[1,2]"));
        assertThrows(ObsProtocolException.class,
            () -> codec.decodeHello(codec.decode("{\"op\":0,\"d\":{}}")));
    }

    @Test
    void unknownOpcodeIsNull() {
        assertNull(codec.opOf(codec.decode("{\"op\":9,\"d\":{}}")));
    }

    @Test
    void decodesRequestResponse() {
        JsonNode frame = codec.decode("""
            {"op":7,"d":{"requestType":"GetStreamStatus","requestId":"r-1",
              "requestStatus":{"result":false,"code":604,"comment":"nope"}}}
            """);

        ObsResponse response = codec.decodeResponse(frame);
        assertEquals("r-1", response.requestId());
        assertEquals("GetStreamStatus", response.requestType());
        assertFalse(response.result());
        assertEquals(604, response.code());
        assertEquals("nope", response.comment());
        assertNull(response.responseData());
    }

    @Test
    void responseWithoutStatusIsProtocolError() {
        JsonNode frame = codec.decode("{\"op\":7,\"d\":{\"requestId\":\"r-1\"}}");

        assertThrows(ObsProtocolException.class, () -> codec.decodeResponse(frame));
    }

    @Test
    void decodesStreamStateChanged() {
        JsonNode frame = codec.decode("""
            {"op":5,"d":{"eventType":"StreamStateChanged","eventIntent":64,
              "eventData":{"outputActive":true,"outputState":"OBS_WEBSOCKET_OUTPUT_STARTED"}}}
            """);

        assertEquals(ObsFrameCodec.STREAM_STATE_CHANGED, codec.eventTypeOf(frame));
        ObsStreamStateChanged event = codec.decodeStreamStateChanged(frame);
        assertTrue(event.outputActive());
        assertEquals(ObsOutputState.STARTED, event.outputState());
    }

    @Test
    void unknownOutputStateMapsToUnknown() {
        JsonNode frame = codec.decode("""
            {"op":5,"d":{"eventType":"StreamStateChanged",
              "eventData":{"outputActive":false,"outputState":"OBS_WEBSOCKET_OUTPUT_SOMETHING_NEW"}}}
            """);

        assertEquals(ObsOutputState.UNKNOWN, codec.decodeStreamStateChanged(frame).outputState());
    }

    @Test
    void encodesIdentify() throws Exception {
        JsonNode withAuth = mapper.readTree(codec.encodeIdentify(1, "secret-response", 64));
        assertEquals(1, withAuth.path("op").asInt());
        assertEquals(1, withAuth.path("d").path("rpcVersion").asInt());
        assertEquals("secret-response", withAuth.path("d").path("authentication").asText());
        assertEquals(64, withAuth.path("d").path("eventSubscriptions").asInt());

        JsonNode withoutAuth = mapper.readTree(codec.encodeIdentify(1, null, 64));
        assertFalse(withoutAuth.path("d").has("authentication"));
    }

    @Test
    void encodesRequest() throws Exception {
        ObjectNode data = mapper.createObjectNode().put("sceneName", "Live");

        JsonNode frame = mapper.readTree(codec.encodeRequest("SetCurrentProgramScene", "r-9", data));

        assertEquals(6, frame.path("op").asInt());
        assertEquals("SetCurrentProgramScene", frame.path("d").path("requestType").asText());
        assertEquals("r-9", frame.path("d").path("requestId").asText());
        assertEquals("Live", frame.path("d").path("requestData").path("sceneName").asText());

        JsonNode bare = mapper.readTree(codec.encodeRequest("GetStreamStatus", "r-10", null));
        assertFalse(bare.path("d").has("requestData"));
    }
}
