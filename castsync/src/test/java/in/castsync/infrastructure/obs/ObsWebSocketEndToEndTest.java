package in.castsync.infrastructure.obs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.castsync.infrastructure.metrics.DaemonMetrics;
import in.castsync.infrastructure.obs.transport.JdkWebSocketTransport;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.core.protocol.version13.Hybi13Handshake;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real socket round trip: JDK WebSocket client against an Undertow server speaking the
 * control protocol.
 */
class ObsWebSocketEndToEndTest {

    private static final int TEST_PORT = 19092;
    private static final String PASSWORD = "supersecretpassword";
    private static final String SALT = "lM1GncleQOaCu9lT1yeUZhFYnqhsLLP1G5lAGo3ixaI=";
    private static final String CHALLENGE = "+IxH4CnCiqpX1rM9scsNynZzbOe4KhDeYcTNS3PDaeY=";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Undertow server;
    private volatile WebSocketChannel serverChannel;
    private JdkObsWebSocketClient client;

    @BeforeEach
    void setUp() {
        WebSocketConnectionCallback callback = new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                serverChannel = channel;
                channel.getReceiveSetter().set(new AbstractReceiveListener() {
                    @Override
                    protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) throws IOException {
                        handleClientFrame(ch, MAPPER.readTree(message.getData()));
                    }
                });
                channel.resumeReceives();
                WebSockets.sendText("{\"op\":0,\"d\":{\"obsWebSocketVersion\":\"5.4.2\",\"rpcVersion\":1,"
                    + "\"authentication\":{\"challenge\":\"" + CHALLENGE + "\",\"salt\":\"" + SALT + "\"}}}",
                    channel, null);
            }
        };

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path().addExactPath("/",
                new WebSocketProtocolHandshakeHandler(
                    List.of(new Hybi13Handshake(Set.of(JdkWebSocketTransport.SUBPROTOCOL), false)), callback)))
            .build();
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    private void handleClientFrame(WebSocketChannel channel, JsonNode frame) {
        JsonNode d = frame.path("d");
        switch (frame.path("op").asInt()) {
            case 1 -> {
                String expected = ObsAuthenticator.authResponse(PASSWORD, SALT, CHALLENGE);
                if (expected.equals(d.path("authentication").asText())) {
                    WebSockets.sendText("{\"op\":2,\"d\":{\"negotiatedRpcVersion\":1}}", channel, null);
                } else {
                    WebSockets.sendClose(4009, "Authentication failed.", channel, null);
                }
            }
            case 6 -> WebSockets.sendText("{\"op\":7,\"d\":{\"requestType\":\"" + d.path("requestType").asText()
                + "\",\"requestId\":\"" + d.path("requestId").asText() + "\","
                + "\"requestStatus\":{\"result\":true,\"code\":100},"
                + "\"responseData\":{\"outputActive\":true,\"outputReconnecting\":false,"
                + "\"outputTimecode\":\"00:10:00.000\",\"outputDuration\":600000}}}", channel, null);
            default -> { }
        }
    }

    private JdkObsWebSocketClient newClient(String password) {
        ObsClientConfig config = ObsClientConfig.of(URI.create("ws://localhost:" + TEST_PORT + "/"), password)
            .withHandshakeTimeout(Duration.ofSeconds(5))
            .withRequestTimeout(Duration.ofSeconds(5));
        client = new JdkObsWebSocketClient(config, new JdkWebSocketTransport(Duration.ofSeconds(5)), DaemonMetrics.NOOP);
        return client;
    }

    @Test
    void connectsQueriesAndReceivesEvents() throws Exception {
        newClient(PASSWORD);
        CompletableFuture<ObsStreamStateChanged> event = new CompletableFuture<>();
        client.onStreamStateChanged(event::complete);

        client.connect().get(5, TimeUnit.SECONDS);
        assertTrue(client.isConnected());

        ObsStreamStatus status = client.getStreamStatus().get(5, TimeUnit.SECONDS);
        assertTrue(status.active());
        assertEquals(600_000L, status.durationMs());

        WebSockets.sendText("{\"op\":5,\"d\":{\"eventType\":\"StreamStateChanged\",\"eventIntent\":64,"
            + "\"eventData\":{\"outputActive\":false,\"outputState\":\"OBS_WEBSOCKET_OUTPUT_STOPPED\"}}}",
            serverChannel, null);
        assertEquals(ObsOutputState.STOPPED, event.get(5, TimeUnit.SECONDS).outputState());
    }

    @Test
    void wrongPasswordIsAuthenticationFailure() {
        newClient("not-the-password");

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> client.connect().get(5, TimeUnit.SECONDS));

        assertInstanceOf(ObsAuthenticationException.class, e.getCause());
        assertFalse(client.isConnected());
    }

    @Test
    void serverCloseEmitsDisconnected() throws Exception {
        newClient(PASSWORD);
        CountDownLatch disconnected = new CountDownLatch(1);
        client.onDisconnected(disconnected::countDown);
        client.connect().get(5, TimeUnit.SECONDS);

        WebSockets.sendClose(1001, "OBS shutting down", serverChannel, null);

        assertTrue(disconnected.await(5, TimeUnit.SECONDS));
        assertFalse(client.isConnected());
    }
}
