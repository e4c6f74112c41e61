package io.agentnode.server.vertx;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

import io.agentnode.server.TransportSetupException;
import io.agentnode.server.config.Settings;
import io.agentnode.server.context.ProcessContext;
import io.agentnode.server.inbound.InboundSessionFactory;
import io.agentnode.server.inbound.ResponseCorrelator;
import io.agentnode.server.messaging.InboundMessage;
import io.agentnode.server.messaging.MessageDispatcher;
import io.agentnode.server.messaging.MessageParseException;
import io.agentnode.server.messaging.MessageReceipt;
import io.agentnode.server.messaging.MessageUnpacker;
import io.agentnode.server.messaging.ParsedMessage;
import io.agentnode.server.messaging.Payload;
import io.agentnode.server.messaging.ReturnRoute;
import io.agentnode.server.tenant.ContextSwitcher;
import io.agentnode.server.tenant.InMemoryRecipientKeyDirectory;
import io.agentnode.server.tenant.InMemoryTenantContextCache;
import io.agentnode.server.tenant.RecipientKeyTenantResolver;
import io.agentnode.server.tenant.StandardTenantSelectionPolicy;
import io.agentnode.server.tenant.TenantStoreException;
import io.agentnode.transport.http.handler.InboundHttpHandler;
import io.agentnode.transport.http.handler.InboundHttpResponse;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class VertxInboundTransportTest {

    private static final String LOCALHOST = "127.0.0.1";
    private static final ParsedMessage ONE_WAY = new ParsedMessage("{\"@type\":\"ping\"}",
            MessageReceipt.noDirectResponse());
    private static final ParsedMessage TWO_WAY = new ParsedMessage("{\"@type\":\"ping\"}",
            MessageReceipt.directResponse(ReturnRoute.ALL));

    private Vertx vertx;
    private MessageUnpacker unpacker;
    private MessageDispatcher dispatcher;
    private ResponseCorrelator correlator;
    private InboundHttpHandler handler;
    private VertxInboundTransport transport;
    private HttpClient client;

    @BeforeEach
    public void setUp() {
        vertx = Vertx.vertx();
        unpacker = mock(MessageUnpacker.class);
        dispatcher = mock(MessageDispatcher.class);
        correlator = new ResponseCorrelator();
        ProcessContext context = ProcessContext.create(Settings.of(Map.of(Settings.RESPONSE_TIMEOUT_MS, "500")));
        ContextSwitcher switcher = new ContextSwitcher(new InMemoryTenantContextCache(
                tenantId -> {
                    throw TenantStoreException.unknownTenant(tenantId);
                }));
        InboundSessionFactory factory = new InboundSessionFactory(context,
                new RecipientKeyTenantResolver(new InMemoryRecipientKeyDirectory()),
                StandardTenantSelectionPolicy.FIRST, switcher, unpacker, dispatcher, correlator);
        handler = new InboundHttpHandler(factory);
        transport = newTransport(0);
        client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    public void tearDown() {
        transport.stop();
        vertx.close().toCompletionStage().toCompletableFuture().join();
    }

    private VertxInboundTransport newTransport(int port) {
        return new VertxInboundTransport(vertx, Settings.of(Map.of(
                Settings.HTTP_HOST, LOCALHOST,
                Settings.HTTP_PORT, Integer.toString(port),
                Settings.HTTP_MAX_MESSAGE_SIZE, "1024")), handler);
    }

    private HttpResponse<String> post(String contentType, byte[] body) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://" + LOCALHOST + ":" + transport.actualPort() + "/"))
                .header("Content-Type", contentType)
                .timeout(Duration.ofSeconds(10))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String pathAndQuery) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://" + LOCALHOST + ":" + transport.actualPort() + pathAndQuery))
                .timeout(Duration.ofSeconds(10))
                .GET()
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testMessageWithoutDirectResponse() throws Exception {
        transport.start();
        when(unpacker.unpack(any(), any())).thenReturn(ONE_WAY);

        HttpResponse<String> response = post(InboundHttpResponse.WIRE, new byte[] {1, 2, 3});

        assertEquals(200, response.statusCode());
        assertEquals("", response.body());
    }

    @Test
    public void testDirectResponseIsReturned() throws Exception {
        transport.start();
        when(unpacker.unpack(any(), any())).thenReturn(TWO_WAY);
        doAnswer(invocation -> {
            InboundMessage message = invocation.getArgument(0);
            correlator.notifyResponseReady(message.exchangeId(), Payload.text("ack"));
            return null;
        }).when(dispatcher).dispatch(any());

        HttpResponse<String> response = post("application/json", "{}".getBytes(StandardCharsets.UTF_8));

        assertEquals(200, response.statusCode());
        assertEquals("application/json", response.headers().firstValue("Content-Type").orElseThrow());
        assertEquals("ack", response.body());
    }

    @Test
    public void testTimedOutResponseIsEmpty() throws Exception {
        transport.start();
        when(unpacker.unpack(any(), any())).thenReturn(TWO_WAY);

        HttpResponse<String> response = post(InboundHttpResponse.WIRE, new byte[] {1, 2, 3});

        assertEquals(200, response.statusCode());
        assertEquals("", response.body());
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    public void testMalformedMessageIsRejected() throws Exception {
        transport.start();
        when(unpacker.unpack(any(), any())).thenThrow(new MessageParseException("Invalid packed message"));

        HttpResponse<String> response = post(InboundHttpResponse.WIRE, new byte[] {0, 0, 0});

        assertEquals(400, response.statusCode());
        assertEquals("Bad Request", response.body());
    }

    @Test
    public void testOversizedMessageIsRefused() throws Exception {
        transport.start();

        HttpResponse<String> response = post(InboundHttpResponse.WIRE, new byte[2048]);

        assertEquals(413, response.statusCode());
        verifyNoInteractions(unpacker, dispatcher);
    }

    @Test
    public void testInvitationProbe() throws Exception {
        transport.start();

        HttpResponse<String> invitation = get("/?c_i=eyJAdHlwZSI6Imludml0YXRpb24ifQ");
        HttpResponse<String> plain = get("/");

        assertEquals(200, invitation.statusCode());
        assertTrue(invitation.body().startsWith("You have received a connection invitation."));
        assertEquals(200, plain.statusCode());
        assertEquals("", plain.body());
    }

    @Test
    public void testPortInUseFailsSetup() throws Exception {
        try (ServerSocket taken = new ServerSocket(0, 50, InetAddress.getByName(LOCALHOST))) {
            VertxInboundTransport conflicting = newTransport(taken.getLocalPort());

            TransportSetupException e = assertThrows(TransportSetupException.class, conflicting::start);

            assertEquals("Unable to start webserver with host '" + LOCALHOST + "' and port '"
                    + taken.getLocalPort() + "'", e.getMessage());
            assertFalse(conflicting.isRunning());
        }
    }

    @Test
    public void testStopIsIdempotent() {
        transport.start();
        assertTrue(transport.isRunning());

        transport.stop();
        transport.stop();

        assertFalse(transport.isRunning());
        assertThrows(IllegalStateException.class, transport::actualPort);
    }
}
