package io.agentnode.server.vertx;

import static io.vertx.core.http.HttpHeaders.CONTENT_TYPE;
import static io.vertx.core.http.HttpHeaders.HOST;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import io.agentnode.server.TransportSetupException;
import io.agentnode.server.config.Settings;
import io.agentnode.server.inbound.PeerInfo;
import io.agentnode.transport.http.handler.InboundHttpHandler;
import io.agentnode.transport.http.handler.InboundHttpRequest;
import io.agentnode.transport.http.handler.InboundHttpResponse;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerOptions;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.net.SocketAddress;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the inbound endpoint on a Vert.x HTTP server.
 * <pre>
 * POST /   → {@link InboundHttpHandler#handleInbound(InboundHttpRequest)}
 * GET  /   → {@link InboundHttpHandler#handleInvitation(String)}
 * </pre>
 * <p>
 * Inbound messages are handled on worker threads without ordering, so a handler waiting for a
 * direct response blocks neither the event loop nor other exchanges. Bodies larger than
 * {@code agentnode.transport.http.max-message-size} are refused with {@code 413} before any
 * exchange is opened.
 */
@ApplicationScoped
public class VertxInboundTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(VertxInboundTransport.class);

    static final String INVITATION_PARAM = "c_i";
    private static final long STOP_TIMEOUT_SECONDS = 10;

    private final Vertx vertx;
    private final InboundHttpHandler handler;
    private final String host;
    private final int port;
    private final long maxMessageSize;
    private final AtomicReference<HttpServer> server = new AtomicReference<>();

    @Inject
    public VertxInboundTransport(Vertx vertx, Settings settings, InboundHttpHandler handler) {
        this.vertx = vertx;
        this.handler = handler;
        this.host = settings.getString(Settings.HTTP_HOST, "0.0.0.0");
        this.port = settings.getInt(Settings.HTTP_PORT, 8030);
        this.maxMessageSize = settings.getLong(Settings.HTTP_MAX_MESSAGE_SIZE, 0);
    }

    /**
     * Binds the listener and blocks until it accepts connections.
     *
     * @throws TransportSetupException if the address cannot be bound
     * @throws IllegalStateException if already started
     */
    public void start() throws TransportSetupException {
        if (server.get() != null) {
            throw new IllegalStateException("Inbound transport already started");
        }
        HttpServer httpServer = vertx.createHttpServer(new HttpServerOptions().setHost(host).setPort(port))
                .requestHandler(createRouter());
        try {
            httpServer.listen().toCompletionStage().toCompletableFuture().get();
        } catch (ExecutionException e) {
            throw new TransportSetupException(setupFailure(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportSetupException(setupFailure(), e);
        }
        if (!server.compareAndSet(null, httpServer)) {
            httpServer.close();
            throw new IllegalStateException("Inbound transport already started");
        }
        LOGGER.info("Inbound HTTP transport listening on {}:{}", host, httpServer.actualPort());
    }

    /**
     * Closes the listener. Does nothing if it is not running.
     */
    public void stop() {
        HttpServer httpServer = server.getAndSet(null);
        if (httpServer == null) {
            return;
        }
        try {
            httpServer.close().toCompletionStage().toCompletableFuture().get(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            LOGGER.info("Inbound HTTP transport on {}:{} stopped", host, port);
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Failed to stop the inbound HTTP transport on {}:{}", host, port, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while stopping the inbound HTTP transport on {}:{}", host, port);
        }
    }

    public boolean isRunning() {
        return server.get() != null;
    }

    /**
     * The bound port, which differs from the configured one when that is {@code 0}.
     */
    public int actualPort() {
        HttpServer httpServer = server.get();
        if (httpServer == null) {
            throw new IllegalStateException("Inbound transport is not running");
        }
        return httpServer.actualPort();
    }

    Router createRouter() {
        Router router = Router.router(vertx);
        BodyHandler bodyHandler = BodyHandler.create(false);
        if (maxMessageSize > 0) {
            bodyHandler.setBodyLimit(maxMessageSize);
        }
        router.post("/").handler(bodyHandler).blockingHandler(this::handleInbound, false);
        router.get("/").handler(this::handleInvitation);
        return router;
    }

    private void handleInbound(RoutingContext rc) {
        Buffer buffer = rc.body().buffer();
        byte[] body = buffer == null ? new byte[0] : buffer.getBytes();
        InboundHttpRequest request = new InboundHttpRequest(peerInfo(rc), rc.request().getHeader(CONTENT_TYPE), body,
                action -> rc.response().closeHandler(v -> action.run()));
        write(rc, handler.handleInbound(request));
    }

    private void handleInvitation(RoutingContext rc) {
        write(rc, handler.handleInvitation(rc.queryParams().get(INVITATION_PARAM)));
    }

    private static PeerInfo peerInfo(RoutingContext rc) {
        SocketAddress remote = rc.request().remoteAddress();
        return new PeerInfo(rc.request().getHeader(HOST), remote == null ? null : remote.hostAddress());
    }

    private static void write(RoutingContext rc, InboundHttpResponse result) {
        HttpServerResponse response = rc.response().setStatusCode(result.getStatusCode());
        String contentType = result.getContentType();
        if (contentType != null) {
            response.putHeader(CONTENT_TYPE, contentType);
        }
        response.end(Buffer.buffer(result.getBody()))
                .onFailure(e -> LOGGER.debug("Could not write response to {}: {}", peerInfo(rc), e.getMessage()));
    }

    private String setupFailure() {
        return "Unable to start webserver with host '" + host + "' and port '" + port + "'";
    }
}
