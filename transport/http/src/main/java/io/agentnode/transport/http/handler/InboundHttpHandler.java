package io.agentnode.transport.http.handler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;

import io.agentnode.server.inbound.InboundSession;
import io.agentnode.server.inbound.InboundSessionFactory;
import io.agentnode.server.messaging.MessageParseException;
import io.agentnode.server.messaging.ParsedMessage;
import io.agentnode.server.messaging.Payload;
import io.agentnode.server.tenant.TenantResolutionException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps inbound HTTP requests onto {@link InboundSession}s.
 * <p>
 * Every exchange accepts undelivered messages and can carry a direct response, which is waited
 * for at most {@link InboundSessionFactory#responseTimeout()}. A timed out or abandoned wait is
 * answered with an empty {@code 200}.
 */
@ApplicationScoped
public class InboundHttpHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(InboundHttpHandler.class);

    static final String BAD_REQUEST_TEXT = "Bad Request";
    static final String INVITATION_TEXT = "You have received a connection invitation. "
            + "To accept the invitation, paste it into your agent application.";

    private InboundSessionFactory sessionFactory;

    protected InboundHttpHandler() {
        // For CDI
    }

    @Inject
    public InboundHttpHandler(InboundSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    public InboundHttpResponse handleInbound(InboundHttpRequest request) {
        Payload body = isJson(request.contentType())
                ? Payload.text(new String(request.body(), StandardCharsets.UTF_8))
                : Payload.binary(request.body());

        try (InboundSession session = sessionFactory.open(request.peer(), true, true)) {
            request.connection().onClose(session::cancel);
            session.resolveTenant(body);
            ParsedMessage message = session.receive(body);
            if (!message.receipt().directResponseRequested()) {
                return InboundHttpResponse.empty();
            }
            Optional<Payload> reply = session.awaitResponse(sessionFactory.responseTimeout());
            return reply.map(InboundHttpResponse::reply).orElseGet(InboundHttpResponse::empty);
        } catch (MessageParseException e) {
            // The unpacking detail stays out of the reply to an unauthenticated peer
            LOGGER.debug("Rejected message from {}: {}", request.peer(), e.getMessage());
            return InboundHttpResponse.text(400, BAD_REQUEST_TEXT);
        } catch (TenantResolutionException e) {
            LOGGER.error("Cannot route message from {} to a tenant", request.peer(), e);
            return InboundHttpResponse.text(500, "Internal Server Error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Interrupted while waiting for the response to {}", request.peer());
            return InboundHttpResponse.empty();
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure handling message from {}", request.peer(), e);
            return InboundHttpResponse.text(500, "Internal Server Error");
        }
    }

    /**
     * Answers a {@code GET}; the {@code c_i} query parameter marks an out-of-band invitation
     * opened in a browser.
     */
    public InboundHttpResponse handleInvitation(@Nullable String invitation) {
        if (invitation == null || invitation.isEmpty()) {
            return InboundHttpResponse.empty();
        }
        return InboundHttpResponse.text(200, INVITATION_TEXT);
    }

    static boolean isJson(@Nullable String contentType) {
        if (contentType == null) {
            return false;
        }
        int params = contentType.indexOf(';');
        String mediaType = params < 0 ? contentType : contentType.substring(0, params);
        return InboundHttpResponse.JSON.equals(mediaType.trim().toLowerCase(Locale.ROOT));
    }
}
