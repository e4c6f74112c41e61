package io.agentnode.transport.http.handler;

import java.nio.charset.StandardCharsets;

import io.agentnode.server.messaging.Payload;
import org.jspecify.annotations.Nullable;

public class InboundHttpResponse {

    public static final String JSON = "application/json";
    public static final String WIRE = "application/ssi-agent-wire";
    public static final String TEXT = "text/plain";

    private static final byte[] NO_BODY = new byte[0];

    private final int statusCode;
    private final @Nullable String contentType;
    private final byte[] body;

    public InboundHttpResponse(int statusCode, @Nullable String contentType, byte[] body) {
        this.statusCode = statusCode;
        this.contentType = contentType;
        this.body = body;
    }

    public static InboundHttpResponse empty() {
        return new InboundHttpResponse(200, null, NO_BODY);
    }

    /**
     * A reply to the peer; text goes out as JSON, bytes as a packed wire message.
     */
    public static InboundHttpResponse reply(Payload payload) {
        return new InboundHttpResponse(200, payload.isText() ? JSON : WIRE, payload.asBytes());
    }

    public static InboundHttpResponse text(int statusCode, String text) {
        return new InboundHttpResponse(statusCode, TEXT, text.getBytes(StandardCharsets.UTF_8));
    }

    public int getStatusCode() { return statusCode; }
    public @Nullable String getContentType() { return contentType; }
    public byte[] getBody() { return body; }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    @Override
    public String toString() {
        return "InboundHttpResponse[" + statusCode + ", " + contentType + ", " + body.length + " bytes]";
    }
}
