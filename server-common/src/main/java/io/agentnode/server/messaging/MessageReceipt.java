package io.agentnode.server.messaging;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Delivery metadata collected while unpacking an inbound message.
 *
 * @param senderVerkey the sender's verification key, null for anonymous messages
 * @param recipientVerkey the recipient key the message was decrypted with, null for plaintext
 * @param threadId the message thread, when the message carries one
 * @param returnRoute the requested return route
 */
public record MessageReceipt(@Nullable String senderVerkey,
                             @Nullable String recipientVerkey,
                             @Nullable String threadId,
                             ReturnRoute returnRoute) {

    public MessageReceipt {
        Objects.requireNonNull(returnRoute, "returnRoute");
    }

    public static MessageReceipt noDirectResponse() {
        return new MessageReceipt(null, null, null, ReturnRoute.NONE);
    }

    public static MessageReceipt directResponse(ReturnRoute returnRoute) {
        return new MessageReceipt(null, null, null, returnRoute);
    }

    public boolean directResponseRequested() {
        return returnRoute.isDirectResponse();
    }
}
