package io.agentnode.server.messaging;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A wire body or a direct reply, either structured text (JSON) or opaque bytes.
 * <p>
 * The inbound endpoint picks the kind from the request content type, and a reply's kind decides
 * the content type written back to the peer. The content is passed along unmodified.
 * <pre>{@code
 * Payload ack = Payload.text("{\"@type\":\"ack\"}");
 * Payload packed = Payload.binary(bytes);
 * }</pre>
 */
public final class Payload {

    private final @Nullable String text;
    private final byte @Nullable [] bytes;

    private Payload(@Nullable String text, byte @Nullable [] bytes) {
        this.text = text;
        this.bytes = bytes;
    }

    public static Payload text(String text) {
        Objects.requireNonNull(text, "text");
        return new Payload(text, null);
    }

    public static Payload binary(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new Payload(null, bytes.clone());
    }

    public boolean isText() {
        return text != null;
    }

    /**
     * @return the text content
     * @throws IllegalStateException if this is a binary payload
     */
    public String asText() {
        if (text == null) {
            throw new IllegalStateException("Payload is binary");
        }
        return text;
    }

    /**
     * Returns the content as bytes; text payloads are encoded as UTF-8.
     */
    public byte[] asBytes() {
        if (bytes != null) {
            return bytes.clone();
        }
        return Objects.requireNonNull(text).getBytes(StandardCharsets.UTF_8);
    }

    public int size() {
        return bytes != null ? bytes.length : Objects.requireNonNull(text).length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Objects.equals(text, payload.text) && Arrays.equals(bytes, payload.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(text) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return isText() ? "Payload[text, " + size() + " chars]" : "Payload[binary, " + size() + " bytes]";
    }
}
