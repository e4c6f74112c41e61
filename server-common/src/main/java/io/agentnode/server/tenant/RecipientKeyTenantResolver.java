package io.agentnode.server.tenant;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentnode.server.messaging.Payload;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves tenants from the recipient keys of a packed (JWE) message.
 * <p>
 * A packed message is a JSON envelope whose {@code protected} member is a base64url encoded JSON
 * header listing the recipients:
 * <pre>{@code
 * {
 *   "protected": "eyJlbmMiOi...",
 *   "iv": "...", "ciphertext": "...", "tag": "..."
 * }
 * // protected, decoded:
 * {
 *   "enc": "xchacha20poly1305_ietf", "typ": "JWM/1.0", "alg": "Authcrypt",
 *   "recipients": [ { "encrypted_key": "...", "header": { "kid": "<recipient verkey>" } } ]
 * }
 * }</pre>
 * Every {@code kid} is looked up in the {@link RecipientKeyDirectory}. Candidates keep recipient
 * order and appear once. Reading the envelope needs no key material, so it can run before any
 * tenant store is opened. Bodies that are not packed messages yield no candidates.
 */
@ApplicationScoped
public class RecipientKeyTenantResolver implements TenantResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecipientKeyTenantResolver.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final RecipientKeyDirectory directory;

    @Inject
    public RecipientKeyTenantResolver(RecipientKeyDirectory directory) {
        this.directory = directory;
    }

    @Override
    public List<TenantId> resolve(Payload body) {
        List<String> recipientKeys = recipientKeys(body);
        Set<TenantId> candidates = new LinkedHashSet<>();
        for (String key : recipientKeys) {
            Optional<TenantId> owner = directory.lookup(key);
            if (owner.isPresent()) {
                candidates.add(owner.get());
            } else {
                LOGGER.debug("No tenant owns recipient key {}", key);
            }
        }
        return new ArrayList<>(candidates);
    }

    /**
     * Extracts the recipient keys of a packed message.
     *
     * @return the keys in envelope order, empty if the body is not a packed message
     */
    static List<String> recipientKeys(Payload body) {
        JsonNode envelope = readJson(body.asBytes());
        if (envelope == null || !envelope.path("protected").isTextual()) {
            return List.of();
        }
        byte[] header;
        try {
            header = Base64.getUrlDecoder().decode(envelope.get("protected").asText());
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Protected header is not base64url: {}", e.getMessage());
            return List.of();
        }
        JsonNode recipients = readJson(header);
        if (recipients == null) {
            return List.of();
        }
        List<String> keys = new ArrayList<>();
        for (JsonNode recipient : recipients.path("recipients")) {
            JsonNode kid = recipient.path("header").path("kid");
            if (kid.isTextual() && !kid.asText().isEmpty()) {
                keys.add(kid.asText());
            }
        }
        return keys;
    }

    private static @Nullable JsonNode readJson(byte[] content) {
        try {
            JsonNode node = OBJECT_MAPPER.readTree(new String(content, StandardCharsets.UTF_8));
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            LOGGER.debug("Body is not a JSON envelope: {}", e.getOriginalMessage());
            return null;
        }
    }
}
