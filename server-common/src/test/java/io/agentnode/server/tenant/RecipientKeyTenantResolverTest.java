package io.agentnode.server.tenant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentnode.server.messaging.Payload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RecipientKeyTenantResolverTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String ALICE_KEY = "GJ1SzoWzavQYfNL9XkaJdrQejfztN4XqdsiV4ct3LXKL";
    private static final String ALICE_SECOND_KEY = "8HH5gYEeNc3z7PYXmd54d4x6qAfCNrqQqEB3nS7Zfu7K";
    private static final String BOB_KEY = "H3C2AVvLMv6gmMNam3uVAjZpfkcJCwDwnZn6z3wXmqPV";

    private InMemoryRecipientKeyDirectory directory;
    private RecipientKeyTenantResolver resolver;

    @BeforeEach
    public void setUp() {
        directory = new InMemoryRecipientKeyDirectory();
        directory.register(ALICE_KEY, TenantId.of("alice"));
        directory.register(ALICE_SECOND_KEY, TenantId.of("alice"));
        directory.register(BOB_KEY, TenantId.of("bob"));
        resolver = new RecipientKeyTenantResolver(directory);
    }

    @Test
    public void testResolvesSingleRecipient() throws Exception {
        Payload body = Payload.binary(packedEnvelope(ALICE_KEY).getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(TenantId.of("alice")), resolver.resolve(body));
    }

    @Test
    public void testKeepsRecipientOrderWithoutDuplicates() throws Exception {
        Payload body = Payload.text(packedEnvelope(BOB_KEY, ALICE_KEY, ALICE_SECOND_KEY));

        assertEquals(List.of(TenantId.of("bob"), TenantId.of("alice")), resolver.resolve(body));
    }

    @Test
    public void testIgnoresForeignRecipients() throws Exception {
        Payload body = Payload.text(packedEnvelope("UnknownKey1111111111111111111111111111111111", BOB_KEY));

        assertEquals(List.of(TenantId.of("bob")), resolver.resolve(body));
    }

    @Test
    public void testPlaintextMessageHasNoCandidates() {
        Payload body = Payload.text("{\"@type\":\"https://didcomm.org/trust_ping/1.0/ping\",\"@id\":\"1\"}");

        assertTrue(resolver.resolve(body).isEmpty());
    }

    @Test
    public void testGarbageHasNoCandidates() {
        assertTrue(resolver.resolve(Payload.binary(new byte[] {0x00, 0x7f, (byte) 0xff})).isEmpty());
        assertTrue(resolver.resolve(Payload.text("{\"protected\":\"not base64 !!\"}")).isEmpty());
        assertTrue(resolver.resolve(Payload.text("[1,2,3]")).isEmpty());
    }

    @Test
    public void testKeyCannotMoveToAnotherTenant() {
        assertThrows(IllegalStateException.class, () -> directory.register(BOB_KEY, TenantId.of("alice")));
    }

    static String packedEnvelope(String... recipientKeys) throws Exception {
        ObjectNode header = MAPPER.createObjectNode()
                .put("enc", "xchacha20poly1305_ietf")
                .put("typ", "JWM/1.0")
                .put("alg", "Authcrypt");
        ArrayNode recipients = header.putArray("recipients");
        for (String key : recipientKeys) {
            ObjectNode recipient = recipients.addObject();
            recipient.put("encrypted_key", "c2VjcmV0");
            recipient.putObject("header").put("kid", key).put("iv", "aXY");
        }
        String protectedHeader = Base64.getUrlEncoder().withoutPadding()
                .encodeToString(MAPPER.writeValueAsBytes(header));
        return MAPPER.writeValueAsString(MAPPER.createObjectNode()
                .put("protected", protectedHeader)
                .put("iv", "aXY")
                .put("ciphertext", "Y2lwaGVy")
                .put("tag", "dGFn"));
    }
}
