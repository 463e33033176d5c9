package com.ryuqq.agentmesh.core.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.exception.EnvelopeCodecException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.DecimalValue;
import com.ryuqq.agentmesh.core.model.IntegerValue;
import com.ryuqq.agentmesh.core.model.Payload;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EnvelopeCodec 테스트.
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
class EnvelopeCodecTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void encode_UsesWireFieldNames() throws Exception {
        // Given
        Envelope request = Envelope.request(AgentId.of("alice"), AgentId.of("bob"), Payload.of("q", "hi"));
        Envelope response = Envelope.response(request, AgentId.of("bob"), Payload.empty());

        // When
        JsonNode node = mapper.readTree(codec.encode(response));

        // Then
        assertEquals("bob", node.get("from").asText());
        assertEquals("alice", node.get("to").asText());
        assertEquals("response", node.get("kind").asText());
        assertEquals(response.id().getValue(), node.get("id").asText());
        assertEquals(request.id().getValue(), node.get("correlation_id").asText());
        assertEquals(response.createdAt(), node.get("created_at").asLong());
        assertTrue(node.get("payload").isObject());
    }

    @Test
    void decode_EncodedEnvelope_PreservesNumericVariants() {
        // Given
        Payload payload = Payload.of(Map.of(
            "count", 3,
            "ratio", 1.5,
            "tags", List.of("x", "y"),
            "nested", Map.of("ok", true)
        ));
        Envelope original = Envelope.notification(AgentId.of("alice"), AgentId.of("bob"), payload);

        // When
        Envelope decoded = codec.decode(codec.encode(original));

        // Then
        assertEquals(original, decoded);
        assertInstanceOf(IntegerValue.class, decoded.payload().get("count").orElseThrow());
        assertInstanceOf(DecimalValue.class, decoded.payload().get("ratio").orElseThrow());
    }

    @Test
    void decode_UnknownKind_Succeeds() {
        // Given
        String json = "{\"id\":\"m-1\",\"from\":\"alice\",\"to\":\"bob\",\"kind\":\"heartbeat\","
            + "\"payload\":{},\"correlation_id\":null,\"created_at\":5}";

        // When
        Envelope decoded = codec.decode(json);

        // Then
        assertFalse(decoded.kind().isKnown());
        assertEquals("heartbeat", decoded.kind().getValue());
    }

    @Test
    void decode_MissingPayload_DefaultsToEmpty() {
        String json = "{\"id\":\"m-1\",\"from\":\"alice\",\"to\":\"*\",\"kind\":\"broadcast\",\"created_at\":5}";

        Envelope decoded = codec.decode(json);

        assertTrue(decoded.payload().isEmpty());
        assertTrue(decoded.to().isBroadcast());
    }

    @Test
    void decode_MalformedJson_ThrowsCodecException() {
        assertThrows(EnvelopeCodecException.class, () -> codec.decode("{not json"));
    }

    @Test
    void decode_MissingRequiredField_ThrowsCodecException() {
        EnvelopeCodecException exception = assertThrows(
            EnvelopeCodecException.class,
            () -> codec.decode("{\"id\":\"m-1\",\"to\":\"bob\",\"kind\":\"request\",\"created_at\":1}")
        );
        assertTrue(exception.getMessage().contains("from"));
    }

    @Test
    void decode_ResponseWithoutCorrelation_ThrowsCodecException() {
        assertThrows(EnvelopeCodecException.class, () -> codec.decode(
            "{\"id\":\"m-1\",\"from\":\"a\",\"to\":\"b\",\"kind\":\"response\",\"payload\":{},\"created_at\":1}"));
    }

    @Test
    void decode_NonObjectRoot_ThrowsCodecException() {
        assertThrows(EnvelopeCodecException.class, () -> codec.decode("[1,2]"));
    }

    @Test
    void decode_IntegerBeyondLongRange_ThrowsCodecException() {
        EnvelopeCodecException exception = assertThrows(EnvelopeCodecException.class, () -> codec.decode(
            "{\"id\":\"m-1\",\"from\":\"a\",\"to\":\"b\",\"kind\":\"request\","
                + "\"payload\":{\"n\":18446744073709551617},\"created_at\":1}"));
        assertTrue(exception.getMessage().contains("18446744073709551617"));
    }

    @Test
    void decode_LongBoundaries_ArePreserved() {
        Envelope decoded = codec.decode(
            "{\"id\":\"m-1\",\"from\":\"a\",\"to\":\"b\",\"kind\":\"request\","
                + "\"payload\":{\"max\":9223372036854775807,\"min\":-9223372036854775808},\"created_at\":1}");

        assertEquals(Long.MAX_VALUE, decoded.payload().getLong("max").orElseThrow());
        assertEquals(Long.MIN_VALUE, decoded.payload().getLong("min").orElseThrow());
    }

    @Test
    void decode_DecimalBeyondDoubleRange_ThrowsCodecException() {
        assertThrows(EnvelopeCodecException.class, () -> codec.decode(
            "{\"id\":\"m-1\",\"from\":\"a\",\"to\":\"b\",\"kind\":\"request\","
                + "\"payload\":{\"x\":1e400},\"created_at\":1}"));
    }
}
