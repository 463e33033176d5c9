package com.ryuqq.agentmesh.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.exception.EnvelopeCodecException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.BooleanValue;
import com.ryuqq.agentmesh.core.model.DecimalValue;
import com.ryuqq.agentmesh.core.model.IntegerValue;
import com.ryuqq.agentmesh.core.model.ListValue;
import com.ryuqq.agentmesh.core.model.MapValue;
import com.ryuqq.agentmesh.core.model.MessageId;
import com.ryuqq.agentmesh.core.model.MessageKind;
import com.ryuqq.agentmesh.core.model.NullValue;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.model.PayloadValue;
import com.ryuqq.agentmesh.core.model.TextValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON wire codec for {@link Envelope}.
 *
 * <p>Envelopes travel over the transport as JSON text with the field names
 * {@code from}, {@code to}, {@code kind}, {@code payload}, {@code id},
 * {@code correlation_id} and {@code created_at}. Payload variants map onto native
 * JSON types, so integers stay integers and decimals stay decimals.</p>
 *
 * <p>An unrecognized {@code kind} decodes successfully and is carried as an unknown
 * {@link MessageKind}, which keeps older agents forward-compatible.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public final class EnvelopeCodec {

    static final String FIELD_ID = "id";
    static final String FIELD_FROM = "from";
    static final String FIELD_TO = "to";
    static final String FIELD_KIND = "kind";
    static final String FIELD_PAYLOAD = "payload";
    static final String FIELD_CORRELATION_ID = "correlation_id";
    static final String FIELD_CREATED_AT = "created_at";

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(new ObjectMapper());
    }

    /**
     * Creates a codec around a caller-supplied mapper.
     *
     * @param mapper the Jackson mapper to use
     * @throws IllegalArgumentException if mapper is null
     */
    public EnvelopeCodec(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Serializes an envelope to JSON text.
     *
     * @param envelope the envelope to encode
     * @return JSON text
     * @throws IllegalArgumentException if envelope is null
     * @throws EnvelopeCodecException if serialization fails
     */
    public String encode(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }

        ObjectNode node = mapper.createObjectNode();
        node.put(FIELD_ID, envelope.id().getValue());
        node.put(FIELD_FROM, envelope.from().getValue());
        node.put(FIELD_TO, envelope.to().getValue());
        node.put(FIELD_KIND, envelope.kind().getValue());
        node.set(FIELD_PAYLOAD, toJson(envelope.payload().asMap()));
        if (envelope.hasCorrelationId()) {
            node.put(FIELD_CORRELATION_ID, envelope.correlationId().getValue());
        } else {
            node.putNull(FIELD_CORRELATION_ID);
        }
        node.put(FIELD_CREATED_AT, envelope.createdAt());

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new EnvelopeCodecException("Failed to encode envelope " + envelope.id().getValue(), e);
        }
    }

    /**
     * Parses JSON text back into an envelope.
     *
     * @param json JSON text produced by {@link #encode(Envelope)} or a compatible peer
     * @return the decoded envelope
     * @throws EnvelopeCodecException if the text is not valid JSON or misses required fields
     */
    public Envelope decode(String json) {
        if (json == null || json.isBlank()) {
            throw new EnvelopeCodecException("envelope text cannot be null or blank");
        }

        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EnvelopeCodecException("Malformed envelope JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeCodecException("Envelope JSON must be an object");
        }

        try {
            JsonNode payloadNode = root.get(FIELD_PAYLOAD);
            Payload payload = payloadNode == null || payloadNode.isNull()
                ? Payload.empty()
                : Payload.of(toMap(requireObject(payloadNode, FIELD_PAYLOAD)));

            JsonNode correlation = root.get(FIELD_CORRELATION_ID);
            MessageId correlationId = correlation == null || correlation.isNull()
                ? null
                : MessageId.of(correlation.asText());

            return new Envelope(
                MessageId.of(requireText(root, FIELD_ID)),
                AgentId.of(requireText(root, FIELD_FROM)),
                AgentId.of(requireText(root, FIELD_TO)),
                MessageKind.of(requireText(root, FIELD_KIND)),
                payload,
                correlationId,
                requireLong(root, FIELD_CREATED_AT)
            );
        } catch (IllegalArgumentException e) {
            throw new EnvelopeCodecException("Invalid envelope: " + e.getMessage(), e);
        }
    }

    private JsonNode toJson(PayloadValue value) {
        JsonNodeFactory factory = mapper.getNodeFactory();
        if (value instanceof TextValue text) {
            return factory.textNode(text.value());
        }
        if (value instanceof IntegerValue integer) {
            return factory.numberNode(integer.value());
        }
        if (value instanceof DecimalValue decimal) {
            return factory.numberNode(decimal.value());
        }
        if (value instanceof BooleanValue bool) {
            return factory.booleanNode(bool.value());
        }
        if (value instanceof ListValue list) {
            ArrayNode array = factory.arrayNode();
            for (PayloadValue item : list.items()) {
                array.add(toJson(item));
            }
            return array;
        }
        if (value instanceof MapValue map) {
            return toJson(map.entries());
        }
        return factory.nullNode();
    }

    private ObjectNode toJson(Map<String, PayloadValue> entries) {
        ObjectNode object = mapper.createObjectNode();
        for (Map.Entry<String, PayloadValue> entry : entries.entrySet()) {
            object.set(entry.getKey(), toJson(entry.getValue()));
        }
        return object;
    }

    private PayloadValue fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullValue.INSTANCE;
        }
        if (node.isTextual()) {
            return new TextValue(node.asText());
        }
        if (node.isIntegralNumber()) {
            if (!node.canConvertToLong()) {
                throw new EnvelopeCodecException("Integer out of 64-bit range: " + node.asText());
            }
            return new IntegerValue(node.longValue());
        }
        if (node.isNumber()) {
            double value = node.doubleValue();
            if (Double.isInfinite(value)) {
                throw new EnvelopeCodecException("Decimal out of double range: " + node.asText());
            }
            return new DecimalValue(value);
        }
        if (node.isBoolean()) {
            return BooleanValue.of(node.asBoolean());
        }
        if (node.isArray()) {
            List<PayloadValue> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(fromJson(item));
            }
            return new ListValue(items);
        }
        if (node.isObject()) {
            return new MapValue(toMap(node));
        }
        throw new EnvelopeCodecException("Unsupported JSON node type: " + node.getNodeType());
    }

    private Map<String, PayloadValue> toMap(JsonNode object) {
        Map<String, PayloadValue> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), fromJson(field.getValue()));
        }
        return entries;
    }

    private static JsonNode requireObject(JsonNode node, String field) {
        if (!node.isObject()) {
            throw new EnvelopeCodecException("Field '" + field + "' must be an object");
        }
        return node;
    }

    private static String requireText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isValueNode()) {
            throw new EnvelopeCodecException("Missing required field '" + field + "'");
        }
        return node.asText();
    }

    private static long requireLong(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.canConvertToLong()) {
            throw new EnvelopeCodecException("Missing or non-numeric field '" + field + "'");
        }
        return node.asLong();
    }
}
