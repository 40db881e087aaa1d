package com.project.chc.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.chc.crypto.CryptoPrimitives;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic encoding of ledger records used as hash and seal input.
 *
 * <p>Keys are sorted at every depth, there is no whitespace, absent optional values are omitted
 * and every floating-point number is written as a plain decimal with at least one fractional digit.
 * Two conforming encoders must produce identical bytes for the same record.</p>
 */
public final class CanonicalJson {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private static final JsonMapper MAPPER = JsonMapper.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .nodeFactory(NODES)
            .build();

    private static final ObjectMapper STORAGE_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> METADATA = new TypeReference<>() { };

    private CanonicalJson() {
    }

    /**
     * Metadata as it reads back from a persisted ledger: a {@code Float} becomes the {@code Double}
     * its JSON text parses to, and long decimals lose the digits a {@code Double} cannot hold.
     * Records must be hashed and sealed over this form or a reload breaks them.
     *
     * @throws IllegalArgumentException if the metadata cannot be written as JSON
     */
    public static Map<String, Object> storedForm(Map<String, Object> metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return STORAGE_MAPPER.readValue(STORAGE_MAPPER.writeValueAsBytes(metadata), METADATA);
        } catch (IOException e) {
            throw new IllegalArgumentException("Metadata is not representable as JSON", e);
        }
    }

    /**
     * SHA-256 hex over the encoding of every field except {@code hash}.
     */
    public static String hash(LedgerRecord record) {
        return CryptoPrimitives.sha256Hex(encode(recordBody(record)));
    }

    /**
     * Every field of the record except {@code hash}.
     */
    public static ObjectNode recordBody(LedgerRecord record) {
        ObjectNode body = registrationBody(record);
        body.put("previousHash", record.previousHash());
        ArrayNode audit = body.putArray("auditEntries");
        for (AuditEntry entry : record.auditEntries()) {
            ObjectNode node = audit.addObject();
            node.put("kind", entry.kind().id());
            node.put("principal", entry.principal());
            node.set("timestamp", decimal(entry.timestamp()));
            if (entry.reason() != null) {
                node.put("reason", entry.reason());
            }
            if (entry.error() != null) {
                node.put("error", entry.error());
            }
        }
        if (record.provenanceSeal() != null) {
            body.put("provenanceSeal", record.provenanceSeal());
        }
        return body;
    }

    /**
     * Fields fixed at registration: index, timestamp, fileId, owner, authorizedUsers and metadata.
     */
    public static ObjectNode registrationBody(LedgerRecord record) {
        ObjectNode body = NODES.objectNode();
        body.put("index", record.index());
        body.set("timestamp", decimal(record.timestamp()));
        body.put("fileId", record.fileId());
        body.put("owner", record.owner());
        ArrayNode users = body.putArray("authorizedUsers");
        record.authorizedUsers().forEach(users::add);
        if (record.metadata() != null) {
            body.set("metadata", MAPPER.valueToTree(record.metadata()));
        }
        return body;
    }

    public static byte[] encode(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(normalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode canonical JSON", e);
        }
    }

    public static String encodeToString(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(normalize(node));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode canonical JSON", e);
        }
    }

    static JsonNode normalize(JsonNode node) {
        if (node == null || node.isNull()) {
            return NODES.nullNode();
        }
        if (node.isObject()) {
            Map<String, JsonNode> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                sorted.put(field.getKey(), normalize(field.getValue()));
            }
            ObjectNode out = NODES.objectNode();
            sorted.forEach(out::set);
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode();
            node.forEach(element -> out.add(normalize(element)));
            return out;
        }
        if (node.isFloatingPointNumber()) {
            return decimal(node.doubleValue());
        }
        return node;
    }

    private static JsonNode decimal(double value) {
        return NODES.numberNode(new BigDecimal(CryptoPrimitives.decimalString(value)));
    }
}
