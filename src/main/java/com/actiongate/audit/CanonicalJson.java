package com.actiongate.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.POJONode;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;

/**
 * Deterministic JSON serialization used as hashing input.
 *
 * <ul>
 *   <li>object keys sorted lexicographically, array order preserved</li>
 *   <li>{@code null} object members dropped, {@code null} array elements kept</li>
 *   <li>integers outside the IEEE-754 safe range rendered as decimal strings</li>
 *   <li>integral floating point values rendered without a fraction, non-finite ones as {@code null}</li>
 *   <li>binary rendered as base64, no whitespace anywhere</li>
 * </ul>
 */
public class CanonicalJson {

    static final long MAX_SAFE_INTEGER = 9_007_199_254_740_991L;

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final BigDecimal MAX_SAFE = BigDecimal.valueOf(MAX_SAFE_INTEGER);

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public CanonicalJson(ObjectMapper mapper) {
        this.mapper = mapper;
        this.writer = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Converts any Jackson-serializable value into its canonical tree. The result serializes to
     * the canonical text with a plain {@link ObjectMapper} and reads back to an equal tree.
     */
    public JsonNode normalize(Object value) {
        JsonNode tree = value instanceof JsonNode node ? node : mapper.valueToTree(value);
        return canonical(tree);
    }

    public String toCanonicalString(Object value) {
        try {
            return writer.writeValueAsString(normalize(value));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("canonical serialization failed", ex);
        }
    }

    private JsonNode canonical(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NODES.nullNode();
        }
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            names.sort(null);
            ObjectNode out = NODES.objectNode();
            for (String name : names) {
                JsonNode child = node.get(name);
                if (child == null || child.isNull() || child.isMissingNode()) {
                    continue;
                }
                out.set(name, canonical(child));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode();
            for (JsonNode child : node) {
                out.add(canonical(child));
            }
            return out;
        }
        if (node.isBinary()) {
            try {
                return NODES.textNode(Base64.getEncoder().encodeToString(node.binaryValue()));
            } catch (IOException ex) {
                throw new IllegalStateException("unreadable binary node", ex);
            }
        }
        if (node.isIntegralNumber()) {
            return integral(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return decimal(node);
        }
        if (node.isPojo()) {
            return canonical(mapper.valueToTree(((POJONode) node).getPojo()));
        }
        return node;
    }

    private static JsonNode integral(BigInteger value) {
        if (value.abs().compareTo(BigInteger.valueOf(MAX_SAFE_INTEGER)) > 0) {
            return NODES.textNode(value.toString());
        }
        return NODES.numberNode(value.longValue());
    }

    private static JsonNode decimal(JsonNode node) {
        if (node.isBigDecimal()) {
            BigDecimal value = node.decimalValue().stripTrailingZeros();
            if (value.scale() <= 0) {
                return value.abs().compareTo(MAX_SAFE) > 0
                    ? NODES.textNode(value.toBigIntegerExact().toString())
                    : NODES.numberNode(value.longValueExact());
            }
            return NODES.numberNode(value.doubleValue());
        }
        double value = node.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return NODES.nullNode();
        }
        if (value == Math.rint(value) && Math.abs(value) <= MAX_SAFE_INTEGER) {
            return NODES.numberNode((long) value);
        }
        return NODES.numberNode(value);
    }
}
