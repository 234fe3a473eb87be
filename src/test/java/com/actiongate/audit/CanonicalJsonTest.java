package com.actiongate.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalJsonTest {

    record Sample(String zeta, int alpha) {}

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();
    private final CanonicalJson canonical = new CanonicalJson(mapper);
    private final ArtifactHasher hasher = new ArtifactHasher(canonical);

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        void keyInsertionOrderDoesNotMatter() {
            Map<String, Object> a = new LinkedHashMap<>();
            a.put("b", 1);
            a.put("a", Map.of("z", true, "y", "text"));
            Map<String, Object> b = new TreeMap<>();
            b.put("a", new TreeMap<>(Map.of("y", "text", "z", true)));
            b.put("b", 1);

            assertEquals(canonical.toCanonicalString(a), canonical.toCanonicalString(b));
            assertEquals(hasher.hash(a), hasher.hash(b));
            assertEquals("{\"a\":{\"y\":\"text\",\"z\":true},\"b\":1}", canonical.toCanonicalString(a));
        }

        @Test
        void arrayOrderIsPreserved() {
            assertNotEquals(hasher.hash(List.of(1, 2)).hash(), hasher.hash(List.of(2, 1)).hash());
        }

        @Test
        void serializedTreeReadsBackEqual() throws Exception {
            Map<String, Object> value = new HashMap<>();
            value.put("amount", 12.5);
            value.put("ids", List.of("x", "y"));
            value.put("nested", Map.of("k", 3));
            String text = canonical.toCanonicalString(value);
            JsonNode reread = mapper.readTree(text);

            assertEquals(canonical.normalize(value), reread);
            assertEquals(hasher.hash(value), hasher.hash(reread));
        }

        @Test
        void hashIsLowercaseSha256Hex() {
            ArtifactHash hash = hasher.hash(Map.of("k", "v"));
            assertEquals(ArtifactHash.SCHEMA_VERSION, hash.schemaVersion());
            assertEquals(ArtifactHash.HASH_ALG, hash.hashAlg());
            assertTrue(hash.hash().matches("[0-9a-f]{64}"));
            assertEquals(ArtifactHasher.sha256Hex("{\"k\":\"v\"}"), hash.hash());
        }
    }

    @Nested
    @DisplayName("Value normalization")
    class Values {

        @Test
        void nullMembersAreDroppedButNullElementsKept() {
            Map<String, Object> value = new LinkedHashMap<>();
            value.put("present", "x");
            value.put("absent", null);
            value.put("list", Arrays.asList("a", null));
            assertEquals("{\"list\":[\"a\",null],\"present\":\"x\"}", canonical.toCanonicalString(value));
        }

        @Test
        void integersBeyondSafeRangeBecomeStrings() {
            long unsafe = CanonicalJson.MAX_SAFE_INTEGER + 2;
            Map<String, Object> value = Map.of(
                "safe", CanonicalJson.MAX_SAFE_INTEGER,
                "unsafe", unsafe,
                "huge", new BigInteger("123456789012345678901234567890"));
            JsonNode node = canonical.normalize(value);
            assertTrue(node.get("safe").isIntegralNumber());
            assertEquals(String.valueOf(unsafe), node.get("unsafe").asText());
            assertTrue(node.get("unsafe").isTextual());
            assertEquals("123456789012345678901234567890", node.get("huge").asText());
        }

        @Test
        void integralDoublesLoseTheirFraction() {
            assertEquals("{\"a\":1,\"b\":1.5}", canonical.toCanonicalString(Map.of("a", 1.0, "b", 1.5)));
            assertEquals(hasher.hash(Map.of("n", 2)), hasher.hash(Map.of("n", 2.0)));
        }

        @Test
        void nonFiniteNumbersBecomeNullElements() {
            List<Object> value = new ArrayList<>();
            value.add(Double.NaN);
            value.add(Double.POSITIVE_INFINITY);
            assertEquals("[null,null]", canonical.toCanonicalString(value));
        }

        @Test
        void binaryIsBase64() {
            assertEquals("{\"b\":\"AQID\"}", canonical.toCanonicalString(Map.of("b", new byte[]{1, 2, 3})));
        }

        @Test
        void recordsAreSortedByFieldName() {
            assertEquals("{\"alpha\":7,\"zeta\":\"z\"}", canonical.toCanonicalString(new Sample("z", 7)));
        }
    }
}
