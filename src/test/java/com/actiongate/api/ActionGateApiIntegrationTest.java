package com.actiongate.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultMatcher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end over HTTP with the sandbox driver: prepare, confirm, execute, inspect the trace and
 * re-verify it from disk.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ActionGateApiIntegrationTest {

    private static final Path STATE_DIR;

    static {
        try {
            STATE_DIR = Files.createTempDirectory("actiongate-it");
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @DynamicPropertySource
    static void stateDir(DynamicPropertyRegistry registry) {
        registry.add("actiongate.state-dir", STATE_DIR::toString);
    }

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper mapper;

    private JsonNode postJson(String path, Object body, ResultMatcher expected) throws Exception {
        String response = mvc.perform(post(path)
                .contentType(MediaType.APPLICATION_JSON)
                .content(mapper.writeValueAsString(body)))
            .andExpect(expected)
            .andReturn().getResponse().getContentAsString();
        return mapper.readTree(response);
    }

    private JsonNode getJson(String path, ResultMatcher expected) throws Exception {
        String response = mvc.perform(get(path))
            .andExpect(expected)
            .andReturn().getResponse().getContentAsString();
        return mapper.readTree(response);
    }

    private JsonNode prepareTransfer(double amount) throws Exception {
        return postJson("/actions/prepare", Map.of(
            "adapter", "sandbox",
            "action", "transfer",
            "params", Map.of("to", "alice", "amount", amount)), status().isOk());
    }

    @Test
    @DisplayName("prepare → confirm → execute twice → artifact gone → trace verifies")
    void fullLifecycle() throws Exception {
        JsonNode prepared = prepareTransfer(10);
        assertTrue(prepared.get("allowed").asBoolean());
        String preparedId = prepared.get("preparedId").asText();
        String traceId = prepared.get("traceId").asText();

        JsonNode artifact = getJson("/artifacts/" + preparedId, status().isOk());
        assertTrue(artifact.get("hashMatches").asBoolean());
        assertEquals(prepared.get("artifactHash").get("hash").asText(), artifact.get("recomputedHash").asText());

        JsonNode approval = postJson("/actions/execute", Map.of("preparedId", preparedId),
            status().isPreconditionRequired());
        assertEquals("APPROVAL_REQUIRED", approval.get("error_code").asText());

        JsonNode first = postJson("/actions/execute", Map.of("preparedId", preparedId, "confirm", true),
            status().isOk());
        JsonNode second = postJson("/actions/execute", Map.of("preparedId", preparedId, "confirm", true),
            status().isOk());
        assertTrue(first.get("signature").asText().startsWith("sandbox_tx_"));
        assertEquals(first.get("signature"), second.get("signature"));
        assertTrue(second.get("cached").asBoolean());

        JsonNode gone = getJson("/artifacts/" + preparedId, status().isNotFound());
        assertEquals("PREPARED_NOT_FOUND_OR_EXPIRED", gone.get("error_code").asText());

        JsonNode trace = getJson("/traces/" + traceId, status().isOk());
        List<String> types = new ArrayList<>();
        trace.get("events").forEach(event -> types.add(event.get("type").asText()));
        assertTrue(types.containsAll(List.of("run.started", "tx.built", "tx.simulated", "policy.decision",
            "run.finished", "tx.submitted")));
        assertEquals(1, types.stream().filter("tx.submitted"::equals).count());

        JsonNode verified = getJson("/traces/" + traceId + "/verify", status().isOk());
        assertTrue(verified.get("ok").asBoolean(), verified::toString);
    }

    @Nested
    @DisplayName("Plans")
    class Plans {

        @Test
        void cycleIsRejectedWithItsNodes() throws Exception {
            JsonNode body = postJson("/plan/compile", Map.of("actions", List.of(
                Map.of("id", "a", "dependsOn", List.of("b"), "adapter", "sandbox", "action", "noop"),
                Map.of("id", "b", "dependsOn", List.of("a"), "adapter", "sandbox", "action", "noop"))),
                status().isBadRequest());

            assertEquals("PLAN_CYCLE", body.get("error_code").asText());
            assertEquals(2, body.get("cycle").size());
        }

        @Test
        void compileReportsPerNodeResults() throws Exception {
            JsonNode body = postJson("/plan/compile", Map.of("network", "devnet", "actions", List.of(
                Map.of("id", "q", "adapter", "sandbox", "action", "noop"),
                Map.of("id", "x", "dependsOn", List.of("q"), "adapter", "sandbox", "action", "transfer",
                    "params", Map.of("amount", 1)))),
                status().isOk());

            assertEquals(List.of("q", "x"), List.of(body.at("/order/0").asText(), body.at("/order/1").asText()));
            assertEquals("prepared", body.at("/results/0/state").asText());
            assertEquals("failed", body.at("/results/1/state").asText());
            assertEquals("BUILD_ERROR", body.at("/results/1/error/code").asText());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void unknownPreparedIdIsNotFound() throws Exception {
            postJson("/actions/execute", Map.of("preparedId", "prep_unknown", "confirm", true),
                status().isNotFound());
        }

        @Test
        void unknownAdapterIsBadRequest() throws Exception {
            JsonNode body = postJson("/actions/prepare", Map.of("adapter", "nope", "action", "swap"),
                status().isBadRequest());
            assertEquals("UNKNOWN_ADAPTER", body.get("error_code").asText());
        }

        @Test
        void unknownTraceIsNotFound() throws Exception {
            mvc.perform(get("/traces/run_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("TRACE_NOT_FOUND"));
        }

        @Test
        void malformedBodyIsBadRequest() throws Exception {
            mvc.perform(post("/actions/prepare").contentType(MediaType.APPLICATION_JSON).content("{oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
        }
    }

    @Test
    void excessiveSlippageIsBlockedAtPrepare() throws Exception {
        JsonNode body = postJson("/actions/prepare", Map.of(
            "adapter", "sandbox",
            "action", "swap",
            "params", Map.of("inputMint", "SOL", "outputMint", "USDC", "amount", 1, "slippageBps", 500)),
            status().isOk());

        assertFalse(body.get("allowed").asBoolean());
        assertFalse(body.has("preparedId"));
        assertEquals("SLIPPAGE_EXCEEDED", body.at("/policyReport/code").asText());
    }

    @Test
    void policyDecideIsSideEffectFree() throws Exception {
        mvc.perform(post("/policy/decide").contentType(MediaType.APPLICATION_JSON)
                .content("{\"chain\":\"sandbox\",\"network\":\"mainnet\",\"action\":\"swap\","
                    + "\"sideEffect\":\"broadcast\",\"simulationOk\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.decision").value("block"))
            .andExpect(jsonPath("$.code").value("SIMULATION_REQUIRED"));
    }

    @Test
    void capabilitiesHealthAndAudit() throws Exception {
        prepareTransfer(1);

        mvc.perform(get("/actions"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sandbox.chain").value("sandbox"));
        mvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
        JsonNode audit = getJson("/audit/report", status().isOk());
        assertTrue(audit.get("runs").asInt() >= 1);
        JsonNode traces = getJson("/traces?limit=5", status().isOk());
        assertTrue(traces.get("traces").size() >= 1);
    }
}
