package com.actiongate.audit;

import com.actiongate.error.RunNotFoundException;
import com.actiongate.plan.ActionNode;
import com.actiongate.plan.CompileResult;
import com.actiongate.plan.NodeResult;
import com.actiongate.plan.Plan;
import com.actiongate.testing.GateFixture;
import com.actiongate.testing.ScriptedDriver;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReplayVerifierTest {

    @TempDir
    Path stateDir;

    private GateFixture gate;

    @BeforeEach
    void setUp() {
        gate = new GateFixture(stateDir, GateFixture.permissivePolicy(), new ScriptedDriver());
    }

    @AfterEach
    void tearDown() {
        gate.close();
    }

    private CompileResult compileTwoSteps() {
        Plan plan = new Plan(List.of(
            new ActionNode("q", List.of(), null, ScriptedDriver.ID, "quote", Map.of("pair", "A/B")),
            new ActionNode("s", List.of("q"), null, ScriptedDriver.ID, "swap", Map.of("amount", 5, "slippageBps", 30))
        ), null);
        CompileResult result = gate.compiler.compile(plan);
        assertTrue(result.allOk());
        return result;
    }

    @Test
    @DisplayName("untouched run verifies from the log and artifact files alone")
    void untouchedRunVerifies() {
        CompileResult result = compileTwoSteps();

        ReplayReport report = gate.replayVerifier.verify(result.traceId());

        assertTrue(report.ok(), () -> "mismatches: " + report.mismatches());
        // reasoning hash, two artifacts, artifacts hash, idempotency key
        assertEquals(5, report.checked());
    }

    @Test
    void memoryRecordMatchesRun() {
        CompileResult result = compileTwoSteps();

        MemoryRecord record = gate.memoryRecords.load(result.traceId()).orElseThrow();

        assertEquals(result.traceId(), record.runId());
        assertEquals("prepared", record.outcome());
        assertEquals(ArtifactHash.HASH_ALG, record.hashAlg());
        List<String> hashes = result.results().stream().map(r -> r.artifactHash().hash()).toList();
        assertEquals(gate.memoryRecords.artifactsHash(hashes), record.artifactsHash());
        assertEquals(MemoryRecordWriter.idempotencyKey(record.runId(), record.reasoningHash(), record.artifactsHash()),
            record.idempotencyKey());
    }

    @Test
    @DisplayName("editing a prepared artifact file is detected")
    void tamperedArtifactIsDetected() throws Exception {
        CompileResult result = compileTwoSteps();
        NodeResult swap = result.results().get(1);
        Path file = stateDir.resolve("runs").resolve(result.traceId())
            .resolve("artifacts").resolve("prepared-" + swap.preparedId() + ".json");
        ObjectNode snapshot = (ObjectNode) gate.mapper.readTree(file.toFile());
        ((ObjectNode) snapshot.path("hashInput").path("params")).put("amount", 5000);
        gate.mapper.writeValue(file.toFile(), snapshot);

        ReplayReport report = gate.replayVerifier.verify(result.traceId());

        assertFalse(report.ok());
        assertTrue(report.mismatches().stream().anyMatch(m -> m.startsWith("artifact " + swap.preparedId())));
        assertTrue(report.mismatches().stream().anyMatch(m -> m.startsWith("artifacts_hash")));
    }

    @Test
    void deletedArtifactIsReported() throws Exception {
        CompileResult result = compileTwoSteps();
        NodeResult quote = result.results().get(0);
        Files.delete(stateDir.resolve("runs").resolve(result.traceId())
            .resolve("artifacts").resolve("prepared-" + quote.preparedId() + ".json"));

        ReplayReport report = gate.replayVerifier.verify(result.traceId());

        assertFalse(report.ok());
        assertTrue(report.mismatches().contains("artifact missing for preparedId=" + quote.preparedId()));
    }

    @Test
    void editedMemoryRecordIsDetected() throws Exception {
        CompileResult result = compileTwoSteps();
        Path file = stateDir.resolve("memory_records").resolve(result.traceId() + ".json");
        ObjectNode record = (ObjectNode) gate.mapper.readTree(file.toFile());
        record.put("idempotency_key", "0".repeat(64));
        gate.mapper.writeValue(file.toFile(), record);

        ReplayReport report = gate.replayVerifier.verify(result.traceId());

        assertFalse(report.ok());
        assertTrue(report.mismatches().stream().anyMatch(m -> m.startsWith("idempotency_key")));
    }

    @Test
    void unknownRunIsNotFound() {
        assertThrows(RunNotFoundException.class, () -> gate.replayVerifier.verify("run_missing"));
    }
}
