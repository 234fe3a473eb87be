package com.actiongate.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes {@link MemoryRecord}s under {@code <dir>/memory_records/}.
 */
public class MemoryRecordWriter {

    private static final Logger log = LoggerFactory.getLogger(MemoryRecordWriter.class);

    private final Path dir;
    private final ObjectMapper mapper;
    private final ArtifactHasher hasher;

    public MemoryRecordWriter(Path stateDir, ObjectMapper mapper, ArtifactHasher hasher) {
        this.dir = stateDir.resolve("memory_records");
        this.mapper = mapper;
        this.hasher = hasher;
    }

    /**
     * @param declaredInputs  what the caller asked for; hashed as the reasoning hash
     * @param artifactHashes  prepared artifact hashes in processing order
     */
    public MemoryRecord write(String runId,
                              Object declaredInputs,
                              List<String> artifactHashes,
                              Map<String, Object> policyDecision,
                              String outcome,
                              Instant ts) {
        String reasoningHash = hasher.hash(declaredInputs).hash();
        String artifactsHash = artifactsHash(artifactHashes);
        MemoryRecord record = new MemoryRecord(
            runId,
            reasoningHash,
            artifactsHash,
            policyDecision,
            outcome,
            ts.toString(),
            idempotencyKey(runId, reasoningHash, artifactsHash),
            ArtifactHash.SCHEMA_VERSION,
            ArtifactHash.HASH_ALG
        );
        Path file = dir.resolve(runId + ".json");
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, runId, ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), record);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to write memory record " + file, ex);
        }
        log.debug("Memory record written run={} outcome={}", runId, outcome);
        return record;
    }

    public Optional<MemoryRecord> load(String runId) {
        Path file = dir.resolve(runId + ".json");
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), MemoryRecord.class));
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to read memory record " + file, ex);
        }
    }

    public String artifactsHash(List<String> artifactHashes) {
        return hasher.hash(artifactHashes).hash();
    }

    public static String idempotencyKey(String runId, String reasoningHash, String artifactsHash) {
        return ArtifactHasher.sha256Hex(runId + reasoningHash + artifactsHash);
    }
}
