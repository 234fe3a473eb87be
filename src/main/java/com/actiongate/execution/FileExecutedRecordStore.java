package com.actiongate.execution;

import com.actiongate.driver.ConfirmationStatus;
import com.actiongate.error.InternalInvariantException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory map mirrored to {@code <dir>/executed.json} on every write, loaded at startup.
 *
 * An unreadable file fails startup; starting empty would let an executed id broadcast again.
 */
public class FileExecutedRecordStore implements ExecutedRecordStore {

    private static final Logger log = LoggerFactory.getLogger(FileExecutedRecordStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, ExecutedRecord> records;

    public FileExecutedRecordStore(Path stateDir, ObjectMapper mapper) {
        this.file = stateDir.resolve("executed.json");
        this.mapper = mapper;
        this.records = load();
        log.info("Loaded {} executed records from {}", records.size(), file);
    }

    @Override
    public synchronized Optional<ExecutedRecord> find(String preparedId) {
        return Optional.ofNullable(records.get(preparedId));
    }

    @Override
    public synchronized void put(ExecutedRecord record) {
        if (records.containsKey(record.preparedId())) {
            throw new InternalInvariantException("executed record already exists for " + record.preparedId());
        }
        records.put(record.preparedId(), record);
        persist();
    }

    @Override
    public synchronized ExecutedRecord updateConfirmation(String preparedId, ConfirmationStatus status) {
        ExecutedRecord existing = records.get(preparedId);
        if (existing == null) {
            throw new InternalInvariantException("no executed record to confirm for " + preparedId);
        }
        ExecutedRecord updated = existing.withConfirmation(status);
        records.put(preparedId, updated);
        persist();
        return updated;
    }

    @Override
    public synchronized int size() {
        return records.size();
    }

    private Map<String, ExecutedRecord> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, ExecutedRecord> loaded = mapper.readValue(file.toFile(),
                new TypeReference<LinkedHashMap<String, ExecutedRecord>>() {});
            return loaded == null ? new LinkedHashMap<>() : loaded;
        } catch (IOException ex) {
            throw new UncheckedIOException("executed record file is unreadable: " + file, ex);
        }
    }

    private void persist() {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), "executed", ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), records);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to persist executed records " + file, ex);
        }
    }
}
