package com.actiongate.execution;

import com.actiongate.driver.ConfirmationStatus;
import com.actiongate.error.InternalInvariantException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileExecutedRecordStoreTest {

    @TempDir
    Path stateDir;

    private final ObjectMapper mapper = new ObjectMapper();

    private static ExecutedRecord record(String preparedId) {
        return new ExecutedRecord(preparedId, "sig-" + preparedId, "2026-01-10T12:00:00Z", "run_1",
            "testchain", "scripted", "swap", null);
    }

    @Test
    void recordsSurviveRestart() {
        FileExecutedRecordStore store = new FileExecutedRecordStore(stateDir, mapper);
        store.put(record("p1"));
        store.updateConfirmation("p1", ConfirmationStatus.CONFIRMED);
        store.put(record("p2"));

        FileExecutedRecordStore reloaded = new FileExecutedRecordStore(stateDir, mapper);

        assertEquals(2, reloaded.size());
        assertEquals("sig-p1", reloaded.find("p1").orElseThrow().receiptId());
        assertEquals(ConfirmationStatus.CONFIRMED, reloaded.find("p1").orElseThrow().confirmationStatus());
        assertNull(reloaded.find("p2").orElseThrow().confirmationStatus());
    }

    @Test
    void secondRecordForSameIdIsRefused() {
        FileExecutedRecordStore store = new FileExecutedRecordStore(stateDir, mapper);
        store.put(record("p1"));

        assertThrows(InternalInvariantException.class, () -> store.put(record("p1")));
        assertEquals(1, store.size());
    }

    @Test
    void confirmingUnknownIdIsAnInvariantViolation() {
        FileExecutedRecordStore store = new FileExecutedRecordStore(stateDir, mapper);
        assertThrows(InternalInvariantException.class,
            () -> store.updateConfirmation("missing", ConfirmationStatus.FAILED));
    }

    @Test
    void corruptFileFailsStartup() throws Exception {
        Files.writeString(stateDir.resolve("executed.json"), "{not json");

        assertThrows(UncheckedIOException.class, () -> new FileExecutedRecordStore(stateDir, mapper));
    }
}
