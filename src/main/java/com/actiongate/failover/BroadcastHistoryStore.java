package com.actiongate.failover;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded history of successful broadcasts persisted in
 * {@code <dir>/policy_broadcast_history.json}. Independent of any upstream's own limits.
 */
public class BroadcastHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHistoryStore.class);

    static final int MAX_ENTRIES = 1000;
    static final Duration RETENTION = Duration.ofHours(24);

    private final Path file;
    private final ObjectMapper mapper;
    private final List<Entry> entries;

    public BroadcastHistoryStore(Path stateDir, ObjectMapper mapper) {
        this.file = stateDir.resolve("policy_broadcast_history.json");
        this.mapper = mapper;
        this.entries = load();
    }

    /**
     * @param ts     epoch millis of the broadcast
     * @param amount null when the action carried no amount
     */
    public record Entry(long ts, Double amount) {}

    public synchronized void record(Instant at, Double amount) {
        entries.add(new Entry(at.toEpochMilli(), amount));
        prune(at);
        persist();
    }

    public synchronized BroadcastSignals signals(Instant now) {
        long nowMs = now.toEpochMilli();
        long minuteAgo = nowMs - 60_000L;
        long dayAgo = nowMs - RETENTION.toMillis();
        Long last = null;
        int lastMinute = 0;
        double volume = 0.0;
        for (Entry e : entries) {
            if (e.ts() < dayAgo || e.ts() > nowMs) {
                continue;
            }
            if (last == null || e.ts() > last) {
                last = e.ts();
            }
            if (e.ts() >= minuteAgo) {
                lastMinute++;
            }
            if (e.amount() != null) {
                volume += e.amount();
            }
        }
        Double since = last == null ? null : (nowMs - last) / 1000.0;
        return new BroadcastSignals(since, lastMinute, volume);
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    private void prune(Instant now) {
        long cutoff = now.toEpochMilli() - RETENTION.toMillis();
        entries.removeIf(e -> e.ts() < cutoff);
        while (entries.size() > MAX_ENTRIES) {
            entries.remove(0);
        }
    }

    private List<Entry> load() {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        try {
            List<Entry> loaded = mapper.readValue(file.toFile(), new TypeReference<List<Entry>>() {});
            return loaded == null ? new ArrayList<>() : new ArrayList<>(loaded);
        } catch (IOException ex) {
            log.warn("Ignoring unreadable broadcast history {}: {}", file, ex.getMessage());
            return new ArrayList<>();
        }
    }

    private void persist() {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), "policy_broadcast_history", ".tmp");
            mapper.writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to persist broadcast history " + file, ex);
        }
    }
}
