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
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-pool endpoint rotation state persisted in {@code <dir>/rpc_state.json}.
 */
public class FailoverStateStore {

    private static final Logger log = LoggerFactory.getLogger(FailoverStateStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final Map<String, List<String>> pools;
    private final Clock clock;
    private final Map<String, PoolState> state;

    public FailoverStateStore(Path stateDir, ObjectMapper mapper, Map<String, List<String>> pools, Clock clock) {
        this.file = stateDir.resolve("rpc_state.json");
        this.mapper = mapper;
        this.pools = pools == null ? Map.of() : Map.copyOf(pools);
        this.clock = clock;
        this.state = load();
    }

    /** Current endpoint of the pool; empty when the pool is not configured or has no endpoints. */
    public synchronized Optional<String> activeEndpoint(String pool) {
        List<String> endpoints = pool == null ? null : pools.get(pool);
        if (endpoints == null || endpoints.isEmpty()) {
            return Optional.empty();
        }
        int index = state.getOrDefault(pool, PoolState.initial()).currentIndex();
        return Optional.of(endpoints.get(Math.floorMod(index, endpoints.size())));
    }

    /**
     * Moves the pool to its next endpoint and records why. A pool without endpoints still records
     * the error.
     */
    public synchronized PoolState rotate(String pool, String reason) {
        if (pool == null) {
            return PoolState.initial();
        }
        List<String> endpoints = pools.getOrDefault(pool, List.of());
        PoolState current = state.getOrDefault(pool, PoolState.initial());
        int next = endpoints.isEmpty() ? 0 : (current.currentIndex() + 1) % endpoints.size();
        PoolState updated = new PoolState(next, clock.instant().toString(), reason);
        state.put(pool, updated);
        persist();
        if (!endpoints.isEmpty()) {
            log.warn("Rotated upstream pool={} to index={} endpoint={} reason={}",
                pool, next, endpoints.get(next), reason);
        }
        return updated;
    }

    public synchronized PoolState snapshot(String pool) {
        return state.getOrDefault(pool, PoolState.initial());
    }

    private Map<String, PoolState> load() {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        try {
            Map<String, PoolState> loaded = mapper.readValue(file.toFile(), new TypeReference<TreeMap<String, PoolState>>() {});
            return loaded == null ? new TreeMap<>() : loaded;
        } catch (IOException ex) {
            log.warn("Ignoring unreadable failover state {}: {}", file, ex.getMessage());
            return new TreeMap<>();
        }
    }

    private void persist() {
        try {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), "rpc_state", ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            throw new UncheckedIOException("failed to persist failover state " + file, ex);
        }
    }
}
