package com.actiongate.execution;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPreparedArtifactStore implements PreparedArtifactStore {

    private final ConcurrentHashMap<String, PreparedArtifact> artifacts = new ConcurrentHashMap<>();

    @Override
    public void put(PreparedArtifact artifact) {
        if (artifacts.putIfAbsent(artifact.preparedId(), artifact) != null) {
            throw new IllegalStateException("prepared id collision: " + artifact.preparedId());
        }
    }

    @Override
    public Optional<PreparedArtifact> get(String preparedId) {
        return preparedId == null ? Optional.empty() : Optional.ofNullable(artifacts.get(preparedId));
    }

    @Override
    public void remove(String preparedId) {
        if (preparedId != null) {
            artifacts.remove(preparedId);
        }
    }

    @Override
    public int sweepExpired(Instant now) {
        int before = artifacts.size();
        artifacts.values().removeIf(a -> a.isExpired(now));
        return Math.max(0, before - artifacts.size());
    }

    @Override
    public int size() {
        return artifacts.size();
    }
}
