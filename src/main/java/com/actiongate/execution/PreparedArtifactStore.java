package com.actiongate.execution;

import java.time.Instant;
import java.util.Optional;

public interface PreparedArtifactStore {

    void put(PreparedArtifact artifact);

    Optional<PreparedArtifact> get(String preparedId);

    void remove(String preparedId);

    /** @return number of artifacts removed */
    int sweepExpired(Instant now);

    int size();
}
