package com.actiongate.api;

import com.actiongate.audit.ArtifactHasher;
import com.actiongate.error.NotFoundOrExpiredException;
import com.actiongate.execution.PreparedArtifact;
import com.actiongate.execution.PreparedArtifactStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical view of a prepared artifact with its hash recomputed on read. Signer references are
 * never part of an artifact.
 */
@RestController
@RequestMapping("/artifacts")
public class ArtifactController {

    private final PreparedArtifactStore preparedStore;
    private final ArtifactHasher hasher;
    private final Clock clock;

    public ArtifactController(PreparedArtifactStore preparedStore, ArtifactHasher hasher, Clock clock) {
        this.preparedStore = preparedStore;
        this.hasher = hasher;
        this.clock = clock;
    }

    @GetMapping("/{preparedId}")
    public Map<String, Object> get(@PathVariable String preparedId) {
        PreparedArtifact artifact = preparedStore.get(preparedId)
            .filter(a -> !a.isExpired(clock.instant()))
            .orElseThrow(() -> new NotFoundOrExpiredException(preparedId));
        Map<String, Object> hashInput = artifact.hashInput();
        String recomputed = hasher.hash(hashInput).hash();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("preparedId", artifact.preparedId());
        body.put("createdAt", artifact.createdAt().toString());
        body.put("expiresAt", artifact.expiresAt().toString());
        body.put("network", artifact.network());
        body.put("artifact", hasher.canonicalJson().normalize(hashInput));
        body.put("artifactHash", artifact.artifactHash());
        body.put("recomputedHash", recomputed);
        body.put("hashMatches", recomputed.equals(artifact.artifactHash().hash()));
        return body;
    }
}
