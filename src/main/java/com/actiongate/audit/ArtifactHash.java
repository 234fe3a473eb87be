package com.actiongate.audit;

/**
 * Hash triple attached to prepared artifacts and memory records so that third parties can
 * recompute it.
 */
public record ArtifactHash(String schemaVersion, String hashAlg, String hash) {

    public static final String SCHEMA_VERSION = "v1";
    public static final String HASH_ALG = "sha256";

    public static ArtifactHash of(String hash) {
        return new ArtifactHash(SCHEMA_VERSION, HASH_ALG, hash);
    }
}
