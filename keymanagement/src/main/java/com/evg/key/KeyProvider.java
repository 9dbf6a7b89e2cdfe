package com.evg.key;

import javax.crypto.SecretKey;
import java.io.IOException;

/**
 * Opaque source of raw key material.
 * Implementations must return the same material for the same (repoId, epoch) across restarts,
 * since the registry persists only handle metadata.
 */
public interface KeyProvider {

    SecretKey materialFor(String repoId, long epoch) throws IOException;
}
