package com.evg.key;

import com.evg.common.KeyHandle;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Selects which repositories a rotation pass advances.
 */
public final class RotationSchedule {

    @FunctionalInterface
    private interface Selector {
        boolean test(KeyHandle active, long nowMillis);
    }

    private final String description;
    private final Selector selector;

    private RotationSchedule(String description, Selector selector) {
        this.description = description;
        this.selector = selector;
    }

    public static RotationSchedule all() {
        return new RotationSchedule("all", (h, now) -> true);
    }

    public static RotationSchedule forRepositories(Collection<String> repoIds) {
        Set<String> ids = Set.copyOf(Objects.requireNonNull(repoIds, "repoIds"));
        return new RotationSchedule("repos=" + ids, (h, now) -> ids.contains(h.getRepoId()));
    }

    public static RotationSchedule olderThan(Duration maxAge) {
        long ms = Objects.requireNonNull(maxAge, "maxAge").toMillis();
        if (ms <= 0) throw new IllegalArgumentException("maxAge must be positive");
        return new RotationSchedule("olderThan=" + maxAge, (h, now) -> now - h.getCreatedAt() >= ms);
    }

    public boolean selects(KeyHandle active, long nowMillis) {
        return selector.test(active, nowMillis);
    }

    @Override
    public String toString() {
        return "RotationSchedule{" + description + "}";
    }
}
