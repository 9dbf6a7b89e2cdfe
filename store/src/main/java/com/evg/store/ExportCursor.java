package com.evg.store;

import java.util.Objects;

/**
 * Resume point for {@link VectorStore#export}: segments committed after {@code afterVersion}.
 */
public final class ExportCursor {
    private final String repoId;
    private final long afterVersion;

    public ExportCursor(String repoId, long afterVersion) {
        this.repoId = Objects.requireNonNull(repoId, "repoId");
        if (afterVersion < 0) throw new IllegalArgumentException("afterVersion must be >= 0");
        this.afterVersion = afterVersion;
    }

    public static ExportCursor fromStart(String repoId) {
        return new ExportCursor(repoId, 0L);
    }

    public String getRepoId() { return repoId; }
    public long getAfterVersion() { return afterVersion; }

    /** Cursor that continues after {@code record}. */
    public ExportCursor after(ExportRecord record) {
        return new ExportCursor(repoId, Math.max(afterVersion, record.getCommitVersion()));
    }

    @Override
    public String toString() {
        return "ExportCursor{repo='" + repoId + "', after=" + afterVersion + '}';
    }
}
