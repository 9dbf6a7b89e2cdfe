package com.evg.key;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one rotation pass. A non-empty {@code failed} map is a partial rotation:
 * the listed repositories keep their previous key and may be retried.
 */
public final class RotationReport {
    private final List<String> succeeded;
    private final Map<String, String> failed;
    private final long startedAt;
    private final long finishedAt;

    public RotationReport(List<String> succeeded, Map<String, String> failed, long startedAt, long finishedAt) {
        this.succeeded = List.copyOf(succeeded);
        this.failed = Map.copyOf(failed);
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public List<String> getSucceeded() { return succeeded; }
    public Map<String, String> getFailed() { return failed; }
    public long getStartedAt() { return startedAt; }
    public long getFinishedAt() { return finishedAt; }

    public boolean isPartial() {
        return !failed.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("RotationReport{succeeded=%s, failed=%s, tookMs=%d}",
                succeeded, failed.keySet(), finishedAt - startedAt);
    }
}
