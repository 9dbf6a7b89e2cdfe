package com.evg.ledger;

import java.util.List;

/**
 * Result of walking one repository's chain from genesis.
 * When {@code ok} is false, {@code firstBrokenSequence} is the first sequence that failed and
 * {@code untrustedSequences} lists every stored sequence after it.
 */
public final class VerificationReport {

    public enum Reason { SEQUENCE_GAP, HASH_PREV_MISMATCH, HASH_SELF_MISMATCH, HEAD_MISMATCH }

    private final String repoId;
    private final boolean ok;
    private final int entriesChecked;
    private final long firstBrokenSequence;
    private final List<Long> untrustedSequences;
    private final Reason reason;

    private VerificationReport(String repoId, boolean ok, int entriesChecked, long firstBrokenSequence,
                               List<Long> untrustedSequences, Reason reason) {
        this.repoId = repoId;
        this.ok = ok;
        this.entriesChecked = entriesChecked;
        this.firstBrokenSequence = firstBrokenSequence;
        this.untrustedSequences = List.copyOf(untrustedSequences);
        this.reason = reason;
    }

    static VerificationReport intact(String repoId, int entriesChecked) {
        return new VerificationReport(repoId, true, entriesChecked, -1L, List.of(), null);
    }

    static VerificationReport broken(String repoId, int entriesChecked, long firstBrokenSequence,
                                     List<Long> untrusted, Reason reason) {
        return new VerificationReport(repoId, false, entriesChecked, firstBrokenSequence, untrusted, reason);
    }

    public String getRepoId() { return repoId; }
    public boolean isOk() { return ok; }
    public int getEntriesChecked() { return entriesChecked; }
    /** -1 when the chain is intact. */
    public long getFirstBrokenSequence() { return firstBrokenSequence; }
    public List<Long> getUntrustedSequences() { return untrustedSequences; }
    /** null when the chain is intact. */
    public Reason getReason() { return reason; }

    @Override
    public String toString() {
        return ok
                ? String.format("VerificationReport{repo=%s, ok, checked=%d}", repoId, entriesChecked)
                : String.format("VerificationReport{repo=%s, broken at %d (%s), untrusted=%d}",
                        repoId, firstBrokenSequence, reason, untrustedSequences.size());
    }
}
