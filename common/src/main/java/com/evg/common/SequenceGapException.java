package com.evg.common;

/**
 * The ledger chain of a repository failed verification. Appends stay halted until reconciled.
 */
public class SequenceGapException extends PersistenceException {
    private static final long serialVersionUID = 1L;

    private final String repoId;
    private final long brokenSequence;

    public SequenceGapException(String repoId, long brokenSequence, String message) {
        super(message);
        this.repoId = repoId;
        this.brokenSequence = brokenSequence;
    }

    public String getRepoId() {
        return repoId;
    }

    public long getBrokenSequence() {
        return brokenSequence;
    }
}
