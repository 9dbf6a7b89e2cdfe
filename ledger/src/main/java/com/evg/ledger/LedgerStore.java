package com.evg.ledger;

import com.evg.common.LedgerEntry;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable backing of the hash-chained ledger.
 * {@link #append(LedgerEntry)} must record the entry and move the repository's head in one atomic step:
 * after a failure neither is visible.
 */
public interface LedgerStore extends AutoCloseable {

    Optional<LedgerEntry> head(String repoId) throws IOException;

    void append(LedgerEntry entry) throws IOException;

    /** Entries of one repository in ascending sequence order. */
    List<LedgerEntry> read(String repoId) throws IOException;

    Set<String> repositories() throws IOException;

    @Override
    void close();
}
