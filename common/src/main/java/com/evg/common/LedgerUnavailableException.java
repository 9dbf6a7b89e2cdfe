package com.evg.common;

/**
 * The ledger store rejected an append. Nothing was recorded and the chain head did not move.
 */
public class LedgerUnavailableException extends TransientIOException {
    private static final long serialVersionUID = 1L;

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
