package com.evg.common;

/**
 * The envelope was opened under the wrong scope ({@code repoId:keyId}).
 */
public class AadMismatchException extends DecryptException {
    private static final long serialVersionUID = 1L;

    private final String expectedScope;
    private final String suppliedScope;

    public AadMismatchException(String keyId, String expectedScope, String suppliedScope) {
        super(keyId, "AAD scope mismatch: envelope bound to " + expectedScope + ", opened as " + suppliedScope);
        this.expectedScope = expectedScope;
        this.suppliedScope = suppliedScope;
    }

    public String getExpectedScope() {
        return expectedScope;
    }

    public String getSuppliedScope() {
        return suppliedScope;
    }
}
