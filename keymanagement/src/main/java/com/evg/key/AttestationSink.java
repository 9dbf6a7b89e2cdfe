package com.evg.key;

@FunctionalInterface
public interface AttestationSink {

    AttestationSink NONE = attestation -> { };

    void attest(KeyAttestation attestation);
}
