package com.evg.api;

import com.evg.buffer.BufferOverflow;
import com.evg.buffer.RetryBuffer;
import com.evg.buffer.RetryBufferEntry;
import com.evg.buffer.RetryBufferListener;
import com.evg.ledger.LedgerWriter;
import com.evg.ledger.VerificationReport;
import com.evg.replay.ReplayCoordinator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Micrometer meters for the buffer, the replay worker and ledger verification.
 * The store registers its own put/query/compact timers on the same registry.
 */
public final class PersistenceMetrics implements RetryBufferListener {

    private static final Logger logger = LoggerFactory.getLogger(PersistenceMetrics.class);

    private final MeterRegistry registry;

    private final Counter overflowCounter;
    private final Counter expiredCounter;
    private final Counter verifyFailures;

    public PersistenceMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");

        this.overflowCounter =
                Counter.builder("evg.buffer.overflow")
                        .description("Buffered writes evicted to make room")
                        .register(registry);
        this.expiredCounter =
                Counter.builder("evg.buffer.expired")
                        .description("Buffered writes dropped after maxAgeMs")
                        .register(registry);
        this.verifyFailures =
                Counter.builder("evg.ledger.verify.failures")
                        .description("Ledger verifications that found a broken chain")
                        .register(registry);
    }

    /* --------------------------------------------------------
     * BINDING
     * -------------------------------------------------------- */

    public void bindBuffer(RetryBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer");
        Gauge.builder("evg.buffer.size", buffer, RetryBuffer::size)
                .description("Ready and in-flight buffered writes")
                .register(registry);
        buffer.addListener(this);
    }

    public void bindReplay(ReplayCoordinator coordinator) {
        Objects.requireNonNull(coordinator, "coordinator");
        FunctionCounter.builder("evg.replay.applied", coordinator, ReplayCoordinator::totalApplied)
                .description("Buffered writes committed by replay")
                .register(registry);
        FunctionCounter.builder("evg.replay.requeued", coordinator, ReplayCoordinator::totalRequeued)
                .description("Buffered writes returned to the buffer by replay")
                .register(registry);
    }

    /* --------------------------------------------------------
     * EVENTS
     * -------------------------------------------------------- */

    @Override
    public void onOverflow(BufferOverflow overflow) {
        overflowCounter.increment();
    }

    @Override
    public void onExpired(RetryBufferEntry entry) {
        expiredCounter.increment();
    }

    /** Verifies one repository's chain and counts the failure, if any. */
    public VerificationReport verify(LedgerWriter ledger, String repoId) {
        VerificationReport report = ledger.verify(repoId);
        if (!report.isOk()) {
            verifyFailures.increment();
            logger.debug("Counted ledger verification failure for {}", repoId);
        }
        return report;
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
