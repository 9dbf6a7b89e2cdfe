package com.evg.replay;

/**
 * Phases of a replay pass: {@code IDLE -> DRAINING -> COMMITTING -> (IDLE | REQUEUING)}, {@code REQUEUING -> IDLE}.
 */
public enum ReplayState {
    IDLE,
    DRAINING,
    COMMITTING,
    REQUEUING
}
