package com.workq.internal;

/**
 * States of a {@link JobExecutionLoop}.
 * A cycle goes {@code IDLE -> POLLING -> CLAIMED -> RUNNING -> REPORTING -> IDLE}, or
 * {@code IDLE -> POLLING -> SLEEPING -> IDLE} when nothing is due.
 */
public enum LoopState {
    IDLE,
    POLLING,
    CLAIMED,
    RUNNING,
    REPORTING,
    SLEEPING,
    STOPPED
}
