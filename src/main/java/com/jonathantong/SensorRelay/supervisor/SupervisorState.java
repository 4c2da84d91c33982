package com.jonathantong.SensorRelay.supervisor;

/**
 * Lifecycle states of one stream supervisor run
 */
public enum SupervisorState {
    INITIALIZING,
    STREAMING,
    RETRY_BACKOFF,
    /** Retry budget exhausted; the outer restart loop takes over */
    GIVE_UP,
    /** Shutdown requested */
    STOPPED
}
