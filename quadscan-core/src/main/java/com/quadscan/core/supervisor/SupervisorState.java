package com.quadscan.core.supervisor;

/**
 * STARTING -> RUNNING -> DRAINING -> STOPPED
 */
public enum SupervisorState {
    STARTING,
    RUNNING,
    DRAINING,
    STOPPED
}
