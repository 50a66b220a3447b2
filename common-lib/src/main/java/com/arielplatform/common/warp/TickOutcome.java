package com.arielplatform.common.warp;

public enum TickOutcome {
    /** Host overloaded; nothing evaluated. */
    THROTTLED,
    /** Stability check failed; phase stepped back. */
    REVERTED,
    ADVANCED,
    /** Terminal state reached on this tick. */
    WARP_DRIVE_ENGAGED,
    IDLE,
    /** Terminal state already engaged; nothing changed. */
    HALTED
}
