package com.arielplatform.orchestrator.event;

public enum ControlLoopEventType {
    WARP_STARTED,
    WARP_STOPPED,
    PHASE_ADVANCED,
    PHASE_REVERTED,
    THROTTLED,
    COMPLEXITY_WARNING,
    WARP_DRIVE_ENGAGED,
    LOW_DIVERSITY,
    HEALING_COMPLETED,
    INCENTIVES_ADAPTED,
    LOOP_FAILED
}
