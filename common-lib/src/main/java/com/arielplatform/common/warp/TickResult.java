package com.arielplatform.common.warp;

/**
 * @param outcome            what the tick did
 * @param phase              phase after the tick
 * @param complexityExceeded true when this tick pushed complexity past the configured cap
 */
public record TickResult(TickOutcome outcome, Phase phase, boolean complexityExceeded) {

    public static TickResult of(TickOutcome outcome, Phase phase) {
        return new TickResult(outcome, phase, false);
    }
}
