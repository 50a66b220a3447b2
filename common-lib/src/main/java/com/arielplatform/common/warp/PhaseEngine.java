package com.arielplatform.common.warp;

import java.time.Duration;
import java.time.Instant;

/**
 * One step of the warp sequence state machine. Pure apart from the {@link WarpState}
 * passed in; time and load are supplied by the caller.
 *
 * <p>Evaluation order per tick:
 * <ol>
 *   <li>halted: nothing to do</li>
 *   <li>admission control on the resource sample</li>
 *   <li>stability, once the phase has run for the check interval</li>
 *   <li>terminal engagement in {@link Phase#WARP_DRIVE}</li>
 *   <li>advancement on sustained team efficiency</li>
 * </ol>
 */
public class PhaseEngine {

    private final WarpConfig config;

    public PhaseEngine(WarpConfig config) {
        this.config = config;
    }

    public void start(WarpState state, Instant now) {
        state.setPhase(Phase.INIT);
        state.team(Phase.INIT).setActive(true);
        state.setHalted(false);
        state.resetPhaseTimer(now);
    }

    /**
     * Full reset for re-entry after the terminal state.
     */
    public void restart(WarpState state, Instant now) {
        for (Team team : state.teams()) {
            team.setActive(false);
        }
        state.setLightSpeed(false);
        state.resetComplexity();
        start(state, now);
    }

    public TickResult tick(WarpState state, ResourceSample sample, double errorRate, Instant now) {
        if (state.isHalted()) {
            return TickResult.of(TickOutcome.HALTED, state.phase());
        }

        if (sample.isOverloaded(config.cpuThreshold(), config.memoryThreshold())) {
            return TickResult.of(TickOutcome.THROTTLED, state.phase());
        }

        Duration inPhase = Duration.between(state.phaseStartedAt(), now);
        if (inPhase.compareTo(config.stabilityCheckInterval()) >= 0 && errorRate > config.maxErrorRate()) {
            revert(state, now);
            return TickResult.of(TickOutcome.REVERTED, state.phase());
        }

        if (state.phase().isTerminal()) {
            state.setLightSpeed(true);
            for (Team team : state.teams()) {
                team.setActive(true);
            }
            state.setHalted(true);
            return TickResult.of(TickOutcome.WARP_DRIVE_ENGAGED, state.phase());
        }

        Team team = state.team(state.phase());
        if (team.efficiency() >= config.efficiencyThreshold()) {
            if (inPhase.compareTo(config.sustainDuration()) >= 0) {
                boolean exceeded = advance(state, now);
                return new TickResult(TickOutcome.ADVANCED, state.phase(), exceeded);
            }
        } else {
            // efficiency dropped: the sustain window starts over
            state.resetPhaseTimer(now);
        }
        return TickResult.of(TickOutcome.IDLE, state.phase());
    }

    private boolean advance(WarpState state, Instant now) {
        Phase next = state.phase().next();
        state.setPhase(next);
        state.team(next).setActive(true);
        state.resetPhaseTimer(now);
        state.addComplexity(config.complexityStep());
        return state.complexity() > config.maxComplexity();
    }

    private void revert(WarpState state, Instant now) {
        Phase left = state.phase();
        state.resetPhaseTimer(now);
        if (left == Phase.INIT) {
            return;
        }
        state.setPhase(left.previous());
        state.team(left).setActive(false);
        state.addComplexity(-config.complexityStep());
    }
}
