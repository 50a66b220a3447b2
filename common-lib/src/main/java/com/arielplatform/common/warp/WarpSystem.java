package com.arielplatform.common.warp;

import com.arielplatform.common.exception.AgentException;
import com.arielplatform.common.exception.InvalidArgumentException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Phase orchestrator facade: owns the {@link WarpState}, delegates progression to
 * {@link PhaseEngine} and handles per-team processing.
 *
 * <p>Not thread-safe. The host confines every call to the agent's scheduler.
 */
public class WarpSystem {

    private final PhaseEngine engine;
    private final WarpState state;
    private final TaskDiversityTracker diversity;

    public WarpSystem(WarpConfig config, Map<Phase, TeamProcessor> processors) {
        this.engine    = new PhaseEngine(config);
        this.state     = new WarpState(processors);
        this.diversity = new TaskDiversityTracker(config.diversityWindow(), config.diversityThreshold());
    }

    public WarpSystem(WarpConfig config) {
        this(config, Map.of());
    }

    public void start(Instant now) {
        engine.start(state, now);
    }

    public void restart(Instant now) {
        engine.restart(state, now);
    }

    public TickResult tick(ResourceSample sample, double errorRate, Instant now) {
        return engine.tick(state, sample, errorRate, now);
    }

    /**
     * Runs {@code input} through every active team and combines the outputs.
     * The input enters the diversity window only after all outputs were validated.
     */
    public WarpProcessResult processWithWarp(double[] input) {
        if (input == null) {
            throw new InvalidArgumentException("warp", "Input must not be null");
        }
        List<Team> active = state.activeTeams();
        if (active.isEmpty()) {
            throw new AgentException("warp", "No active teams; start the warp sequence first");
        }

        List<double[]> results = new ArrayList<>(active.size());
        for (Team team : active) {
            results.add(team.process(input.clone()));
        }
        ResultCombiner.validate(results);

        diversity.update(input);
        double[] combined = ResultCombiner.combine(results, state.isLightSpeed());
        return new WarpProcessResult(combined, active.size(), diversity.isLow());
    }

    public List<Team> activeTeams() {
        return state.activeTeams();
    }

    public void setTeamEfficiency(Phase phase, double efficiency) {
        state.team(phase).setEfficiency(efficiency);
    }

    public Phase phase() {
        return state.phase();
    }

    public boolean isLightSpeed() {
        return state.isLightSpeed();
    }

    public WarpState state() {
        return state;
    }

    public WarpStatus status() {
        return new WarpStatus(
            state.phase(),
            state.phase().level(),
            state.phaseStartedAt(),
            state.complexity(),
            state.isLightSpeed(),
            state.isHalted(),
            diversity.diversity(),
            state.teams().stream().map(TeamStatus::of).toList());
    }
}
