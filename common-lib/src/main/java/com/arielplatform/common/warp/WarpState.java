package com.arielplatform.common.warp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable loop state of one warp sequence. Owned by {@link WarpSystem} and mutated
 * only through {@link PhaseEngine}.
 */
public class WarpState {

    private final EnumMap<Phase, Team> teams = new EnumMap<>(Phase.class);

    private Phase phase = Phase.INIT;
    private Instant phaseStartedAt = Instant.EPOCH;
    private int complexity;
    private boolean lightSpeed;
    private boolean halted;

    public WarpState(Map<Phase, TeamProcessor> processors) {
        for (Phase p : Phase.values()) {
            teams.put(p, new Team(p, processors.getOrDefault(p, TeamProcessor.IDENTITY)));
        }
    }

    public WarpState() {
        this(Map.of());
    }

    public Phase phase() {
        return phase;
    }

    public Instant phaseStartedAt() {
        return phaseStartedAt;
    }

    public int complexity() {
        return complexity;
    }

    public boolean isLightSpeed() {
        return lightSpeed;
    }

    public boolean isHalted() {
        return halted;
    }

    public Team team(Phase p) {
        return teams.get(p);
    }

    public List<Team> teams() {
        return Collections.unmodifiableList(new ArrayList<>(teams.values()));
    }

    /** Active teams in phase order. */
    public List<Team> activeTeams() {
        return teams.values().stream().filter(Team::isActive).toList();
    }

    void setPhase(Phase phase) {
        this.phase = phase;
    }

    void resetPhaseTimer(Instant now) {
        this.phaseStartedAt = now;
    }

    void addComplexity(int delta) {
        this.complexity += delta;
    }

    void resetComplexity() {
        this.complexity = 0;
    }

    void setLightSpeed(boolean lightSpeed) {
        this.lightSpeed = lightSpeed;
    }

    void setHalted(boolean halted) {
        this.halted = halted;
    }
}
