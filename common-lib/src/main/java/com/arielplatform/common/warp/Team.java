package com.arielplatform.common.warp;

import com.arielplatform.common.exception.InvalidArgumentException;

public class Team {

    public static final double DEFAULT_EFFICIENCY = 0.5;

    private final Phase phase;
    private final TeamProcessor processor;
    private boolean active;
    private double efficiency = DEFAULT_EFFICIENCY;

    public Team(Phase phase, TeamProcessor processor) {
        this.phase     = phase;
        this.processor = processor;
    }

    public String name() {
        return phase.teamName();
    }

    public Phase phase() {
        return phase;
    }

    public boolean isActive() {
        return active;
    }

    void setActive(boolean active) {
        this.active = active;
    }

    public double efficiency() {
        return efficiency;
    }

    public void setEfficiency(double efficiency) {
        if (Double.isNaN(efficiency) || efficiency < 0.0 || efficiency > 1.0) {
            throw new InvalidArgumentException("warp", "Team efficiency must be in [0,1]: " + efficiency);
        }
        this.efficiency = efficiency;
    }

    double[] process(double[] input) {
        return processor.process(input);
    }
}
