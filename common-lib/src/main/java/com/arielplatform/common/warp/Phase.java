package com.arielplatform.common.warp;

import com.arielplatform.common.exception.InvalidArgumentException;

/**
 * Stages of the warp sequence, in advancement order. Each phase owns one team.
 */
public enum Phase {

    INIT(1, "Initialization"),
    COHESION(2, "Capturing Cohesion"),
    ADVERSARIAL_CORTEX(3, "Adversarial Cortex"),
    HYPER_COMPRESSION(4, "Secondary Hyper-Compression"),
    WARP_DRIVE(5, "Warp Drive");

    private final int level;
    private final String teamName;

    Phase(int level, String teamName) {
        this.level    = level;
        this.teamName = teamName;
    }

    public int level() {
        return level;
    }

    public String teamName() {
        return teamName;
    }

    public boolean isTerminal() {
        return this == WARP_DRIVE;
    }

    /** Next phase; the terminal phase returns itself. */
    public Phase next() {
        return isTerminal() ? this : values()[ordinal() + 1];
    }

    /** Previous phase; {@link #INIT} returns itself. */
    public Phase previous() {
        return this == INIT ? this : values()[ordinal() - 1];
    }

    public static Phase fromLevel(int level) {
        for (Phase p : values()) {
            if (p.level == level) return p;
        }
        throw new InvalidArgumentException("warp", "Phase level must be in [1,5]: " + level);
    }

    public static Phase fromName(String name) {
        if (name != null) {
            for (Phase p : values()) {
                if (p.name().equalsIgnoreCase(name)) return p;
            }
            if (name.trim().matches("\\d{1,2}")) {
                return fromLevel(Integer.parseInt(name.trim()));
            }
        }
        throw new InvalidArgumentException("warp", "Unknown phase: " + name);
    }
}
