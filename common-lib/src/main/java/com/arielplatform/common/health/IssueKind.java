package com.arielplatform.common.health;

public enum IssueKind {
    CRITICAL("critical_"),
    RECURRING("recurring_");

    private final String prefix;

    IssueKind(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
