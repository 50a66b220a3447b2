package com.arielplatform.common.exception;

/**
 * Base runtime failure of the agent control loop.
 *
 * <p>{@link #getMessage()} is prefixed with the rejecting component for logs, e.g.
 * {@code [warp] No active teams}; {@link #getDetail()} is the bare text for API bodies,
 * which report the component separately.
 */
public class AgentException extends RuntimeException {

    private final String component;
    private final String detail;

    public AgentException(String component, String detail) {
        this(component, detail, null);
    }

    public AgentException(String component, String detail, Throwable cause) {
        super(format(component, detail), cause);
        this.component = component;
        this.detail    = detail;
    }

    public String getComponent() {
        return component;
    }

    public String getDetail() {
        return detail;
    }

    private static String format(String component, String detail) {
        return component == null ? detail : "[" + component + "] " + detail;
    }
}
