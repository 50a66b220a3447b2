package com.arielplatform.common.exception;

/**
 * Index outside the bounds of a collaborator (e.g. a memory slot).
 */
public class OutOfRangeException extends AgentException {
    private final int index;

    public OutOfRangeException(String component, int index, int size) {
        super(component, "Index " + index + " out of range [0, " + (size - 1) + "]");
        this.index = index;
    }

    public int getIndex() {
        return index;
    }
}
