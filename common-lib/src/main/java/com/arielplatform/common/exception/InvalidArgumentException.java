package com.arielplatform.common.exception;

/**
 * Unknown emotion, incentive category or malformed input. Always raised
 * before any state is mutated.
 */
public class InvalidArgumentException extends AgentException {

    public InvalidArgumentException(String component, String message) {
        super(component, message);
    }
}
