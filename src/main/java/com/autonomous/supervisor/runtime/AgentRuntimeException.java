package com.autonomous.supervisor.runtime;

/**
 * Raised when the external agent runtime cannot be started, a control request
 * fails, or the event stream breaks mid-run.
 */
public class AgentRuntimeException extends RuntimeException {

    public AgentRuntimeException(String message) {
        super(message);
    }

    public AgentRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
