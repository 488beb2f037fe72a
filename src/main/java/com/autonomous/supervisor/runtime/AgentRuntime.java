package com.autonomous.supervisor.runtime;

/**
 * Starts sessions of the external agent runtime. Implementations are expected
 * to return a live session whose event stream can be consumed immediately.
 */
public interface AgentRuntime {

    AgentSession start(RuntimeOptions options);
}
