package com.autonomous.supervisor.runtime;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.Closeable;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One running runtime session: an ordered event stream plus a side control channel.
 */
public interface AgentSession extends Closeable {

    /**
     * Blocks until the next event arrives. Returns empty once the stream has
     * ended (the process exited or the session was closed); every later call
     * returns empty as well.
     */
    Optional<RuntimeEvent> nextEvent() throws InterruptedException;

    /**
     * Sends a named control request. The future completes with the response
     * payload, which may be {@code null}.
     */
    CompletableFuture<JsonNode> sendControlRequest(String subtype, Map<String, Object> payload);

    /** Session id reported by the runtime so far, or {@code null}. */
    String getSessionId();

    @Override
    void close();
}
