package com.autonomous.supervisor.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A live runtime process speaking newline-delimited JSON over stdio.
 *
 * <p>Stdout lines of type {@code control_response} complete the matching
 * pending control request by {@code request_id}; every other line becomes a
 * {@link RuntimeEvent}. Stderr is drained to the debug log.
 */
@Slf4j
class ClaudeCodeSession implements AgentSession {

    private static final RuntimeEvent END_OF_STREAM = new RuntimeEvent();

    private final String label;
    private final Process process;
    private final ObjectMapper objectMapper;
    private final long controlTimeoutSeconds;
    private final BufferedWriter writer;

    private final BlockingQueue<RuntimeEvent> events = new LinkedBlockingQueue<>();
    private final Map<String, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicInteger nextRequestId = new AtomicInteger(1);

    private volatile boolean running = true;
    private volatile String sessionId;

    ClaudeCodeSession(String label, Process process, ObjectMapper objectMapper, long controlTimeoutSeconds) {
        this.label = label;
        this.process = process;
        this.objectMapper = objectMapper;
        this.controlTimeoutSeconds = controlTimeoutSeconds;
        this.writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    void begin(String prompt) {
        Thread readerThread = new Thread(this::readLoop, "runtime-reader-" + label);
        readerThread.setDaemon(true);
        readerThread.start();

        Thread stderrThread = new Thread(this::stderrDrain, "runtime-stderr-" + label);
        stderrThread.setDaemon(true);
        stderrThread.start();

        if (prompt != null) {
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("role", "user");
            message.put("content", prompt);
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("type", "user");
            envelope.put("message", message);
            try {
                writeLine(envelope);
            } catch (IOException e) {
                close();
                throw new AgentRuntimeException("Failed to send prompt to runtime: " + e.getMessage(), e);
            }
        }
    }

    @Override
    public Optional<RuntimeEvent> nextEvent() throws InterruptedException {
        RuntimeEvent event = events.take();
        if (event == END_OF_STREAM) {
            events.offer(END_OF_STREAM);
            return Optional.empty();
        }
        return Optional.of(event);
    }

    @Override
    public CompletableFuture<JsonNode> sendControlRequest(String subtype, Map<String, Object> payload) {
        String requestId = "req_" + nextRequestId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
            .orTimeout(controlTimeoutSeconds, TimeUnit.SECONDS)
            .whenComplete((result, ex) -> pendingRequests.remove(requestId));
        pendingRequests.put(requestId, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("subtype", subtype);
        if (payload != null) {
            request.putAll(payload);
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put("type", "control_request");
        envelope.put("request_id", requestId);
        envelope.put("request", request);

        try {
            writeLine(envelope);
        } catch (IOException e) {
            pendingRequests.remove(requestId);
            future.completeExceptionally(new AgentRuntimeException("Control request " + subtype + " failed", e));
        }
        return future;
    }

    @Override
    public String getSessionId() {
        return sessionId;
    }

    private void writeLine(Object message) throws IOException {
        String json = objectMapper.writeValueAsString(message);
        log.debug("[runtime:{}] -> {}", label, json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                try {
                    dispatch(objectMapper.readTree(line));
                } catch (JsonProcessingException e) {
                    log.debug("[runtime:{}] Ignoring non-JSON output: {}", label, line);
                }
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[runtime:{}] Reader error: {}", label, e.getMessage());
            }
        } finally {
            for (CompletableFuture<JsonNode> pending : pendingRequests.values()) {
                pending.completeExceptionally(new AgentRuntimeException("Runtime process closed"));
            }
            pendingRequests.clear();
            events.offer(END_OF_STREAM);
        }
    }

    private void dispatch(JsonNode message) {
        String type = message.path("type").asText("");
        if ("control_response".equals(type)) {
            completeControlRequest(message.path("response"));
            return;
        }
        if ("control_request".equals(type) || "keep_alive".equals(type)) {
            log.debug("[runtime:{}] Ignoring {} message", label, type);
            return;
        }

        RuntimeEvent event = RuntimeEvent.fromJson(message);
        if (event.getSessionId() != null) {
            sessionId = event.getSessionId();
        }
        events.offer(event);
    }

    private void completeControlRequest(JsonNode response) {
        String requestId = response.path("request_id").asText(null);
        CompletableFuture<JsonNode> pending = requestId == null ? null : pendingRequests.remove(requestId);
        if (pending == null) {
            log.warn("[runtime:{}] Control response for unknown request id: {}", label, requestId);
            return;
        }
        if ("error".equals(response.path("subtype").asText())) {
            pending.completeExceptionally(new AgentRuntimeException(
                response.path("error").asText("Unknown control error")));
            return;
        }
        JsonNode payload = response.get("response");
        pending.complete(payload == null || payload.isNull() ? null : payload);
    }

    private void stderrDrain() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[runtime:{}] stderr: {}", label, line.trim());
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[runtime:{}] Stderr drain ended: {}", label, e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        log.debug("[runtime:{}] Closing session {}", label, sessionId);

        try {
            writer.close();
        } catch (IOException e) {
            log.debug("[runtime:{}] Error closing stdin: {}", label, e.getMessage());
        }

        if (process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }
}
