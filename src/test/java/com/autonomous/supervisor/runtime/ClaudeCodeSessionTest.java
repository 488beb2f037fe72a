package com.autonomous.supervisor.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeCodeSessionTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private FakeProcess process;
    private ClaudeCodeSession session;

    @BeforeEach
    void setUp() throws Exception {
        process = new FakeProcess();
        session = new ClaudeCodeSession("test", process, mapper, 5);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void shouldWritePromptAsUserMessage() throws Exception {
        session.begin("hello there");

        JsonNode written = mapper.readTree(process.writtenToStdin().trim());
        assertEquals("user", written.get("type").asText());
        assertEquals("user", written.path("message").path("role").asText());
        assertEquals("hello there", written.path("message").path("content").asText());
    }

    @Test
    void shouldNotWriteAnythingForKeepAliveSession() {
        session.begin(null);

        assertEquals("", process.writtenToStdin());
    }

    @Test
    void shouldStreamEventsInOrderUntilExit() throws Exception {
        session.begin(null);
        process.printLine("{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-1\",\"tools\":[\"Read\"]}");
        process.printLine("not json at all");
        process.printLine("{\"type\":\"keep_alive\"}");
        process.printLine("{\"type\":\"assistant\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}}");
        process.printLine("{\"type\":\"result\",\"subtype\":\"success\",\"result\":\"done\",\"session_id\":\"s-1\"}");
        process.exit();

        assertEquals("system", session.nextEvent().orElseThrow().getType());
        assertEquals("assistant", session.nextEvent().orElseThrow().getType());
        RuntimeEvent result = session.nextEvent().orElseThrow();
        assertEquals("done", result.getResult());
        assertEquals(Optional.empty(), session.nextEvent());
        assertEquals(Optional.empty(), session.nextEvent());
        assertEquals("s-1", session.getSessionId());
    }

    @Test
    void shouldCompleteControlRequestFromMatchingResponse() throws Exception {
        session.begin(null);

        CompletableFuture<JsonNode> response = session.sendControlRequest("scheduler_status", Map.of("cwd", "."));

        JsonNode request = mapper.readTree(process.writtenToStdin().trim());
        assertEquals("control_request", request.get("type").asText());
        assertEquals("req_1", request.get("request_id").asText());
        assertEquals("scheduler_status", request.path("request").path("subtype").asText());
        assertEquals(".", request.path("request").path("cwd").asText());

        process.printLine("{\"type\":\"control_response\",\"response\":{\"subtype\":\"success\","
            + "\"request_id\":\"req_1\",\"response\":{\"jobs\":2}}}");

        assertEquals(2, response.get(5, TimeUnit.SECONDS).get("jobs").asInt());
    }

    @Test
    void shouldCompleteWithNullWhenResponseHasNoPayload() throws Exception {
        session.begin(null);

        CompletableFuture<JsonNode> response = session.sendControlRequest("scheduler_start", Map.of("cwd", "."));
        process.printLine("{\"type\":\"control_response\",\"response\":{\"subtype\":\"success\",\"request_id\":\"req_1\"}}");

        assertNull(response.get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldFailControlRequestOnErrorResponse() throws Exception {
        session.begin(null);

        CompletableFuture<JsonNode> response = session.sendControlRequest("scheduler_start", Map.of("cwd", "."));
        process.printLine("{\"type\":\"control_response\",\"response\":{\"subtype\":\"error\","
            + "\"request_id\":\"req_1\",\"error\":\"scheduler unavailable\"}}");

        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> response.get(5, TimeUnit.SECONDS));
        assertInstanceOf(AgentRuntimeException.class, failure.getCause());
        assertEquals("scheduler unavailable", failure.getCause().getMessage());
    }

    @Test
    void shouldFailPendingRequestsWhenProcessExits() throws Exception {
        session.begin(null);

        CompletableFuture<JsonNode> response = session.sendControlRequest("scheduler_status", Map.of("cwd", "."));
        process.exit();

        ExecutionException failure = assertThrows(ExecutionException.class,
            () -> response.get(5, TimeUnit.SECONDS));
        assertInstanceOf(AgentRuntimeException.class, failure.getCause());
        assertEquals(Optional.empty(), session.nextEvent());
    }
}
