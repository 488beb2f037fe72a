package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.AgentRunRequest;
import com.autonomous.supervisor.model.AgentRunResult;
import com.autonomous.supervisor.model.ChannelContext;
import com.autonomous.supervisor.runtime.AgentRuntimeException;
import com.autonomous.supervisor.runtime.RuntimeOptions;
import com.autonomous.supervisor.runtime.ScriptedAgentRuntime;
import com.autonomous.supervisor.runtime.ScriptedAgentSession;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentRunnerServiceTest {

    private static final String INIT_WITH_SEND_TOOL =
        "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-1\",\"tools\":[\"Read\",\"SendFileToChat\"]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private ScriptedAgentRuntime runtime;
    private SessionStoreService sessionStore;
    private ToolOutputQueueService toolQueue;
    private CostTrackerService costTracker;
    private AgentRunnerService runner;

    @TempDir
    Path tempDir;

    private Path workspace;

    @BeforeEach
    void setUp() throws Exception {
        workspace = tempDir.toAbsolutePath().normalize();
        Files.createDirectories(workspace.resolve("attachments"));
        runtime = new ScriptedAgentRuntime();
        sessionStore = new SessionStoreService(mapper);
        toolQueue = new ToolOutputQueueService(mapper);
        costTracker = mock(CostTrackerService.class);
        runner = new AgentRunnerService(runtime, sessionStore, toolQueue, new FileSendToolProvisioner(mapper));
        runner.setCostTracker(costTracker);
    }

    private AgentRunRequest.AgentRunRequestBuilder request(String text) {
        return AgentRunRequest.builder()
            .userMessage(text)
            .workspaceDir(workspace)
            .userName("Ada")
            .channelId("D1")
            .model("sonnet");
    }

    private static String assistant(String text) {
        return "{\"type\":\"assistant\",\"session_id\":\"s-1\",\"message\":{\"content\":[{\"type\":\"text\",\"text\":\""
            + text + "\"}]}}";
    }

    private static String result(String text) {
        return "{\"type\":\"result\",\"subtype\":\"success\",\"is_error\":false,\"session_id\":\"s-1\","
            + "\"total_cost_usd\":0.02,\"result\":\"" + text + "\"}";
    }

    @Test
    void shouldStreamAssistantTextAndReturnResult() throws Exception {
        ScriptedAgentSession session = new ScriptedAgentSession()
            .emit(INIT_WITH_SEND_TOOL)
            .emit(assistant("Working on it"))
            .emit(result("All done"))
            .end();
        runtime.willStart(session);
        List<String> delivered = new ArrayList<>();

        AgentRunResult result = runner.run(request("hello").onMessage(text -> delivered.add(text)).build());

        assertEquals(List.of("Working on it"), delivered);
        assertTrue(result.isMessageSent());
        assertEquals("All done", result.getText());
        assertEquals("s-1", result.getSessionId());
        assertFalse(result.isError());
        assertTrue(result.getPendingUploads().isEmpty());
        assertTrue(session.isClosed());
        assertEquals(Optional.of("s-1"), sessionStore.getSessionId(workspace));
        verify(costTracker).recordRun("D1", "s-1", "sonnet", 0.02);
    }

    @Test
    void shouldStartRuntimeWithPromptAndBypassPermissions() throws Exception {
        runner.setPermissionMode("default");
        sessionStore.saveSessionId(workspace, "previous");
        runtime.willStart(new ScriptedAgentSession().emit(INIT_WITH_SEND_TOOL).emit(result("ok")).end());

        runner.run(request("what changed?")
            .channelContext(ChannelContext.builder().channelName("eng").build())
            .build());

        RuntimeOptions options = runtime.getStarts().get(0);
        assertEquals("bypassPermissions", options.getPermissionMode());
        assertEquals("previous", options.getResumeSessionId());
        assertEquals(workspace, options.getWorkingDirectory());
        assertTrue(options.getAllowedTools().contains("SendFileToChat"));
        assertTrue(options.getAllowedTools().contains("mcp__chat__SendFileToChat"));
        assertEquals(workspace.resolve(".agent-supervisor/tools/mcp-servers.json"), options.getMcpConfigPath());
        assertTrue(Files.exists(options.getMcpConfigPath()));
        assertTrue(options.getPrompt().startsWith("what changed?\n\n<agent_supervisor_system_context>"));
        assertTrue(options.getPrompt().contains("## Context: Slack Channel #eng"));
    }

    @Test
    void shouldDiscardSessionWhenFileSendToolMissing() throws Exception {
        sessionStore.saveSessionId(workspace, "previous");
        runtime.willStart(new ScriptedAgentSession()
            .emit("{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-2\",\"tools\":[\"Read\"]}")
            .emit(result("ok"))
            .end());

        AgentRunResult result = runner.run(request("hello").build());

        assertEquals("ok", result.getText());
        assertEquals(Optional.empty(), sessionStore.getSessionId(workspace));
    }

    @Test
    void shouldKeepSessionWhenToolServerToolsAreReported() throws Exception {
        runtime.willStart(new ScriptedAgentSession()
            .emit("{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-4\","
                + "\"tools\":[\"Read\",\"mcp__chat__SendFileToChat\",\"mcp__chat__message\"]}")
            .emit("{\"type\":\"result\",\"subtype\":\"success\",\"session_id\":\"s-4\",\"result\":\"ok\"}")
            .end());
        runner.run(request("hello").build());

        runtime.willStart(new ScriptedAgentSession().emit(INIT_WITH_SEND_TOOL).emit(result("again")).end());
        runner.run(request("hello again").build());

        assertEquals("s-4", runtime.getStarts().get(1).getResumeSessionId());
    }

    @Test
    void shouldAcceptNamespacedFileSendTool() throws Exception {
        runtime.willStart(new ScriptedAgentSession()
            .emit("{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-3\","
                + "\"tools\":[\"mcp__chat__send_file_to_chat\"]}")
            .emit("{\"type\":\"result\",\"subtype\":\"success\",\"session_id\":\"s-3\",\"result\":\"ok\"}")
            .end());

        runner.run(request("hello").build());

        assertEquals(Optional.of("s-3"), sessionStore.getSessionId(workspace));
    }

    @Test
    void shouldReturnQueuedUploadsAndMessagesThroughPolicy() throws Exception {
        Path x = Files.writeString(workspace.resolve("attachments/x.png"), "x");
        Path y = Files.writeString(workspace.resolve("attachments/y.png"), "y");
        Files.writeString(workspace.resolve("session.json"), "{\"sessionId\":\"s-0\"}");
        runtime.onStart(options -> {
            try {
                toolQueue.queueUpload(workspace, x.toString());
                toolQueue.queueUpload(workspace, y.toString());
                toolQueue.queueUpload(workspace, "session.json");
                toolQueue.queueMessage(workspace, "Sent both images");
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        runtime.willStart(new ScriptedAgentSession().emit(INIT_WITH_SEND_TOOL).emit(result("Here they are")).end());

        AgentRunResult result = runner.run(request("send the files").build());

        assertEquals(List.of(x, y), result.getPendingUploads());
        assertEquals(List.of("Sent both images"), result.getPendingMessages());
        assertTrue(toolQueue.drain(workspace).isEmpty());
    }

    @Test
    void shouldNotReturnOutputLeftOverFromEarlierRun() throws Exception {
        Path stale = Files.writeString(workspace.resolve("attachments/stale.png"), "old");
        Path queueFile = toolQueue.queueFile(workspace);
        Files.createDirectories(queueFile.getParent());
        Files.writeString(queueFile,
            "{\"uploads\":[\"" + stale + "\"],\"messages\":[\"Left over from a crashed run\"]}");
        runtime.willStart(new ScriptedAgentSession().emit(INIT_WITH_SEND_TOOL).emit(result("Nothing to send")).end());

        AgentRunResult result = runner.run(request("how are you").build());

        assertTrue(result.getPendingUploads().isEmpty());
        assertTrue(result.getPendingMessages().isEmpty());
        assertEquals("Nothing to send", result.getText());
    }

    @Test
    void shouldFallBackToFilesNamedInRequest() throws Exception {
        Path report = Files.writeString(workspace.resolve("report.csv"), "a,b");
        runtime.willStart(new ScriptedAgentSession().emit(INIT_WITH_SEND_TOOL).emit(result("Attached")).end());

        AgentRunResult result = runner.run(request("attach report.csv").build());

        assertEquals(List.of(report), result.getPendingUploads());
    }

    @Test
    void shouldFallBackToMediaReferencesInModelOutput() throws Exception {
        Path out = Files.writeString(workspace.resolve("out.txt"), "result");
        runtime.willStart(new ScriptedAgentSession()
            .emit(INIT_WITH_SEND_TOOL)
            .emit(assistant("MEDIA:out.txt"))
            .emit(result("Sent it"))
            .end());

        AgentRunResult result = runner.run(request("send that file").build());

        assertEquals(List.of(out), result.getPendingUploads());
    }

    @Test
    void shouldUseMessageTokensWhenResultHasNoText() throws Exception {
        runtime.willStart(new ScriptedAgentSession()
            .emit(INIT_WITH_SEND_TOOL)
            .emit(assistant("MESSAGE:Heads up"))
            .emit("{\"type\":\"result\",\"subtype\":\"error_during_execution\",\"is_error\":true,\"session_id\":\"s-1\"}")
            .end());

        AgentRunResult result = runner.run(request("ping").build());

        assertTrue(result.isError());
        assertEquals(List.of("Heads up"), result.getPendingMessages());
        assertEquals("Heads up", result.getText());
    }

    @Test
    void shouldKeepRunningWhenIncrementalDeliveryFails() throws Exception {
        runtime.willStart(new ScriptedAgentSession()
            .emit(INIT_WITH_SEND_TOOL)
            .emit(assistant("partial"))
            .emit(result("final"))
            .end());

        AgentRunResult result = runner.run(request("hello").onMessage(text -> {
            throw new IllegalStateException("slack down");
        }).build());

        assertFalse(result.isMessageSent());
        assertEquals("final", result.getText());
    }

    @Test
    void shouldFailWhenStreamEndsWithoutResult() {
        ScriptedAgentSession session = new ScriptedAgentSession().emit(INIT_WITH_SEND_TOOL).end();
        runtime.willStart(session);

        assertThrows(AgentRuntimeException.class, () -> runner.run(request("hello").build()));
        assertTrue(session.isClosed());
        verifyNoInteractions(costTracker);
    }
}
