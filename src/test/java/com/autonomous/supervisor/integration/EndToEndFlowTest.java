package com.autonomous.supervisor.integration;

import com.autonomous.supervisor.model.SchedulerRoute;
import com.autonomous.supervisor.runtime.AgentRuntime;
import com.autonomous.supervisor.runtime.RuntimeOptions;
import com.autonomous.supervisor.runtime.ScriptedAgentSession;
import com.autonomous.supervisor.service.SchedulerBridgeService;
import com.autonomous.supervisor.service.SessionStoreService;
import com.autonomous.supervisor.service.SlackService;
import com.autonomous.supervisor.service.WorkspaceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.util.FileSystemUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = {
    "agent.data.path=target/e2e-data",
    "agent.scheduler.enabled=false",
    "slack.bot.token=xoxb-test"
})
@AutoConfigureMockMvc
class EndToEndFlowTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private WorkspaceService workspaceService;

    @Autowired
    private SessionStoreService sessionStore;

    @Autowired
    private SchedulerBridgeService schedulerBridge;

    @MockBean
    private AgentRuntime agentRuntime;

    @MockBean
    private SlackService slackService;

    private ScriptedAgentSession schedulerSession;

    @BeforeEach
    void setUp() {
        schedulerBridge.stopAll();
        FileSystemUtils.deleteRecursively(Paths.get("target/e2e-data").toFile());

        schedulerSession = new ScriptedAgentSession();
        when(agentRuntime.start(any(RuntimeOptions.class))).thenAnswer(invocation -> {
            RuntimeOptions options = invocation.getArgument(0);
            if (options.getPrompt() == null) {
                return schedulerSession;
            }
            return new ScriptedAgentSession()
                .emit("{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"s-e2e\","
                    + "\"tools\":[\"Read\",\"SendFileToChat\"]}")
                .emit("{\"type\":\"result\",\"subtype\":\"success\",\"session_id\":\"s-e2e\","
                    + "\"result\":\"Hello from the agent\",\"total_cost_usd\":0.01}")
                .end();
        });
        when(slackService.getUserRealName("U1")).thenReturn(Optional.of("Ada"));
        when(slackService.postMessage("D1", "_Thinking..._")).thenReturn("ts-1");
        when(slackService.updateMessage(anyString(), anyString(), anyString())).thenReturn(true);
        when(slackService.deliver(any(), anyString())).thenReturn(true);
    }

    @Test
    void shouldAnswerDirectMessageAndRelayScheduledJob() throws Exception {
        mockMvc.perform(post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"event_callback\",\"event\":{\"type\":\"message\",\"channel_type\":\"im\","
                    + "\"channel\":\"D1\",\"user\":\"U1\",\"text\":\"hello\",\"ts\":\"1.0\"}}"))
            .andExpect(status().isOk());

        verify(slackService, timeout(5000)).updateMessage("D1", "ts-1", "Hello from the agent");

        Path workspace = workspaceService.userWorkspace("U1");
        assertEquals(Optional.of("s-e2e"), sessionStore.getSessionId(workspace));
        assertTrue(schedulerBridge.isActive(workspace));
        assertEquals(List.of("scheduler_start", "scheduler_status", "scheduler_status", "scheduler_start"),
            schedulerSession.getControlRequests());

        schedulerSession.emit("{\"type\":\"system\",\"subtype\":\"scheduler_event\",\"data\":{\"event\":"
            + "{\"jobId\":\"digest\",\"action\":\"finished\",\"status\":\"ok\",\"summary\":\"3 new issues\"}}}");

        verify(slackService, timeout(5000)).deliver(SchedulerRoute.dm("D1"), "Scheduled job digest: 3 new issues");
    }

    @Test
    void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/slack/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.schedulerSessions").value(0));
    }
}
