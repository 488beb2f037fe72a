package com.autonomous.supervisor.controller;

import com.autonomous.supervisor.service.ConversationService;
import com.autonomous.supervisor.service.CostTrackerService;
import com.autonomous.supervisor.service.QueueManagerService;
import com.autonomous.supervisor.service.SchedulerBridgeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SlackController.class)
class SlackControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ConversationService conversationService;

    @MockBean
    private SchedulerBridgeService schedulerBridge;

    @MockBean
    private QueueManagerService queueManager;

    @MockBean
    private CostTrackerService costTracker;

    @Test
    void shouldEchoUrlVerificationChallenge() throws Exception {
        mockMvc.perform(post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"url_verification\",\"challenge\":\"abc123\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.challenge").value("abc123"));

        verifyNoInteractions(conversationService);
    }

    @Test
    void shouldDispatchEventCallback() throws Exception {
        mockMvc.perform(post("/slack/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"event_callback\",\"event\":{\"type\":\"app_mention\",\"channel\":\"C1\","
                    + "\"user\":\"U1\",\"text\":\"<@UBOT> hi\",\"ts\":\"1.0\"}}"))
            .andExpect(status().isOk());

        verify(conversationService).processEvent(argThat((Map<String, Object> payload) ->
            "event_callback".equals(payload.get("type"))));
    }

    @Test
    void shouldReportHealth() throws Exception {
        when(schedulerBridge.activeCount()).thenReturn(3);
        when(queueManager.queueCount()).thenReturn(2);
        when(costTracker.formatBudgetStatus()).thenReturn("$1.00 / $500 (0%)");
        when(costTracker.isOverBudgetThreshold()).thenReturn(false);

        mockMvc.perform(get("/slack/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.schedulerSessions").value(3))
            .andExpect(jsonPath("$.channelQueues").value(2))
            .andExpect(jsonPath("$.budget").value("$1.00 / $500 (0%)"))
            .andExpect(jsonPath("$.overBudgetThreshold").value(false));
    }
}
