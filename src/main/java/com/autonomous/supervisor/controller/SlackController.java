package com.autonomous.supervisor.controller;

import com.autonomous.supervisor.service.ConversationService;
import com.autonomous.supervisor.service.CostTrackerService;
import com.autonomous.supervisor.service.QueueManagerService;
import com.autonomous.supervisor.service.SchedulerBridgeService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/slack")
public class SlackController {

    @Autowired
    private ConversationService conversationService;

    @Autowired
    private SchedulerBridgeService schedulerBridge;

    @Autowired
    private QueueManagerService queueManager;

    @Autowired
    private CostTrackerService costTracker;

    @PostMapping("/events")
    public ResponseEntity<?> handleSlackEvent(@RequestBody Map<String, Object> payload) {
        if (payload.containsKey("challenge")) {
            return ResponseEntity.ok(Map.of("challenge", payload.get("challenge")));
        }

        conversationService.processEvent(payload);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of(
            "status", "healthy",
            "schedulerSessions", schedulerBridge.activeCount(),
            "channelQueues", queueManager.queueCount(),
            "budget", costTracker.formatBudgetStatus(),
            "overBudgetThreshold", costTracker.isOverBudgetThreshold()
        ));
    }
}
