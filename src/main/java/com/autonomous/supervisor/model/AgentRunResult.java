package com.autonomous.supervisor.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class AgentRunResult {
    private boolean messageSent;
    private String text;
    private boolean error;
    private String sessionId;
    private double costUsd;
    @Builder.Default
    private List<Path> pendingUploads = new ArrayList<>();
    @Builder.Default
    private List<String> pendingMessages = new ArrayList<>();
}
