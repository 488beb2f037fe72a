package com.autonomous.supervisor.model;

import com.autonomous.supervisor.service.IncrementalDelivery;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class AgentRunRequest {
    private String userMessage;
    private Path workspaceDir;
    private String userName;
    private String channelId;
    @Builder.Default
    private String platform = "slack";   // slack | whatsapp
    private String orgName;
    private String botName;
    private String model;
    @Builder.Default
    private List<Attachment> attachments = new ArrayList<>();
    private ChannelContext channelContext;   // null for direct messages
    private IncrementalDelivery onMessage;
}
