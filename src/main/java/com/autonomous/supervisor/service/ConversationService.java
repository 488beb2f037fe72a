package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.AgentRunRequest;
import com.autonomous.supervisor.model.AgentRunResult;
import com.autonomous.supervisor.model.ChannelContext;
import com.autonomous.supervisor.model.SchedulerRoute;
import com.autonomous.supervisor.model.SlackMessageEvent;
import com.slack.api.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;

/**
 * Turns inbound Slack events into agent runs. Every message is handled on its
 * channel's queue, so one conversation never runs two turns at once.
 */
@Slf4j
@Service
public class ConversationService {

    static final String THINKING_TEXT = "_Thinking..._";
    static final String NO_RESPONSE_TEXT = "_No response_";
    static final String FAILURE_TEXT = "_Something went wrong, try again_";
    static final String ATTACHMENTS_ONLY_TEXT = "See attached files.";
    static final String NO_UPLOAD_HINT = "No file was uploaded. Please specify a filename/path "
        + "(for example `attachments/<name>`), or ask to attach the latest attachment.";

    private static final Pattern BOT_MENTION = Pattern.compile("<@[A-Z0-9]+>");
    private static final Pattern ASKED_FOR_UPLOAD = Pattern.compile(
        "\\b(attach|upload|send|share)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DENIED_UPLOAD = Pattern.compile(
        "\\b(unable to send|don't have access|do not have access|file-send tool.*not available)\\b",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern CLAIMS_UPLOAD = Pattern.compile(
        "\\b(done|uploaded|attached|sent)\\b[\\s\\S]{0,80}\\b(file|files|attachment|attachments)\\b",
        Pattern.CASE_INSENSITIVE);

    private final QueueManagerService queueManager;
    private final WorkspaceService workspaceService;
    private final SchedulerBridgeService schedulerBridge;
    private final AgentRunnerService agentRunner;
    private final SlackService slackService;

    @Value("${claude.code.model:}")
    private String model = "";

    @Value("${agent.bot.name:}")
    private String botName = "";

    @Value("${agent.org.name:}")
    private String orgName = "";

    @Value("${agent.platform:slack}")
    private String platform = "slack";

    @Value("${agent.slack.channel-history-limit:5}")
    private int channelHistoryLimit = 5;

    @Value("${agent.slack.thread-history-limit:50}")
    private int threadHistoryLimit = 50;

    public ConversationService(QueueManagerService queueManager, WorkspaceService workspaceService,
                               SchedulerBridgeService schedulerBridge, AgentRunnerService agentRunner,
                               SlackService slackService) {
        this.queueManager = queueManager;
        this.workspaceService = workspaceService;
        this.schedulerBridge = schedulerBridge;
        this.agentRunner = agentRunner;
        this.slackService = slackService;
    }

    public void processEvent(Map<String, Object> payload) {
        Object rawEvent = payload.get("event");
        if (!(rawEvent instanceof Map)) {
            return;
        }
        Map<?, ?> event = (Map<?, ?>) rawEvent;
        if (event.get("bot_id") != null || event.get("subtype") != null) {
            log.debug("Ignoring bot or subtype event in {}", event.get("channel"));
            return;
        }

        Object type = event.get("type");
        SlackMessageEvent message = SlackMessageEvent.fromEvent(event);
        if (message.getChannelId() == null || message.getUserId() == null) {
            return;
        }
        if ("message".equals(type) && "im".equals(event.get("channel_type"))) {
            handleDirectMessage(message);
        } else if ("app_mention".equals(type)) {
            handleChannelMention(message);
        }
    }

    public CompletableFuture<Void> handleDirectMessage(SlackMessageEvent message) {
        return queueManager.getQueue(message.getChannelId()).enqueue(() -> {
            try {
                log.info("Processing DM from {} in {}", message.getUserId(), message.getChannelId());
                Path workspace = workspaceService.userWorkspace(message.getUserId());
                ensureScheduler(workspace, SchedulerRoute.dm(message.getChannelId()));
                String userName = slackService.getUserRealName(message.getUserId()).orElse(message.getUserId());
                respond(message, null, workspace, userName, null);
            } catch (Exception e) {
                log.error("DM processing failed for {} in {}", message.getUserId(), message.getChannelId(), e);
                if (slackService.postMessage(message.getChannelId(), FAILURE_TEXT) == null) {
                    log.error("Failed to send DM failure message to {}", message.getChannelId());
                }
            }
        });
    }

    public CompletableFuture<Void> handleChannelMention(SlackMessageEvent message) {
        String threadTs = message.replyThreadTs();
        return queueManager.getQueue(message.getChannelId()).enqueue(() -> {
            try {
                log.info("Processing channel mention from {} in {}", message.getUserId(), message.getChannelId());
                Path workspace = workspaceService.channelWorkspace(message.getChannelId());
                ensureScheduler(workspace, SchedulerRoute.channel(message.getChannelId(), threadTs));
                String userName = slackService.getUserRealName(message.getUserId()).orElse(message.getUserId());
                respond(message, threadTs, workspace, userName, loadChannelContext(message));
            } catch (Exception e) {
                log.error("Channel mention processing failed for {} in {}",
                    message.getUserId(), message.getChannelId(), e);
                if (slackService.postMessageInThread(message.getChannelId(), threadTs, FAILURE_TEXT) == null) {
                    log.error("Failed to send channel failure message to {}", message.getChannelId());
                }
            }
        });
    }

    private void respond(SlackMessageEvent message, String threadTs, Path workspace, String userName,
                         ChannelContext channelContext) throws Exception {
        String channelId = message.getChannelId();
        String userText = stripMentions(message.getText());

        String thinkingTs = post(channelId, threadTs, THINKING_TEXT);
        ThinkingMessageDelivery onMessage = new ThinkingMessageDelivery(channelId, threadTs, thinkingTs);

        AgentRunResult result = agentRunner.run(AgentRunRequest.builder()
            .userMessage(userText.isEmpty() ? ATTACHMENTS_ONLY_TEXT : userText)
            .workspaceDir(workspace)
            .userName(userName)
            .channelId(channelId)
            .platform(platform)
            .orgName(blankToNull(orgName))
            .botName(blankToNull(botName))
            .model(blankToNull(model))
            .channelContext(channelContext)
            .onMessage(onMessage)
            .build());
        schedulerBridge.syncWorkspace(workspace);

        List<Path> uploaded = new ArrayList<>();
        for (Path file : result.getPendingUploads()) {
            log.info("Uploading {} to {}", file, channelId);
            if (slackService.uploadFile(channelId, threadTs, file)) {
                uploaded.add(file);
            }
        }
        for (String text : result.getPendingMessages()) {
            if (post(channelId, threadTs, text) == null) {
                log.warn("Failed to post captured message to {}", channelId);
            }
        }

        String rawText = result.getText() != null ? result.getText() : NO_RESPONSE_TEXT;
        String responseText = normalizeUploadResponse(rawText, uploaded, userText);
        if (!result.isMessageSent()) {
            if (thinkingTs == null || !slackService.updateMessage(channelId, thinkingTs, responseText)) {
                post(channelId, threadTs, responseText);
            }
        } else if (!responseText.equals(rawText)) {
            post(channelId, threadTs, responseText);
        }
    }

    private void ensureScheduler(Path workspace, SchedulerRoute route) {
        try {
            schedulerBridge.ensureWorkspace(workspace, route);
        } catch (RuntimeException e) {
            log.error("Scheduler bridge failed to start for {}; continuing without it", workspace, e);
        }
    }

    ChannelContext loadChannelContext(SlackMessageEvent message) {
        String channelId = message.getChannelId();
        List<Message> history;
        if (message.getThreadTs() != null) {
            log.debug("Fetching {} thread replies for {} in {}", threadHistoryLimit, message.getThreadTs(), channelId);
            history = slackService.getThreadReplies(channelId, message.getThreadTs(), threadHistoryLimit);
        } else {
            log.debug("Fetching {} channel messages for {}", channelHistoryLimit, channelId);
            history = new ArrayList<>(slackService.getChannelHistory(channelId, channelHistoryLimit));
            Collections.reverse(history);
        }

        Map<String, String> names = new HashMap<>();
        List<ChannelContext.ChannelMessage> recent = new ArrayList<>();
        for (Message entry : history) {
            String name = names.computeIfAbsent(entry.getUser(),
                id -> slackService.getUserRealName(id).orElse("Unknown"));
            recent.add(new ChannelContext.ChannelMessage(name, entry.getText()));
        }
        return ChannelContext.builder()
            .channelName(slackService.getChannelName(channelId).orElse(channelId))
            .recentMessages(recent)
            .build();
    }

    /**
     * Rewrites the final reply so it agrees with what was actually uploaded.
     */
    static String normalizeUploadResponse(String responseText, List<Path> uploaded, String userText) {
        int count = uploaded.size();
        String noun = count == 1 ? "file" : "files";
        boolean askedForUpload = userText != null && ASKED_FOR_UPLOAD.matcher(userText).find();

        if (count > 0 && askedForUpload) {
            List<String> names = new ArrayList<>();
            for (Path file : uploaded) {
                names.add(file.getFileName().toString());
            }
            return String.format("Uploaded %d %s to Slack: %s.", count, noun, String.join(", ", names));
        }
        if (count > 0 && DENIED_UPLOAD.matcher(responseText).find()) {
            return String.format("Uploaded %d %s to Slack.", count, noun);
        }
        if (count == 0 && askedForUpload && CLAIMS_UPLOAD.matcher(responseText).find()) {
            return NO_UPLOAD_HINT;
        }
        return responseText;
    }

    private String post(String channelId, String threadTs, String text) {
        return threadTs == null
            ? slackService.postMessage(channelId, text)
            : slackService.postMessageInThread(channelId, threadTs, text);
    }

    private static String stripMentions(String text) {
        return text == null ? "" : BOT_MENTION.matcher(text).replaceAll("").trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Streams assistant text into Slack: the first message replaces the
     * thinking placeholder, later ones are posted as new replies.
     */
    private final class ThinkingMessageDelivery implements IncrementalDelivery {
        private final String channelId;
        private final String threadTs;
        private String placeholderTs;

        ThinkingMessageDelivery(String channelId, String threadTs, String placeholderTs) {
            this.channelId = channelId;
            this.threadTs = threadTs;
            this.placeholderTs = placeholderTs;
        }

        @Override
        public boolean deliver(String text) {
            if (placeholderTs != null) {
                String ts = placeholderTs;
                placeholderTs = null;
                if (slackService.updateMessage(channelId, ts, text)) {
                    return true;
                }
            }
            return post(channelId, threadTs, text) != null;
        }
    }
}
