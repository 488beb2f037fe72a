package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.SchedulerRoute;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.chat.ChatUpdateRequest;
import com.slack.api.methods.request.conversations.ConversationsHistoryRequest;
import com.slack.api.methods.request.conversations.ConversationsInfoRequest;
import com.slack.api.methods.request.conversations.ConversationsRepliesRequest;
import com.slack.api.methods.request.files.FilesUploadV2Request;
import com.slack.api.methods.request.users.UsersInfoRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import com.slack.api.methods.response.chat.ChatUpdateResponse;
import com.slack.api.methods.response.conversations.ConversationsHistoryResponse;
import com.slack.api.methods.response.conversations.ConversationsInfoResponse;
import com.slack.api.methods.response.conversations.ConversationsRepliesResponse;
import com.slack.api.methods.response.files.FilesUploadV2Response;
import com.slack.api.methods.response.users.UsersInfoResponse;
import com.slack.api.model.Message;
import com.slack.api.model.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Slack Web API calls used by the conversation flows and scheduled delivery.
 * Failures are logged and reported through the return value; nothing here
 * throws.
 */
@Slf4j
@Service
public class SlackService implements DeliveryCallback {

    @Value("${slack.bot.token:}")
    private String slackBotToken;

    private final Slack slack = Slack.getInstance();

    private MethodsClient methods() {
        return slack.methods(slackBotToken);
    }

    @Override
    public boolean deliver(SchedulerRoute route, String text) {
        String ts = route.getMode() == SchedulerRoute.Mode.CHANNEL && route.getThreadTs() != null
            ? postMessageInThread(route.getChannelId(), route.getThreadTs(), text)
            : postMessage(route.getChannelId(), text);
        return ts != null;
    }

    /**
     * Posts a message to a channel and returns the message timestamp.
     */
    public String postMessage(String channel, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .text(message)
            .build());
    }

    /**
     * Posts a message as a reply in an existing thread.
     */
    public String postMessageInThread(String channel, String threadTs, String message) {
        return post(ChatPostMessageRequest.builder()
            .channel(channel)
            .threadTs(threadTs)
            .text(message)
            .build());
    }

    private String post(ChatPostMessageRequest request) {
        try {
            ChatPostMessageResponse response = methods().chatPostMessage(request);
            if (response.isOk()) {
                return response.getTs();
            }
            log.warn("Failed to post message to {}: {}", request.getChannel(), response.getError());
        } catch (Exception e) {
            log.error("Failed to post message to {}", request.getChannel(), e);
        }
        return null;
    }

    public boolean updateMessage(String channel, String ts, String message) {
        try {
            ChatUpdateResponse response = methods().chatUpdate(ChatUpdateRequest.builder()
                .channel(channel)
                .ts(ts)
                .text(message)
                .build());
            if (response.isOk()) {
                return true;
            }
            log.warn("Failed to update message {} in {}: {}", ts, channel, response.getError());
        } catch (Exception e) {
            log.error("Failed to update message {} in {}", ts, channel, e);
        }
        return false;
    }

    /**
     * Uploads a local file to the channel, into {@code threadTs} when given.
     */
    public boolean uploadFile(String channel, String threadTs, Path file) {
        try {
            FilesUploadV2Response response = methods().filesUploadV2(FilesUploadV2Request.builder()
                .channel(channel)
                .threadTs(threadTs)
                .file(file.toFile())
                .filename(file.getFileName().toString())
                .build());
            if (response.isOk()) {
                return true;
            }
            log.warn("Failed to upload {} to {}: {}", file, channel, response.getError());
        } catch (Exception e) {
            log.error("Failed to upload {} to {}", file, channel, e);
        }
        return false;
    }

    public Optional<String> getUserRealName(String userId) {
        try {
            UsersInfoResponse response = methods().usersInfo(UsersInfoRequest.builder().user(userId).build());
            if (!response.isOk() || response.getUser() == null) {
                log.warn("Failed to look up user {}: {}", userId, response.getError());
                return Optional.empty();
            }
            User user = response.getUser();
            String name = user.getRealName();
            if ((name == null || name.isBlank()) && user.getProfile() != null) {
                name = user.getProfile().getRealName();
            }
            if (name == null || name.isBlank()) {
                name = user.getName();
            }
            return Optional.ofNullable(name);
        } catch (Exception e) {
            log.error("Failed to look up user {}", userId, e);
            return Optional.empty();
        }
    }

    public Optional<String> getChannelName(String channelId) {
        try {
            ConversationsInfoResponse response = methods().conversationsInfo(
                ConversationsInfoRequest.builder().channel(channelId).build());
            if (response.isOk() && response.getChannel() != null) {
                return Optional.ofNullable(response.getChannel().getName());
            }
            log.warn("Failed to look up channel {}: {}", channelId, response.getError());
        } catch (Exception e) {
            log.error("Failed to look up channel {}", channelId, e);
        }
        return Optional.empty();
    }

    /**
     * Top-level channel messages, newest first as Slack returns them.
     */
    public List<Message> getChannelHistory(String channelId, int limit) {
        try {
            ConversationsHistoryResponse response = methods().conversationsHistory(
                ConversationsHistoryRequest.builder().channel(channelId).limit(limit).build());
            if (response.isOk()) {
                return userMessages(response.getMessages());
            }
            log.warn("Failed to fetch history for {}: {}", channelId, response.getError());
        } catch (Exception e) {
            log.error("Failed to fetch history for {}", channelId, e);
        }
        return new ArrayList<>();
    }

    /**
     * Replies in a thread, oldest first, including the parent message.
     */
    public List<Message> getThreadReplies(String channelId, String threadTs, int limit) {
        try {
            ConversationsRepliesResponse response = methods().conversationsReplies(
                ConversationsRepliesRequest.builder().channel(channelId).ts(threadTs).limit(limit).build());
            if (response.isOk()) {
                return userMessages(response.getMessages());
            }
            log.warn("Failed to fetch thread {} in {}: {}", threadTs, channelId, response.getError());
        } catch (Exception e) {
            log.error("Failed to fetch thread {} in {}", threadTs, channelId, e);
        }
        return new ArrayList<>();
    }

    private static List<Message> userMessages(List<Message> messages) {
        List<Message> filtered = new ArrayList<>();
        if (messages == null) {
            return filtered;
        }
        for (Message message : messages) {
            if (message.getUser() != null && message.getBotId() == null
                && message.getText() != null && !message.getText().isBlank()) {
                filtered.add(message);
            }
        }
        return filtered;
    }
}
