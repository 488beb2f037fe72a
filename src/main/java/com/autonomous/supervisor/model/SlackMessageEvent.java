package com.autonomous.supervisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * The fields of an inbound Slack {@code message} or {@code app_mention} event
 * that the conversation flows use.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlackMessageEvent {
    private String channelId;
    private String userId;
    private String text;
    private String ts;
    private String threadTs;

    public static SlackMessageEvent fromEvent(Map<?, ?> event) {
        return SlackMessageEvent.builder()
            .channelId((String) event.get("channel"))
            .userId((String) event.get("user"))
            .text((String) event.get("text"))
            .ts((String) event.get("ts"))
            .threadTs((String) event.get("thread_ts"))
            .build();
    }

    /** The thread a channel reply belongs in: the existing thread, or a new one under this message. */
    public String replyThreadTs() {
        return threadTs != null ? threadTs : ts;
    }
}
