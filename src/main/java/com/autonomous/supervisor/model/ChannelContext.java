package com.autonomous.supervisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelContext {
    private String channelName;
    @Builder.Default
    private List<ChannelMessage> recentMessages = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChannelMessage {
        private String userName;
        private String text;
    }
}
