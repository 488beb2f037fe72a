package com.autonomous.supervisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerRoute {

    public enum Mode { DM, CHANNEL }

    private String channelId;
    private String threadTs;   // only meaningful for CHANNEL routes
    private Mode mode;

    public static SchedulerRoute dm(String channelId) {
        return new SchedulerRoute(channelId, null, Mode.DM);
    }

    public static SchedulerRoute channel(String channelId, String threadTs) {
        return new SchedulerRoute(channelId, threadTs, Mode.CHANNEL);
    }
}
