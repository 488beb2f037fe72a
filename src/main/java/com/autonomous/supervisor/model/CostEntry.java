package com.autonomous.supervisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostEntry {
    private Instant timestamp;
    private String channelId;
    private String sessionId;
    private String model;
    private double costUsd;
}
