package com.autonomous.supervisor.service;

import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Service
public class QueueManagerService {

    private final Map<String, ChannelQueue> queues = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public ChannelQueue getQueue(String channelId) {
        return queues.computeIfAbsent(channelId, id -> new ChannelQueue(id, executor));
    }

    public int queueCount() {
        return queues.size();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
