package com.autonomous.supervisor.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueueManagerServiceTest {

    private final QueueManagerService queueManager = new QueueManagerService();

    @AfterEach
    void tearDown() {
        queueManager.shutdown();
    }

    @Test
    void shouldReuseQueuePerChannel() {
        ChannelQueue first = queueManager.getQueue("C1");

        assertSame(first, queueManager.getQueue("C1"));
        assertNotSame(first, queueManager.getQueue("C2"));
        assertEquals(2, queueManager.queueCount());
    }

    @Test
    void shouldRunDifferentChannelsConcurrently() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);

        CompletableFuture<Void> a = queueManager.getQueue("C1").enqueue(() -> {
            bothRunning.countDown();
            assertTrue(bothRunning.await(5, TimeUnit.SECONDS));
        });
        CompletableFuture<Void> b = queueManager.getQueue("C2").enqueue(() -> {
            bothRunning.countDown();
            assertTrue(bothRunning.await(5, TimeUnit.SECONDS));
        });

        CompletableFuture.allOf(a, b).get(10, TimeUnit.SECONDS);
    }
}
