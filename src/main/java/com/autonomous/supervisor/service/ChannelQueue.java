package com.autonomous.supervisor.service;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs work for one channel strictly one item at a time, in enqueue order.
 * A failing item is logged and does not stop the items behind it.
 */
@Slf4j
public class ChannelQueue {

    private final String channelId;
    private final Executor executor;
    private final Queue<PendingWork> pending = new ArrayDeque<>();
    private boolean processing;

    public ChannelQueue(String channelId, Executor executor) {
        this.channelId = channelId;
        this.executor = executor;
    }

    public CompletableFuture<Void> enqueue(ChannelWork work) {
        PendingWork item = new PendingWork(work, new CompletableFuture<>());
        synchronized (this) {
            pending.add(item);
            if (processing) {
                return item.done();
            }
            processing = true;
        }
        executor.execute(this::drain);
        return item.done();
    }

    public synchronized int size() {
        return pending.size();
    }

    private void drain() {
        while (true) {
            PendingWork next;
            synchronized (this) {
                next = pending.poll();
                if (next == null) {
                    processing = false;
                    return;
                }
            }
            try {
                next.work().run();
                next.done().complete(null);
            } catch (Throwable e) {
                log.error("Channel queue work item failed for {}", channelId, e);
                next.done().completeExceptionally(e);
            }
        }
    }

    private static final class PendingWork {
        private final ChannelWork work;
        private final CompletableFuture<Void> done;

        private PendingWork(ChannelWork work, CompletableFuture<Void> done) {
            this.work = work;
            this.done = done;
        }

        ChannelWork work() {
            return work;
        }

        CompletableFuture<Void> done() {
            return done;
        }
    }
}
