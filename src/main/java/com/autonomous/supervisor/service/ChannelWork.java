package com.autonomous.supervisor.service;

@FunctionalInterface
public interface ChannelWork {
    void run() throws Exception;
}
