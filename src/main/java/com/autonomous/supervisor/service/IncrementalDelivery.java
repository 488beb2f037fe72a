package com.autonomous.supervisor.service;

/**
 * Receives assistant text while a run is still in progress. Returns whether
 * the text reached the user.
 */
@FunctionalInterface
public interface IncrementalDelivery {
    boolean deliver(String text) throws Exception;
}
