package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.SchedulerRoute;

@FunctionalInterface
public interface DeliveryCallback {
    boolean deliver(SchedulerRoute route, String text);
}
