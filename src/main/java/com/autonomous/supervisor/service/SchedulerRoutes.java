package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.SchedulerRoute;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Where scheduled output for one workspace goes. A job is bound to the route
 * that was latest when the job was added and keeps it until removed; jobs
 * without a binding fall back to the latest route.
 */
public class SchedulerRoutes {

    private SchedulerRoute latestRoute;
    private final Map<String, SchedulerRoute> routesByJobId = new HashMap<>();

    public synchronized void setLatestRoute(SchedulerRoute route) {
        this.latestRoute = route;
    }

    public synchronized void bindJob(String jobId) {
        if (latestRoute == null) {
            return;
        }
        routesByJobId.put(jobId, latestRoute);
    }

    public synchronized void removeJob(String jobId) {
        routesByJobId.remove(jobId);
    }

    public synchronized Optional<SchedulerRoute> resolve(String jobId) {
        SchedulerRoute bound = routesByJobId.get(jobId);
        return Optional.ofNullable(bound != null ? bound : latestRoute);
    }
}
