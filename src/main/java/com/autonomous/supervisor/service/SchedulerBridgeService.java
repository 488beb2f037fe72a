package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.SchedulerRoute;
import com.autonomous.supervisor.runtime.AgentRuntime;
import com.autonomous.supervisor.runtime.AgentRuntimeException;
import com.autonomous.supervisor.runtime.AgentSession;
import com.autonomous.supervisor.runtime.RuntimeEvent;
import com.autonomous.supervisor.runtime.RuntimeOptions;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps one long-lived runtime session per workspace for scheduled jobs and
 * relays finished jobs to the route they were created from.
 *
 * <p>Each session's event stream is consumed by its own background task, in
 * order, until the runtime exits or {@link #stopAll()} closes it.
 */
@Slf4j
@Service
public class SchedulerBridgeService {

    static final String SCHEDULER_EVENT = "scheduler_event";
    static final String CONTROL_START = "scheduler_start";
    static final String CONTROL_STATUS = "scheduler_status";
    private static final Map<String, Object> CWD_PAYLOAD = Map.of("cwd", ".");

    private final AgentRuntime runtime;
    private final DeliveryCallback delivery;
    private final WorkspaceService workspaceService;

    private final Map<Path, WorkspaceState> workspaces = new ConcurrentHashMap<>();
    private final Map<Path, Object> startLocks = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @Value("${claude.code.model:}")
    private String model = "";

    @Value("${claude.code.permission-mode:bypassPermissions}")
    private String permissionMode = AgentRunnerService.EFFECTIVE_PERMISSION_MODE;

    @Value("${claude.code.allowed-tools:}")
    private String allowedTools = "";

    @Value("${claude.code.control-timeout-seconds:60}")
    private long controlTimeoutSeconds = 60;

    @Value("${agent.scheduler.enabled:true}")
    private boolean enabled = true;

    public SchedulerBridgeService(AgentRuntime runtime, DeliveryCallback delivery, WorkspaceService workspaceService) {
        this.runtime = runtime;
        this.delivery = delivery;
        this.workspaceService = workspaceService;
    }

    public void setControlTimeoutSeconds(long controlTimeoutSeconds) {
        this.controlTimeoutSeconds = controlTimeoutSeconds;
    }

    /**
     * Starts the workspace's scheduler session if there is none yet; otherwise
     * only records {@code route} as the workspace's latest route. Startup is
     * serialized per workspace, so a slow start never holds up other workspaces.
     */
    public void ensureWorkspace(Path workspaceDir, SchedulerRoute route) {
        Path key = workspaceDir.toAbsolutePath().normalize();
        if (updateRoute(key, route)) {
            return;
        }
        synchronized (startLocks.computeIfAbsent(key, k -> new Object())) {
            if (updateRoute(key, route)) {
                return;
            }
            start(key, route);
        }
    }

    private boolean updateRoute(Path key, SchedulerRoute route) {
        WorkspaceState existing = workspaces.get(key);
        if (existing == null) {
            return false;
        }
        if (route != null) {
            existing.routes.setLatestRoute(route);
        }
        return true;
    }

    private void start(Path key, SchedulerRoute route) {
        if (!AgentRunnerService.EFFECTIVE_PERMISSION_MODE.equals(permissionMode)) {
            log.warn("Overriding scheduler permission mode {} with {} for {}",
                permissionMode, AgentRunnerService.EFFECTIVE_PERMISSION_MODE, key);
        }

        AgentSession session = runtime.start(RuntimeOptions.builder()
            .workingDirectory(key)
            .model(model == null || model.isBlank() ? null : model)
            .permissionMode(AgentRunnerService.EFFECTIVE_PERMISSION_MODE)
            .allowedTools(AllowedTools.resolve(allowedTools))
            .build());

        try {
            JsonNode startResponse = control(session, CONTROL_START);
            JsonNode statusResponse = control(session, CONTROL_STATUS);
            log.info("Scheduler bridge initialized for {} (start={}, status={})", key, startResponse, statusResponse);
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }

        WorkspaceState state = new WorkspaceState(session);
        if (route != null) {
            state.routes.setLatestRoute(route);
        }
        workspaces.put(key, state);
        executor.execute(() -> consume(key, state));
    }

    /**
     * Refreshes an existing scheduler session after an interactive run may
     * have changed the workspace's job files. Failures are logged only.
     */
    public void syncWorkspace(Path workspaceDir) {
        Path key = workspaceDir.toAbsolutePath().normalize();
        WorkspaceState state = workspaces.get(key);
        if (state == null) {
            return;
        }
        try {
            JsonNode statusResponse = control(state.session, CONTROL_STATUS);
            JsonNode startResponse = control(state.session, CONTROL_START);
            log.debug("Scheduler bridge synced {} (status={}, start={})", key, statusResponse, startResponse);
        } catch (RuntimeException e) {
            log.error("Scheduler bridge sync failed for {}", key, e);
        }
    }

    public boolean isActive(Path workspaceDir) {
        return workspaces.containsKey(workspaceDir.toAbsolutePath().normalize());
    }

    public int activeCount() {
        return workspaces.size();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void bootstrapAll() {
        if (!enabled) {
            log.info("Scheduler bootstrap disabled");
            return;
        }
        List<Path> workspaceDirs;
        try {
            workspaceDirs = workspaceService.listWorkspaces();
        } catch (IOException e) {
            log.error("Scheduler bootstrap could not list workspaces", e);
            return;
        }
        for (Path dir : workspaceDirs) {
            String name = dir.getFileName().toString();
            SchedulerRoute route = name.startsWith(WorkspaceService.CHANNEL_PREFIX)
                ? SchedulerRoute.channel(name.substring(WorkspaceService.CHANNEL_PREFIX.length()), null)
                : null;
            try {
                ensureWorkspace(dir, route);
            } catch (RuntimeException e) {
                log.error("Scheduler bootstrap failed for {}", dir, e);
            }
        }
        log.info("Scheduler bootstrap completed for {} workspaces", workspaceDirs.size());
    }

    public void stopAll() {
        List<WorkspaceState> states = new ArrayList<>(workspaces.values());
        for (WorkspaceState state : states) {
            state.closing = true;
        }
        for (WorkspaceState state : states) {
            state.session.close();
        }
        workspaces.clear();
        log.info("Stopped {} scheduler sessions", states.size());
    }

    @PreDestroy
    public void shutdown() {
        stopAll();
        executor.shutdown();
    }

    private void consume(Path key, WorkspaceState state) {
        try {
            Optional<RuntimeEvent> next;
            while ((next = state.session.nextEvent()).isPresent()) {
                handleEvent(key, state, next.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Scheduler bridge stream failed for {}", key, e);
        } finally {
            if (!state.closing) {
                log.warn("Scheduler bridge stopped unexpectedly for {}; clearing workspace session", key);
            }
            workspaces.remove(key, state);
            state.session.close();
        }
    }

    void handleEvent(Path key, WorkspaceState state, RuntimeEvent event) {
        if (!event.isType(RuntimeEvent.SYSTEM) || !SCHEDULER_EVENT.equals(event.getSubtype())) {
            return;
        }
        JsonNode job = event.getData() == null ? null : event.getData().get("event");
        if (job == null || !job.isObject()) {
            return;
        }
        String jobId = textOrNull(job, "jobId");
        String action = textOrNull(job, "action");
        if (jobId == null || action == null) {
            return;
        }

        switch (action) {
            case "added" -> state.routes.bindJob(jobId);
            case "removed" -> state.routes.removeJob(jobId);
            case "finished" -> deliverFinished(key, state, jobId, job);
            default -> log.debug("Ignoring scheduler action {} for job {}", action, jobId);
        }
    }

    private void deliverFinished(Path key, WorkspaceState state, String jobId, JsonNode job) {
        Optional<SchedulerRoute> route = state.routes.resolve(jobId);
        if (route.isEmpty()) {
            log.warn("Scheduler event for job {} in {} has no route mapping", jobId, key);
            return;
        }
        String text = formatFinished(jobId, textOrNull(job, "status"),
            textOrNull(job, "summary"), textOrNull(job, "error"));
        try {
            if (!delivery.deliver(route.get(), text)) {
                log.warn("Scheduled message for job {} was not delivered to {}", jobId, route.get().getChannelId());
            }
        } catch (RuntimeException e) {
            log.error("Failed to deliver scheduled message for job {} in {}", jobId, key, e);
        }
    }

    static String formatFinished(String jobId, String status, String summary, String error) {
        String id = jobId != null ? jobId : "unknown";
        String details = summary != null && !summary.isEmpty() ? summary
            : error != null && !error.isEmpty() ? error
            : "completed";
        String effectiveStatus = status != null ? status : "ok";
        return switch (effectiveStatus) {
            case "ok" -> String.format("Scheduled job %s: %s", id, details);
            case "skipped" -> String.format("Scheduled job %s was skipped: %s", id, details);
            default -> String.format("Scheduled job %s failed: %s", id, details);
        };
    }

    private JsonNode control(AgentSession session, String subtype) {
        try {
            return session.sendControlRequest(subtype, CWD_PAYLOAD).get(controlTimeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentRuntimeException("Interrupted during control request " + subtype, e);
        } catch (ExecutionException e) {
            throw new AgentRuntimeException("Control request " + subtype + " failed: " + e.getCause().getMessage(),
                e.getCause());
        } catch (TimeoutException e) {
            throw new AgentRuntimeException("Control request " + subtype + " timed out", e);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    static final class WorkspaceState {
        private final SchedulerRoutes routes = new SchedulerRoutes();
        private final AgentSession session;
        private volatile boolean closing;

        WorkspaceState(AgentSession session) {
            this.session = session;
        }
    }
}
