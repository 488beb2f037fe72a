package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.AgentRunRequest;
import com.autonomous.supervisor.model.AgentRunResult;
import com.autonomous.supervisor.model.ToolQueueSnapshot;
import com.autonomous.supervisor.runtime.AgentRuntime;
import com.autonomous.supervisor.runtime.AgentRuntimeException;
import com.autonomous.supervisor.runtime.AgentSession;
import com.autonomous.supervisor.runtime.RuntimeEvent;
import com.autonomous.supervisor.runtime.RuntimeOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one interactive turn against the agent runtime: resume or start a
 * session, send the prompt with its system context, stream assistant text
 * back, then collect the files and messages the turn produced.
 */
@Slf4j
@Service
public class AgentRunnerService {

    public static final String EFFECTIVE_PERMISSION_MODE = "bypassPermissions";
    static final List<String> FILE_SEND_TOOLS = List.of("SendFileToChat", "send_file_to_chat");
    private static final String INTERACTIVE_CONFIRMATION_ERROR =
        "Interactive confirmation is disabled in non-interactive mode";

    private final AgentRuntime runtime;
    private final SessionStoreService sessionStore;
    private final ToolOutputQueueService toolQueue;
    private final FileSendToolProvisioner toolProvisioner;

    @Autowired(required = false)
    private CostTrackerService costTracker;

    @Value("${claude.code.permission-mode:bypassPermissions}")
    private String permissionMode = EFFECTIVE_PERMISSION_MODE;

    @Value("${claude.code.allowed-tools:}")
    private String allowedTools = "";

    public AgentRunnerService(AgentRuntime runtime, SessionStoreService sessionStore,
                              ToolOutputQueueService toolQueue, FileSendToolProvisioner toolProvisioner) {
        this.runtime = runtime;
        this.sessionStore = sessionStore;
        this.toolQueue = toolQueue;
        this.toolProvisioner = toolProvisioner;
    }

    public void setPermissionMode(String permissionMode) {
        this.permissionMode = permissionMode;
    }

    public void setCostTracker(CostTrackerService costTracker) {
        this.costTracker = costTracker;
    }

    public List<String> allowedTools() {
        return AllowedTools.resolve(allowedTools);
    }

    public AgentRunResult run(AgentRunRequest request) throws IOException {
        Path workspace = request.getWorkspaceDir().toAbsolutePath().normalize();
        if (!EFFECTIVE_PERMISSION_MODE.equals(permissionMode)) {
            log.warn("Overriding permission mode {} with {} for non-interactive run",
                permissionMode, EFFECTIVE_PERMISSION_MODE);
        }

        Optional<String> existingSessionId = sessionStore.getSessionId(workspace);
        toolQueue.reset(workspace);
        Path toolConfig = provisionTools(workspace);

        String systemContext = SystemContextBuilder.build(
            request.getPlatform(),
            request.getUserName(),
            workspace,
            request.getOrgName(),
            request.getBotName(),
            request.getChannelContext());
        String prompt = SystemContextBuilder.buildPrompt(
            request.getUserMessage(), request.getAttachments(), systemContext);

        log.info("Starting agent run in {} (resume={}, model={}, attachments={}, mode={})",
            workspace,
            existingSessionId.orElse(null),
            request.getModel(),
            request.getAttachments().size(),
            request.getChannelContext() != null ? "channel" : "dm");

        RuntimeOptions options = RuntimeOptions.builder()
            .workingDirectory(workspace)
            .model(request.getModel())
            .permissionMode(EFFECTIVE_PERMISSION_MODE)
            .allowedTools(runAllowedTools(toolConfig != null))
            .resumeSessionId(existingSessionId.orElse(null))
            .mcpConfigPath(toolConfig)
            .prompt(prompt)
            .build();

        RunState state = new RunState();
        AgentSession session = runtime.start(options);
        try {
            consume(session, request, state);
            if (state.sessionId == null) {
                state.sessionId = session.getSessionId();
            }
        } finally {
            session.close();
        }

        if (!state.resultSeen) {
            throw new AgentRuntimeException("Agent runtime ended without a result for " + workspace);
        }

        persistSession(workspace, existingSessionId, state);

        ToolQueueSnapshot queued = toolQueue.drain(workspace);
        String userText = request.getUserMessage();
        List<Path> uploads = UploadSelectionPolicy.select(toPaths(queued.getUploads()), userText, workspace, "queued");
        List<String> messages = new ArrayList<>(queued.getMessages());
        if (!uploads.isEmpty() || !messages.isEmpty()) {
            log.info("Drained tool queue for {}: {} uploads, {} messages", workspace, uploads.size(), messages.size());
        }

        if (uploads.isEmpty()) {
            List<Path> requested = UploadSelectionPolicy.fallbackUploadsFromRequest(userText, workspace);
            List<Path> accepted = UploadSelectionPolicy.select(requested, userText, workspace, "fallback_request");
            if (!accepted.isEmpty()) {
                uploads = accepted;
                log.info("Inferred uploads from the user's file request: {}", accepted);
            }
        }
        if (uploads.isEmpty()) {
            Set<Path> mentioned = new LinkedHashSet<>();
            for (String text : state.observedText) {
                mentioned.addAll(OutputInference.uploadsFromText(text, workspace));
            }
            List<Path> accepted = UploadSelectionPolicy.select(
                new ArrayList<>(mentioned), userText, workspace, "fallback_model");
            if (!accepted.isEmpty()) {
                uploads = accepted;
                log.info("Inferred uploads from MEDIA/file references in model output: {}", accepted);
            }
        }

        if (messages.isEmpty()) {
            Set<String> inferred = new LinkedHashSet<>();
            for (String text : state.observedText) {
                inferred.addAll(OutputInference.messagesFromText(text));
            }
            if (!inferred.isEmpty()) {
                messages.addAll(inferred);
                log.info("Inferred {} messages from MESSAGE tokens in model output", inferred.size());
            }
        }

        String text = state.resultText;
        if (text == null && !messages.isEmpty()) {
            text = String.join("\n", messages);
        }

        if (costTracker != null) {
            costTracker.recordRun(request.getChannelId(), state.sessionId, request.getModel(), state.costUsd);
        }

        log.info("Agent run completed for {} (session={}, cost=${}, uploads={}, messages={})",
            request.getUserName(), state.sessionId, state.costUsd, uploads.size(), messages.size());

        return AgentRunResult.builder()
            .messageSent(state.messageSent)
            .text(text)
            .error(state.resultError)
            .sessionId(state.sessionId)
            .costUsd(state.costUsd)
            .pendingUploads(uploads)
            .pendingMessages(messages)
            .build();
    }

    private Path provisionTools(Path workspace) {
        try {
            return toolProvisioner.ensureWorkspaceTools(workspace);
        } catch (IOException e) {
            log.warn("Could not provision file-send tools for {}; run continues without them", workspace, e);
            return null;
        }
    }

    private List<String> runAllowedTools(boolean withToolServer) {
        List<String> tools = new ArrayList<>(allowedTools());
        if (withToolServer) {
            for (String name : FileSendToolProvisioner.QUALIFIED_TOOL_NAMES) {
                if (!tools.contains(name)) {
                    tools.add(name);
                }
            }
        }
        return tools;
    }

    private void consume(AgentSession session, AgentRunRequest request, RunState state) {
        try {
            Optional<RuntimeEvent> next;
            while ((next = session.nextEvent()).isPresent()) {
                RuntimeEvent event = next.get();
                if (event.isType(RuntimeEvent.SYSTEM)) {
                    onSystem(event, state);
                } else if (event.isType(RuntimeEvent.ASSISTANT)) {
                    onAssistant(event, request, state);
                } else if (event.isType(RuntimeEvent.USER)) {
                    state.observedText.addAll(event.contentStrings());
                } else if (event.isType(RuntimeEvent.RESULT)) {
                    onResult(event, state);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentRuntimeException("Interrupted while waiting for the agent runtime", e);
        }
    }

    private void onSystem(RuntimeEvent event, RunState state) {
        if (event.getSubtype() != null && !"init".equals(event.getSubtype())) {
            log.debug("Ignoring system event {}", event.getSubtype());
            return;
        }
        if (event.getSessionId() != null) {
            state.sessionId = event.getSessionId();
        }
        List<String> tools = event.getTools();
        boolean hasFileSendTool = tools.stream().anyMatch(AgentRunnerService::isFileSendTool);
        log.debug("Runtime session {} reports {} tools (file-send available: {})",
            event.getSessionId(), tools.size(), hasFileSendTool);
        if (!hasFileSendTool) {
            state.degraded = true;
            log.warn("No SendFileToChat-compatible tool in session {} ({} tools reported)",
                event.getSessionId(), tools.size());
        }
    }

    private void onAssistant(RuntimeEvent event, AgentRunRequest request, RunState state) {
        state.observedText.addAll(event.contentStrings());
        String text = event.joinedText();
        if (text == null || request.getOnMessage() == null) {
            return;
        }
        try {
            if (request.getOnMessage().deliver(text)) {
                state.messageSent = true;
            } else {
                log.warn("Assistant message was not delivered for session {}", event.getSessionId());
            }
        } catch (Exception e) {
            log.warn("Failed to deliver assistant message for session {}", event.getSessionId(), e);
        }
    }

    private void onResult(RuntimeEvent event, RunState state) {
        state.resultSeen = true;
        state.resultError = event.isError();
        state.costUsd = event.getCostUsd();
        if (event.getSessionId() != null) {
            state.sessionId = event.getSessionId();
        }
        log.info("Runtime result for session {}: subtype={}, error={}",
            event.getSessionId(), event.getSubtype(), event.isError());

        if (!event.isError() && event.getResult() != null) {
            state.resultText = event.getResult();
            state.observedText.add(event.getResult());
            if (event.getResult().contains(INTERACTIVE_CONFIRMATION_ERROR)) {
                log.error("Runtime asked for interactive confirmation in session {}", event.getSessionId());
            }
        }
    }

    private void persistSession(Path workspace, Optional<String> existingSessionId, RunState state) throws IOException {
        if (state.degraded) {
            sessionStore.clearSessionId(workspace);
            log.warn("Discarded session {} for {} (previous {}); next run starts fresh",
                state.sessionId, workspace, existingSessionId.orElse(null));
            return;
        }
        if (state.sessionId != null && !state.sessionId.isBlank()) {
            sessionStore.saveSessionId(workspace, state.sessionId);
        }
    }

    static boolean isFileSendTool(String toolName) {
        for (String candidate : FILE_SEND_TOOLS) {
            if (candidate.equals(toolName) || toolName.endsWith("__" + candidate)) {
                return true;
            }
        }
        return false;
    }

    private static List<Path> toPaths(List<String> values) {
        List<Path> paths = new ArrayList<>();
        for (String value : values) {
            paths.add(Paths.get(value));
        }
        return paths;
    }

    private static final class RunState {
        private String sessionId;
        private String resultText;
        private boolean resultSeen;
        private boolean resultError;
        private boolean degraded;
        private boolean messageSent;
        private double costUsd;
        private final List<String> observedText = new ArrayList<>();
    }
}
