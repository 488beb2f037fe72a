package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.ToolQueueSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * File-backed hand-off between tool handlers running inside the agent runtime
 * and the runner. Handlers append; the runner drains after each run, which
 * always leaves the queue empty.
 */
@Slf4j
@Service
public class ToolOutputQueueService {

    private final ObjectMapper mapper;

    public ToolOutputQueueService(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Path queueFile(Path workspace) {
        return workspace.resolve(WorkspaceLayout.TOOL_QUEUE_FILE);
    }

    public void reset(Path workspace) throws IOException {
        write(workspace, ToolQueueSnapshot.empty());
    }

    /**
     * Reads the pending output and resets the queue. Upload entries are kept
     * only when they resolve inside the workspace and exist; missing or
     * malformed queue content reads as empty.
     */
    public ToolQueueSnapshot drain(Path workspace) throws IOException {
        try {
            return normalize(readRaw(workspace), workspace);
        } finally {
            reset(workspace);
        }
    }

    public boolean queueUpload(Path workspace, String filePath) throws IOException {
        Optional<Path> resolved = resolveInside(workspace, filePath);
        if (resolved.isEmpty() || !Files.exists(resolved.get())) {
            log.debug("Rejected upload outside workspace or missing: {}", filePath);
            return false;
        }
        ToolQueueSnapshot snapshot = load(workspace);
        snapshot.getUploads().add(resolved.get().toString());
        write(workspace, snapshot);
        return true;
    }

    public boolean queueMessage(Path workspace, String message) throws IOException {
        String value = message == null ? "" : message.trim();
        if (value.isEmpty()) {
            return false;
        }
        ToolQueueSnapshot snapshot = load(workspace);
        snapshot.getMessages().add(value);
        write(workspace, snapshot);
        return true;
    }

    /**
     * Resolves a possibly relative path against the workspace root, returning
     * empty when the result escapes the workspace.
     */
    public static Optional<Path> resolveInside(Path workspace, String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Optional.empty();
        }
        Path root = workspace.toAbsolutePath().normalize();
        Path candidate;
        try {
            candidate = root.resolve(rawPath).normalize();
        } catch (RuntimeException e) {
            return Optional.empty();
        }
        return candidate.startsWith(root) ? Optional.of(candidate) : Optional.empty();
    }

    private ToolQueueSnapshot load(Path workspace) {
        JsonNode raw = readRaw(workspace);
        ToolQueueSnapshot snapshot = ToolQueueSnapshot.empty();
        if (raw == null) {
            return snapshot;
        }
        snapshot.getUploads().addAll(strings(raw.get("uploads")));
        snapshot.getMessages().addAll(strings(raw.get("messages")));
        return snapshot;
    }

    private JsonNode readRaw(Path workspace) {
        Path file = queueFile(workspace);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Tool queue at {} is unreadable, treating as empty: {}", file, e.getMessage());
            return null;
        }
    }

    private ToolQueueSnapshot normalize(JsonNode raw, Path workspace) {
        if (raw == null || !raw.isObject()) {
            return ToolQueueSnapshot.empty();
        }
        Set<String> uploads = new LinkedHashSet<>();
        for (String entry : strings(raw.get("uploads"))) {
            resolveInside(workspace, entry)
                .filter(Files::exists)
                .ifPresent(path -> uploads.add(path.toString()));
        }
        Set<String> messages = new LinkedHashSet<>();
        for (String entry : strings(raw.get("messages"))) {
            String trimmed = entry.trim();
            if (!trimmed.isEmpty()) {
                messages.add(trimmed);
            }
        }
        return new ToolQueueSnapshot(new ArrayList<>(uploads), new ArrayList<>(messages));
    }

    private List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return out;
        }
        for (JsonNode item : array) {
            if (item.isTextual()) {
                out.add(item.asText());
            }
        }
        return out;
    }

    private void write(Path workspace, ToolQueueSnapshot snapshot) throws IOException {
        Path file = queueFile(workspace);
        Files.createDirectories(file.getParent());
        Files.writeString(file, mapper.writeValueAsString(snapshot), StandardCharsets.UTF_8);
    }
}
