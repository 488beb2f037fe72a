package com.autonomous.supervisor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the runtime session id of a workspace so the next run can resume it.
 */
@Slf4j
@Service
public class SessionStoreService {

    private final ObjectMapper mapper;

    public SessionStoreService(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<String> getSessionId(Path workspace) {
        Path file = workspace.resolve(WorkspaceLayout.SESSION_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(Files.readString(file, StandardCharsets.UTF_8));
            String sessionId = node == null ? null : node.path("sessionId").asText(null);
            return Optional.ofNullable(sessionId).filter(id -> !id.isBlank());
        } catch (IOException e) {
            log.warn("Ignoring unreadable session file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void saveSessionId(Path workspace, String sessionId) throws IOException {
        Files.createDirectories(workspace);
        Files.writeString(workspace.resolve(WorkspaceLayout.SESSION_FILE),
            mapper.writeValueAsString(Map.of("sessionId", sessionId)), StandardCharsets.UTF_8);
    }

    public void clearSessionId(Path workspace) throws IOException {
        Files.deleteIfExists(workspace.resolve(WorkspaceLayout.SESSION_FILE));
    }
}
