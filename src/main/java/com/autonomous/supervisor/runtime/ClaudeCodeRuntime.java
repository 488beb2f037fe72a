package com.autonomous.supervisor.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the Claude Code CLI in stream-json mode, one process per session.
 */
@Slf4j
@Component
public class ClaudeCodeRuntime implements AgentRuntime {

    @Value("${claude.code.path:claude}")
    private String claudeCodePath;

    @Value("${claude.code.control-timeout-seconds:60}")
    private long controlTimeoutSeconds = 60;

    private final ObjectMapper objectMapper;

    public ClaudeCodeRuntime(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void setClaudeCodePath(String path) {
        this.claudeCodePath = path;
    }

    @Override
    public AgentSession start(RuntimeOptions options) {
        List<String> command = buildCommand(options);
        log.info("Starting agent runtime in {} (resume={})",
            options.getWorkingDirectory(), options.getResumeSessionId());

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(options.getWorkingDirectory().toFile());
        pb.redirectErrorStream(false);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new AgentRuntimeException("Failed to start " + claudeCodePath + ": " + e.getMessage(), e);
        }

        String label = options.getWorkingDirectory().getFileName().toString();
        ClaudeCodeSession session = new ClaudeCodeSession(label, process, objectMapper, controlTimeoutSeconds);
        session.begin(options.getPrompt());
        return session;
    }

    List<String> buildCommand(RuntimeOptions options) {
        List<String> command = new ArrayList<>();
        command.add(claudeCodePath);
        command.add("-p");
        command.add("--input-format");
        command.add("stream-json");
        command.add("--output-format");
        command.add("stream-json");
        command.add("--verbose");

        if (options.getModel() != null && !options.getModel().isBlank()) {
            command.add("--model");
            command.add(options.getModel());
        }
        if (options.getPermissionMode() != null) {
            command.add("--permission-mode");
            command.add(options.getPermissionMode());
        }
        if (!options.getAllowedTools().isEmpty()) {
            command.add("--allowedTools");
            command.add(String.join(",", options.getAllowedTools()));
        }
        if (options.getMcpConfigPath() != null) {
            command.add("--mcp-config");
            command.add(options.getMcpConfigPath().toString());
        }
        if (options.getResumeSessionId() != null && !options.getResumeSessionId().isBlank()) {
            command.add("--resume");
            command.add(options.getResumeSessionId());
        }
        return command;
    }
}
