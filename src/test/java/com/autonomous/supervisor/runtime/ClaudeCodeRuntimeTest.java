package com.autonomous.supervisor.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaudeCodeRuntimeTest {

    private ClaudeCodeRuntime runtime;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        runtime = new ClaudeCodeRuntime(new ObjectMapper());
        runtime.setClaudeCodePath("/opt/bin/claude");
    }

    @Test
    void shouldBuildStreamJsonCommand() {
        List<String> command = runtime.buildCommand(RuntimeOptions.builder()
            .workingDirectory(tempDir)
            .model("sonnet")
            .permissionMode("bypassPermissions")
            .allowedTools(List.of("Read", "SendFileToChat"))
            .resumeSessionId("abc-123")
            .build());

        assertEquals(List.of(
            "/opt/bin/claude", "-p",
            "--input-format", "stream-json",
            "--output-format", "stream-json",
            "--verbose",
            "--model", "sonnet",
            "--permission-mode", "bypassPermissions",
            "--allowedTools", "Read,SendFileToChat",
            "--resume", "abc-123"), command);
    }

    @Test
    void shouldPassToolServerConfig() {
        Path config = tempDir.resolve(".agent-supervisor/tools/mcp-servers.json");

        List<String> command = runtime.buildCommand(RuntimeOptions.builder()
            .workingDirectory(tempDir)
            .mcpConfigPath(config)
            .build());

        int flag = command.indexOf("--mcp-config");
        assertTrue(flag > 0);
        assertEquals(config.toString(), command.get(flag + 1));
    }

    @Test
    void shouldOmitOptionalFlags() {
        List<String> command = runtime.buildCommand(RuntimeOptions.builder()
            .workingDirectory(tempDir)
            .model(" ")
            .build());

        assertFalse(command.contains("--model"));
        assertFalse(command.contains("--resume"));
        assertFalse(command.contains("--allowedTools"));
        assertFalse(command.contains("--permission-mode"));
        assertFalse(command.contains("--mcp-config"));
    }

    @Test
    void shouldWrapLaunchFailure() {
        runtime.setClaudeCodePath(tempDir.resolve("missing-binary").toString());

        AgentRuntimeException error = assertThrows(AgentRuntimeException.class,
            () -> runtime.start(RuntimeOptions.builder().workingDirectory(tempDir).build()));
        assertTrue(error.getMessage().contains("missing-binary"));
    }
}
