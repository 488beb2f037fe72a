package com.autonomous.supervisor.runtime;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class RuntimeOptions {
    private Path workingDirectory;
    private String model;
    private String permissionMode;
    @Builder.Default
    private List<String> allowedTools = new ArrayList<>();
    private String resumeSessionId;
    private Path mcpConfigPath;
    private String prompt;   // null keeps the session open without a turn
}
