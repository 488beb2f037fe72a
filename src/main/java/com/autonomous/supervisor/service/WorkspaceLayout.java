package com.autonomous.supervisor.service;

/**
 * Workspace-relative locations shared by the runner, the tool queue and the upload policy.
 */
public final class WorkspaceLayout {

    public static final String INTERNAL_DIR = ".agent-supervisor";
    public static final String TOOLS_DIR = INTERNAL_DIR + "/tools";
    public static final String RUNTIME_DIR = INTERNAL_DIR + "/runtime";
    public static final String TOOL_SERVERS_FILE = TOOLS_DIR + "/mcp-servers.json";
    public static final String TOOL_QUEUE_FILE = RUNTIME_DIR + "/tool-queue.json";
    public static final String ATTACHMENTS_DIR = "attachments";
    public static final String SESSION_FILE = "session.json";

    private WorkspaceLayout() {
    }
}
