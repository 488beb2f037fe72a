package com.autonomous.supervisor.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tool names passed to the runtime as its allowed-tool list. The file-send
 * names and the message/slack compatibility names must stay in the list; the
 * system context tells the model to use them.
 */
public final class AllowedTools {

    public static final List<String> DEFAULT = List.of(
        "Read",
        "Write",
        "Edit",
        "MultiEdit",
        "Glob",
        "Grep",
        "Bash",
        "WebFetch",
        "WebSearch",
        "TodoWrite",
        "NotebookEdit",
        "Skill",
        "SendFileToChat",
        "send_file_to_chat",
        "message",
        "slack");

    private AllowedTools() {
    }

    /**
     * Comma-separated override from configuration, or the defaults when blank.
     */
    public static List<String> resolve(String override) {
        if (override == null || override.isBlank()) {
            return DEFAULT;
        }
        Set<String> tools = new LinkedHashSet<>();
        for (String name : override.split(",")) {
            if (!name.isBlank()) {
                tools.add(name.trim());
            }
        }
        return new ArrayList<>(tools);
    }
}
