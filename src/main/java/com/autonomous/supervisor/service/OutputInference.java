package com.autonomous.supervisor.service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers file and message output the model wrote as plain text tokens
 * ({@code MEDIA:<path>}, {@code file://<path>}, {@code MESSAGE:<text>})
 * instead of calling a file-send tool.
 */
public final class OutputInference {

    private static final Pattern MEDIA_TOKEN = Pattern.compile("MEDIA:(\\S+)");
    private static final Pattern FILE_URL = Pattern.compile("file://(\\S+)");
    private static final Pattern MESSAGE_TOKEN = Pattern.compile("MESSAGE:([^\\n\\r]+)");
    private static final String FILE_SCHEME = "file://";

    private OutputInference() {
    }

    public static List<Path> uploadsFromText(String text, Path workspaceRoot) {
        Set<Path> found = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        Matcher media = MEDIA_TOKEN.matcher(text);
        while (media.find()) {
            String raw = media.group(1).trim();
            addIfInside(found, raw.startsWith(FILE_SCHEME) ? raw.substring(FILE_SCHEME.length()) : raw, workspaceRoot);
        }
        Matcher fileUrl = FILE_URL.matcher(text);
        while (fileUrl.find()) {
            addIfInside(found, fileUrl.group(1), workspaceRoot);
        }
        return new ArrayList<>(found);
    }

    public static List<String> messagesFromText(String text) {
        Set<String> messages = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return new ArrayList<>();
        }
        Matcher matcher = MESSAGE_TOKEN.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(1).trim();
            if (!value.isEmpty()) {
                messages.add(value);
            }
        }
        return new ArrayList<>(messages);
    }

    private static void addIfInside(Set<Path> found, String rawPath, Path workspaceRoot) {
        ToolOutputQueueService.resolveInside(workspaceRoot, rawPath)
            .filter(Files::exists)
            .ifPresent(found::add);
    }
}
