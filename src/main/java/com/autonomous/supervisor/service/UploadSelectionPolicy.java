package com.autonomous.supervisor.service;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which candidate files are returned to the user for a turn.
 *
 * <p>Explicit file names in the user's text win. Without them, an upload verb
 * combined with plural wording ("files", "attachments", "both") selects every
 * candidate, and an upload verb combined with a demonstrative ("this", "that",
 * "it", "the file") selects the single most relevant one. Anything else
 * selects nothing. When both phrasings match, selecting everything wins.
 */
@Slf4j
public final class UploadSelectionPolicy {

    private static final Pattern UPLOAD_INTENT =
        Pattern.compile("\\b(attach|upload|send|share)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERB_DEMONSTRATIVE =
        Pattern.compile("\\b(attach|upload|send|share)\\s+(this|that|it)\\b");
    private static final Pattern DEMONSTRATIVE_FILE =
        Pattern.compile("\\b(this|that|the)\\s+file\\b");
    private static final Pattern VERB_THEN_FILE =
        Pattern.compile("\\b(attach|upload|send|share)\\b[\\s\\w]*(file|attachment)\\b");
    private static final Pattern PLURAL_NOUN = Pattern.compile("\\b(files|attachments)\\b");
    private static final Pattern BOTH = Pattern.compile("\\bboth\\b");
    private static final Pattern FILE_NAME_TOKEN = Pattern.compile("[^\\s\"'`<>]+\\.[A-Za-z0-9_-]+");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[(\\[{\"'`]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[)\\]}\"'`,.;:!?]+$");

    private static final List<String> BLOCKED_PREFIXES =
        List.of(WorkspaceLayout.TOOLS_DIR, WorkspaceLayout.RUNTIME_DIR);

    private static final int TIER_ATTACHMENT = 3;
    private static final int TIER_GENERIC = 2;
    private static final int TIER_SESSION_STATE = 1;

    private UploadSelectionPolicy() {
    }

    public static List<Path> select(List<Path> candidates, String userText, Path workspaceRoot) {
        return select(candidates, userText, workspaceRoot, "queued");
    }

    public static List<Path> select(List<Path> candidates, String userText, Path workspaceRoot, String source) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        String text = userText == null ? "" : userText;
        List<String> requested = new ArrayList<>();
        for (String name : requestedFileNames(text)) {
            requested.add(name.toLowerCase(Locale.ROOT));
        }
        boolean selectAll = requested.isEmpty() && wantsAll(text);
        boolean selectLatest = requested.isEmpty() && wantsLatest(text);

        Set<Path> accepted = new LinkedHashSet<>();
        List<Path> autoCandidates = new ArrayList<>();
        Map<Path, String> dropped = new LinkedHashMap<>();

        for (Path candidate : candidates) {
            Path abs = root.resolve(candidate).normalize();
            if (!abs.startsWith(root)) {
                dropped.put(abs, "outside_workspace");
                continue;
            }
            if (!Files.exists(abs)) {
                dropped.put(abs, "missing");
                continue;
            }
            if (isBlocked(abs, root)) {
                dropped.put(abs, "blocked_internal_path");
                continue;
            }
            if (requested.isEmpty()) {
                if (selectAll || selectLatest) {
                    autoCandidates.add(abs);
                } else {
                    dropped.put(abs, "no_explicit_file_request");
                }
                continue;
            }
            if (!matchesRequested(abs, requested)) {
                dropped.put(abs, "not_user_requested");
                continue;
            }
            accepted.add(abs);
        }

        if (selectAll && !autoCandidates.isEmpty()) {
            List<Path> chosen = new ArrayList<>();
            for (Path path : autoCandidates) {
                if (isAttachment(path, root)) {
                    chosen.add(path);
                }
            }
            if (chosen.isEmpty()) {
                for (Path path : autoCandidates) {
                    if (!isSessionState(path)) {
                        chosen.add(path);
                    }
                }
            }
            if (chosen.isEmpty()) {
                chosen.addAll(autoCandidates);
            }
            accepted.addAll(chosen);
            for (Path path : autoCandidates) {
                if (!accepted.contains(path)) {
                    dropped.put(path, "auto_selected_all_excluded");
                }
            }
            log.info("Auto-selected {} of {} upload candidates ({})", chosen.size(), autoCandidates.size(), source);
        } else if (selectLatest && !autoCandidates.isEmpty()) {
            Path selected = latest(autoCandidates, root);
            accepted.add(selected);
            for (Path path : autoCandidates) {
                if (!path.equals(selected)) {
                    dropped.put(path, "auto_selected_latest_other");
                }
            }
            log.info("Auto-selected latest upload candidate {} ({})", selected, source);
        }

        if (!dropped.isEmpty()) {
            log.info("Upload policy kept {} and dropped {} files ({}): {}",
                accepted.size(), dropped.size(), source, sample(dropped));
        }
        return new ArrayList<>(accepted);
    }

    public static boolean hasUploadIntent(String text) {
        return text != null && UPLOAD_INTENT.matcher(text).find();
    }

    /**
     * Tokens that look like {@code name.ext}, stripped of surrounding
     * punctuation and reduced to their base name, de-duplicated in order.
     */
    public static List<String> requestedFileNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (text == null) {
            return new ArrayList<>();
        }
        Matcher matcher = FILE_NAME_TOKEN.matcher(text);
        while (matcher.find()) {
            String token = matcher.group().trim();
            token = LEADING_PUNCTUATION.matcher(token).replaceAll("");
            token = TRAILING_PUNCTUATION.matcher(token).replaceAll("");
            if (!token.isEmpty()) {
                names.add(baseName(token));
            }
        }
        return new ArrayList<>(names);
    }

    /**
     * Files the user named directly, looked up in the workspace root and in its
     * attachments directory.
     */
    public static List<Path> fallbackUploadsFromRequest(String userText, Path workspaceRoot) {
        Set<Path> found = new LinkedHashSet<>();
        if (!hasUploadIntent(userText)) {
            return new ArrayList<>();
        }
        Path root = workspaceRoot.toAbsolutePath().normalize();
        for (String name : requestedFileNames(userText)) {
            Path direct = root.resolve(name).normalize();
            if (direct.startsWith(root) && Files.exists(direct)) {
                found.add(direct);
            }
            Path inAttachments = root.resolve(WorkspaceLayout.ATTACHMENTS_DIR).resolve(name).normalize();
            if (inAttachments.startsWith(root) && Files.exists(inAttachments)) {
                found.add(inAttachments);
            }
        }
        return new ArrayList<>(found);
    }

    static boolean wantsAll(String text) {
        if (!hasUploadIntent(text) || !requestedFileNames(text).isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return PLURAL_NOUN.matcher(lower).find() || BOTH.matcher(lower).find();
    }

    static boolean wantsLatest(String text) {
        if (!hasUploadIntent(text) || !requestedFileNames(text).isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return VERB_DEMONSTRATIVE.matcher(lower).find()
            || DEMONSTRATIVE_FILE.matcher(lower).find()
            || VERB_THEN_FILE.matcher(lower).find();
    }

    private static Path latest(List<Path> candidates, Path root) {
        Path selected = null;
        int selectedTier = Integer.MIN_VALUE;
        long selectedMtime = Long.MIN_VALUE;
        for (Path path : candidates) {
            int tier = tier(path, root);
            long mtime = modifiedMillis(path);
            boolean better = selected == null
                || tier > selectedTier
                || (tier == selectedTier && (mtime > selectedMtime
                    || (mtime == selectedMtime && path.toString().compareTo(selected.toString()) > 0)));
            if (better) {
                selected = path;
                selectedTier = tier;
                selectedMtime = mtime;
            }
        }
        return selected;
    }

    private static int tier(Path path, Path root) {
        if (isAttachment(path, root)) {
            return TIER_ATTACHMENT;
        }
        return isSessionState(path) ? TIER_SESSION_STATE : TIER_GENERIC;
    }

    private static long modifiedMillis(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return Long.MIN_VALUE;
        }
    }

    private static boolean matchesRequested(Path abs, List<String> requested) {
        String lowerPath = abs.toString().toLowerCase(Locale.ROOT);
        String lowerBase = baseName(lowerPath);
        for (String name : requested) {
            if (name.equals(lowerBase) || lowerPath.endsWith(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isBlocked(Path abs, Path root) {
        String rel = relative(abs, root);
        if (rel.isEmpty()) {
            return true;
        }
        for (String prefix : BLOCKED_PREFIXES) {
            if (rel.equals(prefix) || rel.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAttachment(Path abs, Path root) {
        return relative(abs, root).startsWith(WorkspaceLayout.ATTACHMENTS_DIR + "/");
    }

    private static boolean isSessionState(Path abs) {
        Path fileName = abs.getFileName();
        return fileName != null && fileName.toString().equalsIgnoreCase(WorkspaceLayout.SESSION_FILE);
    }

    private static String relative(Path abs, Path root) {
        return root.relativize(abs).toString().replace('\\', '/');
    }

    private static String baseName(String value) {
        int slash = Math.max(value.lastIndexOf('/'), value.lastIndexOf('\\'));
        return slash >= 0 ? value.substring(slash + 1) : value;
    }

    private static String sample(Map<Path, String> dropped) {
        StringBuilder out = new StringBuilder();
        int count = 0;
        for (Map.Entry<Path, String> entry : dropped.entrySet()) {
            if (count++ == 10) {
                out.append(", ...");
                break;
            }
            if (out.length() > 0) {
                out.append(", ");
            }
            out.append(entry.getKey().getFileName()).append('=').append(entry.getValue());
        }
        return out.toString();
    }
}
