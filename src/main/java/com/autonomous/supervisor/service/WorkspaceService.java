package com.autonomous.supervisor.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Service
public class WorkspaceService {

    public static final String CHANNEL_PREFIX = "channel-";

    @Value("${agent.data.path:data}")
    private String dataPath;

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public Path workspacesRoot() {
        return Paths.get(dataPath, "workspaces").toAbsolutePath().normalize();
    }

    public Path userWorkspace(String userId) throws IOException {
        return ensure(workspacesRoot().resolve(sanitize(userId)));
    }

    public Path channelWorkspace(String channelId) throws IOException {
        return ensure(workspacesRoot().resolve(CHANNEL_PREFIX + sanitize(channelId)));
    }

    public List<Path> listWorkspaces() throws IOException {
        Path root = workspacesRoot();
        Files.createDirectories(root);
        List<Path> workspaces = new ArrayList<>();
        try (Stream<Path> entries = Files.list(root)) {
            entries.filter(Files::isDirectory).sorted().forEach(workspaces::add);
        }
        return workspaces;
    }

    private Path ensure(Path workspace) throws IOException {
        Files.createDirectories(workspace.resolve(WorkspaceLayout.ATTACHMENTS_DIR));
        return workspace;
    }

    private String sanitize(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Workspace identity must not be blank");
        }
        return id.replaceAll("[^A-Za-z0-9_-]", "_");
    }
}
