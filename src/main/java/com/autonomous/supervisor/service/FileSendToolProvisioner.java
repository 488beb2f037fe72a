package com.autonomous.supervisor.service;

import com.autonomous.supervisor.SupervisorApplication;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the MCP server config that makes the runtime launch
 * {@link FileSendToolServer} for a workspace. Rewritten before every run so
 * it always points at the running build.
 */
@Slf4j
@Service
public class FileSendToolProvisioner {

    /** Tool names as the runtime reports them once the server is connected. */
    public static final List<String> QUALIFIED_TOOL_NAMES = List.of(
        qualified(FileSendToolServer.SEND_FILE_TOOL),
        qualified(FileSendToolServer.SEND_FILE_ALIAS),
        qualified(FileSendToolServer.MESSAGE_TOOL));

    private final ObjectMapper mapper;

    public FileSendToolProvisioner(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Path ensureWorkspaceTools(Path workspace) throws IOException {
        Path root = workspace.toAbsolutePath().normalize();
        Path configFile = root.resolve(WorkspaceLayout.TOOL_SERVERS_FILE);
        Files.createDirectories(configFile.getParent());

        List<String> command = serverCommand(root);
        ObjectNode config = mapper.createObjectNode();
        ObjectNode server = config.putObject("mcpServers").putObject(FileSendToolServer.SERVER_NAME);
        server.put("type", "stdio");
        server.put("command", command.get(0));
        ArrayNode args = server.putArray("args");
        for (String arg : command.subList(1, command.size())) {
            args.add(arg);
        }

        Files.writeString(configFile, mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config),
            StandardCharsets.UTF_8);
        log.debug("Provisioned file-send tools for {} at {}", root, configFile);
        return configFile;
    }

    /**
     * Relaunches this application in tool-server mode: {@code -jar} for the
     * packaged jar, the plain class path otherwise.
     */
    List<String> serverCommand(Path workspace) {
        List<String> command = new ArrayList<>();
        command.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        String classPath = System.getProperty("java.class.path", "");
        if (classPath.endsWith(".jar") && !classPath.contains(File.pathSeparator)) {
            command.add("-jar");
            command.add(classPath);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(SupervisorApplication.class.getName());
        }
        command.add(FileSendToolServer.COMMAND);
        command.add(workspace.toString());
        return command;
    }

    private static String qualified(String tool) {
        return "mcp__" + FileSendToolServer.SERVER_NAME + "__" + tool;
    }
}
