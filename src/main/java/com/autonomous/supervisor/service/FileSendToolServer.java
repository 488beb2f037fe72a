package com.autonomous.supervisor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * MCP server spoken over stdio that gives the agent runtime its file-send
 * tools. The runtime launches one per run; every tool call lands in the
 * workspace's tool queue, which the runner drains after the run.
 *
 * <p>Tools: {@code SendFileToChat}, its alias {@code send_file_to_chat}, and
 * the {@code message} compatibility tool.
 */
@Slf4j
public class FileSendToolServer {

    public static final String COMMAND = "file-send-tool-server";
    public static final String SERVER_NAME = "chat";
    public static final String SEND_FILE_TOOL = "SendFileToChat";
    public static final String SEND_FILE_ALIAS = "send_file_to_chat";
    public static final String MESSAGE_TOOL = "message";

    private static final String JSONRPC_VERSION = "2.0";
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final int METHOD_NOT_FOUND = -32601;
    private static final int INVALID_PARAMS = -32602;

    private final Path workspace;
    private final ToolOutputQueueService toolQueue;
    private final ObjectMapper mapper;

    public FileSendToolServer(Path workspace, ToolOutputQueueService toolQueue, ObjectMapper mapper) {
        this.workspace = workspace.toAbsolutePath().normalize();
        this.toolQueue = toolQueue;
        this.mapper = mapper;
    }

    /**
     * Entry point for the subprocess. Stdout carries the protocol, so anything
     * else printed there (logging included) is sent to stderr.
     */
    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            System.err.println("Usage: " + COMMAND + " <workspace-dir>");
            System.exit(2);
        }
        PrintStream protocolOut = System.out;
        System.setOut(System.err);
        ObjectMapper mapper = new ObjectMapper();
        new FileSendToolServer(Paths.get(args[0]), new ToolOutputQueueService(mapper), mapper)
            .serve(System.in, protocolOut);
    }

    public void serve(InputStream in, OutputStream out) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode request;
            try {
                request = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unparseable tool request: {}", e.getMessage());
                continue;
            }
            JsonNode response = handle(request);
            if (response != null) {
                writer.write(mapper.writeValueAsString(response));
                writer.newLine();
                writer.flush();
            }
        }
    }

    /**
     * Answers one JSON-RPC message. Notifications (no {@code id}) get no answer
     * and yield null.
     */
    JsonNode handle(JsonNode request) {
        JsonNode id = request.get("id");
        String method = request.path("method").asText("");
        if (id == null || id.isNull()) {
            log.debug("Tool server notification: {}", method);
            return null;
        }
        JsonNode params = request.path("params");
        return switch (method) {
            case "initialize" -> success(id, initializeResult());
            case "ping" -> success(id, mapper.createObjectNode());
            case "tools/list" -> success(id, toolsListResult());
            case "tools/call" -> callTool(id, params);
            default -> error(id, METHOD_NOT_FOUND, "Method not found: " + method);
        };
    }

    private ObjectNode initializeResult() {
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", MCP_PROTOCOL_VERSION);
        result.putObject("capabilities").putObject("tools");
        ObjectNode info = result.putObject("serverInfo");
        info.put("name", SERVER_NAME);
        info.put("version", "1.0.0");
        return result;
    }

    private ObjectNode toolsListResult() {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode tools = result.putArray("tools");
        tools.add(fileTool(SEND_FILE_TOOL, "Queue a file from the workspace to be sent back to the user in chat. "
            + "The file must exist within your workspace directory. Create the file first, then call this tool "
            + "with its path."));
        tools.add(fileTool(SEND_FILE_ALIAS, "Alias for " + SEND_FILE_TOOL + "."));

        ObjectNode message = tools.addObject();
        message.put("name", MESSAGE_TOOL);
        message.put("description", "Compatibility tool for message-based delivery. Prefer " + SEND_FILE_TOOL
            + " for files. A media value of file://<path> inside the workspace is queued for upload.");
        ObjectNode schema = message.putObject("inputSchema");
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        for (String name : new String[] {"action", "message", "media", "channel", "to"}) {
            properties.putObject(name).put("type", "string");
        }
        return result;
    }

    private ObjectNode fileTool(String name, String description) {
        ObjectNode tool = mapper.createObjectNode();
        tool.put("name", name);
        tool.put("description", description);
        ObjectNode schema = tool.putObject("inputSchema");
        schema.put("type", "object");
        ObjectNode filePath = schema.putObject("properties").putObject("file_path");
        filePath.put("type", "string");
        filePath.put("description", "Path to the file within your workspace");
        schema.putArray("required").add("file_path");
        return tool;
    }

    private JsonNode callTool(JsonNode id, JsonNode params) {
        String name = params.path("name").asText("");
        JsonNode arguments = params.path("arguments");
        try {
            return switch (name) {
                case SEND_FILE_TOOL, SEND_FILE_ALIAS ->
                    success(id, toolText(queueFile(arguments.path("file_path").asText(""))));
                case MESSAGE_TOOL -> success(id, toolText(queueMessage(arguments)));
                default -> error(id, INVALID_PARAMS, "Unknown tool: " + name);
            };
        } catch (IOException e) {
            log.error("Tool {} failed in {}", name, workspace, e);
            ObjectNode result = toolText("Error: " + e.getMessage());
            result.put("isError", true);
            return success(id, result);
        }
    }

    private String queueFile(String rawPath) throws IOException {
        Optional<Path> resolved = ToolOutputQueueService.resolveInside(workspace, rawPath);
        if (resolved.isEmpty()) {
            return "Error: file must be within your workspace " + workspace;
        }
        if (!Files.exists(resolved.get())) {
            return "Error: file not found at " + resolved.get();
        }
        toolQueue.queueUpload(workspace, resolved.get().toString());
        return "File queued for upload: " + resolved.get();
    }

    private String queueMessage(JsonNode arguments) throws IOException {
        String text = arguments.path("message").asText("").trim();
        String media = arguments.path("media").asText("").trim();
        if (text.isEmpty() && media.isEmpty()) {
            return "No message or media provided.";
        }
        if (!text.isEmpty()) {
            toolQueue.queueMessage(workspace, text);
        }
        if (media.startsWith("file://")) {
            String fileResult = queueFile(media.substring("file://".length()));
            if (fileResult.startsWith("Error:")) {
                return fileResult;
            }
        }
        return "Message request captured for Slack delivery.";
    }

    private ObjectNode toolText(String text) {
        ObjectNode result = mapper.createObjectNode();
        ObjectNode content = result.putArray("content").addObject();
        content.put("type", "text");
        content.put("text", text);
        return result;
    }

    private ObjectNode success(JsonNode id, JsonNode result) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.set("id", id);
        response.set("result", result);
        return response;
    }

    private ObjectNode error(JsonNode id, int code, String message) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.set("id", id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return response;
    }
}
