package com.autonomous.supervisor.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single message from the runtime's event stream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuntimeEvent {

    public static final String SYSTEM = "system";
    public static final String ASSISTANT = "assistant";
    public static final String USER = "user";
    public static final String RESULT = "result";

    private String type;
    private String subtype;
    private String sessionId;
    @Builder.Default
    private List<String> tools = new ArrayList<>();
    private JsonNode content;
    private String result;
    private boolean error;
    private double costUsd;
    private JsonNode data;

    public static RuntimeEvent fromJson(JsonNode node) {
        RuntimeEvent event = new RuntimeEvent();
        event.setType(text(node, "type"));
        event.setSubtype(text(node, "subtype"));
        event.setSessionId(text(node, "session_id"));

        JsonNode tools = node.get("tools");
        if (tools != null && tools.isArray()) {
            for (JsonNode tool : tools) {
                if (tool.isTextual()) {
                    event.getTools().add(tool.asText());
                }
            }
        }

        JsonNode message = node.get("message");
        if (message != null && message.has("content")) {
            event.setContent(message.get("content"));
        }

        JsonNode result = node.get("result");
        if (result != null && result.isTextual()) {
            event.setResult(result.asText());
        }
        event.setError(node.path("is_error").asBoolean(false));
        event.setCostUsd(node.path("total_cost_usd").asDouble(0.0));
        event.setData(node.get("data"));
        return event;
    }

    public boolean isType(String expected) {
        return expected.equals(type);
    }

    /**
     * Non-blank text blocks of this event's content, trimmed and joined with
     * newlines, or {@code null} when there are none.
     */
    public String joinedText() {
        if (content == null || !content.isArray()) {
            return null;
        }
        List<String> texts = new ArrayList<>();
        for (JsonNode block : content) {
            if ("text".equals(text(block, "type"))) {
                String value = block.path("text").asText("").trim();
                if (!value.isEmpty()) {
                    texts.add(value);
                }
            }
        }
        return texts.isEmpty() ? null : String.join("\n", texts);
    }

    /**
     * Every text the runtime surfaced in this event's content: text blocks and
     * tool results, including nested text parts of tool results.
     */
    public List<String> contentStrings() {
        List<String> out = new ArrayList<>();
        if (content == null) {
            return out;
        }
        if (content.isTextual()) {
            out.add(content.asText());
            return out;
        }
        if (!content.isArray()) {
            return out;
        }
        for (JsonNode block : content) {
            String blockType = text(block, "type");
            if ("text".equals(blockType)) {
                addIfNotBlank(out, block.get("text"));
            } else if ("tool_result".equals(blockType)) {
                JsonNode toolContent = block.get("content");
                if (toolContent == null) {
                    continue;
                }
                if (toolContent.isTextual()) {
                    addIfNotBlank(out, toolContent);
                } else if (toolContent.isArray()) {
                    for (JsonNode nested : toolContent) {
                        if ("text".equals(text(nested, "type"))) {
                            addIfNotBlank(out, nested.get("text"));
                        }
                    }
                }
            }
        }
        return out;
    }

    private static void addIfNotBlank(List<String> out, JsonNode value) {
        if (value != null && value.isTextual() && !value.asText().isBlank()) {
            out.add(value.asText());
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
