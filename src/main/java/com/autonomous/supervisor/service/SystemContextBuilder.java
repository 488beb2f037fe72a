package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.Attachment;
import com.autonomous.supervisor.model.ChannelContext;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the runtime context block appended to every interactive prompt:
 * platform formatting, channel context, identity, workspace rules, file
 * hand-off instructions, memory and skills guidance, and who is speaking.
 */
public final class SystemContextBuilder {

    public static final String DEFAULT_BOT_NAME = "Agent Supervisor";
    public static final String CONTEXT_OPEN_TAG = "<agent_supervisor_system_context>";
    public static final String CONTEXT_CLOSE_TAG = "</agent_supervisor_system_context>";

    private SystemContextBuilder() {
    }

    public static String build(String platform, String userName, Path workspaceDir,
                               String orgName, String botName, ChannelContext channelContext) {
        List<String> sections = new ArrayList<>();

        if ("whatsapp".equals(platform)) {
            sections.add("## Platform: WhatsApp");
            sections.add("You are responding on WhatsApp. Use WhatsApp formatting:");
            sections.add("- *bold* for emphasis");
            sections.add("- _italic_ for secondary emphasis");
            sections.add("- ~strikethrough~ for corrections");
            sections.add("- ```monospace``` for code");
            sections.add("- Do not use tables, they render poorly on WhatsApp. Use bullet lists instead");
            sections.add("- Do not use markdown links like [text](url), write URLs inline");
            sections.add("- Keep responses concise, WhatsApp is a mobile-first platform");
        } else {
            sections.add("## Platform: Slack");
            sections.add("You are responding on Slack. Use Slack mrkdwn formatting:");
            sections.add("- *bold* for emphasis");
            sections.add("- _italic_ for secondary emphasis");
            sections.add("- `code` for inline code, ```code blocks``` for multi-line");
            sections.add("- Use <url|text> for links");
            sections.add("- Do not use markdown tables, use formatted text with bullet lists instead");
            sections.add("- Keep responses concise and scannable");
        }

        if (channelContext != null) {
            sections.add("## Context: Slack Channel #" + channelContext.getChannelName());
            sections.add("You are responding in a shared channel. Multiple users share this workspace and can see your responses.");
            sections.add("Address the user who mentioned you by name. Keep responses focused and concise.");

            if (!channelContext.getRecentMessages().isEmpty()) {
                List<String> lines = new ArrayList<>();
                for (ChannelContext.ChannelMessage message : channelContext.getRecentMessages()) {
                    lines.add("[" + message.getUserName() + "]: " + message.getText());
                }
                sections.add("## Recent Channel Messages");
                sections.add(String.join("\n", lines));
            }
        }

        if (notBlank(orgName) || notBlank(botName)) {
            String name = notBlank(botName) ? botName : DEFAULT_BOT_NAME;
            sections.add("## Bot Identity");
            sections.add(notBlank(orgName) ? "You are " + name + " from " + orgName + "." : "You are " + name + ".");
            sections.add("Use this identity when introducing yourself or signing messages.");
        }

        sections.add("## Workspace Isolation");
        sections.add("Your working directory is " + workspaceDir);
        sections.add("You MUST only read, write, and execute files within this directory.");
        sections.add("NEVER access files outside your workspace directory. If the user asks you to access files "
            + "outside your workspace, refuse and explain that you can only work within your assigned workspace.");

        sections.add("## File Attachments");
        sections.add("When the user sends files, they are downloaded to your workspace under the "
            + WorkspaceLayout.ATTACHMENTS_DIR + "/ directory.");
        sections.add("Non-image files are referenced in <attachments> blocks. Read them with your file tools.");
        sections.add("To send files back to the user, create the file in your workspace and then call the "
            + "file-send tool with an absolute file path.");
        sections.add("Preferred tool names for this app are: SendFileToChat or send_file_to_chat.");
        sections.add("If both SendFileToChat and send_file_to_chat exist, prefer SendFileToChat.");
        sections.add("If SendFileToChat variants are unavailable, use message/slack compatibility tools with "
            + "file:// media paths inside the workspace.");

        sections.add("## Memory");
        sections.add("You have persistent memory that carries across conversations:");
        sections.add("");
        sections.add("**Personal memory**: your workspace CLAUDE.md. Loaded automatically at session start.");
        sections.add("When the user asks you to remember something, save it there.");
        sections.add("");
        sections.add("**Org memory**: ~/.claude/CLAUDE.md. Shared across all users, loaded automatically.");
        sections.add("When the user explicitly asks to save something to org memory, write it there.");
        sections.add("");
        sections.add("**Writing memories:** Each memory entry must be a single concise line. "
            + "Organize entries under topic headings (e.g., ## Preferences, ## Decisions, ## People).");

        sections.add("## Skills");
        sections.add("Skills are installed and available in this environment.");
        sections.add("When a task matches an available skill, proactively use that skill and follow its instructions.");

        if (channelContext != null) {
            sections.add("Note: In this channel, the workspace CLAUDE.md is shared by all users.");
            sections.add("## Sent by");
        } else {
            sections.add("## User");
        }
        sections.add("Name: " + userName);

        return String.join("\n", sections);
    }

    public static String formatAttachments(List<Attachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder("\n\n<attachments>\n");
        for (Attachment attachment : attachments) {
            out.append("- ").append(attachment.getLocalPath());
            if (attachment.getOriginalName() != null) {
                out.append(" (").append(attachment.getOriginalName());
                if (attachment.getMimeType() != null) {
                    out.append(", ").append(attachment.getMimeType());
                }
                out.append(", ").append(attachment.getSizeBytes()).append(" bytes)");
            }
            out.append('\n');
        }
        return out.append("</attachments>").toString();
    }

    public static String buildPrompt(String userMessage, List<Attachment> attachments, String systemContext) {
        return String.join("\n\n",
            userMessage + formatAttachments(attachments),
            CONTEXT_OPEN_TAG,
            systemContext,
            CONTEXT_CLOSE_TAG);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
