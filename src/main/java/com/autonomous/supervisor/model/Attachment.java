package com.autonomous.supervisor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Attachment {
    private Path localPath;
    private String originalName;
    private String mimeType;
    private long sizeBytes;
}
