package com.autonomous.supervisor.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolQueueSnapshot {
    private List<String> uploads = new ArrayList<>();
    private List<String> messages = new ArrayList<>();

    public static ToolQueueSnapshot empty() {
        return new ToolQueueSnapshot(new ArrayList<>(), new ArrayList<>());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return uploads.isEmpty() && messages.isEmpty();
    }
}
