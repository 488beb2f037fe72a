package com.autonomous.supervisor.service;

import com.autonomous.supervisor.model.CostEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Service
public class CostTrackerService {

    @Value("${agent.data.path:data}")
    private String dataPath;

    @Value("${agent.monthly.budget:500.0}")
    private double monthlyBudget;

    private final ObjectMapper mapper;
    private final List<CostEntry> currentMonthCosts = Collections.synchronizedList(new ArrayList<>());

    public CostTrackerService() {
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public void setMonthlyBudget(double budget) {
        this.monthlyBudget = budget;
    }

    @PostConstruct
    public void init() {
        loadCurrentMonthCosts();
    }

    public CostEntry recordRun(String channelId, String sessionId, String model, double costUsd) {
        CostEntry entry = CostEntry.builder()
            .timestamp(Instant.now())
            .channelId(channelId)
            .sessionId(sessionId)
            .model(model)
            .costUsd(costUsd)
            .build();

        currentMonthCosts.add(entry);
        persistEntry(entry);
        return entry;
    }

    public double getMonthlySpend() {
        synchronized (currentMonthCosts) {
            return currentMonthCosts.stream()
                .mapToDouble(CostEntry::getCostUsd)
                .sum();
        }
    }

    public double getBudgetPercentage() {
        return (getMonthlySpend() / monthlyBudget) * 100.0;
    }

    public boolean isOverBudgetThreshold() {
        return getBudgetPercentage() >= 80.0;
    }

    public String formatBudgetStatus() {
        return String.format("$%.2f / $%.0f (%.0f%%)",
            getMonthlySpend(),
            monthlyBudget,
            getBudgetPercentage());
    }

    private Path costsFile() {
        return Paths.get(dataPath, "costs.jsonl");
    }

    private void persistEntry(CostEntry entry) {
        try {
            Path costsFile = costsFile();
            Files.createDirectories(costsFile.toAbsolutePath().getParent());
            Files.writeString(costsFile, mapper.writeValueAsString(entry) + "\n",
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.warn("Failed to persist cost entry: {}", e.getMessage());
        }
    }

    private void loadCurrentMonthCosts() {
        currentMonthCosts.clear();
        Path costsFile = costsFile();
        if (!Files.exists(costsFile)) {
            return;
        }

        YearMonth currentMonth = YearMonth.now(ZoneOffset.UTC);
        try (Stream<String> lines = Files.lines(costsFile)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    CostEntry entry = mapper.readValue(line, CostEntry.class);
                    if (YearMonth.from(entry.getTimestamp().atZone(ZoneOffset.UTC)).equals(currentMonth)) {
                        currentMonthCosts.add(entry);
                    }
                } catch (IOException | RuntimeException e) {
                    log.debug("Skipping malformed cost entry: {}", e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to load costs: {}", e.getMessage());
        }
    }
}
