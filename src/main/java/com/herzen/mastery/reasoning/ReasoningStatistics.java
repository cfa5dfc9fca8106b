package com.herzen.mastery.reasoning;

import com.herzen.mastery.reasoning.ReasoningModels.ReasoningStatisticsSnapshot;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

@Component
public class ReasoningStatistics {
    private static final int MAX_RECENT_ERRORS = 10;

    private long totalInferences;
    private final Map<String, Long> inferencesByRule = new LinkedHashMap<>();
    private Instant lastRunAt;
    private long lastRunDurationMs;
    private long gapsDetected;
    private long similaritiesCalculated;
    private long clustersDiscovered;
    private final Deque<String> recentErrors = new ArrayDeque<>();

    public synchronized void recordRun(Map<String, Integer> byRule, Instant finishedAt, long durationMs) {
        byRule.forEach((ruleId, count) -> {
            inferencesByRule.merge(ruleId, (long) count, Long::sum);
            totalInferences += count;
        });
        lastRunAt = finishedAt;
        lastRunDurationMs = durationMs;
    }

    public synchronized void recordError(String message) {
        recentErrors.addLast(message);
        while (recentErrors.size() > MAX_RECENT_ERRORS) {
            recentErrors.removeFirst();
        }
    }

    public synchronized void recordGaps(int count) {
        gapsDetected += count;
    }

    public synchronized void recordSimilarities(int count) {
        similaritiesCalculated += count;
    }

    public synchronized void recordClusters(int count) {
        clustersDiscovered += count;
    }

    public synchronized ReasoningStatisticsSnapshot snapshot() {
        return new ReasoningStatisticsSnapshot(totalInferences, Map.copyOf(inferencesByRule), lastRunAt,
                lastRunDurationMs, gapsDetected, similaritiesCalculated, clustersDiscovered, List.copyOf(recentErrors));
    }
}
