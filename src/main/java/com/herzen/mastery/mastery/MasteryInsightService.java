package com.herzen.mastery.mastery;

import com.herzen.mastery.config.MasteryProperties;
import com.herzen.mastery.config.ReasoningProperties;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.mastery.MasteryModels.MasteryLevel;
import com.herzen.mastery.mastery.MasteryModels.MasteryMetrics;
import com.herzen.mastery.mastery.MasteryModels.PathAdjustment;
import com.herzen.mastery.reasoning.GapDetector;
import com.herzen.mastery.reasoning.ReasoningModels.KnowledgeGap;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

@Service
public class MasteryInsightService {
    private static final int MAX_STRUGGLING = 10;

    private final MasteryTracker tracker;
    private final GapDetector gapDetector;
    private final MasteryProperties properties;
    private final ReasoningProperties reasoningProperties;
    private final MasteryStatistics statistics;
    private final Clock clock;

    public MasteryInsightService(MasteryTracker tracker,
                                 GapDetector gapDetector,
                                 MasteryProperties properties,
                                 ReasoningProperties reasoningProperties,
                                 MasteryStatistics statistics,
                                 Clock clock) {
        this.tracker = tracker;
        this.gapDetector = gapDetector;
        this.properties = properties;
        this.reasoningProperties = reasoningProperties;
        this.statistics = statistics;
        this.clock = clock;
    }

    public List<ConceptMastery> detectWeakConcepts(String learnerId) {
        MasteryProperties.Weak weak = properties.getWeak();
        return detectWeakConcepts(learnerId, weak.getMasteryThreshold(), weak.getInactivityDays(), clock.instant());
    }

    /**
     * Records not yet due for review whose score is under {@code masteryThreshold}, and that either had
     * three or more interactions while staying under 0.3, or were practiced within {@code inactivityDays}
     * while staying under 0.5. Lowest score first, then most interactions.
     */
    public List<ConceptMastery> detectWeakConcepts(String learnerId, double masteryThreshold, int inactivityDays, Instant now) {
        List<ConceptMastery> weak = new ArrayList<>();
        for (ConceptMastery record : tracker.getAllMastery(learnerId, false, now)) {
            double score = record.getMasteryScore();
            if (score >= masteryThreshold) continue;

            boolean stuck = record.getInteractionCount() >= 3 && score < 0.3;
            long idleDays = Duration.between(record.getLastInteractionAt(), now).toDays();
            boolean recentlyStruggling = idleDays <= inactivityDays && score < 0.5;
            if (stuck || recentlyStruggling) weak.add(record);
        }
        weak.sort(Comparator.comparingDouble(ConceptMastery::getMasteryScore)
                .thenComparing(Comparator.comparingInt(ConceptMastery::getInteractionCount).reversed()));
        statistics.recordWeakConcepts(weak.size());
        return weak;
    }

    public List<String> getReadyConcepts(String learnerId, ConceptGraph graph) {
        Set<String> known = tracker.knownConcepts(learnerId);
        List<String> ready = new ArrayList<>();
        for (String conceptId : graph.nodeIds()) {
            if (known.contains(conceptId)) continue;
            if (known.containsAll(graph.getPrerequisites(conceptId, false))) ready.add(conceptId);
        }
        return ready;
    }

    public List<String> getRemedialConcepts(String learnerId, String targetConceptId, ConceptGraph graph) {
        Set<String> known = tracker.knownConcepts(learnerId);
        return graph.getPrerequisites(targetConceptId, true).stream()
                .filter(id -> !known.contains(id))
                .toList();
    }

    public PathAdjustment adjustPathForMastery(String learnerId, List<String> pathConcepts) {
        return adjustPathForMastery(learnerId, pathConcepts, clock.instant());
    }

    public PathAdjustment adjustPathForMastery(String learnerId, List<String> pathConcepts, Instant now) {
        double threshold = reasoningProperties.getKnownThreshold();
        List<String> toLearn = new ArrayList<>();
        List<String> toReview = new ArrayList<>();
        for (String conceptId : pathConcepts) {
            Optional<ConceptMastery> mastery = tracker.getConceptMastery(learnerId, conceptId);
            if (mastery.isPresent() && mastery.get().isConsideredKnown(threshold)) {
                if (mastery.get().isOverdueForReview(now)) toReview.add(conceptId);
            } else {
                toLearn.add(conceptId);
            }
        }
        return new PathAdjustment(toLearn, toReview);
    }

    public List<KnowledgeGap> detectLearnerGaps(String learnerId, ConceptGraph graph) {
        return gapDetector.detectKnowledgeGaps(graph, tracker.knownConcepts(learnerId), null);
    }

    public MasteryMetrics calculateMetrics(String learnerId, Map<String, String> domainMap) {
        return calculateMetrics(learnerId, domainMap, clock.instant());
    }

    /**
     * @param domainMap concept id to domain; concepts missing from it count as "uncategorized". When null
     *                  or empty no domain ranking is computed.
     */
    public MasteryMetrics calculateMetrics(String learnerId, Map<String, String> domainMap, Instant now) {
        List<ConceptMastery> records = tracker.getAllMastery(learnerId);
        Map<MasteryLevel, Integer> distribution = new EnumMap<>(MasteryLevel.class);
        for (MasteryLevel level : MasteryLevel.values()) {
            distribution.put(level, 0);
        }
        if (records.isEmpty()) {
            return new MasteryMetrics(learnerId, now, 0.0, 0.0, 1.0, 0, 0, 0, 0, List.of(), null, null, distribution);
        }

        double threshold = reasoningProperties.getKnownThreshold();
        double masterySum = 0.0;
        double confidenceSum = 0.0;
        double stabilitySum = 0.0;
        int mastered = 0;
        int due = 0;
        List<String> struggling = new ArrayList<>();
        Map<String, double[]> domainTotals = new LinkedHashMap<>();

        for (ConceptMastery m : records) {
            masterySum += m.getMasteryScore();
            confidenceSum += m.getConfidenceScore();
            stabilitySum += m.getStability();
            if (m.isConsideredKnown(threshold)) mastered++;
            if (m.isOverdueForReview(now)) due++;
            if (m.getMasteryScore() < 0.5 && m.getInteractionCount() >= 3 && struggling.size() < MAX_STRUGGLING) {
                struggling.add(m.getConceptId());
            }
            distribution.merge(m.getMasteryLevel(), 1, Integer::sum);
            if (domainMap != null && !domainMap.isEmpty()) {
                double[] totals = domainTotals.computeIfAbsent(domainMap.getOrDefault(m.getConceptId(), "uncategorized"), d -> new double[2]);
                totals[0] += m.getMasteryScore();
                totals[1]++;
            }
        }

        String weakest = null;
        String strongest = null;
        double lowest = Double.MAX_VALUE;
        double highest = -1.0;
        for (Map.Entry<String, double[]> entry : domainTotals.entrySet()) {
            double average = entry.getValue()[0] / entry.getValue()[1];
            if (average < lowest) {
                lowest = average;
                weakest = entry.getKey();
            }
            if (average > highest) {
                highest = average;
                strongest = entry.getKey();
            }
        }

        int n = records.size();
        return new MasteryMetrics(learnerId, now, masterySum / n, confidenceSum / n, stabilitySum / n,
                n, mastered, n - mastered, due, List.copyOf(struggling), weakest, strongest, distribution);
    }
}
