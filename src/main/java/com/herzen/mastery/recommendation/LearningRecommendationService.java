package com.herzen.mastery.recommendation;

import com.herzen.mastery.config.MasteryProperties;
import com.herzen.mastery.config.ReasoningProperties;
import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.domain.DomainModels.DifficultyLevel;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphService;
import com.herzen.mastery.mastery.ConceptMastery;
import com.herzen.mastery.mastery.MasteryInsightService;
import com.herzen.mastery.mastery.MasteryModels.ReviewScheduleEntry;
import com.herzen.mastery.mastery.MasteryModels.VisualAidMapping;
import com.herzen.mastery.mastery.MasteryTracker;
import com.herzen.mastery.mastery.ReviewScheduler;
import com.herzen.mastery.mastery.VisualAidLookup;
import com.herzen.mastery.recommendation.RecommendationModels.FactorScore;
import com.herzen.mastery.recommendation.RecommendationModels.LearningRecommendation;
import com.herzen.mastery.recommendation.RecommendationModels.RecommendationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

@Service
public class LearningRecommendationService {
    private static final Logger log = LoggerFactory.getLogger(LearningRecommendationService.class);

    private static final int MAX_NEXT_LESSONS = 5;
    private static final int MAX_CHALLENGES = 3;
    private static final int MAX_REMEDIAL = 3;
    private static final int MAX_RELATED = 5;

    private final KnowledgeGraphService knowledgeGraphService;
    private final MasteryTracker tracker;
    private final ReviewScheduler reviewScheduler;
    private final MasteryInsightService insightService;
    private final VisualAidLookup visualAids;
    private final ReasoningProperties reasoningProperties;
    private final MasteryProperties masteryProperties;
    private final Clock clock;

    public LearningRecommendationService(KnowledgeGraphService knowledgeGraphService,
                                         MasteryTracker tracker,
                                         ReviewScheduler reviewScheduler,
                                         MasteryInsightService insightService,
                                         VisualAidLookup visualAids,
                                         ReasoningProperties reasoningProperties,
                                         MasteryProperties masteryProperties,
                                         Clock clock) {
        this.knowledgeGraphService = knowledgeGraphService;
        this.tracker = tracker;
        this.reviewScheduler = reviewScheduler;
        this.insightService = insightService;
        this.visualAids = visualAids;
        this.reasoningProperties = reasoningProperties;
        this.masteryProperties = masteryProperties;
        this.clock = clock;
    }

    public List<LearningRecommendation> recommend(String learnerId, String catalogId, int maxRecommendations) {
        return recommend(learnerId, catalogId, maxRecommendations, clock.instant());
    }

    public List<LearningRecommendation> recommend(String learnerId, String catalogId, int maxRecommendations, Instant now) {
        Optional<ConceptGraph> snapshot = knowledgeGraphService.snapshot(catalogId);
        if (snapshot.isEmpty() || maxRecommendations <= 0) return List.of();

        ConceptGraph graph = snapshot.get();
        Map<String, ConceptNode> catalog = new LinkedHashMap<>();
        graph.nodes().forEach(n -> catalog.put(n.id(), n));
        Map<String, ConceptMastery> masteryMap = tracker.getMasteryForConcepts(learnerId, catalog.keySet());

        List<LearningRecommendation> recommendations = new ArrayList<>();
        for (ReviewScheduleEntry review : reviewScheduler.getReviewSchedule(learnerId, catalog, maxRecommendations / 2, now)) {
            if (!catalog.containsKey(review.conceptId())) continue;
            recommendations.add(build(catalog.get(review.conceptId()), RecommendationType.REINFORCEMENT, review.priority(),
                    String.format(Locale.US, "Review needed: %s retention at %.0f%%", review.conceptName(), review.currentMastery() * 100),
                    List.of(new FactorScore("review_priority", review.priority()),
                            new FactorScore("predicted_decay", review.predictedDecay())),
                    review.currentMastery(), true, graph));
        }
        recommendations.addAll(nextLessons(learnerId, graph, catalog, masteryMap));
        recommendations.addAll(challenges(graph, catalog, masteryMap));

        MasteryProperties.Weak weak = masteryProperties.getWeak();
        List<ConceptMastery> weakConcepts = insightService.detectWeakConcepts(learnerId, weak.getMasteryThreshold(), weak.getInactivityDays(), now).stream()
                .filter(m -> catalog.containsKey(m.getConceptId()))
                .limit(MAX_REMEDIAL)
                .toList();
        for (ConceptMastery mastery : weakConcepts) {
            double priority = 0.9 - mastery.getMasteryScore();
            recommendations.add(build(catalog.get(mastery.getConceptId()), RecommendationType.REMEDIAL, priority,
                    "Strengthen your understanding of " + catalog.get(mastery.getConceptId()).name(),
                    List.of(new FactorScore("mastery_gap", priority)),
                    mastery.getMasteryScore(), false, graph));
        }

        recommendations.sort(Comparator.comparingDouble(LearningRecommendation::priority).reversed());
        List<LearningRecommendation> result = recommendations.size() > maxRecommendations
                ? List.copyOf(recommendations.subList(0, maxRecommendations))
                : recommendations;
        log.info("Recommended {} item(s) for learner {} in catalog {} ({})", result.size(), learnerId, catalogId,
                result.stream().collect(Collectors.groupingBy(LearningRecommendation::type, TreeMap::new, Collectors.counting())));
        return result;
    }

    private List<LearningRecommendation> nextLessons(String learnerId,
                                                     ConceptGraph graph,
                                                     Map<String, ConceptNode> catalog,
                                                     Map<String, ConceptMastery> masteryMap) {
        List<LearningRecommendation> lessons = new ArrayList<>();
        for (String conceptId : insightService.getReadyConcepts(learnerId, graph)) {
            ConceptMastery mastery = masteryMap.get(conceptId);
            boolean unseen = mastery == null;
            double score = unseen ? 0.0 : mastery.getMasteryScore();
            boolean visual = visualAids.hasVisualAid(conceptId);

            double novelty = unseen ? 0.2 : 0.0;
            double gap = unseen ? 0.0 : score < 0.2 ? 0.2 : score < 0.4 ? 0.1 : 0.0;
            double visualBoost = visual ? 0.1 : 0.0;
            double priority = Math.min(1.0, 0.5 + novelty + gap + visualBoost);

            ConceptNode concept = catalog.get(conceptId);
            lessons.add(build(concept, RecommendationType.NEXT_LESSON, priority,
                    "You're ready to learn " + concept.name() + "!",
                    List.of(new FactorScore("novelty", novelty),
                            new FactorScore("mastery_gap", gap),
                            new FactorScore("visual_aid", visualBoost)),
                    score, false, graph));
        }
        lessons.sort(Comparator.comparingDouble(LearningRecommendation::priority).reversed());
        return lessons.size() > MAX_NEXT_LESSONS ? lessons.subList(0, MAX_NEXT_LESSONS) : lessons;
    }

    private List<LearningRecommendation> challenges(ConceptGraph graph,
                                                    Map<String, ConceptNode> catalog,
                                                    Map<String, ConceptMastery> masteryMap) {
        if (masteryMap.isEmpty()) return List.of();

        double average = masteryMap.values().stream().mapToDouble(ConceptMastery::getMasteryScore).average().orElse(0.0);
        Optional<DifficultyLevel> target = challengeLevel(average);
        if (target.isEmpty()) return List.of();

        double threshold = reasoningProperties.getKnownThreshold();
        List<LearningRecommendation> challenges = new ArrayList<>();
        for (ConceptNode concept : catalog.values()) {
            if (challenges.size() >= MAX_CHALLENGES) break;
            ConceptMastery mastery = masteryMap.get(concept.id());
            if (mastery != null && mastery.isConsideredKnown(threshold)) continue;
            if (concept.difficulty() != target.get()) continue;

            List<String> prerequisites = graph.getPrerequisites(concept.id(), false);
            long knownPrerequisites = prerequisites.stream()
                    .filter(p -> masteryMap.containsKey(p) && masteryMap.get(p).isConsideredKnown(threshold))
                    .count();
            double coverage = prerequisites.isEmpty() ? 1.0 : knownPrerequisites / (double) prerequisites.size();
            if (coverage < 0.7) continue;

            challenges.add(build(concept, RecommendationType.CHALLENGE, 0.5,
                    "Challenge yourself with " + concept.name() + "!",
                    List.of(new FactorScore("average_mastery", average),
                            new FactorScore("prerequisite_coverage", coverage)),
                    mastery == null ? 0.0 : mastery.getMasteryScore(), false, graph));
        }
        return challenges;
    }

    static Optional<DifficultyLevel> challengeLevel(double averageMastery) {
        if (averageMastery >= 0.85) return Optional.of(DifficultyLevel.EXPERT);
        if (averageMastery >= 0.70) return Optional.of(DifficultyLevel.ADVANCED);
        if (averageMastery >= 0.50) return Optional.of(DifficultyLevel.INTERMEDIATE);
        return Optional.empty();
    }

    private LearningRecommendation build(ConceptNode concept,
                                         RecommendationType type,
                                         double priority,
                                         String reason,
                                         List<FactorScore> factors,
                                         double currentMastery,
                                         boolean review,
                                         ConceptGraph graph) {
        List<VisualAidMapping> aids = visualAids.getMappingsForConcept(concept.id());
        Set<String> related = new LinkedHashSet<>(graph.neighbors(concept.id()));
        related.addAll(graph.getPrerequisites(concept.id(), false));
        return new LearningRecommendation(concept.id(), concept.name(), concept.subjectId(), concept.difficulty(),
                type, priority, reason, factors, currentMastery, review, !aids.isEmpty(),
                aids.isEmpty() ? null : aids.get(0).assetId(),
                related.stream().limit(MAX_RELATED).toList());
    }
}
