package com.herzen.mastery.reasoning;

import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.domain.DomainModels.DifficultyLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class ReasoningModels {

    public enum RuleKind {
        TRANSITIVE,
        SYMMETRIC,
        INVERSE,
        SIMILARITY,
        CLUSTER
    }

    public enum ReasoningScope {
        LOCAL,
        SUBJECT,
        GRAPH_WIDE
    }

    public enum InferenceConfidence {
        HIGH,
        MEDIUM,
        LOW;

        public static InferenceConfidence fromScore(double score) {
            if (score > 0.8) return HIGH;
            if (score > 0.5) return MEDIUM;
            return LOW;
        }
    }

    public enum GapSeverity {
        CRITICAL,
        MAJOR,
        MINOR
    }

    public enum GapType {
        MISSING_PREREQUISITE,
        DISCONNECTED
    }

    /**
     * Process-wide inference rule. {@code subjects} and the difficulty range are optional filters on the
     * node a derivation starts from; an empty subject set accepts every subject.
     */
    public record InferenceRule(String ruleId,
                                String name,
                                String description,
                                RuleKind kind,
                                String sourcePredicate,
                                String targetPredicate,
                                int maxHops,
                                double confidenceWeight,
                                int priority,
                                boolean active,
                                Set<String> subjects,
                                DifficultyLevel minDifficulty,
                                DifficultyLevel maxDifficulty) {
        public InferenceRule {
            Objects.requireNonNull(ruleId, "ruleId");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(sourcePredicate, "sourcePredicate");
            if (maxHops < 1 || maxHops > 10) {
                throw new IllegalArgumentException("maxHops must be within 1..10: " + maxHops);
            }
            if (confidenceWeight < 0.0 || confidenceWeight > 1.0) {
                throw new IllegalArgumentException("confidenceWeight must be within 0..1: " + confidenceWeight);
            }
            name = name == null ? ruleId : name;
            description = description == null ? "" : description;
            subjects = subjects == null ? Set.of() : Set.copyOf(subjects);
        }

        public static InferenceRule of(String ruleId, RuleKind kind, String sourcePredicate, String targetPredicate,
                                       int maxHops, double confidenceWeight) {
            return new InferenceRule(ruleId, ruleId, "", kind, sourcePredicate, targetPredicate, maxHops,
                    confidenceWeight, 1, true, Set.of(), null, null);
        }

        public boolean appliesTo(ConceptNode node) {
            if (!subjects.isEmpty() && !subjects.contains(node.subjectId())) return false;
            DifficultyLevel level = node.difficulty();
            if (minDifficulty != null && level.compareTo(minDifficulty) < 0) return false;
            return maxDifficulty == null || level.compareTo(maxDifficulty) <= 0;
        }

        public InferenceRule withActive(boolean active) {
            return new InferenceRule(ruleId, name, description, kind, sourcePredicate, targetPredicate, maxHops,
                    confidenceWeight, priority, active, subjects, minDifficulty, maxDifficulty);
        }
    }

    public record DerivationHop(String source, String target, String type) {}

    public record InferredRelationship(String sourceId,
                                       String targetId,
                                       String relationshipType,
                                       String ruleId,
                                       InferenceConfidence confidence,
                                       double confidenceScore,
                                       List<DerivationHop> derivationPath,
                                       int hopCount,
                                       Instant inferredAt) {
        public InferredRelationship {
            derivationPath = List.copyOf(derivationPath);
        }

        public boolean involves(String conceptId) {
            return sourceId.equals(conceptId) || targetId.equals(conceptId);
        }
    }

    public record InferenceRunStats(int rulesApplied,
                                    int relationshipsInferred,
                                    Map<String, Integer> inferencesByRule,
                                    List<String> warnings,
                                    long durationMs) {}

    public record InferenceResult(List<InferredRelationship> relationships, InferenceRunStats stats) {}

    public record MissingConcept(String conceptId, String name, DifficultyLevel difficulty) {}

    public record KnowledgeGap(String targetConceptId,
                               GapType gapType,
                               GapSeverity severity,
                               List<MissingConcept> missingConcepts,
                               List<String> blockedConcepts,
                               List<String> remediationOrder,
                               double estimatedEffortHours,
                               List<String> suggestedConnectors) {}

    public record ConceptSimilarity(String conceptA,
                                    String conceptB,
                                    double tagSimilarity,
                                    double keywordSimilarity,
                                    double objectiveSimilarity,
                                    double structuralSimilarity,
                                    double overall,
                                    List<String> sharedTags,
                                    List<String> sharedKeywords,
                                    List<String> sharedObjectives) {

        public String pairKey() {
            return pairKey(conceptA, conceptB);
        }

        public boolean recommendedAsPrerequisite() {
            return overall > 0.7 && tagSimilarity < 0.3;
        }

        public boolean recommendedForReview() {
            return overall > 0.6;
        }

        public static String pairKey(String a, String b) {
            return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
        }
    }

    public record ConceptCluster(String clusterId,
                                 List<String> members,
                                 String centroidId,
                                 double cohesion,
                                 String primarySubject,
                                 List<String> secondarySubjects,
                                 List<String> learningOrder,
                                 DifficultyLevel averageDifficulty) {}

    public record ReasoningStatisticsSnapshot(long totalInferences,
                                              Map<String, Long> inferencesByRule,
                                              Instant lastRunAt,
                                              long lastRunDurationMs,
                                              long gapsDetected,
                                              long similaritiesCalculated,
                                              long clustersDiscovered,
                                              List<String> recentErrors) {}
}
