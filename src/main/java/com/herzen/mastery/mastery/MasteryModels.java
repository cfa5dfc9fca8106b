package com.herzen.mastery.mastery;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class MasteryModels {

    public enum MasteryLevel {
        NOVICE(0.0),
        BEGINNER(0.25),
        DEVELOPING(0.5),
        PROFICIENT(0.7),
        ADVANCED(0.85),
        EXPERT(0.95);

        private final double lowerBound;

        MasteryLevel(double lowerBound) {
            this.lowerBound = lowerBound;
        }

        public double lowerBound() {
            return lowerBound;
        }

        public static MasteryLevel fromScore(double score) {
            MasteryLevel level = NOVICE;
            for (MasteryLevel candidate : values()) {
                if (score >= candidate.lowerBound) level = candidate;
            }
            return level;
        }
    }

    public enum InteractionType {
        PRACTICE,
        ASSESSMENT,
        REVIEW,
        VISUALIZATION,
        APPLICATION
    }

    /**
     * Outcome of one learning interaction. {@code score} is clamped to [0, 1], {@code difficultyRating}
     * to [0.5, 2.0] and negative durations to zero.
     */
    public record InteractionResult(String conceptId,
                                    InteractionType interactionType,
                                    boolean success,
                                    double score,
                                    int timeSpentSeconds,
                                    double difficultyRating,
                                    int attemptNumber,
                                    String sessionId) {
        public InteractionResult {
            Objects.requireNonNull(conceptId, "conceptId");
            interactionType = interactionType == null ? InteractionType.PRACTICE : interactionType;
            score = Math.max(0.0, Math.min(1.0, score));
            timeSpentSeconds = Math.max(0, timeSpentSeconds);
            difficultyRating = Math.max(0.5, Math.min(2.0, difficultyRating));
            attemptNumber = Math.max(1, attemptNumber);
        }

        public static InteractionResult of(String conceptId, InteractionType type, boolean success, double score,
                                           int timeSpentSeconds, double difficultyRating) {
            return new InteractionResult(conceptId, type, success, score, timeSpentSeconds, difficultyRating, 1, null);
        }
    }

    public record InteractionRecord(Instant timestamp,
                                    boolean success,
                                    InteractionType type,
                                    double resultScore,
                                    int timeSpentSeconds,
                                    double difficultyRating,
                                    double scoreBefore,
                                    double scoreAfter) {}

    public record MasteryState(String learnerId,
                               String conceptId,
                               double masteryScore,
                               double confidenceScore,
                               double stability,
                               double difficultyModifier,
                               int intervalDays,
                               Instant firstExposureAt,
                               Instant lastInteractionAt,
                               Instant nextReviewAt,
                               Instant lastMasteredAt,
                               int interactionCount,
                               int successfulInteractions,
                               long totalTimeSeconds,
                               double peakMasteryScore,
                               List<InteractionRecord> history) {}

    public record ReviewScheduleEntry(String conceptId,
                                      String conceptName,
                                      Instant scheduledDate,
                                      double priority,
                                      double currentMastery,
                                      double predictedDecay,
                                      String domain,
                                      boolean hasVisualAid,
                                      String assetId) {}

    public record VisualAidMapping(String assetId, String conceptId, String relevanceType) {}

    public record MasteryMetrics(String learnerId,
                                 Instant calculatedAt,
                                 double masteryAverage,
                                 double confidenceAverage,
                                 double stabilityAverage,
                                 int conceptsStarted,
                                 int conceptsMastered,
                                 int conceptsInProgress,
                                 int conceptsDueForReview,
                                 List<String> strugglingConcepts,
                                 String weakestDomain,
                                 String strongestDomain,
                                 Map<MasteryLevel, Integer> distribution) {

        public double progress() {
            return conceptsStarted == 0 ? 0.0 : conceptsMastered / (double) conceptsStarted;
        }
    }

    public record SessionInteraction(String conceptId,
                                     InteractionType type,
                                     boolean success,
                                     double score,
                                     int timeSpentSeconds,
                                     Instant timestamp) {}

    public record LearningSession(String sessionId,
                                  String learnerId,
                                  Instant startedAt,
                                  Instant endedAt,
                                  List<SessionInteraction> interactions) {
        public LearningSession {
            interactions = interactions == null ? List.of() : List.copyOf(interactions);
        }

        public boolean active() {
            return endedAt == null;
        }

        public LearningSession withInteraction(SessionInteraction interaction) {
            List<SessionInteraction> next = new ArrayList<>(interactions);
            next.add(interaction);
            return new LearningSession(sessionId, learnerId, startedAt, endedAt, next);
        }

        public LearningSession end(Instant at) {
            return new LearningSession(sessionId, learnerId, startedAt, at, interactions);
        }

        public Set<String> conceptsCovered() {
            Set<String> covered = new LinkedHashSet<>();
            interactions.forEach(i -> covered.add(i.conceptId()));
            return covered;
        }

        public Set<String> conceptsReviewed() {
            Set<String> reviewed = new LinkedHashSet<>();
            for (SessionInteraction interaction : interactions) {
                if (interaction.type() == InteractionType.REVIEW) reviewed.add(interaction.conceptId());
            }
            return reviewed;
        }

        public Set<String> conceptsLearned() {
            Set<String> learned = conceptsCovered();
            learned.removeAll(conceptsReviewed());
            return learned;
        }

        public double accuracyRate() {
            if (interactions.isEmpty()) return 0.0;
            long successes = interactions.stream().filter(SessionInteraction::success).count();
            return successes / (double) interactions.size();
        }

        /** Whole minutes from start to end, or to {@code now} while active; never below one. */
        public long durationMinutes(Instant now) {
            Instant end = endedAt != null ? endedAt : now;
            return Math.max(1, Duration.between(startedAt, end).toMinutes());
        }
    }

    public record MasteryStatisticsSnapshot(long totalMasteryUpdates,
                                            int conceptsTracked,
                                            long weakConceptsDetected,
                                            int reviewsScheduled,
                                            int activeLearners,
                                            int activeSessions) {}

    public record PathAdjustment(List<String> toLearn, List<String> toReview) {}
}
