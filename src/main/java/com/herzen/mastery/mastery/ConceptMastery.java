package com.herzen.mastery.mastery;

import com.herzen.mastery.mastery.MasteryModels.InteractionRecord;
import com.herzen.mastery.mastery.MasteryModels.InteractionResult;
import com.herzen.mastery.mastery.MasteryModels.MasteryLevel;
import com.herzen.mastery.mastery.MasteryModels.MasteryState;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

public class ConceptMastery {
    static final double BASE_LEARNING_RATE = 0.3;
    static final double SUCCESS_BOOST = 0.1;
    static final double FAIL_PENALTY = 0.2;
    static final double EASY_MULTIPLIER = 2.5;
    static final double NORMAL_MULTIPLIER = 2.0;
    static final double HARD_MULTIPLIER = 1.5;
    static final double STABILITY_LOSS_ON_FAIL = 0.8;
    static final double MIN_STABILITY = 1.0;
    static final int MIN_INTERVAL_DAYS = 1;
    static final int MAX_INTERVAL_DAYS = 365;
    static final double MASTERED_THRESHOLD = 0.85;
    static final double DEFAULT_KNOWN_THRESHOLD = 0.7;

    private static final double SECONDS_PER_DAY = 86_400.0;
    // below this gap (about 2.4 hours) no decay is applied
    private static final double DECAY_MIN_DAYS = 0.1;

    private final String learnerId;
    private final String conceptId;
    private double masteryScore;
    private double confidenceScore;
    private double stability = 1.0;
    private double difficultyModifier = 1.0;
    private int intervalDays = 1;
    private final Instant firstExposureAt;
    private Instant lastInteractionAt;
    private Instant nextReviewAt;
    private Instant lastMasteredAt;
    private int interactionCount;
    private int successfulInteractions;
    private long totalTimeSeconds;
    private double peakMasteryScore;
    private final Deque<InteractionRecord> history = new ArrayDeque<>();

    private ConceptMastery(String learnerId, String conceptId, Instant createdAt) {
        this.learnerId = Objects.requireNonNull(learnerId, "learnerId");
        this.conceptId = Objects.requireNonNull(conceptId, "conceptId");
        this.firstExposureAt = createdAt;
        this.lastInteractionAt = createdAt;
        this.nextReviewAt = createdAt;
    }

    public static ConceptMastery create(String learnerId, String conceptId, Instant now) {
        return new ConceptMastery(learnerId, conceptId, now);
    }

    public static ConceptMastery fromState(MasteryState state, int historyLimit) {
        Instant first = state.firstExposureAt() != null ? state.firstExposureAt() : Instant.EPOCH;
        ConceptMastery mastery = new ConceptMastery(state.learnerId(), state.conceptId(), first);
        mastery.masteryScore = clamp(state.masteryScore(), 0.0, 1.0);
        mastery.confidenceScore = clamp(state.confidenceScore(), 0.0, 1.0);
        mastery.stability = clamp(state.stability(), MIN_STABILITY, MAX_INTERVAL_DAYS);
        mastery.difficultyModifier = state.difficultyModifier() > 0 ? state.difficultyModifier() : 1.0;
        mastery.intervalDays = (int) clamp(state.intervalDays(), MIN_INTERVAL_DAYS, MAX_INTERVAL_DAYS);
        mastery.lastInteractionAt = state.lastInteractionAt() != null ? state.lastInteractionAt() : first;
        mastery.nextReviewAt = state.nextReviewAt() != null ? state.nextReviewAt() : mastery.lastInteractionAt;
        mastery.lastMasteredAt = state.lastMasteredAt();
        mastery.interactionCount = Math.max(0, state.interactionCount());
        mastery.successfulInteractions = Math.max(0, state.successfulInteractions());
        mastery.totalTimeSeconds = Math.max(0, state.totalTimeSeconds());
        mastery.peakMasteryScore = clamp(state.peakMasteryScore(), 0.0, 1.0);
        if (state.history() != null) {
            for (InteractionRecord entry : state.history()) {
                mastery.appendHistory(entry, historyLimit);
            }
        }
        return mastery;
    }

    public MasteryState toState() {
        return new MasteryState(learnerId, conceptId, masteryScore, confidenceScore, stability, difficultyModifier,
                intervalDays, firstExposureAt, lastInteractionAt, nextReviewAt, lastMasteredAt, interactionCount,
                successfulInteractions, totalTimeSeconds, peakMasteryScore, getHistory());
    }

    // caller holds this record's monitor
    void applyInteraction(InteractionResult result, Instant now, int historyLimit) {
        double scoreBefore = masteryScore;

        double elapsedDays = daysBetween(lastInteractionAt, now);
        if (elapsedDays > DECAY_MIN_DAYS) {
            masteryScore *= Math.exp(-elapsedDays / stability);
        }

        double alpha = BASE_LEARNING_RATE / result.difficultyRating();
        double confidenceFactor = confidenceScore + Math.min(0.3, interactionCount * 0.02) + 0.2;

        if (result.success()) {
            double update = alpha * (result.score() - masteryScore) * confidenceFactor
                    + SUCCESS_BOOST * (1 - difficultyModifier) * 0.1;
            masteryScore = clamp(masteryScore + update, 0.0, 1.0);
            confidenceScore = clamp(confidenceScore + 0.05 * confidenceFactor, 0.1, 1.0);
        } else {
            masteryScore = clamp(masteryScore - FAIL_PENALTY * masteryScore * confidenceFactor, 0.0, 1.0);
            confidenceScore = clamp(confidenceScore - 0.02, 0.1, 1.0);
        }

        updateStability(result);
        scheduleNextReview(now);

        interactionCount++;
        if (result.success()) successfulInteractions++;
        totalTimeSeconds += result.timeSpentSeconds();
        lastInteractionAt = now;
        peakMasteryScore = Math.max(peakMasteryScore, masteryScore);
        if (masteryScore >= MASTERED_THRESHOLD && lastMasteredAt == null) {
            lastMasteredAt = now;
        }
        appendHistory(new InteractionRecord(now, result.success(), result.interactionType(), result.score(),
                result.timeSpentSeconds(), result.difficultyRating(), scoreBefore, masteryScore), historyLimit);
    }

    private void updateStability(InteractionResult result) {
        if (result.success()) {
            double multiplier = result.score() > 0.9 ? EASY_MULTIPLIER
                    : result.score() < 0.6 ? HARD_MULTIPLIER
                    : NORMAL_MULTIPLIER;
            stability = Math.min(stability * multiplier, MAX_INTERVAL_DAYS);
        } else {
            stability = Math.max(stability * STABILITY_LOSS_ON_FAIL, MIN_STABILITY);
        }
        intervalDays = (int) clamp(Math.max(MIN_INTERVAL_DAYS, (int) (stability / difficultyModifier)),
                MIN_INTERVAL_DAYS, MAX_INTERVAL_DAYS);
    }

    private void scheduleNextReview(Instant now) {
        double confidenceMultiplier = 0.5 + confidenceScore * 1.5;
        double levelMultiplier;
        if (masteryScore >= 0.95) {
            levelMultiplier = 2.0;
        } else if (masteryScore >= 0.85) {
            levelMultiplier = 1.5;
        } else if (masteryScore >= 0.70) {
            levelMultiplier = 1.2;
        } else {
            levelMultiplier = 1.0;
        }
        int days = (int) (intervalDays * confidenceMultiplier * levelMultiplier);
        days = Math.min(Math.max(days, MIN_INTERVAL_DAYS), MAX_INTERVAL_DAYS);
        nextReviewAt = now.plus(Duration.ofDays(days));
    }

    private void appendHistory(InteractionRecord entry, int historyLimit) {
        history.addLast(entry);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }

    public double getRetentionPrediction(double daysAhead, Instant now) {
        double totalDays = Math.max(0.0, daysBetween(lastInteractionAt, now)) + Math.max(0.0, daysAhead);
        double effectiveStability = stability * difficultyModifier;
        return clamp(Math.exp(-totalDays / effectiveStability), 0.0, 1.0);
    }

    public MasteryLevel getMasteryLevel() {
        return MasteryLevel.fromScore(masteryScore);
    }

    public boolean isOverdueForReview(Instant now) {
        return !now.isBefore(nextReviewAt);
    }

    public boolean isConsideredKnown() {
        return isConsideredKnown(DEFAULT_KNOWN_THRESHOLD);
    }

    public boolean isConsideredKnown(double threshold) {
        return masteryScore >= threshold;
    }

    public String getLearnerId() {
        return learnerId;
    }

    public String getConceptId() {
        return conceptId;
    }

    public double getMasteryScore() {
        return masteryScore;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public double getStability() {
        return stability;
    }

    public double getDifficultyModifier() {
        return difficultyModifier;
    }

    public int getIntervalDays() {
        return intervalDays;
    }

    public Instant getFirstExposureAt() {
        return firstExposureAt;
    }

    public Instant getLastInteractionAt() {
        return lastInteractionAt;
    }

    public Instant getNextReviewAt() {
        return nextReviewAt;
    }

    public Instant getLastMasteredAt() {
        return lastMasteredAt;
    }

    public int getInteractionCount() {
        return interactionCount;
    }

    public int getSuccessfulInteractions() {
        return successfulInteractions;
    }

    public long getTotalTimeSeconds() {
        return totalTimeSeconds;
    }

    public double getPeakMasteryScore() {
        return peakMasteryScore;
    }

    public List<InteractionRecord> getHistory() {
        return List.copyOf(history);
    }

    static double daysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 1000.0 / SECONDS_PER_DAY;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
