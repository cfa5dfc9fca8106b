package com.herzen.mastery.mastery;

import com.herzen.mastery.config.MasteryProperties;
import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.mastery.MasteryModels.ReviewScheduleEntry;
import com.herzen.mastery.mastery.MasteryModels.VisualAidMapping;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Service
public class ReviewScheduler {
    private final MasteryTracker tracker;
    private final VisualAidLookup visualAids;
    private final MasteryProperties properties;
    private final MasteryStatistics statistics;
    private final Clock clock;

    public ReviewScheduler(MasteryTracker tracker,
                           VisualAidLookup visualAids,
                           MasteryProperties properties,
                           MasteryStatistics statistics,
                           Clock clock) {
        this.tracker = tracker;
        this.visualAids = visualAids;
        this.properties = properties;
        this.statistics = statistics;
        this.clock = clock;
    }

    public List<ReviewScheduleEntry> getReviewSchedule(String learnerId, Map<String, ConceptNode> catalog) {
        return getReviewSchedule(learnerId, catalog, properties.getReview().getMaxItems(), clock.instant());
    }

    public List<ReviewScheduleEntry> getReviewSchedule(String learnerId, Map<String, ConceptNode> catalog, int maxItems) {
        return getReviewSchedule(learnerId, catalog, maxItems, clock.instant());
    }

    /** Sorted by non-increasing priority; equal priorities keep record creation order. */
    public List<ReviewScheduleEntry> getReviewSchedule(String learnerId,
                                                       Map<String, ConceptNode> catalog,
                                                       int maxItems,
                                                       Instant now) {
        if (maxItems <= 0) return List.of();

        List<ReviewScheduleEntry> entries = new ArrayList<>();
        for (ConceptMastery mastery : tracker.getAllMastery(learnerId)) {
            ReviewScheduleEntry entry;
            synchronized (mastery) {
                if (!mastery.isOverdueForReview(now)) continue;
                entry = toEntry(mastery, catalog == null ? null : catalog.get(mastery.getConceptId()), now);
            }
            entries.add(entry);
        }

        entries.sort(Comparator.comparingDouble(ReviewScheduleEntry::priority).reversed());
        List<ReviewScheduleEntry> schedule = entries.size() > maxItems ? List.copyOf(entries.subList(0, maxItems)) : entries;
        statistics.recordSchedule(schedule.size());
        return schedule;
    }

    public double calculateReviewPriority(ConceptMastery mastery, Instant now) {
        double priority = 0.0;

        if (mastery.isOverdueForReview(now)) {
            long daysOverdue = Duration.between(mastery.getNextReviewAt(), now).toDays();
            priority += Math.min(0.3, daysOverdue * 0.05);
        }

        double retention7 = mastery.getRetentionPrediction(7, now);
        if (retention7 < 0.5) {
            priority += 0.3;
        } else if (retention7 < 0.7) {
            priority += 0.15;
        }

        double score = mastery.getMasteryScore();
        if (score < 0.3) {
            priority += 0.2;
        } else if (score < 0.5) {
            priority += 0.1;
        }
        return Math.min(1.0, priority);
    }

    private ReviewScheduleEntry toEntry(ConceptMastery mastery, ConceptNode concept, Instant now) {
        String conceptId = mastery.getConceptId();
        long daysUntil = Math.max(0, Duration.between(now, mastery.getNextReviewAt()).toDays());
        List<VisualAidMapping> aids = visualAids.getMappingsForConcept(conceptId);

        return new ReviewScheduleEntry(
                conceptId,
                concept != null ? concept.name() : conceptId,
                mastery.getNextReviewAt(),
                calculateReviewPriority(mastery, now),
                mastery.getMasteryScore(),
                1.0 - mastery.getRetentionPrediction(daysUntil, now),
                concept != null ? concept.domain() : "general",
                !aids.isEmpty(),
                aids.isEmpty() ? null : aids.get(0).assetId());
    }
}
