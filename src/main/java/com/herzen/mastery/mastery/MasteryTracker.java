package com.herzen.mastery.mastery;

import com.herzen.mastery.config.MasteryProperties;
import com.herzen.mastery.config.ReasoningProperties;
import com.herzen.mastery.mastery.MasteryModels.InteractionRecord;
import com.herzen.mastery.mastery.MasteryModels.InteractionResult;
import com.herzen.mastery.mastery.MasteryModels.MasteryState;
import com.herzen.mastery.repository.MasteryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

@Service
public class MasteryTracker {
    private static final Logger log = LoggerFactory.getLogger(MasteryTracker.class);

    private final MasteryRepository repository;
    private final MasteryProperties properties;
    private final ReasoningProperties reasoningProperties;
    private final MasteryStatistics statistics;
    private final Clock clock;

    public MasteryTracker(MasteryRepository repository,
                          MasteryProperties properties,
                          ReasoningProperties reasoningProperties,
                          MasteryStatistics statistics,
                          Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.reasoningProperties = reasoningProperties;
        this.statistics = statistics;
        this.clock = clock;
    }

    public ConceptMastery updateMastery(String learnerId, InteractionResult result) {
        return updateMastery(learnerId, result, clock.instant());
    }

    public ConceptMastery updateMastery(String learnerId, InteractionResult result, Instant now) {
        Objects.requireNonNull(learnerId, "learnerId");
        Objects.requireNonNull(result, "result");

        ConceptMastery mastery = ensureConceptMastery(learnerId, result.conceptId(), now);
        synchronized (mastery) {
            double before = mastery.getMasteryScore();
            mastery.applyInteraction(result, now, properties.getHistoryLimit());
            log.debug("Mastery update learner={} concept={} success={} score {} -> {} stability={} next={}",
                    learnerId, result.conceptId(), result.success(),
                    String.format(Locale.US, "%.3f", before), String.format(Locale.US, "%.3f", mastery.getMasteryScore()),
                    String.format(Locale.US, "%.2f", mastery.getStability()), mastery.getNextReviewAt());
        }
        statistics.recordUpdate();
        return mastery;
    }

    public Optional<ConceptMastery> getConceptMastery(String learnerId, String conceptId) {
        return repository.find(learnerId, conceptId);
    }

    public List<ConceptMastery> getAllMastery(String learnerId) {
        return repository.findAll(learnerId);
    }

    public List<ConceptMastery> getAllMastery(String learnerId, boolean includeOverdue) {
        return getAllMastery(learnerId, includeOverdue, clock.instant());
    }

    public List<ConceptMastery> getAllMastery(String learnerId, boolean includeOverdue, Instant now) {
        List<ConceptMastery> records = repository.findAll(learnerId);
        if (includeOverdue) return records;
        return records.stream().filter(r -> !r.isOverdueForReview(now)).toList();
    }

    public Map<String, ConceptMastery> getMasteryForConcepts(String learnerId, Collection<String> conceptIds) {
        Map<String, ConceptMastery> result = new LinkedHashMap<>();
        for (String conceptId : conceptIds) {
            repository.find(learnerId, conceptId).ifPresent(m -> result.put(conceptId, m));
        }
        return result;
    }

    public ConceptMastery ensureConceptMastery(String learnerId, String conceptId) {
        return ensureConceptMastery(learnerId, conceptId, clock.instant());
    }

    public ConceptMastery ensureConceptMastery(String learnerId, String conceptId, Instant now) {
        return repository.getOrCreate(learnerId, conceptId, () -> ConceptMastery.create(learnerId, conceptId, now));
    }

    public Set<String> knownConcepts(String learnerId) {
        return knownConcepts(learnerId, reasoningProperties.getKnownThreshold());
    }

    public Set<String> knownConcepts(String learnerId, double threshold) {
        Set<String> known = new LinkedHashSet<>();
        for (ConceptMastery mastery : repository.findAll(learnerId)) {
            if (mastery.isConsideredKnown(threshold)) known.add(mastery.getConceptId());
        }
        return known;
    }

    public boolean isKnown(String learnerId, String conceptId) {
        double threshold = reasoningProperties.getKnownThreshold();
        return repository.find(learnerId, conceptId).map(m -> m.isConsideredKnown(threshold)).orElse(false);
    }

    public Map<Integer, Double> calculateRetentionCurve(String learnerId, String conceptId, int daysAhead) {
        return calculateRetentionCurve(learnerId, conceptId, daysAhead, clock.instant());
    }

    public Map<Integer, Double> calculateRetentionCurve(String learnerId, String conceptId, int daysAhead, Instant now) {
        Map<Integer, Double> curve = new LinkedHashMap<>();
        Optional<ConceptMastery> mastery = repository.find(learnerId, conceptId);
        for (int day = 0; day <= Math.max(0, daysAhead); day++) {
            double retention = mastery.isPresent()
                    ? mastery.get().getRetentionPrediction(day, now)
                    : Math.max(0.0, 1.0 - day * 0.1);
            curve.put(day, retention);
        }
        return curve;
    }

    /**
     * Recomputes a mastery score from interaction history as a moving average of result scores, newest
     * first, where the i-th newest entry has weight 0.7^i.
     */
    public double calculateMasteryLevel(List<InteractionRecord> history) {
        if (history == null || history.isEmpty()) return 0.0;

        List<InteractionRecord> newestFirst = new ArrayList<>(history);
        newestFirst.sort(Comparator.comparing(InteractionRecord::timestamp).reversed());

        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (int i = 0; i < newestFirst.size(); i++) {
            double weight = Math.pow(0.7, i);
            weightedSum += newestFirst.get(i).resultScore() * weight;
            totalWeight += weight;
        }
        return weightedSum / totalWeight;
    }

    public List<MasteryState> exportRecords(String learnerId) {
        List<MasteryState> states = new ArrayList<>();
        for (ConceptMastery mastery : repository.findAll(learnerId)) {
            synchronized (mastery) {
                states.add(mastery.toState());
            }
        }
        return states;
    }

    public List<MasteryState> exportRecords() {
        List<MasteryState> states = new ArrayList<>();
        for (String learnerId : new TreeSet<>(repository.learnerIds())) {
            states.addAll(exportRecords(learnerId));
        }
        return states;
    }

    /** Replaces any existing record with the same (learner, concept) key. */
    public int importRecords(List<MasteryState> states) {
        int imported = 0;
        for (MasteryState state : states) {
            if (state == null || state.learnerId() == null || state.conceptId() == null) continue;
            repository.save(ConceptMastery.fromState(state, properties.getHistoryLimit()));
            imported++;
        }
        log.info("Imported {} mastery record(s)", imported);
        return imported;
    }
}
