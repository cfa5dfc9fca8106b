package com.herzen.mastery.repository;

import com.herzen.mastery.mastery.ConceptMastery;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Mastery records keyed by learner, then concept. Records of one learner keep creation order.
 */
@Repository
public class MasteryRepository {
    private final Map<String, Map<String, ConceptMastery>> byLearner = new ConcurrentHashMap<>();

    public Optional<ConceptMastery> find(String learnerId, String conceptId) {
        Map<String, ConceptMastery> records = byLearner.get(learnerId);
        return records == null ? Optional.empty() : Optional.ofNullable(records.get(conceptId));
    }

    public List<ConceptMastery> findAll(String learnerId) {
        Map<String, ConceptMastery> records = byLearner.get(learnerId);
        if (records == null) return List.of();
        synchronized (records) {
            return List.copyOf(records.values());
        }
    }

    public ConceptMastery getOrCreate(String learnerId, String conceptId, Supplier<ConceptMastery> factory) {
        return learnerRecords(learnerId).computeIfAbsent(conceptId, id -> factory.get());
    }

    public void save(ConceptMastery mastery) {
        learnerRecords(mastery.getLearnerId()).put(mastery.getConceptId(), mastery);
    }

    public Set<String> learnerIds() {
        return Set.copyOf(byLearner.keySet());
    }

    public int count() {
        return byLearner.values().stream().mapToInt(Map::size).sum();
    }

    private Map<String, ConceptMastery> learnerRecords(String learnerId) {
        return byLearner.computeIfAbsent(learnerId, id -> Collections.synchronizedMap(new LinkedHashMap<>()));
    }
}
