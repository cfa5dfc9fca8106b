package com.herzen.mastery.mastery;

import com.herzen.mastery.mastery.MasteryModels.VisualAidMapping;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class VisualAidRegistry implements VisualAidLookup {
    private final Map<String, List<VisualAidMapping>> byConcept = new ConcurrentHashMap<>();

    public boolean registerMapping(VisualAidMapping mapping) {
        Objects.requireNonNull(mapping.assetId(), "assetId");
        Objects.requireNonNull(mapping.conceptId(), "conceptId");
        List<VisualAidMapping> mappings = byConcept.computeIfAbsent(mapping.conceptId(), id -> new CopyOnWriteArrayList<>());
        synchronized (mappings) {
            if (mappings.stream().anyMatch(m -> m.assetId().equals(mapping.assetId()))) return false;
            mappings.add(mapping);
            return true;
        }
    }

    @Override
    public List<VisualAidMapping> getMappingsForConcept(String conceptId) {
        if (conceptId == null) return List.of();
        return List.copyOf(byConcept.getOrDefault(conceptId, List.of()));
    }
}
