package com.herzen.mastery.repository;

import com.herzen.mastery.reasoning.ReasoningModels.InferredRelationship;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InferredRelationshipRepository {
    private final Map<String, InferredRelationship> inferred = new ConcurrentHashMap<>();

    public boolean exists(String source, String target, String type, String ruleId) {
        return inferred.containsKey(key(source, target, type, ruleId));
    }

    public boolean save(InferredRelationship relationship) {
        String key = key(relationship.sourceId(), relationship.targetId(), relationship.relationshipType(), relationship.ruleId());
        return inferred.putIfAbsent(key, relationship) == null;
    }

    public List<InferredRelationship> find(String conceptId, String relationshipType) {
        List<InferredRelationship> result = new ArrayList<>();
        for (InferredRelationship rel : inferred.values()) {
            if (conceptId != null && !rel.involves(conceptId)) continue;
            if (relationshipType != null && !relationshipType.equals(rel.relationshipType())) continue;
            result.add(rel);
        }
        result.sort((a, b) -> {
            int bySource = a.sourceId().compareTo(b.sourceId());
            if (bySource != 0) return bySource;
            int byTarget = a.targetId().compareTo(b.targetId());
            return byTarget != 0 ? byTarget : a.relationshipType().compareTo(b.relationshipType());
        });
        return result;
    }

    public int count() {
        return inferred.size();
    }

    public void clear() {
        inferred.clear();
    }

    private String key(String source, String target, String type, String ruleId) {
        return source + "\u0000" + target + "\u0000" + type + "\u0000" + ruleId;
    }
}
