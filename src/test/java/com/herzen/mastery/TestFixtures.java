package com.herzen.mastery;

import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.domain.DomainModels.DifficultyLevel;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphModels.ConceptAttributes;
import com.herzen.mastery.graph.KnowledgeGraphModels.Relationship;
import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipInput;
import com.herzen.mastery.mastery.MasteryModels.MasteryState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

final class TestFixtures {
    static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private TestFixtures() {
    }

    static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    static ConceptAttributes concept(String name, String subject, DifficultyLevel level, String... tags) {
        return new ConceptAttributes(name, subject, level, Set.of(tags), Set.of(), Set.of());
    }

    static RelationshipInput rel(String source, String target, String type) {
        return new RelationshipInput(source, target, type, null);
    }

    static ConceptNode node(String id, String subject, DifficultyLevel level, Set<String> tags) {
        return new ConceptNode(id, id, subject, level, tags, Set.of(), Set.of());
    }

    static ConceptNode node(String id) {
        return node(id, "math", DifficultyLevel.INTERMEDIATE, Set.of());
    }

    /** Nodes with default attributes, one per id. */
    static ConceptGraph graph(String... ids) {
        ConceptGraph graph = new ConceptGraph();
        for (String id : ids) {
            graph.addNode(node(id));
        }
        return graph;
    }

    static void edge(ConceptGraph graph, String source, String target, String type) {
        graph.addEdge(Relationship.explicit(source, target, type, 1.0));
    }

    static MasteryState state(String learnerId,
                              String conceptId,
                              double score,
                              double stability,
                              int interactions,
                              long daysSinceLastInteraction,
                              long daysUntilNextReview) {
        Instant last = NOW.minus(Duration.ofDays(daysSinceLastInteraction));
        return new MasteryState(learnerId, conceptId, score, 0.5, stability, 1.0, 1,
                last.minus(Duration.ofDays(1)), last, NOW.plus(Duration.ofDays(daysUntilNextReview)), null,
                interactions, interactions, 0, score, List.of());
    }
}
