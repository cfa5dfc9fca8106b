package com.herzen.mastery.graph;

import com.herzen.mastery.domain.DomainModels.DifficultyLevel;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class KnowledgeGraphModels {

    /**
     * Directed, typed edge. Explicit edges come from the catalog; inferred edges are virtual
     * and only live in the graph instance they were added to.
     */
    public record Relationship(String source,
                               String target,
                               String type,
                               double weight,
                               boolean inferred,
                               double confidence,
                               String ruleId) {
        public Relationship {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(type, "type");
        }

        public static Relationship explicit(String source, String target, String type, double weight) {
            return new Relationship(source, target, type, weight, false, 1.0, null);
        }

        public static Relationship inferred(String source, String target, String type, double confidence, String ruleId) {
            return new Relationship(source, target, type, 1.0, true, confidence, ruleId);
        }
    }

    public record ConceptAttributes(String name,
                                    String subjectId,
                                    DifficultyLevel difficultyLevel,
                                    Set<String> tags,
                                    Set<String> keywords,
                                    Set<String> learningObjectives) {}

    public record RelationshipInput(String source, String target, String type, Double weight) {}

    public record ConceptCatalog(String catalogId,
                                 Map<String, ConceptAttributes> concepts,
                                 List<RelationshipInput> relationships) {}

    public record GraphValidationIssue(String code, String message, String node) {}

    public record GraphBuildResult(ConceptGraph graph, List<GraphValidationIssue> issues) {}

    public static final class RelationshipTypes {
        public static final String PREREQUISITE = "prerequisite";
        public static final String ENABLES = "enables";
        public static final String LEADS_TO = "leads_to";
        public static final String REQUIRES = "requires";
        public static final String COMPONENT_OF = "component_of";
        public static final String HAS_COMPONENT = "has_component";
        public static final String RELATED_TO = "related_to";
        public static final String SIMILAR_TO = "similar_to";

        private RelationshipTypes() {
        }
    }
}
