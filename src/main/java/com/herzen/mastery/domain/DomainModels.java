package com.herzen.mastery.domain;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

public class DomainModels {

    public enum DifficultyLevel {
        BEGINNER(0.5),
        ELEMENTARY(1.0),
        INTERMEDIATE(2.0),
        ADVANCED(4.0),
        EXPERT(8.0);

        private final double remediationHours;

        DifficultyLevel(double remediationHours) {
            this.remediationHours = remediationHours;
        }

        public double remediationHours() {
            return remediationHours;
        }

        /** Unknown or blank values fall back to {@link #INTERMEDIATE}. */
        public static DifficultyLevel parse(String value) {
            if (value == null || value.isBlank()) return INTERMEDIATE;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return INTERMEDIATE;
            }
        }
    }

    public record ConceptNode(String id,
                              String name,
                              String subjectId,
                              DifficultyLevel difficulty,
                              Set<String> tags,
                              Set<String> keywords,
                              Set<String> learningObjectives) {
        public ConceptNode {
            Objects.requireNonNull(id, "id");
            name = name == null || name.isBlank() ? id : name;
            subjectId = subjectId == null ? "" : subjectId;
            difficulty = difficulty == null ? DifficultyLevel.INTERMEDIATE : difficulty;
            tags = tags == null ? Set.of() : Set.copyOf(tags);
            keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
            learningObjectives = learningObjectives == null ? Set.of() : Set.copyOf(learningObjectives);
        }

        public String domain() {
            return subjectId.isBlank() ? "general" : subjectId;
        }
    }
}
