package com.herzen.mastery.recommendation;

import com.herzen.mastery.domain.DomainModels.DifficultyLevel;

import java.util.List;

public class RecommendationModels {

    public enum RecommendationType {
        NEXT_LESSON,
        REMEDIAL,
        REINFORCEMENT,
        CHALLENGE
    }

    public record LearningRecommendation(String conceptId,
                                         String conceptName,
                                         String subjectId,
                                         DifficultyLevel difficulty,
                                         RecommendationType type,
                                         double priority,
                                         String reason,
                                         List<FactorScore> factors,
                                         double currentMastery,
                                         boolean review,
                                         boolean hasVisualAid,
                                         String visualAssetId,
                                         List<String> relatedConcepts) {}

    public record FactorScore(String name, double value) {}
}
