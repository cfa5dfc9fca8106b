package com.herzen.mastery.mastery;

import com.herzen.mastery.mastery.MasteryModels.VisualAidMapping;

import java.util.List;

public interface VisualAidLookup {

    List<VisualAidMapping> getMappingsForConcept(String conceptId);

    default boolean hasVisualAid(String conceptId) {
        return !getMappingsForConcept(conceptId).isEmpty();
    }
}
