package com.herzen.mastery.graph;

import com.herzen.mastery.graph.KnowledgeGraphModels.ConceptAttributes;
import com.herzen.mastery.graph.KnowledgeGraphModels.GraphBuildResult;
import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipInput;

import java.util.List;
import java.util.Map;

/**
 * Supplies concept graphs to the reasoning engine. Malformed relationships are skipped and reported
 * as issues in the result, never thrown.
 */
public interface KnowledgeGraphSource {

    GraphBuildResult buildConceptGraph(Map<String, ConceptAttributes> concepts, List<RelationshipInput> relationships);
}
