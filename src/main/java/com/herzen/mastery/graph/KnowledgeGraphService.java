package com.herzen.mastery.graph;

import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.graph.KnowledgeGraphModels.*;
import com.herzen.mastery.repository.ConceptCatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class KnowledgeGraphService implements KnowledgeGraphSource {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphService.class);

    private final ConceptCatalogRepository repository;

    public KnowledgeGraphService(ConceptCatalogRepository repository) {
        this.repository = repository;
    }

    @Override
    public GraphBuildResult buildConceptGraph(Map<String, ConceptAttributes> concepts, List<RelationshipInput> relationships) {
        ConceptGraph graph = new ConceptGraph();
        List<GraphValidationIssue> issues = new ArrayList<>();

        if (concepts != null) {
            concepts.forEach((id, attrs) -> graph.addNode(toNode(id, attrs)));
        }

        for (RelationshipInput rel : relationships == null ? List.<RelationshipInput>of() : relationships) {
            if (rel == null || rel.source() == null || rel.target() == null) {
                issues.add(new GraphValidationIssue("RELATIONSHIP_INCOMPLETE", "Relationship is missing an endpoint", String.valueOf(rel)));
                continue;
            }
            String label = rel.source() + "->" + rel.target();
            if (!graph.hasNode(rel.source()) || !graph.hasNode(rel.target())) {
                issues.add(new GraphValidationIssue("CONCEPT_REF_NOT_FOUND", "Relationship references a concept missing from the catalog", label));
                continue;
            }
            String type = rel.type() == null || rel.type().isBlank() ? RelationshipTypes.PREREQUISITE : rel.type();
            double weight = rel.weight() == null ? 1.0 : rel.weight();
            graph.addEdge(Relationship.explicit(rel.source(), rel.target(), type, weight));
        }

        findCycle(graph).ifPresent(node ->
                issues.add(new GraphValidationIssue("CYCLE_DETECTED", "Cycle detected in prerequisite graph", node)));

        for (ConceptNode node : graph.nodes()) {
            if (graph.outgoingEdges(node.id()).isEmpty() && graph.incomingEdges(node.id()).isEmpty()) {
                issues.add(new GraphValidationIssue("ORPHAN_CONCEPT", "Concept has no graph links", node.id()));
            }
        }

        long skipped = issues.stream().filter(i -> !"ORPHAN_CONCEPT".equals(i.code()) && !"CYCLE_DETECTED".equals(i.code())).count();
        if (skipped > 0) {
            log.warn("Skipped {} malformed relationship(s) while building concept graph", skipped);
        }
        return new GraphBuildResult(graph, issues);
    }

    public List<GraphValidationIssue> registerCatalog(ConceptCatalog catalog) {
        Objects.requireNonNull(catalog.catalogId(), "catalogId");
        GraphBuildResult result = buildConceptGraph(catalog.concepts(), catalog.relationships());
        repository.save(new ConceptCatalog(
                catalog.catalogId(),
                catalog.concepts() == null ? Map.of() : new LinkedHashMap<>(catalog.concepts()),
                catalog.relationships() == null ? List.of() : List.copyOf(catalog.relationships())));
        log.info("Registered catalog {} with {} concepts, {} relationships, {} issues",
                catalog.catalogId(), result.graph().size(), result.graph().edgeCount(), result.issues().size());
        return result.issues();
    }

    /** A new graph instance built from the registered catalog; inferred edges never carry over. */
    public Optional<ConceptGraph> snapshot(String catalogId) {
        return repository.find(catalogId)
                .map(c -> buildConceptGraph(c.concepts(), c.relationships()).graph());
    }

    public Map<String, ConceptNode> catalogNodes(String catalogId) {
        Map<String, ConceptNode> nodes = new LinkedHashMap<>();
        repository.find(catalogId).ifPresent(c -> c.concepts().forEach((id, attrs) -> nodes.put(id, toNode(id, attrs))));
        return nodes;
    }

    public List<String> catalogIds() {
        return repository.catalogIds();
    }

    private ConceptNode toNode(String id, ConceptAttributes attrs) {
        if (attrs == null) {
            return new ConceptNode(id, id, "", null, Set.of(), Set.of(), Set.of());
        }
        return new ConceptNode(id, attrs.name(), attrs.subjectId(), attrs.difficultyLevel(),
                attrs.tags(), attrs.keywords(), attrs.learningObjectives());
    }

    private Optional<String> findCycle(ConceptGraph graph) {
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String node : graph.nodeIds()) {
            if (hasCycle(graph, node, visiting, visited)) return Optional.of(node);
        }
        return Optional.empty();
    }

    private boolean hasCycle(ConceptGraph graph, String node, Set<String> visiting, Set<String> visited) {
        if (visited.contains(node)) return false;
        if (visiting.contains(node)) return true;

        visiting.add(node);
        for (Relationship edge : graph.outgoingEdges(node)) {
            if (!RelationshipTypes.PREREQUISITE.equals(edge.type())) continue;
            if (hasCycle(graph, edge.target(), visiting, visited)) return true;
        }
        visiting.remove(node);
        visited.add(node);
        return false;
    }
}
