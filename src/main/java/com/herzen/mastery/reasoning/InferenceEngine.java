package com.herzen.mastery.reasoning;

import com.herzen.mastery.config.ReasoningProperties;
import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphModels.Relationship;
import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipTypes;
import com.herzen.mastery.reasoning.ReasoningModels.*;
import com.herzen.mastery.repository.InferredRelationshipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Applies the registered inference rules to a concept graph.
 * <p>
 * Transitive and symmetric inferences are added back into the graph as virtual edges, so later rules of
 * the same run can build on them. An inference already stored for the same (source, target, type, rule)
 * is never produced twice.
 */
@Service
public class InferenceEngine {
    private static final Logger log = LoggerFactory.getLogger(InferenceEngine.class);

    private static final Map<String, String> INVERSE_PREDICATES = Map.of(
            RelationshipTypes.PREREQUISITE, RelationshipTypes.ENABLES,
            RelationshipTypes.LEADS_TO, RelationshipTypes.REQUIRES,
            RelationshipTypes.COMPONENT_OF, RelationshipTypes.HAS_COMPONENT
    );

    private final InferenceRuleRegistry ruleRegistry;
    private final InferredRelationshipRepository inferredRepository;
    private final SimilarityService similarityService;
    private final ReasoningStatistics statistics;
    private final ReasoningProperties properties;
    private final Clock clock;

    public InferenceEngine(InferenceRuleRegistry ruleRegistry,
                           InferredRelationshipRepository inferredRepository,
                           SimilarityService similarityService,
                           ReasoningStatistics statistics,
                           ReasoningProperties properties,
                           Clock clock) {
        this.ruleRegistry = ruleRegistry;
        this.inferredRepository = inferredRepository;
        this.similarityService = similarityService;
        this.statistics = statistics;
        this.properties = properties;
        this.clock = clock;
    }

    public InferenceResult runInference(ConceptGraph graph) {
        return runInference(graph, null, ReasoningScope.GRAPH_WIDE, Set.of());
    }

    /**
     * @param ruleIds   rules to apply; null or empty means every active rule. Unknown and inactive ids are ignored.
     * @param scope     which nodes may start a derivation
     * @param scopeKeys focus concept ids for {@link ReasoningScope#LOCAL}, subject ids for
     *                  {@link ReasoningScope#SUBJECT}; ignored for {@link ReasoningScope#GRAPH_WIDE}
     */
    public InferenceResult runInference(ConceptGraph graph,
                                        Collection<String> ruleIds,
                                        ReasoningScope scope,
                                        Collection<String> scopeKeys) {
        long started = System.nanoTime();
        List<InferenceRule> rules = selectRules(ruleIds);
        Set<String> startNodes = startNodes(graph, scope, scopeKeys == null ? Set.of() : Set.copyOf(scopeKeys));

        List<InferredRelationship> inferred = new ArrayList<>();
        Map<String, Integer> byRule = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();

        for (InferenceRule rule : rules) {
            try {
                List<InferredRelationship> produced = applyRule(graph, rule, startNodes);
                for (InferredRelationship relationship : produced) {
                    inferredRepository.save(relationship);
                }
                inferred.addAll(produced);
                byRule.put(rule.ruleId(), produced.size());
            } catch (RuntimeException e) {
                String warning = "Rule " + rule.ruleId() + ": " + e.getMessage();
                log.warn("Inference rule {} failed, continuing with remaining rules", rule.ruleId(), e);
                warnings.add(warning);
                statistics.recordError(warning);
            }
        }

        long durationMs = (System.nanoTime() - started) / 1_000_000;
        statistics.recordRun(byRule, clock.instant(), durationMs);
        log.info("Inference run applied {} rule(s) over {} start node(s): {} new relationship(s), {} warning(s) in {} ms",
                rules.size(), startNodes.size(), inferred.size(), warnings.size(), durationMs);

        return new InferenceResult(List.copyOf(inferred),
                new InferenceRunStats(rules.size(), inferred.size(), Map.copyOf(byRule), List.copyOf(warnings), durationMs));
    }

    public List<InferredRelationship> getInferredRelationships(String conceptId, String relationshipType) {
        return inferredRepository.find(conceptId, relationshipType);
    }

    public void clearInferences() {
        inferredRepository.clear();
    }

    static double pathConfidence(int hops) {
        return Math.max(0.3, 1.0 - (hops / 5.0) * 0.5);
    }

    private List<InferredRelationship> applyRule(ConceptGraph graph, InferenceRule rule, Set<String> startNodes) {
        return switch (rule.kind()) {
            case TRANSITIVE -> applyTransitive(graph, rule, startNodes);
            case SYMMETRIC -> applySymmetric(graph, rule, startNodes);
            case INVERSE -> applyInverse(graph, rule, startNodes);
            case SIMILARITY -> {
                similarityService.calculateAllSimilarities(graph, eligible(graph, rule, startNodes));
                yield List.of();
            }
            case CLUSTER -> {
                ReasoningProperties.Clustering clustering = properties.getClustering();
                similarityService.discoverClusters(graph, eligible(graph, rule, startNodes),
                        clustering.getMinSimilarity(), clustering.getMaxClusterSize(), clustering.getMinClusterSize());
                yield List.of();
            }
        };
    }

    private List<InferredRelationship> applyTransitive(ConceptGraph graph, InferenceRule rule, Set<String> startNodes) {
        String predicate = rule.sourcePredicate();
        String derivedType = rule.targetPredicate() != null ? rule.targetPredicate() : "derived_" + predicate;
        List<InferredRelationship> result = new ArrayList<>();

        for (String start : eligible(graph, rule, startNodes)) {
            List<List<String>> paths = new ArrayList<>(graph.findAllPaths(start, rule.maxHops(), e -> predicate.equals(e.type())));
            paths.removeIf(p -> p.size() < 3);
            paths.sort(Comparator.comparingInt(List::size));

            for (List<String> path : paths) {
                String target = path.get(path.size() - 1);
                if (graph.hasEdge(start, target)) continue;
                if (inferredRepository.exists(start, target, derivedType, rule.ruleId())) continue;

                int hops = path.size() - 1;
                double pathConfidence = pathConfidence(hops);
                double score = rule.confidenceWeight() * pathConfidence;
                List<DerivationHop> derivation = new ArrayList<>();
                for (int i = 0; i < hops; i++) {
                    derivation.add(new DerivationHop(path.get(i), path.get(i + 1), predicate));
                }
                result.add(new InferredRelationship(start, target, derivedType, rule.ruleId(),
                        InferenceConfidence.fromScore(pathConfidence), score, derivation, hops, clock.instant()));
                graph.addEdge(Relationship.inferred(start, target, derivedType, score, rule.ruleId()));
            }
        }
        return result;
    }

    private List<InferredRelationship> applySymmetric(ConceptGraph graph, InferenceRule rule, Set<String> startNodes) {
        String predicate = rule.sourcePredicate();
        double score = rule.confidenceWeight() * 0.8;
        Set<String> allowed = new HashSet<>(eligible(graph, rule, startNodes));
        List<InferredRelationship> result = new ArrayList<>();

        for (Relationship edge : graph.edges(e -> predicate.equals(e.type()))) {
            if (!allowed.contains(edge.source())) continue;
            if (graph.hasEdge(edge.target(), edge.source())) continue;
            if (inferredRepository.exists(edge.target(), edge.source(), predicate, rule.ruleId())) continue;

            result.add(new InferredRelationship(edge.target(), edge.source(), predicate, rule.ruleId(),
                    InferenceConfidence.MEDIUM, score,
                    List.of(new DerivationHop(edge.source(), edge.target(), predicate)), 1, clock.instant()));
            graph.addEdge(Relationship.inferred(edge.target(), edge.source(), predicate, score, rule.ruleId()));
        }
        return result;
    }

    private List<InferredRelationship> applyInverse(ConceptGraph graph, InferenceRule rule, Set<String> startNodes) {
        String predicate = rule.sourcePredicate();
        String fallback = rule.targetPredicate() != null ? rule.targetPredicate() : "inverse_" + predicate;
        String inverseType = INVERSE_PREDICATES.getOrDefault(predicate, fallback);
        double score = rule.confidenceWeight() * 0.9;
        Set<String> allowed = new HashSet<>(eligible(graph, rule, startNodes));
        List<InferredRelationship> result = new ArrayList<>();
        Set<String> emitted = new HashSet<>();

        for (Relationship edge : graph.edges(e -> predicate.equals(e.type()))) {
            if (!allowed.contains(edge.source())) continue;
            if (inferredRepository.exists(edge.target(), edge.source(), inverseType, rule.ruleId())) continue;
            if (!emitted.add(edge.target() + "->" + edge.source())) continue;

            result.add(new InferredRelationship(edge.target(), edge.source(), inverseType, rule.ruleId(),
                    InferenceConfidence.HIGH, score,
                    List.of(new DerivationHop(edge.source(), edge.target(), predicate)), 1, clock.instant()));
        }
        return result;
    }

    private List<InferenceRule> selectRules(Collection<String> ruleIds) {
        if (ruleIds == null || ruleIds.isEmpty()) {
            return ruleRegistry.listRules(true);
        }
        return ruleIds.stream()
                .map(ruleRegistry::getRule)
                .flatMap(Optional::stream)
                .filter(InferenceRule::active)
                .toList();
    }

    private Set<String> startNodes(ConceptGraph graph, ReasoningScope scope, Set<String> scopeKeys) {
        Set<String> nodes = new LinkedHashSet<>();
        for (ConceptNode node : graph.nodes()) {
            boolean inScope = switch (scope) {
                case LOCAL -> scopeKeys.contains(node.id());
                case SUBJECT -> scopeKeys.contains(node.subjectId());
                case GRAPH_WIDE -> true;
            };
            if (inScope) nodes.add(node.id());
        }
        return nodes;
    }

    private List<String> eligible(ConceptGraph graph, InferenceRule rule, Set<String> startNodes) {
        return startNodes.stream()
                .filter(id -> graph.getNode(id).map(rule::appliesTo).orElse(false))
                .toList();
    }
}
