package com.herzen.mastery.reasoning;

import com.herzen.mastery.config.ReasoningProperties;
import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.domain.DomainModels.DifficultyLevel;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphModels.Relationship;
import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipTypes;
import com.herzen.mastery.reasoning.ReasoningModels.ConceptCluster;
import com.herzen.mastery.reasoning.ReasoningModels.ConceptSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Pairwise concept similarity and threshold clustering.
 * <p>
 * overall = tag Jaccard * 0.30 + keyword Jaccard * 0.30 + objective Jaccard * 0.25 + out-neighbour Jaccard * 0.15
 */
@Service
public class SimilarityService {
    private static final Logger log = LoggerFactory.getLogger(SimilarityService.class);

    static final String PROMOTION_RULE_ID = "similarity-promotion";

    private final ReasoningProperties properties;
    private final ReasoningStatistics statistics;

    public SimilarityService(ReasoningProperties properties, ReasoningStatistics statistics) {
        this.properties = properties;
        this.statistics = statistics;
    }

    public Optional<ConceptSimilarity> calculateSimilarity(ConceptGraph graph, String conceptA, String conceptB) {
        Optional<ConceptNode> a = graph.getNode(conceptA);
        Optional<ConceptNode> b = graph.getNode(conceptB);
        if (a.isEmpty() || b.isEmpty()) return Optional.empty();

        ConceptSimilarity similarity = similarity(graph, a.get(), b.get());
        statistics.recordSimilarities(1);
        return Optional.of(similarity);
    }

    public List<ConceptSimilarity> calculateAllSimilarities(ConceptGraph graph, Collection<String> conceptIds) {
        List<ConceptNode> nodes = conceptIds.stream()
                .map(graph::getNode)
                .flatMap(Optional::stream)
                .toList();
        List<ConceptSimilarity> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                result.add(similarity(graph, nodes.get(i), nodes.get(j)));
            }
        }
        statistics.recordSimilarities(result.size());
        return result;
    }

    public List<ConceptSimilarity> findSimilarConcepts(ConceptGraph graph, String conceptId, double minScore, int limit) {
        Optional<ConceptNode> origin = graph.getNode(conceptId);
        if (origin.isEmpty() || limit <= 0) return List.of();

        List<ConceptSimilarity> matches = new ArrayList<>();
        for (ConceptNode other : graph.nodes()) {
            if (other.id().equals(conceptId)) continue;
            ConceptSimilarity similarity = similarity(graph, origin.get(), other);
            if (similarity.overall() >= minScore) {
                matches.add(similarity);
            }
        }
        statistics.recordSimilarities(graph.size() - 1);
        matches.sort(Comparator.comparingDouble(ConceptSimilarity::overall).reversed());
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    public boolean promoteSimilarity(ConceptGraph graph, ConceptSimilarity similarity) {
        if (!graph.hasNode(similarity.conceptA()) || !graph.hasNode(similarity.conceptB())) return false;
        return graph.addEdge(Relationship.inferred(similarity.conceptA(), similarity.conceptB(),
                RelationshipTypes.SIMILAR_TO, similarity.overall(), PROMOTION_RULE_ID));
    }

    public List<ConceptCluster> discoverClusters(ConceptGraph graph) {
        ReasoningProperties.Clustering clustering = properties.getClustering();
        return discoverClusters(graph, graph.nodeIds(), clustering.getMinSimilarity(),
                clustering.getMaxClusterSize(), clustering.getMinClusterSize());
    }

    /**
     * Greedy agglomeration: pairs are taken by descending similarity; a pair starts a cluster, extends one,
     * or merges two, unless the result would exceed {@code maxClusterSize}. Clusters below
     * {@code minClusterSize} are dropped.
     */
    public List<ConceptCluster> discoverClusters(ConceptGraph graph,
                                                 Collection<String> conceptIds,
                                                 double minSimilarity,
                                                 int maxClusterSize,
                                                 int minClusterSize) {
        List<ConceptSimilarity> all = calculateAllSimilarities(graph, conceptIds);
        Map<String, Double> scores = new HashMap<>();
        for (ConceptSimilarity s : all) {
            scores.put(s.pairKey(), s.overall());
        }

        List<ConceptSimilarity> candidates = new ArrayList<>(all.stream().filter(s -> s.overall() >= minSimilarity).toList());
        candidates.sort(Comparator.comparingDouble(ConceptSimilarity::overall).reversed());

        List<Set<String>> groups = new ArrayList<>();
        Map<String, Set<String>> groupOf = new HashMap<>();
        for (ConceptSimilarity pair : candidates) {
            String a = pair.conceptA();
            String b = pair.conceptB();
            Set<String> groupA = groupOf.get(a);
            Set<String> groupB = groupOf.get(b);

            if (groupA == null && groupB == null) {
                if (maxClusterSize < 2) continue;
                Set<String> group = new LinkedHashSet<>(List.of(a, b));
                groups.add(group);
                groupOf.put(a, group);
                groupOf.put(b, group);
            } else if (groupA != null && groupB == null) {
                if (groupA.size() + 1 > maxClusterSize) continue;
                groupA.add(b);
                groupOf.put(b, groupA);
            } else if (groupA == null) {
                if (groupB.size() + 1 > maxClusterSize) continue;
                groupB.add(a);
                groupOf.put(a, groupB);
            } else if (groupA != groupB) {
                if (groupA.size() + groupB.size() > maxClusterSize) continue;
                groupA.addAll(groupB);
                groupB.forEach(id -> groupOf.put(id, groupA));
                groups.removeIf(g -> g == groupB);
            }
        }

        List<ConceptCluster> clusters = new ArrayList<>();
        for (Set<String> group : groups) {
            if (group.size() < minClusterSize) continue;
            clusters.add(toCluster(graph, "cluster-" + (clusters.size() + 1), List.copyOf(group), scores));
        }
        statistics.recordClusters(clusters.size());
        log.info("Discovered {} concept cluster(s) from {} candidate pair(s)", clusters.size(), candidates.size());
        return clusters;
    }

    private ConceptCluster toCluster(ConceptGraph graph, String clusterId, List<String> members, Map<String, Double> scores) {
        double total = 0.0;
        int pairs = 0;
        String centroid = members.get(0);
        double bestMean = -1.0;
        for (String member : members) {
            double sum = 0.0;
            for (String other : members) {
                if (other.equals(member)) continue;
                double score = scores.getOrDefault(ConceptSimilarity.pairKey(member, other), 0.0);
                sum += score;
                total += score;
                pairs++;
            }
            double mean = sum / (members.size() - 1);
            if (mean > bestMean) {
                bestMean = mean;
                centroid = member;
            }
        }
        double cohesion = pairs == 0 ? 1.0 : total / pairs;

        Map<String, Integer> subjects = new LinkedHashMap<>();
        int difficultySum = 0;
        for (String member : members) {
            ConceptNode node = graph.getNode(member).orElseThrow();
            subjects.merge(node.domain(), 1, Integer::sum);
            difficultySum += node.difficulty().ordinal();
        }
        String primary = subjects.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse("");
        List<String> secondary = subjects.keySet().stream().filter(s -> !s.equals(primary)).toList();

        DifficultyLevel[] levels = DifficultyLevel.values();
        DifficultyLevel average = levels[Math.min(difficultySum / members.size(), levels.length - 1)];

        List<String> order = new ArrayList<>(members);
        Map<String, Integer> depth = new HashMap<>();
        for (String member : members) {
            depth.put(member, graph.getPrerequisites(member, true).size());
        }
        order.sort(Comparator.comparingInt(depth::get));

        return new ConceptCluster(clusterId, members, centroid, cohesion, primary, secondary, order, average);
    }

    private ConceptSimilarity similarity(ConceptGraph graph, ConceptNode a, ConceptNode b) {
        double tags = jaccard(a.tags(), b.tags());
        double keywords = jaccard(a.keywords(), b.keywords());
        double objectives = jaccard(a.learningObjectives(), b.learningObjectives());
        double structural = jaccard(new HashSet<>(graph.neighbors(a.id())), new HashSet<>(graph.neighbors(b.id())));
        double overall = tags * 0.30 + keywords * 0.30 + objectives * 0.25 + structural * 0.15;

        return new ConceptSimilarity(a.id(), b.id(), tags, keywords, objectives, structural, overall,
                shared(a.tags(), b.tags()), shared(a.keywords(), b.keywords()),
                shared(a.learningObjectives(), b.learningObjectives()));
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) return 0.0;
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        return intersection.size() / (double) union.size();
    }

    private List<String> shared(Set<String> a, Set<String> b) {
        return a.stream().filter(b::contains).sorted().toList();
    }
}
