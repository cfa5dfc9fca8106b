package com.herzen.mastery.reasoning;

import com.herzen.mastery.config.ReasoningProperties;
import com.herzen.mastery.domain.DomainModels.ConceptNode;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.reasoning.ReasoningModels.GapSeverity;
import com.herzen.mastery.reasoning.ReasoningModels.GapType;
import com.herzen.mastery.reasoning.ReasoningModels.KnowledgeGap;
import com.herzen.mastery.reasoning.ReasoningModels.MissingConcept;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class GapDetector {
    private static final Logger log = LoggerFactory.getLogger(GapDetector.class);

    private final ReasoningProperties properties;
    private final ReasoningStatistics statistics;

    public GapDetector(ReasoningProperties properties, ReasoningStatistics statistics) {
        this.properties = properties;
        this.statistics = statistics;
    }

    public List<KnowledgeGap> detectKnowledgeGaps(ConceptGraph graph, Set<String> completed, Set<String> targets) {
        return detectKnowledgeGaps(graph, completed, targets, properties.getGaps().isIncludeMinor());
    }

    /**
     * Missing-prerequisite gaps come first, in graph node order, followed by disconnected concepts.
     *
     * @param targets concepts to check; null means every concept of the graph
     */
    public List<KnowledgeGap> detectKnowledgeGaps(ConceptGraph graph,
                                                  Set<String> completed,
                                                  Set<String> targets,
                                                  boolean includeMinor) {
        Set<String> done = completed == null ? Set.of() : completed;
        Set<String> targetSet = targets == null ? new HashSet<>(graph.nodeIds()) : targets;
        List<String> incomplete = graph.nodeIds().stream()
                .filter(targetSet::contains)
                .filter(id -> !done.contains(id))
                .toList();

        List<KnowledgeGap> gaps = new ArrayList<>();
        for (String targetId : incomplete) {
            List<String> missing = graph.getPrerequisites(targetId, false).stream()
                    .filter(p -> !done.contains(p))
                    .toList();
            if (missing.isEmpty()) continue;

            Set<String> blocked = new LinkedHashSet<>();
            for (String prerequisite : missing) {
                for (String dependent : graph.getPostrequisites(prerequisite)) {
                    if (!dependent.equals(targetId) && !done.contains(dependent) && targetSet.contains(dependent)) {
                        blocked.add(dependent);
                    }
                }
            }

            Optional<GapSeverity> severity = severity(missing.size(), blocked.size(), includeMinor);
            if (severity.isEmpty()) continue;

            List<MissingConcept> missingConcepts = missing.stream()
                    .map(id -> graph.getNode(id).orElseThrow())
                    .map(n -> new MissingConcept(n.id(), n.name(), n.difficulty()))
                    .toList();
            gaps.add(new KnowledgeGap(targetId, GapType.MISSING_PREREQUISITE, severity.get(), missingConcepts,
                    List.copyOf(blocked), remediationOrder(graph, missing), estimateEffort(missingConcepts), List.of()));
        }

        for (String conceptId : incomplete) {
            if (!isDisconnected(graph, conceptId, done)) continue;
            gaps.add(new KnowledgeGap(conceptId, GapType.DISCONNECTED,
                    includeMinor ? GapSeverity.MINOR : GapSeverity.MAJOR,
                    List.of(), List.of(), List.of(), 0.0, suggestConnectors(graph, conceptId)));
        }

        statistics.recordGaps(gaps.size());
        log.debug("Detected {} knowledge gap(s) across {} incomplete target(s)", gaps.size(), incomplete.size());
        return gaps;
    }

    /**
     * missing >= 3: CRITICAL; missing == 2: MAJOR; a single missing prerequisite is MAJOR when it blocks
     * three or more concepts, MINOR when minor gaps are requested, and not reported otherwise.
     */
    static Optional<GapSeverity> severity(int missingCount, int blockedCount, boolean includeMinor) {
        if (missingCount >= 3) return Optional.of(GapSeverity.CRITICAL);
        if (missingCount == 2) return Optional.of(GapSeverity.MAJOR);
        if (missingCount == 1) {
            if (blockedCount >= 3) return Optional.of(GapSeverity.MAJOR);
            if (includeMinor) return Optional.of(GapSeverity.MINOR);
        }
        return Optional.empty();
    }

    private boolean isDisconnected(ConceptGraph graph, String conceptId, Set<String> completed) {
        for (String done : completed) {
            if (graph.hasNode(done) && graph.hasPath(done, conceptId)) return false;
        }
        return completed.containsAll(graph.getPrerequisites(conceptId, false));
    }

    private List<String> suggestConnectors(ConceptGraph graph, String conceptId) {
        ConceptNode concept = graph.getNode(conceptId).orElseThrow();
        return graph.nodes().stream()
                .filter(n -> !n.id().equals(conceptId))
                .filter(n -> n.subjectId().equals(concept.subjectId()))
                .filter(n -> n.tags().stream().anyMatch(concept.tags()::contains))
                .map(ConceptNode::id)
                .limit(properties.getGaps().getMaxConnectorSuggestions())
                .toList();
    }

    // foundational concepts first: fewest ancestors, then easiest
    private List<String> remediationOrder(ConceptGraph graph, List<String> missing) {
        Map<String, Integer> depth = new HashMap<>();
        for (String id : missing) {
            depth.put(id, graph.getPrerequisites(id, true).size());
        }
        return missing.stream()
                .sorted(Comparator.<String>comparingInt(depth::get)
                        .thenComparing(id -> graph.getNode(id).orElseThrow().difficulty())
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    private double estimateEffort(List<MissingConcept> missing) {
        return missing.stream().mapToDouble(m -> m.difficulty().remediationHours()).sum();
    }
}
