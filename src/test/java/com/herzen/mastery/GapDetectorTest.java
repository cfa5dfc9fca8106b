package com.herzen.mastery;

import com.herzen.mastery.domain.DomainModels.DifficultyLevel;
import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipTypes;
import com.herzen.mastery.reasoning.GapDetector;
import com.herzen.mastery.reasoning.ReasoningModels.GapSeverity;
import com.herzen.mastery.reasoning.ReasoningModels.GapType;
import com.herzen.mastery.reasoning.ReasoningModels.KnowledgeGap;
import com.herzen.mastery.reasoning.ReasoningModels.MissingConcept;
import com.herzen.mastery.reasoning.ReasoningStatistics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Set;

import static com.herzen.mastery.TestFixtures.edge;
import static com.herzen.mastery.TestFixtures.graph;
import static com.herzen.mastery.TestFixtures.node;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class GapDetectorTest {
    @Autowired
    private GapDetector gapDetector;

    @Autowired
    private ReasoningStatistics statistics;

    @Test
    void twoMissingPrerequisitesAreMajor() {
        ConceptGraph graph = graph("p1", "p2", "t");
        edge(graph, "p1", "t", RelationshipTypes.PREREQUISITE);
        edge(graph, "p2", "t", RelationshipTypes.PREREQUISITE);

        List<KnowledgeGap> gaps = gapDetector.detectKnowledgeGaps(graph, Set.of(), Set.of("t"));

        assertEquals(1, gaps.size());
        KnowledgeGap gap = gaps.get(0);
        assertEquals("t", gap.targetConceptId());
        assertEquals(GapType.MISSING_PREREQUISITE, gap.gapType());
        assertEquals(GapSeverity.MAJOR, gap.severity());
        assertEquals(List.of("p1", "p2"), gap.missingConcepts().stream().map(MissingConcept::conceptId).toList());
        assertTrue(gap.blockedConcepts().isEmpty());
    }

    @Test
    void threeMissingPrerequisitesAreCriticalWithSummedEffortAndFoundationalOrder() {
        ConceptGraph graph = new ConceptGraph();
        graph.addNode(node("q", "math", DifficultyLevel.BEGINNER, Set.of()));
        graph.addNode(node("p1", "math", DifficultyLevel.BEGINNER, Set.of()));
        graph.addNode(node("p2", "math", DifficultyLevel.ADVANCED, Set.of()));
        graph.addNode(node("p3", "math", DifficultyLevel.EXPERT, Set.of()));
        graph.addNode(node("t", "math", DifficultyLevel.EXPERT, Set.of()));
        edge(graph, "q", "p2", RelationshipTypes.PREREQUISITE);
        edge(graph, "p2", "t", RelationshipTypes.PREREQUISITE);
        edge(graph, "p3", "t", RelationshipTypes.PREREQUISITE);
        edge(graph, "p1", "t", RelationshipTypes.PREREQUISITE);

        List<KnowledgeGap> gaps = gapDetector.detectKnowledgeGaps(graph, Set.of("q"), Set.of("t"));

        assertEquals(1, gaps.size());
        KnowledgeGap gap = gaps.get(0);
        assertEquals(GapSeverity.CRITICAL, gap.severity());
        assertEquals(0.5 + 4.0 + 8.0, gap.estimatedEffortHours(), 1e-9);
        assertEquals(List.of("p1", "p3", "p2"), gap.remediationOrder());
    }

    @Test
    void singleMissingPrerequisiteBlockingThreeConceptsIsMajor() {
        ConceptGraph graph = graph("m", "t", "x", "y", "z");
        for (String dependent : List.of("t", "x", "y", "z")) {
            edge(graph, "m", dependent, RelationshipTypes.PREREQUISITE);
        }

        List<KnowledgeGap> gaps = gapDetector.detectKnowledgeGaps(graph, Set.of(), Set.of("t", "x", "y", "z"));

        KnowledgeGap forT = gaps.stream().filter(g -> g.targetConceptId().equals("t")).findFirst().orElseThrow();
        assertEquals(GapSeverity.MAJOR, forT.severity());
        assertEquals(List.of("x", "y", "z"), forT.blockedConcepts());
        assertFalse(forT.blockedConcepts().contains("t"));
    }

    @Test
    void singleMissingPrerequisiteIsOnlyReportedWhenMinorGapsRequested() {
        ConceptGraph graph = graph("m", "t");
        edge(graph, "m", "t", RelationshipTypes.PREREQUISITE);

        assertTrue(gapDetector.detectKnowledgeGaps(graph, Set.of(), Set.of("t")).isEmpty());

        List<KnowledgeGap> withMinor = gapDetector.detectKnowledgeGaps(graph, Set.of(), Set.of("t"), true);
        assertEquals(1, withMinor.size());
        assertEquals(GapSeverity.MINOR, withMinor.get(0).severity());
    }

    @Test
    void completedConceptsAreNeitherTargetsNorMissing() {
        ConceptGraph graph = graph("p1", "p2", "t");
        edge(graph, "p1", "t", RelationshipTypes.PREREQUISITE);
        edge(graph, "p2", "t", RelationshipTypes.PREREQUISITE);

        assertTrue(gapDetector.detectKnowledgeGaps(graph, Set.of("p1", "p2"), Set.of("t")).isEmpty());
        assertTrue(gapDetector.detectKnowledgeGaps(graph, Set.of("t"), Set.of("t")).isEmpty());
    }

    @Test
    void unreachableConceptIsReportedAsDisconnectedWithConnectors() {
        ConceptGraph graph = new ConceptGraph();
        graph.addNode(node("done", "math", DifficultyLevel.BEGINNER, Set.of()));
        graph.addNode(node("n1", "math", DifficultyLevel.BEGINNER, Set.of("algebra")));
        graph.addNode(node("n2", "physics", DifficultyLevel.BEGINNER, Set.of("algebra")));
        graph.addNode(node("d", "math", DifficultyLevel.ELEMENTARY, Set.of("algebra", "symbols")));
        edge(graph, "done", "n1", RelationshipTypes.PREREQUISITE);
        long before = statistics.snapshot().gapsDetected();

        List<KnowledgeGap> gaps = gapDetector.detectKnowledgeGaps(graph, Set.of("done"), Set.of("d", "n1"));

        assertEquals(1, gaps.size());
        KnowledgeGap gap = gaps.get(0);
        assertEquals("d", gap.targetConceptId());
        assertEquals(GapType.DISCONNECTED, gap.gapType());
        assertEquals(GapSeverity.MAJOR, gap.severity());
        assertEquals(List.of("n1"), gap.suggestedConnectors());
        assertTrue(gap.missingConcepts().isEmpty());
        assertTrue(statistics.snapshot().gapsDetected() >= before + 1);
    }
}
