package com.herzen.mastery;

import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipTypes;
import com.herzen.mastery.mastery.ConceptMastery;
import com.herzen.mastery.mastery.MasteryInsightService;
import com.herzen.mastery.mastery.MasteryModels.MasteryLevel;
import com.herzen.mastery.mastery.MasteryModels.MasteryMetrics;
import com.herzen.mastery.mastery.MasteryModels.PathAdjustment;
import com.herzen.mastery.mastery.MasteryTracker;
import com.herzen.mastery.reasoning.ReasoningModels.GapType;
import com.herzen.mastery.reasoning.ReasoningModels.KnowledgeGap;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static com.herzen.mastery.TestFixtures.NOW;
import static com.herzen.mastery.TestFixtures.edge;
import static com.herzen.mastery.TestFixtures.graph;
import static com.herzen.mastery.TestFixtures.state;
import static com.herzen.mastery.TestFixtures.unique;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class MasteryInsightServiceTest {
    @Autowired
    private MasteryInsightService insightService;

    @Autowired
    private MasteryTracker tracker;

    @Test
    void weakConceptsAreStuckOrRecentlyStruggling() {
        String learner = unique("learner");
        tracker.importRecords(List.of(
                state(learner, "w1", 0.1, 2.0, 5, 30, 5),
                state(learner, "w2", 0.2, 2.0, 1, 2, 3),
                state(learner, "w3", 0.35, 2.0, 1, 20, 5),
                state(learner, "w4", 0.1, 2.0, 5, 3, -1),
                state(learner, "w5", 0.6, 2.0, 5, 1, 5)));

        List<ConceptMastery> weak = insightService.detectWeakConcepts(learner, 0.4, 7, NOW);

        assertEquals(List.of("w1", "w2"), weak.stream().map(ConceptMastery::getConceptId).toList());
    }

    @Test
    void readyAndRemedialConceptsFollowPrerequisites() {
        String learner = unique("learner");
        ConceptGraph graph = graph("a", "b", "c");
        edge(graph, "a", "b", RelationshipTypes.PREREQUISITE);
        edge(graph, "b", "c", RelationshipTypes.PREREQUISITE);
        tracker.importRecords(List.of(state(learner, "a", 0.8, 10.0, 4, 1, 5)));

        assertEquals(List.of("b"), insightService.getReadyConcepts(learner, graph));
        assertEquals(List.of("b"), insightService.getRemedialConcepts(learner, "c", graph));
        assertEquals(List.of("a"), insightService.getReadyConcepts(unique("newcomer"), graph));
    }

    @Test
    void pathAdjustmentSplitsUnknownAndDueConcepts() {
        String learner = unique("learner");
        tracker.importRecords(List.of(
                state(learner, "due", 0.9, 10.0, 6, 12, -2),
                state(learner, "fresh", 0.9, 10.0, 6, 1, 9),
                state(learner, "shaky", 0.4, 10.0, 6, 1, 9)));

        PathAdjustment adjustment = insightService.adjustPathForMastery(learner, List.of("due", "fresh", "shaky", "new"), NOW);

        assertEquals(List.of("shaky", "new"), adjustment.toLearn());
        assertEquals(List.of("due"), adjustment.toReview());
    }

    @Test
    void learnerGapsUseKnownConceptsAsCompleted() {
        String learner = unique("learner");
        ConceptGraph graph = graph("p1", "p2", "t");
        edge(graph, "p1", "t", RelationshipTypes.PREREQUISITE);
        edge(graph, "p2", "t", RelationshipTypes.PREREQUISITE);

        List<KnowledgeGap> gaps = insightService.detectLearnerGaps(learner, graph);
        assertTrue(gaps.stream().anyMatch(g -> g.targetConceptId().equals("t") && g.gapType() == GapType.MISSING_PREREQUISITE));

        tracker.importRecords(List.of(
                state(learner, "p1", 0.9, 10.0, 5, 1, 5),
                state(learner, "p2", 0.9, 10.0, 5, 1, 5)));
        assertTrue(insightService.detectLearnerGaps(learner, graph).stream()
                .noneMatch(g -> g.gapType() == GapType.MISSING_PREREQUISITE));
    }

    @Test
    void metricsSummariseRecordsByDomain() {
        String learner = unique("learner");
        tracker.importRecords(List.of(
                state(learner, "algebra", 0.8, 10.0, 5, 1, 5),
                state(learner, "optics", 0.2, 2.0, 4, 3, -1)));

        MasteryMetrics metrics = insightService.calculateMetrics(learner, Map.of("algebra", "math", "optics", "physics"), NOW);

        assertEquals(0.5, metrics.masteryAverage(), 1e-9);
        assertEquals(6.0, metrics.stabilityAverage(), 1e-9);
        assertEquals(2, metrics.conceptsStarted());
        assertEquals(1, metrics.conceptsMastered());
        assertEquals(1, metrics.conceptsInProgress());
        assertEquals(1, metrics.conceptsDueForReview());
        assertEquals(List.of("optics"), metrics.strugglingConcepts());
        assertEquals("physics", metrics.weakestDomain());
        assertEquals("math", metrics.strongestDomain());
        assertEquals(0.5, metrics.progress(), 1e-9);
        assertEquals(1, metrics.distribution().get(MasteryLevel.PROFICIENT).intValue());
        assertEquals(1, metrics.distribution().get(MasteryLevel.NOVICE).intValue());
    }

    @Test
    void metricsOfLearnerWithoutRecordsAreEmpty() {
        MasteryMetrics metrics = insightService.calculateMetrics(unique("nobody"), Map.of(), NOW);

        assertEquals(0, metrics.conceptsStarted());
        assertEquals(1.0, metrics.stabilityAverage());
        assertEquals(0.0, metrics.progress());
        assertNull(metrics.weakestDomain());
        assertTrue(metrics.distribution().values().stream().allMatch(count -> count == 0));
    }
}
