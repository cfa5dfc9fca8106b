package com.herzen.mastery;

import com.herzen.mastery.graph.ConceptGraph;
import com.herzen.mastery.graph.KnowledgeGraphModels.Relationship;
import com.herzen.mastery.graph.KnowledgeGraphModels.RelationshipTypes;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.herzen.mastery.TestFixtures.edge;
import static com.herzen.mastery.TestFixtures.graph;
import static org.junit.jupiter.api.Assertions.*;

class ConceptGraphTest {

    @Test
    void storesOneEdgePerSourceTargetAndType() {
        ConceptGraph graph = graph("a", "b");

        assertTrue(graph.addEdge(Relationship.explicit("a", "b", RelationshipTypes.PREREQUISITE, 1.0)));
        assertFalse(graph.addEdge(Relationship.explicit("a", "b", RelationshipTypes.PREREQUISITE, 0.5)));
        assertTrue(graph.addEdge(Relationship.explicit("a", "b", RelationshipTypes.RELATED_TO, 1.0)));

        assertEquals(2, graph.edgeCount());
        assertEquals(List.of("b"), graph.neighbors("a"));
        assertTrue(graph.hasEdge("a", "b"));
        assertFalse(graph.hasEdge("b", "a"));
    }

    @Test
    void rejectsEdgeToUnknownConcept() {
        ConceptGraph graph = graph("a");
        assertThrows(IllegalArgumentException.class,
                () -> graph.addEdge(Relationship.explicit("a", "missing", RelationshipTypes.PREREQUISITE, 1.0)));
        assertTrue(graph.getNode("missing").isEmpty());
    }

    @Test
    void pathEnumerationTerminatesOnCyclesAndRespectsHopBound() {
        ConceptGraph graph = graph("a", "b", "c", "d");
        edge(graph, "a", "b", RelationshipTypes.PREREQUISITE);
        edge(graph, "b", "c", RelationshipTypes.PREREQUISITE);
        edge(graph, "c", "a", RelationshipTypes.PREREQUISITE);
        edge(graph, "c", "d", RelationshipTypes.PREREQUISITE);

        List<List<String>> all = graph.findAllPaths("a", 10, null);
        assertEquals(Set.of(List.of("a", "b"), List.of("a", "b", "c"), List.of("a", "b", "c", "d")), Set.copyOf(all));
        all.forEach(p -> assertEquals(p.size(), Set.copyOf(p).size()));

        List<List<String>> bounded = graph.findAllPaths("a", 2, null);
        assertTrue(bounded.stream().allMatch(p -> p.size() - 1 <= 2));
        assertEquals(2, bounded.size());
    }

    @Test
    void pathEnumerationFollowsOnlyAcceptedEdges() {
        ConceptGraph graph = graph("a", "b", "c");
        edge(graph, "a", "b", RelationshipTypes.PREREQUISITE);
        edge(graph, "b", "c", RelationshipTypes.RELATED_TO);

        List<List<String>> paths = graph.findAllPaths("a", 5, e -> RelationshipTypes.PREREQUISITE.equals(e.type()));
        assertEquals(List.of(List.of("a", "b")), paths);
    }

    @Test
    void answersReachabilityAndAncestorQueries() {
        ConceptGraph graph = graph("a", "b", "c", "x");
        edge(graph, "a", "b", RelationshipTypes.PREREQUISITE);
        edge(graph, "b", "c", RelationshipTypes.PREREQUISITE);
        edge(graph, "x", "c", RelationshipTypes.PREREQUISITE);

        assertTrue(graph.hasPath("a", "c"));
        assertFalse(graph.hasPath("c", "a"));
        assertTrue(graph.hasPath("x", "x"));

        assertEquals(Set.of("b", "x"), Set.copyOf(graph.getPrerequisites("c", false)));
        assertEquals(Set.of("a", "b", "x"), Set.copyOf(graph.getPrerequisites("c", true)));
        assertEquals(List.of("b"), graph.getPostrequisites("a"));
        assertEquals(Set.of("b", "c"), Set.copyOf(graph.getPostrequisites("a", true)));
    }
}
