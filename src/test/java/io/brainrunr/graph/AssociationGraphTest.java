package io.brainrunr.graph;

import io.brainrunr.memory.MemoryRecord;
import io.brainrunr.memory.ValidationException;
import io.brainrunr.testsupport.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssociationGraphTest {

    @TempDir
    Path tempDir;

    private EngineFixture engine;
    private AssociationGraph graph;
    private MemoryRecord a;
    private MemoryRecord b;
    private MemoryRecord c;

    @BeforeEach
    void setUp() {
        engine = EngineFixture.open(tempDir);
        graph = engine.graph;
        a = engine.remember("alpha");
        b = engine.remember("beta");
        c = engine.remember("gamma");
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void shouldKeepStrengthSymmetric() {
        graph.bump(a.id(), b.id(), 0.3);
        graph.bump(b.id(), a.id(), 0.3);

        assertEquals(0.6, graph.strength(a.id(), b.id()), 1e-9);
        assertEquals(graph.strength(a.id(), b.id()), graph.strength(b.id(), a.id()));
        assertEquals(1, graph.edgeCount());
    }

    @Test
    void shouldCapStrength() {
        graph.bump(a.id(), b.id(), 0.8);
        double capped = graph.bump(a.id(), b.id(), 0.8);

        assertEquals(1.0, capped, 1e-9);
        assertEquals(1.0, graph.strength(b.id(), a.id()), 1e-9);
    }

    @Test
    void shouldHonourExplicitCap() {
        assertEquals(0.25, graph.bump(a.id(), b.id(), 0.5, 0.25), 1e-9);
    }

    @Test
    void shouldIgnoreSelfEdgesAndZeroDelta() {
        assertEquals(0.0, graph.bump(a.id(), a.id(), 0.5));
        assertEquals(0.0, graph.bump(a.id(), b.id(), 0.0));
        assertEquals(0, graph.edgeCount());
        assertEquals(0.0, graph.strength(a.id(), a.id()));
    }

    @Test
    void shouldRejectNegativeDeltaOrCap() {
        assertThrows(ValidationException.class, () -> graph.bump(a.id(), b.id(), -0.1));
        assertThrows(ValidationException.class, () -> graph.bump(a.id(), b.id(), 0.1, -1.0));
    }

    @Test
    void shouldReturnZeroWithoutEdge() {
        assertEquals(0.0, graph.strength(a.id(), c.id()));
        assertTrue(graph.neighbors(a.id(), 5).isEmpty());
    }

    @Test
    void shouldListNeighborsStrongestFirst() {
        graph.bump(a.id(), b.id(), 0.2);
        graph.bump(c.id(), a.id(), 0.7);

        List<Neighbor> neighbors = graph.neighbors(a.id(), 5);
        assertEquals(List.of(c.id(), b.id()), neighbors.stream().map(Neighbor::id).toList());
        assertEquals(0.7, neighbors.get(0).strength(), 1e-9);

        assertEquals(1, graph.neighbors(a.id(), 1).size());
        assertEquals(List.of(a.id()), graph.neighbors(b.id(), 5).stream().map(Neighbor::id).toList());
    }
}
