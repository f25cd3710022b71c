package com.spreadsheet.calc.dependency;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.models.CellAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private DependencyGraph graph;

    @BeforeEach
    void setUp() {
        graph = new DependencyGraph();
    }

    private static CellAddress a(String a1) {
        return CellAddress.fromA1(a1);
    }

    @Test
    void testForwardAndReverseEdges() {
        graph.setDependencies(a("C1"), List.of(a("A1"), a("B1")));
        assertEquals(Set.of(a("A1"), a("B1")), graph.getDependencies(a("C1")));
        assertEquals(Set.of(a("C1")), graph.getDependents(a("A1")));
        assertTrue(graph.isFormulaCell(a("C1")));
        assertFalse(graph.isFormulaCell(a("A1")));

        // replacing the formula drops the old edges
        graph.setDependencies(a("C1"), List.of(a("B1")));
        assertTrue(graph.getDependents(a("A1")).isEmpty());

        graph.removeDependencies(a("C1"));
        assertTrue(graph.getDependents(a("B1")).isEmpty());
        assertFalse(graph.isFormulaCell(a("C1")));
    }

    @Test
    void testSelfReferenceIsRejected() {
        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> graph.setDependencies(a("A1"), List.of(a("A1"))));
        assertEquals(List.of(a("A1"), a("A1")), ex.getCycle());
    }

    /**
     * A1 -> B1 -> C1, then C1 -> A1 would close the loop; the graph is left as it was.
     */
    @Test
    void testLongerCycleIsRejectedWithPath() {
        graph.setDependencies(a("A1"), List.of(a("B1")));
        graph.setDependencies(a("B1"), List.of(a("C1")));
        CircularReferenceException ex = assertThrows(CircularReferenceException.class,
                () -> graph.setDependencies(a("C1"), List.of(a("A1"))));
        assertEquals(List.of(a("C1"), a("A1"), a("B1"), a("C1")), ex.getCycle());
        assertTrue(graph.getDependencies(a("C1")).isEmpty());
        assertFalse(graph.isFormulaCell(a("C1")));
        assertEquals("Circular reference: C1 -> A1 -> B1 -> C1", ex.getMessage());
    }

    @Test
    void testTransitiveDependents() {
        graph.setDependencies(a("B1"), List.of(a("A1")));
        graph.setDependencies(a("C1"), List.of(a("B1")));
        graph.setDependencies(a("D1"), List.of(a("Z9")));
        assertEquals(Set.of(a("B1"), a("C1")), graph.getTransitiveDependents(List.of(a("A1"))));
    }

    /**
     * Dependencies come first; independent cells come out in row-major order.
     */
    @Test
    void testCalculationOrder() {
        graph.setDependencies(a("A1"), List.of(a("B2")));
        graph.setDependencies(a("B2"), List.of(a("C3")));
        graph.setDependencies(a("A2"), List.of(a("Z1")));
        graph.setDependencies(a("B1"), List.of(a("Z1")));
        assertEquals(List.of(a("B1"), a("A2"), a("B2"), a("A1")), graph.getCalculationOrder());
    }

    /**
     * Ordering a subset still respects links through cells outside it.
     */
    @Test
    void testTopologicalOrderThroughNonMembers() {
        graph.setDependencies(a("A1"), List.of(a("B1")));
        graph.setDependencies(a("B1"), List.of(a("C1")));
        assertEquals(List.of(a("C1"), a("A1")), graph.topologicalOrder(List.of(a("A1"), a("C1"))));
    }

    @Test
    void testLongChainDoesNotOverflow() {
        for (int row = 1; row < 20000; row++) {
            graph.setDependencies(CellAddress.of(0, row), List.of(CellAddress.of(0, row - 1)));
        }
        assertThrows(CircularReferenceException.class,
                () -> graph.setDependencies(CellAddress.of(0, 0), List.of(CellAddress.of(0, 19999))));
        assertEquals(19999, graph.getTransitiveDependents(List.of(CellAddress.of(0, 0))).size());
    }
}
