package pass.cfg;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowGraphTest {

    private static ControlFlowGraph diamond() {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.addEdge("a", "b");
        cfg.addEdge("a", "c");
        cfg.addEdge("b", "d");
        cfg.addEdge("c", "d");
        return cfg;
    }

    @Test
    void nodes_keep_insertion_order() {
        assertEquals(List.of("a", "b", "c", "d"), diamond().nodes());
    }

    @Test
    void degrees_and_neighbours() {
        ControlFlowGraph cfg = diamond();
        assertEquals(2, cfg.outDegree("a"));
        assertEquals(2, cfg.inDegree("d"));
        assertEquals(List.of("b", "c"), cfg.predecessors("d"));
        assertEquals(4, cfg.edgeCount());
    }

    @Test
    void parallel_edges_collapse() {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.addEdge("a", "b");
        cfg.addEdge("a", "b");
        assertEquals(1, cfg.edgeCount());
        assertEquals(1, cfg.inDegree("b"));
    }

    @Test
    void self_edge_counts_both_ways() {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.addEdge("loop", "loop");
        assertTrue(cfg.hasEdge("loop", "loop"));
        assertEquals(1, cfg.inDegree("loop"));
        assertEquals(1, cfg.outDegree("loop"));
    }

    @Test
    void remove_node_drops_incident_edges() {
        ControlFlowGraph cfg = diamond();
        cfg.removeNode("b");
        assertFalse(cfg.containsNode("b"));
        assertEquals(List.of("c"), cfg.successors("a"));
        assertEquals(List.of("c"), cfg.predecessors("d"));
        assertEquals(2, cfg.edgeCount());
    }

    @Test
    void set_successors_replaces_out_edges() {
        ControlFlowGraph cfg = diamond();
        cfg.setSuccessors("a", List.of("d"));
        assertEquals(List.of("d"), cfg.successors("a"));
        assertEquals(0, cfg.inDegree("b"));
        assertEquals(List.of("b", "c", "a"), cfg.predecessors("d"));
    }

    @Test
    void unknown_node_is_rejected() {
        ControlFlowGraph cfg = diamond();
        assertThrows(IllegalArgumentException.class, () -> cfg.successors("nope"));
        assertThrows(IllegalArgumentException.class, () -> cfg.predecessors("nope"));
    }
}
