package pass.isolation;

import org.junit.jupiter.api.Test;
import pass.cfg.ControlFlowGraph;
import qasm.ast.Identifier;
import translate.BranchInfo;
import translate.SymbolTable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ChainAnalysisTest {

    @Test
    void chain_stops_at_first_branching_block() {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.addEdge("a", "b");
        cfg.addEdge("b", "c");
        cfg.addEdge("c", "x");
        cfg.addEdge("c", "y");
        assertEquals(List.of("a", "b", "c"), ChainAnalysis.chain(cfg, "a"));
    }

    @Test
    void chain_includes_terminal_block() {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.addEdge("a", "end");
        assertEquals(List.of("a", "end"), ChainAnalysis.chain(cfg, "a"));
    }

    @Test
    void chain_around_a_cycle_is_null() {
        ControlFlowGraph cfg = new ControlFlowGraph();
        cfg.addEdge("a", "b");
        cfg.addEdge("b", "a");
        assertNull(ChainAnalysis.chain(cfg, "a"));
    }

    @Test
    void isolate_copies_shared_blocks_along_the_arm() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("head", List.of(), BranchInfo.conditional(new Identifier("c"), "s1", "other"));
        symbols.addBlock("other", List.of(), BranchInfo.unconditional("s1"));
        symbols.addBlock("s1", List.of(), BranchInfo.unconditional("s2"));
        symbols.addBlock("s2", List.of(), BranchInfo.terminal());

        assertTrue(ChainAnalysis.isolate(symbols, "head", List.of("s1", "s2")));

        ControlFlowGraph cfg = symbols.getCfg();
        assertEquals(List.of("other", "s1.dup0"), cfg.successors("head"));
        // 复制 s1 之后 s2 也有了两个前驱, 所以一并复制
        assertEquals(List.of("s2.dup1"), cfg.successors("s1.dup0"));
        assertEquals(List.of("other"), cfg.predecessors("s1"));
        assertEquals(List.of("s1"), cfg.predecessors("s2"));
        symbols.verifyBlockState();
    }

    @Test
    void isolate_leaves_private_arm_alone() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("head", List.of(), BranchInfo.unconditional("arm"));
        symbols.addBlock("arm", List.of(), BranchInfo.terminal());
        assertFalse(ChainAnalysis.isolate(symbols, "head", List.of("arm")));
        assertEquals(2, symbols.getCfg().nodeCount());
    }
}
