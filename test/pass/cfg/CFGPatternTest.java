package pass.cfg;

import org.junit.jupiter.api.Test;
import pass.cfg.pattern.IfThenElsePattern;
import pass.cfg.pattern.IfThenPattern;
import pass.cfg.pattern.SelfLoopPattern;
import pass.cfg.pattern.SequencePattern;
import pass.cfg.pattern.WhileLoopPattern;
import qasm.QasmPrinter;
import qasm.ast.Identifier;
import qasm.ast.IndexedIdentifier;
import qasm.ast.QuantumGate;
import qasm.ast.Statement;
import translate.BranchInfo;
import translate.SymbolTable;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CFGPatternTest {

    private static Statement gate(String name) {
        return QuantumGate.of(name, IndexedIdentifier.of("Qubits", 0));
    }

    private static String printBlock(SymbolTable symbols, String block) {
        StringBuilder sb = new StringBuilder();
        for (Statement s : symbols.getStatements(block)) {
            sb.append(QasmPrinter.getInstance().printStatement(s));
        }
        return sb.toString();
    }

    @Test
    void sequence_matches_first_pair_in_graph_order() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("a", List.of(gate("h")), BranchInfo.unconditional("b"));
        symbols.addBlock("b", List.of(gate("x")), BranchInfo.terminal());

        SequencePattern pattern = new SequencePattern();
        Map<String, String> match = pattern.match(symbols.getCfg());
        assertEquals(Map.of("A", "a", "B", "b"), match);

        pattern.apply(symbols, match);
        assertEquals(List.of("a"), symbols.getCfg().nodes());
        assertEquals("h Qubits[0];\nx Qubits[0];\n", printBlock(symbols, "a"));
    }

    @Test
    void sequence_allows_edge_back_to_first_block() {
        // b -> a 不在模板里, 合并后 a 变成自环
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("a", List.of(gate("h")), BranchInfo.unconditional("b"));
        symbols.addBlock("b", List.of(gate("x")), BranchInfo.unconditional("a"));

        SequencePattern pattern = new SequencePattern();
        Map<String, String> match = pattern.match(symbols.getCfg());
        assertEquals(Map.of("A", "a", "B", "b"), match);
        pattern.apply(symbols, match);

        assertEquals(List.of("a"), symbols.getCfg().nodes());
        assertTrue(symbols.getCfg().hasEdge("a", "a"));
        assertNull(new SelfLoopPattern().match(symbols.getCfg()));
    }

    @Test
    void sequence_rejects_block_with_self_edge() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("a", List.of(), BranchInfo.unconditional("b"));
        symbols.addBlock("b", List.of(), BranchInfo.conditional(new Identifier("c"), "b", "a"));
        assertNull(new SequencePattern().match(symbols.getCfg()));
    }

    @Test
    void if_then_allows_join_jumping_back_to_head() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("header", List.of(), BranchInfo.conditional(new Identifier("c0"), "body", "exit"));
        symbols.addBlock("body", List.of(gate("x")), BranchInfo.conditional(new Identifier("c1"), "then", "header"));
        symbols.addBlock("then", List.of(gate("y")), BranchInfo.unconditional("header"));
        symbols.addBlock("exit", List.of(), BranchInfo.terminal());

        IfThenPattern pattern = new IfThenPattern();
        Map<String, String> match = pattern.match(symbols.getCfg());
        assertEquals(Map.of("A", "body", "B", "then", "D", "header"), match);
        pattern.apply(symbols, match);

        assertEquals("""
            x Qubits[0];
            if (c1) {
              y Qubits[0];
            }
            """, printBlock(symbols, "body"));
        assertEquals(List.of("header"), symbols.getCfg().successors("body"));
    }

    @Test
    void sequence_rejects_join_point() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("a", List.of(), BranchInfo.unconditional("c"));
        symbols.addBlock("b", List.of(), BranchInfo.unconditional("c"));
        symbols.addBlock("c", List.of(), BranchInfo.terminal());
        assertNull(new SequencePattern().match(symbols.getCfg()));
    }

    @Test
    void diamond_with_cross_edge_is_not_if_else() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("a", List.of(), BranchInfo.conditional(new Identifier("c"), "b", "c"));
        symbols.addBlock("b", List.of(), BranchInfo.conditional(new Identifier("d"), "c", "d"));
        symbols.addBlock("c", List.of(), BranchInfo.unconditional("d"));
        symbols.addBlock("d", List.of(), BranchInfo.terminal());
        assertNull(new IfThenElsePattern().match(symbols.getCfg()));
    }

    @Test
    void if_then_puts_false_edge_arm_in_else_block() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("a", List.of(), BranchInfo.conditional(new Identifier("c"), "d", "b"));
        symbols.addBlock("b", List.of(gate("x")), BranchInfo.unconditional("d"));
        symbols.addBlock("d", List.of(), BranchInfo.terminal());

        IfThenPattern pattern = new IfThenPattern();
        Map<String, String> match = pattern.match(symbols.getCfg());
        assertEquals(Map.of("A", "a", "B", "b", "D", "d"), match);
        pattern.apply(symbols, match);

        assertEquals("""
            if (c) {
            } else {
              x Qubits[0];
            }
            """, printBlock(symbols, "a"));
        assertEquals(List.of("d"), symbols.getCfg().successors("a"));
    }

    @Test
    void while_loop_negates_condition_when_body_is_on_false_edge() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("test", List.of(gate("h")), BranchInfo.conditional(new Identifier("c"), "exit", "body"));
        symbols.addBlock("body", List.of(gate("x")), BranchInfo.unconditional("test"));
        symbols.addBlock("exit", List.of(), BranchInfo.terminal());

        WhileLoopPattern pattern = new WhileLoopPattern();
        Map<String, String> match = pattern.match(symbols.getCfg());
        assertEquals(Map.of("A", "test", "B", "body"), match);
        pattern.apply(symbols, match);

        assertEquals("""
            h Qubits[0];
            while (!c) {
              x Qubits[0];
              h Qubits[0];
            }
            """, printBlock(symbols, "test"));
        assertEquals(List.of("exit"), symbols.getCfg().successors("test"));
    }

    @Test
    void self_loop_needs_an_exit() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("spin", List.of(gate("h")), BranchInfo.unconditional("spin"));
        assertNull(new SelfLoopPattern().match(symbols.getCfg()));
    }

    @Test
    void self_loop_keeps_condition_when_looping_on_true_edge() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("retry", List.of(gate("h")), BranchInfo.conditional(new Identifier("c"), "retry", "done"));
        symbols.addBlock("done", List.of(), BranchInfo.terminal());

        SelfLoopPattern pattern = new SelfLoopPattern();
        pattern.apply(symbols, pattern.match(symbols.getCfg()));

        assertEquals("""
            h Qubits[0];
            while (c) {
              h Qubits[0];
            }
            """, printBlock(symbols, "retry"));
        assertFalse(symbols.getCfg().hasEdge("retry", "retry"));
    }

    @Test
    void template_edges_must_name_roles() {
        assertThrows(IllegalArgumentException.class, () -> new CFGPattern("broken", List.of("A"), "A->B") {
            @Override
            protected boolean accepts(ControlFlowGraph cfg, Map<String, String> match) {
                return true;
            }

            @Override
            public void apply(SymbolTable symbols, Map<String, String> match) {
            }
        });
    }
}
