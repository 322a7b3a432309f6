package pass;

import exception.CompileException;
import exception.CompileException.Kind;
import org.junit.jupiter.api.Test;
import qasm.QasmPrinter;
import qasm.ast.Identifier;
import qasm.ast.IndexedIdentifier;
import qasm.ast.QuantumGate;
import qasm.ast.Statement;
import translate.BranchInfo;
import translate.SymbolTable;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PassManagerTest {

    private static Statement gate(String name) {
        return QuantumGate.of(name, IndexedIdentifier.of("Qubits", 0));
    }

    private static BranchInfo cond(String c, String ifTrue, String ifFalse) {
        return BranchInfo.conditional(new Identifier(c), ifTrue, ifFalse);
    }

    private static BranchInfo jump(String target) {
        return BranchInfo.unconditional(target);
    }

    private static BranchInfo ret() {
        return BranchInfo.terminal();
    }

    private static String structure(SymbolTable symbols) {
        List<String> left = PassManager.getInstance().run(symbols);
        assertEquals(1, left.size());
        StringBuilder sb = new StringBuilder();
        for (Statement stmt : symbols.getStatements(left.get(0))) {
            sb.append(QasmPrinter.getInstance().printStatement(stmt));
        }
        return sb.toString();
    }

    @Test
    void default_pipeline_isolates_before_structuring() {
        assertEquals(List.of(StructuringPassType.IfIsolation,
                             StructuringPassType.WhileIsolation,
                             StructuringPassType.Sequence,
                             StructuringPassType.IfStructuring,
                             StructuringPassType.WhileStructuring),
                     PassManager.getInstance().getPipeline());
    }

    @Test
    void single_block_is_already_structured() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(gate("h")), ret());
        assertEquals("h Qubits[0];\n", structure(symbols));
    }

    @Test
    void straight_line_chain_collapses() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(gate("h")), jump("b"));
        symbols.addBlock("b", List.of(gate("x")), jump("c"));
        symbols.addBlock("c", List.of(gate("z")), ret());
        assertEquals("h Qubits[0];\nx Qubits[0];\nz Qubits[0];\n", structure(symbols));
    }

    @Test
    void empty_then_arm_still_prints_else() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(), cond("c", "then", "else"));
        symbols.addBlock("then", List.of(), jump("end"));
        symbols.addBlock("else", List.of(gate("x")), jump("end"));
        symbols.addBlock("end", List.of(), ret());
        assertEquals("""
            if (c) {
            } else {
              x Qubits[0];
            }
            """, structure(symbols));
    }

    @Test
    void diamond_followed_by_loop() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(gate("h")), cond("c0", "left", "right"));
        symbols.addBlock("left", List.of(gate("x")), jump("join"));
        symbols.addBlock("right", List.of(gate("y")), jump("join"));
        symbols.addBlock("join", List.of(gate("s")), cond("c1", "body", "exit"));
        symbols.addBlock("body", List.of(gate("t")), jump("join"));
        symbols.addBlock("exit", List.of(gate("z")), ret());
        assertEquals("""
            h Qubits[0];
            if (c0) {
              x Qubits[0];
            } else {
              y Qubits[0];
            }
            s Qubits[0];
            while (c1) {
              t Qubits[0];
              s Qubits[0];
            }
            z Qubits[0];
            """, structure(symbols));
    }

    @Test
    void loop_exiting_on_true_edge_negates_condition() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(), jump("test"));
        symbols.addBlock("test", List.of(gate("h")), cond("done", "exit", "body"));
        symbols.addBlock("body", List.of(gate("x")), jump("test"));
        symbols.addBlock("exit", List.of(), ret());
        assertEquals("""
            h Qubits[0];
            while (!done) {
              x Qubits[0];
              h Qubits[0];
            }
            """, structure(symbols));
    }

    @Test
    void nested_loops() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(), jump("outer"));
        symbols.addBlock("outer", List.of(), cond("c0", "inner", "exit"));
        symbols.addBlock("inner", List.of(gate("x")), cond("c1", "inner", "latch"));
        symbols.addBlock("latch", List.of(gate("z")), jump("outer"));
        symbols.addBlock("exit", List.of(), ret());
        assertEquals("""
            while (c0) {
              x Qubits[0];
              while (c1) {
                x Qubits[0];
              }
              z Qubits[0];
            }
            """, structure(symbols));
    }

    @Test
    void loop_entered_in_the_middle_is_peeled() {
        // entry 可以直接跳进循环体, 循环体被复制一份作为 if 分支
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(), cond("c0", "body", "header"));
        symbols.addBlock("header", List.of(gate("h")), cond("c1", "body", "exit"));
        symbols.addBlock("body", List.of(gate("x")), jump("header"));
        symbols.addBlock("exit", List.of(gate("z")), ret());
        assertEquals("""
            if (c0) {
              x Qubits[0];
            }
            h Qubits[0];
            while (c1) {
              x Qubits[0];
              h Qubits[0];
            }
            z Qubits[0];
            """, structure(symbols));
    }

    @Test
    void shared_arm_chain_is_duplicated_block_by_block() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(), cond("c0", "check", "fail1"));
        symbols.addBlock("check", List.of(), cond("c1", "ok", "fail1"));
        symbols.addBlock("ok", List.of(gate("x")), jump("end"));
        symbols.addBlock("fail1", List.of(gate("y")), jump("fail2"));
        symbols.addBlock("fail2", List.of(gate("z")), jump("end"));
        symbols.addBlock("end", List.of(), ret());
        assertEquals("""
            if (c0) {
              if (c1) {
                x Qubits[0];
              } else {
                y Qubits[0];
                z Qubits[0];
              }
            } else {
              y Qubits[0];
              z Qubits[0];
            }
            """, structure(symbols));
    }

    @Test
    void if_inside_loop_merging_at_header() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(gate("h")), jump("header"));
        symbols.addBlock("header", List.of(gate("s")), cond("c0", "body", "exit"));
        symbols.addBlock("body", List.of(gate("x")), cond("c1", "then", "header"));
        symbols.addBlock("then", List.of(gate("y")), jump("header"));
        symbols.addBlock("exit", List.of(gate("z")), ret());
        assertEquals("""
            h Qubits[0];
            s Qubits[0];
            while (c0) {
              x Qubits[0];
              if (c1) {
                y Qubits[0];
              }
              s Qubits[0];
            }
            z Qubits[0];
            """, structure(symbols));
    }

    @Test
    void bottom_tested_loop_with_if_else() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(gate("h")), jump("a"));
        symbols.addBlock("a", List.of(gate("s")), cond("c0", "b", "c"));
        symbols.addBlock("b", List.of(gate("x")), jump("d"));
        symbols.addBlock("c", List.of(gate("y")), jump("d"));
        symbols.addBlock("d", List.of(gate("t")), cond("c1", "a", "exit"));
        symbols.addBlock("exit", List.of(gate("z")), ret());
        assertEquals("""
            h Qubits[0];
            s Qubits[0];
            if (c0) {
              x Qubits[0];
            } else {
              y Qubits[0];
            }
            t Qubits[0];
            while (c1) {
              s Qubits[0];
              if (c0) {
                x Qubits[0];
              } else {
                y Qubits[0];
              }
              t Qubits[0];
            }
            z Qubits[0];
            """, structure(symbols));
    }

    @Test
    void irreducible_graph_does_not_converge() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(), cond("c0", "a", "b"));
        symbols.addBlock("a", List.of(gate("x")), cond("c1", "b", "exit"));
        symbols.addBlock("b", List.of(gate("y")), cond("c2", "a", "exit"));
        symbols.addBlock("exit", List.of(), ret());
        var e = assertThrows(CompileException.class, () -> PassManager.getInstance().run(symbols));
        assertEquals(Kind.STRUCTURING_DID_NOT_CONVERGE, e.getKind());
    }

    @Test
    void unreachable_block_does_not_converge() {
        SymbolTable symbols = new SymbolTable();
        symbols.addBlock("entry", List.of(), ret());
        symbols.addBlock("dead", List.of(gate("x")), ret());
        var e = assertThrows(CompileException.class, () -> PassManager.getInstance().run(symbols));
        assertEquals(Kind.STRUCTURING_DID_NOT_CONVERGE, e.getKind());
    }
}
