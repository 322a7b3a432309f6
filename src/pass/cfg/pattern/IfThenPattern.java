package pass.cfg.pattern;

import java.util.List;
import java.util.Map;

import pass.cfg.CFGPattern;
import pass.cfg.ControlFlowGraph;
import qasm.ast.BranchingStatement;
import qasm.ast.Statement;
import translate.BranchInfo;
import translate.SymbolTable;

/**
 * Triangle {@code A -> B -> D, A -> D}. When the true edge goes straight
 * to D the arm lands in the else block, {@code if (c) {} else { B }}.
 */
public class IfThenPattern extends CFGPattern {

    public IfThenPattern() {
        super("if-then", List.of("A", "B", "D"), "A->B", "A->D", "B->D");
    }

    @Override
    protected boolean accepts(ControlFlowGraph cfg, Map<String, String> m) {
        String b = m.get("B");
        return cfg.outDegree(m.get("A")) == 2 && cfg.inDegree(b) == 1 && cfg.outDegree(b) == 1;
    }

    @Override
    public void apply(SymbolTable symbols, Map<String, String> m) {
        String a = m.get("A");
        String b = m.get("B");
        BranchInfo branch = symbols.getBranch(a);
        List<Statement> arm = symbols.getStatements(b);

        BranchingStatement stmt = branch.trueTarget().equals(b)
            ? new BranchingStatement(branch.condition(), arm, List.of())
            : new BranchingStatement(branch.condition(), List.of(), arm);
        symbols.rewriteBlock(a, List.of(stmt), BranchInfo.unconditional(m.get("D")), List.of(b));
    }
}
