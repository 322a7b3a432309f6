package pass.cfg.pattern;

import java.util.List;
import java.util.Map;

import pass.cfg.CFGPattern;
import pass.cfg.ControlFlowGraph;
import qasm.ast.BranchingStatement;
import translate.BranchInfo;
import translate.SymbolTable;

/**
 * Diamond {@code A -> B -> D, A -> C -> D}. The arm on A's true edge
 * becomes the if block; the condition is used as is.
 */
public class IfThenElsePattern extends CFGPattern {

    public IfThenElsePattern() {
        super("if-then-else", List.of("A", "B", "C", "D"), "A->B", "A->C", "B->D", "C->D");
    }

    @Override
    protected boolean accepts(ControlFlowGraph cfg, Map<String, String> m) {
        String b = m.get("B");
        String c = m.get("C");
        return cfg.outDegree(m.get("A")) == 2
            && cfg.inDegree(b) == 1 && cfg.outDegree(b) == 1
            && cfg.inDegree(c) == 1 && cfg.outDegree(c) == 1;
    }

    @Override
    public void apply(SymbolTable symbols, Map<String, String> m) {
        String a = m.get("A");
        String b = m.get("B");
        String c = m.get("C");
        BranchInfo branch = symbols.getBranch(a);
        String thenArm = branch.trueTarget().equals(b) ? b : c;
        String elseArm = thenArm.equals(b) ? c : b;

        BranchingStatement stmt = new BranchingStatement(branch.condition(),
                                                         symbols.getStatements(thenArm),
                                                         symbols.getStatements(elseArm));
        symbols.rewriteBlock(a, List.of(stmt), BranchInfo.unconditional(m.get("D")), List.of(b, c));
    }
}
