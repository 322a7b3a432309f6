package pass.cfg.pattern;

import java.util.List;
import java.util.Map;

import pass.cfg.CFGPattern;
import pass.cfg.ControlFlowGraph;
import qasm.ast.Expression;
import qasm.ast.UnaryExpression;
import qasm.ast.WhileLoop;
import translate.BranchInfo;
import translate.SymbolTable;

/**
 * Block branching to itself: {@code A; while (c) { A; }}.
 */
public class SelfLoopPattern extends CFGPattern {

    public SelfLoopPattern() {
        super("self-loop", List.of("A"), "A->A");
    }

    @Override
    protected boolean accepts(ControlFlowGraph cfg, Map<String, String> m) {
        return cfg.outDegree(m.get("A")) == 2;
    }

    @Override
    public void apply(SymbolTable symbols, Map<String, String> m) {
        String a = m.get("A");
        BranchInfo branch = symbols.getBranch(a);
        boolean loopOnTrue = branch.trueTarget().equals(a);
        String exit = loopOnTrue ? branch.falseTarget() : branch.trueTarget();
        Expression cond = loopOnTrue ? branch.condition() : UnaryExpression.not(branch.condition());

        WhileLoop loop = new WhileLoop(cond, symbols.getStatements(a));
        symbols.rewriteBlock(a, List.of(loop), BranchInfo.unconditional(exit), List.of());
    }
}
