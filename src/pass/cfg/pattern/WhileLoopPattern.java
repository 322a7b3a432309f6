package pass.cfg.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import pass.cfg.CFGPattern;
import pass.cfg.ControlFlowGraph;
import qasm.ast.Expression;
import qasm.ast.Statement;
import qasm.ast.UnaryExpression;
import qasm.ast.WhileLoop;
import translate.BranchInfo;
import translate.SymbolTable;

/**
 * Two-block loop: test block A, body B with {@code B -> A}.
 *
 * <pre>
 * A; while (c) { B; A; }
 * </pre>
 * The condition is negated when A's true edge is the exit.
 */
public class WhileLoopPattern extends CFGPattern {

    public WhileLoopPattern() {
        super("while", List.of("A", "B"), "A->B", "B->A");
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
        boolean bodyOnTrue = branch.trueTarget().equals(b);
        String exit = bodyOnTrue ? branch.falseTarget() : branch.trueTarget();
        Expression cond = bodyOnTrue ? branch.condition() : UnaryExpression.not(branch.condition());

        List<Statement> body = new ArrayList<>(symbols.getStatements(b));
        // 循环体末尾重新执行测试块, 条件才会被重新计算
        body.addAll(symbols.getStatements(a));
        symbols.rewriteBlock(a, List.of(new WhileLoop(cond, body)), BranchInfo.unconditional(exit), List.of(b));
    }
}
