package pass.cfg.pattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import pass.cfg.CFGPattern;
import pass.cfg.ControlFlowGraph;
import translate.SymbolTable;

/**
 * {@code A -> B} where A has no other successor and B no other
 * predecessor: B is appended to A and takes over its branch.
 */
public class SequencePattern extends CFGPattern {

    public SequencePattern() {
        super("sequence", List.of("A", "B"), "A->B");
    }

    @Override
    protected boolean accepts(ControlFlowGraph cfg, Map<String, String> m) {
        return cfg.outDegree(m.get("A")) == 1 && cfg.inDegree(m.get("B")) == 1;
    }

    @Override
    public void apply(SymbolTable symbols, Map<String, String> m) {
        String a = m.get("A");
        String b = m.get("B");
        symbols.rewriteBlock(a, new ArrayList<>(symbols.getStatements(b)), symbols.getBranch(b), List.of(b));
    }
}
