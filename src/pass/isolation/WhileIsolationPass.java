package pass.isolation;

import java.util.List;

import driver.Config;
import exception.CompileException;
import pass.Pass.StructuringPass;
import pass.StructuringPassType;
import pass.cfg.ControlFlowGraph;
import translate.SymbolTable;
import util.LoggingManager;
import util.logging.Logger;

/**
 * For a two-way branch with a successor chain that leads back to the
 * branching block, gives every block of that loop body a single predecessor.
 */
public class WhileIsolationPass implements StructuringPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public StructuringPassType getType() {
        return StructuringPassType.WhileIsolation;
    }

    @Override
    public boolean run(SymbolTable symbols) {
        ControlFlowGraph cfg = symbols.getCfg();
        int maxRounds = Config.getInstance().maxStructuringRounds;
        boolean changed = false;
        boolean progress;
        int rounds = 0;
        do {
            if (++rounds > maxRounds) {
                throw CompileException.notConverged(cfg.nodeCount(), cfg.nodes().toString());
            }
            progress = false;
            for (String head : cfg.nodes()) {
                if (isolateBody(symbols, head)) {
                    progress = true;
                    changed = true;
                    break;
                }
            }
        } while (progress);
        if (changed) {
            log.debug("while isolation: {} blocks after duplication", cfg.nodeCount());
        }
        return changed;
    }

    private boolean isolateBody(SymbolTable symbols, String head) {
        ControlFlowGraph cfg = symbols.getCfg();
        if (cfg.outDegree(head) != 2) {
            return false;
        }
        for (String succ : cfg.successors(head)) {
            List<String> chain = ChainAnalysis.chain(cfg, succ);
            if (chain == null || !chain.get(chain.size() - 1).equals(head)) {
                continue;
            }
            List<String> body = chain.subList(0, chain.size() - 1);
            if (ChainAnalysis.isolate(symbols, head, body)) {
                return true;
            }
        }
        return false;
    }
}
