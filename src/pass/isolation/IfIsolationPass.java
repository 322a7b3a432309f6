package pass.isolation;

import java.util.ArrayList;
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
 * For a two-way branch whose arms are chains meeting at the same block,
 * gives each arm block a single predecessor so that the if templates can
 * match. The shared tail after the meeting point is left alone.
 */
public class IfIsolationPass implements StructuringPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());

    @Override
    public StructuringPassType getType() {
        return StructuringPassType.IfIsolation;
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
                if (isolateArms(symbols, head)) {
                    progress = true;
                    changed = true;
                    break;
                }
            }
        } while (progress);
        if (changed) {
            log.debug("if isolation: {} blocks after duplication", cfg.nodeCount());
        }
        return changed;
    }

    private boolean isolateArms(SymbolTable symbols, String head) {
        ControlFlowGraph cfg = symbols.getCfg();
        if (cfg.outDegree(head) != 2) {
            return false;
        }
        List<String> succs = cfg.successors(head);
        List<String> first = ChainAnalysis.chain(cfg, succs.get(0));
        List<String> second = ChainAnalysis.chain(cfg, succs.get(1));
        if (first == null || second == null) {
            return false;
        }
        String end = first.get(first.size() - 1);
        if (!end.equals(second.get(second.size() - 1)) || end.equals(head)) {
            return false;
        }

        List<String> armA = new ArrayList<>(first);
        List<String> armB = new ArrayList<>(second);
        // 去掉公共后缀, 剩下的才是两条分支臂
        while (!armA.isEmpty() && !armB.isEmpty()
               && armA.get(armA.size() - 1).equals(armB.get(armB.size() - 1))) {
            armA.remove(armA.size() - 1);
            armB.remove(armB.size() - 1);
        }

        boolean changed = ChainAnalysis.isolate(symbols, head, armA);
        changed |= ChainAnalysis.isolate(symbols, head, armB);
        return changed;
    }
}
