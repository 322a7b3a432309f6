package pass.isolation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import pass.cfg.ControlFlowGraph;
import translate.SymbolTable;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Straight-line chains and the duplication that makes them private to one
 * predecessor.
 */
public final class ChainAnalysis {
    private static final Logger log = LoggingManager.getLogger(ChainAnalysis.class);

    private ChainAnalysis() {
    }

    /**
     * Follows single-successor blocks from {@code start}. The first block
     * whose out-degree is not 1 ends the chain and is included.
     *
     * @return the chain, or null if it runs into a cycle of single-successor blocks
     */
    public static List<String> chain(ControlFlowGraph cfg, String start) {
        List<String> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String cur = start;
        while (true) {
            if (!seen.add(cur)) {
                return null;
            }
            chain.add(cur);
            if (cfg.outDegree(cur) != 1) {
                return chain;
            }
            cur = cfg.successors(cur).get(0);
        }
    }

    /**
     * Walks {@code arm} from {@code head} and duplicates every block that has
     * other predecessors, so the arm is reached only through {@code head}.
     *
     * @return true if anything was duplicated
     */
    public static boolean isolate(SymbolTable symbols, String head, List<String> arm) {
        ControlFlowGraph cfg = symbols.getCfg();
        boolean changed = false;
        String prev = head;
        for (String node : arm) {
            if (cfg.inDegree(node) > 1) {
                String copy = symbols.duplicateBlock(prev, node);
                log.debug("duplicated {} as {} for the edge from {}", node, copy, prev);
                prev = copy;
                changed = true;
            } else {
                prev = node;
            }
        }
        return changed;
    }
}
