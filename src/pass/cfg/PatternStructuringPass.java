package pass.cfg;

import java.util.List;
import java.util.Map;

import pass.Pass.StructuringPass;
import translate.SymbolTable;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Applies its patterns until none of them matches. Every rewrite removes
 * at least one block or edge, so this terminates.
 */
public abstract class PatternStructuringPass implements StructuringPass {
    private final Logger log = LoggingManager.getLogger(this.getClass());
    private final List<CFGPattern> patterns;

    protected PatternStructuringPass(List<CFGPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    @Override
    public boolean run(SymbolTable symbols) {
        boolean changed = false;
        boolean progress;
        do {
            progress = false;
            for (CFGPattern pattern : patterns) {
                Map<String, String> match = pattern.match(symbols.getCfg());
                if (match == null) {
                    continue;
                }
                log.debug("{} matched {}", pattern.getName(), match);
                pattern.apply(symbols, match);
                progress = true;
                changed = true;
                break;
            }
        } while (progress);
        return changed;
    }
}
