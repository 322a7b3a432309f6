package pass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import driver.Config;
import exception.CompileException;
import pass.Pass.StructuringPass;
import pass.cfg.ControlFlowGraph;
import translate.SymbolTable;
import util.LoggingManager;
import util.logging.Logger;

/**
 * Drives control-flow structuring. Every round runs the isolation passes
 * and then the structuring passes, each to its own fixpoint; rounds repeat
 * until one makes no change. Structuring succeeded iff a single block is left
 * and it no longer branches anywhere.
 */
public class PassManager {
    private final List<StructuringPass> pipeline = new ArrayList<>();

    private final Set<String> enabled;

    private Logger log = LoggingManager.getLogger(PassManager.class);

    private static PassManager INSTANCE = null;

    public static PassManager getInstance() {
        if (INSTANCE == null) {
            INSTANCE = new PassManager();
        }
        return INSTANCE;
    }

    private PassManager() {
        // read the system property
        // eg: -Dstructuring.passes=sequence,ifstructuring,...
        enabled = loadEnabled("structuring.passes");
        setDefaultPipeline();
    }

    /**
     * Reset the singleton instance (used for testing different configurations)
     */
    public static void resetInstance() {
        INSTANCE = null;
    }

    private void setDefaultPipeline() {
        setPipeline(
                // 先把共享的分支臂/循环体复制出来, 否则模板的入度约束匹配不上
                StructuringPassType.IfIsolation,
                StructuringPassType.WhileIsolation,

                StructuringPassType.Sequence,
                StructuringPassType.IfStructuring,
                StructuringPassType.WhileStructuring);
    }

    /** read “a,b,c” from system property and convert them to Set */
    private Set<String> loadEnabled(String propName) {
        String raw = System.getProperty(propName, "").trim();
        if (raw.isEmpty()) {
            return Collections.emptySet();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());
    }

    public List<StructuringPassType> getPipeline() {
        List<StructuringPassType> types = new ArrayList<>();
        for (StructuringPass p : pipeline) {
            types.add(p.getType());
        }
        return types;
    }

    /**
     * Collapses the block graph of {@code symbols} into its entry block.
     *
     * @return the remaining block names, exactly one
     * @throws CompileException STRUCTURING_DID_NOT_CONVERGE unless one block without successors is left
     */
    public List<String> run(SymbolTable symbols) {
        ControlFlowGraph cfg = symbols.getCfg();
        int maxRounds = Config.getInstance().maxStructuringRounds;
        int round = 0;
        boolean changed = true;

        while (changed && !isStructured(cfg)) {
            if (++round > maxRounds) {
                log.error("structuring gave up after {} rounds", maxRounds);
                throw CompileException.notConverged(cfg.nodeCount(), cfg.nodes().toString());
            }
            changed = false;
            for (StructuringPass p : pipeline) {
                if (Config.getInstance().isDebug) {
                    log.info("[CFG] " + p.getType().getName());
                }
                changed |= p.run(symbols);
            }
            log.debug("round {}: {} blocks, {} edges", round, cfg.nodeCount(), cfg.edgeCount());
        }

        log.info("structuring finished after {} rounds with {} block(s)", round, cfg.nodeCount());
        if (!isStructured(cfg)) {
            throw CompileException.notConverged(cfg.nodeCount(), cfg.nodes().toString());
        }
        return cfg.nodes();
    }

    // 只剩一个块且没有出边 (自环说明还有循环没被识别)
    private static boolean isStructured(ControlFlowGraph cfg) {
        return cfg.nodeCount() == 1 && cfg.edgeCount() == 0;
    }

    /**
     * 按顺序整体设置 pipeline（会清空重建）
     */
    private void setPipeline(StructuringPassType... types) {
        pipeline.clear();
        for (StructuringPassType type : types) {
            if (enabled.isEmpty() || enabled.contains(type.getName())) {
                pipeline.add(type.create());
            }
        }
    }
}
