package pass;

import java.util.function.Supplier;

import pass.Pass.StructuringPass;
import pass.cfg.IfStructuringPass;
import pass.cfg.SequencePass;
import pass.cfg.WhileStructuringPass;
import pass.isolation.IfIsolationPass;
import pass.isolation.WhileIsolationPass;

/**
 * StructuringPassFactory: create the structuring passes here
 */
public enum StructuringPassType implements PassType<StructuringPass> {
    IfIsolation(IfIsolationPass::new),
    WhileIsolation(WhileIsolationPass::new),

    Sequence(SequencePass::new),
    IfStructuring(IfStructuringPass::new),
    WhileStructuring(WhileStructuringPass::new),
    // add more pass here
    ;

    private final Supplier<StructuringPass> supplier;

    StructuringPassType(Supplier<StructuringPass> constructor) {
        this.supplier = constructor;
    }

    @Override
    public Supplier<StructuringPass> constructor() {
        return supplier;
    }
}
