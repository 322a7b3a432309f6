package pass.cfg;

import java.util.List;

import pass.StructuringPassType;
import pass.cfg.pattern.IfThenElsePattern;
import pass.cfg.pattern.IfThenPattern;

/**
 * if/else diamonds first, then one-armed ifs.
 */
public class IfStructuringPass extends PatternStructuringPass {

    public IfStructuringPass() {
        super(List.of(new IfThenElsePattern(), new IfThenPattern()));
    }

    @Override
    public StructuringPassType getType() {
        return StructuringPassType.IfStructuring;
    }
}
