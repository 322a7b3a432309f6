package pass.cfg;

import java.util.List;

import pass.StructuringPassType;
import pass.cfg.pattern.SelfLoopPattern;
import pass.cfg.pattern.WhileLoopPattern;

public class WhileStructuringPass extends PatternStructuringPass {

    public WhileStructuringPass() {
        super(List.of(new WhileLoopPattern(), new SelfLoopPattern()));
    }

    @Override
    public StructuringPassType getType() {
        return StructuringPassType.WhileStructuring;
    }
}
