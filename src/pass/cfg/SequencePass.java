package pass.cfg;

import java.util.List;

import pass.StructuringPassType;
import pass.cfg.pattern.SequencePattern;

public class SequencePass extends PatternStructuringPass {

    public SequencePass() {
        super(List.of(new SequencePattern()));
    }

    @Override
    public StructuringPassType getType() {
        return StructuringPassType.Sequence;
    }
}
