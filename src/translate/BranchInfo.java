package translate;

import java.util.ArrayList;
import java.util.List;

import qasm.ast.Expression;

/**
 * Terminator of a block after lowering. For a conditional branch
 * {@code targets.get(0)} is taken when the condition holds.
 */
public record BranchInfo(Expression condition, List<String> targets) {

    public BranchInfo {
        targets = List.copyOf(targets);
        if (condition != null && targets.size() != 2) {
            throw new IllegalArgumentException("conditional branch needs two targets: " + targets);
        }
        if (condition == null && targets.size() > 1) {
            throw new IllegalArgumentException("unconditional branch has one target at most: " + targets);
        }
    }

    public static BranchInfo unconditional(String target) {
        return new BranchInfo(null, List.of(target));
    }

    /**
     * Identical targets collapse into an unconditional branch.
     */
    public static BranchInfo conditional(Expression condition, String ifTrue, String ifFalse) {
        if (ifTrue.equals(ifFalse)) {
            return unconditional(ifTrue);
        }
        return new BranchInfo(condition, List.of(ifTrue, ifFalse));
    }

    public static BranchInfo terminal() {
        return new BranchInfo(null, List.of());
    }

    public boolean isConditional() {
        return condition != null;
    }

    public String trueTarget() {
        return targets.get(0);
    }

    public String falseTarget() {
        return targets.get(1);
    }

    public BranchInfo retarget(String from, String to) {
        List<String> newTargets = new ArrayList<>();
        for (String t : targets) {
            newTargets.add(t.equals(from) ? to : t);
        }
        return new BranchInfo(condition, newTargets);
    }
}
