package qasm.ast;

import java.util.List;

/**
 * {@code if (c) { ... } else { ... }}. Both arms are snapshots of the
 * statement lists at construction time.
 */
public record BranchingStatement(Expression condition,
                                 List<Statement> ifBlock,
                                 List<Statement> elseBlock) implements Statement {

    public BranchingStatement {
        ifBlock = List.copyOf(ifBlock);
        elseBlock = List.copyOf(elseBlock);
    }
}
