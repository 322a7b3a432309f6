package qasm.ast;

import java.util.List;

public record WhileLoop(Expression condition, List<Statement> block) implements Statement {

    public WhileLoop {
        block = List.copyOf(block);
    }
}
