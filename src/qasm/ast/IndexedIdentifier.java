package qasm.ast;

import java.util.List;

/**
 * {@code name[i][j]...}, used both as an operand and as an assignment target.
 */
public record IndexedIdentifier(Identifier name, List<Expression> indices) implements Expression {

    public IndexedIdentifier {
        indices = List.copyOf(indices);
    }

    public static IndexedIdentifier of(String name, long index) {
        return new IndexedIdentifier(new Identifier(name), List.of(new IntegerLiteral(index)));
    }
}
