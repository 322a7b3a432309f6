package translate.builder;

import java.util.List;

import qasm.ast.Expression;
import qasm.ast.Statement;

/**
 * What a builder produced: the expression the call's result is bound to
 * (null when it has none) and the statements appended to the current block.
 */
public record LoweringResult(Expression result, List<Statement> statements) {

    public LoweringResult {
        statements = List.copyOf(statements);
    }

    public static LoweringResult of(Expression result, List<Statement> statements) {
        return new LoweringResult(result, statements);
    }

    public static LoweringResult of(List<Statement> statements) {
        return new LoweringResult(null, statements);
    }

    public static LoweringResult of(Statement statement) {
        return new LoweringResult(null, List.of(statement));
    }

    public static LoweringResult none() {
        return new LoweringResult(null, List.of());
    }

    public boolean hasResult() {
        return result != null;
    }
}
