package qasm.ast;

import java.util.List;

public record FunctionCall(Identifier name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        arguments = List.copyOf(arguments);
    }
}
