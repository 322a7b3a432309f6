package qasm.ast;

import java.util.List;

public record Program(String version, List<Statement> statements) implements Statement {

    public static final String VERSION = "3.0";

    public Program {
        statements = List.copyOf(statements);
    }

    public Program(List<Statement> statements) {
        this(VERSION, statements);
    }
}
