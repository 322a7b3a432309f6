package qasm.ast;

public record Include(String filename) implements Statement {
}
