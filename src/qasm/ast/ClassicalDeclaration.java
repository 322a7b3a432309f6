package qasm.ast;

public record ClassicalDeclaration(ClassicalType type, Identifier identifier) implements Statement {
}
