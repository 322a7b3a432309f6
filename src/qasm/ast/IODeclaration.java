package qasm.ast;

public record IODeclaration(IOKeyword io, ClassicalType type, Identifier identifier) implements Statement {
}
