package qasm.ast;

public record Identifier(String name) implements Expression {
}
