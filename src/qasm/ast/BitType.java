package qasm.ast;

/**
 * {@code bit} or {@code bit[n]}; size may be null.
 */
public record BitType(Expression size) implements ClassicalType {

    public BitType() {
        this(null);
    }
}
