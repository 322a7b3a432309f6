package qasm.ast;

/**
 * Classical type of a declaration, temporary or defcal signature.
 * {@link #getName()} is what temporaries and I/O variables are named after.
 */
public interface ClassicalType {

    default String getName() {
        return getClass().getSimpleName();
    }
}
