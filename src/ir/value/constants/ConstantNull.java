package ir.value.constants;

import ir.type.PointerType;

/**
 * {@code null} of a pointer type. For {@code %Qubit* null} this is how QIR
 * addresses the first static qubit.
 */
public class ConstantNull extends Constant {

    public ConstantNull(PointerType type) {
        super(type);
    }

    @Override
    public String toIR() {
        return getType().toIR() + " null";
    }
}
