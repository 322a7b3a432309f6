package ir.value.constants;

import ir.type.FloatType;

public class ConstantFloat extends Constant {
    private final double value;

    public ConstantFloat(FloatType type, double value) {
        super(type);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public String toIR() {
        // hex form keeps the exact bits, like llvm does for non-representable decimals
        return getType().toIR()
            + " 0x"
            + Long.toHexString(Double.doubleToRawLongBits(this.value)).toUpperCase();
    }
}
