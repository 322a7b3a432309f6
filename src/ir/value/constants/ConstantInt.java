package ir.value.constants;

import ir.type.IntegerType;

public class ConstantInt extends Constant {
    private final long value;

    public ConstantInt(IntegerType type, long value) {
        super(type);
        this.value = value;
    }

    public static ConstantInt get(int bitWidth, long value) {
        return new ConstantInt(IntegerType.get(bitWidth), value);
    }

    public static ConstantInt getBool(boolean value) {
        return new ConstantInt(IntegerType.getI1(), value ? 1 : 0);
    }

    public long getValue() { return value; }

    public int getBitWidth() {
        return ((IntegerType) getType()).getBitWidth();
    }

    public boolean isBool() {
        return getBitWidth() == 1;
    }

    @Override
    public String toIR() {
        if (isBool()) {
            return "i1 " + (value != 0 ? "true" : "false");
        }
        return getType().toIR() + " " + value;
    }
}
