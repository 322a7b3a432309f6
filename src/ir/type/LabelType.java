package ir.type;

/**
 * Type of basic block operands in branch instructions.
 */
public final class LabelType extends Type {
    private static final LabelType instance = new LabelType();

    private LabelType() {
        super(TypeKind.LABEL);
    }

    public static LabelType getLabel() {
        return instance;
    }

    @Override
    public String toIR() {
        return "label";
    }
}
