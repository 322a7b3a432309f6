package ir.type;

public final class VoidType extends Type {
    private static final VoidType instance = new VoidType();

    private VoidType() {
        super(TypeKind.VOID);
    }

    public static VoidType getVoid() {
        return instance;
    }

    @Override
    public String toIR() {
        return "void";
    }
}
