package ir.type;

public abstract class Type {
    private final TypeKind kind;

    protected Type(TypeKind kind) {
        this.kind = kind;
    }

    public TypeKind getKind() {
        return this.kind;
    }

    /**
     * @return the type spelled the way it appears in a .ll file
     */
    public abstract String toIR();

    /* classification helpers */
    public boolean is(TypeKind k) { return kind == k; }
    public boolean isVoid() { return is(TypeKind.VOID); }
    public boolean isInteger() { return is(TypeKind.INTEGER); }
    public boolean isI1() { return false; }
    public boolean isFloatingPoint() { return kind.isFloatingPoint(); }
    public boolean isPointer() { return is(TypeKind.POINTER); }
    public boolean isStruct() { return is(TypeKind.STRUCT); }
    public boolean isArray() { return is(TypeKind.ARRAY); }
    public boolean isVector() { return is(TypeKind.VECTOR); }
    public boolean isFunction() { return is(TypeKind.FUNCTION); }
    public boolean isLabel() { return is(TypeKind.LABEL); }

    @Override public String toString() { return toIR(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Type other = (Type) o;
        return kind == other.kind;
    }

    @Override
    public int hashCode() {
        return kind.hashCode();
    }
}
