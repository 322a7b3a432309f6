package ir.type;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public final class FunctionType extends Type {
    private final Type returnType;
    private final List<Type> paramTypes;
    private final boolean isVarArg;

    private static final Map<Key, FunctionType> pool =
        new ConcurrentHashMap<>();

    private record Key(Type ret, List<Type> params, boolean var) {}

    private FunctionType(Type returnType, List<Type> paramTypes, boolean var) {
        super(TypeKind.FUNCTION);
        this.returnType = returnType;
        this.paramTypes = paramTypes;
        this.isVarArg = var;
    }

    public static FunctionType get(Type ret, List<Type> params) {
        return get(ret, params, false);
    }

    public static FunctionType get(Type ret,
                                   List<Type> params,
                                   boolean isVarArg) {
        Type r = ret != null ? ret : VoidType.getVoid();
        return pool.computeIfAbsent(
                   new Key(r, List.copyOf(params), isVarArg),
                   k -> new FunctionType(k.ret(), k.params(), k.var()));
    }

    public Type getReturnType() { return returnType; }
    public List<Type> getParamTypes() { return paramTypes; }
    public boolean isVarArg() { return isVarArg; }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(returnType.toIR());
        sb.append(" (");
        for (int i = 0; i < paramTypes.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(paramTypes.get(i).toIR());
        }
        if (isVarArg) {
            if (!paramTypes.isEmpty()) sb.append(", ");
            sb.append("...");
        }
        sb.append(")");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FunctionType other)) return false;
        return returnType.equals(other.returnType)
            && paramTypes.equals(other.paramTypes)
            && isVarArg == other.isVarArg;
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), returnType, paramTypes, isVarArg);
    }
}
