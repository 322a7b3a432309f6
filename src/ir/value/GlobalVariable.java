package ir.value;

import ir.QIRModule;
import ir.type.PointerType;
import ir.type.Type;

import java.util.Objects;

/**
 * A module-level global. The initializer is kept as text: globals are only
 * referenced (string labels for output recording), never lowered.
 */
public class GlobalVariable extends Value {
    private final QIRModule parent;
    private final String initializer;
    private final boolean isConst;

    public GlobalVariable(QIRModule parent, Type valueType, String name,
                          String initializer, boolean isConst) {
        super(PointerType.get(Objects.requireNonNull(valueType, "type")), name);
        this.parent = Objects.requireNonNull(parent, "parent");
        this.initializer = initializer;
        this.isConst = isConst;
    }

    public QIRModule getParent() { return parent; }
    public String getInitializer() { return initializer; }
    public boolean hasInitializer() { return initializer != null; }
    public boolean isConst() { return isConst; }

    public Type getValueType() {
        return ((PointerType) getType()).getPointeeType();
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append("@").append(getName()).append(" = ");
        sb.append(isConst ? "constant " : "global ");
        sb.append(getValueType().toIR());
        if (initializer != null) {
            sb.append(" ").append(initializer);
        }
        return sb.toString();
    }
}
