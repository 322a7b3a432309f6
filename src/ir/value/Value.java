package ir.value;

import ir.type.Type;
import java.util.Objects;

public abstract class Value {
    private final Type type;
    private String name;

    protected Value(Type type, String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
    }

    /**
     * @return the textual IR form: the full instruction for instructions,
     *         {@code <type> <value>} for constants
     */
    public abstract String toIR();

    /* getter setter */
    public String getName() { return this.name; }
    public Type getType() { return this.type; }
    public boolean isConstant() { return false; }
    public boolean hasName() { return name != null && !name.isEmpty(); }

    public void setName(String name) { this.name = name; }

    /**
     * 获取在指令中引用此值时的字符串表示
     * 常量返回值部分（如 "42"）, 其他返回名字引用（如 "%ptr"）
     */
    public String getReference() {
        if (isConstant()) {
            String full = toIR();
            String typeText = getType().toIR();
            if (full.startsWith(typeText + " ")) {
                return full.substring(typeText.length() + 1);
            }
            return full;
        }
        if (this instanceof GlobalVariable || this instanceof Function) return "@" + getName();
        return "%" + getName();
    }

    @Override
    public String toString() {
        return toIR();
    }
}
