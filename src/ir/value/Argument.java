package ir.value;

import ir.type.Type;

public class Argument extends Value {
    private final int index;
    private final Function parent;

    public Argument(Type type, String name, int index, Function parent) {
        super(type, name);
        this.index = index;
        this.parent = parent;
    }

    public int getIndex() { return index; }
    public Function getParent() { return parent; }

    @Override
    public String toIR() {
        return getType().toIR() + " %" + getName();
    }
}
