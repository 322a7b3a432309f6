package ir.value;

import ir.type.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public abstract class User extends Value {

    private final ArrayList<Value> operands;

    protected User(Type type, String name) {
        super(type, name);
        this.operands = new ArrayList<>();
    }

    protected User(Type type, String name, Value... operands) {
        this(type, name);
        for (var operand : operands) {
            addOperand(operand);
        }
    }

    /* getter */
    public int getNumOperands() { return operands.size(); }
    public Value getOperand(int index) { return operands.get(index); }

    // to assure the consistency, you can only get a read only list
    public List<Value> getOperands() {
        return Collections.unmodifiableList(operands);
    }

    /* updater */
    public void setOperand(int index, Value value) {
        assert index >= 0 && index < getNumOperands();
        operands.set(index, Objects.requireNonNull(value, "Operand value cannot be null"));
    }

    public void addOperand(Value value) {
        operands.add(Objects.requireNonNull(value, "Operand value cannot be null"));
    }
}
