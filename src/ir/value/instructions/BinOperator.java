package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.Type;
import ir.value.Opcode;
import ir.value.Value;

public class BinOperator extends Instruction {
    private final Opcode opcode;

    public BinOperator(String name, Opcode opcode,
            Type type, Value lhs, Value rhs) {
        super(type, name);
        if (!opcode.isBinary()) {
            throw new IllegalArgumentException(opcode + " is not a binary opcode");
        }
        this.opcode = opcode;
        addOperand(lhs);
        addOperand(rhs);
    }

    @Override
    public Opcode opCode() {
        return opcode;
    }

    public Value getLHS() { return getOperand(0); }
    public Value getRHS() { return getOperand(1); }

    @Override
    public String toIR() {
        return resultPrefix() + opcode.getIRName() + " " + getType().toIR()
            + " " + getLHS().getReference() + ", " + getRHS().getReference();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
