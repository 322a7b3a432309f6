package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.IntegerType;
import ir.value.Opcode;
import ir.value.Value;

public class ICmpInst extends Instruction {
    private final Opcode opcode;

    public ICmpInst(Opcode opcode, String name, Value lhs, Value rhs) {
        super(IntegerType.getI1(), name);
        if (!opcode.isICmp()) {
            throw new IllegalArgumentException(opcode + " is not an icmp predicate");
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
        return resultPrefix() + opcode.getIRName() + " " + getLHS().getType().toIR()
            + " " + getLHS().getReference() + ", " + getRHS().getReference();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
