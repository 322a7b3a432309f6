package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.VoidType;
import ir.value.Opcode;
import ir.value.Value;

public class ReturnInst extends Instruction {

    public ReturnInst(Value value) {
        super(VoidType.getVoid(), "");
        if (value != null) {
            addOperand(value);
        }
    }

    public boolean hasReturnValue() {
        return getNumOperands() > 0;
    }

    public Value getReturnValue() {
        return hasReturnValue() ? getOperand(0) : null;
    }

    @Override
    public String toIR() {
        if (hasReturnValue()) {
            Value returnVal = getOperand(0);
            return "ret " + returnVal.getType().toIR() + " " + returnVal.getReference();
        }
        return "ret void";
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Opcode opCode() {
        return Opcode.RET;
    }
}
