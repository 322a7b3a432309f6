package ir.value.instructions;

import ir.InstructionVisitor;
import ir.type.VoidType;
import ir.value.BasicBlock;
import ir.value.Opcode;
import ir.value.Value;

// br label %dest | br i1 %c, label %then, label %else
public class BranchInst extends Instruction {

    public BranchInst(BasicBlock dest) {
        super(VoidType.getVoid(), "");
        addOperand(dest);
    }

    public BranchInst(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        super(VoidType.getVoid(), "");
        addOperand(condition);
        addOperand(thenBlock);
        addOperand(elseBlock);
    }

    @Override
    public Opcode opCode() {
        return Opcode.BR;
    }

    @Override
    public String toIR() {
        if (isConditional()) {
            Value condition = getCondition();
            return "br " + condition.getType().toIR()
                + " " + condition.getReference()
                + ", label %" + getThenBlock().getName()
                + ", label %" + getElseBlock().getName();
        }
        return "br label %" + getThenBlock().getName();
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    public boolean isConditional() {
        return getNumOperands() > 1;
    }

    public Value getCondition() {
        return isConditional() ? getOperand(0) : null;
    }

    public BasicBlock getThenBlock() {
        return (BasicBlock) (isConditional() ? getOperand(1) : getOperand(0));
    }

    public BasicBlock getElseBlock() {
        return isConditional() ? (BasicBlock) getOperand(2) : null;
    }
}
