package ir.value.instructions;

import java.util.ArrayList;
import java.util.List;

import ir.InstructionVisitor;
import ir.type.FunctionType;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;

public class CallInst extends Instruction {

    private final Function func;

    public CallInst(Function func, List<Value> args, String name) {
        super(func.getFunctionType().getReturnType(), name);
        this.func = func;
        for (Value arg : args) {
            addOperand(arg);
        }
    }

    public Function getCalledFunction() {
        return func;
    }

    public FunctionType getCalleeType() {
        return func.getFunctionType();
    }

    public int getNumArgs() {
        return getNumOperands();
    }

    public Value getArg(int i) {
        return getOperand(i);
    }

    public List<Value> getArgs() {
        return getOperands();
    }

    public boolean isVoid() {
        return getType().isVoid();
    }

    @Override
    public Opcode opCode() {
        return Opcode.CALL;
    }

    @Override
    public String toIR() {
        List<String> argStrings = new ArrayList<>();
        for (Value arg : getArgs()) {
            argStrings.add(arg.getType().toIR() + " " + arg.getReference());
        }
        return resultPrefix() + "call " + getType().toIR() + " @" + func.getName()
            + "(" + String.join(", ", argStrings) + ")";
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
