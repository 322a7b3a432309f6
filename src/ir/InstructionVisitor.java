package ir;

import ir.value.instructions.*;

public interface InstructionVisitor<T> {
    T visit(BinOperator inst);

    T visit(ICmpInst inst);

    T visit(CallInst inst);

    T visit(BranchInst inst);

    T visit(ReturnInst inst);

    T visit(GenericInst inst);
}
