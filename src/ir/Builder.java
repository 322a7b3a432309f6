package ir;

import java.util.List;

import ir.type.Type;
import ir.value.BasicBlock;
import ir.value.Function;
import ir.value.Opcode;
import ir.value.Value;
import ir.value.instructions.BinOperator;
import ir.value.instructions.BranchInst;
import ir.value.instructions.CallInst;
import ir.value.instructions.ICmpInst;
import ir.value.instructions.Instruction;
import ir.value.instructions.ReturnInst;

/**
 * Appends instructions at the end of a basic block. Used by the loader and
 * by tests that assemble modules without going through text.
 */
public class Builder {
    private final QIRModule module;
    private BasicBlock currentBlock;
    private Function currentFunction;

    public Builder(QIRModule module) {
        this.module = module;
    }

    public QIRModule getModule() {
        return module;
    }

    public void positionAtEnd(BasicBlock block) {
        this.currentBlock = block;
        this.currentFunction = block.getParent();
    }

    public Function getCurrentFunction() {
        return currentFunction;
    }

    public BasicBlock getCurrentBlock() {
        return currentBlock;
    }

    /**
     * Inserts an already constructed instruction, e.g. one the loader could
     * not map to a dedicated builder method.
     */
    public <T extends Instruction> T insert(T inst) {
        insertInstruction(inst);
        return inst;
    }

    private void insertInstruction(Instruction inst) {
        if (inst == null) {
            throw new IllegalArgumentException("Instruction cannot be null");
        }
        if (currentBlock == null) {
            throw new IllegalStateException("Builder is not positioned at a block");
        }
        if (currentBlock.isTerminated()) {
            throw new IllegalStateException(
                "Cannot insert into terminated block '" + currentBlock.getName() + "'");
        }
        currentBlock.addInstruction(inst);
    }

    // --- 二元运算 ---
    public Value buildBinary(Opcode opcode, Value lhs, Value rhs, String name) {
        if (!lhs.getType().equals(rhs.getType())) {
            throw new IllegalArgumentException(
                "lhs and rhs should have the same type in " + opcode.getIRName()
                + ": " + lhs.getType() + " vs " + rhs.getType());
        }
        Instruction inst = new BinOperator(name, opcode, lhs.getType(), lhs, rhs);
        insertInstruction(inst);
        return inst;
    }

    public Value buildAdd(Value lhs, Value rhs, String name) {
        return buildBinary(Opcode.ADD, lhs, rhs, name);
    }

    // --- 整数比较 ---
    public Value buildICmp(Opcode predicate, Value lhs, Value rhs, String name) {
        Type type = lhs.getType();
        if (!(type.isInteger() || type.isPointer()) || !type.equals(rhs.getType())) {
            throw new IllegalArgumentException(
                "icmp needs two integers or pointers of the same type: " + type + " vs " + rhs.getType());
        }
        Instruction inst = new ICmpInst(predicate, name, lhs, rhs);
        insertInstruction(inst);
        return inst;
    }

    public Value buildICmpEQ(Value lhs, Value rhs, String name) {
        return buildICmp(Opcode.ICMP_EQ, lhs, rhs, name);
    }

    // --- 控制流 ---
    public void buildBr(BasicBlock dest) {
        if (dest == null) {
            throw new IllegalArgumentException("Branch destination cannot be null");
        }
        insertInstruction(new BranchInst(dest));
    }

    public void buildCondBr(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        if (condition == null || thenBlock == null || elseBlock == null) {
            throw new IllegalArgumentException("Conditional branch requires non-null condition and destinations");
        }
        if (!condition.getType().isI1()) {
            throw new IllegalArgumentException("Condition must be of i1 type, got " + condition.getType());
        }
        insertInstruction(new BranchInst(condition, thenBlock, elseBlock));
    }

    public void buildRet(Value value) {
        if (value == null) {
            throw new IllegalArgumentException("Return value cannot be null; use buildRetVoid instead");
        }
        insertInstruction(new ReturnInst(value));
    }

    public void buildRetVoid() {
        insertInstruction(new ReturnInst(null));
    }

    /* 函数调用 */
    public Value buildCall(Function function, List<Value> args, String name) {
        List<Type> params = function.getFunctionType().getParamTypes();
        if (!function.getFunctionType().isVarArg() && params.size() != args.size()) {
            throw new IllegalArgumentException(
                "Call to @" + function.getName() + " expects " + params.size()
                + " arguments, got " + args.size());
        }
        Instruction inst = new CallInst(function, args, function.getFunctionType().getReturnType().isVoid() ? "" : name);
        insertInstruction(inst);
        return inst;
    }
}
