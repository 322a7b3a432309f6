package ir.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import ir.type.LabelType;
import ir.value.instructions.BranchInst;
import ir.value.instructions.Instruction;

public class BasicBlock extends Value {
    private final List<Instruction> instructions;
    private Function parent;

    public BasicBlock(String name, Function parent) {
        super(LabelType.getLabel(), name);
        this.instructions = new ArrayList<>();
        this.parent = parent;
        if (parent != null) {
            parent.addBlock(this);
        }
    }

    public BasicBlock(String name) {
        this(name, null);
    }

    /* getter setter */
    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public Function getParent() {
        return parent;
    }

    void setParent(Function parent) {
        this.parent = parent;
    }

    public Instruction getFirstInstruction() {
        return instructions.isEmpty() ? null : instructions.get(0);
    }

    public void addInstruction(Instruction inst) {
        if (inst == null) {
            return;
        }
        if (inst.hasName() && parent != null) {
            inst.setName(parent.getUniqueName(inst.getName()));
        }
        instructions.add(inst);
        inst.setParent(this);
    }

    /* 判断整个block是否已经插入过terminator */
    public boolean isTerminated() {
        return getTerminator() != null;
    }

    public Instruction getTerminator() {
        for (Instruction inst : instructions) {
            if (inst.opCode().isTerminator()) {
                return inst;
            }
        }
        return null;
    }

    /**
     * Successors in branch-target order: {@code [then, else]} for a
     * conditional branch, one block for an unconditional one, none for ret.
     */
    public Set<BasicBlock> getSuccessors() {
        Set<BasicBlock> succs = new LinkedHashSet<>();
        if (getTerminator() instanceof BranchInst br) {
            succs.add(br.getThenBlock());
            if (br.isConditional()) {
                succs.add(br.getElseBlock());
            }
        }
        return succs;
    }

    @Override
    public String toIR() {
        StringBuilder sb = new StringBuilder();
        sb.append(getName()).append(":\n");
        for (Instruction inst : instructions) {
            sb.append("  ").append(inst.toIR()).append("\n");
        }
        return sb.toString();
    }

    @Override
    public String getReference() {
        return "label %" + getName();
    }
}
