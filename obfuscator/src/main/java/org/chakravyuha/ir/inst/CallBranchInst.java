package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Call that may transfer control to one of several labels (asm goto).
 * Operands: {@code [callee, args..., defaultDest, indirectDests...]}.
 */
public final class CallBranchInst extends TerminatorInst {

    private final int argCount;

    public CallBranchInst(Function callee, List<? extends Value> args, BasicBlock defaultDest,
                          List<BasicBlock> indirectDests, String name) {
        super(Opcode.CALLBR, callee.getReturnType(), callee.getReturnType().isVoid() ? null : name);
        this.argCount = args.size();
        addOperand(callee);
        for (Value arg : args) {
            addOperand(arg);
        }
        addOperand(defaultDest);
        for (BasicBlock dest : indirectDests) {
            addOperand(dest);
        }
    }

    public Function getCallee() {
        return (Function) getOperand(0);
    }

    public List<Value> getArguments() {
        return getOperands().subList(1, 1 + argCount);
    }

    public BasicBlock getDefaultDest() {
        return (BasicBlock) getOperand(1 + argCount);
    }

    public List<BasicBlock> getIndirectDests() {
        return getSuccessors().subList(1, getNumSuccessors());
    }

    @Override
    public String formatBody() {
        return "callbr " + getType().toIr() + " " + getCallee().getReference() + "(" + typedList(getArguments())
                + ") to label " + getDefaultDest().getReference() + " [" + getIndirectDests().stream()
                .map(b -> "label " + b.getReference())
                .collect(Collectors.joining(", ")) + "]";
    }
}
