package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.Value;

import java.util.List;

/**
 * Call that continues at {@code normalDest} or unwinds to {@code unwindDest}.
 * Operands: {@code [callee, args..., normalDest, unwindDest]}.
 */
public final class InvokeInst extends TerminatorInst {

    public InvokeInst(Function callee, List<? extends Value> args, BasicBlock normalDest, BasicBlock unwindDest, String name) {
        super(Opcode.INVOKE, callee.getReturnType(), callee.getReturnType().isVoid() ? null : name);
        addOperand(callee);
        for (Value arg : args) {
            addOperand(arg);
        }
        addOperand(normalDest);
        addOperand(unwindDest);
    }

    public Function getCallee() {
        return (Function) getOperand(0);
    }

    public List<Value> getArguments() {
        return getOperands().subList(1, getNumOperands() - 2);
    }

    public BasicBlock getNormalDest() {
        return (BasicBlock) getOperand(getNumOperands() - 2);
    }

    public BasicBlock getUnwindDest() {
        return (BasicBlock) getOperand(getNumOperands() - 1);
    }

    @Override
    public String formatBody() {
        return "invoke " + getType().toIr() + " " + getCallee().getReference() + "(" + typedList(getArguments())
                + ") to label " + getNormalDest().getReference() + " unwind label " + getUnwindDest().getReference();
    }
}
