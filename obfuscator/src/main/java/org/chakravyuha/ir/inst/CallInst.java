package org.chakravyuha.ir.inst;

import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.Value;

import java.util.List;

public final class CallInst extends Instruction {

    public CallInst(Function callee, List<? extends Value> args, String name) {
        super(Opcode.CALL, callee.getReturnType(), callee.getReturnType().isVoid() ? null : name);
        addOperand(callee);
        for (Value arg : args) {
            addOperand(arg);
        }
    }

    public Function getCallee() {
        return (Function) getOperand(0);
    }

    public List<Value> getArguments() {
        return getOperands().subList(1, getNumOperands());
    }

    @Override
    public String formatBody() {
        return "call " + getType().toIr() + " " + getCallee().getReference() + "(" + typedList(getArguments()) + ")";
    }
}
