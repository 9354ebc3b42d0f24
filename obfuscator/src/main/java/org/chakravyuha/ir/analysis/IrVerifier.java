package org.chakravyuha.ir.analysis;

import org.chakravyuha.ir.Argument;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.Use;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.BranchInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.inst.ReturnInst;
import org.chakravyuha.ir.inst.SwitchInst;
import org.chakravyuha.ir.inst.TerminatorInst;
import org.chakravyuha.ir.type.IntegerType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks over a function:
 * <ul>
 *   <li>every block ends in exactly one terminator and targets blocks of the same function</li>
 *   <li>PHIs are grouped at the top of their block and have one incoming entry per predecessor</li>
 *   <li>operand and use-lists agree in both directions</li>
 *   <li>every instruction operand is defined in the same function and dominates its use</li>
 * </ul>
 * Problems are collected as messages rather than thrown, so a caller can
 * report all of them at once.
 */
public final class IrVerifier {

    private IrVerifier() {
    }

    public static Map<String, List<String>> verify(IrModule module) {
        Map<String, List<String>> problems = new LinkedHashMap<>();
        for (Function f : module.getFunctions()) {
            List<String> diagnostics = verify(f);
            if (!diagnostics.isEmpty()) {
                problems.put(f.getName(), diagnostics);
            }
        }
        return problems;
    }

    public static void verifyOrThrow(Function function) {
        List<String> diagnostics = verify(function);
        if (!diagnostics.isEmpty()) {
            throw new IrVerificationException(function.getName(), diagnostics);
        }
    }

    public static List<String> verify(Function function) {
        List<String> out = new ArrayList<>();
        if (function.isDeclaration()) {
            return out;
        }
        Set<BasicBlock> blocks = new HashSet<>(function.getBlocks());
        BasicBlock entry = function.getEntryBlock();
        if (!entry.getPredecessors().isEmpty()) {
            out.add("entry block %" + entry.getName() + " has predecessors");
        }
        if (!entry.getPhis().isEmpty()) {
            out.add("entry block %" + entry.getName() + " contains PHI instructions");
        }

        for (BasicBlock bb : function.getBlocks()) {
            checkBlockShape(function, bb, blocks, out);
        }

        DominatorTree dom = new DominatorTree(function);
        for (BasicBlock bb : function.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                checkOperands(function, inst, dom, out);
                checkUses(function, inst, out);
            }
        }
        return out;
    }

    private static void checkBlockShape(Function function, BasicBlock bb, Set<BasicBlock> blocks, List<String> out) {
        String where = "block %" + bb.getName();
        if (bb.getParent() != function) {
            out.add(where + " has a wrong parent");
        }
        if (bb.isEmpty()) {
            out.add(where + " is empty");
            return;
        }
        TerminatorInst term = bb.getTerminator();
        if (term == null) {
            out.add(where + " does not end in a terminator");
        }
        boolean seenNonPhi = false;
        List<Instruction> insts = bb.getInstructions();
        for (int i = 0; i < insts.size(); i++) {
            Instruction inst = insts.get(i);
            if (inst.getParent() != bb) {
                out.add(where + ": " + inst + " has a wrong parent");
            }
            if (inst.isTerminator() && i != insts.size() - 1) {
                out.add(where + ": terminator " + inst + " is not the last instruction");
            }
            if (inst instanceof PhiInst) {
                if (seenNonPhi) {
                    out.add(where + ": PHI " + inst.getReference() + " follows a non-PHI instruction");
                }
            } else {
                seenNonPhi = true;
            }
        }
        if (term == null) {
            return;
        }
        for (BasicBlock succ : term.getSuccessors()) {
            if (!blocks.contains(succ)) {
                out.add(where + ": terminator targets %" + succ.getName() + " outside the function");
            }
        }
        if (term instanceof BranchInst && ((BranchInst) term).isConditional()
                && ((BranchInst) term).getCondition().getType() != IntegerType.I1) {
            out.add(where + ": branch condition is not i1");
        }
        if (term instanceof SwitchInst && !((SwitchInst) term).getCondition().getType().isInteger()) {
            out.add(where + ": switch condition is not an integer");
        }
        if (term instanceof ReturnInst) {
            ReturnInst ret = (ReturnInst) term;
            boolean voidFunction = function.getReturnType().isVoid();
            if (voidFunction == ret.hasValue()
                    || (ret.hasValue() && !ret.getValue().getType().equals(function.getReturnType()))) {
                out.add(where + ": return does not match the function return type " + function.getReturnType());
            }
        }
        Set<BasicBlock> preds = bb.getPredecessors();
        for (PhiInst phi : bb.getPhis()) {
            Set<BasicBlock> incoming = new HashSet<>(phi.getIncomingBlocks());
            if (!incoming.equals(preds)) {
                out.add(where + ": PHI " + phi.getReference() + " incoming blocks do not match the predecessors");
            }
        }
    }

    private static void checkOperands(Function function, Instruction inst, DominatorTree dom, List<String> out) {
        for (int i = 0; i < inst.getNumOperands(); i++) {
            Value operand = inst.getOperand(i);
            if (operand instanceof Argument && ((Argument) operand).getParent() != function) {
                out.add(inst + ": uses an argument of another function");
            }
            if (operand instanceof BasicBlock && ((BasicBlock) operand).getParent() != function) {
                out.add(inst + ": refers to block %" + operand.getName() + " outside the function");
            }
            if (!(operand instanceof Instruction)) {
                continue;
            }
            Instruction def = (Instruction) operand;
            if (def.getParent() == null || def.getFunction() != function) {
                out.add(inst + ": operand " + def.getReference() + " is not defined in this function");
                continue;
            }
            if (!dom.isReachable(inst.getParent()) || !dom.isReachable(def.getParent())) {
                continue;
            }
            if (inst instanceof PhiInst) {
                // the value has to be available at the end of the incoming block
                BasicBlock incoming = ((PhiInst) inst).getIncomingBlock(i / 2);
                if (!dom.dominates(def.getParent(), incoming)) {
                    out.add(inst + ": incoming " + def.getReference() + " does not dominate %" + incoming.getName());
                }
            } else if (!dom.dominates(def, inst)) {
                out.add(inst + ": operand " + def.getReference() + " does not dominate its use");
            }
        }
    }

    private static void checkUses(Function function, Instruction inst, List<String> out) {
        for (int i = 0; i < inst.getNumOperands(); i++) {
            if (!hasUse(inst.getOperand(i), inst, i)) {
                out.add(inst + ": operand " + i + " is missing from the use-list of "
                        + inst.getOperand(i).getReference());
            }
        }
        for (Use use : inst.getUses()) {
            if (use.getUser() instanceof Instruction) {
                Instruction user = (Instruction) use.getUser();
                if (user.getParent() == null || user.getFunction() != function) {
                    out.add(inst.getReference() + " is used by a detached instruction " + user);
                }
            }
            if (use.getOperandIndex() >= use.getUser().getNumOperands()
                    || use.getUser().getOperand(use.getOperandIndex()) != inst) {
                out.add(inst.getReference() + " has a stale use record " + use);
            }
        }
    }

    private static boolean hasUse(Value value, Instruction user, int index) {
        for (Use use : value.getUses()) {
            if (use.getUser() == user && use.getOperandIndex() == index) {
                return true;
            }
        }
        return false;
    }
}
