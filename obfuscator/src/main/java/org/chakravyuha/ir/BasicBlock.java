package org.chakravyuha.ir;

import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.LandingPadInst;
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.inst.TerminatorInst;
import org.chakravyuha.ir.type.LabelType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Straight-line sequence of instructions ending in exactly one terminator.
 * <p>
 * Predecessors are not stored: a block is an operand of every terminator that
 * targets it, so they are read back from the block's own use-list.
 */
public final class BasicBlock extends Value {

    private final List<Instruction> instructions = new ArrayList<>();
    private Function parent;

    public BasicBlock(String name) {
        super(LabelType.LABEL, name);
    }

    public Function getParent() {
        return parent;
    }

    void setParent(Function parent) {
        this.parent = parent;
    }

    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public int size() {
        return instructions.size();
    }

    public boolean isEmpty() {
        return instructions.isEmpty();
    }

    public Instruction getFirstInstruction() {
        return instructions.isEmpty() ? null : instructions.get(0);
    }

    public Instruction getLastInstruction() {
        return instructions.isEmpty() ? null : instructions.get(instructions.size() - 1);
    }

    /**
     * @return the last instruction if it is a terminator, otherwise {@code null}
     */
    public TerminatorInst getTerminator() {
        Instruction last = getLastInstruction();
        return last instanceof TerminatorInst ? (TerminatorInst) last : null;
    }

    /**
     * @return the first instruction that is neither a PHI nor a landing pad,
     * or {@code null} if the block holds only such instructions
     */
    public Instruction getFirstInsertionPoint() {
        for (Instruction inst : instructions) {
            if (!(inst instanceof PhiInst) && !(inst instanceof LandingPadInst)) {
                return inst;
            }
        }
        return null;
    }

    public List<PhiInst> getPhis() {
        List<PhiInst> phis = new ArrayList<>();
        for (Instruction inst : instructions) {
            if (inst instanceof PhiInst) {
                phis.add((PhiInst) inst);
            }
        }
        return phis;
    }

    public boolean isLandingPad() {
        return getFirstInstruction() instanceof LandingPadInst;
    }

    public int indexOf(Instruction inst) {
        return instructions.indexOf(inst);
    }

    public void append(Instruction inst) {
        attach(inst);
        instructions.add(inst);
    }

    public void insertBefore(Instruction inst, Instruction position) {
        int index = positionOf(position);
        attach(inst);
        instructions.add(index, inst);
    }

    public void insertAfter(Instruction inst, Instruction position) {
        int index = positionOf(position);
        attach(inst);
        instructions.add(index + 1, inst);
    }

    /**
     * Unlinks {@code inst} from this block without touching its operands or uses.
     */
    public void remove(Instruction inst) {
        if (!instructions.remove(inst)) {
            throw new IllegalArgumentException("Instruction " + inst.getName() + " is not in block " + getName());
        }
        inst.setParent(null);
    }

    /**
     * @return distinct blocks whose terminator targets this block, in use order
     */
    public Set<BasicBlock> getPredecessors() {
        Set<BasicBlock> preds = new LinkedHashSet<>();
        for (Use use : getUses()) {
            if (use.getUser() instanceof TerminatorInst) {
                BasicBlock block = ((TerminatorInst) use.getUser()).getParent();
                if (block != null) {
                    preds.add(block);
                }
            }
        }
        return preds;
    }

    /**
     * @return distinct successor blocks in terminator operand order
     */
    public Set<BasicBlock> getSuccessors() {
        TerminatorInst term = getTerminator();
        if (term == null) {
            return Collections.emptySet();
        }
        return new LinkedHashSet<>(term.getSuccessors());
    }

    public void eraseFromParent() {
        Objects.requireNonNull(parent, "block has no parent").removeBlock(this);
    }

    private int positionOf(Instruction position) {
        int index = instructions.indexOf(position);
        if (index < 0) {
            throw new IllegalArgumentException("Insertion point is not in block " + getName());
        }
        return index;
    }

    private void attach(Instruction inst) {
        Objects.requireNonNull(inst, "inst");
        if (inst.getParent() != null) {
            throw new IllegalStateException("Instruction " + inst.getName() + " already belongs to block "
                    + inst.getParent().getName());
        }
        inst.setParent(this);
    }
}
