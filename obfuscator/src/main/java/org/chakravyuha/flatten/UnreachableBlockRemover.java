package org.chakravyuha.flatten;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.UndefValue;
import org.chakravyuha.ir.analysis.DominatorTree;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.PhiInst;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Deletes blocks that can no longer be reached from the entry.
 */
public final class UnreachableBlockRemover {

    /**
     * @return the number of blocks removed
     */
    public int removeUnreachable(Function function) {
        Set<BasicBlock> reachable = DominatorTree.reachableBlocks(function);
        List<BasicBlock> dead = new ArrayList<>();
        for (BasicBlock bb : function.getBlocks()) {
            if (!reachable.contains(bb)) {
                dead.add(bb);
            }
        }
        if (dead.isEmpty()) {
            return 0;
        }
        for (BasicBlock bb : reachable) {
            for (PhiInst phi : bb.getPhis()) {
                for (int i = phi.getNumIncoming() - 1; i >= 0; i--) {
                    if (!reachable.contains(phi.getIncomingBlock(i))) {
                        phi.removeIncoming(i);
                    }
                }
            }
        }
        for (BasicBlock bb : dead) {
            for (Instruction inst : bb.getInstructions()) {
                if (inst.hasUses()) {
                    inst.replaceAllUsesWith(UndefValue.get(inst.getType()));
                }
            }
        }
        for (BasicBlock bb : dead) {
            for (Instruction inst : new ArrayList<>(bb.getInstructions())) {
                inst.dropAllOperands();
                bb.remove(inst);
            }
        }
        for (BasicBlock bb : dead) {
            bb.eraseFromParent();
        }
        return dead.size();
    }
}
