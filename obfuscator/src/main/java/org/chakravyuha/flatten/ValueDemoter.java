package org.chakravyuha.flatten;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IRBuilder;
import org.chakravyuha.ir.UndefValue;
import org.chakravyuha.ir.Use;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.AllocaInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.LoadInst;
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.inst.StoreInst;
import org.chakravyuha.ir.type.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Moves every value that crosses a block boundary into a stack slot so blocks
 * can be rearranged freely afterwards. PHIs become a store on each incoming
 * edge plus one load at the top of the PHI's block; other values are stored
 * right after their definition and reloaded in front of every use.
 * <p>
 * Afterwards the function holds no PHI and no instruction is used outside
 * its own block. The block list is not changed.
 */
public final class ValueDemoter {

    private static final Logger logger = LoggerFactory.getLogger(ValueDemoter.class);

    /**
     * @return the number of slots created
     */
    public int demote(Function function) {
        int phis = demotePhis(function);
        int values = demoteCrossBlockValues(function);
        logger.debug("Demoted {} PHIs and {} cross-block values in @{}", phis, values, function.getName());
        return phis + values;
    }

    private int demotePhis(Function function) {
        List<PhiInst> phis = new ArrayList<>();
        for (BasicBlock bb : function.getBlocks()) {
            phis.addAll(bb.getPhis());
        }
        if (phis.isEmpty()) {
            return 0;
        }
        BasicBlock entry = function.getEntryBlock();
        IRBuilder builder = new IRBuilder();

        Map<PhiInst, AllocaInst> slots = new LinkedHashMap<>();
        for (PhiInst phi : phis) {
            slots.put(phi, createSlot(builder, entry, phi.getType(), phi.getName() + ".slot"));
        }
        builder.positionBeforeTerminator(entry);
        for (Map.Entry<PhiInst, AllocaInst> e : slots.entrySet()) {
            builder.createStore(UndefValue.get(e.getKey().getType()), e.getValue());
        }

        // A PHI feeding another PHI is read at the predecessor before any edge
        // store lands there, so all PHIs of a block observe the pre-edge values.
        Map<BasicBlock, Map<PhiInst, LoadInst>> edgeReads = new HashMap<>();
        for (PhiInst phi : phis) {
            for (int i = 0; i < phi.getNumIncoming(); i++) {
                Value incoming = phi.getIncomingValue(i);
                if (!(incoming instanceof PhiInst) || !slots.containsKey(incoming)) {
                    continue;
                }
                BasicBlock pred = phi.getIncomingBlock(i);
                Map<PhiInst, LoadInst> reads = edgeReads.computeIfAbsent(pred, b -> new HashMap<>());
                if (!reads.containsKey(incoming)) {
                    PhiInst source = (PhiInst) incoming;
                    builder.positionBeforeTerminator(pred);
                    reads.put(source, builder.createLoad(source.getType(), slots.get(source), source.getName() + ".in"));
                }
            }
        }

        for (PhiInst phi : phis) {
            AllocaInst slot = slots.get(phi);
            for (int i = 0; i < phi.getNumIncoming(); i++) {
                Value incoming = phi.getIncomingValue(i);
                BasicBlock pred = phi.getIncomingBlock(i);
                Map<PhiInst, LoadInst> reads = edgeReads.get(pred);
                if (reads != null && reads.containsKey(incoming)) {
                    incoming = reads.get(incoming);
                }
                builder.positionBeforeTerminator(pred);
                builder.createStore(incoming, slot);
            }
        }

        // One load on entry to the PHI's block captures the value before any
        // back edge overwrites the slot; later blocks read it through a spill.
        for (PhiInst phi : phis) {
            List<Use> uses = new ArrayList<>();
            for (Use use : phi.getUses()) {
                if (!(use.getUser() instanceof PhiInst && slots.containsKey(use.getUser()))) {
                    uses.add(use);
                }
            }
            if (uses.isEmpty()) {
                continue;
            }
            builder.positionBefore(phi.getParent().getFirstInsertionPoint());
            LoadInst reload = builder.createLoad(phi.getType(), slots.get(phi), phi.getName() + ".reload");
            for (Use use : uses) {
                use.set(reload);
            }
        }

        for (PhiInst phi : phis) {
            phi.dropAllOperands();
        }
        for (PhiInst phi : phis) {
            phi.eraseFromParent();
        }
        return phis.size();
    }

    private int demoteCrossBlockValues(Function function) {
        BasicBlock entry = function.getEntryBlock();
        List<Instruction> escaping = new ArrayList<>();
        for (BasicBlock bb : function.getBlocks()) {
            for (Instruction inst : bb.getInstructions()) {
                if (inst.isTerminator() || !inst.producesValue()) {
                    continue;
                }
                // entry allocas dominate every block, flattened or not
                if (inst instanceof AllocaInst && bb == entry) {
                    continue;
                }
                if (isUsedOutsideBlock(inst)) {
                    escaping.add(inst);
                }
            }
        }

        IRBuilder builder = new IRBuilder();
        for (Instruction inst : escaping) {
            AllocaInst slot = createSlot(builder, entry, inst.getType(), inst.getName() + ".slot");
            List<Use> uses = new ArrayList<>(inst.getUses());
            builder.positionBefore(inst.getNextInstruction());
            StoreInst spill = builder.createStore(inst, slot);
            for (Use use : uses) {
                if (use.getUser() == spill) {
                    continue;
                }
                positionBeforeUser(builder, use, inst.getParent());
                use.set(builder.createLoad(inst.getType(), slot, inst.getName() + ".reload"));
            }
        }
        return escaping.size();
    }

    private static boolean isUsedOutsideBlock(Instruction inst) {
        for (Use use : inst.getUses()) {
            if (!(use.getUser() instanceof Instruction)) {
                continue;
            }
            Instruction user = (Instruction) use.getUser();
            if (user.getParent() != inst.getParent() || user instanceof PhiInst) {
                return true;
            }
        }
        return false;
    }

    /**
     * Slots go after the allocas already at the top of the entry block, in creation order.
     */
    static AllocaInst createSlot(IRBuilder builder, BasicBlock entry, Type type, String name) {
        Instruction point = null;
        for (Instruction inst : entry.getInstructions()) {
            if (!(inst instanceof AllocaInst)) {
                point = inst;
                break;
            }
        }
        if (point == null) {
            builder.positionAtEnd(entry);
        } else {
            builder.positionBefore(point);
        }
        return builder.createAlloca(type, name);
    }

    private static void positionBeforeUser(IRBuilder builder, Use use, BasicBlock fallback) {
        if (use.getUser() instanceof Instruction && ((Instruction) use.getUser()).getParent() != null) {
            builder.positionBefore((Instruction) use.getUser());
            return;
        }
        Instruction point = fallback.getFirstInsertionPoint();
        if (point == null) {
            builder.positionAtEnd(fallback);
        } else {
            builder.positionBefore(point);
        }
    }
}
