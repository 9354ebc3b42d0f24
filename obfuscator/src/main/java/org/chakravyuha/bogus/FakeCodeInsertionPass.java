package org.chakravyuha.bogus;

import org.chakravyuha.FastRandom;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IRBuilder;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.AllocaInst;
import org.chakravyuha.ir.inst.BranchInst;
import org.chakravyuha.ir.inst.ICmpInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.Opcode;
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.inst.TerminatorInst;
import org.chakravyuha.ir.type.IntegerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Hangs dead code off unconditional branches. The original edge becomes
 * {@code br i1 false, <fake>, <successor>}, so the decoys are part of the CFG
 * but never run. Every decoy ends in a volatile store to a per-function
 * {@code dummy.var} slot and rejoins the original successor.
 */
public class FakeCodeInsertionPass {

    private static final Logger logger = LoggerFactory.getLogger(FakeCodeInsertionPass.class);

    public static final String DUMMY_SLOT_NAME = "dummy.var";

    private static final int MAX_FAKE_INSTRUCTIONS_PER_BLOCK = 20;

    private static final Opcode[] BLOCK_OPS = {Opcode.ADD, Opcode.SUB, Opcode.MUL, Opcode.XOR, Opcode.SHL};
    private static final Opcode[] LOOP_OPS = {Opcode.ADD, Opcode.MUL, Opcode.XOR, Opcode.SHL};

    private final FastRandom random;
    private final int maxLoops;
    private final int maxConditionals;
    private final int maxBlocks;

    public FakeCodeInsertionPass(FastRandom random, int maxLoops, int maxConditionals, int maxBlocks) {
        if (maxLoops < 0 || maxConditionals < 0 || maxBlocks < 0) {
            throw new IllegalArgumentException("Fake code limits must not be negative");
        }
        this.random = random;
        this.maxLoops = maxLoops;
        this.maxConditionals = maxConditionals;
        this.maxBlocks = maxBlocks;
    }

    public FakeCodeStats run(IrModule module) {
        FakeCodeStats stats = new FakeCodeStats();
        for (Function function : new ArrayList<>(module.getFunctions())) {
            if (function.isDeclaration() || function.isIntrinsic()) {
                continue;
            }
            FakeCodeStats local = insertInto(function);
            if (!local.isEmpty()) {
                logger.debug("Fake code in @{}: {}", function.getName(), local);
            }
            stats.add(local);
        }
        logger.info("Fake code insertion: {} blocks, {} loops, {} conditionals, {} bogus instructions",
                stats.getFakeBlocks(), stats.getFakeLoops(), stats.getFakeConditionals(), stats.getBogusInstructions());
        return stats;
    }

    FakeCodeStats insertInto(Function function) {
        FakeCodeStats stats = new FakeCodeStats();
        List<BasicBlock> candidates = collectCandidates(function);
        if (candidates.isEmpty()) {
            return stats;
        }
        AllocaInst dummy = createDummySlot(function);

        int loops = Math.min(pickCount(maxLoops), candidates.size() / 3);
        for (int i = 0; i < loops && !candidates.isEmpty(); i++) {
            stats.addLoop(insertFakeLoop(takeRandom(candidates), dummy));
        }
        int conditionals = Math.min(pickCount(maxConditionals), candidates.size() / 2);
        for (int i = 0; i < conditionals && !candidates.isEmpty(); i++) {
            stats.addConditional(insertFakeConditional(takeRandom(candidates), dummy));
        }
        int blocks = Math.min(pickCount(maxBlocks), candidates.size());
        for (int i = 0; i < blocks && !candidates.isEmpty(); i++) {
            stats.addBlock(insertFakeBlock(takeRandom(candidates), dummy));
        }
        return stats;
    }

    /**
     * Blocks ending in an unconditional branch to a block without PHIs. The
     * extra edge this pass adds to the successor would need a PHI incoming.
     */
    static List<BasicBlock> collectCandidates(Function function) {
        List<BasicBlock> candidates = new ArrayList<>();
        for (BasicBlock bb : function.getBlocks()) {
            TerminatorInst term = bb.getTerminator();
            if (!(term instanceof BranchInst) || !((BranchInst) term).isUnconditional()) {
                continue;
            }
            BasicBlock successor = term.getSuccessor(0);
            if (!(successor.getFirstInstruction() instanceof PhiInst)) {
                candidates.add(bb);
            }
        }
        return candidates;
    }

    private int pickCount(int max) {
        return max == 0 ? 0 : random.nextIntInclusive(1, max);
    }

    private BasicBlock takeRandom(List<BasicBlock> candidates) {
        return candidates.remove(random.nextInt(candidates.size()));
    }

    private static AllocaInst createDummySlot(Function function) {
        BasicBlock entry = function.getEntryBlock();
        IRBuilder builder = new IRBuilder();
        Instruction point = entry.getFirstInsertionPoint();
        if (point == null) {
            builder.positionAtEnd(entry);
        } else {
            builder.positionBefore(point);
        }
        return builder.createAlloca(IntegerType.I32, DUMMY_SLOT_NAME);
    }

    /**
     * Replaces {@code from}'s branch with {@code br i1 false, fake, successor}.
     *
     * @return the original successor
     */
    private static BasicBlock guard(BasicBlock from, BasicBlock fake) {
        TerminatorInst term = from.getTerminator();
        BasicBlock successor = term.getSuccessor(0);
        term.eraseFromParent();
        new IRBuilder(from).createCondBr(IRBuilder.getInt1(false), fake, successor);
        return successor;
    }

    private int insertFakeLoop(BasicBlock from, AllocaInst dummy) {
        Function function = from.getParent();
        BasicBlock loopEntry = function.createBlock("fake.loop.entry");
        BasicBlock header = function.createBlock("fake.loop.header");
        BasicBlock body = function.createBlock("fake.loop.body");
        BasicBlock exit = function.createBlock("fake.loop.exit");
        BasicBlock successor = guard(from, loopEntry);

        IRBuilder builder = new IRBuilder(loopEntry);
        builder.createBr(header);

        builder.positionAtEnd(header);
        PhiInst counter = builder.createPhi(IntegerType.I32, "fake.counter");
        ICmpInst cond = builder.createICmp(ICmpInst.Predicate.SLT, counter, IRBuilder.getInt32(10), "fake.cond");
        builder.createCondBr(cond, body, exit);

        builder.positionAtEnd(body);
        Value next = builder.createAdd(counter, IRBuilder.getInt32(1), "fake.inc");
        int ops = random.nextIntInclusive(5, 15);
        Value acc = emitArithmetic(builder, LOOP_OPS, ops, null);
        builder.createVolatileStore(acc, dummy);
        builder.createBr(header);

        counter.addIncoming(IRBuilder.getInt32(0), loopEntry);
        counter.addIncoming(next, body);

        builder.positionAtEnd(exit);
        builder.createBr(successor);
        // phi, compare and the two loop branches
        return ops + 4;
    }

    private int insertFakeConditional(BasicBlock from, AllocaInst dummy) {
        Function function = from.getParent();
        BasicBlock test = function.createBlock("fake.test");
        BasicBlock thenBlock = function.createBlock("fake.then");
        BasicBlock elseBlock = function.createBlock("fake.else");
        BasicBlock merge = function.createBlock("fake.merge");
        BasicBlock successor = guard(from, test);

        IRBuilder builder = new IRBuilder(test);
        Value seen = builder.createVolatileLoad(IntegerType.I32, dummy, "fake.seen");
        Value cond = builder.createICmp(ICmpInst.Predicate.SLT, seen, IRBuilder.getInt32(0), "fake.cmp");
        builder.createCondBr(cond, thenBlock, elseBlock);

        int ops = random.nextIntInclusive(3, 10);
        builder.positionAtEnd(thenBlock);
        Value thenValue = IRBuilder.getInt32(42);
        for (int i = 0; i < ops; i++) {
            thenValue = builder.createAdd(thenValue, IRBuilder.getInt32(i), "fake.then.op");
        }
        builder.createVolatileStore(thenValue, dummy);
        builder.createBr(merge);

        builder.positionAtEnd(elseBlock);
        Value elseValue = IRBuilder.getInt32(24);
        for (int i = 0; i < ops; i++) {
            elseValue = builder.createMul(elseValue, IRBuilder.getInt32(i + 1), "fake.else.op");
        }
        builder.createVolatileStore(elseValue, dummy);
        builder.createBr(merge);

        builder.positionAtEnd(merge);
        builder.createBr(successor);
        // load, compare and three branches
        return 2 * ops + 5;
    }

    private int insertFakeBlock(BasicBlock from, AllocaInst dummy) {
        BasicBlock fake = from.getParent().createBlock("fake.block");
        BasicBlock successor = guard(from, fake);

        IRBuilder builder = new IRBuilder(fake);
        int ops = random.nextIntInclusive(5, MAX_FAKE_INSTRUCTIONS_PER_BLOCK);
        Value acc = emitArithmetic(builder, BLOCK_OPS, ops, "fake.op");
        builder.createVolatileStore(acc, dummy);
        builder.createBr(successor);
        // store and branch
        return ops + 2;
    }

    /**
     * Chains {@code count} operations on an i32 accumulator starting at 1. With
     * a null {@code name} each value is named after its opcode.
     */
    private Value emitArithmetic(IRBuilder builder, Opcode[] choices, int count, String name) {
        Value acc = IRBuilder.getInt32(1);
        for (int i = 0; i < count; i++) {
            Opcode op = choices[random.nextInt(choices.length)];
            Value operand = op == Opcode.SHL ? IRBuilder.getInt32(1) : IRBuilder.getInt32(i + 1);
            String valueName = name != null ? name : "fake." + op.getMnemonic();
            acc = builder.createBinary(op, acc, operand, valueName);
        }
        return acc;
    }
}
