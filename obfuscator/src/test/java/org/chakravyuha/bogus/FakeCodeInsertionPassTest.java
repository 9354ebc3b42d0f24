package org.chakravyuha.bogus;

import org.chakravyuha.FastRandom;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IrInterpreter;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.analysis.IrVerifier;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FakeCodeInsertionPassTest {

    private static final String CHAIN = """
            declare void @record(i32)

            define i32 @chain(i32 %n) {
            entry:
              %a = add i32 %n, 1
              br label %b1
            b1:
              call void @record(i32 %a)
              br label %b2
            b2:
              %b = mul i32 %a, 3
              br label %b3
            b3:
              call void @record(i32 %b)
              br label %b4
            b4:
              %c = sub i32 %b, %n
              br label %b5
            b5:
              br label %b6
            b6:
              ret i32 %c
            }
            """;

    @Test
    public void testBehaviourIsPreserved() throws Exception {
        IrModule original = IrParser.parse(CHAIN, "chain");
        for (long seed = 0; seed < 8; seed++) {
            IrModule module = IrParser.parse(CHAIN, "chain");
            FakeCodeStats stats = new FakeCodeInsertionPass(new FastRandom(seed), 5, 8, 10).run(module);

            assertFalse(stats.isEmpty());
            assertTrue(IrVerifier.verify(module).isEmpty(), IrVerifier.verify(module).toString());
            for (long n : new long[]{0, 3, -7}) {
                IrInterpreter before = new IrInterpreter(original);
                IrInterpreter after = new IrInterpreter(module);
                assertEquals(before.call("chain", n), after.call("chain", n));
                assertEquals(before.getOutput(), after.getOutput());
            }
        }
    }

    @Test
    public void testCountsRespectLimits() throws Exception {
        IrModule module = IrParser.parse(CHAIN, "chain");
        Function f = module.getFunction("chain");
        int candidates = FakeCodeInsertionPass.collectCandidates(f).size();
        int blocksBefore = f.size();

        FakeCodeStats stats = new FakeCodeInsertionPass(new FastRandom(11), 1, 2, 3).insertInto(f);

        assertEquals(6, candidates);
        assertTrue(stats.getFakeLoops() <= 1);
        assertTrue(stats.getFakeConditionals() <= 2);
        assertTrue(stats.getFakeBlocks() >= 1 && stats.getFakeBlocks() <= 3);
        int expectedBlocks = blocksBefore + 4 * stats.getFakeLoops() + 4 * stats.getFakeConditionals()
                + stats.getFakeBlocks();
        assertEquals(expectedBlocks, f.size());
        assertTrue(stats.getBogusInstructions() > 0);
        assertEquals(FakeCodeInsertionPass.DUMMY_SLOT_NAME, f.getEntryBlock().getFirstInstruction().getName());
    }

    @Test
    public void testZeroLimitsInsertNothing() throws Exception {
        IrModule module = IrParser.parse(CHAIN, "chain");
        Function f = module.getFunction("chain");

        FakeCodeStats stats = new FakeCodeInsertionPass(new FastRandom(5), 0, 0, 0).run(module);

        assertTrue(stats.isEmpty());
        assertEquals(7, f.size());
    }

    @Test
    public void testEntryIsNeverAFakeTarget() throws Exception {
        IrModule module = IrParser.parse(CHAIN, "chain");
        Function f = module.getFunction("chain");
        BasicBlock entry = f.getEntryBlock();

        new FakeCodeInsertionPass(new FastRandom(99), 5, 8, 10).run(module);

        assertSame(entry, f.getEntryBlock());
        assertTrue(entry.getPredecessors().isEmpty());
    }

    @Test
    public void testPhiSuccessorsAreNotCandidates() throws Exception {
        IrModule module = IrParser.parse("""
                define i32 @f(i1 %c) {
                entry:
                  br i1 %c, label %l, label %r
                l:
                  br label %m
                r:
                  br label %m
                m:
                  %p = phi i32 [ 1, %l ], [ 2, %r ]
                  ret i32 %p
                }
                """, "phi");
        Function f = module.getFunction("f");

        List<BasicBlock> candidates = FakeCodeInsertionPass.collectCandidates(f);

        assertTrue(candidates.isEmpty());
        assertTrue(new FakeCodeInsertionPass(new FastRandom(1), 5, 8, 10).run(module).isEmpty());
        assertEquals(4, f.size());
    }

    @Test
    public void testNegativeLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FakeCodeInsertionPass(new FastRandom(1), -1, 0, 0));
    }
}
