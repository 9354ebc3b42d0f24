package org.chakravyuha.flatten;

import org.chakravyuha.StatePool;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IrPrinter;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class StateDispatchBuilderTest {

    private static Function parse(String text) throws Exception {
        return IrParser.parse(text, "test").getFunction("f");
    }

    @Test
    public void testAssignIdentifiersSkipsEntryAndHonoursPolicy() throws Exception {
        Function f = parse("""
                define i32 @f(i1 %c) {
                entry:
                  br i1 %c, label %work, label %done
                work:
                  %x = add i32 1, 2
                  ret i32 %x
                done:
                  ret i32 0
                }
                """);

        Map<BasicBlock, Integer> all = StateDispatchBuilder.assignIdentifiers(f, TrivialBlockPolicy.INCLUDE,
                StatePool.sequential());
        assertEquals(2, all.size());
        assertFalse(all.containsKey(f.getEntryBlock()));
        assertEquals(1, all.get(ControlFlowFlattenerTest.block(f, "work")));
        assertEquals(2, all.get(ControlFlowFlattenerTest.block(f, "done")));

        Map<BasicBlock, Integer> some = StateDispatchBuilder.assignIdentifiers(f, TrivialBlockPolicy.EXCLUDE,
                StatePool.sequential());
        assertEquals(1, some.size());
        assertTrue(some.containsKey(ControlFlowFlattenerTest.block(f, "work")));
    }

    @Test
    public void testBuildRedirectsEntryToDispatcher() throws Exception {
        Function f = parse("""
                define i32 @f(i1 %c) {
                entry:
                  br i1 %c, label %work, label %done
                work:
                  ret i32 1
                done:
                  ret i32 0
                }
                """);
        Map<BasicBlock, Integer> ids = StateDispatchBuilder.assignIdentifiers(f, TrivialBlockPolicy.INCLUDE,
                StatePool.sequential());

        Optional<StateDispatchBuilder.StateDispatch> dispatch = new StateDispatchBuilder().build(f, ids);

        assertTrue(dispatch.isPresent());
        BasicBlock dispatcher = dispatch.get().getDispatcher();
        assertEquals(StateDispatchBuilder.DISPATCH_BLOCK_NAME, dispatcher.getName());
        assertEquals(1, f.getEntryBlock().getSuccessors().size());
        assertTrue(f.getEntryBlock().getSuccessors().contains(dispatcher));
        assertEquals(StateDispatchBuilder.STATE_SLOT_NAME, dispatch.get().getStateSlot().getName());
    }

    @Test
    public void testAbortRemovesEverything() throws Exception {
        Function f = parse("""
                define i32 @f(i1 %c) {
                entry:
                  br i1 %c, label %work, label %done
                work:
                  %x = add i32 1, 2
                  ret i32 %x
                done:
                  ret i32 0
                }
                """);
        String before = IrPrinter.print(f);
        int blocks = f.size();
        Map<BasicBlock, Integer> ids = StateDispatchBuilder.assignIdentifiers(f, TrivialBlockPolicy.EXCLUDE,
                StatePool.sequential());

        Optional<StateDispatchBuilder.StateDispatch> dispatch = new StateDispatchBuilder().build(f, ids);

        assertFalse(dispatch.isPresent());
        assertEquals(blocks, f.size());
        assertEquals(before, IrPrinter.print(f));
    }
}
