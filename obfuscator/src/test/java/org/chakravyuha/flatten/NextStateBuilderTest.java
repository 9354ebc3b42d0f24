package org.chakravyuha.flatten;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.ConstantInt;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IRBuilder;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.SelectInst;
import org.chakravyuha.ir.inst.TerminatorInst;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NextStateBuilderTest {

    private static final String SOURCE = """
            define i32 @f(i32 %v, i1 %c) {
            entry:
              br label %branchy
            branchy:
              br i1 %c, label %sw, label %out
            sw:
              switch i32 %v, label %out [
                i32 4, label %a
                i32 9, label %b
              ]
            a:
              ret i32 1
            b:
              ret i32 2
            out:
              ret i32 3
            }
            """;

    private static Function parse() throws Exception {
        return IrParser.parse(SOURCE, "test").getFunction("f");
    }

    private static Map<BasicBlock, Integer> ids(Function f, String... names) {
        Map<BasicBlock, Integer> ids = new LinkedHashMap<>();
        int state = 10;
        for (String name : names) {
            ids.put(ControlFlowFlattenerTest.block(f, name), state);
            state += 10;
        }
        return ids;
    }

    private static int countSelects(BasicBlock block) {
        int selects = 0;
        for (Instruction inst : block.getInstructions()) {
            if (inst instanceof SelectInst) {
                selects++;
            }
        }
        return selects;
    }

    @Test
    public void testUnconditionalBranchIsConstant() throws Exception {
        Function f = parse();
        NextStateBuilder builder = new NextStateBuilder(ids(f, "branchy", "sw", "a", "b", "out"));
        TerminatorInst term = f.getEntryBlock().getTerminator();
        IRBuilder ir = new IRBuilder();
        ir.positionBefore(term);

        Value state = builder.build(term, ir);

        assertTrue(state instanceof ConstantInt);
        assertEquals(10, ((ConstantInt) state).getValue());
        assertEquals(1, f.getEntryBlock().size());
    }

    @Test
    public void testConditionalBranchNeedsBothTargets() throws Exception {
        Function f = parse();
        BasicBlock branchy = ControlFlowFlattenerTest.block(f, "branchy");
        TerminatorInst term = branchy.getTerminator();

        assertFalse(new NextStateBuilder(ids(f, "branchy", "sw")).isExpressible(term));
        IRBuilder ir = new IRBuilder();
        ir.positionBefore(term);
        assertNull(new NextStateBuilder(ids(f, "branchy", "sw")).build(term, ir));
        assertEquals(1, branchy.size());

        Value state = new NextStateBuilder(ids(f, "branchy", "sw", "out")).build(term, ir);
        assertTrue(state instanceof SelectInst);
        SelectInst select = (SelectInst) state;
        assertEquals(20, ((ConstantInt) select.getTrueValue()).getValue());
        assertEquals(30, ((ConstantInt) select.getFalseValue()).getValue());
    }

    @Test
    public void testStrictSwitchFold() throws Exception {
        Function f = parse();
        BasicBlock sw = ControlFlowFlattenerTest.block(f, "sw");
        TerminatorInst term = sw.getTerminator();

        assertFalse(new NextStateBuilder(ids(f, "a", "b")).isExpressible(term));

        NextStateBuilder builder = new NextStateBuilder(ids(f, "a", "b", "out"));
        IRBuilder ir = new IRBuilder();
        ir.positionBefore(term);
        Value state = builder.build(term, ir);

        assertEquals(2, countSelects(sw));
        // the last case is folded last, so it sits at the top of the chain
        SelectInst top = (SelectInst) state;
        assertEquals(20, ((ConstantInt) top.getTrueValue()).getValue());
        SelectInst inner = (SelectInst) top.getFalseValue();
        assertEquals(10, ((ConstantInt) inner.getTrueValue()).getValue());
        assertEquals(30, ((ConstantInt) inner.getFalseValue()).getValue());
    }

    @Test
    public void testDefaultStateMode() throws Exception {
        Function f = parse();
        BasicBlock sw = ControlFlowFlattenerTest.block(f, "sw");
        TerminatorInst term = sw.getTerminator();
        NextStateBuilder builder = NextStateBuilder.withDefaultState(ids(f, "b"), 77);

        assertTrue(builder.isExpressible(term));
        IRBuilder ir = new IRBuilder();
        ir.positionBefore(term);
        SelectInst state = (SelectInst) builder.build(term, ir);

        assertEquals(1, countSelects(sw));
        assertEquals(10, ((ConstantInt) state.getTrueValue()).getValue());
        assertEquals(77, ((ConstantInt) state.getFalseValue()).getValue());

        assertFalse(NextStateBuilder.withDefaultState(ids(f, "branchy"), 77).isExpressible(term));
    }

    @Test
    public void testReturnHasNoState() throws Exception {
        Function f = parse();
        TerminatorInst ret = ControlFlowFlattenerTest.block(f, "a").getTerminator();
        assertFalse(new NextStateBuilder(ids(f, "a", "b", "out")).isExpressible(ret));
        assertFalse(NextStateBuilder.withDefaultState(ids(f, "a"), 1).isExpressible(ret));
    }
}
