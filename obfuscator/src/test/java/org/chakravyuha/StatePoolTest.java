package org.chakravyuha;

import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class StatePoolTest {

    private static Function function() throws Exception {
        return IrParser.parse("""
                define void @f() {
                entry:
                  br label %a
                a:
                  br label %b
                b:
                  br label %c
                c:
                  ret void
                }
                """, "test").getFunction("f");
    }

    @Test
    public void testSequentialStates() throws Exception {
        Function f = function();
        StatePool pool = StatePool.sequential();

        assertFalse(pool.isScrambled());
        assertEquals(1, pool.getState(f.getBlocks().get(1)));
        assertEquals(2, pool.getState(f.getBlocks().get(2)));
        assertEquals(1, pool.getState(f.getBlocks().get(1)));
        assertEquals(3, pool.getState(f.getBlocks().get(3)));
    }

    private static Function chain(int blocks) throws Exception {
        StringBuilder text = new StringBuilder("define void @chain() {\nentry:\n  br label %b0\n");
        for (int i = 0; i < blocks - 1; i++) {
            text.append("b").append(i).append(":\n  br label %b").append(i + 1).append('\n');
        }
        text.append("b").append(blocks - 1).append(":\n  ret void\n}\n");
        return IrParser.parse(text.toString(), "test").getFunction("chain");
    }

    @Test
    public void testScrambledStatesArePositiveAndUnique() throws Exception {
        Function f = chain(500);
        StatePool pool = StatePool.scrambled(77);
        Set<Integer> seen = new HashSet<>();
        for (BasicBlock bb : f.getBlocks()) {
            int state = pool.getState(bb);
            assertTrue(state > 0);
            assertTrue(seen.add(state));
        }
        assertEquals(501, seen.size());
    }

    @Test
    public void testScrambledFactoryIsStablePerFunction() throws Exception {
        Function f = function();
        StatePool.Factory factory = StatePool.scrambledFactory(2024);
        BasicBlock a = f.getBlocks().get(1);

        assertEquals(factory.create(f).getState(a), factory.create(f).getState(a));
        assertTrue(factory.create(f).isScrambled());
    }
}
