package org.chakravyuha.flatten;

import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ControlFlowFlatteningPassTest {

    @Test
    public void testSummaryCountsFlattenedAndSkippedFunctions() throws Exception {
        IrModule module = IrParser.parse("""
                declare i32 @external(i32)

                define i32 @single(i32 %a) {
                entry:
                  ret i32 %a
                }

                define i32 @branchy(i1 %c) {
                entry:
                  br i1 %c, label %a, label %b
                a:
                  ret i32 1
                b:
                  ret i32 2
                }
                """, "test");

        FlatteningSummary summary = new ControlFlowFlatteningPass(FlatteningOptions.defaults()).run(module);

        assertEquals(1, summary.getFlattenedFunctions());
        assertEquals(2, summary.getFlattenedBlocks());
        assertEquals(1, summary.getSkippedFunctions());
        assertEquals(SkipReason.DECLARATION, summary.getResult("external").getSkipReason().orElse(null));
        assertEquals(SkipReason.TOO_SMALL, summary.getResult("single").getSkipReason().orElse(null));
        assertTrue(summary.getResult("branchy").isModified());
    }

    @Test
    public void testSecondRunFindsEverythingFlattened() throws Exception {
        IrModule module = IrParser.parse("""
                define i32 @branchy(i1 %c) {
                entry:
                  br i1 %c, label %a, label %b
                a:
                  ret i32 1
                b:
                  ret i32 2
                }
                """, "test");
        ControlFlowFlatteningPass pass = new ControlFlowFlatteningPass(FlatteningOptions.defaults());
        pass.run(module);

        FlatteningSummary second = pass.run(module);

        assertEquals(0, second.getFlattenedFunctions());
        assertEquals(SkipReason.ALREADY_FLATTENED, second.getResult("branchy").getSkipReason().orElse(null));
    }
}
