package org.chakravyuha;

import org.chakravyuha.ir.IrInterpreter;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.IrPrinter;
import org.chakravyuha.ir.analysis.IrVerifier;
import org.chakravyuha.ir.parse.IrParser;
import org.chakravyuha.report.ObfuscationReport;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

public class ChakravyuhaObfuscatorTest {

    static final String PROGRAM = """
            source_filename = "program.c"
            target triple = "x86_64-pc-linux-gnu"

            @.str = private constant [6 x i8] c"hello\\00"

            declare i32 @puts(ptr)
            declare void @record(i32)
            declare void @may_throw()

            define i32 @sum(i32 %n) {
            entry:
              br label %header
            header:
              %i = phi i32 [ 0, %entry ], [ %next, %body ]
              %acc = phi i32 [ 0, %entry ], [ %acc.next, %body ]
              %done = icmp sge i32 %i, %n
              br i1 %done, label %exit, label %body
            body:
              %acc.next = add i32 %acc, %i
              %next = add i32 %i, 1
              br label %header
            exit:
              ret i32 %acc
            }

            define i32 @main(i32 %n) {
            entry:
              %p = call i32 @puts(ptr @.str)
              %s = call i32 @sum(i32 %n)
              call void @record(i32 %s)
              %big = icmp sgt i32 %s, 10
              br i1 %big, label %yes, label %no
            yes:
              %y = mul i32 %s, 2
              br label %out
            no:
              %z = add i32 %s, 100
              br label %out
            out:
              %r = phi i32 [ %y, %yes ], [ %z, %no ]
              ret i32 %r
            }

            define void @guarded() {
            entry:
              invoke void @may_throw() to label %ok unwind label %lpad
            ok:
              ret void
            lpad:
              %lp = landingpad { ptr, i32 } cleanup
              ret void
            }
            """;

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-04T05:06:07.890Z"), ZoneOffset.UTC);

    private static ObfuscatorConfig config(int cycles, long seed) {
        return ObfuscatorConfig.builder()
                .setLevel(ObfuscationLevel.HIGH)
                .setCycles(cycles)
                .setSeed(seed)
                .build();
    }

    @Test
    public void testMultiCycleRunPreservesBehaviour() throws Exception {
        IrModule original = IrParser.parse(PROGRAM, "program");
        IrModule module = IrParser.parse(PROGRAM, "program");

        new ChakravyuhaObfuscator(CLOCK).obfuscate(module, config(3, 42L));

        assertTrue(IrVerifier.verify(module).isEmpty(), IrVerifier.verify(module).toString());
        for (long n : new long[]{0, 3, 6, 10}) {
            IrInterpreter before = new IrInterpreter(original);
            IrInterpreter after = new IrInterpreter(module);
            assertEquals(before.call("main", n), after.call("main", n), "n = " + n);
            assertEquals(before.getOutput(), after.getOutput());
        }
        // the obfuscated text is still valid input
        IrModule reparsed = IrParser.parse(IrPrinter.print(module), "again");
        assertEquals(90L, new IrInterpreter(reparsed).call("main", 10));
    }

    @Test
    public void testReportFields() throws Exception {
        IrModule module = IrParser.parse(PROGRAM, "program");

        ObfuscationReport report = new ChakravyuhaObfuscator(CLOCK).obfuscate(module, config(3, 7L));

        assertEquals("2026-03-04T05:06:07Z", report.getTimestamp());
        assertEquals("program.c", report.getInputFile());
        assertEquals("obfuscated.ll", report.getOutputFile());
        assertEquals("high", report.getInputParameters().getObfuscationLevel());
        assertEquals("linux", report.getInputParameters().getTargetPlatform());
        assertEquals(3, report.getInputParameters().getRequestedCycles());

        ObfuscationReport.ObfuscationMetrics metrics = report.getObfuscationMetrics();
        assertEquals(3, metrics.getCyclesCompleted());
        assertEquals(7, metrics.getPassesRun().size());
        assertEquals(ChakravyuhaObfuscator.STRING_ENCRYPTION, metrics.getPassesRun().get(0));
        assertEquals(1, metrics.getStringEncryption().getCount());
        // sum, main and the decryption routine
        assertEquals(3, metrics.getControlFlowFlattening().getFlattenedFunctions());
        assertEquals(1, metrics.getControlFlowFlattening().getSkippedFunctions());
        assertTrue(metrics.getControlFlowFlattening().getFlattenedBlocks() > 0);
        assertTrue(metrics.getFakeCodeInsertion().getTotalBogusInstructions() > 0);

        assertEquals("5 bytes", report.getOutputAttributes().getOriginalIRStringDataSize());
        assertEquals("6 bytes", report.getOutputAttributes().getObfuscatedIRStringDataSize());
        assertTrue(report.getOutputAttributes().getObfuscationMethods().contains("Control Flow Flattening"));
    }

    @Test
    public void testSameSeedSameOutput() throws Exception {
        IrModule first = IrParser.parse(PROGRAM, "program");
        IrModule second = IrParser.parse(PROGRAM, "program");

        new ChakravyuhaObfuscator(CLOCK).obfuscate(first, config(2, 123L));
        new ChakravyuhaObfuscator(CLOCK).obfuscate(second, config(2, 123L));

        assertEquals(IrPrinter.print(first), IrPrinter.print(second));
    }

    @Test
    public void testDisabledPassesDoNotRun() throws Exception {
        IrModule module = IrParser.parse(PROGRAM, "program");
        ObfuscatorConfig config = ObfuscatorConfig.builder()
                .setSeed(1L)
                .setProtectionConfig(ProtectionConfig.flatteningOnly())
                .build();

        ObfuscationReport report = new ChakravyuhaObfuscator(CLOCK).obfuscate(module, config);

        assertNotNull(module.getGlobal(".str"));
        assertEquals("N/A", report.getObfuscationMetrics().getStringEncryption().getMethod());
        assertEquals(1, report.getObfuscationMetrics().getPassesRun().size());
        assertEquals(2, report.getObfuscationMetrics().getControlFlowFlattening().getFlattenedFunctions());
        assertEquals(0, report.getObfuscationMetrics().getFakeCodeInsertion().getFakeBlocks());
    }

    @Test
    public void testCycleBounds() {
        assertThrows(IllegalArgumentException.class, () -> ObfuscatorConfig.builder().setCycles(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> ObfuscatorConfig.builder().setCycles(ObfuscatorConfig.MAX_CYCLES + 1).build());
    }
}
