package org.chakravyuha.ir.analysis;

import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class IrVerifierTest {

    private static Function parse(String text) throws Exception {
        return IrParser.parse(text, "test").getFunction("f");
    }

    @Test
    public void testValidFunctionPasses() throws Exception {
        Function f = parse("""
                define i32 @f(i1 %c) {
                entry:
                  %a = add i32 1, 2
                  br i1 %c, label %l, label %r
                l:
                  br label %m
                r:
                  br label %m
                m:
                  %p = phi i32 [ %a, %l ], [ 0, %r ]
                  ret i32 %p
                }
                """);
        assertTrue(IrVerifier.verify(f).isEmpty(), IrVerifier.verify(f).toString());
        IrVerifier.verifyOrThrow(f);
    }

    @Test
    public void testPhiIncomingMismatch() throws Exception {
        Function f = parse("""
                define i32 @f(i1 %c) {
                entry:
                  br i1 %c, label %l, label %r
                l:
                  br label %m
                r:
                  br label %m
                m:
                  %p = phi i32 [ 1, %l ]
                  ret i32 %p
                }
                """);
        List<String> problems = IrVerifier.verify(f);
        assertEquals(1, problems.size(), problems.toString());
        assertTrue(problems.get(0).contains("do not match the predecessors"));
    }

    @Test
    public void testUseNotDominatedByDefinition() throws Exception {
        Function f = parse("""
                define i32 @f(i1 %c) {
                entry:
                  br i1 %c, label %l, label %r
                l:
                  %x = add i32 1, 2
                  br label %m
                r:
                  br label %m
                m:
                  %y = add i32 %x, 1
                  ret i32 %y
                }
                """);
        List<String> problems = IrVerifier.verify(f);
        assertEquals(1, problems.size(), problems.toString());
        assertTrue(problems.get(0).contains("does not dominate"));

        IrVerificationException e = assertThrows(IrVerificationException.class, () -> IrVerifier.verifyOrThrow(f));
        assertEquals(problems, e.getDiagnostics());
    }
}
