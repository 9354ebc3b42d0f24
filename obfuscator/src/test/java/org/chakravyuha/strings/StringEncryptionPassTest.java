package org.chakravyuha.strings;

import org.chakravyuha.FastRandom;
import org.chakravyuha.ir.ConstantString;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.GlobalVariable;
import org.chakravyuha.ir.IrInterpreter;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.analysis.IrVerifier;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class StringEncryptionPassTest {

    private static final String HELLO = """
            @.str = private constant [14 x i8] c"Hello, World!\\00"
            @.str.1 = private constant [4 x i8] c"bye\\00"
            @empty = private constant [1 x i8] c"\\00"
            @table = private constant [3 x i8] c"abc"

            declare i32 @puts(ptr)

            define i32 @main(i1 %loud) {
            entry:
              %a = call i32 @puts(ptr @.str)
              br i1 %loud, label %twice, label %done
            twice:
              %b = call i32 @puts(ptr @.str)
              br label %done
            done:
              %msg = phi ptr [ @.str.1, %twice ], [ @.str, %entry ]
              %c = call i32 @puts(ptr %msg)
              ret i32 0
            }
            """;

    @Test
    public void testOutputIsPreserved() throws Exception {
        IrModule original = IrParser.parse(HELLO, "hello");
        IrModule module = IrParser.parse(HELLO, "hello");

        new StringEncryptionPass(new FastRandom(42)).run(module);

        for (long loud : new long[]{0, 1}) {
            IrInterpreter before = new IrInterpreter(original);
            IrInterpreter after = new IrInterpreter(module);
            before.call("main", loud);
            after.call("main", loud);
            assertEquals(before.getOutput(), after.getOutput());
        }
        IrInterpreter interpreter = new IrInterpreter(module);
        interpreter.call("main", 1);
        assertEquals("Hello, World!\nHello, World!\nbye\n", interpreter.getOutput());
        assertTrue(IrVerifier.verify(module).isEmpty(), IrVerifier.verify(module).toString());
    }

    @Test
    public void testPlainGlobalsAreReplaced() throws Exception {
        IrModule module = IrParser.parse(HELLO, "hello");

        StringEncryptionStats stats = new StringEncryptionPass(new FastRandom(7)).run(module);

        assertEquals(2, stats.getCount());
        assertEquals(13 + 3, stats.getOriginalBytes());
        assertEquals(14 + 4, stats.getEncryptedBytes());
        assertTrue(stats.getKey() >= 1 && stats.getKey() <= 255);
        assertEquals(StringEncryptionStats.METHOD, stats.getMethod());

        assertNull(module.getGlobal(".str"));
        assertNull(module.getGlobal(".str.1"));
        assertNotNull(module.getGlobal("empty"));
        assertNotNull(module.getGlobal("table"));

        GlobalVariable enc = module.getGlobal(".str.enc");
        assertNotNull(enc);
        assertTrue(enc.isConstant());
        byte[] cipher = ((ConstantString) enc.getInitializer()).getData();
        byte[] plain = "Hello, World!\0".getBytes(StandardCharsets.US_ASCII);
        assertArrayEquals(StringEncryptionPass.encrypt(plain, stats.getKey()), cipher);
        assertArrayEquals(plain, StringEncryptionPass.encrypt(cipher, stats.getKey()));

        Function decrypt = module.getFunction(StringEncryptionPass.DECRYPT_FUNCTION_NAME);
        assertNotNull(decrypt);
        assertFalse(decrypt.isDeclaration());
        assertEquals(3, decrypt.getArguments().size());
    }

    @Test
    public void testSecondRunGetsItsOwnDecryptFunction() throws Exception {
        IrModule module = IrParser.parse(HELLO, "hello");
        new StringEncryptionPass(new FastRandom(1)).run(module);
        module.addGlobal(new GlobalVariable("late", ConstantString.ofCString("late").getType(),
                ConstantString.ofCString("late"), true, true));

        StringEncryptionStats second = new StringEncryptionPass(new FastRandom(2)).run(module);

        assertEquals(1, second.getCount());
        long stubs = module.getFunctions().stream()
                .filter(f -> f.getName().startsWith(StringEncryptionPass.DECRYPT_FUNCTION_NAME))
                .count();
        assertEquals(2, stubs);
    }

    @Test
    public void testNothingToEncrypt() throws Exception {
        IrModule module = IrParser.parse("""
                define i32 @main() {
                entry:
                  ret i32 0
                }
                """, "plain");

        StringEncryptionStats stats = new StringEncryptionPass(new FastRandom(3)).run(module);

        assertEquals(0, stats.getCount());
        assertNull(module.getFunction(StringEncryptionPass.DECRYPT_FUNCTION_NAME));
    }

    @Test
    public void testEncryptableFilter() {
        assertTrue(StringEncryptionPass.isEncryptable(new GlobalVariable("s",
                ConstantString.ofCString("x").getType(), ConstantString.ofCString("x"), true, true)));
        assertFalse(StringEncryptionPass.isEncryptable(new GlobalVariable("m",
                ConstantString.ofCString("x").getType(), ConstantString.ofCString("x"), false, true)));
        assertFalse(StringEncryptionPass.isEncryptable(new GlobalVariable("e",
                ConstantString.ofCString("").getType(), ConstantString.ofCString(""), true, true)));
    }
}
