package org.chakravyuha;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.chakravyuha.ir.IrInterpreter;
import org.chakravyuha.ir.parse.IrParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    private static Path writeInput(Path dir, String text) throws Exception {
        Path input = dir.resolve("program.ll");
        Files.write(input, text.getBytes(StandardCharsets.UTF_8));
        return input;
    }

    @Test
    public void testWritesOutputAndReport(@TempDir Path dir) throws Exception {
        Path input = writeInput(dir, ChakravyuhaObfuscatorTest.PROGRAM);
        Path output = dir.resolve("out").resolve("program.obf.ll");
        Path report = dir.resolve("report.json");

        int exitCode = Main.createCommandLine().execute(input.toString(),
                "-o", output.toString(), "--report", report.toString(),
                "--level", "LOW", "--cycles", "2", "--seed", "11");

        assertEquals(0, exitCode);
        String obfuscated = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertEquals(90L, new IrInterpreter(IrParser.parse(obfuscated, "out")).call("main", 10));

        JsonObject json = JsonParser.parseString(new String(Files.readAllBytes(report), StandardCharsets.UTF_8))
                .getAsJsonObject();
        assertEquals(input.toString(), json.get("inputFile").getAsString());
        assertEquals(output.toString(), json.get("outputFile").getAsString());
        assertEquals("low", json.getAsJsonObject("inputParameters").get("obfuscationLevel").getAsString());
        assertEquals(2, json.getAsJsonObject("obfuscationMetrics").get("cyclesCompleted").getAsInt());
    }

    @Test
    public void testPrintsToStandardOutputWithoutOutputOption(@TempDir Path dir) throws Exception {
        Path input = writeInput(dir, ChakravyuhaObfuscatorTest.PROGRAM);
        CommandLine commandLine = Main.createCommandLine();
        StringWriter out = new StringWriter();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute(input.toString(), "--no-string-encryption", "--no-fake-code", "--seed", "3");

        assertEquals(0, exitCode);
        String text = out.toString();
        assertTrue(text.contains("cff.dispatch"));
        assertTrue(text.contains("c\"hello\\00\""));
    }

    @Test
    public void testMalformedInputFails(@TempDir Path dir) throws Exception {
        Path input = writeInput(dir, """
                define i32 @broken() {
                entry:
                  %a = add i32 %nowhere, 1
                  ret i32 %a
                }
                """);

        assertEquals(1, Main.createCommandLine().execute(input.toString(), "-o", dir.resolve("x.ll").toString()));
        assertFalse(Files.exists(dir.resolve("x.ll")));
    }

    @Test
    public void testMissingInputFails(@TempDir Path dir) {
        assertEquals(1, Main.createCommandLine().execute(dir.resolve("absent.ll").toString()));
    }

    @Test
    public void testInvalidOptionsAreUsageErrors(@TempDir Path dir) throws Exception {
        Path input = writeInput(dir, ChakravyuhaObfuscatorTest.PROGRAM);
        assertEquals(2, quietCommandLine().execute(input.toString(), "--cycles", "0"));
        assertEquals(2, quietCommandLine().execute(input.toString(), "--level", "extreme"));
    }

    private static CommandLine quietCommandLine() {
        CommandLine commandLine = Main.createCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));
        return commandLine;
    }
}
