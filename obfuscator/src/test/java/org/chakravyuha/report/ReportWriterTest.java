package org.chakravyuha.report;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ReportWriterTest {

    private static ObfuscationReport sampleReport() {
        return new ObfuscationReport("2026-01-02T03:04:05Z", "in.ll", "out.ll",
                new ObfuscationReport.InputParameters("high", "linux", 2, true, true, false),
                new ObfuscationReport.OutputAttributes(2048, 3072, 13, 14, 0.25,
                        Arrays.asList("String Encryption (XOR)", "Control Flow Flattening")),
                new ObfuscationReport.ObfuscationMetrics(2,
                        Arrays.asList("StringEncryption", "ControlFlowFlattening"),
                        new ObfuscationReport.StringEncryption(1, null),
                        new ObfuscationReport.ControlFlowFlattening(3, 17, 1),
                        new ObfuscationReport.FakeCodeInsertion(0, 0, 0, 0)));
    }

    @Test
    public void testJsonHasNestedSections() {
        String json = new ReportWriter().toJson(sampleReport());
        JsonObject root = JsonParser.parseString(json).getAsJsonObject();

        assertEquals("2026-01-02T03:04:05Z", root.get("timestamp").getAsString());
        assertEquals("in.ll", root.get("inputFile").getAsString());

        JsonObject input = root.getAsJsonObject("inputParameters");
        assertEquals("high", input.get("obfuscationLevel").getAsString());
        assertEquals(2, input.get("requestedCycles").getAsInt());
        assertFalse(input.get("enableFakeCodeInsertion").getAsBoolean());

        JsonObject output = root.getAsJsonObject("outputAttributes");
        assertEquals("2.00 KB", output.get("originalIRSize").getAsString());
        assertEquals("3.00 KB", output.get("obfuscatedIRSize").getAsString());
        assertEquals("50.00%", output.get("irSizeIncrease").getAsString());
        assertEquals("13 bytes", output.get("originalIRStringDataSize").getAsString());
        assertEquals(2, output.getAsJsonArray("obfuscationMethods").size());

        JsonObject metrics = root.getAsJsonObject("obfuscationMetrics");
        assertEquals(2, metrics.get("cyclesCompleted").getAsInt());
        assertEquals("N/A", metrics.getAsJsonObject("stringEncryption").get("method").getAsString());
        JsonObject cff = metrics.getAsJsonObject("controlFlowFlattening");
        assertEquals(3, cff.get("flattenedFunctions").getAsInt());
        assertEquals(17, cff.get("flattenedBlocks").getAsInt());
        assertEquals(1, cff.get("skippedFunctions").getAsInt());
        assertEquals(0, metrics.getAsJsonObject("fakeCodeInsertion").get("totalBogusInstructions").getAsInt());
    }

    @Test
    public void testWriteCreatesParentDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("reports").resolve("run.json");

        new ReportWriter().write(sampleReport(), target);

        String text = new String(Files.readAllBytes(target), StandardCharsets.UTF_8);
        assertTrue(text.contains("\"flattenedBlocks\": 17"));
        assertTrue(JsonParser.parseString(text).isJsonObject());
    }

    @Test
    public void testFormatting() {
        assertEquals("0 B", ObfuscationReport.formatBytes(0));
        assertEquals("512.00 B", ObfuscationReport.formatBytes(512));
        assertEquals("1.50 KB", ObfuscationReport.formatBytes(1536));
        assertEquals("1.00 MB", ObfuscationReport.formatBytes(1024 * 1024));
        assertEquals("7.69%", ObfuscationReport.formatPercentage(ObfuscationReport.percentChange(13, 14)));
        assertEquals(0.0, ObfuscationReport.percentChange(0, 100));
        assertEquals(-50.0, ObfuscationReport.percentChange(10, 5));
    }

    @Test
    public void testPlatformOf() {
        assertEquals("windows", ObfuscationReport.platformOf("x86_64-pc-windows-msvc"));
        assertEquals("windows", ObfuscationReport.platformOf("x86_64-w64-mingw32"));
        assertEquals("linux", ObfuscationReport.platformOf("x86_64-pc-linux-gnu"));
        assertEquals("linux", ObfuscationReport.platformOf(null));
    }
}
