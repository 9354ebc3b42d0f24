package org.chakravyuha.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Summary of one obfuscation run. The field names are the JSON keys written by
 * {@link ReportWriter}.
 */
public final class ObfuscationReport {

    private final String timestamp;
    private final String inputFile;
    private final String outputFile;
    private final InputParameters inputParameters;
    private final OutputAttributes outputAttributes;
    private final ObfuscationMetrics obfuscationMetrics;

    public ObfuscationReport(String timestamp, String inputFile, String outputFile, InputParameters inputParameters,
                             OutputAttributes outputAttributes, ObfuscationMetrics obfuscationMetrics) {
        this.timestamp = timestamp;
        this.inputFile = inputFile;
        this.outputFile = outputFile;
        this.inputParameters = inputParameters;
        this.outputAttributes = outputAttributes;
        this.obfuscationMetrics = obfuscationMetrics;
    }

    public String getTimestamp() { return timestamp; }
    public String getInputFile() { return inputFile; }
    public String getOutputFile() { return outputFile; }
    public InputParameters getInputParameters() { return inputParameters; }
    public OutputAttributes getOutputAttributes() { return outputAttributes; }
    public ObfuscationMetrics getObfuscationMetrics() { return obfuscationMetrics; }

    /**
     * @return {@code "0 B"}, {@code "512.00 B"}, {@code "1.23 KB"} and so on, up to GB
     */
    public static String formatBytes(long bytes) {
        if (bytes == 0) {
            return "0 B";
        }
        String[] units = {"B", "KB", "MB", "GB"};
        int unit = 0;
        double size = bytes;
        while (size >= 1024.0 && unit < units.length - 1) {
            size /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, units[unit]);
    }

    public static String formatPercentage(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value);
    }

    /**
     * @return the growth from {@code before} to {@code after} in percent, 0 if {@code before} is 0
     */
    public static double percentChange(long before, long after) {
        if (before == 0) {
            return 0.0;
        }
        return (double) (after - before) / (double) before * 100.0;
    }

    /**
     * @return {@code windows} if the target triple names Windows, otherwise {@code linux}
     */
    public static String platformOf(String targetTriple) {
        if (targetTriple == null) {
            return "linux";
        }
        String triple = targetTriple.toLowerCase(Locale.ROOT);
        return triple.contains("windows") || triple.contains("win32") || triple.contains("mingw")
                ? "windows" : "linux";
    }

    public static final class InputParameters {
        private final String obfuscationLevel;
        private final String targetPlatform;
        private final int requestedCycles;
        private final boolean enableStringEncryption;
        private final boolean enableControlFlowFlattening;
        private final boolean enableFakeCodeInsertion;

        public InputParameters(String obfuscationLevel, String targetPlatform, int requestedCycles,
                               boolean enableStringEncryption, boolean enableControlFlowFlattening,
                               boolean enableFakeCodeInsertion) {
            this.obfuscationLevel = obfuscationLevel;
            this.targetPlatform = targetPlatform;
            this.requestedCycles = requestedCycles;
            this.enableStringEncryption = enableStringEncryption;
            this.enableControlFlowFlattening = enableControlFlowFlattening;
            this.enableFakeCodeInsertion = enableFakeCodeInsertion;
        }

        public String getObfuscationLevel() { return obfuscationLevel; }
        public String getTargetPlatform() { return targetPlatform; }
        public int getRequestedCycles() { return requestedCycles; }
        public boolean isEnableStringEncryption() { return enableStringEncryption; }
        public boolean isEnableControlFlowFlattening() { return enableControlFlowFlattening; }
        public boolean isEnableFakeCodeInsertion() { return enableFakeCodeInsertion; }
    }

    public static final class OutputAttributes {
        private final String originalIRSize;
        private final String obfuscatedIRSize;
        private final String irSizeIncrease;
        private final String originalIRStringDataSize;
        private final String obfuscatedIRStringDataSize;
        private final String stringDataSizeChange;
        private final double compilationTimeSeconds;
        private final List<String> obfuscationMethods;

        public OutputAttributes(long originalIRSize, long obfuscatedIRSize, long originalStringData,
                                long obfuscatedStringData, double compilationTimeSeconds,
                                List<String> obfuscationMethods) {
            this.originalIRSize = formatBytes(originalIRSize);
            this.obfuscatedIRSize = formatBytes(obfuscatedIRSize);
            this.irSizeIncrease = formatPercentage(percentChange(originalIRSize, obfuscatedIRSize));
            this.originalIRStringDataSize = originalStringData + " bytes";
            this.obfuscatedIRStringDataSize = obfuscatedStringData + " bytes";
            this.stringDataSizeChange = formatPercentage(percentChange(originalStringData, obfuscatedStringData));
            this.compilationTimeSeconds = compilationTimeSeconds;
            this.obfuscationMethods = new ArrayList<>(obfuscationMethods);
        }

        public String getOriginalIRSize() { return originalIRSize; }
        public String getObfuscatedIRSize() { return obfuscatedIRSize; }
        public String getIrSizeIncrease() { return irSizeIncrease; }
        public String getOriginalIRStringDataSize() { return originalIRStringDataSize; }
        public String getObfuscatedIRStringDataSize() { return obfuscatedIRStringDataSize; }
        public String getStringDataSizeChange() { return stringDataSizeChange; }
        public double getCompilationTimeSeconds() { return compilationTimeSeconds; }
        public List<String> getObfuscationMethods() { return Collections.unmodifiableList(obfuscationMethods); }
    }

    public static final class ObfuscationMetrics {
        private final int cyclesCompleted;
        private final List<String> passesRun;
        private final StringEncryption stringEncryption;
        private final ControlFlowFlattening controlFlowFlattening;
        private final FakeCodeInsertion fakeCodeInsertion;

        public ObfuscationMetrics(int cyclesCompleted, List<String> passesRun, StringEncryption stringEncryption,
                                  ControlFlowFlattening controlFlowFlattening, FakeCodeInsertion fakeCodeInsertion) {
            this.cyclesCompleted = cyclesCompleted;
            this.passesRun = new ArrayList<>(passesRun);
            this.stringEncryption = stringEncryption;
            this.controlFlowFlattening = controlFlowFlattening;
            this.fakeCodeInsertion = fakeCodeInsertion;
        }

        public int getCyclesCompleted() { return cyclesCompleted; }
        public List<String> getPassesRun() { return Collections.unmodifiableList(passesRun); }
        public StringEncryption getStringEncryption() { return stringEncryption; }
        public ControlFlowFlattening getControlFlowFlattening() { return controlFlowFlattening; }
        public FakeCodeInsertion getFakeCodeInsertion() { return fakeCodeInsertion; }
    }

    public static final class StringEncryption {
        private final int count;
        private final String method;

        public StringEncryption(int count, String method) {
            this.count = count;
            this.method = method == null || method.isEmpty() ? "N/A" : method;
        }

        public int getCount() { return count; }
        public String getMethod() { return method; }
    }

    public static final class ControlFlowFlattening {
        private final int flattenedFunctions;
        private final int flattenedBlocks;
        private final int skippedFunctions;

        public ControlFlowFlattening(int flattenedFunctions, int flattenedBlocks, int skippedFunctions) {
            this.flattenedFunctions = flattenedFunctions;
            this.flattenedBlocks = flattenedBlocks;
            this.skippedFunctions = skippedFunctions;
        }

        public int getFlattenedFunctions() { return flattenedFunctions; }
        public int getFlattenedBlocks() { return flattenedBlocks; }
        public int getSkippedFunctions() { return skippedFunctions; }
    }

    public static final class FakeCodeInsertion {
        private final int totalBogusInstructions;
        private final int fakeBlocks;
        private final int fakeLoops;
        private final int fakeConditionals;

        public FakeCodeInsertion(int totalBogusInstructions, int fakeBlocks, int fakeLoops, int fakeConditionals) {
            this.totalBogusInstructions = totalBogusInstructions;
            this.fakeBlocks = fakeBlocks;
            this.fakeLoops = fakeLoops;
            this.fakeConditionals = fakeConditionals;
        }

        public int getTotalBogusInstructions() { return totalBogusInstructions; }
        public int getFakeBlocks() { return fakeBlocks; }
        public int getFakeLoops() { return fakeLoops; }
        public int getFakeConditionals() { return fakeConditionals; }
    }
}
