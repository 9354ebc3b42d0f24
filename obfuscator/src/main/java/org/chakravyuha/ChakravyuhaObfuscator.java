package org.chakravyuha;

import org.chakravyuha.bogus.FakeCodeInsertionPass;
import org.chakravyuha.bogus.FakeCodeStats;
import org.chakravyuha.flatten.ControlFlowFlatteningPass;
import org.chakravyuha.flatten.FlatteningOptions;
import org.chakravyuha.flatten.FlatteningResult;
import org.chakravyuha.flatten.FlatteningSummary;
import org.chakravyuha.flatten.SkipReason;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.IrPrinter;
import org.chakravyuha.report.ObfuscationReport;
import org.chakravyuha.strings.StringEncryptionPass;
import org.chakravyuha.strings.StringEncryptionStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the enabled passes over a module for the configured number of cycles
 * and reports what they did. Strings are encrypted in the first cycle only;
 * flattening and fake code run every cycle, in that order.
 */
public class ChakravyuhaObfuscator {

    private static final Logger logger = LoggerFactory.getLogger(ChakravyuhaObfuscator.class);

    public static final String STRING_ENCRYPTION = "StringEncryption";
    public static final String CONTROL_FLOW_FLATTENING = "ControlFlowFlattening";
    public static final String FAKE_CODE_INSERTION = "FakeCodeInsertion";

    private static final String DEFAULT_OUTPUT_FILE = "obfuscated.ll";

    private final Clock clock;

    public ChakravyuhaObfuscator() {
        this(Clock.systemUTC());
    }

    public ChakravyuhaObfuscator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Obfuscates {@code module} in place.
     */
    public ObfuscationReport obfuscate(IrModule module, ObfuscatorConfig config) {
        long started = System.nanoTime();
        long originalSize = irSize(module);
        FastRandom random = config.createRandom();
        logger.info("Starting obfuscation of {} with {} cycle(s), level {}, seed {}",
                module.getName(), config.getCycles(), config.getLevel().getKey(), random.getSeed());

        FlatteningOptions flatteningOptions = FlatteningOptions.builder()
                .trivialBlockPolicy(config.getTrivialBlockPolicy())
                .statePoolFactory(StatePool.scrambledFactory(random.nextLong()))
                .verify(config.isVerify())
                .build();
        ControlFlowFlatteningPass flatteningPass = new ControlFlowFlatteningPass(flatteningOptions);
        ObfuscationLevel level = config.getLevel();

        List<String> passesRun = new ArrayList<>();
        StringEncryptionStats strings = StringEncryptionStats.empty();
        FakeCodeStats fakeCode = new FakeCodeStats();
        Set<String> flattened = new LinkedHashSet<>();
        Set<String> skipped = new LinkedHashSet<>();
        int flattenedBlocks = 0;
        int cyclesCompleted = 0;

        for (int cycle = 0; cycle < config.getCycles(); cycle++) {
            logger.info("Cycle {}/{}", cycle + 1, config.getCycles());
            if (cycle == 0 && config.isStringEncryptionEnabled()) {
                strings = new StringEncryptionPass(random.fork(cycle * 3L + 1)).run(module);
                passesRun.add(STRING_ENCRYPTION);
            }
            if (config.isControlFlowFlatteningEnabled()) {
                FlatteningSummary summary = flatteningPass.run(module);
                flattenedBlocks += summary.getFlattenedBlocks();
                for (Map.Entry<String, FlatteningResult> e : summary.getResults().entrySet()) {
                    FlatteningResult result = e.getValue();
                    if (result.isModified()) {
                        flattened.add(e.getKey());
                    } else if (result.getSkipReason().map(SkipReason::countsAsSkipped).orElse(false)) {
                        skipped.add(e.getKey());
                    }
                }
                passesRun.add(CONTROL_FLOW_FLATTENING);
            }
            if (config.isFakeCodeInsertionEnabled()) {
                FakeCodeInsertionPass fakePass = new FakeCodeInsertionPass(random.fork(cycle * 3L + 2),
                        level.getMaxFakeLoops(), level.getMaxFakeConditionals(), level.getMaxFakeBlocks());
                fakeCode.add(fakePass.run(module));
                passesRun.add(FAKE_CODE_INSERTION);
            }
            cyclesCompleted = cycle + 1;
        }
        // a function flattened in an earlier cycle is skipped as already flattened later on
        skipped.removeAll(flattened);

        long obfuscatedSize = irSize(module);
        double seconds = (System.nanoTime() - started) / 1_000_000_000.0;
        logger.info("Obfuscation finished in {} s: IR grew from {} to {}", String.format("%.3f", seconds),
                ObfuscationReport.formatBytes(originalSize), ObfuscationReport.formatBytes(obfuscatedSize));

        ObfuscationReport.InputParameters input = new ObfuscationReport.InputParameters(level.getKey(),
                ObfuscationReport.platformOf(module.getTargetTriple()), config.getCycles(),
                config.isStringEncryptionEnabled(), config.isControlFlowFlatteningEnabled(),
                config.isFakeCodeInsertionEnabled());
        ObfuscationReport.OutputAttributes output = new ObfuscationReport.OutputAttributes(originalSize, obfuscatedSize,
                strings.getOriginalBytes(), strings.getEncryptedBytes(), seconds, methodsOf(config, fakeCode));
        ObfuscationReport.ObfuscationMetrics metrics = new ObfuscationReport.ObfuscationMetrics(cyclesCompleted,
                passesRun,
                new ObfuscationReport.StringEncryption(strings.getCount(),
                        config.isStringEncryptionEnabled() ? strings.getMethod() : null),
                new ObfuscationReport.ControlFlowFlattening(flattened.size(), flattenedBlocks, skipped.size()),
                new ObfuscationReport.FakeCodeInsertion(fakeCode.getBogusInstructions(), fakeCode.getFakeBlocks(),
                        fakeCode.getFakeLoops(), fakeCode.getFakeConditionals()));
        return new ObfuscationReport(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString(),
                inputFileOf(module, config), outputFileOf(config), input, output, metrics);
    }

    private static List<String> methodsOf(ObfuscatorConfig config, FakeCodeStats fakeCode) {
        List<String> methods = new ArrayList<>();
        if (config.isStringEncryptionEnabled()) {
            methods.add("String Encryption (XOR)");
        }
        if (config.isControlFlowFlatteningEnabled()) {
            methods.add("Control Flow Flattening");
        }
        if (config.isFakeCodeInsertionEnabled()) {
            methods.add("Fake Code Insertion");
            if (fakeCode.getFakeLoops() > 0) {
                methods.add("Fake Loop Insertion");
            }
            if (fakeCode.getFakeConditionals() > 0) {
                methods.add("Fake Conditional Insertion");
            }
        }
        return methods;
    }

    private static String inputFileOf(IrModule module, ObfuscatorConfig config) {
        if (config.getInputPath() != null) {
            return config.getInputPath().toString();
        }
        String source = module.getSourceFileName();
        return source == null || source.isEmpty() ? "<stdin>" : source;
    }

    private static String outputFileOf(ObfuscatorConfig config) {
        Path output = config.getOutputPath();
        return output == null ? DEFAULT_OUTPUT_FILE : output.toString();
    }

    static long irSize(IrModule module) {
        return IrPrinter.print(module).getBytes(StandardCharsets.UTF_8).length;
    }
}
