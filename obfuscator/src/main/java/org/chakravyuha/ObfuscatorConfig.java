package org.chakravyuha;

import org.chakravyuha.flatten.TrivialBlockPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Everything one obfuscation run needs: which passes to run, how hard, how
 * often, and where input, output and report live.
 */
public class ObfuscatorConfig {

    private static final Logger logger = LoggerFactory.getLogger(ObfuscatorConfig.class);

    public static final int MAX_CYCLES = 16;

    private final Path inputPath;
    private final Path outputPath;
    private final Path reportPath;
    private final ObfuscationLevel level;
    private final int cycles;
    private final Long seed;
    private final TrivialBlockPolicy trivialBlockPolicy;
    private final boolean verify;
    private final ProtectionConfig protectionConfig;

    private ObfuscatorConfig(Builder builder) {
        this.inputPath = builder.inputPath;
        this.outputPath = builder.outputPath;
        this.reportPath = builder.reportPath;
        this.level = builder.level;
        this.cycles = builder.cycles;
        this.seed = builder.seed;
        this.trivialBlockPolicy = builder.trivialBlockPolicy;
        this.verify = builder.verify;
        this.protectionConfig = builder.protectionConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getInputPath() { return inputPath; }
    public Path getOutputPath() { return outputPath; }
    public Path getReportPath() { return reportPath; }
    public ObfuscationLevel getLevel() { return level; }
    public int getCycles() { return cycles; }
    public TrivialBlockPolicy getTrivialBlockPolicy() { return trivialBlockPolicy; }
    public boolean isVerify() { return verify; }
    public ProtectionConfig getProtectionConfig() { return protectionConfig; }

    /**
     * @return the fixed seed, or {@code null} if every run should draw a fresh one
     */
    public Long getSeed() { return seed; }

    public boolean isStringEncryptionEnabled() { return protectionConfig.isStringEncryptionEnabled(); }
    public boolean isControlFlowFlatteningEnabled() { return protectionConfig.isControlFlowFlatteningEnabled(); }
    public boolean isFakeCodeInsertionEnabled() { return protectionConfig.isFakeCodeInsertionEnabled(); }

    public FastRandom createRandom() {
        return seed == null ? FastRandom.fromClock() : new FastRandom(seed);
    }

    /**
     * Logs warnings for problematic combinations.
     */
    public void validateAndWarn() {
        protectionConfig.validateAndWarn();
        if (cycles > 1 && !protectionConfig.isFakeCodeInsertionEnabled()) {
            logger.info("{} cycles requested without fake code, functions are flattened once and skipped afterwards", cycles);
        }
        if (seed == null && protectionConfig.isAnyEnabled()) {
            logger.debug("No seed given, output will differ between runs");
        }
    }

    @Override
    public String toString() {
        return String.format("ObfuscatorConfig{\n" +
                        "  input=%s,\n" +
                        "  output=%s,\n" +
                        "  report=%s,\n" +
                        "  level=%s,\n" +
                        "  cycles=%d,\n" +
                        "  trivialBlocks=%s,\n" +
                        "  protectionConfig=%s\n" +
                        "}",
                inputPath, outputPath, reportPath, level, cycles, trivialBlockPolicy, protectionConfig);
    }

    /**
     * Builder class for constructing ObfuscatorConfig instances.
     */
    public static class Builder {
        private Path inputPath;
        private Path outputPath;
        private Path reportPath;
        private ObfuscationLevel level = ObfuscationLevel.MEDIUM;
        private int cycles = 1;
        private Long seed;
        private TrivialBlockPolicy trivialBlockPolicy = TrivialBlockPolicy.INCLUDE;
        private boolean verify = true;
        private ProtectionConfig protectionConfig = ProtectionConfig.createDefault();

        public Builder setInputPath(Path inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder setOutputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder setReportPath(Path reportPath) {
            this.reportPath = reportPath;
            return this;
        }

        public Builder setLevel(ObfuscationLevel level) {
            this.level = level;
            return this;
        }

        public Builder setCycles(int cycles) {
            this.cycles = cycles;
            return this;
        }

        public Builder setSeed(Long seed) {
            this.seed = seed;
            return this;
        }

        public Builder setTrivialBlockPolicy(TrivialBlockPolicy trivialBlockPolicy) {
            this.trivialBlockPolicy = trivialBlockPolicy;
            return this;
        }

        public Builder setVerify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public Builder setProtectionConfig(ProtectionConfig protectionConfig) {
            this.protectionConfig = protectionConfig;
            return this;
        }

        public ObfuscatorConfig build() {
            if (level == null) {
                throw new IllegalStateException("Obfuscation level must be set");
            }
            if (protectionConfig == null) {
                throw new IllegalStateException("Protection config must be set");
            }
            if (trivialBlockPolicy == null) {
                throw new IllegalStateException("Trivial block policy must be set");
            }
            if (cycles < 1 || cycles > MAX_CYCLES) {
                throw new IllegalArgumentException("Cycles must be between 1 and " + MAX_CYCLES + ", got " + cycles);
            }
            return new ObfuscatorConfig(this);
        }
    }
}
