package org.chakravyuha;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Switches for the individual obfuscation passes.
 */
public class ProtectionConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProtectionConfig.class);

    private final boolean stringEncryptionEnabled;
    private final boolean controlFlowFlatteningEnabled;
    private final boolean fakeCodeInsertionEnabled;

    public ProtectionConfig(boolean stringEncryptionEnabled, boolean controlFlowFlatteningEnabled,
                            boolean fakeCodeInsertionEnabled) {
        this.stringEncryptionEnabled = stringEncryptionEnabled;
        this.controlFlowFlatteningEnabled = controlFlowFlatteningEnabled;
        this.fakeCodeInsertionEnabled = fakeCodeInsertionEnabled;
    }

    /**
     * @return true if constant C strings should be XOR-encrypted and decrypted at their uses
     */
    public boolean isStringEncryptionEnabled() {
        return stringEncryptionEnabled;
    }

    /**
     * @return true if function bodies should be rewritten into a dispatch loop
     */
    public boolean isControlFlowFlatteningEnabled() {
        return controlFlowFlatteningEnabled;
    }

    /**
     * @return true if never-taken decoy blocks should be inserted
     */
    public boolean isFakeCodeInsertionEnabled() {
        return fakeCodeInsertionEnabled;
    }

    public boolean isAnyEnabled() {
        return stringEncryptionEnabled || controlFlowFlatteningEnabled || fakeCodeInsertionEnabled;
    }

    /**
     * All passes enabled.
     */
    public static ProtectionConfig createDefault() {
        return new ProtectionConfig(true, true, true);
    }

    public static ProtectionConfig flatteningOnly() {
        return new ProtectionConfig(false, true, false);
    }

    /**
     * Logs warnings for combinations that are legal but probably not intended.
     */
    public void validateAndWarn() {
        if (!isAnyEnabled()) {
            logger.warn("All obfuscation passes are disabled, the output will equal the input");
        }
        if (fakeCodeInsertionEnabled && !controlFlowFlatteningEnabled) {
            logger.info("Fake code is inserted without control-flow flattening, decoys stay visible as guarded branches");
        }
        if (!stringEncryptionEnabled) {
            logger.info("String encryption is disabled, string constants stay in plain text");
        }
    }

    @Override
    public String toString() {
        return String.format("ProtectionConfig{stringEncryption=%s, controlFlowFlattening=%s, fakeCode=%s}",
                stringEncryptionEnabled, controlFlowFlatteningEnabled, fakeCodeInsertionEnabled);
    }
}
