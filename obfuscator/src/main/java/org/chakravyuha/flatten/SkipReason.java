package org.chakravyuha.flatten;

/**
 * Why a function was left untouched.
 */
public enum SkipReason {
    DECLARATION("declaration", "external declaration or intrinsic"),
    TOO_SMALL("tooSmall", "fewer than two blocks"),
    EXCEPTION_HANDLING("exceptionHandling", "landing pad or invoke"),
    UNSUPPORTED_TERMINATOR("unsupportedTerminator", "indirect branch, call-with-branch or unknown terminator"),
    ALREADY_FLATTENED("alreadyFlattened", "contains a state dispatcher"),
    UNEXPRESSIBLE_INITIAL_STATE("unexpressibleInitialState", "entry terminator has no next-state value");

    private final String key;
    private final String description;

    SkipReason(String key, String description) {
        this.key = key;
        this.description = description;
    }

    public String getKey() {
        return key;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Declarations are not candidates at all, so they are not counted as skipped.
     */
    public boolean countsAsSkipped() {
        return this != DECLARATION;
    }
}
