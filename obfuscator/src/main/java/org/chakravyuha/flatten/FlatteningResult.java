package org.chakravyuha.flatten;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one flattening attempt on one function.
 */
public final class FlatteningResult {

    private final boolean modified;
    private final int blocksFlattened;
    private final SkipReason skipReason;
    private final List<String> diagnostics;

    private FlatteningResult(boolean modified, int blocksFlattened, SkipReason skipReason, List<String> diagnostics) {
        this.modified = modified;
        this.blocksFlattened = blocksFlattened;
        this.skipReason = skipReason;
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public static FlatteningResult flattened(int blocksFlattened, List<String> diagnostics) {
        return new FlatteningResult(true, blocksFlattened, null, diagnostics);
    }

    public static FlatteningResult skipped(SkipReason reason) {
        return new FlatteningResult(false, 0, reason, Collections.emptyList());
    }

    public boolean isModified() {
        return modified;
    }

    public int getBlocksFlattened() {
        return blocksFlattened;
    }

    public Optional<SkipReason> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    /**
     * @return verifier messages for a flattened function; empty when it verified cleanly
     * or verification was turned off
     */
    public List<String> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        return modified
                ? "flattened " + blocksFlattened + " blocks" + (diagnostics.isEmpty() ? "" : ", " + diagnostics.size() + " diagnostics")
                : "skipped (" + skipReason.getKey() + ")";
    }
}
