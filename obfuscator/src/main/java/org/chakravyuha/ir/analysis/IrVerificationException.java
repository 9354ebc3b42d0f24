package org.chakravyuha.ir.analysis;

import java.util.Collections;
import java.util.List;

/**
 * Thrown by {@link IrVerifier#verifyOrThrow} when a function breaks a structural rule.
 */
public class IrVerificationException extends RuntimeException {

    private final List<String> diagnostics;

    public IrVerificationException(String functionName, List<String> diagnostics) {
        super("Function @" + functionName + " failed verification: " + String.join("; ", diagnostics));
        this.diagnostics = Collections.unmodifiableList(diagnostics);
    }

    public List<String> getDiagnostics() {
        return diagnostics;
    }
}
