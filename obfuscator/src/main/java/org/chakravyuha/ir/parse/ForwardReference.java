package org.chakravyuha.ir.parse;

import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.type.Type;

/**
 * Stands in for a local value used before its definition. Replaced through
 * {@link Value#replaceAllUsesWith} once the definition is parsed.
 */
final class ForwardReference extends Value {

    private final int firstUseLine;

    ForwardReference(Type type, String name, int firstUseLine) {
        super(type, name);
        this.firstUseLine = firstUseLine;
    }

    int getFirstUseLine() {
        return firstUseLine;
    }
}
