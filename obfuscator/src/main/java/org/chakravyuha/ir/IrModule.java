package org.chakravyuha.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public final class IrModule {

    private final String name;
    private final List<Function> functions = new ArrayList<>();
    private final List<GlobalVariable> globals = new ArrayList<>();
    private String targetTriple;
    private String sourceFileName;

    public IrModule(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getName() {
        return name;
    }

    public String getTargetTriple() {
        return targetTriple;
    }

    public void setTargetTriple(String targetTriple) {
        this.targetTriple = targetTriple;
    }

    public String getSourceFileName() {
        return sourceFileName;
    }

    public void setSourceFileName(String sourceFileName) {
        this.sourceFileName = sourceFileName;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public Function getFunction(String functionName) {
        for (Function f : functions) {
            if (f.getName().equals(functionName)) {
                return f;
            }
        }
        return null;
    }

    public void addFunction(Function function) {
        if (getFunction(function.getName()) != null || getGlobal(function.getName()) != null) {
            throw new IllegalArgumentException("Duplicate global symbol: @" + function.getName());
        }
        functions.add(function);
        function.setParent(this);
    }

    public List<GlobalVariable> getGlobals() {
        return Collections.unmodifiableList(globals);
    }

    public GlobalVariable getGlobal(String globalName) {
        for (GlobalVariable gv : globals) {
            if (gv.getName().equals(globalName)) {
                return gv;
            }
        }
        return null;
    }

    public void addGlobal(GlobalVariable global) {
        if (getFunction(global.getName()) != null || getGlobal(global.getName()) != null) {
            throw new IllegalArgumentException("Duplicate global symbol: @" + global.getName());
        }
        globals.add(global);
        global.setParent(this);
    }

    /**
     * Removes a global that is no longer referenced.
     */
    public void removeGlobal(GlobalVariable global) {
        if (global.hasUses()) {
            throw new IllegalStateException("Global @" + global.getName() + " still has " + global.getNumUses() + " uses");
        }
        if (!globals.remove(global)) {
            throw new IllegalArgumentException("Global @" + global.getName() + " is not in module " + name);
        }
        global.setParent(null);
    }

    public String uniqueGlobalName(String hint) {
        if (getFunction(hint) == null && getGlobal(hint) == null) {
            return hint;
        }
        for (int i = 1; ; i++) {
            String candidate = hint + "." + i;
            if (getFunction(candidate) == null && getGlobal(candidate) == null) {
                return candidate;
            }
        }
    }
}
