package org.chakravyuha.ir;

import org.chakravyuha.ir.inst.Instruction;

import java.util.stream.Collectors;

/**
 * Writes the textual IR form read back by {@link org.chakravyuha.ir.parse.IrParser}.
 */
public final class IrPrinter {

    private IrPrinter() {
    }

    public static String print(IrModule module) {
        StringBuilder sb = new StringBuilder();
        sb.append("; ModuleID = '").append(module.getName()).append("'\n");
        if (module.getSourceFileName() != null) {
            sb.append("source_filename = \"").append(module.getSourceFileName()).append("\"\n");
        }
        if (module.getTargetTriple() != null) {
            sb.append("target triple = \"").append(module.getTargetTriple()).append("\"\n");
        }
        if (!module.getGlobals().isEmpty()) {
            sb.append('\n');
            for (GlobalVariable global : module.getGlobals()) {
                sb.append(printGlobal(global)).append('\n');
            }
        }
        for (Function function : module.getFunctions()) {
            sb.append('\n').append(print(function));
        }
        return sb.toString();
    }

    public static String printGlobal(GlobalVariable global) {
        StringBuilder sb = new StringBuilder(global.getReference()).append(" = ");
        if (!global.hasInitializer()) {
            return sb.append("external ").append(global.isConstant() ? "constant " : "global ")
                    .append(global.getValueType().toIr()).toString();
        }
        if (global.isPrivate()) {
            sb.append("private ");
        }
        sb.append(global.isConstant() ? "constant " : "global ");
        sb.append(global.getValueType().toIr()).append(' ').append(global.getInitializer().getReference());
        return sb.toString();
    }

    public static String print(Function function) {
        StringBuilder sb = new StringBuilder();
        if (function.isDeclaration()) {
            sb.append("declare ").append(function.getReturnType().toIr()).append(' ')
                    .append(function.getReference()).append('(')
                    .append(function.getArguments().stream()
                            .map(a -> a.getType().toIr())
                            .collect(Collectors.joining(", ")))
                    .append(")\n");
            return sb.toString();
        }
        sb.append("define ").append(function.getReturnType().toIr()).append(' ')
                .append(function.getReference()).append('(')
                .append(function.getArguments().stream()
                        .map(Value::toString)
                        .collect(Collectors.joining(", ")))
                .append(") {\n");
        boolean first = true;
        for (BasicBlock block : function.getBlocks()) {
            if (!first) {
                sb.append('\n');
            }
            first = false;
            sb.append(block.getName()).append(":\n");
            for (Instruction inst : block.getInstructions()) {
                sb.append("  ").append(inst).append('\n');
            }
        }
        sb.append("}\n");
        return sb.toString();
    }
}
