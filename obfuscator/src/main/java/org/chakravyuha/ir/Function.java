package org.chakravyuha.ir;

import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.type.PointerType;
import org.chakravyuha.ir.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A function owns its blocks in layout order; the first block is the entry.
 * A function without blocks is a declaration.
 */
public final class Function extends Value {

    private final Type returnType;
    private final List<Argument> arguments = new ArrayList<>();
    private final List<BasicBlock> blocks = new ArrayList<>();
    private final Set<String> localNames = new HashSet<>();
    private IrModule parent;

    public Function(String name, Type returnType, List<Type> paramTypes, List<String> paramNames) {
        super(PointerType.PTR, Objects.requireNonNull(name, "name"));
        this.returnType = Objects.requireNonNull(returnType, "returnType");
        for (int i = 0; i < paramTypes.size(); i++) {
            String hint = paramNames != null && i < paramNames.size() ? paramNames.get(i) : null;
            if (hint == null) {
                hint = "arg" + i;
            }
            arguments.add(new Argument(paramTypes.get(i), uniqueName(hint), this, i));
        }
    }

    public Function(String name, Type returnType, List<Type> paramTypes) {
        this(name, returnType, paramTypes, null);
    }

    public Type getReturnType() {
        return returnType;
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Argument getArgument(int index) {
        return arguments.get(index);
    }

    public List<BasicBlock> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public BasicBlock getEntryBlock() {
        return blocks.isEmpty() ? null : blocks.get(0);
    }

    public int size() {
        return blocks.size();
    }

    public boolean isDeclaration() {
        return blocks.isEmpty();
    }

    public boolean isIntrinsic() {
        return getName().startsWith("llvm.");
    }

    public IrModule getParent() {
        return parent;
    }

    void setParent(IrModule parent) {
        this.parent = parent;
    }

    /**
     * Creates a block with a unique name and appends it to the layout.
     */
    public BasicBlock createBlock(String nameHint) {
        BasicBlock block = new BasicBlock(uniqueName(nameHint));
        appendBlock(block);
        return block;
    }

    public void appendBlock(BasicBlock block) {
        if (block.getParent() != null) {
            throw new IllegalStateException("Block " + block.getName() + " already belongs to a function");
        }
        blocks.add(block);
        block.setParent(this);
    }

    /**
     * Unlinks {@code block} from the layout. Its instructions are left as they are.
     */
    public void removeBlock(BasicBlock block) {
        if (!blocks.remove(block)) {
            throw new IllegalArgumentException("Block " + block.getName() + " is not in function " + getName());
        }
        block.setParent(null);
    }

    /**
     * Reserves a local name. Returns {@code hint} if it is free, otherwise the
     * first free {@code hint.N}.
     */
    public String uniqueName(String hint) {
        String base = hint == null || hint.isEmpty() ? "t" : hint;
        if (localNames.add(base)) {
            return base;
        }
        for (int i = 1; ; i++) {
            String candidate = base + "." + i;
            if (localNames.add(candidate)) {
                return candidate;
            }
        }
    }

    public boolean isNameTaken(String name) {
        return localNames.contains(name);
    }

    public List<Instruction> getAllInstructions() {
        List<Instruction> all = new ArrayList<>();
        for (BasicBlock block : blocks) {
            all.addAll(block.getInstructions());
        }
        return all;
    }

    public int getInstructionCount() {
        int count = 0;
        for (BasicBlock block : blocks) {
            count += block.size();
        }
        return count;
    }

    @Override
    public String getReference() {
        return "@" + getName();
    }
}
