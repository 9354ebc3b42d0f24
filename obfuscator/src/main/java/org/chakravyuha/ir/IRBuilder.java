package org.chakravyuha.ir;

import org.chakravyuha.ir.inst.AllocaInst;
import org.chakravyuha.ir.inst.BinaryInst;
import org.chakravyuha.ir.inst.BranchInst;
import org.chakravyuha.ir.inst.CallInst;
import org.chakravyuha.ir.inst.CastInst;
import org.chakravyuha.ir.inst.GetElementPtrInst;
import org.chakravyuha.ir.inst.ICmpInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.LoadInst;
import org.chakravyuha.ir.inst.Opcode;
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.inst.ReturnInst;
import org.chakravyuha.ir.inst.SelectInst;
import org.chakravyuha.ir.inst.StoreInst;
import org.chakravyuha.ir.inst.SwitchInst;
import org.chakravyuha.ir.inst.UnreachableInst;
import org.chakravyuha.ir.type.IntegerType;
import org.chakravyuha.ir.type.Type;

import java.util.List;
import java.util.Objects;

/**
 * Creates instructions at an insertion point. Positioned at the end of a block
 * it appends; positioned before an instruction it inserts in front of it, so a
 * run of create calls comes out in call order.
 * <p>
 * Value names are reserved through the owning function, so the block must
 * already belong to one.
 */
public class IRBuilder {

    private BasicBlock block;
    private Instruction insertBefore;

    public IRBuilder() {
    }

    public IRBuilder(BasicBlock block) {
        positionAtEnd(block);
    }

    public void positionAtEnd(BasicBlock block) {
        this.block = Objects.requireNonNull(block, "block");
        this.insertBefore = null;
    }

    public void positionBefore(Instruction inst) {
        Objects.requireNonNull(inst, "inst");
        if (inst.getParent() == null) {
            throw new IllegalArgumentException("Insertion point " + inst + " is not placed in a block");
        }
        this.block = inst.getParent();
        this.insertBefore = inst;
    }

    /**
     * Positions before the terminator of {@code block}, or at its end if it has none.
     */
    public void positionBeforeTerminator(BasicBlock block) {
        Instruction term = block.getTerminator();
        if (term == null) {
            positionAtEnd(block);
        } else {
            positionBefore(term);
        }
    }

    public BasicBlock getInsertBlock() {
        return block;
    }

    public static ConstantInt getInt1(boolean value) {
        return value ? ConstantInt.getTrue() : ConstantInt.getFalse();
    }

    public static ConstantInt getInt8(long value) {
        return ConstantInt.get(IntegerType.I8, value);
    }

    public static ConstantInt getInt32(long value) {
        return ConstantInt.get(IntegerType.I32, value);
    }

    public static ConstantInt getInt64(long value) {
        return ConstantInt.get(IntegerType.I64, value);
    }

    public BinaryInst createBinary(Opcode opcode, Value lhs, Value rhs, String name) {
        return insert(new BinaryInst(opcode, lhs, rhs, reserve(name)));
    }

    public BinaryInst createAdd(Value lhs, Value rhs, String name) {
        return createBinary(Opcode.ADD, lhs, rhs, name);
    }

    public BinaryInst createSub(Value lhs, Value rhs, String name) {
        return createBinary(Opcode.SUB, lhs, rhs, name);
    }

    public BinaryInst createMul(Value lhs, Value rhs, String name) {
        return createBinary(Opcode.MUL, lhs, rhs, name);
    }

    public BinaryInst createXor(Value lhs, Value rhs, String name) {
        return createBinary(Opcode.XOR, lhs, rhs, name);
    }

    public ICmpInst createICmp(ICmpInst.Predicate predicate, Value lhs, Value rhs, String name) {
        return insert(new ICmpInst(predicate, lhs, rhs, reserve(name)));
    }

    public CastInst createCast(Opcode opcode, Value value, IntegerType destType, String name) {
        return insert(new CastInst(opcode, value, destType, reserve(name)));
    }

    public SelectInst createSelect(Value condition, Value trueValue, Value falseValue, String name) {
        return insert(new SelectInst(condition, trueValue, falseValue, reserve(name)));
    }

    public AllocaInst createAlloca(Type allocatedType, String name) {
        return insert(new AllocaInst(allocatedType, reserve(name)));
    }

    public LoadInst createLoad(Type type, Value pointer, String name) {
        return insert(new LoadInst(type, pointer, false, reserve(name)));
    }

    public LoadInst createVolatileLoad(Type type, Value pointer, String name) {
        return insert(new LoadInst(type, pointer, true, reserve(name)));
    }

    public StoreInst createStore(Value value, Value pointer) {
        return insert(new StoreInst(value, pointer, false));
    }

    public StoreInst createVolatileStore(Value value, Value pointer) {
        return insert(new StoreInst(value, pointer, true));
    }

    public GetElementPtrInst createGep(Type elementType, Value base, Value index, String name) {
        return insert(new GetElementPtrInst(elementType, base, index, reserve(name)));
    }

    public CallInst createCall(Function callee, List<? extends Value> args, String name) {
        String reserved = callee.getReturnType().isVoid() ? null : reserve(name);
        return insert(new CallInst(callee, args, reserved));
    }

    public PhiInst createPhi(Type type, String name) {
        return insert(new PhiInst(type, reserve(name)));
    }

    public BranchInst createBr(BasicBlock dest) {
        return insert(new BranchInst(dest));
    }

    public BranchInst createCondBr(Value condition, BasicBlock thenBlock, BasicBlock elseBlock) {
        return insert(new BranchInst(condition, thenBlock, elseBlock));
    }

    public SwitchInst createSwitch(Value condition, BasicBlock defaultDest) {
        return insert(new SwitchInst(condition, defaultDest));
    }

    public ReturnInst createRetVoid() {
        return insert(new ReturnInst());
    }

    public ReturnInst createRet(Value value) {
        return insert(new ReturnInst(value));
    }

    public UnreachableInst createUnreachable() {
        return insert(new UnreachableInst());
    }

    private String reserve(String hint) {
        if (block == null) {
            throw new IllegalStateException("Builder has no insertion point");
        }
        Function function = block.getParent();
        if (function == null) {
            throw new IllegalStateException("Block " + block.getName() + " is not placed in a function");
        }
        return function.uniqueName(hint);
    }

    private <T extends Instruction> T insert(T inst) {
        if (block == null) {
            throw new IllegalStateException("Builder has no insertion point");
        }
        if (insertBefore == null) {
            block.append(inst);
        } else {
            block.insertBefore(inst, insertBefore);
        }
        return inst;
    }
}
