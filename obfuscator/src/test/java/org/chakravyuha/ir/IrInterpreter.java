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
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.inst.ReturnInst;
import org.chakravyuha.ir.inst.SelectInst;
import org.chakravyuha.ir.inst.StoreInst;
import org.chakravyuha.ir.inst.SwitchInst;
import org.chakravyuha.ir.inst.UnreachableInst;
import org.chakravyuha.ir.type.ArrayType;
import org.chakravyuha.ir.type.IntegerType;
import org.chakravyuha.ir.type.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a module directly on the IR so tests can compare behaviour before
 * and after a transformation. Integers are carried as sign-extended longs,
 * pointers as {@link Pointer}s into cell arrays (one cell per element).
 * <p>
 * Declared functions are host calls: {@code puts(ptr)} and {@code record(i32)}
 * append a line to {@link #getOutput()}.
 */
public final class IrInterpreter {

    public static final class Pointer {
        final Object[] cells;
        final int offset;

        Pointer(Object[] cells, int offset) {
            this.cells = cells;
            this.offset = offset;
        }
    }

    public static final class TrapException extends RuntimeException {
        TrapException(String message) {
            super(message);
        }
    }

    private static final long MAX_STEPS = 2_000_000;

    private final IrModule module;
    private final Map<GlobalVariable, Pointer> globals = new IdentityHashMap<>();
    private final StringBuilder output = new StringBuilder();
    private long steps;

    public IrInterpreter(IrModule module) {
        this.module = module;
        for (GlobalVariable global : module.getGlobals()) {
            globals.put(global, new Pointer(initialCells(global), 0));
        }
    }

    public String getOutput() {
        return output.toString();
    }

    public long getSteps() {
        return steps;
    }

    /**
     * Calls {@code name} with integer arguments and returns its integer
     * result, or {@code null} for a void function.
     */
    public Long call(String name, long... args) {
        Function function = module.getFunction(name);
        if (function == null) {
            throw new IllegalArgumentException("No function @" + name);
        }
        List<Object> values = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            Type type = function.getArgument(i).getType();
            values.add(((IntegerType) type).normalize(args[i]));
        }
        return (Long) invoke(function, values);
    }

    private static Object[] initialCells(GlobalVariable global) {
        Constant init = global.getInitializer();
        if (init instanceof ConstantString) {
            byte[] data = ((ConstantString) init).getData();
            Object[] cells = new Object[data.length];
            for (int i = 0; i < data.length; i++) {
                cells[i] = (long) data[i];
            }
            return cells;
        }
        if (init instanceof ConstantInt) {
            return new Object[]{((ConstantInt) init).getValue()};
        }
        return newCells(global.getValueType());
    }

    private static Object[] newCells(Type type) {
        Object[] cells = new Object[type instanceof ArrayType ? ((ArrayType) type).getLength() : 1];
        Arrays.fill(cells, 0L);
        return cells;
    }

    private Object invoke(Function function, List<Object> args) {
        if (function.isDeclaration()) {
            return hostCall(function, args);
        }
        Map<Value, Object> frame = new HashMap<>();
        for (int i = 0; i < args.size(); i++) {
            frame.put(function.getArgument(i), args.get(i));
        }
        BasicBlock previous = null;
        BasicBlock block = function.getEntryBlock();
        while (true) {
            List<PhiInst> phis = block.getPhis();
            Map<PhiInst, Object> incoming = new HashMap<>();
            for (PhiInst phi : phis) {
                incoming.put(phi, phiValue(phi, previous, frame));
            }
            frame.putAll(incoming);
            BasicBlock next = null;
            for (Instruction inst : block.getInstructions()) {
                if (inst instanceof PhiInst) {
                    continue;
                }
                if (++steps > MAX_STEPS) {
                    throw new TrapException("Step limit exceeded in @" + function.getName());
                }
                if (inst instanceof ReturnInst) {
                    ReturnInst ret = (ReturnInst) inst;
                    return ret.hasValue() ? eval(ret.getValue(), frame) : null;
                }
                if (inst instanceof BranchInst) {
                    BranchInst br = (BranchInst) inst;
                    if (br.isUnconditional()) {
                        next = br.getSuccessor(0);
                    } else {
                        next = asLong(eval(br.getCondition(), frame)) != 0 ? br.getThenBlock() : br.getElseBlock();
                    }
                    break;
                }
                if (inst instanceof SwitchInst) {
                    SwitchInst sw = (SwitchInst) inst;
                    next = sw.findDest(asLong(eval(sw.getCondition(), frame)));
                    break;
                }
                if (inst instanceof UnreachableInst) {
                    throw new TrapException("Reached unreachable in @" + function.getName() + ":" + block.getName());
                }
                Object result = execute(inst, frame);
                if (inst.producesValue()) {
                    frame.put(inst, result);
                }
            }
            if (next == null) {
                throw new TrapException("Block " + block.getName() + " fell through");
            }
            previous = block;
            block = next;
        }
    }

    private Object phiValue(PhiInst phi, BasicBlock previous, Map<Value, Object> frame) {
        for (int i = 0; i < phi.getNumIncoming(); i++) {
            if (phi.getIncomingBlock(i) == previous) {
                return eval(phi.getIncomingValue(i), frame);
            }
        }
        throw new TrapException("PHI " + phi.getName() + " has no incoming value for " + previous);
    }

    private Object execute(Instruction inst, Map<Value, Object> frame) {
        if (inst instanceof BinaryInst) {
            BinaryInst bin = (BinaryInst) inst;
            IntegerType type = (IntegerType) bin.getType();
            return binary(bin, type, asLong(eval(bin.getLhs(), frame)), asLong(eval(bin.getRhs(), frame)));
        }
        if (inst instanceof ICmpInst) {
            ICmpInst cmp = (ICmpInst) inst;
            boolean r = cmp.getPredicate().test(asLong(eval(cmp.getLhs(), frame)), asLong(eval(cmp.getRhs(), frame)));
            return r ? 1L : 0L;
        }
        if (inst instanceof CastInst) {
            CastInst cast = (CastInst) inst;
            long v = asLong(eval(cast.getValue(), frame));
            IntegerType from = (IntegerType) cast.getValue().getType();
            switch (cast.getOpcode()) {
                case ZEXT:
                    return cast.getType().normalize(zeroExtend(v, from));
                case SEXT:
                    return cast.getType().normalize(from == IntegerType.I1 ? -v : v);
                default:
                    return cast.getType().normalize(v);
            }
        }
        if (inst instanceof SelectInst) {
            SelectInst sel = (SelectInst) inst;
            return asLong(eval(sel.getCondition(), frame)) != 0
                    ? eval(sel.getTrueValue(), frame) : eval(sel.getFalseValue(), frame);
        }
        if (inst instanceof AllocaInst) {
            return new Pointer(newCells(((AllocaInst) inst).getAllocatedType()), 0);
        }
        if (inst instanceof LoadInst) {
            LoadInst load = (LoadInst) inst;
            Pointer p = asPointer(eval(load.getPointer(), frame));
            Object v = p.cells[p.offset];
            if (load.getType() instanceof IntegerType) {
                return ((IntegerType) load.getType()).normalize(asLong(v));
            }
            return v;
        }
        if (inst instanceof StoreInst) {
            StoreInst store = (StoreInst) inst;
            Pointer p = asPointer(eval(store.getPointer(), frame));
            p.cells[p.offset] = eval(store.getValue(), frame);
            return null;
        }
        if (inst instanceof GetElementPtrInst) {
            GetElementPtrInst gep = (GetElementPtrInst) inst;
            Pointer base = asPointer(eval(gep.getBase(), frame));
            long index = asLong(eval(gep.getIndex(), frame));
            return new Pointer(base.cells, (int) (base.offset + index));
        }
        if (inst instanceof CallInst) {
            CallInst call = (CallInst) inst;
            List<Object> args = new ArrayList<>();
            for (Value arg : call.getArguments()) {
                args.add(eval(arg, frame));
            }
            return invoke(call.getCallee(), args);
        }
        throw new TrapException("Cannot execute " + inst);
    }

    private static Object binary(BinaryInst bin, IntegerType type, long a, long b) {
        switch (bin.getOpcode()) {
            case ADD:
                return type.normalize(a + b);
            case SUB:
                return type.normalize(a - b);
            case MUL:
                return type.normalize(a * b);
            case AND:
                return a & b;
            case OR:
                return a | b;
            case XOR:
                return type.normalize(a ^ b);
            case SHL:
                return type.normalize(a << (b & 63));
            case LSHR:
                return type.normalize(zeroExtend(a, type) >>> (b & 63));
            case ASHR:
                return type.normalize(a >> (b & 63));
            case SDIV:
                checkDivisor(b);
                return type.normalize(a / b);
            case SREM:
                checkDivisor(b);
                return type.normalize(a % b);
            case UDIV:
                checkDivisor(b);
                return type.normalize(Long.divideUnsigned(zeroExtend(a, type), zeroExtend(b, type)));
            case UREM:
                checkDivisor(b);
                return type.normalize(Long.remainderUnsigned(zeroExtend(a, type), zeroExtend(b, type)));
            default:
                throw new TrapException("Unknown binary opcode " + bin.getOpcode());
        }
    }

    private static void checkDivisor(long b) {
        if (b == 0) {
            throw new TrapException("Division by zero");
        }
    }

    private static long zeroExtend(long v, IntegerType type) {
        return type.getBits() == 64 ? v : v & ((1L << type.getBits()) - 1);
    }

    private Object hostCall(Function function, List<Object> args) {
        switch (function.getName()) {
            case "puts": {
                Pointer p = asPointer(args.get(0));
                StringBuilder sb = new StringBuilder();
                for (int i = p.offset; asLong(p.cells[i]) != 0; i++) {
                    sb.append((char) (asLong(p.cells[i]) & 0xFF));
                }
                output.append(sb).append('\n');
                return 0L;
            }
            case "record":
                output.append(asLong(args.get(0))).append('\n');
                return null;
            default:
                throw new TrapException("No host implementation for @" + function.getName());
        }
    }

    private Object eval(Value value, Map<Value, Object> frame) {
        if (value instanceof ConstantInt) {
            return ((ConstantInt) value).getValue();
        }
        if (value instanceof UndefValue) {
            return value.getType() instanceof IntegerType ? 0L : null;
        }
        if (value instanceof GlobalVariable) {
            return globals.get(value);
        }
        if (!frame.containsKey(value)) {
            throw new TrapException("Value " + value.getReference() + " read before it was defined");
        }
        return frame.get(value);
    }

    private static long asLong(Object v) {
        if (!(v instanceof Long)) {
            throw new TrapException("Expected an integer, got " + v);
        }
        return (Long) v;
    }

    private static Pointer asPointer(Object v) {
        if (!(v instanceof Pointer)) {
            throw new TrapException("Expected a pointer, got " + v);
        }
        return (Pointer) v;
    }
}
