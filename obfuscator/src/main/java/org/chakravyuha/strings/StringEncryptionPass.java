package org.chakravyuha.strings;

import org.chakravyuha.FastRandom;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.GlobalVariable;
import org.chakravyuha.ir.IRBuilder;
import org.chakravyuha.ir.IrModule;
import org.chakravyuha.ir.ConstantString;
import org.chakravyuha.ir.Use;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.AllocaInst;
import org.chakravyuha.ir.inst.GetElementPtrInst;
import org.chakravyuha.ir.inst.ICmpInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.LoadInst;
import org.chakravyuha.ir.inst.PhiInst;
import org.chakravyuha.ir.type.IntegerType;
import org.chakravyuha.ir.type.PointerType;
import org.chakravyuha.ir.type.Type;
import org.chakravyuha.ir.type.VoidType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Replaces constant C strings with XOR ciphertext. Every instruction that read
 * the plain global gets a fresh stack buffer, filled by a call to an injected
 * decryption function right in front of it.
 */
public class StringEncryptionPass {

    private static final Logger logger = LoggerFactory.getLogger(StringEncryptionPass.class);

    public static final String DECRYPT_FUNCTION_NAME = "chakravyuha_decrypt_string";

    private final FastRandom random;

    public StringEncryptionPass(FastRandom random) {
        this.random = random;
    }

    public StringEncryptionStats run(IrModule module) {
        List<GlobalVariable> targets = new ArrayList<>();
        for (GlobalVariable global : module.getGlobals()) {
            if (isEncryptable(global)) {
                targets.add(global);
            }
        }
        if (targets.isEmpty()) {
            logger.debug("No string constants to encrypt in {}", module.getName());
            return StringEncryptionStats.empty();
        }

        int key = 1 + random.nextInt(255);
        Function decrypt = createDecryptFunction(module, key);

        long originalBytes = 0;
        long encryptedBytes = 0;
        for (GlobalVariable global : targets) {
            ConstantString plain = (ConstantString) global.getInitializer();
            byte[] data = plain.getData();
            byte[] cipher = encrypt(data, key);
            GlobalVariable encrypted = new GlobalVariable(module.uniqueGlobalName(global.getName() + ".enc"),
                    plain.getType(), new ConstantString(cipher), true, true);
            module.addGlobal(encrypted);

            for (Use use : new ArrayList<>(global.getUses())) {
                if (!(use.getUser() instanceof Instruction)) {
                    continue;
                }
                Instruction user = (Instruction) use.getUser();
                IRBuilder builder = new IRBuilder();
                positionForUse(builder, user, use);
                AllocaInst buffer = builder.createAlloca(plain.getType(), global.getName() + ".dec.alloca");
                builder.createCall(decrypt, Arrays.asList(buffer, encrypted, IRBuilder.getInt32(data.length)), null);
                use.set(buffer);
            }

            originalBytes += data.length - 1;
            encryptedBytes += cipher.length;
            if (global.hasUses()) {
                logger.warn("@{} is still referenced outside instructions, keeping the plain copy", global.getName());
            } else {
                module.removeGlobal(global);
            }
        }

        StringEncryptionStats stats = new StringEncryptionStats(targets.size(), originalBytes, encryptedBytes, key);
        logger.info("String encryption: {} strings, {} bytes encrypted", stats.getCount(), stats.getEncryptedBytes());
        return stats;
    }

    static boolean isEncryptable(GlobalVariable global) {
        if (!global.isConstant() || !(global.getInitializer() instanceof ConstantString)) {
            return false;
        }
        ConstantString init = (ConstantString) global.getInitializer();
        return init.isCString() && init.length() > 1;
    }

    static byte[] encrypt(byte[] data, int key) {
        byte[] out = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = (byte) (data[i] ^ key);
        }
        return out;
    }

    /**
     * A PHI reads its operand on the edge, so the buffer is filled at the end of
     * the incoming block instead of in front of the PHI.
     */
    private static void positionForUse(IRBuilder builder, Instruction user, Use use) {
        if (user instanceof PhiInst) {
            BasicBlock incoming = ((PhiInst) user).getIncomingBlock(use.getOperandIndex() / 2);
            builder.positionBeforeTerminator(incoming);
        } else {
            builder.positionBefore(user);
        }
    }

    /**
     * {@code void (ptr dest, ptr src, i32 length)}: copies {@code length} bytes
     * from {@code src} to {@code dest}, XOR-ing each with the key.
     */
    private static Function createDecryptFunction(IrModule module, int key) {
        List<Type> params = Arrays.asList(PointerType.PTR, PointerType.PTR, IntegerType.I32);
        Function function = new Function(module.uniqueGlobalName(DECRYPT_FUNCTION_NAME), VoidType.VOID, params,
                Arrays.asList("dest_ptr", "src_ptr", "length"));
        module.addFunction(function);
        Value dest = function.getArgument(0);
        Value src = function.getArgument(1);
        Value length = function.getArgument(2);

        BasicBlock entry = function.createBlock("entry");
        BasicBlock header = function.createBlock("loop_header");
        BasicBlock body = function.createBlock("loop_body");
        BasicBlock exit = function.createBlock("loop_exit");

        IRBuilder builder = new IRBuilder(entry);
        builder.createBr(header);

        builder.positionAtEnd(header);
        PhiInst index = builder.createPhi(IntegerType.I32, "index");
        ICmpInst cond = builder.createICmp(ICmpInst.Predicate.SLT, index, length, "loop_cond");
        builder.createCondBr(cond, body, exit);

        builder.positionAtEnd(body);
        GetElementPtrInst srcChar = builder.createGep(IntegerType.I8, src, index, "src_char_ptr");
        LoadInst loaded = builder.createLoad(IntegerType.I8, srcChar, "loaded_byte");
        Value decrypted = builder.createXor(loaded, IRBuilder.getInt8(key), "decrypted_byte");
        GetElementPtrInst destChar = builder.createGep(IntegerType.I8, dest, index, "dest_char_ptr");
        builder.createStore(decrypted, destChar);
        Value next = builder.createAdd(index, IRBuilder.getInt32(1), "next_index");
        builder.createBr(header);

        index.addIncoming(IRBuilder.getInt32(0), entry);
        index.addIncoming(next, body);

        builder.positionAtEnd(exit);
        builder.createRetVoid();
        return function;
    }
}
