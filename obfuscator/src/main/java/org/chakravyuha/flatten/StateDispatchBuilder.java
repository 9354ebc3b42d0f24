package org.chakravyuha.flatten;

import org.chakravyuha.StatePool;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IRBuilder;
import org.chakravyuha.ir.Value;
import org.chakravyuha.ir.inst.AllocaInst;
import org.chakravyuha.ir.inst.Instruction;
import org.chakravyuha.ir.inst.LoadInst;
import org.chakravyuha.ir.inst.SwitchInst;
import org.chakravyuha.ir.inst.TerminatorInst;
import org.chakravyuha.ir.type.IntegerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the dispatch skeleton of a demoted function: the {@code cff.state}
 * slot, the {@code cff.dispatch} block switching on it and the trapping
 * {@code cff.default} block, then points the entry at the dispatcher.
 */
public final class StateDispatchBuilder {

    private static final Logger logger = LoggerFactory.getLogger(StateDispatchBuilder.class);

    public static final String STATE_SLOT_NAME = "cff.state";
    public static final String DISPATCH_BLOCK_NAME = "cff.dispatch";
    public static final String DEFAULT_BLOCK_NAME = "cff.default";

    /**
     * The pieces created for one function.
     */
    public static final class StateDispatch {
        private final AllocaInst stateSlot;
        private final BasicBlock dispatcher;
        private final BasicBlock defaultBlock;
        private final Map<BasicBlock, Integer> ids;

        StateDispatch(AllocaInst stateSlot, BasicBlock dispatcher, BasicBlock defaultBlock, Map<BasicBlock, Integer> ids) {
            this.stateSlot = stateSlot;
            this.dispatcher = dispatcher;
            this.defaultBlock = defaultBlock;
            this.ids = Collections.unmodifiableMap(ids);
        }

        public AllocaInst getStateSlot() {
            return stateSlot;
        }

        public BasicBlock getDispatcher() {
            return dispatcher;
        }

        public BasicBlock getDefaultBlock() {
            return defaultBlock;
        }

        public Map<BasicBlock, Integer> getIds() {
            return ids;
        }
    }

    /**
     * Gives every non-entry block selected by {@code policy} a state, in block order.
     */
    public static Map<BasicBlock, Integer> assignIdentifiers(Function function, TrivialBlockPolicy policy, StatePool pool) {
        Map<BasicBlock, Integer> ids = new LinkedHashMap<>();
        BasicBlock entry = function.getEntryBlock();
        for (BasicBlock bb : function.getBlocks()) {
            if (bb != entry && policy.isFlattened(bb)) {
                ids.put(bb, pool.getState(bb));
            }
        }
        return ids;
    }

    /**
     * @return the skeleton, or empty if the entry terminator has no next-state
     * value; in that case everything created here has been removed again
     */
    public Optional<StateDispatch> build(Function function, Map<BasicBlock, Integer> ids) {
        BasicBlock entry = function.getEntryBlock();
        IRBuilder builder = new IRBuilder();

        AllocaInst stateSlot = ValueDemoter.createSlot(builder, entry, IntegerType.I32, STATE_SLOT_NAME);

        BasicBlock dispatcher = function.createBlock(DISPATCH_BLOCK_NAME);
        BasicBlock defaultBlock = function.createBlock(DEFAULT_BLOCK_NAME);
        builder.positionAtEnd(defaultBlock);
        builder.createUnreachable();

        builder.positionAtEnd(dispatcher);
        LoadInst current = builder.createLoad(IntegerType.I32, stateSlot, "cff.cur");
        SwitchInst dispatch = builder.createSwitch(current, defaultBlock);
        for (Map.Entry<BasicBlock, Integer> e : ids.entrySet()) {
            dispatch.addCase(IRBuilder.getInt32(e.getValue()), e.getKey());
        }

        TerminatorInst entryTerm = entry.getTerminator();
        NextStateBuilder nextState = new NextStateBuilder(ids);
        if (!nextState.isExpressible(entryTerm)) {
            logger.debug("Entry terminator of @{} has no next-state value, removing the dispatcher", function.getName());
            abort(stateSlot, dispatcher, defaultBlock);
            return Optional.empty();
        }
        builder.positionBefore(entryTerm);
        Value initial = nextState.build(entryTerm, builder);
        builder.createStore(initial, stateSlot);
        builder.createBr(dispatcher);
        entryTerm.eraseFromParent();
        return Optional.of(new StateDispatch(stateSlot, dispatcher, defaultBlock, ids));
    }

    private static void abort(AllocaInst stateSlot, BasicBlock dispatcher, BasicBlock defaultBlock) {
        eraseAll(dispatcher);
        eraseAll(defaultBlock);
        dispatcher.eraseFromParent();
        defaultBlock.eraseFromParent();
        stateSlot.eraseFromParent();
    }

    private static void eraseAll(BasicBlock block) {
        while (!block.isEmpty()) {
            Instruction last = block.getLastInstruction();
            last.eraseFromParent();
        }
    }
}
