package org.chakravyuha.flatten;

import org.chakravyuha.StatePool;
import org.chakravyuha.ir.BasicBlock;
import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.analysis.IrVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Flattens one function at a time. A function either comes out fully
 * flattened or is not touched at all: every check that can reject it runs
 * before the first mutation.
 * <p>
 * Steps: eligibility check, state assignment and entry check (the plan),
 * demotion, dispatcher construction, terminator rewriting, removal of blocks
 * that became unreachable and optional verification.
 */
public class ControlFlowFlattener {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowFlattener.class);

    private final FlatteningOptions options;
    private final EligibilityChecker eligibilityChecker = new EligibilityChecker();
    private final ValueDemoter demoter = new ValueDemoter();
    private final StateDispatchBuilder dispatchBuilder = new StateDispatchBuilder();
    private final TerminatorRewriter rewriter = new TerminatorRewriter();
    private final UnreachableBlockRemover blockRemover = new UnreachableBlockRemover();

    public ControlFlowFlattener() {
        this(FlatteningOptions.defaults());
    }

    public ControlFlowFlattener(FlatteningOptions options) {
        this.options = options;
    }

    public FlatteningOptions getOptions() {
        return options;
    }

    public FlatteningResult flatten(Function function) {
        Optional<SkipReason> rejection = eligibilityChecker.check(function);
        if (rejection.isPresent()) {
            SkipReason reason = rejection.get();
            if (reason.countsAsSkipped()) {
                logger.info("Skipping @{}: {}", function.getName(), reason.getDescription());
            }
            return FlatteningResult.skipped(reason);
        }

        StatePool pool = options.getStatePoolFactory().create(function);
        Map<BasicBlock, Integer> ids = StateDispatchBuilder.assignIdentifiers(function, options.getTrivialBlockPolicy(), pool);
        if (!new NextStateBuilder(ids).isExpressible(function.getEntryBlock().getTerminator())) {
            logger.info("Skipping @{}: {}", function.getName(), SkipReason.UNEXPRESSIBLE_INITIAL_STATE.getDescription());
            return FlatteningResult.skipped(SkipReason.UNEXPRESSIBLE_INITIAL_STATE);
        }

        int slots = demoter.demote(function);
        StateDispatchBuilder.StateDispatch dispatch = dispatchBuilder.build(function, ids)
                .orElseThrow(() -> new IllegalStateException(
                        "Entry of @" + function.getName() + " lost its next-state value during demotion"));
        int rewritten = rewriter.rewrite(function, dispatch);
        int removed = blockRemover.removeUnreachable(function);

        List<String> diagnostics = Collections.emptyList();
        if (options.isVerify()) {
            diagnostics = IrVerifier.verify(function);
            for (String diagnostic : diagnostics) {
                logger.warn("Verification of flattened @{}: {}", function.getName(), diagnostic);
            }
        }
        logger.debug("Flattened @{}: {} states, {} slots, {} terminators rewritten, {} blocks removed",
                function.getName(), ids.size(), slots, rewritten, removed);
        return FlatteningResult.flattened(ids.size(), diagnostics);
    }
}
