package org.chakravyuha.flatten;

import org.chakravyuha.ir.Function;
import org.chakravyuha.ir.IrModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs the {@link ControlFlowFlattener} over every function of a module and
 * collects the results.
 */
public class ControlFlowFlatteningPass {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowFlatteningPass.class);

    private final ControlFlowFlattener flattener;

    public ControlFlowFlatteningPass(FlatteningOptions options) {
        this(new ControlFlowFlattener(options));
    }

    public ControlFlowFlatteningPass(ControlFlowFlattener flattener) {
        this.flattener = flattener;
    }

    public FlatteningSummary run(IrModule module) {
        Map<String, FlatteningResult> results = new LinkedHashMap<>();
        for (Function function : new ArrayList<>(module.getFunctions())) {
            results.put(function.getName(), flattener.flatten(function));
        }
        FlatteningSummary summary = new FlatteningSummary(results);
        logger.info("Control-flow flattening: {} functions, {} blocks flattened, {} functions skipped",
                summary.getFlattenedFunctions(), summary.getFlattenedBlocks(), summary.getSkippedFunctions());
        return summary;
    }
}
