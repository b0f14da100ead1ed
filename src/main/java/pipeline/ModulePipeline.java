package pipeline;

import assembly.AggregateAssembler;
import assembly.EnhancedFunctionData;
import assembly.EnhancedModuleData;
import assembly.FunctionFailure;
import assembly.ModuleAssemblyResult;
import ast.FunctionSource;
import cpg.CodePropertyGraph;
import cpg.GraphUnifier;
import cpg.IndexBuilder;
import cpg.NodeMappings;
import cpg.SymbolTable;
import errors.CpgException;
import errors.DuplicateFunctionNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.CFGGenerator;
import sanalysis.ControlFlowGraph;
import sanalysis.DFGGenerator;
import sanalysis.DataFlowGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds every function of a module on a fixed worker pool, then hands the results to the
 * {@link AggregateAssembler}.
 *
 * The symbol table is built before any task starts and shared read-only. Tasks share nothing
 * else, so the outcome does not depend on the number of workers. A function that fails is
 * reported and left out; the others are still assembled.
 */
public class ModulePipeline {
    private static final Logger logger = LoggerFactory.getLogger(ModulePipeline.class);

    private final PipelineConfig config;
    private final CFGGenerator cfgGenerator = new CFGGenerator();
    private final DFGGenerator dfgGenerator = new DFGGenerator();
    private final GraphUnifier unifier = new GraphUnifier();
    private final IndexBuilder indexBuilder = new IndexBuilder();
    private final AggregateAssembler assembler = new AggregateAssembler();

    public ModulePipeline(PipelineConfig config) {
        this.config = config;
    }

    public ModuleAssemblyResult run(String moduleName, List<FunctionSource> functions) throws DuplicateFunctionNameException {
        return run(moduleName, functions, SymbolTable.EMPTY);
    }

    /**
     * @param externalSymbols functions of other modules that calls may resolve to
     * @throws DuplicateFunctionNameException if two functions share a qualified name; nothing is built
     */
    public ModuleAssemblyResult run(String moduleName, List<FunctionSource> functions, SymbolTable externalSymbols)
            throws DuplicateFunctionNameException {
        List<String> names = new ArrayList<>();
        for (FunctionSource function : functions) {
            names.add(function.getQualifiedName());
        }
        AggregateAssembler.requireUniqueNames(moduleName, names);

        SymbolTable symbols = buildSymbolTable(functions, externalSymbols);
        logger.info("Building module {}: {} function(s) on {} worker(s)", moduleName, functions.size(), config.getWorkers());

        List<Callable<EnhancedFunctionData>> tasks = new ArrayList<>();
        for (FunctionSource function : functions) {
            tasks.add(() -> buildFunction(function, symbols));
        }

        List<EnhancedFunctionData> built = new ArrayList<>();
        List<FunctionFailure> failures = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(config.getWorkers());
        try {
            List<Future<EnhancedFunctionData>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                FunctionSource function = functions.get(i);
                try {
                    built.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof CpgException) {
                        FunctionFailure failure = new FunctionFailure(function.getQualifiedName(), (CpgException) cause);
                        logger.warn("Skipping {}: {}", function.getQualifiedName(), failure.getMessage());
                        failures.add(failure);
                    } else if (cause instanceof RuntimeException) {
                        throw (RuntimeException) cause;
                    } else {
                        throw new IllegalStateException("Unexpected failure building " + function.getQualifiedName(), cause);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building module " + moduleName, e);
        } finally {
            executor.shutdownNow();
        }

        EnhancedModuleData module = assembler.assembleModule(moduleName, built, config.isModuleGraph());
        if (!failures.isEmpty()) {
            logger.warn("Module {}: {} of {} function(s) failed", moduleName, failures.size(), functions.size());
        }
        return new ModuleAssemblyResult(module, failures);
    }

    /**
     * Runs CFG, DFG, unification and indexing for one function.
     */
    public EnhancedFunctionData buildFunction(FunctionSource function, SymbolTable symbols) throws CpgException {
        ControlFlowGraph cfg = cfgGenerator.generate(function);
        DataFlowGraph dfg = dfgGenerator.generate(function, cfg);
        CodePropertyGraph cpg = unifier.unify(function, cfg, dfg, symbols);
        NodeMappings mappings = indexBuilder.build(cpg);
        return assembler.assembleFunction(function, cfg, dfg, cpg, mappings);
    }

    private SymbolTable buildSymbolTable(List<FunctionSource> functions, SymbolTable externalSymbols) {
        if (!config.isResolveCalls()) {
            return SymbolTable.EMPTY;
        }
        SymbolTable.Builder builder = SymbolTable.builder().addAll(externalSymbols);
        for (FunctionSource function : functions) {
            builder.add(function);
        }
        return builder.build();
    }
}
