package assembly;

import java.util.List;

/**
 * Outcome of building one module: the assembled record plus the functions that failed.
 */
public final class ModuleAssemblyResult {

    private final EnhancedModuleData module;
    private final List<FunctionFailure> failures;

    public ModuleAssemblyResult(EnhancedModuleData module, List<FunctionFailure> failures) {
        this.module = module;
        this.failures = List.copyOf(failures);
    }

    public EnhancedModuleData getModule() { return module; }
    public List<FunctionFailure> getFailures() { return failures; }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
