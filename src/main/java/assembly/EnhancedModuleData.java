package assembly;

import cpg.CodePropertyGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A module's assembled functions, in input order, and the optional union of their graphs.
 */
public final class EnhancedModuleData {

    private final String moduleName;
    private final Map<String, EnhancedFunctionData> functions;
    private final CodePropertyGraph moduleLevelCpg;

    EnhancedModuleData(String moduleName, Map<String, EnhancedFunctionData> functions, CodePropertyGraph moduleLevelCpg) {
        this.moduleName = moduleName;
        this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.moduleLevelCpg = moduleLevelCpg;
    }

    public String getModuleName() { return moduleName; }
    public Map<String, EnhancedFunctionData> getFunctions() { return functions; }

    public Optional<EnhancedFunctionData> getFunction(String qualifiedName) {
        return Optional.ofNullable(functions.get(qualifiedName));
    }

    public Optional<CodePropertyGraph> getModuleLevelCpg() {
        return Optional.ofNullable(moduleLevelCpg);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EnhancedModuleData)) return false;
        EnhancedModuleData other = (EnhancedModuleData) obj;
        return moduleName.equals(other.moduleName) && functions.equals(other.functions)
                && Objects.equals(moduleLevelCpg, other.moduleLevelCpg);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleName, functions.keySet());
    }
}
