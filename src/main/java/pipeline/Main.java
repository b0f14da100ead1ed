package pipeline;

import assembly.EnhancedFunctionData;
import assembly.FunctionFailure;
import assembly.ModuleAssemblyResult;
import ast.FunctionSource;
import ast.JavaAstAdapter;
import ast.SourcePositionRegistry;
import com.github.javaparser.ParseProblemException;
import errors.CpgIoException;
import errors.DuplicateFunctionNameException;
import io.CpgDotExporter;
import io.CpgSerializer;
import io.MetricsCsvExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command line entry: builds the code property graphs of every method in one Java file.
 *
 * Writes {@code <module>.cpg.json}, {@code <module>.metrics.csv} and, unless disabled, one DOT file
 * per function into the output directory.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String DEFAULT_OUTPUT = "target/cpg";

    public static void main(String[] args) {
        if (args.length < 1) {
            System.out.println("Usage: java pipeline.Main <source.java> [<outputDir>]");
            System.out.println("Settings: -D" + PipelineConfig.WORKERS + "=<n> -D" + PipelineConfig.MODULE_GRAPH
                    + "=<bool> -D" + PipelineConfig.RESOLVE_CALLS + "=<bool> -D" + PipelineConfig.DOT_EXPORT + "=<bool>");
            System.exit(2);
        }
        Path source = Paths.get(args[0]);
        Path outputDir = Paths.get(args.length >= 2 ? args[1] : DEFAULT_OUTPUT);
        try {
            int failures = run(source, outputDir, PipelineConfig.load());
            System.exit(failures == 0 ? 0 : 1);
        } catch (IOException | CpgIoException e) {
            logger.error("I/O failure: {}", e.getMessage(), e);
            System.exit(3);
        } catch (ParseProblemException e) {
            logger.error("Could not parse {}: {}", source, e.getMessage());
            System.exit(3);
        } catch (DuplicateFunctionNameException e) {
            logger.error(e.getMessage());
            System.exit(1);
        }
    }

    /**
     * @return the number of functions that could not be built
     */
    public static int run(Path source, Path outputDir, PipelineConfig config)
            throws IOException, DuplicateFunctionNameException {
        String moduleName = moduleNameOf(source);
        List<FunctionSource> functions = new JavaAstAdapter(new SourcePositionRegistry()).parse(source);

        ModuleAssemblyResult result = new ModulePipeline(config).run(moduleName, functions);

        new CpgSerializer().write(result.getModule(), outputDir.resolve(moduleName + ".cpg.json"));
        new MetricsCsvExporter().write(result.getModule(), outputDir.resolve(moduleName + ".metrics.csv"));
        if (config.isDotExport()) {
            CpgDotExporter dot = new CpgDotExporter();
            for (EnhancedFunctionData function : result.getModule().getFunctions().values()) {
                dot.write(function.getCpg(), outputDir.resolve("dot").resolve(fileNameOf(function.getQualifiedName()) + ".dot"));
            }
        }
        for (FunctionFailure failure : result.getFailures()) {
            logger.warn("Not built: {}", failure);
        }
        logger.info("Module {}: {} built, {} failed", moduleName,
                result.getModule().getFunctions().size(), result.getFailures().size());
        return result.getFailures().size();
    }

    static String moduleNameOf(Path source) {
        String file = source.getFileName().toString();
        return file.endsWith(".java") ? file.substring(0, file.length() - ".java".length()) : file;
    }

    static String fileNameOf(String qualifiedName) {
        return qualifiedName.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
