package io.exprtree.standalone.demo;

import io.exprtree.core.engine.TreeEngine;
import io.exprtree.core.model.Expression;
import io.exprtree.standalone.LogbackConfigurator;
import io.exprtree.standalone.config.ConfigLoader;
import io.exprtree.standalone.config.DemoConfig;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the demo end to end.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Load configuration from YAML (if {@code --config} is given) + env
 * overlay</li>
 * <li>Configure Logback from {@code logging.format} and
 * {@code logging.level}</li>
 * <li>Build {@code abs(var * sqrt(32.0 - 16.0))}</li>
 * <li>Evaluate it, deep-copy it, evaluate the copy</li>
 * <li>Print {@code Result:} and {@code New Result:} lines</li>
 * </ol>
 *
 * <p>
 * Separate from {@link io.exprtree.standalone.StandaloneMain} to allow
 * testing without going through {@code main()}.
 */
public final class DemoApp {

    private static final Logger LOG = LoggerFactory.getLogger(DemoApp.class);

    private DemoApp() {
        // utility class
    }

    /** Runs with the process environment, printing to {@link System#out}. */
    public static DemoReport run(String[] args) {
        return run(args, System::getenv, System.out);
    }

    /**
     * Runs the demo.
     *
     * @param args      command-line arguments (e.g.
     *                  {@code --config path/to/config.yaml})
     * @param envLookup environment variable lookup function
     * @param out       where the result lines are printed
     * @return the trees and values produced
     * @throws io.exprtree.standalone.config.ConfigLoadException if the
     *         configuration cannot be loaded
     * @throws io.exprtree.core.error.ExpressionEvalException    in strict mode,
     *         if evaluation fails
     */
    public static DemoReport run(String[] args, Function<String, String> envLookup, PrintStream out) {
        Optional<Path> configPath = ConfigLoader.resolveConfigPath(args);
        DemoConfig config = configPath.isPresent()
                ? ConfigLoader.load(configPath.get(), envLookup)
                : ConfigLoader.defaults(envLookup);

        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());

        LOG.info(
                "Configuration loaded from {}: mode={}, max-depth={}",
                configPath.map(Path::toString).orElse("built-in defaults"),
                config.engineMode(),
                config.maxDepth());

        TreeEngine engine = new TreeEngine(config.evalLimits(), config.engineMode());

        Expression tree = ReferenceTree.build(config.variableValue());
        double result = engine.evaluate(tree);
        out.println("Result: " + result);

        Expression copy = engine.copy(tree);
        double copyResult = engine.evaluate(copy);
        out.println("New Result: " + copyResult);

        LOG.info("Evaluated {} = {}, copy = {}", tree, result, copyResult);
        return new DemoReport(tree, copy, result, copyResult);
    }
}
