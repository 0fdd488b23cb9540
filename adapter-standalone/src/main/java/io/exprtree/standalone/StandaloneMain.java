package io.exprtree.standalone;

import io.exprtree.standalone.demo.DemoApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the expression tree demo.
 *
 * <p>
 * Delegates to {@link DemoApp#run(String[])}. On failure, logs the error and
 * exits with a non-zero status code.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g.
     *             {@code --config path/to/config.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            DemoApp.run(args);
        } catch (Exception e) {
            LOG.error("Demo failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
