package io.fieldcheck.standalone;

import io.fieldcheck.standalone.app.FieldCheckApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone field validator.
 *
 * <p>
 * Delegates to {@link FieldCheckApp#run(String[], java.io.PrintStream)} and
 * exits with its status code. An unexpected failure is logged and exits with
 * {@link FieldCheckApp#EXIT_ERROR}.
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
     *             {@code --rules customer.yaml --input customer.json})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = FieldCheckApp.run(args, System.out);
        } catch (Exception e) {
            LOG.error("Validation run failed: {}", e.getMessage(), e);
            exitCode = FieldCheckApp.EXIT_ERROR;
        }
        System.exit(exitCode);
    }
}
