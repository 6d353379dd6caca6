package io.avroxform.standalone;

import io.avroxform.core.engine.TransformPlugin;
import io.avroxform.core.error.TransformLoadException;
import io.avroxform.standalone.config.ConfigLoader;
import io.avroxform.standalone.config.StandaloneConfig;
import io.avroxform.standalone.runner.LogbackConfigurator;
import io.avroxform.standalone.runner.PayloadRunner;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone runner.
 *
 * <p>
 * {@code StandaloneMain --config <file> [payload files...]}: loads the configuration, initializes
 * one plugin, transforms each payload file (stdin when none is given) and writes the rows to
 * stdout in argument order. Exit status is 0 when every payload succeeded, 1 when any payload
 * failed and 2 when the configuration is invalid.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    /** Exit status for a configuration or startup failure. */
    public static final int EXIT_CONFIG_ERROR = 2;

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/config.yaml payload.bin})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            StandaloneConfig config = ConfigLoader.load(ConfigLoader.resolveConfigPath(args));
            LogbackConfigurator.configure(config);
            status = run(config, ConfigLoader.resolvePayloadPaths(args), System.in, System.out);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            status = EXIT_CONFIG_ERROR;
        }
        if (status != PayloadRunner.EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Initializes the plugin and runs every payload.
     *
     * @param config       loaded runner configuration
     * @param payloadFiles payload files; when empty, {@code in} is read as a single payload
     * @param in           fallback payload source
     * @param out          destination of the emitted rows
     * @return the process exit status
     * @throws IOException if reading payloads or writing output fails
     */
    public static int run(StandaloneConfig config, List<Path> payloadFiles, InputStream in, OutputStream out)
            throws IOException {
        TransformPlugin plugin = new TransformPlugin();
        try {
            plugin.init(config.properties());
        } catch (TransformLoadException e) {
            LOG.error("Invalid transform configuration: source={}, detail={}", e.source(), e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        LOG.info("Runner started: payloads={}, workers={}",
                payloadFiles.isEmpty() ? "stdin" : payloadFiles.size(), config.workers());
        try (PayloadRunner runner = new PayloadRunner(plugin, config.workers())) {
            return payloadFiles.isEmpty() ? runner.runStream(in, out) : runner.runFiles(payloadFiles, out);
        }
    }
}
