package io.automock.cli;

import io.automock.cli.config.ConfigLoader;
import io.automock.cli.config.ExportConfig;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the batch exporter. On failure, logs the error and exits
 * with status 1.
 */
public final class ExportMain {

    private static final Logger LOG = LoggerFactory.getLogger(ExportMain.class);

    private ExportMain() {
        // utility class
    }

    /**
     * @param args command-line arguments, e.g. {@code --config automock.yaml}
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        try {
            run(args);
        } catch (Exception e) {
            LOG.error("Export failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static BatchExporter.Summary run(String[] args) {
        Path configPath = ConfigLoader.resolveConfigPath(args);
        ExportConfig config = ConfigLoader.load(configPath);
        LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
        LOG.info("Configuration loaded from {}", configPath);
        return new BatchExporter().export(config);
    }
}
