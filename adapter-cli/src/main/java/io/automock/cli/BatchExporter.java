package io.automock.cli;

import io.automock.cli.config.ExportConfig;
import io.automock.core.engine.CompressionTransformer;
import io.automock.core.engine.ProgressiveExpander;
import io.automock.core.engine.ResponseFeature;
import io.automock.core.export.ExpectationJsonReader;
import io.automock.core.export.ExpectationJsonWriter;
import io.automock.core.model.Expectation;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one export: read the draft, apply the configured response features and
 * compression, expand progressive policies, write the wire JSON.
 *
 * <p>
 * The output file is written last, so a failure in any step leaves an
 * existing output untouched.
 */
public final class BatchExporter {

    private static final Logger LOG = LoggerFactory.getLogger(BatchExporter.class);

    private final ExpectationJsonReader reader;

    public BatchExporter() {
        this(new ExpectationJsonReader());
    }

    BatchExporter(ExpectationJsonReader reader) {
        this.reader = reader;
    }

    /** Counts reported after a successful run. */
    public record Summary(int read, int compressed, int written) {}

    /**
     * Exports according to {@code config}.
     *
     * @throws io.automock.core.error.ExpectationException if reading,
     *         transforming or writing fails
     */
    public Summary export(ExportConfig config) {
        List<Expectation> expectations = reader.read(config.input());
        int read = expectations.size();
        LOG.info("Loaded {} expectation(s) from {}", read, config.input());

        for (Map.Entry<String, String> feature : config.features().entrySet()) {
            ResponseFeature applier = ResponseFeature.fromKey(feature.getKey());
            expectations.forEach(exp -> applier.apply(exp, feature.getValue()));
            LOG.debug("Applied feature {}={} to {} expectation(s)", applier.key(), feature.getValue(), read);
        }

        int compressed = 0;
        String algorithm = config.compressionAlgorithm();
        if (algorithm != null && !algorithm.isBlank()) {
            for (Expectation exp : expectations) {
                if (exp.response() != null) {
                    CompressionTransformer.apply(exp, algorithm, config.compressionMode());
                    compressed++;
                }
            }
            LOG.info("Applied {} compression ({}) to {} response(s)", algorithm, config.compressionMode().configName(),
                    compressed);
        }

        if (config.progressiveEnabled()) {
            expectations = ProgressiveExpander.expand(expectations);
        }

        new ExpectationJsonWriter(config.priorityOrder(), config.pretty()).write(expectations, config.output());
        LOG.info("Wrote {} expectation(s) to {}", expectations.size(), config.output());
        return new Summary(read, compressed, expectations.size());
    }
}
