package io.automock.cli.config;

import io.automock.core.engine.CompressionMode;
import io.automock.core.export.PriorityOrder;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of one batch export run. Use {@link #builder()}; every field except
 * {@code input} and {@code output} has a default.
 *
 * @param input                draft file (JSON or YAML)
 * @param output               wire JSON file to write
 * @param progressiveEnabled   expand progressive delay policies
 * @param compressionAlgorithm coding applied to every response, or
 *                             {@code null} for none
 * @param compressionMode      how the coding is applied
 * @param pretty               pretty-print the output
 * @param priorityOrder        priority convention of the consuming engine
 * @param features             response features applied to every expectation,
 *                             in order (feature key → argument)
 * @param loggingFormat        {@code text} or {@code json}
 * @param loggingLevel         root log level
 */
public record ExportConfig(
        Path input,
        Path output,
        boolean progressiveEnabled,
        String compressionAlgorithm,
        CompressionMode compressionMode,
        boolean pretty,
        PriorityOrder priorityOrder,
        Map<String, String> features,
        String loggingFormat,
        String loggingLevel) {

    public ExportConfig {
        features = features == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link ExportConfig}. */
    public static final class Builder {
        private Path input;
        private Path output;
        private boolean progressiveEnabled = true;
        private String compressionAlgorithm;
        private CompressionMode compressionMode = CompressionMode.HEADERS_ONLY;
        private boolean pretty = true;
        private PriorityOrder priorityOrder = PriorityOrder.LOWER_FIRST;
        private final Map<String, String> features = new LinkedHashMap<>();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public Builder output(Path output) {
            this.output = output;
            return this;
        }

        public Builder progressiveEnabled(boolean progressiveEnabled) {
            this.progressiveEnabled = progressiveEnabled;
            return this;
        }

        public Builder compressionAlgorithm(String compressionAlgorithm) {
            this.compressionAlgorithm = compressionAlgorithm;
            return this;
        }

        public Builder compressionMode(CompressionMode compressionMode) {
            this.compressionMode = compressionMode;
            return this;
        }

        public Builder pretty(boolean pretty) {
            this.pretty = pretty;
            return this;
        }

        public Builder priorityOrder(PriorityOrder priorityOrder) {
            this.priorityOrder = priorityOrder;
            return this;
        }

        public Builder feature(String key, String argument) {
            this.features.put(key, argument);
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public ExportConfig build() {
            return new ExportConfig(
                    input,
                    output,
                    progressiveEnabled,
                    compressionAlgorithm,
                    compressionMode,
                    pretty,
                    priorityOrder,
                    features,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
