package ai.tlumach.extract.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path input,
        Optional<String> locale,
        OutputFormat outputFormat,
        ParserSettings parserSettings,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(input, "input");
        locale = locale == null ? Optional.empty() : locale.map(String::trim).filter(value -> !value.isEmpty());
        outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
        parserSettings = Objects.requireNonNull(parserSettings, "parserSettings");
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
    }
}
