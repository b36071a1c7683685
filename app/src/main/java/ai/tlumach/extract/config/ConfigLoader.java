package ai.tlumach.extract.config;

import ai.tlumach.extract.cli.CliArguments;
import ai.tlumach.extract.template.TemplateEscaping;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LOCALE = "TLUMACH_LOCALE";
    static final String ENV_CSV_SEPARATOR = "TLUMACH_CSV_SEPARATOR";
    static final String ENV_TSV_QUOTES = "TLUMACH_TSV_QUOTES";
    static final String ENV_ESCAPING = "TLUMACH_ESCAPING";
    static final String ENV_RECOGNIZE_REFERENCES = "TLUMACH_RECOGNIZE_REFERENCES";
    static final String ENV_SKIP_EMPTY = "TLUMACH_SKIP_EMPTY";
    static final String ENV_DESCRIPTION_CAPTION = "TLUMACH_DESCRIPTION_CAPTION";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.input() == null) {
            throw new IllegalArgumentException("input file must be provided");
        }

        Optional<String> locale = Optional.ofNullable(arguments.locale())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.get(ENV_LOCALE).filter(ConfigLoader::isNotBlank));

        char csvSeparator = Optional.ofNullable(arguments.csvSeparator())
                .filter(ConfigLoader::isNotEmpty)
                .or(() -> environmentReader.get(ENV_CSV_SEPARATOR).filter(ConfigLoader::isNotEmpty))
                .map(ConfigLoader::parseSeparator)
                .orElse(ParserSettings.DEFAULT_CSV_SEPARATOR);

        boolean tsvQuotes = arguments.tsvQuotes() || resolveFlag(ENV_TSV_QUOTES, false);

        Optional<TemplateEscaping> escaping = Optional.ofNullable(arguments.escaping())
                .or(() -> environmentReader.get(ENV_ESCAPING)
                        .filter(ConfigLoader::isNotBlank)
                        .map(TemplateEscaping::from));

        boolean recognizeReferences = !arguments.noReferences() && resolveFlag(ENV_RECOGNIZE_REFERENCES, true);
        boolean skipEmpty = arguments.skipEmpty() || resolveFlag(ENV_SKIP_EMPTY, false);

        String descriptionCaption = firstNonBlank(arguments.descriptionCaption(), ENV_DESCRIPTION_CAPTION,
                ParserSettings.DEFAULT_DESCRIPTION_CAPTION);

        ParserSettings settings = new ParserSettings(csvSeparator, tsvQuotes, escaping, recognizeReferences, skipEmpty,
                descriptionCaption);

        OutputFormat outputFormat = arguments.tree() ? OutputFormat.TREE : OutputFormat.LIST;
        return new Config(arguments.input(), locale, outputFormat, settings, resolveLogFormat(arguments), arguments.verbose());
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(String envKey, boolean defaultValue) {
        return environmentReader.get(envKey)
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(defaultValue);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    static char parseSeparator(String raw) {
        if (raw.equals("\\t") || raw.equalsIgnoreCase("tab")) {
            return '\t';
        }
        if (raw.length() != 1) {
            throw new IllegalArgumentException("CSV separator must be a single character: " + raw);
        }
        return raw.charAt(0);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean isNotEmpty(String value) {
        return value != null && !value.isEmpty();
    }
}
