package ai.tlumach.extract.cli;

import ai.tlumach.extract.config.LogFormat;
import ai.tlumach.extract.template.TemplateEscaping;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "tlumach-extract", mixinStandardHelpOptions = true,
        version = "tlumach-extract 0.1.0-SNAPSHOT",
        description = "Extracts localizable entries from CSV, TSV, JSON and ARB translation files")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "Translation file (.csv, .tsv, .json, .arb) or configuration file (.jsoncfg, .arbcfg)")
    private Path input;

    @CommandLine.Option(names = "--locale", description = "Locale column to read from table files", paramLabel = "LOCALE")
    private String locale;

    @CommandLine.Option(names = "--tree", description = "Print the key tree instead of the entry list")
    private boolean tree;

    @CommandLine.Option(names = "--csv-separator", description = "Field separator of CSV files (default: ,)", paramLabel = "CHAR")
    private String csvSeparator;

    @CommandLine.Option(names = "--tsv-quotes", description = "Treat quotes in TSV files as field delimiters")
    private boolean tsvQuotes;

    @CommandLine.Option(names = "--escaping", converter = TemplateEscapingConverter.class,
            description = "Placeholder escaping: none, backslash, arb, arb-no-escaping or dotnet", paramLabel = "MODE")
    private TemplateEscaping escaping;

    @CommandLine.Option(names = "--no-references", description = "Treat values starting with @ as plain text")
    private boolean noReferences;

    @CommandLine.Option(names = "--skip-empty", description = "Skip empty table cells instead of loading empty texts")
    private boolean skipEmpty;

    @CommandLine.Option(names = "--description-caption", description = "Header caption of the description column", paramLabel = "CAPTION")
    private String descriptionCaption;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log parser details")
    private boolean verbose;

    public Path input() {
        return input;
    }

    public String locale() {
        return locale;
    }

    public boolean tree() {
        return tree;
    }

    public String csvSeparator() {
        return csvSeparator;
    }

    public boolean tsvQuotes() {
        return tsvQuotes;
    }

    public TemplateEscaping escaping() {
        return escaping;
    }

    public boolean noReferences() {
        return noReferences;
    }

    public boolean skipEmpty() {
        return skipEmpty;
    }

    public String descriptionCaption() {
        return descriptionCaption;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
