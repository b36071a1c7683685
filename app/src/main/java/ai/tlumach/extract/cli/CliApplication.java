package ai.tlumach.extract.cli;

import ai.tlumach.extract.config.Config;
import ai.tlumach.extract.config.ConfigLoader;
import ai.tlumach.extract.config.OutputFormat;
import ai.tlumach.extract.config.SystemEnvironmentReader;
import ai.tlumach.extract.logging.LoggingConfigurator;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationTree;
import ai.tlumach.extract.parse.FileFormats;
import ai.tlumach.extract.parse.StandardFormats;
import ai.tlumach.extract.parse.TranslationLoader;
import ai.tlumach.extract.parse.TranslationParserException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and format registry.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_NOTHING_LOADED = 1;
    static final int EXIT_PARSE_ERROR = 2;

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            err.println(ex.getMessage());
            commandLine.usage(err);
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.debug("Extracting {} (locale={}, output={})", config.input(), config.locale().orElse("-"), config.outputFormat());

        FileFormats formats = StandardFormats.initialize(config.parserSettings());
        TranslationLoader loader = new TranslationLoader(formats);
        EntryPrinter printer = new EntryPrinter(out);
        try {
            return extract(config, formats, loader, printer);
        } catch (TranslationParserException ex) {
            LOGGER.debug("Extraction of {} failed", config.input(), ex);
            err.println(ex.getMessage());
            return EXIT_PARSE_ERROR;
        } finally {
            StandardFormats.shutdown();
        }
    }

    private int extract(Config config, FileFormats formats, TranslationLoader loader, EntryPrinter printer) {
        String extension = TranslationLoader.extensionOf(config.input());
        if (formats.supportedConfigExtensions().contains(extension)) {
            Optional<TranslationTree> tree = loader.loadStructureFromConfiguration(config.input());
            tree.ifPresent(printer::printTree);
            return tree.isPresent() ? EXIT_OK : EXIT_NOTHING_LOADED;
        }
        if (config.outputFormat() == OutputFormat.TREE) {
            Optional<TranslationTree> tree = loader.loadStructure(config.input());
            tree.ifPresent(printer::printTree);
            return tree.isPresent() ? EXIT_OK : EXIT_NOTHING_LOADED;
        }
        Optional<Translation> translation = loader.load(config.input(), config.locale().orElse(null));
        if (translation.isEmpty()) {
            err.println("No translation found in " + config.input() + config.locale().map(locale -> " for locale " + locale).orElse(""));
            return EXIT_NOTHING_LOADED;
        }
        printer.printEntries(translation.get());
        return EXIT_OK;
    }
}
