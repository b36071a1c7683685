package ai.tlumach.extract.parse;

import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationConfiguration;
import ai.tlumach.extract.model.TranslationTree;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import javax.lang.model.SourceVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reads translation and configuration files from disk and hands them to the parser registered for
 * their extension. Parse errors are re-thrown with the file they occurred in.
 */
public class TranslationLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationLoader.class);

    static final String MDC_FILE = "file";

    private final FileFormats formats;

    public TranslationLoader(FileFormats formats) {
        this.formats = Objects.requireNonNull(formats, "formats");
    }

    public Optional<Translation> load(Path file, String locale) {
        TranslationParser parser = parserFor(file);
        String content = read(file);
        Optional<Translation> translation = withFileContext(file, () -> parser.loadTranslation(content, locale));
        translation.ifPresentOrElse(
                loaded -> LOGGER.info("Loaded {} entries from {}", loaded.size(), file),
                () -> LOGGER.info("No translation for locale '{}' in {}", locale == null ? "" : locale, file));
        return translation.map(loaded -> loaded.withOrigin(file));
    }

    public Optional<TranslationTree> loadStructure(Path file) {
        TranslationParser parser = parserFor(file);
        String content = read(file);
        return withFileContext(file, () -> parser.loadTranslationStructure(content));
    }

    public TranslationConfiguration loadConfiguration(Path file) {
        String extension = extensionOf(file);
        TranslationParser parser = formats.configParserFor(extension)
                .orElseThrow(() -> new ParserLoadException(file, "No configuration parser found for the '" + extension + "' file extension"));
        String content = read(file);
        try {
            return withFileContext(file, () -> parser.parseConfiguration(content));
        } catch (ParserConfigException ex) {
            throw new ParserConfigException("Parsing of the configuration file '" + file + "' has failed with an error: "
                    + ex.getMessage(), ex);
        }
    }

    /**
     * Loads a configuration file and builds the key tree of the default translation file it names.
     * A relative default file is resolved against the configuration file's directory.
     */
    public Optional<TranslationTree> loadStructureFromConfiguration(Path configFile) {
        TranslationConfiguration configuration = loadConfiguration(configFile);
        validate(configFile, configuration);
        Path defaultFile = Path.of(configuration.defaultFile());
        if (!defaultFile.isAbsolute() && configFile.getParent() != null) {
            defaultFile = configFile.getParent().resolve(defaultFile);
        }
        LOGGER.debug("Configuration {} names default translation file {}", configFile, defaultFile);
        return loadStructure(defaultFile);
    }

    public static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private TranslationParser parserFor(Path file) {
        Objects.requireNonNull(file, "file");
        String extension = extensionOf(file);
        TranslationParser parser = formats.parserFor(extension)
                .orElseThrow(() -> new ParserLoadException(file, "No parser found for the '" + extension + "' file extension of " + file));
        LOGGER.debug("Parsing {} with {}", file, parser.getClass().getSimpleName());
        return parser;
    }

    private String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ParserLoadException(file, "Loading of the file '" + file + "' has failed", ex);
        }
    }

    private <T> T withFileContext(Path file, Supplier<T> action) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_FILE, file.toString())) {
            return action.get();
        } catch (TextFileParseException ex) {
            throw ex;
        } catch (TextParseException ex) {
            throw new TextFileParseException(file, ex);
        } catch (DuplicateKeyException ex) {
            throw ex.file().isPresent() ? ex : ex.inFile(file);
        } catch (ParserLoadException | ParserConfigException ex) {
            throw ex;
        } catch (TranslationParserException ex) {
            throw new TranslationParserException(file + ": " + ex.getMessage(), ex);
        }
    }

    private static void validate(Path configFile, TranslationConfiguration configuration) {
        if (configuration.defaultFile().isBlank()) {
            throw new ParserConfigException("No reference to a default translation file is present in " + configFile
                    + ". The reference must be specified as a 'defaultFile' setting.");
        }
        configuration.defaultLocale().ifPresent(locale -> {
            if (Locale.forLanguageTag(locale.replace('_', '-')).getLanguage().isEmpty()) {
                throw new ParserConfigException("Unknown locale identifier '" + locale + "' specified as a default locale in " + configFile);
            }
        });
        configuration.generatedNamespace().ifPresent(namespace -> {
            if (!SourceVersion.isName(namespace)) {
                throw new ParserConfigException("The provided namespace name '" + namespace + "' is not a valid qualified identifier");
            }
        });
        configuration.generatedClassName().ifPresent(className -> {
            if (!SourceVersion.isIdentifier(className) || SourceVersion.isKeyword(className)) {
                throw new ParserConfigException("The provided class name '" + className + "' is not a valid identifier");
            }
        });
    }
}
