package ai.tlumach.extract.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry mapping file extensions to parser factories, separately for translation files and
 * configuration files.
 * <p>
 * Formats are registered explicitly, usually through {@link StandardFormats#registerAll}. The first
 * registration of an extension wins. {@link #defaults()} is the process-wide instance, filled by
 * {@link StandardFormats#initialize} and emptied by {@link StandardFormats#shutdown}; tests and
 * embedders may create their own.
 */
public class FileFormats {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileFormats.class);

    private static final FileFormats DEFAULT = new FileFormats();

    private final Map<String, FormatDescriptor> parsers = new LinkedHashMap<>();
    private final Map<String, FormatDescriptor> configParsers = new LinkedHashMap<>();

    public static FileFormats defaults() {
        return DEFAULT;
    }

    /**
     * Registers a translation file format.
     *
     * @return {@code false} if the extension was already registered
     */
    public synchronized boolean register(FormatDescriptor descriptor) {
        return put(parsers, descriptor, "translation");
    }

    public synchronized boolean registerConfig(FormatDescriptor descriptor) {
        return put(configParsers, descriptor, "configuration");
    }

    /**
     * Removes all registrations.
     */
    public synchronized void unregisterAll() {
        parsers.clear();
        configParsers.clear();
    }

    /**
     * Creates a parser for translation files with the extension. When no format is registered under the
     * extension itself, the first format whose capability check accepts it is used.
     */
    public synchronized Optional<TranslationParser> parserFor(String extension) {
        return lookup(parsers, extension);
    }

    public synchronized Optional<TranslationParser> configParserFor(String extension) {
        return lookup(configParsers, extension);
    }

    public synchronized List<String> supportedExtensions() {
        return new ArrayList<>(parsers.keySet());
    }

    public synchronized List<String> supportedConfigExtensions() {
        return new ArrayList<>(configParsers.keySet());
    }

    private static boolean put(Map<String, FormatDescriptor> target, FormatDescriptor descriptor, String kind) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (target.putIfAbsent(descriptor.extension(), descriptor) != null) {
            LOGGER.debug("Ignoring duplicate {} format registration for {}", kind, descriptor.extension());
            return false;
        }
        LOGGER.debug("Registered {} format {}", kind, descriptor.extension());
        return true;
    }

    private static Optional<TranslationParser> lookup(Map<String, FormatDescriptor> source, String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        String normalized = FormatDescriptor.normalize(extension);
        FormatDescriptor descriptor = source.get(normalized);
        if (descriptor == null) {
            descriptor = source.values().stream()
                    .filter(candidate -> candidate.canHandle().test(normalized))
                    .findFirst()
                    .orElse(null);
        }
        return Optional.ofNullable(descriptor).map(FormatDescriptor::newParser);
    }
}
