package ai.tlumach.extract.parse;

import ai.tlumach.extract.config.ParserSettings;
import java.util.Objects;

/**
 * Registers the built-in formats: CSV, TSV, JSON and ARB translations and JSON and ARB configuration files.
 * <p>
 * Applications call {@link #initialize} once before loading files and {@link #shutdown} when done;
 * nothing is registered implicitly.
 */
public final class StandardFormats {

    private StandardFormats() {
    }

    public static void registerAll(FileFormats registry, ParserSettings settings) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(settings, "settings");
        registry.register(FormatDescriptor.of(CsvParser.EXTENSION, () -> new CsvParser(settings)));
        registry.register(FormatDescriptor.of(TsvParser.EXTENSION, () -> new TsvParser(settings)));
        registry.register(FormatDescriptor.of(JsonParser.EXTENSION, () -> new JsonParser(settings)));
        registry.register(FormatDescriptor.of(ArbParser.EXTENSION, () -> new ArbParser(settings)));
        registry.registerConfig(FormatDescriptor.of(JsonParser.CONFIG_EXTENSION, () -> new JsonParser(settings)));
        registry.registerConfig(FormatDescriptor.of(ArbParser.CONFIG_EXTENSION, () -> new ArbParser(settings)));
    }

    /**
     * Creates a registry holding only the built-in formats.
     */
    public static FileFormats newRegistry(ParserSettings settings) {
        FileFormats registry = new FileFormats();
        registerAll(registry, settings);
        return registry;
    }

    /**
     * Replaces the content of the process-wide registry with the built-in formats configured by {@code settings}.
     *
     * @return the process-wide registry
     */
    public static FileFormats initialize(ParserSettings settings) {
        FileFormats registry = FileFormats.defaults();
        synchronized (registry) {
            registry.unregisterAll();
            registerAll(registry, settings);
        }
        return registry;
    }

    /**
     * Empties the process-wide registry.
     */
    public static void shutdown() {
        FileFormats.defaults().unregisterAll();
    }
}
