package ai.tlumach.extract.parse;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Describes a file format for {@link FileFormats}: its extension, how to create a parser and which
 * extensions the parser accepts.
 */
public record FormatDescriptor(String extension, Supplier<? extends TranslationParser> factory, Predicate<String> canHandle) {

    public FormatDescriptor {
        extension = normalize(extension);
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(canHandle, "canHandle");
    }

    /**
     * Descriptor accepting exactly its own extension, ignoring case.
     */
    public static FormatDescriptor of(String extension, Supplier<? extends TranslationParser> factory) {
        String normalized = normalize(extension);
        return new FormatDescriptor(normalized, factory, candidate -> candidate != null && candidate.equalsIgnoreCase(normalized));
    }

    public TranslationParser newParser() {
        return Objects.requireNonNull(factory.get(), "factory returned no parser");
    }

    static String normalize(String extension) {
        if (extension == null || extension.isBlank()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }
}
