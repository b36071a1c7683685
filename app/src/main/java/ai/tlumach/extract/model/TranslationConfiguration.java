package ai.tlumach.extract.model;

import ai.tlumach.extract.template.TemplateEscaping;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Contents of a translation project configuration file: the default translation file and
 * the per-locale files that complement it.
 */
public record TranslationConfiguration(
        String defaultFile,
        Optional<String> defaultLocale,
        Optional<String> generatedNamespace,
        Optional<String> generatedClassName,
        TemplateEscaping escaping,
        Map<String, String> translations
) {

    public static final String DEFAULT_TRANSLATION = "DEFAULT";

    public TranslationConfiguration {
        defaultFile = defaultFile == null ? "" : defaultFile;
        defaultLocale = defaultLocale == null ? Optional.empty() : defaultLocale;
        generatedNamespace = generatedNamespace == null ? Optional.empty() : generatedNamespace;
        generatedClassName = generatedClassName == null ? Optional.empty() : generatedClassName;
        escaping = Objects.requireNonNull(escaping, "escaping");
        translations = translations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(translations));
    }

    /**
     * Returns the file registered for the locale, matching the locale name case-insensitively.
     */
    public Optional<String> translationFileFor(String locale) {
        if (locale == null || locale.isBlank()) {
            return Optional.ofNullable(translations.get(DEFAULT_TRANSLATION));
        }
        return Optional.ofNullable(translations.get(locale.trim().toUpperCase(java.util.Locale.ROOT)));
    }
}
