package ai.tlumach.extract.config;

import ai.tlumach.extract.template.TemplateEscaping;
import java.util.Objects;
import java.util.Optional;

/**
 * Parser options, fixed for the duration of a parse.
 *
 * @param csvSeparator             field separator of CSV files
 * @param tsvQuotedFields          whether TSV fields may be wrapped in quotes
 * @param escapingOverride         escaping mode to use instead of each format's default
 * @param recognizeReferences      whether values starting with {@code @} reference other keys
 * @param treatEmptyValuesAsAbsent whether empty table cells produce no entry
 * @param descriptionColumnCaption header caption of the description column in tables
 */
public record ParserSettings(
        char csvSeparator,
        boolean tsvQuotedFields,
        Optional<TemplateEscaping> escapingOverride,
        boolean recognizeReferences,
        boolean treatEmptyValuesAsAbsent,
        String descriptionColumnCaption
) {

    public static final char DEFAULT_CSV_SEPARATOR = ',';
    public static final String DEFAULT_DESCRIPTION_CAPTION = "Description";

    public ParserSettings {
        if (csvSeparator == '"' || csvSeparator == '\r' || csvSeparator == '\n') {
            throw new IllegalArgumentException("csvSeparator must not be a quote or a line break");
        }
        escapingOverride = escapingOverride == null ? Optional.empty() : escapingOverride;
        if (descriptionColumnCaption == null || descriptionColumnCaption.isBlank()) {
            descriptionColumnCaption = DEFAULT_DESCRIPTION_CAPTION;
        }
    }

    public static ParserSettings defaults() {
        return new ParserSettings(DEFAULT_CSV_SEPARATOR, false, Optional.empty(), true, false, DEFAULT_DESCRIPTION_CAPTION);
    }

    public TemplateEscaping escapingOr(TemplateEscaping formatDefault) {
        return escapingOverride.orElse(Objects.requireNonNull(formatDefault, "formatDefault"));
    }

    public ParserSettings withEscaping(TemplateEscaping escaping) {
        return new ParserSettings(csvSeparator, tsvQuotedFields, Optional.ofNullable(escaping), recognizeReferences,
                treatEmptyValuesAsAbsent, descriptionColumnCaption);
    }
}
