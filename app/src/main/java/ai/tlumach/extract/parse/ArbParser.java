package ai.tlumach.extract.parse;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.template.PlaceholderParser;
import ai.tlumach.extract.template.TemplateEscaping;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application Resource Bundle files ({@code .arb}) and their configuration files ({@code .arbcfg}).
 * <p>
 * The document is JSON with metadata members: top-level {@code @@locale}, {@code @@context},
 * {@code @@author} and {@code @@last_modified} describe the translation itself and {@code @@x-name}
 * members are kept as custom properties. {@code @name} objects describe entries, see {@link JsonDocumentWalker#arb}.
 */
public class ArbParser extends JsonParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArbParser.class);

    public static final String EXTENSION = ".arb";
    public static final String CONFIG_EXTENSION = ".arbcfg";
    public static final TemplateEscaping DEFAULT_ESCAPING = TemplateEscaping.ARB;

    static final String KEY_LOCALE = "@@locale";
    static final String KEY_CONTEXT = "@@context";
    static final String KEY_AUTHOR = "@@author";
    static final String KEY_LAST_MODIFIED = "@@last_modified";
    static final String CUSTOM_PROPERTY_PREFIX = "@@x-";

    public ArbParser(ParserSettings settings) {
        this(decoderFor(settings));
    }

    private ArbParser(EntryDecoder decoder) {
        super(newObjectMapper(), decoder, JsonDocumentWalker.arb(decoder, new PlaceholderParser()));
    }

    private static EntryDecoder decoderFor(ParserSettings settings) {
        return new EntryDecoder(settings.escapingOr(DEFAULT_ESCAPING), settings.recognizeReferences(), true);
    }

    @Override
    protected String extension() {
        return EXTENSION;
    }

    @Override
    protected void readDocumentMetadata(JsonNode document, Translation translation) {
        textOf(document, KEY_LOCALE).ifPresent(translation::setLocale);
        textOf(document, KEY_CONTEXT).ifPresent(translation::setContext);
        textOf(document, KEY_AUTHOR).ifPresent(translation::setAuthor);
        textOf(document, KEY_LAST_MODIFIED)
                .flatMap(ArbParser::parseTimestamp)
                .ifPresent(translation::setLastModified);

        for (Iterator<Map.Entry<String, JsonNode>> it = document.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            String name = field.getKey().trim();
            if (name.startsWith(CUSTOM_PROPERTY_PREFIX) && name.length() > CUSTOM_PROPERTY_PREFIX.length()
                    && field.getValue().isTextual()) {
                translation.putCustomProperty(name.substring(CUSTOM_PROPERTY_PREFIX.length()), field.getValue().textValue());
            }
        }
    }

    private static Optional<Instant> parseTimestamp(String raw) {
        try {
            return Optional.of(Instant.parse(raw));
        } catch (DateTimeParseException ex) {
            LOGGER.debug("Ignoring unparseable {} value '{}'", KEY_LAST_MODIFIED, raw);
            return Optional.empty();
        }
    }
}
