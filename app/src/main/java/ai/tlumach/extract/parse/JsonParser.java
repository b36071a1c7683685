package ai.tlumach.extract.parse;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationConfiguration;
import ai.tlumach.extract.model.TranslationTree;
import ai.tlumach.extract.template.TemplateEscaping;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON translation files ({@code .json}) and JSON configuration files ({@code .jsoncfg}).
 * <p>
 * Member names are taken literally: every string member is an entry and every object member a group.
 * {@link ArbParser} adds the ARB metadata conventions on top of this format.
 */
public class JsonParser implements TranslationParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonParser.class);

    public static final String EXTENSION = ".json";
    public static final String CONFIG_EXTENSION = ".jsoncfg";
    public static final TemplateEscaping DEFAULT_ESCAPING = TemplateEscaping.DOTNET;

    static final String KEY_DEFAULT_FILE = "defaultFile";
    static final String KEY_DEFAULT_LOCALE = "defaultLocale";
    static final String KEY_GENERATED_NAMESPACE = "generatedNamespace";
    static final String KEY_GENERATED_CLASS = "generatedClass";
    static final String KEY_TRANSLATIONS = "translations";
    static final String KEY_ANY_LOCALE = "*";

    private final ObjectMapper objectMapper;
    private final EntryDecoder decoder;
    private final JsonDocumentWalker walker;

    public JsonParser(ParserSettings settings) {
        Objects.requireNonNull(settings, "settings");
        this.objectMapper = newObjectMapper();
        // references in plain JSON keep the text after the marker as it is
        this.decoder = new EntryDecoder(settings.escapingOr(DEFAULT_ESCAPING), settings.recognizeReferences(), false);
        this.walker = JsonDocumentWalker.plain(decoder);
    }

    protected JsonParser(ObjectMapper objectMapper, EntryDecoder decoder, JsonDocumentWalker walker) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.walker = Objects.requireNonNull(walker, "walker");
    }

    static ObjectMapper newObjectMapper() {
        return JsonMapper.builder().enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION).build();
    }

    /**
     * The translation file extension handled by the format, with the leading dot.
     */
    protected String extension() {
        return EXTENSION;
    }

    public TemplateEscaping escaping() {
        return decoder.escaping();
    }

    @Override
    public boolean canHandle(String fileExtension) {
        return fileExtension != null && fileExtension.equalsIgnoreCase(extension());
    }

    @Override
    public Optional<Translation> loadTranslation(String content, String locale) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        JsonNode document = readDocument(content);
        Translation translation = new Translation();
        readDocumentMetadata(document, translation);
        walker.walk(document, translation, "");
        LOGGER.debug("Loaded {} entries from {} document", translation.size(), extension());
        return Optional.of(translation);
    }

    @Override
    public Optional<TranslationTree> loadTranslationStructure(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(walker.walkStructure(readDocument(content)));
    }

    @Override
    public TranslationConfiguration parseConfiguration(String content) {
        JsonNode root = readDocument(content == null ? "" : content);
        String defaultFile = textOf(root, KEY_DEFAULT_FILE).orElse("");
        Map<String, String> translations = new LinkedHashMap<>();

        if (!defaultFile.isEmpty()) {
            JsonNode section = memberIgnoringCase(root, KEY_TRANSLATIONS);
            if (section != null && section.isObject()) {
                for (Iterator<Map.Entry<String, JsonNode>> it = section.fields(); it.hasNext(); ) {
                    Map.Entry<String, JsonNode> field = it.next();
                    String locale = field.getKey().trim();
                    locale = locale.equals(KEY_ANY_LOCALE)
                            ? TranslationConfiguration.DEFAULT_TRANSLATION
                            : locale.toUpperCase(Locale.ROOT);
                    if (!field.getValue().isTextual()) {
                        throw new ParserConfigException("Translation reference '" + field.getKey() + "' is not a string");
                    }
                    if (translations.putIfAbsent(locale, field.getValue().textValue().trim()) != null) {
                        throw new ParserConfigException("Duplicate translation reference '" + field.getKey()
                                + "' specified in the list of translations");
                    }
                }
            }
        }

        return new TranslationConfiguration(defaultFile,
                textOf(root, KEY_DEFAULT_LOCALE),
                textOf(root, KEY_GENERATED_NAMESPACE),
                textOf(root, KEY_GENERATED_CLASS),
                decoder.escaping(),
                translations);
    }

    JsonNode readDocument(String content) {
        JsonNode document;
        try {
            document = objectMapper.readTree(content);
        } catch (JsonProcessingException ex) {
            JsonLocation location = ex.getLocation();
            int line = location == null ? 1 : Math.max(location.getLineNr(), 1);
            int column = location == null ? 1 : Math.max(location.getColumnNr(), 1);
            int position = location == null ? 0 : (int) Math.max(location.getCharOffset(), 0);
            throw new TextParseException(ex.getOriginalMessage(), position, position, line, column, ex);
        }
        if (document == null || !document.isObject()) {
            throw new TextParseException("The root of a JSON translation must be an object", 0, 0, 1, 1);
        }
        return document;
    }

    /**
     * Reads top-level members describing the translation as a whole. Plain JSON has none.
     */
    protected void readDocumentMetadata(JsonNode document, Translation translation) {
    }

    static Optional<String> textOf(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isTextual()) {
            return Optional.empty();
        }
        String text = value.textValue().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    private static JsonNode memberIgnoringCase(JsonNode node, String name) {
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            if (field.getKey().trim().equalsIgnoreCase(name)) {
                return field.getValue();
            }
        }
        return null;
    }
}
