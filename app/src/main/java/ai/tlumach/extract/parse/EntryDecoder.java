package ai.tlumach.extract.parse;

import ai.tlumach.extract.model.EntryValue;
import ai.tlumach.extract.model.TranslationEntry;
import ai.tlumach.extract.template.PlaceholderClassifier;
import ai.tlumach.extract.template.TemplateEscaping;
import ai.tlumach.extract.template.TextUnescaper;
import java.util.Objects;

/**
 * Turns raw values read from a source file into entry values: references, decoded text and the templated flag.
 */
public class EntryDecoder {

    public static final char REFERENCE_MARKER = '@';

    private final PlaceholderClassifier classifier;
    private final boolean recognizeReferences;
    private final boolean trimReferences;

    /**
     * Decoder whose references have surrounding whitespace removed.
     */
    public EntryDecoder(TemplateEscaping escaping, boolean recognizeReferences) {
        this(escaping, recognizeReferences, true);
    }

    public EntryDecoder(TemplateEscaping escaping, boolean recognizeReferences, boolean trimReferences) {
        this.classifier = new PlaceholderClassifier(escaping);
        this.recognizeReferences = recognizeReferences;
        this.trimReferences = trimReferences;
    }

    public TemplateEscaping escaping() {
        return classifier.escaping();
    }

    public boolean isReference(String raw) {
        return recognizeReferences && raw != null && !raw.isEmpty() && raw.charAt(0) == REFERENCE_MARKER;
    }

    /**
     * Classifies raw text; references are never templated.
     */
    public boolean isTemplated(String raw) {
        return !isReference(raw) && classifier.isTemplated(raw);
    }

    public EntryValue decode(String raw) {
        Objects.requireNonNull(raw, "raw");
        if (isReference(raw)) {
            String key = raw.substring(1);
            return EntryValue.reference(trimReferences ? key.trim() : key);
        }
        if (classifier.escaping().decodesBackslashes()) {
            return EntryValue.literal(TextUnescaper.unescape(raw), raw);
        }
        return EntryValue.literal(raw);
    }

    /**
     * Assigns the decoded value to the entry and sets its templated flag.
     */
    public void fill(TranslationEntry entry, String raw) {
        EntryValue value = decode(raw);
        entry.assignValue(value);
        entry.setTemplated(value instanceof EntryValue.Literal literal && classifier.isTemplated(literal.rawText()));
    }

    public TranslationEntry newEntry(String key, String raw) {
        TranslationEntry entry = new TranslationEntry(key);
        fill(entry, raw);
        return entry;
    }
}
