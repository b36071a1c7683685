package ai.tlumach.extract.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One localizable key together with its parsed value and the metadata the source file supplied for it.
 * <p>
 * Parsers fill an entry while reading the file. The value can be assigned once; an entry whose
 * metadata arrived before its text stays without a value until the text is read.
 */
public class TranslationEntry {

    private final String key;
    private EntryValue value;
    private boolean templated;
    private String target;
    private String description;
    private String type;
    private String context;
    private String sourceText;
    private String screen;
    private String video;
    private final List<Placeholder> placeholders = new ArrayList<>();

    public TranslationEntry(String key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    public TranslationEntry(String key, EntryValue value) {
        this(key);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String key() {
        return key;
    }

    public Optional<EntryValue> value() {
        return Optional.ofNullable(value);
    }

    public boolean hasValue() {
        return value != null;
    }

    public void assignValue(EntryValue newValue) {
        Objects.requireNonNull(newValue, "newValue");
        if (value != null) {
            throw new IllegalStateException("Value of entry '" + key + "' is already set");
        }
        value = newValue;
    }

    /**
     * Returns the literal text, or empty when the entry is a reference or has no value yet.
     */
    public Optional<String> text() {
        if (value instanceof EntryValue.Literal literal) {
            return Optional.of(literal.text());
        }
        return Optional.empty();
    }

    public Optional<String> escapedText() {
        if (value instanceof EntryValue.Literal literal) {
            return literal.escapedText();
        }
        return Optional.empty();
    }

    public Optional<String> reference() {
        if (value instanceof EntryValue.Reference reference) {
            return Optional.of(reference.key());
        }
        return Optional.empty();
    }

    public boolean isTemplated() {
        return templated;
    }

    public void setTemplated(boolean templated) {
        this.templated = templated;
    }

    public Optional<String> target() {
        return Optional.ofNullable(target);
    }

    public void setTarget(String target) {
        this.target = target;
    }

    public Optional<String> description() {
        return Optional.ofNullable(description);
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Optional<String> type() {
        return Optional.ofNullable(type);
    }

    public void setType(String type) {
        this.type = type;
    }

    public Optional<String> context() {
        return Optional.ofNullable(context);
    }

    public void setContext(String context) {
        this.context = context;
    }

    public Optional<String> sourceText() {
        return Optional.ofNullable(sourceText);
    }

    public void setSourceText(String sourceText) {
        this.sourceText = sourceText;
    }

    public Optional<String> screen() {
        return Optional.ofNullable(screen);
    }

    public void setScreen(String screen) {
        this.screen = screen;
    }

    public Optional<String> video() {
        return Optional.ofNullable(video);
    }

    public void setVideo(String video) {
        this.video = video;
    }

    public List<Placeholder> placeholders() {
        return Collections.unmodifiableList(placeholders);
    }

    public void addPlaceholder(Placeholder placeholder) {
        placeholders.add(Objects.requireNonNull(placeholder, "placeholder"));
    }

    @Override
    public String toString() {
        return "TranslationEntry{" + key + '=' + value + (templated ? ", templated" : "") + '}';
    }
}
