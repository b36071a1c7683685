package ai.tlumach.extract.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Translation entries of one locale, keyed by their qualified (dot-joined) key in source order.
 * <p>
 * Keys are unique: {@link #add(TranslationEntry)} never replaces an existing entry.
 */
public class Translation {

    private final Map<String, TranslationEntry> entries = new LinkedHashMap<>();
    private final Map<String, String> customProperties = new LinkedHashMap<>();
    private String locale;
    private String context;
    private String author;
    private Instant lastModified;
    private Path originalFile;

    public Translation() {
    }

    public Translation(String locale) {
        this.locale = locale;
    }

    /**
     * Adds the entry under its key.
     *
     * @return {@code false} if an entry with the same key is already present; the existing entry is kept
     */
    public boolean add(TranslationEntry entry) {
        Objects.requireNonNull(entry, "entry");
        return entries.putIfAbsent(entry.key(), entry) == null;
    }

    public Optional<TranslationEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public Collection<TranslationEntry> entries() {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<String> locale() {
        return Optional.ofNullable(locale);
    }

    public void setLocale(String locale) {
        this.locale = locale;
    }

    public Optional<String> context() {
        return Optional.ofNullable(context);
    }

    public void setContext(String context) {
        this.context = context;
    }

    public Optional<String> author() {
        return Optional.ofNullable(author);
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public Optional<Instant> lastModified() {
        return Optional.ofNullable(lastModified);
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }

    public Map<String, String> customProperties() {
        return Collections.unmodifiableMap(customProperties);
    }

    public void putCustomProperty(String name, String value) {
        customProperties.put(name, value);
    }

    public Optional<Path> originalFile() {
        return Optional.ofNullable(originalFile);
    }

    public Translation withOrigin(Path file) {
        this.originalFile = file;
        return this;
    }
}
