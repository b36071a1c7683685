package ai.tlumach.extract.model;

import java.util.Objects;
import java.util.Optional;

/**
 * The value of a translation entry: either literal text or a reference to another key.
 */
public sealed interface EntryValue permits EntryValue.Literal, EntryValue.Reference {

    static Literal literal(String text) {
        return new Literal(text, Optional.empty());
    }

    static Literal literal(String text, String escapedText) {
        return new Literal(text, Optional.ofNullable(escapedText));
    }

    static Reference reference(String key) {
        return new Reference(key);
    }

    /**
     * Literal text. {@code escapedText} holds the raw form when the text was un-escaped while parsing.
     */
    record Literal(String text, Optional<String> escapedText) implements EntryValue {

        public Literal {
            Objects.requireNonNull(text, "text");
            escapedText = escapedText == null ? Optional.empty() : escapedText;
        }

        /**
         * Returns the text as it appeared in the source.
         */
        public String rawText() {
            return escapedText.orElse(text);
        }
    }

    record Reference(String key) implements EntryValue {

        public Reference {
            Objects.requireNonNull(key, "key");
        }
    }
}
