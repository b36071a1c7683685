package ai.tlumach.extract.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Describes one parameter of a templated entry as declared in the source file.
 * <p>
 * Purely descriptive: whether the entry is templated is decided from its text alone.
 */
public record Placeholder(
        String name,
        Optional<String> type,
        Optional<String> format,
        Optional<String> example,
        Map<String, String> properties,
        Map<String, String> optionalParameters
) {

    public Placeholder {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        type = type == null ? Optional.empty() : type;
        format = format == null ? Optional.empty() : format;
        example = example == null ? Optional.empty() : example;
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        optionalParameters = optionalParameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(optionalParameters));
    }

    public static Placeholder named(String name) {
        return new Placeholder(name, Optional.empty(), Optional.empty(), Optional.empty(), Map.of(), Map.of());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {

        private final String name;
        private String type;
        private String format;
        private String example;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final Map<String, String> optionalParameters = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder type(String value) {
            this.type = value;
            return this;
        }

        public Builder format(String value) {
            this.format = value;
            return this;
        }

        public Builder example(String value) {
            this.example = value;
            return this;
        }

        public Builder property(String key, String value) {
            properties.put(key, value);
            return this;
        }

        public Builder optionalParameter(String key, String value) {
            optionalParameters.put(key, value);
            return this;
        }

        public Placeholder build() {
            return new Placeholder(name, Optional.ofNullable(type), Optional.ofNullable(format),
                    Optional.ofNullable(example), properties, optionalParameters);
        }
    }
}
