package ai.tlumach.extract.template;

import ai.tlumach.extract.model.Placeholder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads placeholder declarations, i.e. the members of an ARB-style {@code "placeholders"} object:
 * <pre>
 * "count": { "type": "int", "format": "compact", "example": "3", "optionalParameters": { "decimalDigits": "1" } }
 * </pre>
 * {@code type}, {@code format} and {@code example} are recognized; other string members go to the
 * generic property bag and the members of {@code optionalParameters} to the second bag.
 */
public class PlaceholderParser {

    static final String KEY_TYPE = "type";
    static final String KEY_FORMAT = "format";
    static final String KEY_EXAMPLE = "example";
    static final String KEY_OPTIONAL_PARAMETERS = "optionalParameters";

    /**
     * Parses every object-valued member of {@code placeholders}; other members are ignored.
     */
    public List<Placeholder> parseAll(JsonNode placeholders) {
        List<Placeholder> result = new ArrayList<>();
        if (placeholders == null || !placeholders.isObject()) {
            return result;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = placeholders.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            String name = field.getKey().trim();
            if (field.getValue().isObject() && !name.isEmpty()) {
                result.add(parse(name, field.getValue()));
            }
        }
        return result;
    }

    public Placeholder parse(String name, JsonNode declaration) {
        Placeholder.Builder builder = Placeholder.builder(name);
        if (declaration == null || !declaration.isObject()) {
            return builder.build();
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = declaration.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            String key = field.getKey().trim();
            JsonNode value = field.getValue();
            if (value.isTextual()) {
                applyScalar(builder, key, value.textValue());
            } else if (value.isObject() && key.equalsIgnoreCase(KEY_OPTIONAL_PARAMETERS)) {
                collectOptionalParameters(builder, value);
            }
        }
        return builder.build();
    }

    private void applyScalar(Placeholder.Builder builder, String key, String value) {
        if (key.equalsIgnoreCase(KEY_TYPE)) {
            builder.type(value);
        } else if (key.equalsIgnoreCase(KEY_FORMAT)) {
            builder.format(value);
        } else if (key.equalsIgnoreCase(KEY_EXAMPLE)) {
            builder.example(value);
        } else {
            builder.property(key, value);
        }
    }

    private void collectOptionalParameters(Placeholder.Builder builder, JsonNode parameters) {
        for (Iterator<Map.Entry<String, JsonNode>> it = parameters.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> parameter = it.next();
            if (parameter.getValue().isValueNode() && !parameter.getValue().isNull()) {
                builder.optionalParameter(parameter.getKey().trim(), parameter.getValue().asText());
            }
        }
    }
}
