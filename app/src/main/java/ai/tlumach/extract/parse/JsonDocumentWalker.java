package ai.tlumach.extract.parse;

import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationEntry;
import ai.tlumach.extract.model.TranslationTree;
import ai.tlumach.extract.model.TranslationTreeNode;
import ai.tlumach.extract.template.PlaceholderParser;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens nested JSON objects into group-qualified entries.
 * <p>
 * String members become entries keyed {@code group.name}; object members are groups and are walked
 * recursively. All string members of an object are registered before any of its groups is entered.
 * <p>
 * A walker created by {@link #arb} also follows the ARB conventions: members whose name starts with
 * {@code @} carry metadata, {@code @name} objects describe the entry {@code name} of the same group and
 * other {@code @} strings are left to the caller. A name of the form {@code key@target} sets the entry's
 * target. A {@link #plain} walker treats every name literally.
 */
public class JsonDocumentWalker {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonDocumentWalker.class);

    static final char METADATA_MARKER = '@';
    static final String KEY_DESCRIPTION = "description";
    static final String KEY_TYPE = "type";
    static final String KEY_CONTEXT = "context";
    static final String KEY_SOURCE_TEXT = "source_text";
    static final String KEY_SCREEN = "screen";
    static final String KEY_VIDEO = "video";
    static final String KEY_PLACEHOLDERS = "placeholders";

    private final EntryDecoder decoder;
    private final PlaceholderParser placeholderParser;
    private final boolean arbConventions;

    private JsonDocumentWalker(EntryDecoder decoder, PlaceholderParser placeholderParser, boolean arbConventions) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.placeholderParser = placeholderParser;
        this.arbConventions = arbConventions;
    }

    public static JsonDocumentWalker plain(EntryDecoder decoder) {
        return new JsonDocumentWalker(decoder, null, false);
    }

    public static JsonDocumentWalker arb(EntryDecoder decoder, PlaceholderParser placeholderParser) {
        return new JsonDocumentWalker(decoder, Objects.requireNonNull(placeholderParser, "placeholderParser"), true);
    }

    /**
     * Adds the entries of {@code node} and its groups to the translation.
     *
     * @param group qualified name of the group {@code node} represents; empty for the document root
     * @throws DuplicateKeyException if a qualified key is already present in the translation
     */
    public void walk(JsonNode node, Translation translation, String group) {
        Objects.requireNonNull(translation, "translation");
        String prefix = group == null ? "" : group;
        for (Map.Entry<String, JsonNode> field : fields(node, JsonNode::isTextual)) {
            addEntry(translation, prefix, field.getKey().trim(), field.getValue().textValue());
        }
        for (Map.Entry<String, JsonNode> field : fields(node, JsonNode::isObject)) {
            String name = field.getKey().trim();
            if (name.isEmpty()) {
                throw new TranslationParserException("Empty group name in group '" + prefix + "'");
            }
            if (arbConventions && name.charAt(0) == METADATA_MARKER) {
                if (name.length() > 1) {
                    applyMetadata(translation, qualify(prefix, name.substring(1)), field.getValue());
                }
                continue;
            }
            walk(field.getValue(), translation, qualify(prefix, name));
        }
    }

    /**
     * Builds the key tree of a document.
     */
    public TranslationTree walkStructure(JsonNode document) {
        TranslationTree tree = new TranslationTree();
        walkStructure(document, tree.root());
        return tree;
    }

    private void walkStructure(JsonNode node, TranslationTreeNode parent) {
        for (Map.Entry<String, JsonNode> field : fields(node, JsonNode::isTextual)) {
            String name = requireName(field.getKey(), "key");
            if (arbConventions) {
                if (name.charAt(0) == METADATA_MARKER) {
                    continue;
                }
                name = stripTarget(name);
            }
            if (!parent.addLeaf(name, decoder.isTemplated(field.getValue().textValue()))) {
                throw new DuplicateKeyException(name, "Duplicate key '" + name + "' specified in group '" + parent.name() + "'");
            }
        }
        for (Map.Entry<String, JsonNode> field : fields(node, JsonNode::isObject)) {
            String name = requireName(field.getKey(), "group");
            if (arbConventions && name.charAt(0) == METADATA_MARKER) {
                continue;
            }
            if (parent.child(name).isPresent()) {
                throw new DuplicateKeyException(name, "Duplicate group name '" + name + "' specified");
            }
            TranslationTreeNode child = parent.makeNode(name);
            if (child == null) {
                throw new TranslationParserException("Group '" + name + "' could not be used to build a tree of translation entries");
            }
            walkStructure(field.getValue(), child);
        }
    }

    private void addEntry(Translation translation, String group, String name, String raw) {
        if (name.isEmpty()) {
            throw new TranslationParserException("Empty key in group '" + group + "'");
        }
        String target = null;
        if (arbConventions) {
            if (name.charAt(0) == METADATA_MARKER) {
                return;
            }
            int at = name.indexOf(METADATA_MARKER);
            if (at > 0 && at < name.length() - 1) {
                target = name.substring(at + 1);
                name = name.substring(0, at);
            }
        }

        String key = qualify(group, name);
        if (translation.containsKey(key)) {
            throw new DuplicateKeyException(key, "Duplicate key '" + key + "' specified in the translation file");
        }
        TranslationEntry entry = decoder.newEntry(key, raw);
        entry.setTarget(target);
        translation.add(entry);
    }

    private void applyMetadata(Translation translation, String key, JsonNode metadata) {
        Optional<TranslationEntry> found = translation.get(key);
        if (found.isEmpty()) {
            LOGGER.debug("Ignoring metadata of '{}', which has no value", key);
            return;
        }
        TranslationEntry entry = found.get();
        for (Iterator<Map.Entry<String, JsonNode>> it = metadata.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> property = it.next();
            String name = property.getKey().trim();
            JsonNode value = property.getValue();
            if (value.isTextual()) {
                applyMetadataValue(entry, name, value.textValue());
            } else if (value.isObject() && name.equalsIgnoreCase(KEY_PLACEHOLDERS)) {
                placeholderParser.parseAll(value).forEach(entry::addPlaceholder);
            }
        }
    }

    private static void applyMetadataValue(TranslationEntry entry, String name, String value) {
        if (name.equalsIgnoreCase(KEY_DESCRIPTION)) {
            entry.setDescription(value);
        } else if (name.equalsIgnoreCase(KEY_TYPE)) {
            entry.setType(value);
        } else if (name.equalsIgnoreCase(KEY_CONTEXT)) {
            entry.setContext(value);
        } else if (name.equalsIgnoreCase(KEY_SOURCE_TEXT)) {
            entry.setSourceText(value);
        } else if (name.equalsIgnoreCase(KEY_SCREEN)) {
            entry.setScreen(value);
        } else if (name.equalsIgnoreCase(KEY_VIDEO)) {
            entry.setVideo(value);
        }
    }

    private static String stripTarget(String name) {
        int at = name.indexOf(METADATA_MARKER);
        return at > 0 && at < name.length() - 1 ? name.substring(0, at) : name;
    }

    private static String requireName(String raw, String kind) {
        String name = raw.trim();
        if (name.isEmpty()) {
            throw new TranslationParserException("Invalid " + kind + " '" + raw + "' encountered");
        }
        return name;
    }

    static String qualify(String group, String name) {
        return group == null || group.isEmpty() ? name : group + "." + name;
    }

    private static List<Map.Entry<String, JsonNode>> fields(JsonNode node, Predicate<JsonNode> filter) {
        List<Map.Entry<String, JsonNode>> result = new ArrayList<>();
        if (node == null || !node.isObject()) {
            return result;
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            if (filter.test(field.getValue())) {
                result.add(field);
            }
        }
        return result;
    }
}
