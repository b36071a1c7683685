package ai.tlumach.extract.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A group of keys in a {@link TranslationTree}.
 * <p>
 * Child nodes and leaves are looked up case-insensitively but keep the casing they were created with.
 * A node knows only its own name, never its full path.
 */
public class TranslationTreeNode {

    private final String name;
    private final Map<String, TranslationTreeNode> children = new LinkedHashMap<>();
    private final Map<String, TranslationTreeLeaf> leaves = new LinkedHashMap<>();

    public TranslationTreeNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public Collection<TranslationTreeNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    public Optional<TranslationTreeNode> child(String childName) {
        return Optional.ofNullable(children.get(normalize(childName)));
    }

    public Collection<TranslationTreeLeaf> leaves() {
        return Collections.unmodifiableCollection(leaves.values());
    }

    public Optional<TranslationTreeLeaf> leaf(String key) {
        return Optional.ofNullable(leaves.get(normalize(key)));
    }

    /**
     * Stores a leaf under this node.
     *
     * @return {@code false} if a leaf with the same name (ignoring case) already exists; it is left untouched
     */
    public boolean addLeaf(String key, boolean templated) {
        Objects.requireNonNull(key, "key");
        return leaves.putIfAbsent(normalize(key), new TranslationTreeLeaf(key, templated)) == null;
    }

    /**
     * Resolves a dot-separated path relative to this node without creating anything.
     *
     * @return the node, or {@code null} when the path is empty, malformed or any segment is missing
     */
    public TranslationTreeNode findNode(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        int idx = path.indexOf('.');
        if (idx == -1) {
            return children.get(normalize(path));
        }
        if (idx == 0) {
            return null;
        }
        TranslationTreeNode next = children.get(normalize(path.substring(0, idx)));
        return next == null ? null : next.findNode(path.substring(idx + 1));
    }

    /**
     * Resolves a dot-separated path relative to this node, creating missing nodes on the way.
     *
     * @return the final node, or {@code null} when the path is empty or contains an empty segment
     */
    public TranslationTreeNode makeNode(String path) {
        if (!isWellFormed(path)) {
            return null;
        }
        TranslationTreeNode current = this;
        for (String segment : path.split("\\.")) {
            current = current.children.computeIfAbsent(normalize(segment), ignored -> new TranslationTreeNode(segment));
        }
        return current;
    }

    private static boolean isWellFormed(String path) {
        if (path == null || path.isEmpty() || path.startsWith(".") || path.endsWith(".")) {
            return false;
        }
        return !path.contains("..");
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "TranslationTreeNode{" + name + ", children=" + children.size() + ", leaves=" + leaves.size() + '}';
    }
}
