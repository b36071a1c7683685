package ai.tlumach.extract.model;

import java.util.Optional;

/**
 * Keys of one translation arranged by their dotted paths, e.g. {@code menu.file.open} is the leaf
 * {@code open} under node {@code menu} &gt; {@code file}.
 */
public class TranslationTree {

    private final TranslationTreeNode root = new TranslationTreeNode("");

    public TranslationTreeNode root() {
        return root;
    }

    public TranslationTreeNode findNode(String path) {
        return root.findNode(path);
    }

    public TranslationTreeNode makeNode(String path) {
        return root.makeNode(path);
    }

    /**
     * Stores a leaf for a qualified key, creating the nodes of its group path.
     *
     * @return {@code false} if the key is malformed or a leaf with that name already exists in its group
     */
    public boolean addLeaf(String qualifiedKey, boolean templated) {
        if (qualifiedKey == null || qualifiedKey.isEmpty()) {
            return false;
        }
        int idx = qualifiedKey.lastIndexOf('.');
        if (idx == -1) {
            return root.addLeaf(qualifiedKey, templated);
        }
        String key = qualifiedKey.substring(idx + 1);
        TranslationTreeNode node = root.makeNode(qualifiedKey.substring(0, idx));
        if (node == null || key.isEmpty()) {
            return false;
        }
        return node.addLeaf(key, templated);
    }

    /**
     * Looks up the leaf of a qualified key.
     */
    public Optional<TranslationTreeLeaf> findLeaf(String qualifiedKey) {
        if (qualifiedKey == null || qualifiedKey.isEmpty()) {
            return Optional.empty();
        }
        int idx = qualifiedKey.lastIndexOf('.');
        if (idx == -1) {
            return root.leaf(qualifiedKey);
        }
        TranslationTreeNode node = root.findNode(qualifiedKey.substring(0, idx));
        return node == null ? Optional.empty() : node.leaf(qualifiedKey.substring(idx + 1));
    }
}
