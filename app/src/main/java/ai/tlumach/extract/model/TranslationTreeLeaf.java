package ai.tlumach.extract.model;

import java.util.Objects;

/**
 * A key stored under a tree node. The key is unqualified: it does not include the names of its parent nodes.
 */
public record TranslationTreeLeaf(String key, boolean templated) {

    public TranslationTreeLeaf {
        Objects.requireNonNull(key, "key");
    }
}
