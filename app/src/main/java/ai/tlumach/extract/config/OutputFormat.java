package ai.tlumach.extract.config;

/**
 * How extracted entries are printed.
 */
public enum OutputFormat {
    /**
     * One line per entry: key, templated marker, value.
     */
    LIST,
    /**
     * Indented key tree.
     */
    TREE
}
