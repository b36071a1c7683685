package ai.tlumach.extract.cli;

import ai.tlumach.extract.model.EntryValue;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationEntry;
import ai.tlumach.extract.model.TranslationTree;
import ai.tlumach.extract.model.TranslationTreeLeaf;
import ai.tlumach.extract.model.TranslationTreeNode;
import java.io.PrintWriter;

/**
 * Renders extraction results for the console.
 */
class EntryPrinter {

    private static final String INDENT = "  ";

    private final PrintWriter out;

    EntryPrinter(PrintWriter out) {
        this.out = out;
    }

    /**
     * Prints {@code key<TAB>T|-<TAB>value} per entry; references are printed as {@code @key}.
     */
    void printEntries(Translation translation) {
        for (TranslationEntry entry : translation.entries()) {
            out.print(entry.key());
            out.print('\t');
            out.print(entry.isTemplated() ? 'T' : '-');
            out.print('\t');
            out.println(render(entry));
        }
        out.flush();
    }

    void printTree(TranslationTree tree) {
        printNode(tree.root(), 0);
        out.flush();
    }

    private void printNode(TranslationTreeNode node, int depth) {
        for (TranslationTreeLeaf leaf : node.leaves()) {
            out.println(INDENT.repeat(depth) + leaf.key() + (leaf.templated() ? " (templated)" : ""));
        }
        for (TranslationTreeNode child : node.children()) {
            out.println(INDENT.repeat(depth) + child.name() + "/");
            printNode(child, depth + 1);
        }
    }

    private static String render(TranslationEntry entry) {
        if (entry.value().isEmpty()) {
            return "";
        }
        EntryValue value = entry.value().get();
        if (value instanceof EntryValue.Reference reference) {
            return "@" + reference.key();
        }
        return escapeControls(((EntryValue.Literal) value).text());
    }

    private static String escapeControls(String text) {
        return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\r", "\\r").replace("\t", "\\t");
    }
}
