package ai.tlumach.extract.parse;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.model.Translation;
import ai.tlumach.extract.model.TranslationEntry;
import ai.tlumach.extract.model.TranslationTree;
import ai.tlumach.extract.template.TemplateEscaping;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base of the table formats (CSV, TSV).
 * <p>
 * The first non-empty row is the header: column 0 holds the keys, every other column is named after the
 * locale of its translations, except for an optional description column. Each following row holds one key.
 */
public abstract class TableParser implements TranslationParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableParser.class);

    private final ParserSettings settings;
    private final EntryDecoder decoder;

    protected TableParser(ParserSettings settings, TemplateEscaping defaultEscaping) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.decoder = new EntryDecoder(settings.escapingOr(defaultEscaping), settings.recognizeReferences());
    }

    /**
     * The file extension handled by the format, with the leading dot.
     */
    protected abstract String extension();

    protected abstract DelimitedLineReader lineReader();

    protected ParserSettings settings() {
        return settings;
    }

    public TemplateEscaping escaping() {
        return decoder.escaping();
    }

    @Override
    public boolean canHandle(String fileExtension) {
        return fileExtension != null && fileExtension.equalsIgnoreCase(extension());
    }

    @Override
    public Optional<Translation> loadTranslation(String content, String locale) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        Table table = readTable(content);
        if (table == null || table.header().size() < 2) {
            return Optional.empty();
        }
        int column = table.localeColumn(locale);
        if (column == -1) {
            LOGGER.debug("No column for locale '{}' among {}", locale, table.header());
            return Optional.empty();
        }

        Translation translation = new Translation(table.header().get(column).trim());
        for (TableRow row : table.rows()) {
            String key = row.cells().get(0);
            String value = row.cells().get(column);
            if (value.isEmpty() && settings.treatEmptyValuesAsAbsent()) {
                continue;
            }
            TranslationEntry entry = decoder.newEntry(key, value);
            if (table.descriptionColumn() != -1) {
                entry.setDescription(row.cells().get(table.descriptionColumn()));
            }
            if (!translation.add(entry)) {
                throw new DuplicateKeyException(key, "Duplicate key '" + key + "' detected on line " + row.lineNumber(), row.lineNumber());
            }
        }
        LOGGER.debug("Loaded {} entries for column '{}'", translation.size(), translation.locale().orElse(""));
        return Optional.of(translation);
    }

    @Override
    public Optional<TranslationTree> loadTranslationStructure(String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        Table table = readTable(content);
        if (table == null) {
            return Optional.empty();
        }
        int valueColumn = table.localeColumn(null);

        TranslationTree tree = new TranslationTree();
        for (TableRow row : table.rows()) {
            String key = row.cells().get(0);
            boolean templated = valueColumn != -1 && decoder.isTemplated(row.cells().get(valueColumn));
            if (!tree.addLeaf(key, templated)) {
                throw new TextParseException("Key '" + key + "' on line " + row.lineNumber() + " is not a valid dotted path",
                        row.startPosition(), row.endPosition(), row.lineNumber(), 1);
            }
        }
        return Optional.of(tree);
    }

    /**
     * Reads the header and all rows, validating keys and column counts.
     *
     * @return the table, or {@code null} if the content has no non-empty line
     */
    Table readTable(String content) {
        DelimitedLineReader reader = lineReader();
        List<String> header = null;
        int descriptionColumn = -1;
        List<TableRow> rows = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();

        int length = content.length();
        int offset = 0;
        int lineNumber = 1;
        while (offset < length) {
            char ch = content.charAt(offset);
            if (ch == '\n' || ch == '\r') {
                offset++;
                if (ch == '\r' && offset < length && content.charAt(offset) == '\n') {
                    offset++;
                }
                lineNumber++;
                continue;
            }

            DelimitedLine line = reader.read(content, offset, lineNumber);
            if (line.isEmpty() || line.posAfterEnd() == offset) {
                throw new TextParseException("Malformed line detected on line " + lineNumber, offset, line.posAfterEnd(), lineNumber, 1);
            }

            if (header == null) {
                header = line.fields();
                descriptionColumn = validateHeader(header, offset, lineNumber);
            } else {
                rows.add(validateRow(line, header.size(), seenKeys, offset, lineNumber));
            }
            offset = line.posAfterEnd();
            lineNumber = line.nextLineNumber();
        }

        if (header == null) {
            return null;
        }
        return new Table(header, descriptionColumn, rows);
    }

    private int validateHeader(List<String> header, int offset, int lineNumber) {
        int descriptionColumn = -1;
        for (int i = 1; i < header.size(); i++) {
            String caption = header.get(i).trim();
            if (header.size() > 2 && caption.isEmpty()) {
                throw new TextParseException("Multiple columns are provided, but the locale name of column " + (i + 1)
                        + " is empty. Locale names must be listed as column captions on the first non-empty line.",
                        offset, offset, lineNumber, 1);
            }
            if (descriptionColumn == -1 && caption.equalsIgnoreCase(settings.descriptionColumnCaption())) {
                descriptionColumn = i;
            }
        }
        return descriptionColumn;
    }

    private TableRow validateRow(DelimitedLine line, int columns, Set<String> seenKeys, int offset, int lineNumber) {
        String key = line.field(0).trim();
        if (key.isEmpty()) {
            throw new TextParseException("Empty key detected on line " + lineNumber, offset, line.posAfterEnd(), lineNumber, 1);
        }
        if (!seenKeys.add(key.toLowerCase(Locale.ROOT))) {
            throw new DuplicateKeyException(key, "A duplicate key " + key + " detected on line " + lineNumber, lineNumber);
        }
        if (line.size() < columns) {
            throw new TextParseException("Insufficient number of columns detected on line " + lineNumber + " (" + columns
                    + " columns expected, " + line.size() + " columns found)", offset, line.posAfterEnd(), lineNumber, 1);
        }
        List<String> cells = new ArrayList<>(columns);
        cells.add(key);
        for (int i = 1; i < columns; i++) {
            cells.add(line.field(i).trim());
        }
        return new TableRow(lineNumber, offset, line.posAfterEnd(), cells);
    }

    record TableRow(int lineNumber, int startPosition, int endPosition, List<String> cells) {
    }

    record Table(List<String> header, int descriptionColumn, List<TableRow> rows) {

        /**
         * Finds the column holding the locale's translations.
         * <p>
         * A blank locale selects the first translation column. For a locale like {@code de-AT} without a
         * column of its own the {@code de} column is used.
         *
         * @return the column index, or -1
         */
        int localeColumn(String locale) {
            if (locale == null || locale.isBlank()) {
                for (int i = 1; i < header.size(); i++) {
                    if (i != descriptionColumn) {
                        return i;
                    }
                }
                return -1;
            }
            String normalized = locale.trim().replace('_', '-');
            int column = findCaption(normalized);
            if (column == -1 && normalized.indexOf('-') == 2) {
                column = findCaption(normalized.substring(0, 2));
            }
            return column;
        }

        private int findCaption(String caption) {
            for (int i = 1; i < header.size(); i++) {
                if (i != descriptionColumn && header.get(i).trim().replace('_', '-').equalsIgnoreCase(caption)) {
                    return i;
                }
            }
            return -1;
        }
    }
}
