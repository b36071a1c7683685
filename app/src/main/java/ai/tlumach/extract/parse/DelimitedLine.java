package ai.tlumach.extract.parse;

import java.util.List;

/**
 * One logical row read by {@link DelimitedLineReader}.
 *
 * @param fields         field values in column order
 * @param posAfterEnd    offset of the first character after the row and its line terminator
 * @param nextLineNumber line number of the text that starts at {@code posAfterEnd}
 */
public record DelimitedLine(List<String> fields, int posAfterEnd, int nextLineNumber) {

    public DelimitedLine {
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    public String field(int index) {
        return fields.get(index);
    }
}
