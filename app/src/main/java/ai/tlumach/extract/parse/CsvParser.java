package ai.tlumach.extract.parse;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.template.TemplateEscaping;

/**
 * Comma-separated tables. The separator is configurable (Excel writes {@code ;}); fields may be quoted.
 */
public class CsvParser extends TableParser {

    public static final String EXTENSION = ".csv";
    public static final TemplateEscaping DEFAULT_ESCAPING = TemplateEscaping.NONE;

    private final DelimitedLineReader lineReader;

    public CsvParser(ParserSettings settings) {
        super(settings, DEFAULT_ESCAPING);
        this.lineReader = new DelimitedLineReader(settings.csvSeparator(), true);
    }

    @Override
    protected String extension() {
        return EXTENSION;
    }

    @Override
    protected DelimitedLineReader lineReader() {
        return lineReader;
    }
}
