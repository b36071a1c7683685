package ai.tlumach.extract.parse;

import ai.tlumach.extract.config.ParserSettings;
import ai.tlumach.extract.template.TemplateEscaping;

/**
 * Tab-separated tables. Quoting of fields that contain tabs or line breaks is off unless enabled in the settings.
 */
public class TsvParser extends TableParser {

    public static final String EXTENSION = ".tsv";
    public static final TemplateEscaping DEFAULT_ESCAPING = TemplateEscaping.NONE;

    private final DelimitedLineReader lineReader;

    public TsvParser(ParserSettings settings) {
        super(settings, DEFAULT_ESCAPING);
        this.lineReader = new DelimitedLineReader('\t', settings.tsvQuotedFields());
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
