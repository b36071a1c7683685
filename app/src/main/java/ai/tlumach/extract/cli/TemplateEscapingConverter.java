package ai.tlumach.extract.cli;

import ai.tlumach.extract.template.TemplateEscaping;
import picocli.CommandLine;

public class TemplateEscapingConverter implements CommandLine.ITypeConverter<TemplateEscaping> {

    @Override
    public TemplateEscaping convert(String value) {
        return TemplateEscaping.from(value);
    }
}
