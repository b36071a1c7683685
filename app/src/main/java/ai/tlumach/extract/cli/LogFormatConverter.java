package ai.tlumach.extract.cli;

import ai.tlumach.extract.config.LogFormat;
import picocli.CommandLine;

public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        return LogFormat.from(value);
    }
}
