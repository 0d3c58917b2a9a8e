package ai.scholar.outline.cli;

import ai.scholar.outline.config.OutputFormat;
import picocli.CommandLine;

public class OutputFormatConverter implements CommandLine.ITypeConverter<OutputFormat> {

    @Override
    public OutputFormat convert(String value) {
        return OutputFormat.from(value);
    }
}
