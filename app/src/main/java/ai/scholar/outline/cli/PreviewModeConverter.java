package ai.scholar.outline.cli;

import ai.scholar.outline.skeleton.PreviewMode;
import picocli.CommandLine;

public class PreviewModeConverter implements CommandLine.ITypeConverter<PreviewMode> {

    @Override
    public PreviewMode convert(String value) {
        return PreviewMode.from(value);
    }
}
