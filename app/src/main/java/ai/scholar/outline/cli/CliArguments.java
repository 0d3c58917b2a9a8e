package ai.scholar.outline.cli;

import ai.scholar.outline.config.LogFormat;
import ai.scholar.outline.config.OutputFormat;
import ai.scholar.outline.skeleton.PreviewMode;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "scholar-outline", mixinStandardHelpOptions = true, version = "scholar-outline 0.1.0",
        description = "Rebuilds the section outline of papers from GROBID TEI output")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "INPUT", arity = "0..*", description = "TEI files or directories containing *.xml TEI files")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = "--format", converter = OutputFormatConverter.class, description = "Output format: json, jsonl, text or preview")
    private OutputFormat outputFormat;

    @CommandLine.Option(names = "--preview-mode", converter = PreviewModeConverter.class, description = "Preview paragraphs: first (first sentence) or full")
    private PreviewMode previewMode;

    @CommandLine.Option(names = "--output-dir", description = "Directory receiving one output file per input (default: standard output)", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--parallelism", description = "Number of documents parsed concurrently", paramLabel = "COUNT")
    private Integer parallelism;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log outline reconstruction decisions")
    private boolean verbose;

    public List<Path> inputs() {
        return inputs;
    }

    public OutputFormat outputFormat() {
        return outputFormat;
    }

    public PreviewMode previewMode() {
        return previewMode;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Integer parallelism() {
        return parallelism;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
