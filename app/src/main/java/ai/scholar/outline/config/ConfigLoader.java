package ai.scholar.outline.config;

import ai.scholar.outline.cli.CliArguments;
import ai.scholar.outline.skeleton.PreviewMode;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * CLI values win over environment values, which win over defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUTS = "OUTLINE_INPUTS";
    static final String ENV_FORMAT = "OUTLINE_FORMAT";
    static final String ENV_PREVIEW_MODE = "OUTLINE_PREVIEW_MODE";
    static final String ENV_OUTPUT_DIR = "OUTLINE_OUTPUT_DIR";
    static final String ENV_PARALLELISM = "OUTLINE_PARALLELISM";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "OUTLINE_VERBOSE";

    private static final int DEFAULT_PARALLELISM = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> inputs = resolveInputs(arguments);
        OutputFormat outputFormat = Optional.ofNullable(arguments.outputFormat())
                .or(() -> environmentReader.getNonBlank(ENV_FORMAT).map(OutputFormat::from))
                .orElse(OutputFormat.JSON);
        PreviewMode previewMode = Optional.ofNullable(arguments.previewMode())
                .or(() -> environmentReader.getNonBlank(ENV_PREVIEW_MODE).map(PreviewMode::from))
                .orElse(PreviewMode.FIRST);
        Optional<Path> outputDirectory = Optional.ofNullable(arguments.outputDirectory())
                .or(() -> environmentReader.getNonBlank(ENV_OUTPUT_DIR).map(Path::of));
        int parallelism = resolveParallelism(arguments);
        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environmentReader.getNonBlank(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);
        boolean verbose = arguments.verbose() || environmentReader.getNonBlank(ENV_VERBOSE)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);

        return new Config(inputs, outputFormat, previewMode, outputDirectory, parallelism, logFormat, verbose);
    }

    private List<Path> resolveInputs(CliArguments arguments) {
        List<Path> cliInputs = arguments.inputs();
        if (cliInputs != null && !cliInputs.isEmpty()) {
            return cliInputs;
        }
        return environmentReader.getNonBlank(ENV_INPUTS)
                .map(ConfigLoader::parseInputs)
                .filter(paths -> !paths.isEmpty())
                .orElseThrow(() -> new IllegalArgumentException("input files must be provided"));
    }

    private int resolveParallelism(CliArguments arguments) {
        Integer cliValue = arguments.parallelism();
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException("--parallelism must be at least 1");
            }
            return cliValue;
        }
        return environmentReader.getNonBlank(ENV_PARALLELISM)
                .map(ConfigLoader::parseParallelism)
                .orElse(DEFAULT_PARALLELISM);
    }

    private static int parseParallelism(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_PARALLELISM + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_PARALLELISM + " must be an integer", ex);
        }
    }

    private static List<Path> parseInputs(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(Path::of)
                .collect(Collectors.toList());
    }
}
