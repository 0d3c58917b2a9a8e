package ai.scholar.outline.cli;

import ai.scholar.outline.config.Config;
import ai.scholar.outline.config.ConfigLoader;
import ai.scholar.outline.config.SystemEnvironmentReader;
import ai.scholar.outline.logging.LoggingConfigurator;
import ai.scholar.outline.service.InputResolver;
import ai.scholar.outline.service.OutlineRunResult;
import ai.scholar.outline.service.OutlineService;
import ai.scholar.outline.structure.OutlineParser;
import ai.scholar.outline.tei.TeiReader;
import ai.scholar.outline.writer.OutlineWriter;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and outline service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_INPUT_FAILURES = 1;
    static final int EXIT_INVALID_CONFIG = 2;

    private final ConfigLoader configLoader;
    private final PrintStream out;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), System.out);
    }

    CliApplication(ConfigLoader configLoader, PrintStream out) {
        this.configLoader = configLoader;
        this.out = out;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_INVALID_CONFIG;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Building outlines as {} into {}", config.outputFormat(),
                config.outputDirectory().map(Path::toString).orElse("standard output"));

        OutlineService service = createOutlineService(config);
        OutlineRunResult result = service.run(config.inputs(), config.outputDirectory(), out);
        if (!result.degraded().isEmpty()) {
            LOGGER.warn("Flat outline produced for: {}", join(result.degraded()));
        }
        if (result.hasFailures()) {
            LOGGER.warn("Failed inputs: {}", join(result.failures()));
            return EXIT_INPUT_FAILURES;
        }
        return 0;
    }

    private OutlineService createOutlineService(Config config) {
        TeiReader teiReader = new TeiReader();
        OutlineWriter writer = new OutlineWriter(config.outputFormat(), config.previewMode());
        return new OutlineService(new InputResolver(), teiReader, new OutlineParser(), writer, config.parallelism());
    }

    private static String join(List<Path> paths) {
        return paths.stream().map(Path::toString).collect(Collectors.joining(", "));
    }
}
