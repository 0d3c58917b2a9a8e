package ai.scholar.outline.service;

import ai.scholar.outline.model.Document;
import ai.scholar.outline.structure.OutlineParser;
import ai.scholar.outline.tei.TeiReader;
import ai.scholar.outline.writer.OutlineWriter;
import ai.scholar.outline.writer.PaperRecord;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Parses a batch of TEI files into outline records. Each file is an isolated unit of work on a fixed pool of
 * worker threads; a file that cannot be read or written is reported and the others continue.
 * Records are emitted in input order.
 */
public class OutlineService {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutlineService.class);
    private static final String DOCUMENT_MDC_KEY = "document";

    private final InputResolver inputResolver;
    private final TeiReader teiReader;
    private final OutlineParser parser;
    private final OutlineWriter writer;
    private final int parallelism;

    public OutlineService(InputResolver inputResolver, TeiReader teiReader, OutlineParser parser, OutlineWriter writer, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.inputResolver = inputResolver;
        this.teiReader = teiReader;
        this.parser = parser;
        this.writer = writer;
        this.parallelism = parallelism;
    }

    public OutlineRunResult run(List<Path> inputs, Optional<Path> outputDirectory, PrintStream out) {
        List<Path> files = inputResolver.resolve(inputs);
        LOGGER.info("Processing {} TEI file(s) with parallelism {}", files.size(), parallelism);

        List<Path> processed = new ArrayList<>();
        List<Path> degraded = new ArrayList<>();
        List<Path> failures = new ArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(files.size(), 1)));
        try {
            List<Future<PaperRecord>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> parse(file)));
            }
            for (int i = 0; i < files.size(); i++) {
                Path file = files.get(i);
                Optional<PaperRecord> record = await(file, futures.get(i));
                if (record.isEmpty()) {
                    failures.add(file);
                    continue;
                }
                if (emit(file, record.get(), outputDirectory, out)) {
                    processed.add(file);
                    if (record.get().degraded()) {
                        degraded.add(file);
                    }
                } else {
                    failures.add(file);
                }
            }
        } finally {
            executor.shutdownNow();
        }
        LOGGER.info("Produced {} outline(s), {} degraded, {} failed", processed.size(), degraded.size(), failures.size());
        return new OutlineRunResult(processed, degraded, failures);
    }

    private PaperRecord parse(Path file) {
        MDC.put(DOCUMENT_MDC_KEY, file.toString());
        try {
            Document document = parser.parse(teiReader.read(file));
            if (document.isEmpty()) {
                LOGGER.info("No body content found");
            }
            return PaperRecord.of(document, file.toString());
        } finally {
            MDC.remove(DOCUMENT_MDC_KEY);
        }
    }

    private Optional<PaperRecord> await(Path file, Future<PaperRecord> future) {
        try {
            return Optional.of(future.get());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing " + file, ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof UncheckedIOException ioException) {
                LOGGER.warn("Skipping {}: {}", file, ioException.getMessage());
                return Optional.empty();
            }
            throw new IllegalStateException("Failed to parse " + file, ex.getCause());
        }
    }

    private boolean emit(Path file, PaperRecord record, Optional<Path> outputDirectory, PrintStream out) {
        if (outputDirectory.isEmpty()) {
            writer.print(out, record);
            return true;
        }
        try {
            Path target = writer.write(outputDirectory.get(), InputResolver.stem(file), record);
            LOGGER.info("Wrote outline of {} to {}", file, target);
            return true;
        } catch (UncheckedIOException ex) {
            LOGGER.warn("Failed to write outline of {}: {}", file, ex.getMessage());
            return false;
        }
    }
}
