package ai.scholar.outline.service;

import static org.assertj.core.api.Assertions.assertThat;

import ai.scholar.outline.config.OutputFormat;
import ai.scholar.outline.skeleton.PreviewMode;
import ai.scholar.outline.structure.OutlineParser;
import ai.scholar.outline.tei.TeiReader;
import ai.scholar.outline.writer.OutlineWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OutlineServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void writesOneRecordPerInputAndReportsFailures() throws Exception {
        Path numbered = copyFixture("numbered.tei.xml");
        Path inconsistent = copyFixture("inconsistent.tei.xml");
        Path missing = tempDir.resolve("missing.tei.xml");
        Path outputDir = tempDir.resolve("out");

        OutlineRunResult result = service(OutputFormat.JSON, 2)
                .run(List.of(numbered, missing, inconsistent), Optional.of(outputDir), System.out);

        assertThat(result.processed()).containsExactly(numbered, inconsistent);
        assertThat(result.degraded()).containsExactly(inconsistent);
        assertThat(result.failures()).containsExactly(missing);
        assertThat(result.hasFailures()).isTrue();

        JsonNode record = objectMapper.readTree(Files.readString(outputDir.resolve("numbered.json")));
        assertThat(record.get("title").asText()).isEqualTo("Learning Outlines from Scholarly Markup");
        assertThat(record.get("degraded").asBoolean()).isFalse();
        assertThat(record.get("structure").get(0).asText()).isEqualTo("Section 1. Introduction");
        JsonNode degraded = objectMapper.readTree(Files.readString(outputDir.resolve("inconsistent.json")));
        assertThat(degraded.get("degraded").asBoolean()).isTrue();
        assertThat(degraded.get("structure").get(0).get("text").asText()).isEqualTo("1 Intro A");
    }

    @Test
    void printsRecordsInInputOrderWithoutOutputDirectory() throws Exception {
        Path numbered = copyFixture("numbered.tei.xml");
        Path inconsistent = copyFixture("inconsistent.tei.xml");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        OutlineRunResult result = service(OutputFormat.JSONL, 4)
                .run(List.of(inconsistent, numbered), Optional.empty(), new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertThat(result.hasFailures()).isFalse();
        List<String> lines = buffer.toString(StandardCharsets.UTF_8).lines().toList();
        assertThat(lines).hasSize(2);
        assertThat(objectMapper.readTree(lines.get(0)).get("source").asText()).isEqualTo(inconsistent.toString());
        assertThat(objectMapper.readTree(lines.get(1)).get("source").asText()).isEqualTo(numbered.toString());
    }

    @Test
    void expandsInputDirectories() throws Exception {
        copyFixture("numbered.tei.xml");
        copyFixture("inconsistent.tei.xml");
        Path outputDir = tempDir.resolve("text");

        OutlineRunResult result = service(OutputFormat.TEXT, 1).run(List.of(tempDir), Optional.of(outputDir), System.out);

        assertThat(result.processed()).hasSize(2);
        assertThat(outputDir.resolve("numbered.txt")).exists();
        assertThat(Files.readString(outputDir.resolve("numbered.txt")))
                .startsWith("Section 1. Introduction" + "\n\n" + "Text A");
    }

    @Test
    void emptyInputDirectoryProducesNothing() throws Exception {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        OutlineRunResult result = service(OutputFormat.JSON, 3).run(List.of(empty), Optional.empty(), System.out);

        assertThat(result.processed()).isEmpty();
        assertThat(result.hasFailures()).isFalse();
    }

    private OutlineService service(OutputFormat format, int parallelism) {
        return new OutlineService(new InputResolver(), new TeiReader(), new OutlineParser(),
                new OutlineWriter(format, PreviewMode.FIRST), parallelism);
    }

    private Path copyFixture(String name) throws IOException {
        Path target = tempDir.resolve(name);
        try (InputStream in = OutlineServiceTest.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IOException("Missing fixture " + name);
            }
            Files.copy(in, target);
        }
        return target;
    }
}
