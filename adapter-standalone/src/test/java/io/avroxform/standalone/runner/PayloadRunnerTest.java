package io.avroxform.standalone.runner;

import static io.avroxform.standalone.TweetPayloads.embeddedProperties;
import static io.avroxform.standalone.TweetPayloads.tweets;
import static io.avroxform.standalone.TweetPayloads.writeSchema;
import static org.assertj.core.api.Assertions.assertThat;

import io.avroxform.core.engine.TransformPlugin;
import io.avroxform.core.error.TypeMismatchException;
import io.avroxform.core.model.TransformResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link PayloadRunner}: ordered output, failure isolation and exit status. */
@DisplayName("PayloadRunner")
class PayloadRunnerTest {

    @TempDir
    Path dir;

    private Path schemaFile;
    private TransformPlugin plugin;
    private PayloadRunner runner;

    @BeforeEach
    void setUp() {
        schemaFile = writeSchema(dir);
        plugin = new TransformPlugin();
        plugin.init(embeddedProperties(schemaFile));
        runner = new PayloadRunner(plugin, 4);
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    private Path payloadFile(String name, byte[] content) throws Exception {
        Path file = dir.resolve(name);
        Files.write(file, content);
        return file;
    }

    @Test
    @DisplayName("Files are written in argument order regardless of completion order")
    void filesInArgumentOrder() throws Exception {
        List<Path> files = new ArrayList<>();
        StringBuilder expected = new StringBuilder();
        for (int i = 0; i < 20; i++) {
            files.add(payloadFile("p" + i + ".bin", tweets(schemaFile, "user" + i, "other" + i)));
            expected.append("user").append(i).append(",2023-11-14 22:13:20\n");
            expected.append("other").append(i).append(",2023-11-14 22:13:20\n");
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = runner.runFiles(files, out);

        assertThat(status).isEqualTo(PayloadRunner.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo(expected.toString());
    }

    @Test
    @DisplayName("A failed payload contributes nothing; the others still run; status 1")
    void failedPayloadIsolated() throws Exception {
        Path good1 = payloadFile("a.bin", tweets(schemaFile, "alice"));
        Path missing = dir.resolve("missing.bin");
        Path good2 = payloadFile("b.bin", tweets(schemaFile, "bob"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = runner.runFiles(List.of(good1, missing, good2), out);

        assertThat(status).isEqualTo(PayloadRunner.EXIT_PAYLOAD_FAILED);
        assertThat(out.toString(StandardCharsets.UTF_8))
                .isEqualTo("alice,2023-11-14 22:13:20\nbob,2023-11-14 22:13:20\n");
    }

    @Test
    @DisplayName("Stream input is transformed as one payload")
    void streamInput() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = runner.runStream(new ByteArrayInputStream(tweets(schemaFile, "carol")), out);

        assertThat(status).isEqualTo(PayloadRunner.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("carol,2023-11-14 22:13:20\n");
    }

    @Test
    @DisplayName("Empty stream → no rows, status 0")
    void emptyStream() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = runner.runStream(new ByteArrayInputStream(new byte[0]), out);

        assertThat(status).isEqualTo(PayloadRunner.EXIT_OK);
        assertThat(out.size()).isZero();
    }

    @Test
    @DisplayName("transformAll returns results in input order")
    void transformAllOrdered() throws Exception {
        List<TransformResult> results =
                runner.transformAll(List.of(tweets(schemaFile, "x"), tweets(schemaFile, "y", "z")));

        assertThat(results).extracting(TransformResult::rowCount).containsExactly(1, 2);
        assertThat(results.get(1).outputAsString())
                .isEqualTo("y,2023-11-14 22:13:20\nz,2023-11-14 22:13:20\n");
    }

    @Test
    @DisplayName("A type mismatch surfaces as an error result with no output")
    void typeMismatch() throws Exception {
        Map<String, String> props = embeddedProperties(schemaFile);
        props.put("type_1", "timestamp");
        TransformPlugin strict = new TransformPlugin();
        strict.init(props);

        try (PayloadRunner other = new PayloadRunner(strict, 1)) {
            TransformResult result = other.transformAll(List.of(tweets(schemaFile, "dave"))).get(0);

            assertThat(result.isError()).isTrue();
            assertThat(result.output()).isEmpty();
            assertThat(result.error()).isInstanceOf(TypeMismatchException.class);
        }
    }
}
