package io.avroxform.standalone;

import static io.avroxform.standalone.TweetPayloads.embeddedProperties;
import static io.avroxform.standalone.TweetPayloads.tweets;
import static io.avroxform.standalone.TweetPayloads.writeSchema;
import static org.assertj.core.api.Assertions.assertThat;

import io.avroxform.standalone.config.StandaloneConfig;
import io.avroxform.standalone.runner.PayloadRunner;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end tests for {@link StandaloneMain#run}: plugin init, payload run and exit status. */
@DisplayName("StandaloneMain")
class StandaloneMainTest {

    private static final InputStream NO_STDIN = new ByteArrayInputStream(new byte[0]);

    @TempDir
    Path dir;

    private static StandaloneConfig config(Map<String, String> properties) {
        StandaloneConfig.Builder builder = StandaloneConfig.builder().workers(2);
        properties.forEach(builder::property);
        return builder.build();
    }

    @Test
    @DisplayName("Valid config and payload files → rows on stdout, status 0")
    void successfulRun() throws Exception {
        Path schemaFile = writeSchema(dir);
        Path first = Files.write(dir.resolve("1.bin"), tweets(schemaFile, "alice"));
        Path second = Files.write(dir.resolve("2.bin"), tweets(schemaFile, "bob", "carol"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = StandaloneMain.run(config(embeddedProperties(schemaFile)), List.of(first, second), NO_STDIN, out);

        assertThat(status).isEqualTo(PayloadRunner.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8))
                .isEqualTo("alice,2023-11-14 22:13:20\nbob,2023-11-14 22:13:20\ncarol,2023-11-14 22:13:20\n");
    }

    @Test
    @DisplayName("No payload files → stdin is the payload")
    void stdinPayload() throws Exception {
        Path schemaFile = writeSchema(dir);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = StandaloneMain.run(
                config(embeddedProperties(schemaFile)),
                List.of(),
                new ByteArrayInputStream(tweets(schemaFile, "dave")),
                out);

        assertThat(status).isEqualTo(PayloadRunner.EXIT_OK);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("dave,2023-11-14 22:13:20\n");
    }

    @Test
    @DisplayName("Invalid plugin properties → status 2, nothing written")
    void invalidProperties() throws Exception {
        Path schemaFile = writeSchema(dir);
        Map<String, String> props = embeddedProperties(schemaFile);
        props.remove("column_number");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = StandaloneMain.run(config(props), List.of(), NO_STDIN, out);

        assertThat(status).isEqualTo(StandaloneMain.EXIT_CONFIG_ERROR);
        assertThat(out.size()).isZero();
    }

    @Test
    @DisplayName("Embedded schema that does not compile → status 2")
    void invalidEmbeddedSchema() throws Exception {
        Path schemaFile = Files.writeString(dir.resolve("broken.avsc"), "{\"type\": \"recrd\"}");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = StandaloneMain.run(config(embeddedProperties(schemaFile)), List.of(), NO_STDIN, out);

        assertThat(status).isEqualTo(StandaloneMain.EXIT_CONFIG_ERROR);
    }

    @Test
    @DisplayName("One unreadable payload file → status 1, other rows still written")
    void payloadFailure() throws Exception {
        Path schemaFile = writeSchema(dir);
        Path good = Files.write(dir.resolve("good.bin"), tweets(schemaFile, "erin"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = StandaloneMain.run(
                config(embeddedProperties(schemaFile)), List.of(dir.resolve("absent.bin"), good), NO_STDIN, out);

        assertThat(status).isEqualTo(PayloadRunner.EXIT_PAYLOAD_FAILED);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("erin,2023-11-14 22:13:20\n");
    }
}
