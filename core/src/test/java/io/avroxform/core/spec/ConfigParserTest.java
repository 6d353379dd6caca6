package io.avroxform.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.avroxform.core.error.ConfigurationException;
import io.avroxform.core.model.ColumnSpec;
import io.avroxform.core.model.DeclaredType;
import io.avroxform.core.model.EngineConfig;
import io.avroxform.core.model.ExtractionMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link ConfigParser}: property map to {@link EngineConfig}. */
@DisplayName("ConfigParser")
class ConfigParserTest {

    private static final String SCHEMA = "{\"type\":\"record\",\"name\":\"T\",\"fields\":[]}";

    private static Map<String, String> registry() {
        Map<String, String> props = new HashMap<>();
        props.put("name", "tweets");
        props.put("schema_url", "http://registry.test");
        return props;
    }

    private static Map<String, String> dynamic() {
        Map<String, String> props = registry();
        props.put("dynamic_csv", "true");
        props.put("column_number", "2");
        props.put("value_1", "username");
        props.put("type_1", "string");
        props.put("value_2", "timestamp");
        props.put("type_2", "Timestamp");
        return props;
    }

    private static ConfigurationException configError(Map<String, String> props) {
        try {
            ConfigParser.parse(props);
        } catch (ConfigurationException e) {
            return e;
        }
        throw new AssertionError("expected ConfigurationException");
    }

    @Nested
    @DisplayName("Schema source")
    class SchemaSource {

        @Test
        @DisplayName("schema_url → registry mode, framed payloads")
        void registryMode() {
            EngineConfig config = ConfigParser.parse(registry());

            assertThat(config.registryUrl()).isEqualTo("http://registry.test");
            assertThat(config.schemaText()).isNull();
            assertThat(config.embeddedSchema()).isFalse();
            assertThat(config.name()).isEqualTo("tweets");
        }

        @Test
        @DisplayName("schema_file → embedded mode with the file's text")
        void embeddedMode(@TempDir Path dir) throws IOException {
            Path schemaFile = dir.resolve("t.avsc");
            Files.writeString(schemaFile, SCHEMA);
            Map<String, String> props = new HashMap<>();
            props.put("schema_file", schemaFile.toString());

            EngineConfig config = ConfigParser.parse(props);

            assertThat(config.embeddedSchema()).isTrue();
            assertThat(config.schemaText()).isEqualTo(SCHEMA);
            assertThat(config.registryUrl()).isNull();
        }

        @Test
        @DisplayName("Neither source → error naming schema_file")
        void neither() {
            Map<String, String> props = new HashMap<>();
            props.put("name", "tweets");

            ConfigurationException e = configError(props);

            assertThat(e.getMessage()).contains("no schema file or URL specified");
            assertThat(e.source()).isEqualTo("schema_file");
            assertThat(e.instanceName()).isEqualTo("tweets");
        }

        @Test
        @DisplayName("Both sources → mutually exclusive")
        void both(@TempDir Path dir) throws IOException {
            Path schemaFile = dir.resolve("t.avsc");
            Files.writeString(schemaFile, SCHEMA);
            Map<String, String> props = registry();
            props.put("schema_file", schemaFile.toString());

            ConfigurationException e = configError(props);

            assertThat(e.getMessage()).contains("mutually exclusive");
            assertThat(e.source()).isEqualTo("schema_url");
        }

        @Test
        @DisplayName("Unreadable schema file → error naming the file")
        void missingFile(@TempDir Path dir) {
            Map<String, String> props = new HashMap<>();
            props.put("schema_file", dir.resolve("absent.avsc").toString());

            ConfigurationException e = configError(props);

            assertThat(e.getMessage()).contains("failed to read schema file").contains("absent.avsc");
            assertThat(e.source()).isEqualTo("schema_file");
            assertThat(e.getCause()).isNotNull();
        }

        @Test
        @DisplayName("Blank schema_url → error")
        void blankUrl() {
            Map<String, String> props = new HashMap<>();
            props.put("schema_url", "  ");

            assertThat(configError(props).source()).isEqualTo("schema_url");
        }

        @ParameterizedTest
        @ValueSource(strings = {
            "registry host:8081", "registry.test:8081", "ftp://registry.test", "http:registry", "/schemas"
        })
        @DisplayName("schema_url that is not an absolute http(s) URL → error at parse time")
        void invalidUrl(String url) {
            Map<String, String> props = new HashMap<>();
            props.put("schema_url", url);

            ConfigurationException e = configError(props);

            assertThat(e.source()).isEqualTo("schema_url");
            assertThat(e.getMessage()).contains("schema_url");
        }

        @Test
        @DisplayName("https schema_url with port and path is accepted")
        void httpsUrl() {
            Map<String, String> props = new HashMap<>();
            props.put("schema_url", " https://registry.test:8443/sr ");

            assertThat(ConfigParser.parse(props).registryUrl()).isEqualTo("https://registry.test:8443/sr");
        }
    }

    @Nested
    @DisplayName("Columns")
    class Columns {

        @Test
        @DisplayName("dynamic_csv with columns → DYNAMIC mode, types mapped")
        void dynamicColumns() {
            EngineConfig config = ConfigParser.parse(dynamic());

            assertThat(config.mode()).isEqualTo(ExtractionMode.DYNAMIC);
            assertThat(config.columns())
                    .isEqualTo(ColumnSpec.of(
                            new ColumnSpec.Column("username", DeclaredType.PLAIN),
                            new ColumnSpec.Column("timestamp", DeclaredType.TIMESTAMP)));
        }

        @Test
        @DisplayName("dynamic_csv absent → STATIC mode, column properties ignored")
        void staticWhenAbsent() {
            Map<String, String> props = dynamic();
            props.remove("dynamic_csv");
            props.remove("column_number");

            EngineConfig config = ConfigParser.parse(props);

            assertThat(config.mode()).isEqualTo(ExtractionMode.STATIC);
            assertThat(config.columns().size()).isZero();
        }

        @Test
        @DisplayName("dynamic_csv without column_number → error")
        void missingColumnNumber() {
            Map<String, String> props = dynamic();
            props.remove("column_number");

            ConfigurationException e = configError(props);

            assertThat(e.getMessage()).contains("need to set 'column_number'");
            assertThat(e.source()).isEqualTo("column_number");
        }

        @ParameterizedTest
        @ValueSource(strings = {"two", "0", "-1"})
        @DisplayName("Non-positive or non-numeric column_number → error")
        void badColumnNumber(String value) {
            Map<String, String> props = dynamic();
            props.put("column_number", value);

            assertThat(configError(props).source()).isEqualTo("column_number");
        }

        @Test
        @DisplayName("Missing value_N → error naming value_N")
        void missingValue() {
            Map<String, String> props = dynamic();
            props.remove("value_2");

            ConfigurationException e = configError(props);

            assertThat(e.getMessage()).isEqualTo("the 'value_2' is missing");
            assertThat(e.source()).isEqualTo("value_2");
        }

        @Test
        @DisplayName("Missing type_N → error naming type_N")
        void missingType() {
            Map<String, String> props = dynamic();
            props.remove("type_1");

            assertThat(configError(props).source()).isEqualTo("type_1");
        }

        @Test
        @DisplayName("Extra value_N beyond column_number is ignored")
        void extraColumnsIgnored() {
            Map<String, String> props = dynamic();
            props.put("value_3", "tweet");
            props.put("type_3", "string");

            assertThat(ConfigParser.parse(props).columns().size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("dynamic_csv flag")
    class DynamicFlag {

        @ParameterizedTest
        @ValueSource(strings = {"1", "t", "T", "true", "TRUE", "True", " true "})
        @DisplayName("Truthy values")
        void truthy(String value) {
            assertThat(ConfigParser.isTrue(value)).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "false", "yes", "on", "", "2"})
        @DisplayName("Everything else is false")
        void falsy(String value) {
            assertThat(ConfigParser.isTrue(value)).isFalse();
        }

        @Test
        @DisplayName("Absent is false")
        void absent() {
            assertThat(ConfigParser.isTrue(null)).isFalse();
        }
    }

    @Nested
    @DisplayName("Time zone and timeouts")
    class Ambient {

        @Test
        @DisplayName("Defaults: system zone, default registry timeouts")
        void defaults() {
            EngineConfig config = ConfigParser.parse(registry());

            assertThat(config.zoneId()).isEqualTo(ZoneId.systemDefault());
            assertThat(config.registryConnectTimeoutMs()).isEqualTo(EngineConfig.DEFAULT_REGISTRY_CONNECT_TIMEOUT_MS);
            assertThat(config.registryTimeoutMs()).isEqualTo(EngineConfig.DEFAULT_REGISTRY_TIMEOUT_MS);
        }

        @Test
        @DisplayName("Explicit time_zone and timeouts are applied")
        void explicit() {
            Map<String, String> props = registry();
            props.put("time_zone", "Europe/Ljubljana");
            props.put("registry_connect_timeout_ms", "250");
            props.put("registry_timeout_ms", "750");

            EngineConfig config = ConfigParser.parse(props);

            assertThat(config.zoneId()).isEqualTo(ZoneId.of("Europe/Ljubljana"));
            assertThat(config.registryConnectTimeoutMs()).isEqualTo(250);
            assertThat(config.registryTimeoutMs()).isEqualTo(750);
        }

        @Test
        @DisplayName("Unknown time zone → error naming time_zone")
        void badZone() {
            Map<String, String> props = registry();
            props.put("time_zone", "Mars/Olympus");

            ConfigurationException e = configError(props);

            assertThat(e.source()).isEqualTo("time_zone");
            assertThat(e.getMessage()).contains("Mars/Olympus");
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "-5", "soon"})
        @DisplayName("Invalid timeout → error naming the property")
        void badTimeout(String value) {
            Map<String, String> props = registry();
            props.put("registry_timeout_ms", value);

            assertThatThrownBy(() -> ConfigParser.parse(props))
                    .isInstanceOfSatisfying(
                            ConfigurationException.class, e -> assertThat(e.source()).isEqualTo("registry_timeout_ms"));
        }
    }
}
