package io.avroxform.core.engine.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.avroxform.core.error.RegistryException;
import io.avroxform.core.spi.SchemaRegistryClient;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JDK {@link HttpClient}-based schema registry client.
 *
 * <p>
 * Issues {@code GET {baseUrl}/schemas/ids/{id}} and returns the body of a 200 response as the
 * schema text. Registries that wrap the schema in a JSON envelope ({@code {"schema": "..."}}) are
 * unwrapped. Any other status, a timeout or a connection failure raises {@link RegistryException};
 * the call is never retried.
 *
 * <p>
 * Thread-safe: the underlying {@link HttpClient} is shared across calls.
 */
public final class HttpSchemaRegistryClient implements SchemaRegistryClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpSchemaRegistryClient.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration requestTimeout;
    private final String instanceName;

    /**
     * Creates a client for the given registry.
     *
     * @param baseUrl          registry base URL, e.g. {@code http://registry:8081}; a trailing
     *                         slash is ignored
     * @param connectTimeoutMs TCP connect timeout
     * @param requestTimeoutMs overall timeout for one request
     * @param instanceName     transform instance name for error reporting, may be null
     */
    public HttpSchemaRegistryClient(String baseUrl, int connectTimeoutMs, int requestTimeoutMs, String instanceName) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);
        this.instanceName = instanceName;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        LOG.debug("HttpSchemaRegistryClient initialized: registry={}", this.baseUrl);
    }

    @Override
    public String fetchSchema(int schemaId) {
        URI uri;
        HttpRequest request;
        try {
            uri = schemaUri(schemaId);
            request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(requestTimeout)
                    .header("Accept", "application/vnd.schemaregistry.v1+json, application/json, */*")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new RegistryException(
                    "Invalid schema registry URL " + baseUrl + ": " + e.getMessage(), e, instanceName, null);
        }

        LOG.debug("Fetching schema: schema_id={}, uri={}", schemaId, uri);

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpConnectTimeoutException e) {
            throw new RegistryException("Connect timeout to schema registry " + uri, e, instanceName, null);
        } catch (HttpTimeoutException e) {
            throw new RegistryException("Read timeout from schema registry " + uri, e, instanceName, null);
        } catch (IOException e) {
            throw new RegistryException("Failed to reach schema registry " + uri + ": " + e, e, instanceName, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryException("Interrupted while fetching schema from " + uri, e, instanceName, null);
        }

        if (response.statusCode() != 200) {
            throw new RegistryException(
                    "Unexpected status code " + response.statusCode() + " from schema registry " + uri,
                    instanceName,
                    null);
        }

        String body = response.body() != null ? response.body() : "";
        LOG.debug("Schema registry responded: schema_id={}, bytes={}", schemaId, body.length());
        return unwrapEnvelope(body);
    }

    /** URI of the schema lookup endpoint for the given id. */
    URI schemaUri(int schemaId) {
        return URI.create(baseUrl + "/schemas/ids/" + schemaId);
    }

    /**
     * Returns the {@code schema} string of a registry JSON envelope, or {@code body} unchanged when
     * it is not such an envelope (a bare schema definition is returned as-is).
     */
    static String unwrapEnvelope(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return body;
        }
        try {
            JsonNode root = JSON.readTree(trimmed);
            JsonNode schema = root.get("schema");
            if (root.isObject() && !root.has("type") && schema != null && schema.isTextual()) {
                return schema.asText();
            }
        } catch (JsonProcessingException e) {
            LOG.debug("Registry body is not JSON, using it verbatim: {}", e.getOriginalMessage());
        }
        return body;
    }
}
