package org.terragraph.wrapper.audit;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.terragraph.engine.exec.ExecutionListener;
import org.terragraph.engine.exec.ExecutionResult;
import org.terragraph.engine.graph.NodeStatus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Posts the outcome of every directory run to an audit API.
 * <p>
 * Delivery is best effort: transport errors and non-2xx responses are logged and never change the outcome
 * of the run. Skipped directories are not reported since the tool never ran for them.
 */
public class AuditClient implements ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(AuditClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final URI endpoint;
    private final Path repositoryRoot;
    private final String runBy;
    private final HttpClient httpClient;

    public AuditClient(URI endpoint, Path repositoryRoot) {
        this(endpoint, repositoryRoot, System.getProperty("user.name"),
            HttpClient.newBuilder().connectTimeout(TIMEOUT).build());
    }

    public AuditClient(URI endpoint, Path repositoryRoot, String runBy, HttpClient httpClient) {
        this.endpoint = endpoint;
        this.repositoryRoot = repositoryRoot.toAbsolutePath().normalize();
        this.runBy = runBy;
        this.httpClient = httpClient;
    }

    @Override
    public void onResult(ExecutionResult result) {
        if (result.status() == NodeStatus.SKIPPED) {
            return;
        }
        AuditEvent event = toEvent(result);
        log.info("Sending audit record for {} run by {} ({})", event.directory(), event.runBy(), event.status());
        try {
            HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(event), StandardCharsets.UTF_8))
                .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.error("Audit API {} rejected record for {} with HTTP {}", endpoint, event.directory(),
                    response.statusCode());
            }
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit record for {}: {}", event.directory(), e.getMessage());
        } catch (IOException e) {
            log.error("Unable to post audit record to {}: {}", endpoint, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while posting audit record to {}", endpoint);
        }
    }

    AuditEvent toEvent(ExecutionResult result) {
        Path directory = result.directory().toAbsolutePath().normalize();
        String relative = directory.startsWith(repositoryRoot)
            ? repositoryRoot.relativize(directory).toString().replace('\\', '/')
            : directory.toString();
        String status = result.status() == NodeStatus.SUCCEEDED ? AuditEvent.SUCCESS : AuditEvent.FAILED;
        return new AuditEvent(relative.startsWith("/") ? relative : "/" + relative, status, runBy, result.output());
    }
}
