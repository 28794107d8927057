package io.gtask.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.gtask.core.error.DuplicateJobException;
import io.gtask.core.error.ExecutionNotFoundException;
import io.gtask.core.error.GtaskException;
import io.gtask.core.error.JobConfigurationException;
import io.gtask.core.error.JobNotFoundException;
import io.gtask.core.execution.ExecutionRecord;
import io.gtask.core.job.JobDefinition;
import io.gtask.core.job.JobRegistry;
import io.gtask.core.job.NewJob;
import io.gtask.core.query.CommandSummary;
import io.gtask.core.query.RunReport;
import io.gtask.core.query.StatusQueryService;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.PathHandler;
import io.undertow.util.Headers;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON surface over the job registry and the execution history.
 *
 * <pre>
 * GET  /healthz
 * GET  /status
 * GET  /executions?limit=N
 * GET  /download?task_uid=UID
 * GET  /jobs
 * POST /jobs
 * POST /jobs/{id}/disable
 * POST /jobs/{id}/enable
 * </pre>
 */
public final class StatusServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);

    private final String host;
    private final int requestedPort;
    private final JobRegistry registry;
    private final StatusQueryService queries;
    private final ZoneId zone;
    private final ObjectMapper mapper;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private Undertow server;
    private int actualPort;

    public StatusServer(String host, int port, JobRegistry registry, StatusQueryService queries, ZoneId zone) {
        this.host = host == null || host.isBlank() ? "0.0.0.0" : host;
        this.requestedPort = port;
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.queries = Objects.requireNonNull(queries, "queries must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.actualPort = port;
    }

    public void start() {
        if (running.getAndSet(true)) {
            return;
        }

        PathHandler routes = Handlers.path()
            .addExactPath("/healthz", this::handleHealth)
            .addExactPath("/status", exchange -> blocking(exchange, this::handleStatus))
            .addExactPath("/executions", exchange -> blocking(exchange, this::handleExecutions))
            .addExactPath("/download", exchange -> blocking(exchange, this::handleDownload))
            .addPrefixPath("/jobs", exchange -> blocking(exchange, this::handleJobs));

        server = Undertow.builder()
            .addHttpListener(requestedPort, host)
            .setHandler(routes)
            .build();
        server.start();
        actualPort = resolveBoundPort(server, requestedPort);
        LOG.info("Status server listening on {}:{}", host, actualPort);
    }

    public int port() {
        return actualPort;
    }

    @Override
    public void close() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (server != null) {
            server.stop();
        }
    }

    private void handleHealth(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        sendJson(exchange, 200, Map.of("status", "ok"));
    }

    private void handleStatus(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        List<Map<String, Object>> summaries = new ArrayList<>();
        for (CommandSummary summary : queries.summarize()) {
            summaries.add(toSummaryResponse(summary));
        }
        sendJson(exchange, 200, Map.of("summaries", summaries));
    }

    private void handleExecutions(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        int limit = parseQueryInt(exchange, "limit", 50);
        List<Map<String, Object>> executions = new ArrayList<>();
        for (ExecutionRecord record : queries.recent(limit)) {
            executions.add(toRecordResponse(record));
        }
        sendJson(exchange, 200, Map.of("executions", executions));
    }

    private void handleDownload(HttpServerExchange exchange) throws IOException {
        if (!isMethod(exchange, "GET")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        String uid = queryParam(exchange, "task_uid");
        if (uid.isBlank()) {
            sendError(exchange, 400, "missing_parameter", "task_uid is required");
            return;
        }
        ExecutionRecord record = queries.fetch(uid);
        byte[] body = RunReport.render(record, zone).getBytes(StandardCharsets.UTF_8);
        exchange.setStatusCode(200);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
        exchange.getResponseHeaders().put(
            Headers.CONTENT_DISPOSITION,
            "attachment; filename=\"" + RunReport.fileName(record) + "\""
        );
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private void handleJobs(HttpServerExchange exchange) throws IOException {
        String rest = exchange.getRelativePath();
        if (rest == null || rest.isEmpty() || "/".equals(rest)) {
            if (isMethod(exchange, "GET")) {
                sendJson(exchange, 200, Map.of("jobs", registry.list()));
                return;
            }
            if (isMethod(exchange, "POST")) {
                JobDefinition created = registry.register(readNewJob(exchange));
                sendJson(exchange, 201, Map.of("job", created));
                return;
            }
            sendMethodNotAllowed(exchange);
            return;
        }

        String[] parts = rest.substring(1).split("/");
        if (parts.length != 2 || !("disable".equals(parts[1]) || "enable".equals(parts[1]))) {
            sendError(exchange, 404, "not_found", "No route for " + exchange.getRequestPath());
            return;
        }
        if (!isMethod(exchange, "POST")) {
            sendMethodNotAllowed(exchange);
            return;
        }
        long id;
        try {
            id = Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            sendError(exchange, 400, "invalid_id", "Job id must be a number: " + parts[0]);
            return;
        }
        JobDefinition updated = "disable".equals(parts[1]) ? registry.disable(id) : registry.enable(id);
        sendJson(exchange, 200, Map.of("job", updated));
    }

    private NewJob readNewJob(HttpServerExchange exchange) throws IOException {
        JsonNode body;
        try {
            body = readJsonBody(exchange);
        } catch (JsonProcessingException e) {
            throw new JobConfigurationException("Request body is not valid JSON");
        }
        if (!body.isObject()) {
            throw new JobConfigurationException("Request body must be a JSON object");
        }
        JsonNode timeout = body.get("timeoutSeconds");
        if (timeout != null && !timeout.isNull() && !timeout.canConvertToLong()) {
            throw new JobConfigurationException("timeoutSeconds must be a whole number");
        }
        return new NewJob(
            readString(body, "name"),
            readString(body, "schedule"),
            readString(body, "command"),
            readString(body, "description"),
            timeout == null || timeout.isNull() ? 0 : timeout.asLong()
        );
    }

    private void blocking(HttpServerExchange exchange, Route route) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(() -> blocking(exchange, route));
            return;
        }
        try {
            route.handle(exchange);
        } catch (GtaskException e) {
            sendGtaskError(exchange, e);
        } catch (Exception e) {
            LOG.error("Request {} {} failed", exchange.getRequestMethod(), exchange.getRequestPath(), e);
            sendInternalError(exchange, e);
        }
    }

    private void sendGtaskError(HttpServerExchange exchange, GtaskException error) {
        int status;
        if (error instanceof DuplicateJobException) {
            status = 409;
        } else if (error instanceof JobNotFoundException || error instanceof ExecutionNotFoundException) {
            status = 404;
        } else if (error instanceof JobConfigurationException) {
            status = 400;
        } else {
            status = 500;
        }
        try {
            sendError(exchange, status, error.getErrorCode(), error.getMessage());
        } catch (IOException e) {
            LOG.warn("Failed to send error response: {}", e.getMessage());
        }
    }

    private void sendInternalError(HttpServerExchange exchange, Exception error) {
        try {
            sendError(exchange, 500, "internal_error", error.getMessage() == null ? "internal_error" : error.getMessage());
        } catch (IOException e) {
            LOG.warn("Failed to send error response: {}", e.getMessage());
        }
    }

    private void sendMethodNotAllowed(HttpServerExchange exchange) throws IOException {
        sendError(exchange, 405, "method_not_allowed", exchange.getRequestMethod() + " is not supported here");
    }

    private void sendError(HttpServerExchange exchange, int status, String code, String message) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", code);
        payload.put("message", message);
        sendJson(exchange, status, payload);
    }

    private void sendJson(HttpServerExchange exchange, int status, Map<String, ?> payload) throws IOException {
        byte[] body = mapper.writeValueAsBytes(payload);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseHeaders().put(Headers.CONTENT_LENGTH, String.valueOf(body.length));
        exchange.getResponseSender().send(ByteBuffer.wrap(body));
    }

    private JsonNode readJsonBody(HttpServerExchange exchange) throws IOException {
        exchange.startBlocking();
        byte[] bytes = exchange.getInputStream().readAllBytes();
        if (bytes.length == 0) {
            return mapper.createObjectNode();
        }
        return mapper.readTree(bytes);
    }

    private Map<String, Object> toSummaryResponse(CommandSummary summary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("command", summary.command());
        payload.put("lastTaskId", summary.lastTaskId());
        payload.put("lastRunAt", summary.lastRunAt());
        payload.put("successCount", summary.successCount());
        payload.put("failureCount", summary.failureCount());
        payload.put("lastOutput", summary.lastOutput());
        return payload;
    }

    private Map<String, Object> toRecordResponse(ExecutionRecord record) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("uid", record.uid());
        payload.put("sequenceId", record.sequenceId());
        payload.put("command", record.command());
        payload.put("timestamp", record.timestamp());
        payload.put("status", record.status().label());
        payload.put("exitCode", record.exitCode());
        payload.put("durationMs", record.durationMs());
        payload.put("output", record.output());
        return payload;
    }

    private static boolean isMethod(HttpServerExchange exchange, String method) {
        return method.equalsIgnoreCase(exchange.getRequestMethod().toString());
    }

    private static String readString(JsonNode body, String field) {
        JsonNode node = body.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String queryParam(HttpServerExchange exchange, String key) {
        Deque<String> values = exchange.getQueryParameters().get(key);
        if (values == null || values.isEmpty()) {
            return "";
        }
        String value = values.peekFirst();
        return value == null ? "" : value.trim();
    }

    private static int parseQueryInt(HttpServerExchange exchange, String key, int fallback) {
        String raw = queryParam(exchange, key);
        if (raw.isEmpty()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static int resolveBoundPort(Undertow undertow, int fallbackPort) {
        List<Undertow.ListenerInfo> listeners = undertow.getListenerInfo();
        if (!listeners.isEmpty() && listeners.get(0).getAddress() instanceof InetSocketAddress socketAddress) {
            return socketAddress.getPort();
        }
        return fallbackPort;
    }

    @FunctionalInterface
    private interface Route {
        void handle(HttpServerExchange exchange) throws Exception;
    }
}
