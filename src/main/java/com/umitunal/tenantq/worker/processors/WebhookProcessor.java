package com.umitunal.tenantq.worker.processors;

import com.fasterxml.jackson.databind.JsonNode;
import com.umitunal.tenantq.worker.JobProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calls an HTTP endpoint. Any non-2xx response is a failed attempt.
 */
public class WebhookProcessor implements JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(WebhookProcessor.class);

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE");
    private static final String DEFAULT_METHOD = "POST";

    private final HttpClient client;
    private final Duration requestTimeout;

    public WebhookProcessor(HttpClient client) {
        this(client, Duration.ofSeconds(30));
    }

    public WebhookProcessor(HttpClient client, Duration requestTimeout) {
        this.client = client;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ProcessingResult process(JsonNode payload) throws InterruptedException {
        String url = PayloadRules.text(payload, "url");
        String method = methodOf(payload);

        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json");

        JsonNode headers = payload.get("headers");
        if (headers != null && headers.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> header = fields.next();
                request.setHeader(header.getKey(), header.getValue().asText());
            }
        }

        JsonNode body = payload.get("body");
        HttpRequest.BodyPublisher publisher = body == null || body.isNull() || "GET".equals(method)
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body.toString());
        request.method(method, publisher);

        log.info("Webhook {} {}", method, url);
        try {
            HttpResponse<Void> response = client.send(request.build(), HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                return ProcessingResult.failure("HTTP " + status);
            }
            return ProcessingResult.success("HTTP " + status);
        } catch (IOException e) {
            return ProcessingResult.failure("Webhook failed: " + e.getMessage());
        }
    }

    @Override
    public List<String> validate(JsonNode payload) {
        List<String> violations = new ArrayList<>();
        if (!PayloadRules.requireObject(payload, violations)) {
            return violations;
        }

        String url = PayloadRules.text(payload, "url");
        if (url == null || !isHttpUrl(url)) {
            violations.add("url must be an http(s) URL");
        }

        JsonNode method = payload.get("method");
        if (method != null && !method.isNull() && !METHODS.contains(method.asText())) {
            violations.add("method must be one of " + METHODS);
        }

        JsonNode headers = payload.get("headers");
        if (headers != null && !headers.isNull()) {
            if (!headers.isObject()) {
                violations.add("headers must be an object");
            } else {
                headers.fields().forEachRemaining(header -> {
                    if (!header.getValue().isTextual()) {
                        violations.add("header " + header.getKey() + " must be a string");
                    }
                });
            }
        }
        return violations;
    }

    private static String methodOf(JsonNode payload) {
        String method = PayloadRules.text(payload, "method");
        return method != null ? method : DEFAULT_METHOD;
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value);
            return ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
