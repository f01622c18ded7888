package com.z254.prism.client.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.prism.config.PrismProperties;
import com.z254.prism.exception.CollaboratorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Shared request handling for the monitoring API adapters.
 * <p>
 * Non-2xx responses, unreadable bodies and timeouts surface as {@link CollaboratorException}.
 * List endpoints answer either {@code {"items": [...]}} or {@code {"data": {"items": [...]}}};
 * {@link #items(JsonNode)} accepts both.
 */
@Slf4j
abstract class MonitoringApiSupport {

    protected final WebClient webClient;
    protected final Duration timeout;

    protected MonitoringApiSupport(WebClient monitoringWebClient, PrismProperties prismProperties) {
        this.webClient = monitoringWebClient;
        this.timeout = prismProperties.getApi().getTimeout();
    }

    protected Mono<JsonNode> getJson(String collaborator, Function<UriBuilder, URI> uri) {
        return webClient.get()
                .uri(uri)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new CollaboratorException(collaborator,
                                "HTTP " + response.statusCode().value() + " " + errorMessage(body), null)))
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .onErrorMap(error -> !(error instanceof CollaboratorException),
                        error -> new CollaboratorException(collaborator, String.valueOf(error.getMessage()), error))
                .doOnError(error -> log.debug("Monitoring API call failed: {}", error.getMessage()));
    }

    protected static List<JsonNode> items(JsonNode body) {
        JsonNode items = body.path("items");
        if (items.isMissingNode()) {
            items = body.path("data").path("items");
        }
        List<JsonNode> result = new ArrayList<>();
        if (items.isArray()) {
            items.forEach(result::add);
        }
        return result;
    }

    protected static String text(JsonNode node, String field, String alternate, String defaultValue) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            value = node.path(alternate);
        }
        return value.isMissingNode() || value.isNull() ? defaultValue : value.asText();
    }

    protected static Long longOrNull(JsonNode node, String field, String alternate) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            value = node.path(alternate);
        }
        if (value.isNumber() || (value.isTextual() && value.asText().matches("-?\\d+"))) {
            return value.asLong();
        }
        return null;
    }

    private static String errorMessage(String body) {
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
