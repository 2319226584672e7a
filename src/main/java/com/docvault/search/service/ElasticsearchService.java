package com.docvault.search.service;

import com.docvault.search.config.ElasticsearchProperties;
import com.docvault.search.exception.BackendUnavailableException;
import com.docvault.search.exception.SearchBackendException;
import com.docvault.search.model.BaseDoc;
import com.docvault.search.model.DocumentType;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Elasticsearch REST client: single-document get/index/delete, search, index bootstrap and
 * cluster health. A lookup miss is an empty Mono; every other failure is a
 * {@link SearchBackendException}.
 */
@Service
public class ElasticsearchService {
    private static final Logger log = LoggerFactory.getLogger(ElasticsearchService.class);
    private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE = new ParameterizedTypeReference<>() {};
    private static final Set<String> HEALTHY_STATUSES = Set.of("green", "yellow");
    private static final double RETRY_JITTER = 0.5;

    private final WebClient elasticsearchClient;
    private final ObjectMapper objectMapper;
    private final ElasticsearchProperties properties;

    public ElasticsearchService(@Qualifier("elasticsearchClient") WebClient elasticsearchClient, ObjectMapper objectMapper, ElasticsearchProperties properties) {
        this.elasticsearchClient = elasticsearchClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public <T extends BaseDoc> Mono<T> get(String index, String id, Class<T> type) {
        Mono<Map<String, Object>> call = elasticsearchClient.get().uri("/{index}/_doc/{id}", index, id)
                .exchangeToMono(resp -> {
                    // missing document and missing index are both a miss
                    if (resp.statusCode().value() == 404) return resp.releaseBody().then(Mono.empty());
                    return readJson(resp, "get");
                });
        return withRetry(call, "get")
                .filter(raw -> Boolean.TRUE.equals(raw.get("found")))
                .map(raw -> toDoc(raw, type));
    }

    /**
     * Writes the whole document. Without an id the backend assigns one; with an id the stored
     * document is replaced. Returns the document id.
     */
    public Mono<String> indexDocument(String index, BaseDoc doc) {
        Map<String, Object> source = toSource(doc);
        String refresh = properties.getRefresh();
        WebClient.RequestBodySpec request = doc.getId() == null
                ? elasticsearchClient.post().uri(b -> b.path("/{index}/_doc").queryParam("refresh", refresh).build(index))
                : elasticsearchClient.put().uri(b -> b.path("/{index}/_doc/{id}").queryParam("refresh", refresh).build(index, doc.getId()));
        Mono<Map<String, Object>> call = request
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(source)
                .exchangeToMono(resp -> readJson(resp, "index"));
        return withRetry(call, "index").map(raw -> {
            Object id = raw.get("_id");
            if (id == null) throw new SearchBackendException("Elasticsearch index response carried no _id");
            return String.valueOf(id);
        });
    }

    public <T extends BaseDoc> Mono<List<T>> search(String index, Map<String, Object> body, Class<T> type) {
        Mono<Map<String, Object>> call = elasticsearchClient.post().uri("/{index}/_search", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchangeToMono(resp -> readJson(resp, "search"));
        return withRetry(call, "search").map(raw -> {
            List<T> docs = new ArrayList<>();
            if (raw.get("hits") instanceof Map<?, ?> hits && hits.get("hits") instanceof List<?> list) {
                for (Object h : list) {
                    if (h instanceof Map<?, ?> hit) docs.add(toDoc(hit, type));
                }
            }
            return docs;
        });
    }

    /**
     * @return true if a document was deleted, false if there was nothing to delete
     */
    public Mono<Boolean> delete(String index, String id) {
        Mono<Boolean> call = elasticsearchClient.delete()
                .uri(b -> b.path("/{index}/_doc/{id}").queryParam("refresh", properties.getRefresh()).build(index, id))
                .exchangeToMono(resp -> {
                    if (resp.statusCode().value() == 404) return resp.releaseBody().thenReturn(Boolean.FALSE);
                    return readJson(resp, "delete").map(raw -> "deleted".equals(raw.get("result")));
                });
        return withRetry(call, "delete");
    }

    /**
     * Creates the index with its mappings unless it already exists.
     */
    public Mono<Void> ensureIndex(String index, DocumentType type) {
        Map<String, Object> payload = Map.of(
                "settings", Map.of(
                        "number_of_shards", properties.getNumberOfShards(),
                        "number_of_replicas", properties.getNumberOfReplicas()),
                "mappings", type.mappings());
        Mono<Void> call = elasticsearchClient.put().uri("/{index}", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .exchangeToMono(resp -> {
                    if (resp.statusCode().is2xxSuccessful()) {
                        log.info("Created index {}", index);
                        return resp.releaseBody();
                    }
                    if (resp.statusCode().value() == 400) {
                        return resp.bodyToMono(String.class).defaultIfEmpty("").flatMap(body -> {
                            if (body.contains("resource_already_exists_exception")) {
                                log.debug("Index {} already exists", index);
                                return Mono.<Void>empty();
                            }
                            log.error("Elasticsearch create index error: status=400 body={}", abbreviate(body));
                            return Mono.<Void>error(new SearchBackendException("Elasticsearch create index failed with status 400"));
                        });
                    }
                    return this.<Void>failure(resp, "create index");
                });
        return withRetry(call, "create index");
    }

    /**
     * Fails with {@link BackendUnavailableException} if the cluster cannot be reached.
     */
    public Mono<Void> ping() {
        Mono<Map<String, Object>> call = elasticsearchClient.get().uri("/")
                .exchangeToMono(resp -> readJson(resp, "ping"));
        return withRetry(call, "ping")
                .doOnNext(info -> log.info("Connected to Elasticsearch at {}", properties.getHost()))
                .then();
    }

    public Mono<Boolean> isHealthy() {
        return elasticsearchClient.get().uri("/_cluster/health")
                .retrieve()
                .bodyToMono(MAP_TYPE)
                .map(m -> HEALTHY_STATUSES.contains(String.valueOf(m.get("status"))))
                .onErrorResume(e -> {
                    log.error("Elasticsearch health check failed: {}", e.toString());
                    return Mono.just(Boolean.FALSE);
                });
    }

    /**
     * Worst-case time spent sleeping between attempts with the configured retry policy,
     * jitter included. Connect and response timeouts come on top but are bounded by
     * {@code retry-total-timeout-ms}.
     */
    public Duration maxRetryDelay() {
        long total = 0;
        long delay = firstBackoff().toMillis();
        long cap = maxBackoff().toMillis();
        for (int i = 0; i < properties.getMaxRetries(); i++) {
            total += Math.min(delay, cap);
            delay = Math.min(delay * 2, cap);
        }
        return Duration.ofMillis(Math.round(total * (1 + RETRY_JITTER)));
    }

    private Duration firstBackoff() {
        return Duration.ofMillis(Math.max(1, properties.getRetryBackoffMs()));
    }

    private Duration maxBackoff() {
        return Duration.ofMillis(Math.max(firstBackoff().toMillis(), properties.getRetryMaxBackoffMs()));
    }

    private <R> Mono<R> withRetry(Mono<R> call, String op) {
        return call
                .retryWhen(Retry.backoff(properties.getMaxRetries(), firstBackoff())
                        .maxBackoff(maxBackoff())
                        .jitter(RETRY_JITTER)
                        .filter(this::isRetryable)
                        .doBeforeRetry(sig -> log.warn("Retrying Elasticsearch {} attempt={} cause={}", op, sig.totalRetries() + 1, sig.failure().toString()))
                        .onRetryExhaustedThrow((retrySpec, sig) -> new BackendUnavailableException(
                                "Elasticsearch " + op + " failed after " + sig.totalRetries() + " retries", sig.failure())))
                .timeout(Duration.ofMillis(Math.max(1, properties.getRetryTotalTimeoutMs())))
                .onErrorMap(this::isTransportFailure, e -> new BackendUnavailableException("Elasticsearch " + op + " failed", e));
    }

    private boolean isTransportFailure(Throwable e) {
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }

    private boolean isRetryable(Throwable e) {
        if (!isTransportFailure(e)) return false;
        return properties.isRetryOnTimeout() || !isTimeout(e);
    }

    private static boolean isTimeout(Throwable e) {
        Throwable cause = e instanceof WebClientRequestException ? e.getCause() : e;
        return cause instanceof TimeoutException || cause instanceof io.netty.handler.timeout.TimeoutException;
    }

    private Mono<Map<String, Object>> readJson(ClientResponse resp, String op) {
        if (resp.statusCode().isError()) return failure(resp, op);
        return resp.bodyToMono(MAP_TYPE).defaultIfEmpty(Map.of());
    }

    private <R> Mono<R> failure(ClientResponse resp, String op) {
        int status = resp.statusCode().value();
        return resp.bodyToMono(String.class).defaultIfEmpty("").flatMap(body -> {
            log.error("Elasticsearch {} error: status={} body={}", op, status, abbreviate(body));
            return Mono.error(new SearchBackendException("Elasticsearch " + op + " failed with status " + status));
        });
    }

    private Map<String, Object> toSource(BaseDoc doc) {
        Map<String, Object> source = objectMapper.convertValue(doc, new TypeReference<Map<String, Object>>() {});
        source.remove("id");
        return source;
    }

    private <T extends BaseDoc> T toDoc(Map<?, ?> hit, Class<T> type) {
        try {
            Object source = hit.get("_source");
            T doc = objectMapper.convertValue(source != null ? source : Map.of(), type);
            doc.setId(String.valueOf(hit.get("_id")));
            return doc;
        } catch (IllegalArgumentException e) {
            throw new SearchBackendException("Unreadable document " + hit.get("_id") + " in Elasticsearch response", e);
        }
    }

    private static String abbreviate(String body) {
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
