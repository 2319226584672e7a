package com.docvault.search.service;

import com.docvault.search.config.ElasticsearchProperties;
import com.docvault.search.config.WebClientConfig;
import com.docvault.search.exception.BackendUnavailableException;
import com.docvault.search.exception.SearchBackendException;
import com.docvault.search.model.ArticleDoc;
import com.docvault.search.model.DocumentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class ElasticsearchServiceTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private Function<ClientRequest, Mono<ClientResponse>> responder;
    private ElasticsearchProperties properties;
    private ElasticsearchService service;

    @BeforeEach
    public void setUp() {
        properties = new ElasticsearchProperties();
        properties.setMaxRetries(2);
        properties.setRetryBackoffMs(1);
        WebClient client = WebClient.builder()
                .baseUrl("http://es.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return responder.apply(request);
                })
                .build();
        service = new ElasticsearchService(client, new WebClientConfig().objectMapper(), properties);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    public void getMapsSourceAndId() {
        responder = r -> json(HttpStatus.OK, """
                {"_index":"app_articles","_id":"abc","found":true,
                 "_source":{"title":"Hello","category":"technology","tags":["a","b"],"views":3,"rating":4.5,
                            "created_at":"2026-03-01T10:00:00.000Z","updated_at":"2026-03-01T10:00:01.000Z"}}
                """);

        ArticleDoc doc = service.get("app_articles", "abc", ArticleDoc.class).block();

        assertNotNull(doc);
        assertEquals("abc", doc.getId());
        assertEquals("Hello", doc.getTitle());
        assertEquals(List.of("a", "b"), doc.getTags());
        assertEquals(3, doc.getViews());
        assertEquals(OffsetDateTime.parse("2026-03-01T10:00:00Z").toInstant(), doc.getCreated_at().toInstant());
        assertEquals(HttpMethod.GET, requests.get(0).method());
        assertEquals("/app_articles/_doc/abc", requests.get(0).url().getPath());
    }

    @Test
    public void getMissIsEmptyNotError() {
        responder = r -> json(HttpStatus.NOT_FOUND, "{\"_index\":\"app_articles\",\"_id\":\"nope\",\"found\":false}");

        assertNull(service.get("app_articles", "nope", ArticleDoc.class).block());
        assertEquals(1, requests.size());
    }

    @Test
    public void indexWithoutIdPostsAndReturnsAssignedId() {
        responder = r -> json(HttpStatus.CREATED, "{\"_id\":\"generated-1\",\"result\":\"created\"}");
        ArticleDoc doc = new ArticleDoc();
        doc.setTitle("New");

        String id = service.indexDocument("app_articles", doc).block();

        assertEquals("generated-1", id);
        ClientRequest req = requests.get(0);
        assertEquals(HttpMethod.POST, req.method());
        assertEquals("/app_articles/_doc", req.url().getPath());
        assertEquals("refresh=false", req.url().getQuery());
    }

    @Test
    public void indexWithIdReplacesDocument() {
        responder = r -> json(HttpStatus.OK, "{\"_id\":\"abc\",\"result\":\"updated\"}");
        ArticleDoc doc = new ArticleDoc();
        doc.setId("abc");

        assertEquals("abc", service.indexDocument("app_articles", doc).block());
        assertEquals(HttpMethod.PUT, requests.get(0).method());
        assertEquals("/app_articles/_doc/abc", requests.get(0).url().getPath());
    }

    @Test
    public void searchReturnsHitsInOrder() {
        responder = r -> json(HttpStatus.OK, """
                {"hits":{"total":{"value":2},"hits":[
                  {"_id":"2","_score":2.0,"_source":{"title":"Second"}},
                  {"_id":"1","_score":1.0,"_source":{"title":"First"}}]}}
                """);

        List<ArticleDoc> docs = service.search("app_articles", Map.of("query", Map.of("match_all", Map.of())), ArticleDoc.class).block();

        assertEquals(List.of("2", "1"), docs.stream().map(ArticleDoc::getId).toList());
        assertEquals("Second", docs.get(0).getTitle());
        assertEquals("/app_articles/_search", requests.get(0).url().getPath());
    }

    @Test
    public void searchWithNoHitsIsEmptyList() {
        responder = r -> json(HttpStatus.OK, "{\"hits\":{\"total\":{\"value\":0},\"hits\":[]}}");

        assertEquals(List.of(), service.search("app_articles", Map.of(), ArticleDoc.class).block());
    }

    @Test
    public void deleteReportsWhetherSomethingWasDeleted() {
        responder = r -> json(HttpStatus.OK, "{\"_id\":\"abc\",\"result\":\"deleted\"}");
        assertTrue(service.delete("app_articles", "abc").block());
        assertEquals(HttpMethod.DELETE, requests.get(0).method());

        responder = r -> json(HttpStatus.NOT_FOUND, "{\"_id\":\"abc\",\"result\":\"not_found\"}");
        assertFalse(service.delete("app_articles", "abc").block());
        assertFalse(service.delete("app_articles", "abc").block());
    }

    @Test
    public void errorStatusIsBackendFailureAndNotRetried() {
        responder = r -> json(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":{\"type\":\"search_phase_execution_exception\"}}");

        SearchBackendException ex = assertThrows(SearchBackendException.class,
                () -> service.search("app_articles", Map.of(), ArticleDoc.class).block());

        assertFalse(ex instanceof BackendUnavailableException);
        assertFalse(ex.getMessage().contains("search_phase_execution_exception"));
        assertEquals(1, requests.size());
    }

    @Test
    public void transportFailureIsRetriedThenReportedUnavailable() {
        responder = r -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), r.method(), r.url(), new HttpHeaders()));

        assertThrows(BackendUnavailableException.class, () -> service.get("app_articles", "abc", ArticleDoc.class).block());
        assertEquals(3, requests.size());
    }

    @Test
    public void transportFailureRecoversOnRetry() {
        responder = r -> requests.size() == 1
                ? Mono.error(new WebClientRequestException(new ConnectException("refused"), r.method(), r.url(), new HttpHeaders()))
                : json(HttpStatus.OK, "{\"_id\":\"abc\",\"found\":true,\"_source\":{\"title\":\"Back\"}}");

        ArticleDoc doc = service.get("app_articles", "abc", ArticleDoc.class).block();

        assertEquals("Back", doc.getTitle());
        assertEquals(2, requests.size());
    }

    @Test
    public void defaultRetryPolicyGivesUpWithinSeconds() {
        ElasticsearchService defaults = new ElasticsearchService(null, null, new ElasticsearchProperties());

        Duration budget = defaults.maxRetryDelay();

        assertTrue(budget.compareTo(Duration.ofSeconds(15)) < 0, "retry delays add up to " + budget);
        assertTrue(budget.toMillis() <= new ElasticsearchProperties().getRetryTotalTimeoutMs());
    }

    @Test
    public void backoffIsCappedAtMaxBackoff() {
        properties.setMaxRetries(10);
        properties.setRetryBackoffMs(5);
        properties.setRetryMaxBackoffMs(5);
        responder = r -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), r.method(), r.url(), new HttpHeaders()));

        long started = System.nanoTime();
        assertThrows(BackendUnavailableException.class, () -> service.get("app_articles", "abc", ArticleDoc.class).block());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertEquals(11, requests.size());
        // uncapped exponential growth from 5ms would sleep for about five seconds
        assertTrue(elapsedMs < 2000, "took " + elapsedMs + " ms");
    }

    @Test
    public void totalTimeoutStopsRetryingEarly() {
        properties.setMaxRetries(10);
        properties.setRetryBackoffMs(1000);
        properties.setRetryMaxBackoffMs(1000);
        properties.setRetryTotalTimeoutMs(100);
        responder = r -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), r.method(), r.url(), new HttpHeaders()));

        long started = System.nanoTime();
        assertThrows(BackendUnavailableException.class, () -> service.ping().block());
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertTrue(elapsedMs < 2000, "took " + elapsedMs + " ms");
        assertEquals(1, requests.size());
    }

    @Test
    public void ensureIndexToleratesExistingIndex() {
        responder = r -> json(HttpStatus.BAD_REQUEST,
                "{\"error\":{\"type\":\"resource_already_exists_exception\"},\"status\":400}");

        assertDoesNotThrow(() -> service.ensureIndex("app_articles", DocumentType.ARTICLES).block());
        assertEquals(HttpMethod.PUT, requests.get(0).method());
        assertEquals("/app_articles", requests.get(0).url().getPath());
    }

    @Test
    public void ensureIndexFailsOnOtherBadRequest() {
        responder = r -> json(HttpStatus.BAD_REQUEST, "{\"error\":{\"type\":\"mapper_parsing_exception\"}}");

        assertThrows(SearchBackendException.class, () -> service.ensureIndex("app_articles", DocumentType.ARTICLES).block());
    }

    @Test
    public void pingFailsWhenUnreachable() {
        responder = r -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), r.method(), r.url(), new HttpHeaders()));

        assertThrows(BackendUnavailableException.class, () -> service.ping().block());
    }

    @Test
    public void healthFollowsClusterStatus() {
        responder = r -> json(HttpStatus.OK, "{\"status\":\"yellow\"}");
        assertTrue(service.isHealthy().block());

        responder = r -> json(HttpStatus.OK, "{\"status\":\"red\"}");
        assertFalse(service.isHealthy().block());

        responder = r -> Mono.error(new WebClientRequestException(
                new ConnectException("Connection refused"), r.method(), r.url(), new HttpHeaders()));
        assertFalse(service.isHealthy().block());
        assertEquals("/_cluster/health", requests.get(0).url().getPath());
    }
}
