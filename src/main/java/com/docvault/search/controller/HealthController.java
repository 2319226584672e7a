package com.docvault.search.controller;

import com.docvault.search.service.ElasticsearchService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/health")
public class HealthController {
    private final ElasticsearchService elasticsearchService;

    public HealthController(ElasticsearchService elasticsearchService) { this.elasticsearchService = elasticsearchService; }

    @GetMapping({"", "/"})
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return elasticsearchService.isHealthy()
                .map(ok -> ok
                        ? ResponseEntity.ok(Map.<String, Object>of("status", "healthy", "elasticsearch", "connected"))
                        : unhealthy())
                .onErrorReturn(unhealthy());
    }

    @GetMapping("/elasticsearch")
    public Mono<Map<String, Object>> elasticsearch() {
        return elasticsearchService.isHealthy()
                .onErrorReturn(Boolean.FALSE)
                .map(ok -> Map.<String, Object>of("elasticsearch", ok ? "healthy" : "unhealthy"));
    }

    private static ResponseEntity<Map<String, Object>> unhealthy() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.<String, Object>of("status", "unhealthy", "detail", "Elasticsearch is not healthy"));
    }
}
