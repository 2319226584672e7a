package com.docvault.search.config;

import com.docvault.search.model.DocumentType;
import com.docvault.search.service.ElasticsearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Verifies the backend connection and creates missing indexes before the service takes
 * traffic. Any failure here aborts startup.
 */
@Component
public class ElasticsearchBootstrap implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ElasticsearchBootstrap.class);

    private final ElasticsearchService elasticsearchService;
    private final ElasticsearchProperties properties;

    public ElasticsearchBootstrap(ElasticsearchService elasticsearchService, ElasticsearchProperties properties) {
        this.elasticsearchService = elasticsearchService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isVerifyOnStartup()) {
            log.info("Skipping Elasticsearch startup verification");
            return;
        }
        try {
            elasticsearchService.ping()
                    .thenMany(Flux.fromArray(DocumentType.values()))
                    .concatMap(type -> elasticsearchService.ensureIndex(properties.indexName(type), type))
                    .then()
                    .block();
        } catch (RuntimeException e) {
            log.error("Failed to connect to Elasticsearch at {}: {}", properties.getHost(), e.toString());
            throw e;
        }
    }
}
