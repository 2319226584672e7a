package com.docvault.search.service;

import com.docvault.search.config.ElasticsearchProperties;
import com.docvault.search.dto.DocumentDtos;
import com.docvault.search.dto.SearchDtos;
import com.docvault.search.model.ArticleDoc;
import com.docvault.search.model.BaseDoc;
import com.docvault.search.model.DocumentType;
import com.docvault.search.model.UserDoc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Article and user operations on top of {@link ElasticsearchService}. "Not found" is an empty
 * Mono (or {@code false} for deletes); backend failures propagate as errors.
 */
@Service
public class DocumentService {
    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    private final ElasticsearchService elasticsearchService;
    private final ElasticsearchProperties properties;
    private final Clock clock;

    public DocumentService(ElasticsearchService elasticsearchService, ElasticsearchProperties properties, Clock clock) {
        this.elasticsearchService = elasticsearchService;
        this.properties = properties;
        this.clock = clock;
    }

    public Mono<ArticleDoc> createArticle(DocumentDtos.ArticleCreateRequest request) {
        return save(DocumentType.ARTICLES, request.toDoc())
                .doOnNext(a -> log.info("Created article with ID: {}", a.getId()))
                .doOnError(e -> log.error("Failed to create article: {}", e.toString()));
    }

    public Mono<ArticleDoc> getArticle(String id) {
        return elasticsearchService.get(index(DocumentType.ARTICLES), id, ArticleDoc.class)
                .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Article not found: {}", id)))
                .doOnError(e -> log.error("Failed to get article {}: {}", id, e.toString()));
    }

    public Mono<List<ArticleDoc>> searchArticles(SearchDtos.ArticleSearchParams params) {
        return elasticsearchService.search(index(DocumentType.ARTICLES), ElasticsearchQueryBuilder.articleSearch(params), ArticleDoc.class)
                .doOnError(e -> log.error("Failed to search articles: {}", e.toString()));
    }

    public Mono<ArticleDoc> updateArticle(String id, DocumentDtos.ArticleUpdateRequest update) {
        return elasticsearchService.get(index(DocumentType.ARTICLES), id, ArticleDoc.class)
                .flatMap(article -> {
                    update.applyTo(article);
                    return save(DocumentType.ARTICLES, article);
                })
                .doOnNext(a -> log.info("Updated article with ID: {}", id))
                .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Article not found for update: {}", id)))
                .doOnError(e -> log.error("Failed to update article {}: {}", id, e.toString()));
    }

    public Mono<Boolean> deleteArticle(String id) {
        return delete(DocumentType.ARTICLES, id, "Article");
    }

    public Mono<UserDoc> createUser(DocumentDtos.UserCreateRequest request) {
        return save(DocumentType.USERS, request.toDoc())
                .doOnNext(u -> log.info("Created user with ID: {}", u.getId()))
                .doOnError(e -> log.error("Failed to create user: {}", e.toString()));
    }

    public Mono<UserDoc> getUser(String id) {
        return elasticsearchService.get(index(DocumentType.USERS), id, UserDoc.class)
                .switchIfEmpty(Mono.fromRunnable(() -> log.warn("User not found: {}", id)))
                .doOnError(e -> log.error("Failed to get user {}: {}", id, e.toString()));
    }

    public Mono<UserDoc> updateUser(String id, DocumentDtos.UserUpdateRequest update) {
        return elasticsearchService.get(index(DocumentType.USERS), id, UserDoc.class)
                .flatMap(user -> {
                    update.applyTo(user);
                    return save(DocumentType.USERS, user);
                })
                .doOnNext(u -> log.info("Updated user with ID: {}", id))
                .switchIfEmpty(Mono.fromRunnable(() -> log.warn("User not found for update: {}", id)))
                .doOnError(e -> log.error("Failed to update user {}: {}", id, e.toString()));
    }

    public Mono<Boolean> deleteUser(String id) {
        return delete(DocumentType.USERS, id, "User");
    }

    private <T extends BaseDoc> Mono<T> save(DocumentType type, T doc) {
        return Mono.defer(() -> {
            doc.touch(OffsetDateTime.now(clock));
            return elasticsearchService.indexDocument(index(type), doc);
        }).map(id -> {
            doc.setId(id);
            return doc;
        });
    }

    private Mono<Boolean> delete(DocumentType type, String id, String label) {
        return elasticsearchService.delete(index(type), id)
                .doOnNext(deleted -> {
                    if (deleted) log.info("Deleted {} with ID: {}", label.toLowerCase(), id);
                    else log.warn("{} not found for deletion: {}", label, id);
                })
                .doOnError(e -> log.error("Failed to delete {} {}: {}", label.toLowerCase(), id, e.toString()));
    }

    private String index(DocumentType type) {
        return properties.indexName(type);
    }
}
