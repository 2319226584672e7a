package com.docvault.search.controller;

import com.docvault.search.dto.DocumentDtos;
import com.docvault.search.dto.SearchDtos;
import com.docvault.search.exception.DocumentNotFoundException;
import com.docvault.search.model.ArticleDoc;
import com.docvault.search.model.UserDoc;
import com.docvault.search.service.DocumentService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping(value = "/documents", produces = MediaType.APPLICATION_JSON_VALUE)
public class DocumentController {
    private static final Logger log = LoggerFactory.getLogger(DocumentController.class);
    private final DocumentService documentService;

    public DocumentController(DocumentService documentService) { this.documentService = documentService; }

    @PostMapping("/articles")
    public Mono<ArticleDoc> createArticle(@Valid @RequestBody DocumentDtos.ArticleCreateRequest body) {
        return documentService.createArticle(body);
    }

    @GetMapping("/articles/{id}")
    public Mono<ArticleDoc> getArticle(@PathVariable("id") String id) {
        return documentService.getArticle(id)
                .switchIfEmpty(Mono.error(() -> new DocumentNotFoundException("Article not found")));
    }

    @GetMapping("/articles")
    public Mono<List<ArticleDoc>> searchArticles(
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset,
            ServerWebExchange exchange) {
        // raw values: a tag may itself contain a comma
        List<String> tags = exchange.getRequest().getQueryParams().get("tags");
        if (limit < 1 || limit > SearchDtos.MAX_LIMIT) {
            return Mono.error(new ServerWebInputException("limit must be between 1 and " + SearchDtos.MAX_LIMIT));
        }
        if (offset < 0) {
            return Mono.error(new ServerWebInputException("offset must be greater than or equal to 0"));
        }
        log.debug("/documents/articles query='{}' category='{}' tags={} limit={} offset={}", query, category, tags, limit, offset);
        return documentService.searchArticles(new SearchDtos.ArticleSearchParams(query, category, tags, limit, offset));
    }

    @PutMapping("/articles/{id}")
    public Mono<ArticleDoc> updateArticle(@PathVariable("id") String id,
                                          @Valid @RequestBody DocumentDtos.ArticleUpdateRequest body) {
        return documentService.updateArticle(id, body)
                .switchIfEmpty(Mono.error(() -> new DocumentNotFoundException("Article not found")));
    }

    @DeleteMapping("/articles/{id}")
    public Mono<DocumentDtos.MessageResponse> deleteArticle(@PathVariable("id") String id) {
        return documentService.deleteArticle(id)
                .flatMap(deleted -> deleted
                        ? Mono.just(new DocumentDtos.MessageResponse("Article deleted successfully"))
                        : Mono.<DocumentDtos.MessageResponse>error(new DocumentNotFoundException("Article not found")));
    }

    @PostMapping("/users")
    public Mono<UserDoc> createUser(@Valid @RequestBody DocumentDtos.UserCreateRequest body) {
        return documentService.createUser(body);
    }

    @GetMapping("/users/{id}")
    public Mono<UserDoc> getUser(@PathVariable("id") String id) {
        return documentService.getUser(id)
                .switchIfEmpty(Mono.error(() -> new DocumentNotFoundException("User not found")));
    }

    @PutMapping("/users/{id}")
    public Mono<UserDoc> updateUser(@PathVariable("id") String id,
                                    @Valid @RequestBody DocumentDtos.UserUpdateRequest body) {
        return documentService.updateUser(id, body)
                .switchIfEmpty(Mono.error(() -> new DocumentNotFoundException("User not found")));
    }

    @DeleteMapping("/users/{id}")
    public Mono<DocumentDtos.MessageResponse> deleteUser(@PathVariable("id") String id) {
        return documentService.deleteUser(id)
                .flatMap(deleted -> deleted
                        ? Mono.just(new DocumentDtos.MessageResponse("User deleted successfully"))
                        : Mono.<DocumentDtos.MessageResponse>error(new DocumentNotFoundException("User not found")));
    }
}
