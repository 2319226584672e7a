package com.docvault.search.service;

import com.docvault.search.dto.SearchDtos;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Composes Elasticsearch search request bodies.
 */
public class ElasticsearchQueryBuilder {
    static final List<String> ARTICLE_TEXT_FIELDS = List.of("title^2", "content");

    public static Map<String, Object> articleSearch(SearchDtos.ArticleSearchParams params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", articleQuery(params));
        body.put("from", params.getOffset());
        body.put("size", params.getLimit());
        return body;
    }

    static Map<String, Object> articleQuery(SearchDtos.ArticleSearchParams params) {
        Map<String, Object> textQuery = params.hasQuery()
                ? Map.of("multi_match", Map.of("query", params.getQuery(), "fields", ARTICLE_TEXT_FIELDS))
                : null;

        List<Map<String, Object>> filters = new ArrayList<>();
        if (params.hasCategory()) {
            filters.add(Map.of("term", Map.of("category", params.getCategory())));
        }
        if (params.hasTags()) {
            filters.add(Map.of("terms", Map.of("tags", nonBlank(params.getTags()))));
        }

        if (filters.isEmpty()) {
            return textQuery != null ? textQuery : Map.of("match_all", Map.of());
        }
        // filter clauses AND with the text query without affecting its score
        Map<String, Object> bool = new LinkedHashMap<>();
        if (textQuery != null) bool.put("must", List.of(textQuery));
        bool.put("filter", filters);
        return Map.of("bool", bool);
    }

    private static List<String> nonBlank(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v);
        }
        return out;
    }
}
