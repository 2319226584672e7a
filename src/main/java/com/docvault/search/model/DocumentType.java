package com.docvault.search.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indexed document types with their field mappings. Keyword fields are matched on full
 * equality only; text fields go through the standard analyzer and are relevance ranked.
 */
public enum DocumentType {
    ARTICLES("articles") {
        @Override
        protected void addProperties(Map<String, Object> properties) {
            properties.put("title", text());
            properties.put("content", text());
            properties.put("author", keyword());
            properties.put("category", keyword());
            properties.put("tags", keyword());
            properties.put("views", Map.of("type", "integer"));
            properties.put("rating", Map.of("type", "float"));
        }
    },
    USERS("users") {
        @Override
        protected void addProperties(Map<String, Object> properties) {
            properties.put("username", keyword());
            properties.put("email", keyword());
            properties.put("full_name", text());
            properties.put("bio", text());
            properties.put("is_active", keyword());
        }
    };

    private final String suffix;

    DocumentType(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() { return suffix; }

    protected abstract void addProperties(Map<String, Object> properties);

    /** Body for the "mappings" section of a create-index request. */
    public Map<String, Object> mappings() {
        Map<String, Object> properties = new LinkedHashMap<>();
        addProperties(properties);
        properties.put("created_at", Map.of("type", "date"));
        properties.put("updated_at", Map.of("type", "date"));
        return Map.of("properties", properties);
    }

    private static Map<String, Object> text() {
        return Map.of("type", "text", "analyzer", "standard");
    }

    private static Map<String, Object> keyword() {
        return Map.of("type", "keyword");
    }
}
