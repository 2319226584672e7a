package com.docvault.search.dto;

import java.util.List;

public class SearchDtos {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    /**
     * Article search parameters. Blank query/category and an empty tag list mean "no constraint".
     */
    public static class ArticleSearchParams {
        private String query;
        private String category;
        private List<String> tags;
        private int limit = DEFAULT_LIMIT;
        private int offset = 0;

        public ArticleSearchParams() {}

        public ArticleSearchParams(String query, String category, List<String> tags, int limit, int offset) {
            this.query = query;
            this.category = category;
            this.tags = tags;
            this.limit = limit;
            this.offset = offset;
        }

        public boolean hasQuery() { return query != null && !query.isBlank(); }
        public boolean hasCategory() { return category != null && !category.isBlank(); }
        public boolean hasTags() { return tags != null && tags.stream().anyMatch(t -> t != null && !t.isBlank()); }

        public String getQuery() { return query; }
        public void setQuery(String query) { this.query = query; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags; }
        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }
        public int getOffset() { return offset; }
        public void setOffset(int offset) { this.offset = offset; }
    }
}
