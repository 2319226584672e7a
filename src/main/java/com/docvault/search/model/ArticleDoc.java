package com.docvault.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Article document indexed in {prefix}_articles.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleDoc extends BaseDoc {
    private String title;       // full text, boosted in search
    private String content;     // full text
    private String author;      // keyword
    private String category;    // keyword
    private List<String> tags;  // keywords, order not guaranteed
    private Integer views;
    private Double rating;

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public Integer getViews() {
        return views;
    }

    public void setViews(Integer views) {
        this.views = views;
    }

    public Double getRating() {
        return rating;
    }

    public void setRating(Double rating) {
        this.rating = rating;
    }
}
