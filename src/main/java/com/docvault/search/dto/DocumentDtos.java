package com.docvault.search.dto;

import com.docvault.search.model.ArticleDoc;
import com.docvault.search.model.UserDoc;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.List;

public class DocumentDtos {

    public static class ArticleCreateRequest {
        @NotNull
        private String title;
        @NotNull
        private String content;
        @NotNull
        private String author;
        @NotNull
        private String category;
        private List<String> tags = new ArrayList<>();
        @Min(0)
        private Integer views = 0;
        private Double rating = 0.0;

        public ArticleDoc toDoc() {
            ArticleDoc d = new ArticleDoc();
            d.setTitle(title);
            d.setContent(content);
            d.setAuthor(author);
            d.setCategory(category);
            d.setTags(tags != null ? new ArrayList<>(tags) : new ArrayList<>());
            d.setViews(views != null ? views : 0);
            d.setRating(rating != null ? rating : 0.0);
            return d;
        }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
        public String getAuthor() { return author; }
        public void setAuthor(String author) { this.author = author; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags; }
        public Integer getViews() { return views; }
        public void setViews(Integer views) { this.views = views; }
        public Double getRating() { return rating; }
        public void setRating(Double rating) { this.rating = rating; }
    }

    /**
     * Partial article update. Only non-null fields overwrite the stored document.
     */
    public static class ArticleUpdateRequest {
        private String title;
        private String content;
        private String author;
        private String category;
        private List<String> tags;
        @Min(0)
        private Integer views;
        private Double rating;

        public void applyTo(ArticleDoc d) {
            if (title != null) d.setTitle(title);
            if (content != null) d.setContent(content);
            if (author != null) d.setAuthor(author);
            if (category != null) d.setCategory(category);
            if (tags != null) d.setTags(new ArrayList<>(tags));
            if (views != null) d.setViews(views);
            if (rating != null) d.setRating(rating);
        }

        public String getTitle() { return title; }
        public void setTitle(String title) { this.title = title; }
        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
        public String getAuthor() { return author; }
        public void setAuthor(String author) { this.author = author; }
        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public List<String> getTags() { return tags; }
        public void setTags(List<String> tags) { this.tags = tags; }
        public Integer getViews() { return views; }
        public void setViews(Integer views) { this.views = views; }
        public Double getRating() { return rating; }
        public void setRating(Double rating) { this.rating = rating; }
    }

    public static class UserCreateRequest {
        @NotNull
        private String username;
        @NotNull
        private String email;
        @NotNull
        private String full_name;
        private String bio = "";
        private String is_active = "true";

        public UserDoc toDoc() {
            UserDoc d = new UserDoc();
            d.setUsername(username);
            d.setEmail(email);
            d.setFull_name(full_name);
            d.setBio(bio != null ? bio : "");
            d.setIs_active(is_active != null ? is_active : "true");
            return d;
        }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
        public String getFull_name() { return full_name; }
        public void setFull_name(String full_name) { this.full_name = full_name; }
        public String getBio() { return bio; }
        public void setBio(String bio) { this.bio = bio; }
        public String getIs_active() { return is_active; }
        public void setIs_active(String is_active) { this.is_active = is_active; }
    }

    public static class UserUpdateRequest {
        private String username;
        private String email;
        private String full_name;
        private String bio;
        private String is_active;

        public void applyTo(UserDoc d) {
            if (username != null) d.setUsername(username);
            if (email != null) d.setEmail(email);
            if (full_name != null) d.setFull_name(full_name);
            if (bio != null) d.setBio(bio);
            if (is_active != null) d.setIs_active(is_active);
        }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getEmail() { return email; }
        public void setEmail(String email) { this.email = email; }
        public String getFull_name() { return full_name; }
        public void setFull_name(String full_name) { this.full_name = full_name; }
        public String getBio() { return bio; }
        public void setBio(String bio) { this.bio = bio; }
        public String getIs_active() { return is_active; }
        public void setIs_active(String is_active) { this.is_active = is_active; }
    }

    public static class MessageResponse {
        private String message;

        public MessageResponse() {}
        public MessageResponse(String message) { this.message = message; }

        public String getMessage() { return message; }
        public void setMessage(String message) { this.message = message; }
    }
}
