package com.docvault.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * User document indexed in {prefix}_users.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserDoc extends BaseDoc {
    private String username;
    private String email;
    private String full_name;
    private String bio;
    // "true"/"false" as a keyword, not a JSON boolean
    private String is_active;

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getFull_name() {
        return full_name;
    }

    public void setFull_name(String full_name) {
        this.full_name = full_name;
    }

    public String getBio() {
        return bio;
    }

    public void setBio(String bio) {
        this.bio = bio;
    }

    public String getIs_active() {
        return is_active;
    }

    public void setIs_active(String is_active) {
        this.is_active = is_active;
    }
}
