package com.docrepo.repos.certification;

import com.docrepo.core.Entity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parent record used by the certification suites. {@code comments} holds
 * embedded records, {@code tags} embedded scalars.
 */
public class Note extends Entity<String> {
    private String title;
    private String status;
    private String email;
    private List<String> tags = new ArrayList<>();
    private List<Comment> comments = new ArrayList<>();

    public Note() {
    }

    public Note(String title, String status) {
        this.title = title;
        this.status = status;
    }

    public Note(String title, String status, String email) {
        this(title, status);
        this.email = email;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags;
    }

    public List<Comment> getComments() {
        return comments;
    }

    public void setComments(List<Comment> comments) {
        this.comments = comments;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        Note note = (Note) o;
        return Objects.equals(title, note.title)
                && Objects.equals(status, note.status)
                && Objects.equals(email, note.email)
                && Objects.equals(tags, note.tags)
                && Objects.equals(comments, note.comments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), title, status, email, tags, comments);
    }

    @Override
    public String toString() {
        return "Note{id=" + getId() + ", title=" + title + ", status=" + status + ", email=" + email + "}";
    }
}
