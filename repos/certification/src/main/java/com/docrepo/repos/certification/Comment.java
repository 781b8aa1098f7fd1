package com.docrepo.repos.certification;

import com.docrepo.core.Entity;

import java.util.Objects;

/**
 * Embedded record kept in {@link Note#getComments()}.
 */
public class Comment extends Entity<String> {
    private String text;
    private String author;
    private Integer votes;

    public Comment() {
    }

    public Comment(String text, String author, Integer votes) {
        this.text = text;
        this.author = author;
        this.votes = votes;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public Integer getVotes() {
        return votes;
    }

    public void setVotes(Integer votes) {
        this.votes = votes;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        Comment comment = (Comment) o;
        return Objects.equals(text, comment.text)
                && Objects.equals(author, comment.author)
                && Objects.equals(votes, comment.votes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), text, author, votes);
    }

    @Override
    public String toString() {
        return "Comment{id=" + getId() + ", text=" + text + ", author=" + author + ", votes=" + votes + "}";
    }
}
