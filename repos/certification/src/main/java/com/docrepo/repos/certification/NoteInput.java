package com.docrepo.repos.certification;

/**
 * Request model for notes. Fields left null are not part of an update.
 */
public class NoteInput {
    private String title;
    private String status;
    private String email;

    public NoteInput() {
    }

    public NoteInput(String title, String status, String email) {
        this.title = title;
        this.status = status;
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
}
