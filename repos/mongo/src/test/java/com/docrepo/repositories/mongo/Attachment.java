package com.docrepo.repositories.mongo;

import com.docrepo.core.Entity;
import org.bson.types.ObjectId;

import java.util.Objects;

public class Attachment extends Entity<ObjectId> {
    private String name;
    private Long size;

    public Attachment() {
    }

    public Attachment(String name, long size) {
        this.name = name;
        this.size = size;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Long getSize() {
        return size;
    }

    public void setSize(Long size) {
        this.size = size;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        Attachment that = (Attachment) o;
        return Objects.equals(name, that.name) && Objects.equals(size, that.size);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), name, size);
    }
}
