package com.docrepo.repos.certification;

import com.docrepo.core.Filter;
import com.docrepo.core.Listing;
import com.docrepo.core.Repository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract every {@link Repository} implementation must satisfy. Subclasses
 * point {@link #repository} at an empty collection in {@link #init()}.
 */
public abstract class RepositoryCertification {
    protected Repository<Note, String> repository;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    @Test
    public void createShouldAssignIdentityAndCreationTime() {
        Instant before = Instant.now().minusSeconds(1);

        Note created = repository.create(new Note("Create Test", "open"));

        assertNotNull(created.getId());
        assertNotNull(created.getCreatedAt());
        assertTrue(created.getCreatedAt().isAfter(before));
        assertNull(created.getUpdatedAt());
        assertEquals("Create Test", created.getTitle());
    }

    @Test
    public void createShouldKeepACallerSuppliedId() {
        String id = UUID.randomUUID().toString();
        Note note = new Note("Supplied", "open");
        note.setId(id);

        Note created = repository.create(note);

        assertEquals(id, created.getId());
        assertTrue(repository.get(id).isPresent());
    }

    @Test
    public void getShouldReturnTheCreatedRecord() {
        Note created = repository.create(new Note("Round Trip", "open", "a@x.com"));

        Optional<Note> read = repository.get(created.getId());

        assertTrue(read.isPresent());
        assertEquals(created, read.get());
    }

    @Test
    public void getShouldReturnEmptyForAnUnknownId() {
        assertTrue(repository.get(UUID.randomUUID().toString()).isEmpty());
    }

    @Test
    public void deleteShouldReturnTrueOnceThenFalse() {
        Note created = repository.create(new Note("Delete Test", "open"));

        assertTrue(repository.delete(created.getId()));
        assertFalse(repository.delete(created.getId()));
        assertTrue(repository.get(created.getId()).isEmpty());
    }

    @Test
    public void updateShouldReplaceFieldsAndKeepIdentityAndCreationTime() {
        Note created = repository.create(new Note("Before", "open"));

        Note replacement = new Note("After", "closed");
        replacement.setId("ignored");
        replacement.setCreatedAt(Instant.EPOCH);
        Optional<Note> updated = repository.update(created.getId(), replacement);

        assertTrue(updated.isPresent());
        assertEquals(created.getId(), updated.get().getId());
        assertEquals(created.getCreatedAt(), updated.get().getCreatedAt());
        assertNotNull(updated.get().getUpdatedAt());
        assertEquals("After", updated.get().getTitle());
        assertEquals("closed", updated.get().getStatus());
        assertTrue(repository.get("ignored").isEmpty());
    }

    @Test
    public void updateShouldReturnEmptyForAnUnknownId() {
        assertTrue(repository.update(UUID.randomUUID().toString(), new Note("Nobody", "open")).isEmpty());
    }

    @Test
    public void listShouldReturnEverythingWithoutPagination() {
        for (int i = 0; i < 3; i++) {
            repository.create(new Note("note" + i, "open"));
        }

        Listing<Note> listing = repository.list(null, null, Filter.empty());

        assertEquals(3, listing.totalCount());
        assertEquals(3, listing.items().size());
    }

    @Test
    public void listShouldIgnorePaginationUnlessBothSizeAndPageAreGiven() {
        for (int i = 0; i < 4; i++) {
            repository.create(new Note("note" + i, "open"));
        }

        assertEquals(4, repository.list(2, null, Filter.empty()).items().size());
        assertEquals(4, repository.list(null, 2, Filter.empty()).items().size());
    }

    @Test
    public void listShouldCountAndPaginateOverFilteredRecordsOnly() {
        for (int i = 0; i < 5; i++) {
            repository.create(new Note("open" + i, "open"));
        }
        for (int i = 0; i < 3; i++) {
            repository.create(new Note("closed" + i, "closed"));
        }

        Listing<Note> first = repository.list(2, 1, Filter.where("status", "open"));

        assertEquals(5, first.totalCount());
        assertEquals(2, first.items().size());
        assertTrue(first.items().stream().allMatch(n -> "open".equals(n.getStatus())));
    }

    @Test
    public void listPagesShouldPartitionTheMatchingRecords() {
        for (int i = 0; i < 5; i++) {
            repository.create(new Note("note" + i, "open"));
        }

        List<Note> page1 = repository.list(2, 1, Filter.empty()).items();
        List<Note> page2 = repository.list(2, 2, Filter.empty()).items();
        List<Note> page3 = repository.list(2, 3, Filter.empty()).items();
        List<Note> page4 = repository.list(2, 4, Filter.empty()).items();

        assertEquals(2, page1.size());
        assertEquals(2, page2.size());
        assertEquals(1, page3.size());
        assertTrue(page4.isEmpty());

        Set<String> seen = new HashSet<>();
        for (List<Note> page : List.of(page1, page2, page3)) {
            seen.addAll(page.stream().map(Note::getId).collect(Collectors.toSet()));
        }
        assertEquals(5, seen.size());
    }

    @Test
    public void searchOneShouldReturnTheFirstMatchOrEmpty() {
        repository.create(new Note("Alpha", "open", "alpha@x.com"));
        repository.create(new Note("Beta", "closed", "beta@x.com"));

        Optional<Note> found = repository.searchOne(Filter.where("email", "beta@x.com"));

        assertTrue(found.isPresent());
        assertEquals("Beta", found.get().getTitle());
        assertTrue(repository.searchOne(Filter.where("email", "nobody@x.com")).isEmpty());
    }

    @Test
    public void searchManyShouldReturnAllMatchesOrEmpty() {
        repository.create(new Note("A", "open"));
        repository.create(new Note("B", "open"));
        repository.create(new Note("C", "closed"));

        Optional<List<Note>> open = repository.searchMany(Filter.where("status", "open"));

        assertTrue(open.isPresent());
        assertEquals(2, open.get().size());
        assertTrue(repository.searchMany(Filter.where("status", "archived")).isEmpty());
    }

    @Test
    public void searchShouldMatchOnAConjunctionOfFields() {
        repository.create(new Note("Same", "open"));
        repository.create(new Note("Same", "closed"));

        Optional<List<Note>> found = repository.searchMany(Filter.where("title", "Same").and("status", "closed"));

        assertTrue(found.isPresent());
        assertEquals(1, found.get().size());
        assertEquals("closed", found.get().get(0).getStatus());
    }

    @Test
    public void filterOnIdShouldMatchTheStoredIdentity() {
        Note created = repository.create(new Note("By Id", "open"));
        repository.create(new Note("Other", "open"));

        Optional<Note> found = repository.searchOne(Filter.where("id", created.getId()));

        assertTrue(found.isPresent());
        assertEquals("By Id", found.get().getTitle());
    }

    @Test
    public void countShouldMatchTheFilter() {
        repository.create(new Note("A", "open"));
        repository.create(new Note("B", "open"));
        repository.create(new Note("C", "closed"));

        assertEquals(3, repository.count(Filter.empty()));
        assertEquals(2, repository.count(Filter.where("status", "open")));
        assertEquals(0, repository.count(Filter.where("status", "archived")));
    }
}
