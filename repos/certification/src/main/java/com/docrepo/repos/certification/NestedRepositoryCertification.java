package com.docrepo.repos.certification;

import com.docrepo.core.Filter;
import com.docrepo.core.NestedRepository;
import com.docrepo.core.NestedValue;
import com.docrepo.core.Repository;
import com.docrepo.core.SortKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract for the embedded-array operations. {@link #repository} and
 * {@link #nested} must address the same collection.
 */
public abstract class NestedRepositoryCertification {
    protected Repository<Note, String> repository;
    protected NestedRepository<String> nested;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
    }

    private Note parent() {
        return repository.create(new Note("Parent", "open"));
    }

    private Comment comment(String parentId, String text, int votes) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("text", text);
        data.put("author", "tester");
        data.put("votes", votes);
        return nested.nestedCreate(parentId, "comments", NestedValue.of(data), Comment.class).orElseThrow();
    }

    // ==================== nestedCreate ====================

    @Test
    public void nestedCreateShouldAppendARecordAndStampItsIdentity() {
        Note parent = parent();

        Comment created = comment(parent.getId(), "first", 1);

        assertNotNull(created.getId());
        assertNotNull(created.getCreatedAt());
        assertEquals("first", created.getText());

        Note stored = repository.get(parent.getId()).orElseThrow();
        assertEquals(1, stored.getComments().size());
        assertEquals(created.getId(), stored.getComments().get(0).getId());
    }

    @Test
    public void nestedCreateShouldKeepASuppliedElementId() {
        Note parent = parent();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("id", "comment-1");
        data.put("text", "with id");

        Optional<Comment> created = nested.nestedCreate(parent.getId(), "comments", NestedValue.of(data), Comment.class);

        assertTrue(created.isPresent());
        assertEquals("comment-1", created.get().getId());
        assertTrue(nested.nestedGet(parent.getId(), "comment-1", null, "comments", Comment.class).isPresent());
    }

    @Test
    public void nestedCreateShouldReturnEmptyWhenTheParentIsMissing() {
        Optional<Comment> created = nested.nestedCreate(UUID.randomUUID().toString(), "comments",
                NestedValue.of(Map.of("text", "orphan")), Comment.class);

        assertTrue(created.isEmpty());
    }

    @Test
    public void nestedCreateShouldAppendScalars() {
        Note parent = parent();

        Optional<String> tag = nested.nestedCreate(parent.getId(), "tags", NestedValue.scalar("urgent"), String.class);
        nested.nestedCreate(parent.getId(), "tags", NestedValue.scalar("home"), String.class);

        assertEquals(Optional.of("urgent"), tag);
        assertEquals(List.of("urgent", "home"), nested.nestedList(parent.getId(), "tags", String.class, null, null));
    }

    @Test
    public void nestedCreateShouldStoreABigIntegerInLongRange() {
        Note parent = parent();

        Optional<Long> created = nested.nestedCreate(parent.getId(), "tags",
                NestedValue.of(BigInteger.valueOf(5)), Long.class);

        assertEquals(Optional.of(5L), created);
        assertEquals(List.of(5L), nested.nestedList(parent.getId(), "tags", Long.class, null, null));
    }

    // ==================== nestedList / nestedCount ====================

    @Test
    public void nestedListShouldReturnElementsInArrayOrder() {
        Note parent = parent();
        comment(parent.getId(), "a", 1);
        comment(parent.getId(), "b", 2);
        comment(parent.getId(), "c", 3);

        List<Comment> comments = nested.nestedList(parent.getId(), "comments", Comment.class, null, null);

        assertEquals(List.of("a", "b", "c"), comments.stream().map(Comment::getText).collect(Collectors.toList()));
    }

    @Test
    public void nestedListShouldSortAndLimit() {
        Note parent = parent();
        comment(parent.getId(), "three", 3);
        comment(parent.getId(), "one", 1);
        comment(parent.getId(), "two", 2);

        List<Comment> top = nested.nestedList(parent.getId(), "comments", Comment.class,
                List.of(SortKey.desc("votes")), 2);

        assertEquals(List.of("three", "two"), top.stream().map(Comment::getText).collect(Collectors.toList()));
    }

    @Test
    public void nestedListShouldBeEmptyForAMissingParentOrAnEmptyArray() {
        Note parent = parent();

        assertTrue(nested.nestedList(parent.getId(), "comments", Comment.class, null, null).isEmpty());
        assertTrue(nested.nestedList(UUID.randomUUID().toString(), "comments", Comment.class, null, null).isEmpty());
    }

    @Test
    public void nestedCountShouldCountElementsOfOneParentOnly() {
        Note parent = parent();
        Note other = parent();
        comment(parent.getId(), "a", 1);
        comment(parent.getId(), "b", 1);
        comment(other.getId(), "c", 1);

        assertEquals(2, nested.nestedCount(parent.getId(), "comments"));
        assertEquals(1, nested.nestedCount(other.getId(), "comments"));
        assertEquals(0, nested.nestedCount(UUID.randomUUID().toString(), "comments"));
        assertEquals(0, nested.nestedCount(parent.getId(), "tags"));
    }

    // ==================== nestedGet ====================

    @Test
    public void nestedGetShouldReturnTheMatchingElement() {
        Note parent = parent();
        comment(parent.getId(), "a", 1);
        Comment target = comment(parent.getId(), "b", 2);
        comment(parent.getId(), "c", 3);

        Optional<Comment> found = nested.nestedGet(parent.getId(), target.getId(), null, "comments", Comment.class);

        assertTrue(found.isPresent());
        assertEquals(target, found.get());
    }

    @Test
    public void nestedGetShouldReturnEmptyForAnUnknownElementOrParent() {
        Note parent = parent();
        Comment target = comment(parent.getId(), "a", 1);

        assertTrue(nested.nestedGet(parent.getId(), "missing", null, "comments", Comment.class).isEmpty());
        assertTrue(nested.nestedGet(UUID.randomUUID().toString(), target.getId(), null, "comments", Comment.class).isEmpty());
    }

    @Test
    public void nestedGetShouldApplyTheParentFilter() {
        Note parent = parent();
        Comment target = comment(parent.getId(), "a", 1);

        assertTrue(nested.nestedGet(parent.getId(), target.getId(), Filter.where("status", "open"),
                "comments", Comment.class).isPresent());
        assertTrue(nested.nestedGet(parent.getId(), target.getId(), Filter.where("status", "closed"),
                "comments", Comment.class).isEmpty());
    }

    @Test
    public void nestedGetWithoutAnElementIdShouldReturnTheFirstElement() {
        Note parent = parent();
        Comment first = comment(parent.getId(), "a", 1);
        comment(parent.getId(), "b", 2);

        Optional<Comment> found = nested.nestedGet(parent.getId(), null, null, "comments", Comment.class);

        assertTrue(found.isPresent());
        assertEquals(first.getId(), found.get().getId());
    }

    // ==================== nestedUpdate ====================

    @Test
    public void nestedUpdateShouldOnlyTouchTheTargetElement() {
        Note parent = parent();
        Comment a = comment(parent.getId(), "a", 1);
        Comment b = comment(parent.getId(), "b", 2);
        Comment c = comment(parent.getId(), "c", 3);
        List<Comment> before = repository.get(parent.getId()).orElseThrow().getComments();

        Optional<Comment> updated = nested.nestedUpdate(parent.getId(), b.getId(), "comments",
                Map.of("text", "b edited"), Comment.class, null, false);

        assertTrue(updated.isPresent());
        assertEquals("b edited", updated.get().getText());
        assertEquals(b.getId(), updated.get().getId());
        assertEquals(2, updated.get().getVotes());
        assertEquals(b.getCreatedAt(), updated.get().getCreatedAt());
        assertNotNull(updated.get().getUpdatedAt());

        List<Comment> after = repository.get(parent.getId()).orElseThrow().getComments();
        assertEquals(3, after.size());
        assertEquals(before.get(0), after.get(0));
        assertEquals(before.get(2), after.get(2));
        assertEquals(a, after.get(0));
        assertEquals(c, after.get(2));
        assertEquals(updated.get(), after.get(1));
    }

    @Test
    public void nestedUpdateShouldNotRewriteTheElementIdentity() {
        Note parent = parent();
        Comment target = comment(parent.getId(), "a", 1);

        Optional<Comment> updated = nested.nestedUpdate(parent.getId(), target.getId(), "comments",
                Map.of("id", "hijacked", "votes", 5), Comment.class, null, false);

        assertTrue(updated.isPresent());
        assertEquals(target.getId(), updated.get().getId());
        assertEquals(5, updated.get().getVotes());
    }

    @Test
    public void nestedUpdateShouldReturnEmptyWhenNothingMatches() {
        Note parent = parent();
        Comment target = comment(parent.getId(), "a", 1);

        assertTrue(nested.nestedUpdate(parent.getId(), "missing", "comments",
                Map.of("text", "x"), Comment.class, null, false).isEmpty());
        assertTrue(nested.nestedUpdate(parent.getId(), target.getId(), "comments",
                Map.of("text", "x"), Comment.class, Filter.where("status", "closed"), false).isEmpty());
        assertEquals("a", nested.nestedGet(parent.getId(), target.getId(), null, "comments", Comment.class)
                .orElseThrow().getText());
    }

    @Test
    public void nestedUpdateWithUpsertShouldAppendAMissingElement() {
        Note parent = parent();
        Comment existing = comment(parent.getId(), "a", 1);

        Optional<Comment> upserted = nested.nestedUpdate(parent.getId(), "new-element", "comments",
                Map.of("text", "x", "votes", 4), Comment.class, null, true);

        assertTrue(upserted.isPresent());
        assertEquals("new-element", upserted.get().getId());
        assertEquals("x", upserted.get().getText());
        assertEquals(4, upserted.get().getVotes());
        assertNotNull(upserted.get().getCreatedAt());

        List<Comment> comments = nested.nestedList(parent.getId(), "comments", Comment.class, null, null);
        assertEquals(2, comments.size());
        assertEquals(existing, comments.get(0));
        assertEquals(upserted.get(), comments.get(1));
    }

    @Test
    public void nestedUpdateWithUpsertShouldUpdateAnExistingElementInPlace() {
        Note parent = parent();
        Comment target = comment(parent.getId(), "a", 1);

        Optional<Comment> updated = nested.nestedUpdate(parent.getId(), target.getId(), "comments",
                Map.of("text", "a edited"), Comment.class, null, true);

        assertTrue(updated.isPresent());
        assertEquals("a edited", updated.get().getText());
        assertEquals(1, nested.nestedCount(parent.getId(), "comments"));
    }

    @Test
    public void nestedUpdateWithUpsertShouldNotCreateAMissingOrFilteredOutParent() {
        Note parent = parent();
        String missingParent = UUID.randomUUID().toString();

        assertTrue(nested.nestedUpdate(missingParent, "new-element", "comments",
                Map.of("text", "x"), Comment.class, null, true).isEmpty());
        assertTrue(repository.get(missingParent).isEmpty());
        assertTrue(nested.nestedUpdate(parent.getId(), "new-element", "comments",
                Map.of("text", "x"), Comment.class, Filter.where("status", "closed"), true).isEmpty());
        assertEquals(0, nested.nestedCount(parent.getId(), "comments"));
    }

    @Test
    public void nestedUpdateShouldRequireAnElementId() {
        Note parent = parent();

        assertThrows(NullPointerException.class, () -> nested.nestedUpdate(parent.getId(), null, "comments",
                Map.of("text", "x"), Comment.class, null, false));
    }

    // ==================== nestedRemove ====================

    @Test
    public void nestedRemoveShouldPullTheElementOnce() {
        Note parent = parent();
        Comment keep = comment(parent.getId(), "keep", 1);
        Comment drop = comment(parent.getId(), "drop", 2);

        assertTrue(nested.nestedRemove(parent.getId(), drop.getId(), null, "comments"));
        assertFalse(nested.nestedRemove(parent.getId(), drop.getId(), null, "comments"));

        List<Comment> remaining = nested.nestedList(parent.getId(), "comments", Comment.class, null, null);
        assertEquals(List.of(keep), remaining);
    }

    @Test
    public void nestedRemoveShouldRequireAnElementId() {
        Note parent = parent();
        comment(parent.getId(), "a", 1);

        assertThrows(NullPointerException.class, () -> nested.nestedRemove(parent.getId(), null, null, "comments"));
        assertEquals(1, nested.nestedCount(parent.getId(), "comments"));
    }

    @Test
    public void nestedRemoveShouldApplyTheParentFilter() {
        Note parent = parent();
        Comment target = comment(parent.getId(), "a", 1);

        assertFalse(nested.nestedRemove(parent.getId(), target.getId(), Filter.where("status", "closed"), "comments"));
        assertEquals(1, nested.nestedCount(parent.getId(), "comments"));
    }
}
