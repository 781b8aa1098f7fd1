package com.docrepo.repos.certification;

import com.docrepo.core.BaseService;
import com.docrepo.core.Filter;
import com.docrepo.core.Page;
import com.docrepo.core.Repository;
import com.docrepo.core.errors.BadRequestException;
import com.docrepo.core.errors.ErrorKind;
import com.docrepo.core.errors.NotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Service behaviour on top of a real repository, with {@code email} declared
 * unique. Subclasses provide an empty repository and a mapper for its types.
 */
public abstract class ServiceCertification {
    protected Repository<Note, String> repository;
    protected ObjectMapper mapper;
    protected BaseService<NoteInput, NoteView, Note, String> service;

    public abstract void init();

    @BeforeEach
    public void setUp() throws Exception {
        init();
        service = new BaseService<>(repository, Note.class, NoteView.class, List.of("email"), mapper);
    }

    @Test
    public void createShouldReturnTheStoredView() {
        NoteView created = service.create(new NoteInput("Hello", "open", "a@x.com"));

        assertNotNull(created.getId());
        assertNotNull(created.getCreatedAt());
        assertEquals("Hello", created.getTitle());
        assertEquals("a@x.com", created.getEmail());
    }

    @Test
    public void createShouldRejectADuplicateUniqueValue() {
        service.create(new NoteInput("First", "open", "a@x.com"));

        BadRequestException error = assertThrows(BadRequestException.class,
                () -> service.create(new NoteInput("Second", "open", "a@x.com")));

        assertEquals(400, error.status());
        assertEquals(1, service.count(Filter.where("email", "a@x.com")));
    }

    @Test
    public void createShouldSkipTheUniquenessCheckWhenTheUniqueFieldIsUnset() {
        service.create(new NoteInput("First", "open", null));
        service.create(new NoteInput("Second", "open", null));

        assertEquals(2, service.count(Filter.empty()));
    }

    @Test
    public void updateShouldRejectAUniqueValueHeldByAnotherRecord() {
        service.create(new NoteInput("First", "open", "a@x.com"));
        NoteView second = service.create(new NoteInput("Second", "open", "b@x.com"));

        assertThrows(BadRequestException.class,
                () -> service.update(second.getId(), new NoteInput(null, null, "a@x.com")));
        assertEquals("b@x.com", service.get(second.getId()).getEmail());
    }

    @Test
    public void updateShouldAcceptTheUniqueValueTheRecordAlreadyHolds() {
        NoteView first = service.create(new NoteInput("First", "open", "a@x.com"));

        NoteView updated = service.update(first.getId(), new NoteInput("Renamed", null, "a@x.com"));

        assertEquals("Renamed", updated.getTitle());
        assertEquals("a@x.com", updated.getEmail());
    }

    @Test
    public void updateShouldOnlyOverrideTheFieldsThatAreSet() {
        NoteView created = service.create(new NoteInput("Title", "open", "a@x.com"));

        NoteView updated = service.update(created.getId(), new NoteInput(null, "closed", null));

        assertEquals("Title", updated.getTitle());
        assertEquals("closed", updated.getStatus());
        assertEquals("a@x.com", updated.getEmail());
        assertEquals(created.getCreatedAt(), updated.getCreatedAt());
        assertNotNull(updated.getUpdatedAt());
    }

    @Test
    public void updateShouldFailWithNotFoundForAnUnknownId() {
        NotFoundException error = assertThrows(NotFoundException.class,
                () -> service.update(UUID.randomUUID().toString(), new NoteInput("x", null, null)));

        assertEquals(ErrorKind.NOT_FOUND, error.kind());
    }

    @Test
    public void getShouldFailWithNotFoundWhereTheRepositoryReturnsEmpty() {
        String id = UUID.randomUUID().toString();

        assertTrue(repository.get(id).isEmpty());
        assertThrows(NotFoundException.class, () -> service.get(id));
    }

    @Test
    public void deleteShouldFailWithNotFoundTheSecondTime() {
        NoteView created = service.create(new NoteInput("Gone", "open", null));

        service.delete(created.getId());

        assertThrows(NotFoundException.class, () -> service.delete(created.getId()));
        assertThrows(NotFoundException.class, () -> service.get(created.getId()));
    }

    @Test
    public void searchShouldFailWithNotFoundWhenNothingMatches() {
        service.create(new NoteInput("A", "open", null));

        assertEquals("A", service.searchOne(Filter.where("status", "open")).getTitle());
        assertEquals(1, service.searchMany(Filter.where("status", "open")).size());
        assertThrows(NotFoundException.class, () -> service.searchOne(Filter.where("status", "closed")));
        assertThrows(NotFoundException.class, () -> service.searchMany(Filter.where("status", "closed")));
    }

    @Test
    public void paginateShouldReportPagesOfTheFilteredRecords() {
        for (int i = 0; i < 5; i++) {
            service.create(new NoteInput("open" + i, "open", null));
        }
        service.create(new NoteInput("closed", "closed", null));

        Page<NoteView> page = service.paginate(2, 1, Filter.where("status", "open"));

        assertEquals(5, page.totalCount());
        assertEquals(3, page.totalPages());
        assertEquals(1, page.page());
        assertEquals(2, page.size());
        assertEquals(2, page.data().size());
    }

    @Test
    public void listShouldRejectNonPositivePaging() {
        assertThrows(BadRequestException.class, () -> service.list(0, 1, Filter.empty()));
        assertThrows(BadRequestException.class, () -> service.list(2, 0, Filter.empty()));
    }
}
