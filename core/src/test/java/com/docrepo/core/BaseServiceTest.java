package com.docrepo.core;

import com.docrepo.core.errors.BadRequestException;
import com.docrepo.core.errors.NotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BaseServiceTest {

    @Mock
    private Repository<Account, String> repository;

    private BaseService<Account.Input, Account.View, Account, String> service;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        service = new BaseService<>(repository, Account.class, Account.View.class, List.of("email"), mapper);
    }

    // ==================== create tests ====================

    @Test
    void create_shouldRejectDuplicateUniqueValues() {
        when(repository.searchOne(Filter.where("email", "a@x.com")))
                .thenReturn(Optional.of(new Account("1", "Existing", "a@x.com")));

        assertThrows(BadRequestException.class, () -> service.create(new Account.Input("New", "a@x.com")));
        verify(repository, never()).create(any());
    }

    @Test
    void create_shouldPassAnEntityWithoutIdentityOrTimestamps() {
        when(repository.searchOne(any())).thenReturn(Optional.empty());
        when(repository.create(any())).thenAnswer(invocation -> {
            Account account = invocation.getArgument(0);
            Account stored = new Account("generated", account.getName(), account.getEmail());
            return stored;
        });

        Account.View created = service.create(new Account.Input("New", "a@x.com"));

        ArgumentCaptor<Account> captor = ArgumentCaptor.forClass(Account.class);
        verify(repository).create(captor.capture());
        assertNull(captor.getValue().getId());
        assertNull(captor.getValue().getCreatedAt());
        assertNull(captor.getValue().getUpdatedAt());
        assertEquals("generated", created.getId());
        assertEquals("New", created.getName());
    }

    @Test
    void create_shouldSkipTheUniquenessCheckWhenNoUniqueValueIsSet() {
        when(repository.create(any())).thenReturn(new Account("1", "Nameless", null));

        service.create(new Account.Input("Nameless", null));

        verify(repository, never()).searchOne(any());
    }

    // ==================== update tests ====================

    @Test
    void update_shouldMergeOnlyTheFieldsThatAreSet() {
        when(repository.get("1")).thenReturn(Optional.of(new Account("1", "Old", "a@x.com")));
        when(repository.update(eq("1"), any())).thenAnswer(invocation -> Optional.of(invocation.getArgument(1)));

        Account.View updated = service.update("1", new Account.Input("New", null));

        assertEquals("New", updated.getName());
        assertEquals("a@x.com", updated.getEmail());
        verify(repository, never()).searchMany(any());
    }

    @Test
    void update_shouldRejectAUniqueValueHeldByAnotherRecord() {
        when(repository.get("1")).thenReturn(Optional.of(new Account("1", "Mine", "a@x.com")));
        when(repository.searchMany(Filter.where("email", "b@x.com")))
                .thenReturn(Optional.of(List.of(new Account("2", "Theirs", "b@x.com"))));

        assertThrows(BadRequestException.class, () -> service.update("1", new Account.Input(null, "b@x.com")));
        verify(repository, never()).update(any(), any());
    }

    @Test
    void update_shouldAllowAUniqueValueNobodyHolds() {
        when(repository.get("1")).thenReturn(Optional.of(new Account("1", "Mine", "a@x.com")));
        when(repository.searchMany(Filter.where("email", "c@x.com"))).thenReturn(Optional.empty());
        when(repository.update(eq("1"), any())).thenAnswer(invocation -> Optional.of(invocation.getArgument(1)));

        assertEquals("c@x.com", service.update("1", new Account.Input(null, "c@x.com")).getEmail());
    }

    @Test
    void update_shouldFailWithNotFoundForAnUnknownId() {
        when(repository.get("missing")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.update("missing", new Account.Input("x", null)));
    }

    @Test
    void update_shouldFailWithNotFoundWhenTheRecordVanishesBeforeTheWrite() {
        when(repository.get("1")).thenReturn(Optional.of(new Account("1", "Mine", null)));
        when(repository.update(eq("1"), any())).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.update("1", new Account.Input("x", null)));
    }

    // ==================== read and delete tests ====================

    @Test
    void get_shouldTranslateAbsenceToNotFound() {
        when(repository.get("missing")).thenReturn(Optional.empty());

        NotFoundException error = assertThrows(NotFoundException.class, () -> service.get("missing"));
        assertEquals(404, error.status());
    }

    @Test
    void searchMany_shouldTranslateAbsenceToNotFound() {
        when(repository.searchMany(Filter.where("name", "nobody"))).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> service.searchMany(Filter.where("name", "nobody")));
    }

    @Test
    void delete_shouldFailWithNotFoundWhenNothingWasDeleted() {
        when(repository.delete("1")).thenReturn(false);

        assertThrows(NotFoundException.class, () -> service.delete("1"));
    }

    // ==================== pagination tests ====================

    @Test
    void list_shouldRejectNonPositivePaging() {
        assertThrows(BadRequestException.class, () -> service.list(0, 1, Filter.empty()));
        assertThrows(BadRequestException.class, () -> service.list(10, -1, Filter.empty()));
        verifyNoInteractions(repository);
    }

    @Test
    void paginate_shouldDeriveTotalPagesFromTheCount() {
        when(repository.list(5, 3, Filter.empty()))
                .thenReturn(new Listing<>(11, List.of(new Account("11", "Last", null))));

        Page<Account.View> page = service.paginate(5, 3, Filter.empty());

        assertEquals(11, page.totalCount());
        assertEquals(3, page.totalPages());
        assertEquals(3, page.page());
        assertEquals(5, page.size());
        assertEquals("Last", page.data().get(0).getName());
    }
}
