package com.docrepo.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageTest {

    @Test
    void totalPagesShouldBeTheCeilingOfCountOverSize() {
        assertEquals(2, Page.totalPages(10, 5));
        assertEquals(3, Page.totalPages(11, 5));
        assertEquals(1, Page.totalPages(5, 5));
        assertEquals(1, Page.totalPages(3, 5));
    }

    @Test
    void totalPagesShouldBeZeroWithoutRecords() {
        assertEquals(0, Page.totalPages(0, 5));
    }

    @Test
    void totalPagesShouldRejectANonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> Page.totalPages(10, 0));
    }

    @Test
    void ofShouldCarryTheListing() {
        Page<String> page = Page.of(new Listing<>(7, List.of("f", "g")), 2, 5);

        assertEquals(new Page<>(7, 2, 2, 5, List.of("f", "g")), page);
    }
}
