package com.nexus.resolution.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PaginationTest {

    @Nested
    @DisplayName("PageRequest")
    class PageRequestTests {

        @Test
        @DisplayName("Should create page request from page and size")
        void testOf() {
            PageRequest request = PageRequest.of(2, 10);
            assertEquals(20, request.offset());
            assertEquals(10, request.limit());
            assertEquals(2, request.pageNumber());
        }

        @Test
        @DisplayName("Should create first page request")
        void testFirst() {
            PageRequest request = PageRequest.first(25);
            assertEquals(0, request.offset());
            assertEquals(0, request.pageNumber());
        }

        @Test
        @DisplayName("Should reject invalid requests")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(-1, 10));
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 0));
            assertThrows(IllegalArgumentException.class, () -> new PageRequest(0, 10_001));
            assertThrows(IllegalArgumentException.class, () -> PageRequest.of(-1, 10));
        }
    }

    @Nested
    @DisplayName("Page")
    class PageTests {

        private final List<String> items = List.of("a", "b", "c", "d", "e");

        @Test
        @DisplayName("Should slice the middle page")
        void testMiddlePage() {
            Page<String> page = Page.of(items, PageRequest.of(1, 2));

            assertEquals(List.of("c", "d"), page.content());
            assertEquals(5, page.totalElements());
            assertEquals(3, page.totalPages());
            assertTrue(page.hasNext());
        }

        @Test
        @DisplayName("Last page is partial and has no next")
        void testLastPage() {
            Page<String> page = Page.of(items, PageRequest.of(2, 2));

            assertEquals(List.of("e"), page.content());
            assertFalse(page.hasNext());
        }

        @Test
        @DisplayName("Offsets past the end give an empty page")
        void testPastEnd() {
            Page<String> page = Page.of(items, PageRequest.of(10, 2));

            assertTrue(page.content().isEmpty());
            assertEquals(5, page.totalElements());
            assertFalse(page.hasNext());
        }

        @Test
        @DisplayName("Empty page")
        void testEmpty() {
            Page<String> page = Page.empty(PageRequest.first(20));

            assertTrue(page.content().isEmpty());
            assertEquals(0, page.totalPages());
            assertFalse(page.hasNext());
        }
    }
}
