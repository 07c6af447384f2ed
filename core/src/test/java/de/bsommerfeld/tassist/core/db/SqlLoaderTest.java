package de.bsommerfeld.tassist.core.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    @Test
    void load_shouldReturnTrimmedTemplate() {
        assertEquals("INSERT INTO %s DEFAULT VALUES", SqlLoader.load("insert-default-row"));
    }

    @Test
    void load_shouldCacheTemplates() {
        assertSame(SqlLoader.load("delete-row"), SqlLoader.load("delete-row"));
    }

    @Test
    void format_shouldFillIdentifiers() {
        assertEquals("UPDATE trainer SET name = ? WHERE id = ?",
                SqlLoader.format("update-field", "trainer", "name"));
    }

    @Test
    void load_shouldFailForMissingResource() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("does-not-exist"));
    }
}
