package win.ixuni.strata.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.strata.core.support.Author;
import win.ixuni.strata.core.support.Book;

import static org.junit.jupiter.api.Assertions.*;

class EntityTypeTest {

    @Test
    @DisplayName("Collection name defaults to the class name")
    void collectionName() {
        assertEquals("Author", Author.TYPE.getCollectionName());
        assertEquals("books", Book.TYPE.getCollectionName());
    }

    @Test
    @DisplayName("Defaults fill only missing fields")
    void applyDefaults() {
        Book missing = new Book("b1", "Dune", "Herbert");
        Book present = new Book("b2", "Emma", "Austen");
        present.setEdition("v1");

        assertEquals(1, Book.TYPE.applyDefaults(missing));
        assertEquals(0, Book.TYPE.applyDefaults(present));
        assertEquals("v2", missing.getEdition());
        assertEquals("v1", present.getEdition());
    }

    @Test
    @DisplayName("Descriptors of the same class and name are equal")
    void equality() {
        assertEquals(EntityType.of(Author.class), Author.TYPE);
        assertNotEquals(EntityType.builder(Author.class).collectionName("writers").build(), Author.TYPE);
    }
}
