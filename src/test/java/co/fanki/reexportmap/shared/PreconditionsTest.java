package co.fanki.reexportmap.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequiringNonNull_givenNull_shouldThrowWithMessage() {
        final IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Root is required"));

        assertEquals("Root is required", e.getMessage());
    }

    @Test
    void whenRequiringNonBlank_givenWhitespace_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "Name is required"));
    }

    @Test
    void whenRequiringNonBlank_givenValue_shouldReturnIt() {
        assertEquals("langchain",
                Preconditions.requireNonBlank("langchain", "unused"));
    }

    @Test
    void whenRequiringPositive_givenZero_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Must be positive"));
    }

    @Test
    void whenDefaultingIfBlank_givenBlankOrNull_shouldReturnFallback() {
        assertEquals("langchain",
                Preconditions.defaultIfBlank("", "langchain"));
        assertEquals("langchain",
                Preconditions.defaultIfBlank(null, "langchain"));
        assertEquals("langchain-core",
                Preconditions.defaultIfBlank("langchain-core", "langchain"));
    }

}
