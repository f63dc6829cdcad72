package co.fanki.markupgraph.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link SelectorIndex} and {@link ScriptContentStore}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SelectorIndexTest {

    @Test
    void whenRegistering_givenSameKeyTwice_shouldKeepLastWrite() {
        final SelectorIndex index = new SelectorIndex();

        index.register(".card", 3);
        index.register(".card", 7);

        assertEquals(7, index.resolve(".card"));
        assertEquals(1, index.size());
    }

    @Test
    void whenResolving_givenUnknownKey_shouldReturnNull() {
        final SelectorIndex index = new SelectorIndex();
        index.register("div", 1);

        assertNull(index.resolve("span"));
        assertFalse(index.contains("span"));
        assertTrue(index.contains("div"));
    }

    @Test
    void whenListingEntries_givenSeveralKeys_shouldKeepRegistrationOrder() {
        final SelectorIndex index = new SelectorIndex();
        index.register("div", 1);
        index.register("#app", 1);
        index.register(".t", 2);

        assertEquals(List.of("div", "#app", ".t"),
                List.copyOf(index.entries().keySet()));
    }

    @Test
    void whenRegistering_givenBlankKey_shouldThrowException() {
        final SelectorIndex index = new SelectorIndex();

        assertThrows(IllegalArgumentException.class,
                () -> index.register(" ", 1));
    }

    @Test
    void whenStoringScript_givenText_shouldReturnItById() {
        final ScriptContentStore store = new ScriptContentStore();
        store.put(4, "var x = 1;");

        assertEquals("var x = 1;", store.get(4));
        assertNull(store.get(5));
        assertEquals(1, store.asMap().size());
    }
}
