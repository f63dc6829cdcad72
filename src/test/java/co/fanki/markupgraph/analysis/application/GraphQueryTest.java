package co.fanki.markupgraph.analysis.application;

import co.fanki.markupgraph.shared.DomainException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for the {@link GraphQuery} lexer.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphQueryTest {

    // -- Basic parsing -------------------------------------------------------

    @Test
    void whenParsing_givenKeyword_shouldTokenizeTarget() {
        final GraphQuery query = GraphQuery.parse("functions");

        assertEquals("functions", query.target());
        assertEquals(1, query.tokens().size());
        assertEquals(GraphQuery.TokenType.NAVIGATE,
                query.tokens().get(0).type());
    }

    @Test
    void whenParsing_givenNodeWithNavigation_shouldCaptureAll() {
        final GraphQuery query = GraphQuery.parse(" 12:children ");

        assertEquals("12:children", query.raw());
        assertEquals(List.of("12", "children"), query.navigationsFrom(0));
        assertEquals(List.of("children"), query.navigationsFrom(1));
        assertTrue(query.navigationsFrom(2).isEmpty());
    }

    // -- Include tokens (+) --------------------------------------------------

    @Test
    void whenParsing_givenIncludes_shouldRecognizeCaseInsensitively() {
        final GraphQuery query =
                GraphQuery.parse("elements:+Content:+edges");

        assertEquals(List.of(), query.navigationsFrom(1));
        assertTrue(query.hasInclude("content"));
        assertTrue(query.hasInclude("EDGES"));
        assertFalse(query.hasInclude("logic"));
    }

    @Test
    void whenParsing_givenEmptyInclude_shouldThrow() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> GraphQuery.parse("elements:+"));

        assertEquals(GraphQuery.INVALID_QUERY, ex.getErrorCode());
    }

    // -- Check tokens (?) ----------------------------------------------------

    @Test
    void whenParsing_givenCheck_shouldExposeValue() {
        final GraphQuery query = GraphQuery.parse("7:?function");

        assertTrue(query.hasCheck());
        assertEquals("function", query.checkValue());
        assertEquals("?function", query.tokens().get(1).toString());
    }

    @Test
    void whenParsing_givenNoCheck_shouldReturnNull() {
        final GraphQuery query = GraphQuery.parse("7:children");

        assertFalse(query.hasCheck());
        assertNull(query.checkValue());
    }

    // -- Errors --------------------------------------------------------------

    @Test
    void whenParsing_givenBlankQuery_shouldThrow() {
        assertThrows(DomainException.class, () -> GraphQuery.parse(null));
        assertThrows(DomainException.class, () -> GraphQuery.parse("  "));
        assertThrows(DomainException.class, () -> GraphQuery.parse(":::"));
    }

    @Test
    void whenParsing_givenModifierFirst_shouldThrow() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> GraphQuery.parse("+content:functions"));

        assertEquals(GraphQuery.INVALID_QUERY, ex.getErrorCode());
        assertThrows(DomainException.class,
                () -> GraphQuery.parse("?function"));
    }
}
