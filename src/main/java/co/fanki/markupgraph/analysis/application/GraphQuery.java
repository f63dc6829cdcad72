package co.fanki.markupgraph.analysis.application;

import co.fanki.markupgraph.shared.DomainException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed graph query with a built-in lexer.
 *
 * <p>Query syntax: {@code target[:navigation]*[:+include]*[:?check]}</p>
 *
 * <p>Token types:</p>
 * <ul>
 *   <li>{@code NAVIGATE}: plain segment, traverses the graph</li>
 *   <li>{@code INCLUDE}: prefixed with {@code +}, adds a projection to
 *       the result</li>
 *   <li>{@code CHECK}: prefixed with {@code ?}, performs an existence
 *       check</li>
 * </ul>
 *
 * <p>The first segment is always a navigation target: a node kind
 * keyword such as {@code functions} or {@code elements}, or a node
 * id.</p>
 *
 * <p>Examples:</p>
 * <ul>
 *   <li>{@code functions}</li>
 *   <li>{@code functions:+content}</li>
 *   <li>{@code 0:children}</li>
 *   <li>{@code 3:styles:+edges}</li>
 *   <li>{@code 5:targets}</li>
 *   <li>{@code 7:code}</li>
 *   <li>{@code 7:?function}</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphQuery {

    /** Error code of every query rejected by the lexer. */
    public static final String INVALID_QUERY = "INVALID_QUERY";

    /** Token types produced by the lexer. */
    public enum TokenType {
        /** Navigation segment. */
        NAVIGATE,
        /** Include modifier, prefixed with {@code +}. */
        INCLUDE,
        /** Existence check, prefixed with {@code ?}. */
        CHECK
    }

    /** A single token from the query lexer. */
    public record Token(TokenType type, String value) {

        @Override
        public String toString() {
            return switch (type) {
                case NAVIGATE -> value;
                case INCLUDE -> "+" + value;
                case CHECK -> "?" + value;
            };
        }
    }

    private final String raw;
    private final List<Token> tokens;

    private GraphQuery(final String theRaw, final List<Token> theTokens) {
        this.raw = theRaw;
        this.tokens = Collections.unmodifiableList(theTokens);
    }

    // -- Lexer ---------------------------------------------------------------

    /**
     * Parses a colon-separated query string into a GraphQuery.
     *
     * @param query the raw query string
     * @return the parsed GraphQuery
     * @throws DomainException if the query is invalid
     */
    public static GraphQuery parse(final String query) {
        if (query == null || query.isBlank()) {
            throw new DomainException("Query is required", INVALID_QUERY);
        }

        final String trimmed = query.trim();
        final String[] parts = trimmed.split(":");
        final List<Token> tokens = new ArrayList<>();

        for (final String part : parts) {
            final String segment = part.trim();
            if (segment.isEmpty()) {
                continue;
            }

            final char first = segment.charAt(0);

            if (first == '+') {
                tokens.add(new Token(TokenType.INCLUDE,
                        modifierValue(segment, "Include modifier (+)")));
            } else if (first == '?') {
                tokens.add(new Token(TokenType.CHECK,
                        modifierValue(segment, "Check (?)")));
            } else {
                tokens.add(new Token(TokenType.NAVIGATE, segment));
            }
        }

        if (tokens.isEmpty()) {
            throw new DomainException(
                    "Query must have a target. Got: " + trimmed,
                    INVALID_QUERY);
        }

        if (tokens.get(0).type() != TokenType.NAVIGATE) {
            throw new DomainException(
                    "First segment must be a navigation target, not a"
                            + " modifier. Got: " + tokens.get(0),
                    INVALID_QUERY);
        }

        return new GraphQuery(trimmed, tokens);
    }

    private static String modifierValue(final String segment,
            final String description) {
        final String value = segment.substring(1).trim();
        if (value.isEmpty()) {
            throw new DomainException(description + " requires a value",
                    INVALID_QUERY);
        }
        return value;
    }

    // -- Accessors -----------------------------------------------------------

    /** Returns the raw query string. */
    public String raw() {
        return raw;
    }

    /** Returns the full token list (unmodifiable). */
    public List<Token> tokens() {
        return tokens;
    }

    /** Returns the value of the first NAVIGATE token. */
    public String target() {
        return tokens.get(0).value();
    }

    /**
     * Returns navigation values starting from the given index.
     *
     * @param fromIndex the starting index (inclusive) among NAVIGATE
     *                  tokens
     * @return the remaining navigation values
     */
    public List<String> navigationsFrom(final int fromIndex) {
        final List<String> result = new ArrayList<>();
        int index = 0;
        for (final Token t : tokens) {
            if (t.type() == TokenType.NAVIGATE) {
                if (index >= fromIndex) {
                    result.add(t.value());
                }
                index++;
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Checks if a specific include modifier is present
     * (case-insensitive).
     *
     * @param value the include value to check
     * @return true if the include is present
     */
    public boolean hasInclude(final String value) {
        for (final Token t : tokens) {
            if (t.type() == TokenType.INCLUDE
                    && t.value().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }

    /** Returns true if the query contains any CHECK token. */
    public boolean hasCheck() {
        return checkValue() != null;
    }

    /**
     * Returns the first CHECK value, or null.
     *
     * @return the first check value
     */
    public String checkValue() {
        for (final Token t : tokens) {
            if (t.type() == TokenType.CHECK) {
                return t.value();
            }
        }
        return null;
    }
}
