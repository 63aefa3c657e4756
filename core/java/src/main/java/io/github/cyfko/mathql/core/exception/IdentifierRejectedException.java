package io.github.cyfko.mathql.core.exception;

/**
 * Exception raised when an expression references an identifier that is neither a bound
 * variable nor part of the allow-list.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.mathql.core.parsing.IdentifierGuard
 */
public class IdentifierRejectedException extends RuntimeException {

    private final String identifier;

    public IdentifierRejectedException(String identifier) {
        super("Identifier '" + identifier + "' is not allowed in math expressions");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
