package io.github.cyfko.mathql.core.utils;

/**
 * Result of the identifier check performed before evaluation.
 * <p>
 * The result either accepts the expression or names the first identifier that caused its
 * rejection.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #rejected(String)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = IdentifierGuard.checkIdentifiers("a + window", Set.of("a"));
 * if (!result.isValid()) {
 *     System.out.println("Rejected: " + result.getRejectedIdentifier());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(null);

    private final String rejectedIdentifier;

    private ValidationResult(String rejectedIdentifier) {
        this.rejectedIdentifier = rejectedIdentifier;
    }

    /**
     * @return a valid result
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * Creates a result rejecting the given identifier.
     *
     * @param identifier the offending identifier
     * @return an invalid result naming {@code identifier}
     * @throws IllegalArgumentException if {@code identifier} is null
     */
    public static ValidationResult rejected(String identifier) {
        if (identifier == null) {
            throw new IllegalArgumentException("Rejected identifier is required");
        }
        return new ValidationResult(identifier);
    }

    public boolean isValid() {
        return rejectedIdentifier == null;
    }

    /**
     * @return the rejected identifier, or null if valid
     */
    public String getRejectedIdentifier() {
        return rejectedIdentifier;
    }

    /**
     * @return a message explaining the rejection, or null if valid
     */
    public String getErrorMessage() {
        return isValid() ? null : "Identifier '" + rejectedIdentifier + "' is not allowed";
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, rejected=" + rejectedIdentifier + "]";
    }
}
