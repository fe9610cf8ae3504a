package com.largomodo.gangsheet.core;

/**
 * Base class for request-scoped layout failures.
 * <p>
 * Unchecked, so packing code fails fast without catch blocks along the call chain.
 * Packing is deterministic, so none of these failures are retried: the same input
 * reproduces the same failure.
 * <p>
 * The {@link Category} tells the caller whether the request itself was at fault
 * (reject with a client error) or an internal invariant broke (server error).
 */
public abstract class GangSheetException extends RuntimeException {

    /**
     * Failure classification used by callers to choose a response or exit code.
     */
    public enum Category {
        /** Caller-supplied input or geometry cannot be laid out. */
        VALIDATION,
        /** Internal invariant violation; indicates a bug. */
        INTERNAL
    }

    private final Category category;

    protected GangSheetException(Category category, String message) {
        super(message);
        this.category = category;
    }

    protected GangSheetException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isValidationFailure() {
        return category == Category.VALIDATION;
    }
}
