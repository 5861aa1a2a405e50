package com.scimserver.scim.exceptions;

/**
 * Exception thrown when a SCIM filter expression cannot be tokenized or parsed.
 *
 * This typically occurs when:
 * - The filter is empty
 * - A quoted string is not terminated
 * - An unexpected character or token is found
 * - A comparison has no value
 *
 * The boundary layer reports it as a 400 with scimType {@code invalidFilter}.
 */
public class InvalidFilterException extends Exception {

    private static final long serialVersionUID = 1L;

    /** Position reported when the offending offset is unknown. */
    public static final int UNKNOWN_POSITION = -1;

    private final int position;

    /**
     * Constructs a new InvalidFilterException with the specified detail message.
     *
     * @param message the detail message
     */
    public InvalidFilterException(String message) {
        this(message, UNKNOWN_POSITION);
    }

    /**
     * Constructs a new InvalidFilterException with the specified detail message and
     * the character offset of the offending input.
     *
     * @param message the detail message
     * @param position zero-based offset in the filter string
     */
    public InvalidFilterException(String message, int position) {
        super(message);
        this.position = position;
    }

    /**
     * Constructs a new InvalidFilterException with the specified detail message and cause.
     * The position is taken from the cause when it is itself an InvalidFilterException.
     *
     * @param message the detail message
     * @param cause the cause of this exception
     */
    public InvalidFilterException(String message, Throwable cause) {
        super(message, cause);
        this.position = cause instanceof InvalidFilterException
                ? ((InvalidFilterException) cause).getPosition()
                : UNKNOWN_POSITION;
    }

    /**
     * Get the zero-based offset in the filter string where the error was detected.
     *
     * @return the offset, or {@link #UNKNOWN_POSITION}
     */
    public int getPosition() {
        return position;
    }
}
