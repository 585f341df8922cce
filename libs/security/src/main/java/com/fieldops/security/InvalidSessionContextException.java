package com.fieldops.security;

/**
 * Thrown when authenticated claims cannot be turned into a {@link SessionContext}, for example a
 * tenant id that is not UUID-formatted, or an audience that may not handle requests.
 */
public class InvalidSessionContextException extends RuntimeException {

    public InvalidSessionContextException(String message) {
        super(message);
    }

    public InvalidSessionContextException(String message, Throwable cause) {
        super(message, cause);
    }
}
