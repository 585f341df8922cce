package com.fieldops.security;

/**
 * Thrown when an audience is missing or outside the closed {@link Audience} set.
 *
 * <p>This is a configuration error: the request is rejected before any transaction opens.
 */
public class UnknownAudienceException extends RuntimeException {

    private final String audience;

    public UnknownAudienceException(String audience) {
        super("Unknown audience '%s': no database role is mapped".formatted(audience));
        this.audience = audience;
    }

    /** The offending literal, or null when no audience was supplied. */
    public String audience() {
        return audience;
    }
}
