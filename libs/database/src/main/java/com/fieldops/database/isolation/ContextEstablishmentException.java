package com.fieldops.database.isolation;

import com.fieldops.security.Audience;

/**
 * Thrown when the store rejects the role switch or a session variable assignment.
 *
 * <p>The transaction has been rolled back and the unit of work was never invoked. Callers must
 * surface this as an internal error; it is never retried with a broader context.
 */
public class ContextEstablishmentException extends RuntimeException {

    private final Audience audience;
    private final String roleName;

    public ContextEstablishmentException(
            Audience audience, String roleName, String step, Throwable cause) {
        super("Failed to establish %s context as role '%s' during %s"
                .formatted(audience.value(), roleName, step), cause);
        this.audience = audience;
        this.roleName = roleName;
    }

    public Audience audience() {
        return audience;
    }

    public String roleName() {
        return roleName;
    }
}
