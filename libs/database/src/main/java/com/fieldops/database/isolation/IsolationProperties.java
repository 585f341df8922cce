package com.fieldops.database.isolation;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration of the context propagator, bound from {@code fieldops.isolation.*}.
 *
 * <pre>
 * fieldops:
 *   isolation:
 *     trusted-service-enabled: false
 *     statement-timeout: 30s
 *     max-attempts: 3
 *     verify-policies-on-startup: true
 * </pre>
 *
 * @param trustedServiceEnabled whether the propagator may run {@code service} audience work.
 *     Only fixture and migration tooling turns this on.
 * @param statementTimeout optional transaction-local statement timeout, null for the store default
 * @param maxAttempts attempts for {@link ContextPropagator#inTransactionWithRetry} (1-10, default 3)
 * @param verifyPoliciesOnStartup inspect the live row policies against the catalog at start-up
 */
@ConfigurationProperties(prefix = "fieldops.isolation")
@Validated
public record IsolationProperties(
        boolean trustedServiceEnabled,
        Duration statementTimeout,
        @Min(1) @Max(10) int maxAttempts,
        boolean verifyPoliciesOnStartup) {

    /** Compact constructor: applies defaults before Bean Validation runs. */
    public IsolationProperties {
        if (maxAttempts <= 0) {
            maxAttempts = 3;
        }
        if (statementTimeout != null && (statementTimeout.isNegative() || statementTimeout.isZero())) {
            statementTimeout = null;
        }
    }

    /** Request-handling defaults. */
    public static IsolationProperties defaults() {
        return new IsolationProperties(false, null, 3, false);
    }
}
