package com.fieldops.database.policy;

import com.fieldops.database.isolation.IsolationConfigurationException;
import java.util.List;

/**
 * Outcome of checking row policies, either the catalog's own design rules or the catalog against
 * a live store. Either valid (no errors) or invalid (one message per finding).
 *
 * @param valid whether every check passed
 * @param errors one message per finding, empty when valid
 */
public record PolicyDriftReport(boolean valid, List<String> errors) {

    public static PolicyDriftReport ok() {
        return new PolicyDriftReport(true, List.of());
    }

    public static PolicyDriftReport fail(List<String> errors) {
        return new PolicyDriftReport(false, List.copyOf(errors));
    }

    /** Valid when {@code errors} is empty. */
    public static PolicyDriftReport of(List<String> errors) {
        return errors.isEmpty() ? ok() : fail(errors);
    }

    /**
     * @throws IsolationConfigurationException listing every finding, if invalid
     */
    public void throwIfInvalid() {
        if (!valid) {
            throw new IsolationConfigurationException(
                    "Row policy drift detected:\n  - " + String.join("\n  - ", errors));
        }
    }
}
