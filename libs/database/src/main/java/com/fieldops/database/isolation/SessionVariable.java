package com.fieldops.database.isolation;

import com.fieldops.security.SessionContext;
import java.util.function.Function;

/**
 * Transaction-local settings read by the row policies. The names are a wire contract with the
 * store and must not change without a matching migration.
 *
 * <p>Declaration order is the order in which the propagator assigns them.
 */
public enum SessionVariable {

    TENANT_ID("app.tenant_id", SessionContext::tenantSetting),
    USER_ID("app.user_id", SessionContext::userSetting),
    AUDIENCE("app.aud", SessionContext::audienceSetting);

    private final String settingName;
    private final Function<SessionContext, String> extractor;

    SessionVariable(String settingName, Function<SessionContext, String> extractor) {
        this.settingName = settingName;
        this.extractor = extractor;
    }

    public String settingName() {
        return settingName;
    }

    /** The value to assign for the given context; empty string when the field is absent. */
    public String valueFrom(SessionContext context) {
        return extractor.apply(context);
    }
}
