package com.fieldops.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("SessionContext")
class SessionContextTest {

    private static final TenantId TENANT = TenantId.of("11111111-1111-1111-1111-111111111111");
    private static final UserId USER = UserId.of("33333333-3333-3333-3333-333333333333");

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("audience is required")
        void audienceRequired() {
            assertThatThrownBy(() -> new SessionContext(TENANT, USER, null))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("audience");
        }

        @Test
        @DisplayName("tenant and user may be absent")
        void idsOptional() {
            var ctx = new SessionContext(null, null, Audience.INTERNAL_WEB);
            assertThat(ctx.tenant()).isEmpty();
            assertThat(ctx.user()).isEmpty();
        }

        @Test
        @DisplayName("internal() rejects the portal audience")
        void internalRejectsPortal() {
            assertThatThrownBy(() -> SessionContext.internal(Audience.EXTERNAL_PORTAL, TENANT, USER))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("portal() carries only the user")
        void portalContext() {
            var ctx = SessionContext.portal(USER);
            assertThat(ctx.audience()).isEqualTo(Audience.EXTERNAL_PORTAL);
            assertThat(ctx.tenant()).isEmpty();
            assertThat(ctx.user()).contains(USER);
        }

        @Test
        @DisplayName("worker() carries only the tenant")
        void workerContext() {
            var ctx = SessionContext.worker(TENANT);
            assertThat(ctx.audience()).isEqualTo(Audience.BACKGROUND_WORKER);
            assertThat(ctx.tenant()).contains(TENANT);
            assertThat(ctx.user()).isEmpty();
        }
    }

    @Nested
    @DisplayName("session variable values")
    class SettingValues {

        @Test
        @DisplayName("present ids render as UUID strings")
        void presentIds() {
            var ctx = new SessionContext(TENANT, USER, Audience.INTERNAL_STUDIO);
            assertThat(ctx.tenantSetting()).isEqualTo("11111111-1111-1111-1111-111111111111");
            assertThat(ctx.userSetting()).isEqualTo("33333333-3333-3333-3333-333333333333");
            assertThat(ctx.audienceSetting()).isEqualTo("studio");
        }

        @Test
        @DisplayName("absent ids render as empty strings, never null")
        void absentIds() {
            var ctx = new SessionContext(null, null, Audience.INTERNAL_WEB);
            assertThat(ctx.tenantSetting()).isEmpty();
            assertThat(ctx.userSetting()).isEmpty();
        }
    }

    @Nested
    @DisplayName("identifier types")
    class IdentifierTypes {

        @Test
        @DisplayName("tenant and user ids with the same UUID are not equal")
        void distinctTypes() {
            UUID shared = UUID.randomUUID();
            assertThat((Object) new TenantId(shared)).isNotEqualTo(new UserId(shared));
        }

        @Test
        @DisplayName("of() rejects non-UUID input")
        void rejectsMalformed() {
            assertThatThrownBy(() -> TenantId.of("tenant-1")).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> UserId.of("")).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
