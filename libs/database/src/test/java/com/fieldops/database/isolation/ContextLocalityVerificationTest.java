package com.fieldops.database.isolation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fieldops.database.verification.IsolationDatabase;
import com.fieldops.database.verification.IsolationFixture;
import com.fieldops.database.verification.RequiresIsolationStore;
import com.fieldops.security.Audience;
import com.fieldops.security.SessionContext;
import com.fieldops.security.TenantId;
import com.fieldops.security.testing.TestSessionContextFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Proves that role and session variables live exactly as long as their transaction, using a pool
 * of one connection so every transaction reuses the connection of the one before.
 */
@RequiresIsolationStore
@DisplayName("Context locality")
class ContextLocalityVerificationTest {

    private static final String STATE_SQL = """
            SELECT current_user AS role_name,
                   current_setting('app.tenant_id', true) AS tenant_id,
                   current_setting('app.user_id', true) AS user_id,
                   current_setting('app.aud', true) AS aud,
                   current_setting('statement_timeout') AS statement_timeout
            """;

    private static IsolationDatabase database;
    private static IsolationFixture fixture;
    private static DataSource singleConnection;
    private static ContextPropagator propagator;

    record SessionState(String role, String tenantId, String userId, String aud, String statementTimeout) {}

    @BeforeAll
    static void setUp(IsolationDatabase isolationDatabase, IsolationFixture isolationFixture) {
        database = isolationDatabase;
        fixture = isolationFixture;
        singleConnection = database.newAppPool(1);
        propagator = database.propagator(singleConnection);
    }

    @AfterEach
    void connectionIsClean() {
        SessionState state = rawState();

        assertThat(state.role()).isEqualTo("ops_app");
        assertThat(state.tenantId()).isNullOrEmpty();
        assertThat(state.userId()).isNullOrEmpty();
        assertThat(state.aud()).isNullOrEmpty();
        assertThat(state.statementTimeout()).isEqualTo("0");
    }

    @Test
    @DisplayName("inside the transaction the role and all three variables are in place")
    void established() {
        SessionContext context = TestSessionContextFactory.web(fixture.tenantA());

        SessionState inside = propagator.inTransaction(context, ContextLocalityVerificationTest::state);

        assertThat(inside).isEqualTo(new SessionState(
                "ops_web", fixture.tenantA().toString(), context.userSetting(), "web", "0"));
    }

    @Test
    @DisplayName("nothing survives a commit")
    void afterCommit() {
        propagator.run(TestSessionContextFactory.portal(fixture.portalX()), tx -> state(tx));
    }

    @Test
    @DisplayName("nothing survives a failed unit of work, and its writes are rolled back")
    void afterRollback() {
        UUID invoice = UUID.randomUUID();

        assertThatThrownBy(() -> propagator.run(TestSessionContextFactory.web(fixture.tenantA()), tx -> {
                    tx.update("INSERT INTO invoices (id, tenant_id, period_start, period_end) VALUES (?, ?, ?, ?)",
                            invoice, fixture.tenantA().value(), LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 31));
                    throw new IllegalStateException("abort");
                }))
                .hasMessage("abort");

        assertThat(invoiceIds(fixture.tenantA())).doesNotContain(invoice);
    }

    @Test
    @DisplayName("the store rejects a role that does not exist, leaving the connection clean")
    void unknownRole() {
        ContextPropagator misconfigured = new ContextPropagator(
                singleConnection, IsolationProperties.defaults(), new SimpleMeterRegistry(), audience -> "ops_missing");

        assertThatThrownBy(() -> misconfigured.run(TestSessionContextFactory.web(fixture.tenantA()), tx -> { }))
                .isInstanceOf(ContextEstablishmentException.class)
                .hasMessageContaining("ops_missing");
    }

    @Test
    @DisplayName("the application login cannot switch to the administrative role")
    void serviceRoleUnreachable() {
        ContextPropagator elevated = new ContextPropagator(
                singleConnection, new IsolationProperties(true, null, 1, false), new SimpleMeterRegistry());

        assertThatThrownBy(() -> elevated.run(TestSessionContextFactory.trustedService(), tx -> { }))
                .isInstanceOf(ContextEstablishmentException.class)
                .extracting(e -> ((ContextEstablishmentException) e).roleName())
                .isEqualTo("ops_service");
    }

    @Test
    @DisplayName("a statement timeout applies to its own transaction only")
    void statementTimeout() {
        ContextPropagator bounded = new ContextPropagator(
                singleConnection, new IsolationProperties(false, Duration.ofSeconds(1), 1, false),
                new SimpleMeterRegistry());

        SessionState inside = bounded.inTransaction(
                TestSessionContextFactory.worker(fixture.tenantB()), ContextLocalityVerificationTest::state);

        assertThat(inside.statementTimeout()).isEqualTo("1s");
    }

    @Test
    @DisplayName("the same context in two transactions sees the same rows")
    void idempotent() {
        Set<UUID> first = invoiceIds(fixture.tenantB());
        Set<UUID> second = invoiceIds(fixture.tenantB());

        assertThat(first).isNotEmpty().isEqualTo(second);
    }

    @Test
    @DisplayName("concurrent transactions for different tenants never see each other's rows")
    void concurrentTenants() throws Exception {
        ContextPropagator shared = database.propagator(database.newAppPool(4));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<UUID>>> results = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                TenantId tenant = i % 2 == 0 ? fixture.tenantA() : fixture.tenantB();
                results.add(executor.submit(() -> shared.inTransaction(
                        SessionContext.internal(Audience.INTERNAL_WEB, tenant, null),
                        tx -> tx.queryForList("SELECT tenant_id FROM invoices", UUID.class))));
            }
            for (int i = 0; i < results.size(); i++) {
                TenantId expected = i % 2 == 0 ? fixture.tenantA() : fixture.tenantB();
                assertThat(results.get(i).get(30, TimeUnit.SECONDS)).isNotEmpty().containsOnly(expected.value());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static Set<UUID> invoiceIds(TenantId tenant) {
        return Set.copyOf(propagator.inTransaction(TestSessionContextFactory.web(tenant),
                tx -> tx.queryForList("SELECT id FROM invoices", UUID.class)));
    }

    private static SessionState state(IsolatedTransaction tx) {
        return tx.query(STATE_SQL, (rs, i) -> new SessionState(
                        rs.getString("role_name"),
                        rs.getString("tenant_id"),
                        rs.getString("user_id"),
                        rs.getString("aud"),
                        rs.getString("statement_timeout")))
                .get(0);
    }

    private static SessionState rawState() {
        return new JdbcTemplate(singleConnection).queryForObject(STATE_SQL, (rs, i) -> new SessionState(
                rs.getString("role_name"),
                rs.getString("tenant_id"),
                rs.getString("user_id"),
                rs.getString("aud"),
                rs.getString("statement_timeout")));
    }
}
