package com.fieldops.database.isolation;

import com.fieldops.security.Audience;
import com.fieldops.security.AudienceRoleMapper;
import com.fieldops.security.SessionContext;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.PessimisticLockingFailureException;

/**
 * The single choke point through which business queries reach the store.
 *
 * <p>For every unit of work the propagator opens one transaction on a pooled connection and,
 * inside that transaction and before anything else runs:
 *
 * <ol>
 *   <li>switches the active principal with {@code SET LOCAL ROLE} to the role mapped from the
 *       context's audience
 *   <li>assigns {@code app.tenant_id}, {@code app.user_id} and {@code app.aud} with
 *       {@code set_config(name, value, true)}, in that order, empty string for absent fields
 *   <li>applies the configured statement timeout, if any
 * </ol>
 *
 * <p>Only then is the unit of work invoked. It commits on success and rolls back on any failure,
 * including a failure of the steps above, in which case the unit of work never runs.
 *
 * <p>Every assignment is transaction-local. When the transaction ends the store discards the role
 * and the variables, so a connection handed back to the pool carries no context into the next
 * request that borrows it.
 *
 * <p>Thread-safe: the session context is a parameter of each call, never state of this object.
 */
public class ContextPropagator {

    private static final Logger log = LoggerFactory.getLogger(ContextPropagator.class);

    static final String SET_CONFIG_SQL = "SELECT set_config(?, ?, true)";
    static final String STATEMENT_TIMEOUT = "statement_timeout";

    static final String METRIC_TRANSACTIONS = "isolation.transactions";
    static final String METRIC_DURATION = "isolation.transaction.duration";
    static final String OUTCOME_COMMITTED = "committed";
    static final String OUTCOME_ROLLED_BACK = "rolled_back";
    static final String OUTCOME_ESTABLISHMENT_FAILED = "establishment_failed";

    static final String MDC_TENANT_ID = "tenantId";
    static final String MDC_USER_ID = "userId";
    static final String MDC_AUDIENCE = "aud";

    /** Serialization failure and deadlock: the transaction may succeed when run again. */
    static final Set<String> TRANSIENT_SQL_STATES = Set.of("40001", "40P01");

    private static final Pattern ROLE_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]{0,62}");

    private final DataSource dataSource;
    private final IsolationProperties properties;
    private final MeterRegistry meterRegistry;
    private final Function<Audience, String> roleNames;

    /**
     * Creates a propagator that maps audiences with {@link AudienceRoleMapper}.
     *
     * @param dataSource pool whose login role is a member of every request role
     * @param properties propagator configuration
     * @param meterRegistry registry for transaction metrics
     */
    public ContextPropagator(
            DataSource dataSource, IsolationProperties properties, MeterRegistry meterRegistry) {
        this(dataSource, properties, meterRegistry,
                audience -> AudienceRoleMapper.roleFor(audience).roleName());
    }

    ContextPropagator(
            DataSource dataSource,
            IsolationProperties properties,
            MeterRegistry meterRegistry,
            Function<Audience, String> roleNames) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
        this.roleNames = Objects.requireNonNull(roleNames, "roleNames must not be null");
    }

    /**
     * Runs a unit of work in a new transaction established for the given context.
     *
     * @param context the request's session context
     * @param work the business work
     * @return the unit of work's result, after commit
     * @throws IsolationConfigurationException if the context cannot be served by this propagator
     * @throws com.fieldops.security.UnknownAudienceException if the audience has no mapped role
     * @throws ContextEstablishmentException if the store rejects the role switch or a variable
     * @throws IsolatedTransactionException if the transaction cannot be started or completed
     * @throws PessimisticLockingFailureException if the commit hits a serialization failure or
     *     deadlock
     */
    public <T> T inTransaction(SessionContext context, UnitOfWork<T> work) {
        Objects.requireNonNull(work, "work must not be null");
        String role = resolveRole(context);

        Timer.Sample sample = Timer.start(meterRegistry);
        try (Connection connection = borrow()) {
            return execute(connection, role, context, work);
        } catch (SQLException e) {
            throw new IsolatedTransactionException("Failed to return connection to the pool", e);
        } finally {
            sample.stop(
                    Timer.builder(METRIC_DURATION)
                            .description("Duration of context-established transactions")
                            .tag("audience", context.audienceSetting())
                            .register(meterRegistry));
        }
    }

    /** Variant of {@link #inTransaction} for work without a result. */
    public void run(SessionContext context, Consumer<IsolatedTransaction> work) {
        Objects.requireNonNull(work, "work must not be null");
        inTransaction(context, tx -> {
            work.accept(tx);
            return null;
        });
    }

    /**
     * Runs a unit of work, retrying it when it fails on a transient concurrency conflict
     * (serialization failure, deadlock, lock acquisition), whether raised by the work or by the
     * commit.
     *
     * <p>Each attempt re-enters {@link #inTransaction} and therefore gets a brand-new transaction
     * with the context established from scratch. Context-establishment failures are never retried.
     */
    public <T> T inTransactionWithRetry(SessionContext context, UnitOfWork<T> work) {
        int attempt = 1;
        while (true) {
            try {
                return inTransaction(context, work);
            } catch (ConcurrencyFailureException e) {
                if (attempt >= properties.maxAttempts()) {
                    throw e;
                }
                log.warn("Transient failure in {} transaction (attempt {}/{}), retrying: {}",
                        context.audienceSetting(), attempt, properties.maxAttempts(), e.getMessage());
                attempt++;
            }
        }
    }

    private String resolveRole(SessionContext context) {
        if (context == null) {
            throw new IsolationConfigurationException("session context must not be null");
        }
        if (context.audience() == Audience.TRUSTED_SERVICE && !properties.trustedServiceEnabled()) {
            throw new IsolationConfigurationException(
                    "audience 'service' is reserved for fixtures and migrations");
        }
        String role = roleNames.apply(context.audience());
        if (role == null || !ROLE_IDENTIFIER.matcher(role).matches()) {
            throw new IsolationConfigurationException(
                    "role '%s' mapped for audience '%s' is not a valid role identifier"
                            .formatted(role, context.audienceSetting()));
        }
        return role;
    }

    private Connection borrow() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new IsolatedTransactionException("Failed to borrow a connection", e);
        }
    }

    private <T> T execute(
            Connection connection, String role, SessionContext context, UnitOfWork<T> work) {
        IsolatedTransaction transaction = null;
        try {
            connection.setAutoCommit(false);
            establish(connection, role, context);
            transaction = new IsolatedTransaction(connection, context);

            T result = invoke(transaction, context, work);
            if (Thread.currentThread().isInterrupted()) {
                throw new IsolatedTransactionException(
                        "Unit of work was cancelled; rolling back instead of committing");
            }
            commit(connection);
            count(context, OUTCOME_COMMITTED);
            return result;
        } catch (ContextEstablishmentException e) {
            log.error("Context establishment failed for audience={} role={}: {}",
                    context.audienceSetting(), role, e.getMessage());
            rollback(connection, context, e);
            count(context, OUTCOME_ESTABLISHMENT_FAILED);
            throw e;
        } catch (RuntimeException | Error e) {
            rollback(connection, context, e);
            count(context, OUTCOME_ROLLED_BACK);
            throw e;
        } catch (SQLException e) {
            IsolatedTransactionException failure =
                    new IsolatedTransactionException("Failed to start or commit transaction", e);
            rollback(connection, context, failure);
            count(context, OUTCOME_ROLLED_BACK);
            throw failure;
        } finally {
            if (transaction != null) {
                transaction.close();
            }
        }
    }

    private void establish(Connection connection, String role, SessionContext context) {
        try (Statement statement = connection.createStatement()) {
            statement.execute("SET LOCAL ROLE \"" + role + "\"");
        } catch (SQLException e) {
            throw new ContextEstablishmentException(context.audience(), role, "role switch", e);
        }
        for (SessionVariable variable : SessionVariable.values()) {
            setConfig(connection, variable.settingName(), variable.valueFrom(context), context, role);
        }
        if (properties.statementTimeout() != null) {
            setConfig(connection, STATEMENT_TIMEOUT,
                    Long.toString(properties.statementTimeout().toMillis()), context, role);
        }
        log.debug("Established context audience={} role={} tenant={} user={}",
                context.audienceSetting(), role, context.tenantSetting(), context.userSetting());
    }

    private void setConfig(
            Connection connection, String name, String value, SessionContext context, String role) {
        try (PreparedStatement statement = connection.prepareStatement(SET_CONFIG_SQL)) {
            statement.setString(1, name);
            statement.setString(2, value);
            statement.execute();
        } catch (SQLException e) {
            throw new ContextEstablishmentException(context.audience(), role, "set " + name, e);
        }
    }

    private static void commit(Connection connection) throws SQLException {
        try {
            connection.commit();
        } catch (SQLException e) {
            if (TRANSIENT_SQL_STATES.contains(e.getSQLState())) {
                throw new PessimisticLockingFailureException(
                        "Commit failed on a transient conflict (SQLState " + e.getSQLState() + ")", e);
            }
            throw e;
        }
    }

    private <T> T invoke(IsolatedTransaction transaction, SessionContext context, UnitOfWork<T> work) {
        Map<String, String> previous = new LinkedHashMap<>();
        previous.put(MDC_TENANT_ID, MDC.get(MDC_TENANT_ID));
        previous.put(MDC_USER_ID, MDC.get(MDC_USER_ID));
        previous.put(MDC_AUDIENCE, MDC.get(MDC_AUDIENCE));
        try {
            MDC.put(MDC_TENANT_ID, context.tenantSetting());
            MDC.put(MDC_USER_ID, context.userSetting());
            MDC.put(MDC_AUDIENCE, context.audienceSetting());
            return work.execute(transaction);
        } finally {
            previous.forEach(ContextPropagator::restoreMdc);
        }
    }

    private static void restoreMdc(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    private void rollback(Connection connection, SessionContext context, Throwable cause) {
        try {
            connection.rollback();
            log.warn("Rolled back {} transaction: {}", context.audienceSetting(), cause.toString());
        } catch (SQLException e) {
            cause.addSuppressed(e);
            log.error("Rollback failed for {} transaction", context.audienceSetting(), e);
        }
    }

    private void count(SessionContext context, String outcome) {
        Counter.builder(METRIC_TRANSACTIONS)
                .description("Context-established transactions by outcome")
                .tag("audience", context.audienceSetting())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
