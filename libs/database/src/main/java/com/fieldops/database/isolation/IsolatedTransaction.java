package com.fieldops.database.isolation;

import com.fieldops.security.SessionContext;
import java.sql.Connection;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.IncorrectResultSizeDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

/**
 * Handle to a transaction whose role and session variables are already established.
 *
 * <p>Only {@link ContextPropagator} can create one, so every statement issued through this type
 * runs after the context has been set. The handle is valid for the lifetime of the unit of work
 * it was passed to; any use afterwards throws {@link IllegalStateException}.
 *
 * <p>Data-access failures surface as Spring {@code DataAccessException}s. Out-of-scope rows are
 * simply absent from results.
 */
public final class IsolatedTransaction {

    private final SessionContext context;
    private final JdbcTemplate jdbc;
    private volatile boolean open = true;

    IsolatedTransaction(Connection connection, SessionContext context) {
        this.context = context;
        this.jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    /** The context this transaction was established with. */
    public SessionContext context() {
        return context;
    }

    public boolean isOpen() {
        return open;
    }

    public <T> List<T> query(String sql, RowMapper<T> rowMapper, Object... args) {
        ensureOpen();
        return jdbc.query(sql, rowMapper, args);
    }

    public <T> List<T> queryForList(String sql, Class<T> elementType, Object... args) {
        ensureOpen();
        return jdbc.queryForList(sql, elementType, args);
    }

    /**
     * Returns the single matching row, or empty when no row is visible. A row that exists but is
     * outside the current context is indistinguishable from one that does not exist.
     *
     * @throws IncorrectResultSizeDataAccessException if more than one row matches
     */
    public <T> Optional<T> queryForOptional(String sql, RowMapper<T> rowMapper, Object... args) {
        List<T> rows = query(sql, rowMapper, args);
        if (rows.size() > 1) {
            throw new IncorrectResultSizeDataAccessException(1, rows.size());
        }
        return rows.stream().findFirst();
    }

    public int update(String sql, Object... args) {
        ensureOpen();
        return jdbc.update(sql, args);
    }

    void close() {
        open = false;
    }

    private void ensureOpen() {
        if (!open) {
            throw new IllegalStateException(
                    "transaction for %s context has ended".formatted(context.audienceSetting()));
        }
    }
}
