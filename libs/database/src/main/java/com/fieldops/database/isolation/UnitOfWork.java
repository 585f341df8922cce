package com.fieldops.database.isolation;

/**
 * Business work executed inside one context-established transaction.
 *
 * <p>Implementations issue ordinary queries through the supplied {@link IsolatedTransaction} and
 * must not keep a reference to it after returning.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface UnitOfWork<T> {

    T execute(IsolatedTransaction transaction);
}
