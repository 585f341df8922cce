/**
 * Transaction-scoped propagation of the request's session context to the store.
 *
 * <p>{@link com.fieldops.database.isolation.ContextPropagator} is the only path from business
 * code to the store. Handlers receive an {@link com.fieldops.database.isolation.IsolatedTransaction}
 * whose role and {@code app.*} settings are already in place and vanish when it ends.
 */
package com.fieldops.database.isolation;
