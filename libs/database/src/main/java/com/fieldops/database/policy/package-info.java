/**
 * Application-side model of the row policies, and the inspector that checks it against the store.
 */
package com.fieldops.database.policy;
