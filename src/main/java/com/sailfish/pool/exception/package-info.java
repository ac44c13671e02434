/**
 * Exceptions raised by the pool. Configuration and closed-pool errors are thrown to callers;
 * {@link com.sailfish.pool.exception.TaskException} and its subtypes are only ever recorded.
 */
package com.sailfish.pool.exception;
