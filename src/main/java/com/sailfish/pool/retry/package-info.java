/**
 * Contains interfaces and implementations related to task retry decisions,
 * such as {@link com.sailfish.pool.retry.RetryPolicy}, the default
 * {@link com.sailfish.pool.retry.BoundedRetryPolicy} and the {@link com.sailfish.pool.retry.Backoff} functions it uses.
 */
package com.sailfish.pool.retry;
