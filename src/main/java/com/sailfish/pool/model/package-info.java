/**
 * Immutable value types describing task records, pool statistics and drain results.
 */
package com.sailfish.pool.model;
