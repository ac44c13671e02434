/**
 * Immutable scheduler configuration, built programmatically or loaded from properties.
 */
package com.sailfish.pool.config;
