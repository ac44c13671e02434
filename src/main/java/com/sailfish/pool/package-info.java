/**
 * Provides core classes and interfaces for the bounded-concurrency task pool.
 * This includes the scheduler service, task definitions, result records, and retry policies.
 */
package com.sailfish.pool;
