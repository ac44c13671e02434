/**
 * The scheduler contract, {@link com.sailfish.pool.service.TaskScheduler}, and the observer hooks it notifies.
 */
package com.sailfish.pool.service;
