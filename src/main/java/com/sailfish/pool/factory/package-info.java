/**
 * Sources of task closures for batch submission, such as {@link com.sailfish.pool.factory.MapTaskSource}.
 */
package com.sailfish.pool.factory;
