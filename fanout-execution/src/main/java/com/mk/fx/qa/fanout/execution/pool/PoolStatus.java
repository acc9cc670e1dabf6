package com.mk.fx.qa.fanout.execution.pool;

/**
 * Point-in-time view of a {@link BoundedResourcePool}.
 *
 * @param size fixed capacity of the pool
 * @param available handles that can be acquired without waiting (idle or not yet created)
 * @param inUse handles currently leased
 */
public record PoolStatus(int size, int available, int inUse) {}
