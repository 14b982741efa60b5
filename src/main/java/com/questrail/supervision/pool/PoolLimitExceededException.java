package com.questrail.supervision.pool;

/**
 * Thrown by {@link OperationPool#spawn} when a group the operation would
 * join, or the pool as a whole, has no free slot. The operation is not
 * started.
 */
public final class PoolLimitExceededException extends IllegalStateException
{
    private final Object group;

    public PoolLimitExceededException(Object group, int limit)
    {
        super("limit of " + limit + " running operation(s) reached for group " + group);
        this.group = group;
    }

    /**
     * @return the first group found without a free slot
     */
    public Object group()
    {
        return group;
    }
}
