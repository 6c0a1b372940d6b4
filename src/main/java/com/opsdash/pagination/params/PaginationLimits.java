package com.opsdash.pagination.params;

import com.opsdash.pagination.PaginationConfigurationException;

public record PaginationLimits(int defaultLimit, int maxLimit) {

    public static final int MIN_LIMIT = 1;
    public static final PaginationLimits DEFAULTS = new PaginationLimits(20, 100);

    public PaginationLimits {
        if (maxLimit < MIN_LIMIT) {
            throw new PaginationConfigurationException("Maximum page size must be at least " + MIN_LIMIT);
        }
        if (defaultLimit < MIN_LIMIT || defaultLimit > maxLimit) {
            throw new PaginationConfigurationException(
                "Default page size " + defaultLimit + " must lie in [" + MIN_LIMIT + ", " + maxLimit + "]");
        }
    }

    public int clamp(long requested) {
        return (int) Math.max(MIN_LIMIT, Math.min(maxLimit, requested));
    }
}
