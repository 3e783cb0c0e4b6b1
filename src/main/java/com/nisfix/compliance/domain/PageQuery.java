package com.nisfix.compliance.domain;

/**
 * One-based page request. Out of range values are clamped rather than rejected.
 */
public record PageQuery(int page, int limit) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (page < 1) page = 1;
        if (limit < 1) limit = DEFAULT_LIMIT;
        if (limit > MAX_LIMIT) limit = MAX_LIMIT;
    }

    public static PageQuery of(int page, int limit) {
        return new PageQuery(page, limit);
    }
}
