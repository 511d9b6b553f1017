package com.adpulse.alerts.model;

/**
 * One-based page request.
 */
public record PageQuery(int page, int limit) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public PageQuery {
        if (page < 1) page = 1;
        if (limit < 1) limit = DEFAULT_LIMIT;
        if (limit > MAX_LIMIT) limit = MAX_LIMIT;
    }

    public static PageQuery firstPage() {
        return new PageQuery(1, DEFAULT_LIMIT);
    }

    public int offset() {
        return (page - 1) * limit;
    }
}
