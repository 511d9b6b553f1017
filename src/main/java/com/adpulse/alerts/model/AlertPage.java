package com.adpulse.alerts.model;

import java.util.List;

public record AlertPage(List<Alert> alerts, long total, int page, int totalPages) {

    public static AlertPage of(List<Alert> alerts, long total, PageQuery query) {
        int totalPages = (int) Math.ceil(total / (double) query.limit());
        return new AlertPage(alerts, total, query.page(), totalPages);
    }
}
