package me.golemcore.scheduler.adapter.inbound.web.controller;

final class PageLimits {

    static final int MAX_LIMIT = 200;

    private PageLimits() {
    }

    static int clamp(int limit) {
        return Math.min(Math.max(limit, 1), MAX_LIMIT);
    }
}
