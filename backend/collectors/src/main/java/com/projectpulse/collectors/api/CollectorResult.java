package com.projectpulse.collectors.api;

import java.util.Map;

public record CollectorResult(String collector, boolean success, String message, Map<String, Object> stats) {
    public static CollectorResult success(String collector, String message, Map<String, Object> stats) {
        return new CollectorResult(collector, true, message, stats);
    }

    public static CollectorResult failure(String collector, String message, Map<String, Object> stats) {
        return new CollectorResult(collector, false, message, stats);
    }

    public int stat(String key) {
        Object value = stats.get(key);
        return value instanceof Number number ? number.intValue() : 0;
    }
}
