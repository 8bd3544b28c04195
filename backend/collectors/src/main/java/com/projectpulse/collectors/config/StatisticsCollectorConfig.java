package com.projectpulse.collectors.config;

/**
 * @param zone time zone whose calendar date keys the daily snapshot
 */
public record StatisticsCollectorConfig(String url, String zone) {
}
