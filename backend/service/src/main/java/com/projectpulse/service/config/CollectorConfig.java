package com.projectpulse.service.config;

/**
 * One entry of {@code collectors.json}.
 */
public record CollectorConfig(String name, boolean enabled) {
}
