package com.monthledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monthledger.sync")
public record SyncProperties(boolean enabled, long debounceMs, long flushIntervalMs) {}
