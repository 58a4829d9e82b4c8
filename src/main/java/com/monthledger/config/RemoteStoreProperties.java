package com.monthledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monthledger.remote")
public record RemoteStoreProperties(String baseUrl, Integer connectTimeoutMs, Integer readTimeoutMs) {}
