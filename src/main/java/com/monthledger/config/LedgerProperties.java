package com.monthledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monthledger.ledger")
public record LedgerProperties(
    String person1Name,
    String person2Name,
    int defaultRecurringMonths,
    int materializeMonths
) {}
