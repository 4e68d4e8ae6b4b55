package com.finledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finledger.reconciliation")
public record ReconciliationProperties(boolean enabled, long intervalMs) {}
