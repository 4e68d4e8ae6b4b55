package com.finledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Verification settings for tokens minted by the identity provider. {@code ownerClaim} names the
 * claim carrying the owner UUID.
 */
@ConfigurationProperties(prefix = "finledger.jwt")
public record JwtProperties(
    String secret,
    String issuer,
    @DefaultValue("sub") String ownerClaim,
    @DefaultValue("30") long clockSkewSeconds) {}
