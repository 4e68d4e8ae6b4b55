package com.finledger.service;

import com.finledger.config.JwtProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MissingClaimException;
import io.jsonwebtoken.SignatureException;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import javax.crypto.SecretKey;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.CredentialsExpiredException;
import org.springframework.stereotype.Service;

/**
 * Verifies HS256 tokens minted by the identity provider and resolves the ledger owner they
 * speak for. This service never issues tokens.
 */
@Service
public class JwtService {
  private static final String SUBJECT_CLAIM = "sub";

  private final JwtParser parser;
  private final String ownerClaim;

  public JwtService(JwtProperties properties) {
    SecretKey key = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
    var builder = Jwts.parserBuilder()
        .setSigningKey(key)
        .setAllowedClockSkewSeconds(properties.clockSkewSeconds());
    if (properties.issuer() != null && !properties.issuer().isBlank()) {
      builder.requireIssuer(properties.issuer());
    }
    this.parser = builder.build();
    this.ownerClaim = properties.ownerClaim() == null || properties.ownerClaim().isBlank()
        ? SUBJECT_CLAIM
        : properties.ownerClaim();
  }

  /**
   * Returns the owner named by a valid token. Every rejection is a Spring Security
   * {@code AuthenticationException} whose message tells the caller what was wrong.
   */
  public LedgerOwner parseOwner(String token) {
    Claims claims;
    try {
      claims = parser.parseClaimsJws(token).getBody();
    } catch (ExpiredJwtException ex) {
      throw new CredentialsExpiredException("Token expired", ex);
    } catch (IncorrectClaimException | MissingClaimException ex) {
      throw new BadCredentialsException("Token issuer not accepted", ex);
    } catch (SignatureException ex) {
      throw new BadCredentialsException("Token signature invalid", ex);
    } catch (JwtException | IllegalArgumentException ex) {
      throw new BadCredentialsException("Malformed token", ex);
    }
    return new LedgerOwner(ownerId(claims));
  }

  private UUID ownerId(Claims claims) {
    Object value = SUBJECT_CLAIM.equals(ownerClaim) ? claims.getSubject() : claims.get(ownerClaim);
    if (value == null) {
      throw new BadCredentialsException("Token carries no owner id");
    }
    try {
      return UUID.fromString(value.toString());
    } catch (IllegalArgumentException ex) {
      throw new BadCredentialsException("Token owner id is not a UUID", ex);
    }
  }
}
