package com.finledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.finledger.config.JwtProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.CredentialsExpiredException;

@DisplayName("JwtService")
class JwtServiceTest {
  private static final String SECRET = "test-secret-test-secret-test-secret-test-secret";

  @Test
  @DisplayName("the subject of a valid token is the owner")
  void parsesSubject() {
    UUID userId = UUID.randomUUID();
    JwtService service = service("");

    assertThat(service.parseOwner(token(SECRET, userId.toString(), null, 60_000)))
        .isEqualTo(new LedgerOwner(userId));
  }

  @Test
  @DisplayName("a subject that is not a UUID names no owner")
  void rejectsNonUuidSubject() {
    JwtService service = service(null);

    assertThatThrownBy(() -> service.parseOwner(token(SECRET, "alice@example.com", null, 60_000)))
        .isInstanceOf(BadCredentialsException.class)
        .hasMessage("Token owner id is not a UUID");
  }

  @Test
  @DisplayName("a token without the owner claim is rejected")
  void rejectsMissingSubject() {
    JwtService service = service(null);

    assertThatThrownBy(() -> service.parseOwner(token(SECRET, null, null, 60_000)))
        .isInstanceOf(BadCredentialsException.class)
        .hasMessage("Token carries no owner id");
  }

  @Test
  @DisplayName("the owner can be read from a custom claim")
  void customOwnerClaim() {
    UUID userId = UUID.randomUUID();
    JwtService service = new JwtService(new JwtProperties(SECRET, null, "owner_id", 0));
    long now = System.currentTimeMillis();
    String token = Jwts.builder()
        .setSubject("auth0|12345")
        .claim("owner_id", userId.toString())
        .setExpiration(new Date(now + 60_000))
        .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
        .compact();

    assertThat(service.parseOwner(token).id()).isEqualTo(userId);
  }

  @Test
  @DisplayName("tokens signed with another key are rejected")
  void rejectsForeignSignature() {
    JwtService service = service(null);
    String forged = token("another-secret-another-secret-another-secret", UUID.randomUUID().toString(), null, 60_000);

    assertThatThrownBy(() -> service.parseOwner(forged))
        .isInstanceOf(BadCredentialsException.class)
        .hasMessage("Token signature invalid");
  }

  @Test
  @DisplayName("garbage is reported as malformed")
  void rejectsGarbage() {
    assertThatThrownBy(() -> service(null).parseOwner("not.a.token"))
        .isInstanceOf(BadCredentialsException.class)
        .hasMessage("Malformed token");
  }

  @Test
  @DisplayName("expired tokens are rejected beyond the allowed skew")
  void rejectsExpired() {
    JwtService service = service(null);

    assertThatThrownBy(() -> service.parseOwner(token(SECRET, UUID.randomUUID().toString(), null, -120_000)))
        .isInstanceOf(CredentialsExpiredException.class)
        .hasMessage("Token expired");
    assertThat(service.parseOwner(token(SECRET, UUID.randomUUID().toString(), null, -5_000))).isNotNull();
  }

  @Test
  @DisplayName("a configured issuer must match")
  void requiresIssuer() {
    JwtService service = service("finledger-auth");
    UUID userId = UUID.randomUUID();

    assertThat(service.parseOwner(token(SECRET, userId.toString(), "finledger-auth", 60_000)).id()).isEqualTo(userId);
    assertThatThrownBy(() -> service.parseOwner(token(SECRET, userId.toString(), "someone-else", 60_000)))
        .isInstanceOf(BadCredentialsException.class)
        .hasMessage("Token issuer not accepted");
  }

  private static JwtService service(String issuer) {
    return new JwtService(new JwtProperties(SECRET, issuer, "sub", 30));
  }

  private static String token(String secret, String subject, String issuer, long ttlMillis) {
    long now = System.currentTimeMillis();
    return Jwts.builder()
        .setSubject(subject)
        .setIssuer(issuer)
        .setIssuedAt(new Date(now - 180_000))
        .setExpiration(new Date(now + ttlMillis))
        .signWith(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
        .compact();
  }
}
