package com.finledger.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finledger.service.JwtService;
import com.finledger.service.LedgerOwner;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.authentication.InsufficientAuthenticationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

@DisplayName("JwtAuthFilter")
class JwtAuthFilterTest {
  private static final String SECRET = "test-secret-test-secret-test-secret-test-secret";
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private final LedgerAuthenticationEntryPoint entryPoint = new LedgerAuthenticationEntryPoint(objectMapper, CLOCK);
  private final JwtAuthFilter filter = new JwtAuthFilter(
      new JwtService(new JwtProperties(SECRET, null, "sub", 30)), entryPoint);

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  @DisplayName("a valid token authenticates its owner and continues the chain")
  void validToken() throws Exception {
    UUID userId = UUID.randomUUID();
    MockHttpServletRequest request = request("Bearer " + token(userId.toString()));
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, response, chain);

    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    assertThat(authentication.getPrincipal()).isEqualTo(new LedgerOwner(userId));
    assertThat(authentication.isAuthenticated()).isTrue();
    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(response.getStatus()).isEqualTo(200);
  }

  @Test
  @DisplayName("a subject that is not a UUID is answered with 401 and the reason")
  void nonUuidSubject() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request("Bearer " + token("alice@example.com")), response, chain);

    assertThat(chain.getRequest()).isNull();
    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getHeader(HttpHeaders.WWW_AUTHENTICATE)).isEqualTo("Bearer");
    JsonNode body = objectMapper.readTree(response.getContentAsString());
    assertThat(body.get("status").asInt()).isEqualTo(401);
    assertThat(body.get("message").asText()).isEqualTo("Token owner id is not a UUID");
  }

  @Test
  @DisplayName("a broken token never reaches the controllers")
  void malformedToken() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request("Bearer garbage"), response, chain);

    assertThat(chain.getRequest()).isNull();
    assertThat(objectMapper.readTree(response.getContentAsString()).get("message").asText())
        .isEqualTo("Malformed token");
  }

  @Test
  @DisplayName("requests without a bearer header pass through anonymous")
  void noHeader() throws Exception {
    MockHttpServletRequest request = request(null);
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(chain.getRequest()).isSameAs(request);
    assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
  }

  @Test
  @DisplayName("the entry point reports a missing token when nothing was sent")
  void missingToken() throws Exception {
    MockHttpServletResponse response = new MockHttpServletResponse();

    entryPoint.commence(request(null), response, new InsufficientAuthenticationException("Full authentication is required"));

    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(objectMapper.readTree(response.getContentAsString()).get("message").asText())
        .isEqualTo(LedgerAuthenticationEntryPoint.MISSING_TOKEN);
  }

  private static MockHttpServletRequest request(String authorization) {
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/ledger/accounts");
    if (authorization != null) {
      request.addHeader(HttpHeaders.AUTHORIZATION, authorization);
    }
    return request;
  }

  private static String token(String subject) {
    long now = System.currentTimeMillis();
    return Jwts.builder()
        .setSubject(subject)
        .setExpiration(new Date(now + 60_000))
        .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
        .compact();
  }
}
